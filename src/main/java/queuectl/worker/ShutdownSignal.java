package queuectl.worker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class ShutdownSignal {

    private final CountDownLatch requested = new CountDownLatch(1);

    /**
     * @return true only for the call that actually flipped the signal
     */
    public synchronized boolean request() {
        if (requested.getCount() == 0) {
            return false;
        }
        requested.countDown();
        return true;
    }

    public boolean isRequested() {
        return requested.getCount() == 0;
    }

    /**
     * Sleeps for up to {@code timeout}, waking early if shutdown is requested.
     *
     * @return whether shutdown has been requested
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return requested.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
