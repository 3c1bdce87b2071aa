package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * Lifetime of one worker: register in the liveness registry, run the loop, deregister on the way out.
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final long pid;
    private final int ordinal;
    private final LivenessRegistry registry;
    private final JobWorker worker;
    private final CountDownLatch finished = new CountDownLatch(1);

    public WorkerRuntime(long pid, int ordinal, LivenessRegistry registry, JobWorker worker) {
        this.pid = pid;
        this.ordinal = ordinal;
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
    }

    public void run() {
        boolean registered = false;
        try {
            registry.register(pid, ordinal);
            registered = true;
            log.info("Worker {} started (PID: {})", ordinal, pid);
            worker.run();
        } finally {
            if (registered) {
                registry.deregister(pid);
                log.info("Worker {} (PID: {}) stopped.", ordinal, pid);
            }
            finished.countDown();
        }
    }

    /**
     * Blocks until {@link #run()} has deregistered. Used by the JVM shutdown hook.
     */
    public void awaitFinished() throws InterruptedException {
        finished.await();
    }
}
