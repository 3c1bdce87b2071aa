package queuectl.worker;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * Exponential backoff without jitter: the k-th failure waits {@code base^k} seconds.
 *
 * <p>The base is pulled from the supplier on every decision so config changes apply to running workers.
 */
public class RetryPolicy {

    /** Keeps {@code now + delay} representable. */
    static final Duration MAX_DELAY = Duration.ofDays(365L * 100);

    private final IntSupplier backoffBaseSeconds;

    public RetryPolicy(IntSupplier backoffBaseSeconds) {
        this.backoffBaseSeconds = backoffBaseSeconds;
    }

    public static RetryPolicy withBase(int backoffBaseSeconds) {
        return new RetryPolicy(() -> backoffBaseSeconds);
    }

    /**
     * @param attempts   failed attempts so far, already including the failure being handled
     * @param retryLimit maximum attempts before the job is dead
     */
    public RetryDecision decide(int attempts, int retryLimit) {
        if (attempts >= retryLimit) {
            return RetryDecision.exhausted();
        }
        return RetryDecision.retryAfter(backoff(backoffBaseSeconds.getAsInt(), attempts));
    }

    static Duration backoff(int base, int attempts) {
        if (base < 0) {
            throw new IllegalArgumentException("backoff base must not be negative: " + base);
        }
        long maxSeconds = MAX_DELAY.getSeconds();
        long seconds = 1;
        for (int i = 0; i < attempts; i++) {
            if (base != 0 && seconds > maxSeconds / base) {
                return MAX_DELAY;
            }
            seconds *= base;
        }
        return Duration.ofSeconds(seconds);
    }
}
