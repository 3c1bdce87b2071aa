package queuectl.worker;

import java.time.Duration;
import java.util.Objects;

public final class RetryDecision {

    private static final RetryDecision EXHAUSTED = new RetryDecision(null);

    private final Duration delay;

    private RetryDecision(Duration delay) {
        this.delay = delay;
    }

    public static RetryDecision exhausted() {
        return EXHAUSTED;
    }

    public static RetryDecision retryAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return new RetryDecision(delay);
    }

    public boolean isExhausted() {
        return delay == null;
    }

    public Duration delay() {
        if (delay == null) {
            throw new IllegalStateException("Exhausted decision has no delay");
        }
        return delay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryDecision other)) return false;
        return Objects.equals(delay, other.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(delay);
    }

    @Override
    public String toString() {
        return isExhausted() ? "Exhausted" : "RetryAfter(" + delay + ")";
    }
}
