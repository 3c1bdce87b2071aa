package queuectl.worker;

import java.util.Set;

public record StopResult(Outcome outcome, Set<Long> signalled, Set<Long> remaining) {

    public enum Outcome {
        NOTHING_TO_STOP,
        ALL_STOPPED,
        TIMED_OUT
    }
}
