package queuectl.worker;

import java.time.Duration;

public record CommandResult(int exitCode, boolean timedOut, String stdout, String stderr, Duration elapsed) {

    public static CommandResult exited(int exitCode, String stdout, String stderr, Duration elapsed) {
        return new CommandResult(exitCode, false, stdout, stderr, elapsed);
    }

    public static CommandResult timedOut(String stdout, String stderr, Duration elapsed) {
        return new CommandResult(-1, true, stdout, stderr, elapsed);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
