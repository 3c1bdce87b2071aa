package queuectl.worker;

import java.time.Duration;

public interface CommandExecutor {

    CommandResult execute(String command, Duration timeout) throws CommandExecutionException;
}
