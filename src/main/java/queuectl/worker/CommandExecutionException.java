package queuectl.worker;

public class CommandExecutionException extends Exception {

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
