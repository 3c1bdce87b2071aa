package queuectl;

public class JobStoreException extends QueueException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
