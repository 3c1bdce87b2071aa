package queuectl;

public class DuplicateJobException extends QueueException {

    private final String jobId;

    public DuplicateJobException(String jobId, Throwable cause) {
        super("A job with ID '" + jobId + "' already exists.", cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
