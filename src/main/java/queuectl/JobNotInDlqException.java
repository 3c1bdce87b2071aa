package queuectl;

public class JobNotInDlqException extends QueueException {

    private final String jobId;

    public JobNotInDlqException(String jobId) {
        super("Job ID '" + jobId + "' not found in DLQ.");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
