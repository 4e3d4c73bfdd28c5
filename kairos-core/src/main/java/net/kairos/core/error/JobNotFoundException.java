package net.kairos.core.error;

public class JobNotFoundException extends SchedulingException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("job not found: id=" + jobId);
        this.jobId = jobId;
    }

    public long getJobId() { return jobId; }
}
