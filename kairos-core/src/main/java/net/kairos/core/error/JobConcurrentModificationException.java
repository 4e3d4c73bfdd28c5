package net.kairos.core.error;

/** expectedVersion 이 현재 버전과 다름. 다시 읽고 재시도해야 한다 */
public class JobConcurrentModificationException extends SchedulingException {
    private final long jobId;
    private final long expectedVersion;

    public JobConcurrentModificationException(long jobId, long expectedVersion, Long actualVersion) {
        super("job " + jobId + " was modified concurrently: expected version " + expectedVersion
                + (actualVersion == null ? "" : ", actual " + actualVersion));
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
    }

    public long getJobId() { return jobId; }

    public long getExpectedVersion() { return expectedVersion; }
}
