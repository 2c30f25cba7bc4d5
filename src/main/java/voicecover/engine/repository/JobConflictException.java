package voicecover.engine.repository;

import voicecover.engine.model.JobStatus;

/**
 * A conditional write found the job in a different state than expected.
 * Indicates a benign race, usually with a cancellation request.
 */
public class JobConflictException extends RuntimeException {

    private final String jobId;
    private final JobStatus expected;

    public JobConflictException(String jobId, JobStatus expected, String message) {
        super("Conflict on job " + jobId + " (expected " + expected + "): " + message);
        this.jobId = jobId;
        this.expected = expected;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus expected() {
        return expected;
    }
}
