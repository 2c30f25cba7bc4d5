package voicecover.engine.service;

import voicecover.engine.model.JobStatus;

/**
 * Thrown when a job's result is requested but cannot be served: the job has
 * not succeeded, or its artifacts were already reclaimed.
 */
public class ResultNotAvailableException extends RuntimeException {

    private final String jobId;
    private final JobStatus status;

    public ResultNotAvailableException(String jobId, JobStatus status, String reason) {
        super("Result of job " + jobId + " is not available: " + reason);
        this.jobId = jobId;
        this.status = status;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }
}
