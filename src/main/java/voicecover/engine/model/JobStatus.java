package voicecover.engine.model;

/**
 * Lifecycle status of a cover job.
 */
public enum JobStatus {
    /** Job created, waiting for a worker */
    QUEUED,
    /** A worker is executing the stage pipeline */
    RUNNING,
    /** All stages finished, result artifact available */
    SUCCEEDED,
    /** A stage failed; the job carries an error message */
    FAILED,
    /** Cancelled by user request */
    CANCELED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    /** Lower-case name used on the query boundary */
    public String value() {
        return name().toLowerCase();
    }
}
