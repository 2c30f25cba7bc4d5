package voicecover.engine.runner;

/**
 * How a single stage invocation ended.
 */
public enum StageOutcome {
    /** Exit code 0 and every declared output exists and is non-empty */
    SUCCEEDED,
    /** Tool ran and reported failure */
    NON_ZERO_EXIT,
    /** Tool did not finish in time and was killed */
    TIMEOUT,
    /** Tool could not be started (configuration or environment error) */
    SPAWN_FAILURE,
    /** Exit code 0 but a declared output is missing or empty */
    MISSING_OUTPUT,
    /** Tool was terminated by a cancellation request */
    CANCELED
}
