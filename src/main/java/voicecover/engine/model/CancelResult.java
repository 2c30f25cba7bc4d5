package voicecover.engine.model;

/**
 * Result of a cancellation request.
 */
public enum CancelResult {
    /** Cancel flag recorded (or already recorded) on a non-terminal job */
    ACCEPTED,

    /** Job already reached a terminal state - harmless no-op */
    ALREADY_TERMINAL,

    /** Job not found */
    NOT_FOUND
}
