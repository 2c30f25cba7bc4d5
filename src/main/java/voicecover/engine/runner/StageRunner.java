package voicecover.engine.runner;

/**
 * Executes one pipeline stage as an external command.
 * Implementations never touch the job store.
 */
public interface StageRunner {

    /**
     * Run the stage and wait for it, bounded by the invocation timeout.
     * Failures are reported through the result's outcome, never thrown.
     *
     * @param invocation what to run
     * @param guard      termination hook for cancellation
     * @throws InterruptedException if the calling thread is interrupted; the
     *                              process is killed before this is thrown
     */
    StageResult run(StageInvocation invocation, ProcessGuard guard) throws InterruptedException;
}
