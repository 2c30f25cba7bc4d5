package voicecover.engine.runner;

/**
 * Link between a running tool process and whoever may want to terminate it.
 *
 * The runner calls {@link #attach(Process)} right after spawning and
 * {@link #settle()} exactly once after the process has exited or been killed.
 * Implementations make both calls atomic with respect to termination, so
 * {@code settle()} is the single point where a cancellation and a normal
 * exit are told apart.
 */
public interface ProcessGuard {

    /**
     * Register the freshly started process.
     *
     * @return false if termination was already requested; the guard has then
     *         started killing the process
     */
    boolean attach(Process process);

    /**
     * Detach the process and report whether it was terminated on request.
     * After this call a termination request no longer affects the finished
     * invocation.
     */
    boolean settle();

    /** Guard that never terminates anything */
    ProcessGuard NONE = new ProcessGuard() {
        @Override
        public boolean attach(Process process) {
            return true;
        }

        @Override
        public boolean settle() {
            return false;
        }
    };
}
