package voicecover.engine.runner;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Terminates a tool process together with everything it spawned.
 * Tools are often wrapper scripts, so killing only the direct child would
 * leave the real worker running.
 */
public final class ProcessKiller {

    private ProcessKiller() {
    }

    /**
     * Ask the process tree to stop; children are collected before the parent
     * dies because they are re-parented afterwards.
     */
    public static void destroyGracefully(Process process) {
        List<ProcessHandle> children = process.descendants().toList();
        process.destroy();
        children.forEach(ProcessHandle::destroy);
    }

    public static void destroyForcibly(Process process) {
        List<ProcessHandle> children = process.descendants().toList();
        process.destroyForcibly();
        children.forEach(ProcessHandle::destroyForcibly);
    }

    /**
     * Graceful signal, then a forced kill once the grace period has passed.
     * Blocks until the process is gone.
     *
     * @return true if the process exited within the grace period
     */
    public static boolean terminate(Process process, Duration grace) throws InterruptedException {
        if (!process.isAlive()) {
            return true;
        }
        destroyGracefully(process);
        if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }
        destroyForcibly(process);
        process.waitFor();
        return false;
    }
}
