package voicecover.engine.service;

import voicecover.engine.model.CancelResult;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.runner.ProcessGuard;
import voicecover.engine.runner.ProcessKiller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Records cancel requests and terminates the tool process of a job that is
 * running in this JVM.
 *
 * The persisted flag is the source of truth; the per-job
 * {@link TerminationGuard} only makes the request take effect promptly
 * instead of at the next stage boundary.
 */
public class CancellationController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationController.class);

    private final CoverJobRepository repository;
    private final Clock clock;
    private final Duration killGrace;
    private final ScheduledExecutorService killer;
    private final ConcurrentMap<String, TerminationGuard> guards = new ConcurrentHashMap<>();

    public CancellationController(CoverJobRepository repository, Duration killGrace, Clock clock) {
        this.repository = repository;
        this.killGrace = killGrace;
        this.clock = clock;
        this.killer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voicecover-killer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Mark the job for cancellation.
     *
     * @return ACCEPTED while the job is queued or running (also on repeats),
     *         ALREADY_TERMINAL or NOT_FOUND otherwise
     */
    public CancelResult requestCancel(String jobId) {
        CancelResult result = repository.requestCancel(jobId, clock.instant());
        if (result == CancelResult.ACCEPTED) {
            boolean local = terminateActive(jobId);
            log.info("Cancel accepted for job {}{}", jobId, local ? " (terminating local process)" : "");
        } else {
            log.info("Cancel for job {}: {}", jobId, result);
        }
        return result;
    }

    /**
     * Register a guard for a job about to run here. Close it when the run
     * ends.
     *
     * @throws IllegalStateException if the job already has a live guard
     */
    public TerminationGuard register(String jobId) {
        TerminationGuard guard = new TerminationGuard(jobId);
        if (guards.putIfAbsent(jobId, guard) != null) {
            throw new IllegalStateException("Job " + jobId + " is already running in this process");
        }
        return guard;
    }

    /**
     * Deliver a cancel to the job's local process, if any.
     *
     * @return true if the job is running in this JVM
     */
    public boolean terminateActive(String jobId) {
        TerminationGuard guard = guards.get(jobId);
        if (guard == null) {
            return false;
        }
        guard.cancel();
        return true;
    }

    public boolean isActive(String jobId) {
        return guards.containsKey(jobId);
    }

    private void kill(String jobId, Process process) {
        log.info("Terminating pid={} of job {}", process.pid(), jobId);
        ProcessKiller.destroyGracefully(process);
        killer.schedule(() -> {
            if (process.isAlive()) {
                log.warn("pid={} of job {} ignored termination, killing forcibly", process.pid(), jobId);
                ProcessKiller.destroyForcibly(process);
            }
        }, killGrace.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        killer.shutdownNow();
    }

    /**
     * Cancel state of one running job. All methods are synchronized, which
     * makes "cancel" and "process exited" mutually exclusive from the
     * runner's point of view.
     */
    public final class TerminationGuard implements ProcessGuard, AutoCloseable {

        private final String jobId;
        private Process process;
        private boolean cancelRequested;
        private boolean terminated;

        private TerminationGuard(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public synchronized boolean attach(Process process) {
            this.process = process;
            this.terminated = false;
            if (cancelRequested) {
                kill(jobId, process);
                terminated = true;
                return false;
            }
            return true;
        }

        @Override
        public synchronized boolean settle() {
            boolean killed = terminated;
            process = null;
            terminated = false;
            return killed;
        }

        /** Idempotent */
        public synchronized void cancel() {
            if (cancelRequested) {
                return;
            }
            cancelRequested = true;
            if (process != null && process.isAlive()) {
                kill(jobId, process);
                terminated = true;
            }
        }

        public synchronized boolean isCancelRequested() {
            return cancelRequested;
        }

        @Override
        public void close() {
            guards.remove(jobId, this);
        }
    }
}
