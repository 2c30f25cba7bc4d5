package voicecover.engine.worker;

import voicecover.engine.model.CoverJob;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.service.CancellationController;
import voicecover.engine.service.CoverOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A single worker.
 * Loops: claim -> run orchestrator (heartbeating) -> complete claim.
 * Stops cleanly on Thread.interrupt().
 */
public final class CoverWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CoverWorker.class);

    private final String workerId;
    private final WorkClaim workClaim;
    private final CoverOrchestrator orchestrator;
    private final CancellationController cancellation;
    private final CoverJobRepository repository;
    private final ScheduledExecutorService heartbeats;
    private final Duration heartbeatInterval;
    private final Duration idlePollInterval;

    public CoverWorker(String workerId,
            WorkClaim workClaim,
            CoverOrchestrator orchestrator,
            CancellationController cancellation,
            CoverJobRepository repository,
            ScheduledExecutorService heartbeats,
            Duration heartbeatInterval,
            Duration idlePollInterval) {
        this.workerId = workerId;
        this.workClaim = workClaim;
        this.orchestrator = orchestrator;
        this.cancellation = cancellation;
        this.repository = repository;
        this.heartbeats = heartbeats;
        this.heartbeatInterval = heartbeatInterval;
        this.idlePollInterval = idlePollInterval;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("cover-" + workerId);
        log.info("Worker {} started", workerId);

        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (!pollOnce()) {
                    Thread.sleep(idlePollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.warn("Worker {} error: {}", workerId, e.getMessage());
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", workerId);
    }

    /**
     * Claim and run at most one job.
     *
     * @return false if nothing was queued
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<CoverJob> claimed = workClaim.claim(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    private void process(CoverJob job) throws InterruptedException {
        String jobId = job.id();
        String handle = workerId + ":" + UUID.randomUUID();
        long intervalMs = heartbeatInterval.toMillis();
        ScheduledFuture<?> ticker = heartbeats.scheduleAtFixedRate(
                () -> beat(jobId), intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        boolean release = false;
        try {
            CoverJob result = orchestrator.run(jobId, handle);
            release = true;
            log.debug("Worker {} finished job {} -> {}", workerId, jobId, result.status().value());
        } catch (RuntimeException e) {
            // The job stays claimed; once the heartbeat is stale the reaper finishes it
            log.error("Worker {} aborted job {}", workerId, jobId, e);
        } finally {
            ticker.cancel(false);
            if (release) {
                workClaim.complete(jobId, workerId);
            }
        }
    }

    /** Keep the claim alive and relay cancels issued elsewhere to the local process */
    private void beat(String jobId) {
        try {
            if (!workClaim.heartbeat(jobId, workerId)) {
                log.warn("Worker {} no longer holds the claim on job {}", workerId, jobId);
            }
            boolean cancelRequested = repository.findById(jobId)
                    .map(CoverJob::cancelRequested)
                    .orElse(false);
            if (cancelRequested) {
                cancellation.terminateActive(jobId);
            }
        } catch (Exception e) {
            log.debug("Worker {} heartbeat for job {} failed: {}", workerId, jobId, e.getMessage());
        }
    }
}
