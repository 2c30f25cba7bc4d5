package voicecover.engine.scheduler;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobStatus;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.worker.WorkClaim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Background task that recovers jobs whose worker disappeared.
 *
 * A claim goes stale when its heartbeat stops, e.g. the worker process
 * crashed or was interrupted mid-stage. The reaper:
 * - releases the claim of a job that never started, so another worker
 * picks it up
 * - finishes a running job as failed (or canceled, if a cancel was
 * requested); stages are never rerun
 */
public class StaleJobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

    static final String WORKER_LOST = "worker lost: no heartbeat from %s since %s";

    private final WorkClaim workClaim;
    private final CoverJobRepository repository;
    private final EngineConfig config;
    private final Clock clock;

    public StaleJobReaper(WorkClaim workClaim, CoverJobRepository repository, EngineConfig config, Clock clock) {
        this.workClaim = workClaim;
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStaleJobs();
        } catch (Exception e) {
            log.error("Stale job reaper error", e);
        }
    }

    /**
     * Find and recover jobs with a stale claim.
     *
     * @return number of jobs recovered
     */
    public int reapStaleJobs() {
        Instant now = clock.instant();
        List<CoverJob> stale = workClaim.findStale(now.minus(config.staleClaimThreshold()));

        if (stale.isEmpty()) {
            log.debug("No stale claims found");
            return 0;
        }

        int released = 0;
        int finished = 0;

        for (CoverJob job : stale) {
            try {
                if (job.status() == JobStatus.QUEUED) {
                    if (workClaim.release(job.id())) {
                        released++;
                        log.info("Released stale claim of queued job {} (was {})", job.id(), job.claimedBy());
                    }
                } else if (job.status() == JobStatus.RUNNING) {
                    String message = WORKER_LOST.formatted(job.claimedBy(), job.heartbeatAt());
                    Optional<JobStatus> outcome = repository.finishStale(
                            job.id(), message, now.plus(config.retentionWindow()), now);
                    if (outcome.isPresent()) {
                        finished++;
                        log.warn("Job {} lost its worker {} during {}, now {}",
                                job.id(), job.claimedBy(), job.stage(), outcome.get().value());
                    }
                } else {
                    // Terminal job whose worker died before releasing the claim
                    workClaim.complete(job.id(), job.claimedBy());
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Stale job reaper: {} released, {} finished, {} total stale",
                released, finished, stale.size());

        return released + finished;
    }
}
