package voicecover.engine.worker;

import voicecover.engine.model.CoverJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Dispatch seam between queued jobs and workers.
 *
 * A job is delivered at least once: a claim that stops heartbeating is
 * released or finished by the reaper.
 */
public interface WorkClaim {

    /**
     * Claim the oldest unclaimed queued job.
     *
     * @param workerId identifier of the claiming worker
     * @return the claimed job, or empty if nothing is queued
     */
    Optional<CoverJob> claim(String workerId);

    /**
     * Refresh the claim's heartbeat.
     *
     * @return false if the claim is no longer held by this worker
     */
    boolean heartbeat(String jobId, String workerId);

    /**
     * Release the claim after the orchestrator returned.
     */
    boolean complete(String jobId, String workerId);

    /**
     * Jobs whose claim heartbeat is older than the cutoff.
     */
    List<CoverJob> findStale(Instant cutoff);

    /**
     * Drop the claim on a job that never started, making it claimable again.
     *
     * @return true if the job was still queued and is now unclaimed
     */
    boolean release(String jobId);
}
