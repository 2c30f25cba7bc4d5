package voicecover.engine.repository;

import voicecover.engine.model.CancelResult;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for CoverJob persistence.
 *
 * Status-changing writes are conditional: they name the status (and where
 * relevant the stage) the caller believes the job is in. If the row exists
 * but does not match, {@link JobConflictException} is thrown; if the row is
 * gone, {@link JobNotFoundException}. Progress writes made on behalf of the
 * orchestrator additionally require that no cancellation was requested, so a
 * concurrent cancel always surfaces as a conflict.
 */
public interface CoverJobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save (normally QUEUED)
     */
    void save(CoverJob job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<CoverJob> findById(String jobId);

    /**
     * Get jobs by status, oldest first.
     */
    List<CoverJob> findByStatus(JobStatus status);

    /**
     * Get recent jobs ordered by creation time, newest first.
     */
    List<CoverJob> findRecent(int limit);

    /**
     * QUEUED -> RUNNING at the first stage.
     *
     * @param taskHandle the execution unit that owns the job from now on
     */
    CoverJob markRunning(String jobId, String taskHandle, Stage firstStage, int progress, Instant now);

    /**
     * Move a RUNNING job from {@code expectedStage} to {@code nextStage}.
     * Fails with a conflict if a cancellation was requested meanwhile.
     */
    CoverJob advanceStage(String jobId, Stage expectedStage, Stage nextStage, int progress, Instant now);

    /**
     * RUNNING -> SUCCEEDED with the result artifact. Progress becomes 100.
     * Fails with a conflict if a cancellation was requested meanwhile.
     */
    CoverJob markSucceeded(String jobId, String outputPath, Instant expiresAt, Instant now);

    /**
     * RUNNING -> FAILED with an error message.
     * Fails with a conflict if a cancellation was requested meanwhile.
     */
    CoverJob markFailed(String jobId, String errorMessage, Instant expiresAt, Instant now);

    /**
     * RUNNING -> CANCELED. The stage is left as it was.
     */
    CoverJob markCanceled(String jobId, Instant expiresAt, Instant now);

    /**
     * Set the cancel flag on a non-terminal job. The flag is never cleared.
     */
    CancelResult requestCancel(String jobId, Instant now);

    /**
     * Terminal jobs whose retention has elapsed and whose files have not been
     * purged yet.
     *
     * @return job IDs, oldest expiry first
     */
    List<String> listExpired(Instant now);

    /**
     * Record that the job's files were removed. Idempotent.
     *
     * @return true if the marker was newly set
     */
    boolean markArtifactsPurged(String jobId, Instant now);

    /**
     * Terminal jobs whose expiry lies at or before the cutoff.
     */
    List<String> listRecordsExpired(Instant cutoff);

    /**
     * IDs of every job record, used to detect orphaned directories.
     */
    Set<String> existingIds();

    /**
     * Delete a terminal job record. Queued or running jobs are kept.
     *
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Finish a RUNNING job whose worker stopped heartbeating. The job becomes
     * CANCELED if a cancellation was requested, FAILED otherwise.
     *
     * @return the resulting status, or empty if the job was no longer RUNNING
     */
    Optional<JobStatus> finishStale(String jobId, String errorMessage, Instant expiresAt, Instant now);

    /**
     * Generate a new unique job ID.
     *
     * @return unique ID like "cover-{uuid}"
     */
    String generateId();
}
