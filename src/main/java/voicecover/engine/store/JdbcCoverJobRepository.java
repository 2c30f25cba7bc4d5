package voicecover.engine.store;

import voicecover.engine.model.CancelResult;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobParameters;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;
import voicecover.engine.repository.CoverJobRepository;
import voicecover.engine.repository.JobConflictException;
import voicecover.engine.repository.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC implementation of CoverJobRepository.
 *
 * Every transition is one conditional UPDATE whose WHERE clause carries the
 * expected state; the row count tells whether the caller's view was current.
 */
public class JdbcCoverJobRepository implements CoverJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCoverJobRepository.class);

    private static final int MAX_ERROR_LENGTH = 4096;
    private static final String TERMINAL = "('SUCCEEDED', 'FAILED', 'CANCELED')";

    private final Database db;

    public JdbcCoverJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(CoverJob job) {
        String sql = """
                    INSERT INTO cover_jobs (id, status, stage, progress, reference_voice_path, song_path, parameters,
                                            cancel_requested, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant created = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.status().name());
            ps.setString(3, job.stage() != null ? job.stage().name() : null);
            ps.setInt(4, job.progress());
            ps.setString(5, job.referenceVoicePath());
            ps.setString(6, job.songPath());
            ps.setString(7, job.parameters().toJson());
            ps.setBoolean(8, job.cancelRequested());
            ps.setTimestamp(9, Timestamp.from(created));
            ps.setTimestamp(10, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : created));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved cover job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save cover job: " + job.id(), e);
        }
    }

    @Override
    public Optional<CoverJob> findById(String jobId) {
        String sql = "SELECT * FROM cover_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cover job: " + jobId, e);
        }
    }

    @Override
    public List<CoverJob> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM cover_jobs WHERE status = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cover jobs by status: " + status, e);
        }
    }

    @Override
    public List<CoverJob> findRecent(int limit) {
        String sql = "SELECT * FROM cover_jobs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent cover jobs", e);
        }
    }

    @Override
    public CoverJob markRunning(String jobId, String taskHandle, Stage firstStage, int progress, Instant now) {
        String sql = """
                    UPDATE cover_jobs
                    SET status = 'RUNNING', stage = ?, progress = ?, task_handle = ?, updated_at = ?
                    WHERE id = ? AND status = 'QUEUED'
                """;

        return conditionalUpdate(jobId, JobStatus.QUEUED, sql, ps -> {
            ps.setString(1, firstStage.name());
            ps.setInt(2, progress);
            ps.setString(3, taskHandle);
            ps.setTimestamp(4, Timestamp.from(now));
            ps.setString(5, jobId);
        });
    }

    @Override
    public CoverJob advanceStage(String jobId, Stage expectedStage, Stage nextStage, int progress, Instant now) {
        if (nextStage.ordinal() <= expectedStage.ordinal()) {
            throw new IllegalArgumentException("stage can only move forward: " + expectedStage + " -> " + nextStage);
        }
        String sql = """
                    UPDATE cover_jobs
                    SET stage = ?, progress = ?, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING' AND stage = ? AND cancel_requested = FALSE
                      AND progress <= ?
                """;

        return conditionalUpdate(jobId, JobStatus.RUNNING, sql, ps -> {
            ps.setString(1, nextStage.name());
            ps.setInt(2, progress);
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setString(4, jobId);
            ps.setString(5, expectedStage.name());
            ps.setInt(6, progress);
        });
    }

    @Override
    public CoverJob markSucceeded(String jobId, String outputPath, Instant expiresAt, Instant now) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath is required for a succeeded job");
        }
        String sql = """
                    UPDATE cover_jobs
                    SET status = 'SUCCEEDED', progress = 100, output_path = ?, error_message = NULL,
                        expires_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING' AND cancel_requested = FALSE
                """;

        return conditionalUpdate(jobId, JobStatus.RUNNING, sql, ps -> {
            ps.setString(1, outputPath);
            ps.setTimestamp(2, Timestamp.from(expiresAt));
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setString(4, jobId);
        });
    }

    @Override
    public CoverJob markFailed(String jobId, String errorMessage, Instant expiresAt, Instant now) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage is required for a failed job");
        }
        String sql = """
                    UPDATE cover_jobs
                    SET status = 'FAILED', error_message = ?, expires_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING' AND cancel_requested = FALSE
                """;

        return conditionalUpdate(jobId, JobStatus.RUNNING, sql, ps -> {
            ps.setString(1, truncate(errorMessage));
            ps.setTimestamp(2, Timestamp.from(expiresAt));
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setString(4, jobId);
        });
    }

    @Override
    public CoverJob markCanceled(String jobId, Instant expiresAt, Instant now) {
        String sql = """
                    UPDATE cover_jobs
                    SET status = 'CANCELED', expires_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        return conditionalUpdate(jobId, JobStatus.RUNNING, sql, ps -> {
            ps.setTimestamp(1, Timestamp.from(expiresAt));
            ps.setTimestamp(2, Timestamp.from(now));
            ps.setString(3, jobId);
        });
    }

    @Override
    public CancelResult requestCancel(String jobId, Instant now) {
        String sql = """
                    UPDATE cover_jobs
                    SET cancel_requested = TRUE, updated_at = ?
                    WHERE id = ? AND status IN ('QUEUED', 'RUNNING')
                """;

        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, jobId);
            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel for job: " + jobId, e);
        }

        if (updated > 0) {
            return CancelResult.ACCEPTED;
        }
        return findById(jobId).isPresent() ? CancelResult.ALREADY_TERMINAL : CancelResult.NOT_FOUND;
    }

    @Override
    public List<String> listExpired(Instant now) {
        String sql = """
                    SELECT id FROM cover_jobs
                    WHERE status IN %s AND expires_at <= ? AND artifacts_purged_at IS NULL
                    ORDER BY expires_at
                """.formatted(TERMINAL);

        return queryIds(sql, now);
    }

    @Override
    public boolean markArtifactsPurged(String jobId, Instant now) {
        String sql = "UPDATE cover_jobs SET artifacts_purged_at = ? WHERE id = ? AND artifacts_purged_at IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, jobId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark artifacts purged: " + jobId, e);
        }
    }

    @Override
    public List<String> listRecordsExpired(Instant cutoff) {
        String sql = """
                    SELECT id FROM cover_jobs
                    WHERE status IN %s AND expires_at <= ?
                    ORDER BY expires_at
                """.formatted(TERMINAL);

        return queryIds(sql, cutoff);
    }

    @Override
    public Set<String> existingIds() {
        String sql = "SELECT id FROM cover_jobs";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Set<String> ids = new HashSet<>();
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cover job ids", e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        // Only terminal rows; a running job is never removed from under its worker
        String sql = "DELETE FROM cover_jobs WHERE id = ? AND status IN " + TERMINAL;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete cover job: " + jobId, e);
        }
    }

    @Override
    public Optional<JobStatus> finishStale(String jobId, String errorMessage, Instant expiresAt, Instant now) {
        String cancelSql = """
                    UPDATE cover_jobs
                    SET status = 'CANCELED', expires_at = ?, updated_at = ?, claimed_by = NULL
                    WHERE id = ? AND status = 'RUNNING' AND cancel_requested = TRUE
                """;
        String failSql = """
                    UPDATE cover_jobs
                    SET status = 'FAILED', error_message = ?, expires_at = ?, updated_at = ?, claimed_by = NULL
                    WHERE id = ? AND status = 'RUNNING' AND cancel_requested = FALSE
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(cancelSql)) {
                ps.setTimestamp(1, Timestamp.from(expiresAt));
                ps.setTimestamp(2, Timestamp.from(now));
                ps.setString(3, jobId);
                if (ps.executeUpdate() > 0) {
                    conn.commit();
                    return Optional.of(JobStatus.CANCELED);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                ps.setString(1, truncate(errorMessage));
                ps.setTimestamp(2, Timestamp.from(expiresAt));
                ps.setTimestamp(3, Timestamp.from(now));
                ps.setString(4, jobId);
                int updated = ps.executeUpdate();
                conn.commit();
                return updated > 0 ? Optional.of(JobStatus.FAILED) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish stale job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "cover-" + UUID.randomUUID();
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /**
     * Run a conditional UPDATE. Zero rows means either the job is gone or its
     * state moved on; the two are reported with different exceptions.
     */
    private CoverJob conditionalUpdate(String jobId, JobStatus expected, String sql, Binder binder) {
        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update cover job: " + jobId, e);
        }

        Optional<CoverJob> current = findById(jobId);
        if (current.isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        if (updated == 0) {
            throw new JobConflictException(jobId, expected, "found " + current.get());
        }
        return current.get();
    }

    private List<String> queryIds(String sql, Instant instant) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(instant));
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query cover job ids", e);
        }
    }

    private List<CoverJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<CoverJob> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    static CoverJob mapRow(ResultSet rs) throws SQLException {
        String stage = rs.getString("stage");
        return CoverJob.builder()
                .id(rs.getString("id"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .stage(stage != null ? Stage.valueOf(stage) : null)
                .progress(rs.getInt("progress"))
                .referenceVoicePath(rs.getString("reference_voice_path"))
                .songPath(rs.getString("song_path"))
                .parameters(JobParameters.fromJson(rs.getString("parameters")))
                .outputPath(rs.getString("output_path"))
                .errorMessage(rs.getString("error_message"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .externalTaskHandle(rs.getString("task_handle"))
                .claimedBy(rs.getString("claimed_by"))
                .heartbeatAt(toInstant(rs.getTimestamp("heartbeat_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .expiresAt(toInstant(rs.getTimestamp("expires_at")))
                .artifactsPurgedAt(toInstant(rs.getTimestamp("artifacts_purged_at")))
                .build();
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
