package voicecover.engine.store;

import voicecover.engine.model.CoverJob;
import voicecover.engine.worker.WorkClaim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * WorkClaim over the cover_jobs table.
 * Claims lock the candidate row with SELECT ... FOR UPDATE so two workers
 * never take the same job.
 */
public class JdbcWorkClaim implements WorkClaim {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkClaim.class);

    private final Database db;
    private final Clock clock;

    public JdbcWorkClaim(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public Optional<CoverJob> claim(String workerId) {
        String selectSql = """
                    SELECT * FROM cover_jobs
                    WHERE status = 'QUEUED' AND claimed_by IS NULL
                    ORDER BY created_at
                    LIMIT 1
                    FOR UPDATE
                """;

        String updateSql = """
                    UPDATE cover_jobs
                    SET claimed_by = ?, heartbeat_at = ?
                    WHERE id = ? AND claimed_by IS NULL
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                CoverJob candidate;
                try (ResultSet rs = selectPs.executeQuery()) {
                    if (!rs.next()) {
                        conn.commit();
                        return Optional.empty();
                    }
                    candidate = JdbcCoverJobRepository.mapRow(rs);
                }

                Instant now = clock.instant();
                updatePs.setString(1, workerId);
                updatePs.setTimestamp(2, Timestamp.from(now));
                updatePs.setString(3, candidate.id());
                int updated = updatePs.executeUpdate();
                conn.commit();

                if (updated == 0) {
                    return Optional.empty();
                }
                log.debug("Worker {} claimed job {}", workerId, candidate.id());
                return Optional.of(candidate.toBuilder().claimedBy(workerId).heartbeatAt(now).build());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim job for worker: " + workerId, e);
        }
    }

    @Override
    public boolean heartbeat(String jobId, String workerId) {
        String sql = "UPDATE cover_jobs SET heartbeat_at = ? WHERE id = ? AND claimed_by = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, jobId);
            ps.setString(3, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to heartbeat job: " + jobId, e);
        }
    }

    @Override
    public boolean complete(String jobId, String workerId) {
        String sql = "UPDATE cover_jobs SET claimed_by = NULL, heartbeat_at = NULL WHERE id = ? AND claimed_by = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete claim on job: " + jobId, e);
        }
    }

    @Override
    public List<CoverJob> findStale(Instant cutoff) {
        String sql = """
                    SELECT * FROM cover_jobs
                    WHERE claimed_by IS NOT NULL AND heartbeat_at < ?
                    ORDER BY heartbeat_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            List<CoverJob> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(JdbcCoverJobRepository.mapRow(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale claims", e);
        }
    }

    @Override
    public boolean release(String jobId) {
        String sql = """
                    UPDATE cover_jobs
                    SET claimed_by = NULL, heartbeat_at = NULL
                    WHERE id = ? AND status = 'QUEUED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release claim on job: " + jobId, e);
        }
    }
}
