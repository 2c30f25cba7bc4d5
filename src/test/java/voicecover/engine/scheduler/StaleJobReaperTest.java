package voicecover.engine.scheduler;

import voicecover.engine.FakeTools;
import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;
import voicecover.engine.store.Database;
import voicecover.engine.store.JdbcCoverJobRepository;
import voicecover.engine.store.JdbcWorkClaim;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Claims are taken at T0, the reaper looks at T0 + 10 minutes with a
 * 5 minute threshold.
 */
class StaleJobReaperTest {

    private static final Instant T0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    private Database db;
    private JdbcCoverJobRepository repo;
    private JdbcWorkClaim claimsAtT0;
    private StaleJobReaper reaper;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl(FakeTools.memDb("test-reaper"))
                .withStaleClaimThreshold(Duration.ofMinutes(5));
        db = new Database(config);
        repo = new JdbcCoverJobRepository(db);
        claimsAtT0 = new JdbcWorkClaim(db, Clock.fixed(T0, ZoneOffset.UTC));
        Clock later = Clock.fixed(T0.plus(Duration.ofMinutes(10)), ZoneOffset.UTC);
        reaper = new StaleJobReaper(new JdbcWorkClaim(db, later), repo, config, later);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    /** Queue a job and claim it at T0 */
    private CoverJob claimed(String id, String worker) {
        repo.save(CoverJob.builder()
                .id(id)
                .referenceVoicePath("/r.wav")
                .songPath("/s.wav")
                .createdAt(T0.minusSeconds(60))
                .build());
        CoverJob job = claimsAtT0.claim(worker).orElseThrow();
        assertEquals(id, job.id());
        return job;
    }

    @Test
    void nothingStale() {
        assertEquals(0, reaper.reapStaleJobs());
    }

    @Test
    @DisplayName("Stale claim on a queued job is released and can be claimed again")
    void queuedJobIsReleased() {
        claimed("cover-q", "worker-dead");

        assertEquals(1, reaper.reapStaleJobs());

        CoverJob job = repo.findById("cover-q").orElseThrow();
        assertEquals(JobStatus.QUEUED, job.status());
        assertNull(job.claimedBy());
        assertEquals("cover-q", claimsAtT0.claim("worker-alive").orElseThrow().id());
    }

    @Test
    @DisplayName("Running job without heartbeat fails with 'worker lost'")
    void runningJobFails() {
        claimed("cover-r", "worker-dead");
        repo.markRunning("cover-r", "task", Stage.PREPROCESS, 0, T0);
        repo.advanceStage("cover-r", Stage.PREPROCESS, Stage.SEPARATE, 10, T0);

        assertEquals(1, reaper.reapStaleJobs());

        CoverJob job = repo.findById("cover-r").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertTrue(job.errorMessage().startsWith("worker lost"), job.errorMessage());
        assertTrue(job.errorMessage().contains("worker-dead"), job.errorMessage());
        assertEquals(Stage.SEPARATE, job.stage());
        assertNull(job.claimedBy());
        assertEquals(T0.plus(Duration.ofMinutes(10)).plus(Duration.ofHours(24)), job.expiresAt());

        assertEquals(0, reaper.reapStaleJobs(), "second pass finds nothing");
    }

    @Test
    void runningJobWithPendingCancelIsCanceled() {
        claimed("cover-c", "worker-dead");
        repo.markRunning("cover-c", "task", Stage.PREPROCESS, 0, T0);
        repo.requestCancel("cover-c", T0);

        assertEquals(1, reaper.reapStaleJobs());

        CoverJob job = repo.findById("cover-c").orElseThrow();
        assertEquals(JobStatus.CANCELED, job.status());
        assertNull(job.errorMessage());
    }

    @Test
    void freshClaimIsLeftAlone() {
        claimed("cover-f", "worker-alive");
        repo.markRunning("cover-f", "task", Stage.PREPROCESS, 0, T0);
        JdbcWorkClaim recent = new JdbcWorkClaim(db, Clock.fixed(T0.plus(Duration.ofMinutes(8)), ZoneOffset.UTC));
        assertTrue(recent.heartbeat("cover-f", "worker-alive"));

        assertEquals(0, reaper.reapStaleJobs());

        CoverJob job = repo.findById("cover-f").orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("worker-alive", job.claimedBy());
    }

    @Test
    void terminalJobClaimIsCleared() {
        claimed("cover-t", "worker-dead");
        repo.markRunning("cover-t", "task", Stage.PREPROCESS, 0, T0);
        repo.markFailed("cover-t", "boom", T0.plus(Duration.ofHours(1)), T0);

        assertEquals(0, reaper.reapStaleJobs());

        CoverJob job = repo.findById("cover-t").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals("boom", job.errorMessage());
        assertNull(job.claimedBy());
    }
}
