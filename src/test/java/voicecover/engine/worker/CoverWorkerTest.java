package voicecover.engine.worker;

import voicecover.engine.FakeTools;
import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;
import voicecover.engine.runner.ProcessStageRunner;
import voicecover.engine.service.CancellationController;
import voicecover.engine.service.CoverJobService;
import voicecover.engine.service.CoverOrchestrator;
import voicecover.engine.store.Database;
import voicecover.engine.store.JdbcCoverJobRepository;
import voicecover.engine.store.JdbcWorkClaim;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CoverWorkerTest {

    @TempDir
    Path tmp;

    private Path tools;
    private Path voice;
    private Path song;
    private EngineConfig config;
    private Database db;
    private JdbcCoverJobRepository repo;
    private JdbcWorkClaim claims;
    private CancellationController cancellation;
    private CoverJobService service;
    private ScheduledExecutorService heartbeats;

    @BeforeEach
    void setUp() throws Exception {
        tools = tmp.resolve("tools");
        voice = FakeTools.audio(tmp.resolve("upload"), "voice.wav");
        song = FakeTools.audio(tmp.resolve("upload"), "song.wav");
        config = FakeTools.config(tools, tmp.resolve("assets"), "test-worker");
        db = new Database(config);
        repo = new JdbcCoverJobRepository(db);
        claims = new JdbcWorkClaim(db, Clock.systemUTC());
        cancellation = new CancellationController(repo, config.killGrace(), Clock.systemUTC());
        service = new CoverJobService(repo, cancellation, config, Clock.systemUTC());
        heartbeats = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        heartbeats.shutdownNow();
        cancellation.close();
        db.close();
    }

    private CoverWorker worker(EngineConfig cfg) {
        CoverOrchestrator orchestrator = new CoverOrchestrator(repo,
                new ProcessStageRunner(cfg.killGrace(), cfg.diagnosticChars()), cancellation, cfg, Clock.systemUTC());
        return new CoverWorker("worker-test", claims, orchestrator, cancellation, repo, heartbeats,
                Duration.ofMillis(100), Duration.ofMillis(50));
    }

    @Test
    void pollOnceWithEmptyQueue() throws Exception {
        assertFalse(worker(config).pollOnce());
    }

    @Test
    @DisplayName("pollOnce runs the claimed job to completion and releases the claim")
    void pollOnceRunsJob() throws Exception {
        CoverJob job = service.createJob(voice, song, "m", 0);

        assertTrue(worker(config).pollOnce());

        CoverJob done = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, done.status());
        assertTrue(done.externalTaskHandle().startsWith("worker-test:"));
        assertNull(done.claimedBy());
        assertNull(done.heartbeatAt());
        assertFalse(worker(config).pollOnce(), "job is not delivered twice");
    }

    @Test
    @DisplayName("A cancel flag written by another process reaches the running tool through the heartbeat")
    void heartbeatRelaysCancel() throws Exception {
        EngineConfig slow = FakeTools.withScript(config, tools, Stage.SEPARATE, "sleep 30", Duration.ofSeconds(30));
        CoverJob job = service.createJob(voice, song, "m", 0);
        CoverWorker worker = worker(slow);

        Thread thread = new Thread(() -> {
            try {
                worker.pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        thread.start();

        long deadline = System.currentTimeMillis() + 10_000;
        while (repo.findById(job.id()).orElseThrow().stage() != Stage.SEPARATE) {
            assertTrue(System.currentTimeMillis() < deadline, "separate never started");
            Thread.sleep(20);
        }
        // Store only: no direct call into the local cancellation controller
        repo.requestCancel(job.id(), Instant.now());

        thread.join(10_000);
        assertFalse(thread.isAlive());
        CoverJob canceled = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.CANCELED, canceled.status());
        assertNull(canceled.claimedBy());
        assertFalse(Files.exists(tmp.resolve("assets").resolve(job.id()).resolve("work")));
    }

    @Test
    void runStopsOnInterrupt() throws Exception {
        Thread thread = new Thread(worker(config));
        thread.start();
        Thread.sleep(200);

        thread.interrupt();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(thread.isAlive());
    }
}
