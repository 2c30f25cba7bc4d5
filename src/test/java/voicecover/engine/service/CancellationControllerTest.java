package voicecover.engine.service;

import voicecover.engine.FakeTools;
import voicecover.engine.model.CancelResult;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.Stage;
import voicecover.engine.service.CancellationController.TerminationGuard;
import voicecover.engine.store.Database;
import voicecover.engine.store.JdbcCoverJobRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CancellationControllerTest {

    private Database db;
    private JdbcCoverJobRepository repo;
    private CancellationController controller;

    @BeforeEach
    void setUp() {
        db = new Database(FakeTools.memDb("test-cancel"), 2);
        repo = new JdbcCoverJobRepository(db);
        controller = new CancellationController(repo, Duration.ofMillis(200), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        controller.close();
        db.close();
    }

    private void queue(String id) {
        repo.save(CoverJob.builder().id(id).referenceVoicePath("/r.wav").songPath("/s.wav").build());
    }

    private static Process sleeper() throws Exception {
        return new ProcessBuilder("sleep", "30").start();
    }

    @Test
    void requestCancelOutcomes() {
        queue("cover-a");

        assertEquals(CancelResult.ACCEPTED, controller.requestCancel("cover-a"));
        assertEquals(CancelResult.ACCEPTED, controller.requestCancel("cover-a"), "repeat is harmless");
        assertEquals(CancelResult.NOT_FOUND, controller.requestCancel("cover-missing"));

        repo.markRunning("cover-a", "h", Stage.PREPROCESS, 0, Instant.now());
        repo.markCanceled("cover-a", Instant.now(), Instant.now());
        assertEquals(CancelResult.ALREADY_TERMINAL, controller.requestCancel("cover-a"));
    }

    @Test
    @DisplayName("Cancel terminates the attached process and settle reports it")
    void cancelKillsAttachedProcess() throws Exception {
        queue("cover-b");
        Process process = sleeper();

        try (TerminationGuard guard = controller.register("cover-b")) {
            assertTrue(guard.attach(process));
            assertTrue(controller.isActive("cover-b"));

            assertEquals(CancelResult.ACCEPTED, controller.requestCancel("cover-b"));

            assertTrue(process.waitFor(5, TimeUnit.SECONDS), "process should be terminated");
            assertTrue(guard.settle());
            assertTrue(guard.isCancelRequested());
        }
        assertFalse(controller.isActive("cover-b"));
    }

    @Test
    @DisplayName("A cancel before any process exists kills the next one on attach")
    void cancelBeforeAttachIsRemembered() throws Exception {
        try (TerminationGuard guard = controller.register("cover-c")) {
            assertTrue(controller.terminateActive("cover-c"));

            Process process = sleeper();
            assertFalse(guard.attach(process));
            assertTrue(process.waitFor(5, TimeUnit.SECONDS));
            assertTrue(guard.settle());
        }
    }

    @Test
    void settleWithoutCancelIsFalse() throws Exception {
        Process process = new ProcessBuilder("true").start();
        try (TerminationGuard guard = controller.register("cover-d")) {
            assertTrue(guard.attach(process));
            process.waitFor();
            assertFalse(guard.settle());

            // Cancel after settle does not rewrite the finished invocation
            guard.cancel();
            assertFalse(guard.settle());
        }
    }

    @Test
    @DisplayName("A second guard for a running job is refused and the first keeps receiving cancels")
    void secondRegistrationIsRefused() throws Exception {
        queue("cover-e");
        Process process = sleeper();

        try (TerminationGuard guard = controller.register("cover-e")) {
            assertTrue(guard.attach(process));

            assertThrows(IllegalStateException.class, () -> controller.register("cover-e"));
            assertTrue(controller.isActive("cover-e"));

            assertEquals(CancelResult.ACCEPTED, controller.requestCancel("cover-e"));
            assertTrue(process.waitFor(5, TimeUnit.SECONDS), "process should be terminated");
            assertTrue(guard.settle());
        }

        try (TerminationGuard again = controller.register("cover-e")) {
            assertFalse(again.isCancelRequested(), "a closed guard frees the slot");
        }
    }

    @Test
    void terminateActiveWithoutGuard() {
        assertFalse(controller.terminateActive("cover-nobody"));
    }
}
