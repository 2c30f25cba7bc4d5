package voicecover.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CoverJobTest {

    private static CoverJob.Builder base() {
        return CoverJob.builder()
                .id("cover-1")
                .referenceVoicePath("/a/input/reference_voice.wav")
                .songPath("/a/input/song.wav");
    }

    @Test
    void newJobIsQueuedWithoutStage() {
        CoverJob job = base().build();

        assertEquals(JobStatus.QUEUED, job.status());
        assertNull(job.stage());
        assertEquals(0, job.progress());
        assertFalse(job.isTerminal());
        assertFalse(job.cancelRequested());
        assertEquals(JobParameters.DEFAULT_MODEL, job.parameters().modelId());
    }

    @Test
    void requiredFieldsAreEnforced() {
        assertThrows(NullPointerException.class, () -> CoverJob.builder().songPath("s").referenceVoicePath("r").build());
        assertThrows(NullPointerException.class, () -> CoverJob.builder().id("x").referenceVoicePath("r").build());
    }

    @Test
    void terminalStatuses() {
        assertFalse(JobStatus.QUEUED.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
        assertTrue(JobStatus.SUCCEEDED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELED.isTerminal());
        assertEquals("canceled", JobStatus.CANCELED.value());
    }

    @Test
    void stageOrder() {
        assertEquals(Stage.PREPROCESS, Stage.first());
        assertEquals(Stage.SEPARATE, Stage.PREPROCESS.next());
        assertEquals(Stage.FINALIZE, Stage.MIX.next());
        assertNull(Stage.FINALIZE.next());
        assertTrue(Stage.FINALIZE.isLast());
        assertEquals("infer", Stage.INFER.value());
    }

    @Test
    void toBuilderCopiesEverything() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        CoverJob job = base()
                .status(JobStatus.SUCCEEDED)
                .stage(Stage.FINALIZE)
                .progress(100)
                .outputPath("/a/output/final.wav")
                .expiresAt(now)
                .artifactsPurgedAt(now)
                .build();

        CoverJob copy = job.toBuilder().build();

        assertEquals(job, copy);
        assertEquals(Stage.FINALIZE, copy.stage());
        assertEquals("/a/output/final.wav", copy.outputPath());
        assertTrue(copy.artifactsPurged());
        assertTrue(copy.isTerminal());
    }
}
