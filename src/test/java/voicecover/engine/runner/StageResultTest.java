package voicecover.engine.runner;

import voicecover.engine.model.Stage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageResultTest {

    @Test
    void summaryUsesStderrTail() {
        StageResult r = new StageResult(Stage.INFER, StageOutcome.NON_ZERO_EXIT, 2, "",
                "loading...\nERROR: model not found\n", List.of(), Duration.ofMillis(5), "exit code 2");

        assertEquals("infer stage failed (infer.sh): NON_ZERO_EXIT exit=2 - loading...\nERROR: model not found",
                r.summary("infer.sh", 800));
    }

    @Test
    void summaryFallsBackToDetail() {
        StageResult r = new StageResult(Stage.SEPARATE, StageOutcome.TIMEOUT, null, "", "  ", List.of(),
                Duration.ofSeconds(1), "timed out after 1s");

        assertEquals("separate stage failed (uvr): TIMEOUT - timed out after 1s", r.summary("uvr", 800));
    }

    @Test
    void summaryKeepsOnlyTheEnd() {
        StageResult r = new StageResult(Stage.MIX, StageOutcome.NON_ZERO_EXIT, 1, "",
                "a".repeat(100) + "CAUSE", List.of(), Duration.ZERO, null);

        String summary = r.summary("ffmpeg", 10);
        assertTrue(summary.endsWith("...aaaaaCAUSE"));
    }

    @Test
    void passThroughSucceeds() {
        StageResult r = StageResult.passThrough(Stage.PREPROCESS, List.of(java.nio.file.Path.of("/j/in.wav")));
        assertTrue(r.succeeded());
        assertFalse(r.canceled());
        assertEquals(java.nio.file.Path.of("/j/in.wav"), r.outputPath());
    }
}
