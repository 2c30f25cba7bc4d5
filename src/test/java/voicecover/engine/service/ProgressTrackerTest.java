package voicecover.engine.service;

import voicecover.engine.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    @Test
    void progressPerStage() {
        assertEquals(0, ProgressTracker.initial());
        assertEquals(10, ProgressTracker.progressAfter(Stage.PREPROCESS));
        assertEquals(35, ProgressTracker.progressAfter(Stage.SEPARATE));
        assertEquals(65, ProgressTracker.progressAfter(Stage.INFER));
        assertEquals(85, ProgressTracker.progressAfter(Stage.MIX));
        assertEquals(100, ProgressTracker.progressAfter(Stage.FINALIZE));
    }

    @Test
    void strictlyIncreasingAndOnlyLastStageReaches100() {
        List<Integer> trace = new ArrayList<>();
        trace.add(ProgressTracker.initial());
        for (Stage stage : Stage.values()) {
            trace.add(ProgressTracker.progressAfter(stage));
        }

        for (int i = 1; i < trace.size(); i++) {
            assertTrue(trace.get(i) > trace.get(i - 1), "not increasing at " + i + ": " + trace);
        }
        for (Stage stage : Stage.values()) {
            assertEquals(stage.isLast(), ProgressTracker.progressAfter(stage) == ProgressTracker.COMPLETE);
        }
    }
}
