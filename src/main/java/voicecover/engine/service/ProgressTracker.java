package voicecover.engine.service;

import voicecover.engine.model.Stage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps pipeline position to a completion percentage.
 * Values strictly increase along the stage order; 100 is reached only when
 * the last stage completes.
 */
public final class ProgressTracker {

    public static final int INITIAL = 0;
    public static final int COMPLETE = 100;

    private static final Map<Stage, Integer> AFTER_STAGE = new EnumMap<>(Stage.class);

    static {
        AFTER_STAGE.put(Stage.PREPROCESS, 10);
        AFTER_STAGE.put(Stage.SEPARATE, 35);
        AFTER_STAGE.put(Stage.INFER, 65);
        AFTER_STAGE.put(Stage.MIX, 85);
        AFTER_STAGE.put(Stage.FINALIZE, COMPLETE);
    }

    private ProgressTracker() {
    }

    public static int initial() {
        return INITIAL;
    }

    /** Progress once {@code stage} has completed successfully */
    public static int progressAfter(Stage stage) {
        return AFTER_STAGE.get(stage);
    }
}
