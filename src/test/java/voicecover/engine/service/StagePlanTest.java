package voicecover.engine.service;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobParameters;
import voicecover.engine.model.Stage;
import voicecover.engine.runner.CommandTemplate;
import voicecover.engine.runner.StageInvocation;
import voicecover.engine.runner.StageOutcome;
import voicecover.engine.runner.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StagePlanTest {

    @TempDir
    Path root;

    private Path jobDir;
    private StagePlan plan;

    @BeforeEach
    void setUp() {
        jobDir = root.resolve("cover-plan");
        CoverJob job = CoverJob.builder()
                .id("cover-plan")
                .referenceVoicePath(jobDir.resolve("input/reference_voice.wav").toString())
                .songPath(jobDir.resolve("input/song.mp3").toString())
                .parameters(new JobParameters("tenor", -2, Map.of("index_rate", "0.6")))
                .build();
        EngineConfig config = EngineConfig.defaults()
                .withAssetRoot(root)
                .withStage(Stage.INFER, CommandTemplate.of("infer"), Duration.ofMinutes(3))
                .withTemplateVariable("python_exec", "/opt/py");
        plan = new StagePlan(job, jobDir, config);
    }

    @Test
    void preprocessReadsSongAndWritesWorkFile() {
        StageInvocation inv = plan.invocation(Stage.PREPROCESS);

        assertEquals(List.of(jobDir.resolve("input/song.mp3")), inv.inputs());
        assertEquals(List.of(jobDir.resolve("work/song_preprocessed.wav")), inv.outputs());
        assertEquals(jobDir.resolve("input/song.mp3").toString(), inv.values().get("song_input"));
        assertEquals(inv.outputs().get(0).toString(), inv.values().get("output"));
        assertEquals("/opt/py", inv.values().get("python_exec"));
        assertEquals(jobDir, inv.jobDir());
    }

    @Test
    void laterStagesUseWhatEarlierStagesProduced() {
        plan.record(Stage.PREPROCESS, plan.outputs(Stage.PREPROCESS));
        StageInvocation separate = plan.invocation(Stage.SEPARATE);
        assertEquals(List.of(jobDir.resolve("work/song_preprocessed.wav")), separate.inputs());
        assertEquals(jobDir.resolve("work/vocal.wav").toString(), separate.values().get("vocal_output"));
        assertEquals(jobDir.resolve("work/instrumental.wav").toString(), separate.values().get("inst_output"));

        plan.record(Stage.SEPARATE, separate.outputs());
        StageInvocation infer = plan.invocation(Stage.INFER);
        assertEquals(List.of(jobDir.resolve("input/reference_voice.wav"), jobDir.resolve("work/vocal.wav")),
                infer.inputs());
        assertEquals("tenor", infer.values().get("model_id"));
        assertEquals("-2", infer.values().get("pitch_shift"));
        assertEquals("0.6", infer.values().get("index_rate"));
        assertEquals(jobDir.resolve("work/converted_vocal.wav").toString(), infer.values().get("output_vocal"));
        assertEquals(Duration.ofMinutes(3), infer.timeout());

        plan.record(Stage.INFER, infer.outputs());
        StageInvocation mix = plan.invocation(Stage.MIX);
        assertEquals(jobDir.resolve("work/converted_vocal.wav").toString(), mix.values().get("converted_vocal"));
        assertEquals(jobDir.resolve("work/instrumental.wav").toString(), mix.values().get("instrumental"));
        assertEquals(jobDir.resolve("work/mix.wav").toString(), mix.values().get("output_mix"));

        plan.record(Stage.MIX, mix.outputs());
        StageInvocation finalize = plan.invocation(Stage.FINALIZE);
        assertEquals(List.of(jobDir.resolve("output/final.wav")), finalize.outputs());
    }

    @Test
    void inputsOfAStageThatHasNotRunAreUnavailable() {
        assertThrows(IllegalStateException.class, () -> plan.invocation(Stage.MIX));
    }

    @Test
    void passThroughPreprocessForwardsTheSong() {
        StageResult result = plan.passThrough(Stage.PREPROCESS);

        assertTrue(result.succeeded());
        assertEquals(jobDir.resolve("input/song.mp3"), result.outputPath());
    }

    @Test
    void passThroughFinalizePublishesACopy() throws Exception {
        Path mix = jobDir.resolve("work/mix.wav");
        Files.createDirectories(mix.getParent());
        Files.writeString(mix, "mixed");
        plan.record(Stage.MIX, List.of(mix));

        StageResult result = plan.passThrough(Stage.FINALIZE);

        assertTrue(result.succeeded());
        assertEquals(jobDir.resolve("output/final.wav"), result.outputPath());
        assertEquals("mixed", Files.readString(result.outputPath()));
    }

    @Test
    void passThroughFinalizeWithoutMixFileFails() {
        plan.record(Stage.MIX, List.of(jobDir.resolve("work/missing.wav")));

        StageResult result = plan.passThrough(Stage.FINALIZE);

        assertEquals(StageOutcome.SPAWN_FAILURE, result.outcome());
    }
}
