package voicecover.engine.service;

import voicecover.engine.config.EngineConfig;
import voicecover.engine.config.StageSettings;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.Stage;
import voicecover.engine.runner.StageInvocation;
import voicecover.engine.runner.StageOutcome;
import voicecover.engine.runner.StageResult;
import voicecover.engine.util.JobFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives each stage's inputs, outputs and template values for one job.
 *
 * Inputs come from what earlier stages actually produced, so a pass-through
 * stage simply hands its input on to the next one.
 */
final class StagePlan {

    // Artifact names double as template placeholders
    static final String SONG = "song_input";
    static final String REFERENCE = "reference_voice";
    static final String VOCAL = "input_vocal";
    static final String INSTRUMENTAL = "instrumental";
    static final String CONVERTED = "converted_vocal";
    static final String MIX = "mix";
    static final String FINAL = "final";

    private final CoverJob job;
    private final Path jobDir;
    private final EngineConfig config;
    private final Map<String, Path> artifacts = new HashMap<>();

    StagePlan(CoverJob job, Path jobDir, EngineConfig config) {
        this.job = job;
        this.jobDir = jobDir;
        this.config = config;
        artifacts.put(SONG, Path.of(job.songPath()));
        artifacts.put(REFERENCE, Path.of(job.referenceVoicePath()));
    }

    Path jobDir() {
        return jobDir;
    }

    List<Path> inputs(Stage stage) {
        return switch (stage) {
            case PREPROCESS, SEPARATE -> List.of(artifact(SONG));
            case INFER -> List.of(artifact(REFERENCE), artifact(VOCAL));
            case MIX -> List.of(artifact(CONVERTED), artifact(INSTRUMENTAL));
            case FINALIZE -> List.of(artifact(MIX));
        };
    }

    List<Path> outputs(Stage stage) {
        Path work = JobFiles.workDir(jobDir);
        return switch (stage) {
            case PREPROCESS -> List.of(work.resolve("song_preprocessed.wav"));
            case SEPARATE -> List.of(work.resolve("vocal.wav"), work.resolve("instrumental.wav"));
            case INFER -> List.of(work.resolve("converted_vocal.wav"));
            case MIX -> List.of(work.resolve("mix.wav"));
            case FINALIZE -> List.of(JobFiles.outputDir(jobDir).resolve("final.wav"));
        };
    }

    StageInvocation invocation(Stage stage) {
        StageSettings settings = config.stage(stage);
        List<Path> inputs = inputs(stage);
        List<Path> outputs = outputs(stage);

        Map<String, String> values = new LinkedHashMap<>(job.parameters().extras());
        values.putAll(config.templateVariables());
        values.put("job_dir", jobDir.toString());
        values.put("work_dir", JobFiles.workDir(jobDir).toString());
        values.put("model_id", job.parameters().modelId());
        values.put("pitch_shift", String.valueOf(job.parameters().pitchShift()));
        artifacts.forEach((name, path) -> values.put(name, path.toString()));
        values.put("input", inputs.get(0).toString());
        values.put("output", outputs.get(0).toString());

        switch (stage) {
            case SEPARATE -> {
                values.put("vocal_output", outputs.get(0).toString());
                values.put("inst_output", outputs.get(1).toString());
            }
            case INFER -> values.put("output_vocal", outputs.get(0).toString());
            case MIX -> values.put("output_mix", outputs.get(0).toString());
            default -> {
            }
        }

        return new StageInvocation(stage, settings.template(), values, jobDir, inputs, outputs, settings.timeout());
    }

    /**
     * Stand-in for a stage with no configured tool. The final stage still
     * publishes a copy into output/; any other stage forwards its input.
     */
    StageResult passThrough(Stage stage) {
        Path input = inputs(stage).get(0);
        if (!stage.isLast()) {
            return StageResult.passThrough(stage, List.of(input));
        }
        Path target = outputs(stage).get(0);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
            return StageResult.passThrough(stage, List.of(target));
        } catch (IOException e) {
            return new StageResult(stage, StageOutcome.SPAWN_FAILURE, null, "", "", List.of(), Duration.ZERO,
                    "could not publish " + input.getFileName() + ": " + e.getMessage());
        }
    }

    /** Remember what a successful stage produced */
    void record(Stage stage, List<Path> produced) {
        switch (stage) {
            case PREPROCESS -> artifacts.put(SONG, produced.get(0));
            case SEPARATE -> {
                artifacts.put(VOCAL, produced.get(0));
                artifacts.put(INSTRUMENTAL, produced.get(1));
            }
            case INFER -> artifacts.put(CONVERTED, produced.get(0));
            case MIX -> artifacts.put(MIX, produced.get(0));
            case FINALIZE -> artifacts.put(FINAL, produced.get(0));
        }
    }

    private Path artifact(String name) {
        Path path = artifacts.get(name);
        if (path == null) {
            throw new IllegalStateException("No " + name + " artifact yet for job " + job.id());
        }
        return path;
    }
}
