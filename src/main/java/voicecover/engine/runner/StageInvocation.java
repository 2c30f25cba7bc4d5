package voicecover.engine.runner;

import voicecover.engine.model.Stage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to execute one stage for one job.
 *
 * @param stage     the pipeline stage
 * @param template  command template for the stage's tool
 * @param values    placeholder values for the template
 * @param jobDir    the job's private directory; every path must be inside it
 * @param inputs    files the tool reads
 * @param outputs   files the tool must produce
 * @param timeout   wall-clock limit for the tool
 */
public record StageInvocation(
        Stage stage,
        CommandTemplate template,
        Map<String, String> values,
        Path jobDir,
        List<Path> inputs,
        List<Path> outputs,
        Duration timeout) {

    public StageInvocation {
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(template, "template is required");
        Objects.requireNonNull(jobDir, "jobDir is required");
        Objects.requireNonNull(timeout, "timeout is required");
        values = values == null ? Map.of() : Map.copyOf(values);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /** Directory for captured tool output */
    public Path logDir() {
        return jobDir.resolve("work").resolve("logs");
    }
}
