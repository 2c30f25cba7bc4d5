package voicecover.engine.runner;

import voicecover.engine.model.Stage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Result of one stage invocation.
 *
 * @param exitCode null when the process never started or was killed
 * @param detail   runner-side explanation (spawn error, missing file, ...)
 */
public record StageResult(
        Stage stage,
        StageOutcome outcome,
        Integer exitCode,
        String stdout,
        String stderr,
        List<Path> outputs,
        Duration duration,
        String detail) {

    public StageResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static StageResult passThrough(Stage stage, List<Path> outputs) {
        return new StageResult(stage, StageOutcome.SUCCEEDED, 0, "", "", outputs, Duration.ZERO, "pass-through");
    }

    public boolean succeeded() {
        return outcome == StageOutcome.SUCCEEDED;
    }

    public boolean canceled() {
        return outcome == StageOutcome.CANCELED;
    }

    /** Primary output (the first declared one) */
    public Path outputPath() {
        return outputs.isEmpty() ? null : outputs.get(0);
    }

    /**
     * Normalized, human-readable failure summary: stage, tool, failure kind
     * and the most useful diagnostic text available.
     */
    public String summary(String toolName, int maxDiagnosticChars) {
        StringBuilder sb = new StringBuilder()
                .append(stage.value()).append(" stage failed (").append(toolName).append("): ")
                .append(outcome.name());
        if (exitCode != null && outcome == StageOutcome.NON_ZERO_EXIT) {
            sb.append(" exit=").append(exitCode);
        }
        String diagnostic = !stderr.isBlank() ? stderr : detail;
        if (diagnostic != null && !diagnostic.isBlank()) {
            sb.append(" - ").append(tail(diagnostic.strip(), maxDiagnosticChars));
        }
        return sb.toString();
    }

    /** Keep the last {@code max} characters; tools print the cause last. */
    static String tail(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return "..." + text.substring(text.length() - max);
    }
}
