package voicecover.engine.config;

import voicecover.engine.runner.CommandTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Command template and timeout for one stage.
 * An empty template marks the stage as a pass-through.
 */
public record StageSettings(CommandTemplate template, Duration timeout) {

    public StageSettings {
        Objects.requireNonNull(template, "template is required");
        Objects.requireNonNull(timeout, "timeout is required");
    }

    public static StageSettings passThrough(Duration timeout) {
        return new StageSettings(CommandTemplate.of(), timeout);
    }

    public boolean isPassThrough() {
        return template.isEmpty();
    }

    public StageSettings withTemplate(CommandTemplate template) {
        return new StageSettings(template, timeout);
    }

    public StageSettings withTimeout(Duration timeout) {
        return new StageSettings(template, timeout);
    }
}
