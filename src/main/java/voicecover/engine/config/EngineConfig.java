package voicecover.engine.config;

import voicecover.engine.model.Stage;
import voicecover.engine.runner.CommandTemplate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration for the cover engine.
 * All settings have sensible defaults; {@code with*} methods return a
 * modified copy, so a config handed to a component can never change under it.
 */
public final class EngineConfig {

    /** Stages that cannot be pass-through */
    public static final Set<Stage> REQUIRED_STAGES = Set.of(Stage.SEPARATE, Stage.INFER, Stage.MIX);

    // Database settings
    private final String databaseUrl;
    private final int databasePoolSize;

    // Storage
    private final Path assetRoot;
    private final Set<String> allowedFormats;

    // Pipeline
    private final Map<Stage, StageSettings> stages;
    private final Map<String, String> templateVariables;
    private final Duration killGrace;
    private final int diagnosticChars;

    // Lifecycle
    private final Duration retentionWindow;
    private final Duration recordGracePeriod; // null = keep records forever
    private final Duration sweepInterval;
    private final Duration staleClaimThreshold;
    private final Duration reaperInterval;

    // Workers
    private final int workerCount;
    private final Duration heartbeatInterval;
    private final Duration idlePollInterval;

    private EngineConfig(Builder b) {
        this.databaseUrl = b.databaseUrl;
        this.databasePoolSize = b.databasePoolSize;
        this.assetRoot = b.assetRoot;
        this.allowedFormats = Set.copyOf(b.allowedFormats);
        this.stages = Collections.unmodifiableMap(new EnumMap<>(b.stages));
        this.templateVariables = Collections.unmodifiableMap(new LinkedHashMap<>(b.templateVariables));
        this.killGrace = b.killGrace;
        this.diagnosticChars = b.diagnosticChars;
        this.retentionWindow = b.retentionWindow;
        this.recordGracePeriod = b.recordGracePeriod;
        this.sweepInterval = b.sweepInterval;
        this.staleClaimThreshold = b.staleClaimThreshold;
        this.reaperInterval = b.reaperInterval;
        this.workerCount = b.workerCount;
        this.heartbeatInterval = b.heartbeatInterval;
        this.idlePollInterval = b.idlePollInterval;
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Override defaults from environment-style variables.
     */
    public static EngineConfig fromEnv(Map<String, String> env) {
        Builder b = new Builder();

        String dbUrl = env.get("COVER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            b.databaseUrl = dbUrl;
        }

        String assetRoot = env.get("COVER_ASSET_ROOT");
        if (assetRoot != null && !assetRoot.isBlank()) {
            b.assetRoot = Path.of(assetRoot);
        }

        for (Stage stage : Stage.values()) {
            String prefix = "COVER_" + stage.name() + "_";
            StageSettings current = b.stages.get(stage);

            String cmd = env.get(prefix + "CMD");
            if (cmd != null) {
                current = current.withTemplate(CommandTemplate.parse(cmd));
            }
            String timeout = env.get(prefix + "TIMEOUT_SECONDS");
            if (timeout != null && !timeout.isBlank()) {
                current = current.withTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
            }
            b.stages.put(stage, current);
        }

        putIfSet(env, "GPT_SOVITS_PYTHON", b.templateVariables, "python_exec");
        putIfSet(env, "GPT_SOVITS_PROJECT_ROOT", b.templateVariables, "project_root");
        putIfSet(env, "COVER_UVR_MODEL", b.templateVariables, "uvr_model");

        String ttl = env.get("COVER_RESULT_TTL_HOURS");
        if (ttl != null && !ttl.isBlank()) {
            b.retentionWindow = Duration.ofHours(Long.parseLong(ttl.trim()));
        }

        String workers = env.get("COVER_WORKERS");
        if (workers != null && !workers.isBlank()) {
            b.workerCount = Integer.parseInt(workers.trim());
        }

        return b.build();
    }

    private static void putIfSet(Map<String, String> env, String key, Map<String, String> target, String name) {
        String value = env.get(key);
        if (value != null && !value.isBlank()) {
            target.put(name, value);
        }
    }

    /**
     * Check that the pipeline can actually run.
     *
     * @throws IllegalStateException if a required stage has no command
     */
    public EngineConfig validate() {
        for (Stage stage : REQUIRED_STAGES) {
            if (stages.get(stage).isPassThrough()) {
                throw new IllegalStateException("cover runtime is not configured: no command for stage "
                        + stage.value() + " (set COVER_" + stage.name() + "_CMD)");
            }
        }
        if (workerCount <= 0) {
            throw new IllegalStateException("workerCount must be positive");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path assetRoot() {
        return assetRoot;
    }

    public Set<String> allowedFormats() {
        return allowedFormats;
    }

    public StageSettings stage(Stage stage) {
        return stages.get(stage);
    }

    public Map<String, String> templateVariables() {
        return templateVariables;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public int diagnosticChars() {
        return diagnosticChars;
    }

    public Duration retentionWindow() {
        return retentionWindow;
    }

    public Optional<Duration> recordGracePeriod() {
        return Optional.ofNullable(recordGracePeriod);
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public Duration staleClaimThreshold() {
        return staleClaimThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public int workerCount() {
        return workerCount;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration idlePollInterval() {
        return idlePollInterval;
    }

    // Copying setters for testing/customization

    public EngineConfig withDatabaseUrl(String url) {
        return toBuilder().databaseUrl(url).build();
    }

    public EngineConfig withAssetRoot(Path root) {
        return toBuilder().assetRoot(root).build();
    }

    public EngineConfig withStage(Stage stage, CommandTemplate template, Duration timeout) {
        Builder b = toBuilder();
        b.stages.put(stage, new StageSettings(template, timeout));
        return b.build();
    }

    public EngineConfig withStageCommand(Stage stage, String... tokens) {
        Builder b = toBuilder();
        b.stages.put(stage, b.stages.get(stage).withTemplate(CommandTemplate.of(tokens)));
        return b.build();
    }

    public EngineConfig withStageTimeout(Stage stage, Duration timeout) {
        Builder b = toBuilder();
        b.stages.put(stage, b.stages.get(stage).withTimeout(timeout));
        return b.build();
    }

    public EngineConfig withPassThrough(Stage stage) {
        Builder b = toBuilder();
        b.stages.put(stage, StageSettings.passThrough(b.stages.get(stage).timeout()));
        return b.build();
    }

    public EngineConfig withTemplateVariable(String name, String value) {
        Builder b = toBuilder();
        b.templateVariables.put(name, value);
        return b.build();
    }

    public EngineConfig withKillGrace(Duration grace) {
        return toBuilder().killGrace(grace).build();
    }

    public EngineConfig withRetentionWindow(Duration window) {
        return toBuilder().retentionWindow(window).build();
    }

    /**
     * @param grace how long records outlive their artifacts; null keeps them
     */
    public EngineConfig withRecordGracePeriod(Duration grace) {
        return toBuilder().recordGracePeriod(grace).build();
    }

    public EngineConfig withStaleClaimThreshold(Duration threshold) {
        return toBuilder().staleClaimThreshold(threshold).build();
    }

    public EngineConfig withWorkerCount(int workers) {
        return toBuilder().workerCount(workers).build();
    }

    public EngineConfig withHeartbeatInterval(Duration interval) {
        return toBuilder().heartbeatInterval(interval).build();
    }

    public EngineConfig withIdlePollInterval(Duration interval) {
        return toBuilder().idlePollInterval(interval).build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.databaseUrl = databaseUrl;
        b.databasePoolSize = databasePoolSize;
        b.assetRoot = assetRoot;
        b.allowedFormats = allowedFormats;
        b.stages = new EnumMap<>(stages);
        b.templateVariables = new LinkedHashMap<>(templateVariables);
        b.killGrace = killGrace;
        b.diagnosticChars = diagnosticChars;
        b.retentionWindow = retentionWindow;
        b.recordGracePeriod = recordGracePeriod;
        b.sweepInterval = sweepInterval;
        b.staleClaimThreshold = staleClaimThreshold;
        b.reaperInterval = reaperInterval;
        b.workerCount = workerCount;
        b.heartbeatInterval = heartbeatInterval;
        b.idlePollInterval = idlePollInterval;
        return b;
    }

    private static final class Builder {
        private String databaseUrl = "jdbc:h2:file:./data/voicecover;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        private int databasePoolSize = 10;
        private Path assetRoot = Path.of("./cover_assets");
        private Set<String> allowedFormats = Set.of("wav", "mp3", "flac", "ogg", "m4a", "aac");
        private EnumMap<Stage, StageSettings> stages = defaultStages();
        private Map<String, String> templateVariables = defaultVariables();
        private Duration killGrace = Duration.ofSeconds(5);
        private int diagnosticChars = 800;
        private Duration retentionWindow = Duration.ofHours(24);
        private Duration recordGracePeriod = Duration.ofDays(7);
        private Duration sweepInterval = Duration.ofHours(1);
        private Duration staleClaimThreshold = Duration.ofMinutes(5);
        private Duration reaperInterval = Duration.ofSeconds(30);
        private int workerCount = 1;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration idlePollInterval = Duration.ofMillis(500);

        Builder databaseUrl(String v) {
            this.databaseUrl = v;
            return this;
        }

        Builder assetRoot(Path v) {
            this.assetRoot = v;
            return this;
        }

        Builder killGrace(Duration v) {
            this.killGrace = v;
            return this;
        }

        Builder retentionWindow(Duration v) {
            this.retentionWindow = v;
            return this;
        }

        Builder recordGracePeriod(Duration v) {
            this.recordGracePeriod = v;
            return this;
        }

        Builder staleClaimThreshold(Duration v) {
            this.staleClaimThreshold = v;
            return this;
        }

        Builder workerCount(int v) {
            this.workerCount = v;
            return this;
        }

        Builder heartbeatInterval(Duration v) {
            this.heartbeatInterval = v;
            return this;
        }

        Builder idlePollInterval(Duration v) {
            this.idlePollInterval = v;
            return this;
        }

        EngineConfig build() {
            return new EngineConfig(this);
        }

        private static EnumMap<Stage, StageSettings> defaultStages() {
            EnumMap<Stage, StageSettings> m = new EnumMap<>(Stage.class);
            m.put(Stage.PREPROCESS, new StageSettings(
                    CommandTemplate.parse("ffmpeg -y -i {song_input} -vn -acodec pcm_s16le -ac 2 -ar 44100 {output}"),
                    Duration.ofMinutes(5)));
            m.put(Stage.SEPARATE, StageSettings.passThrough(Duration.ofMinutes(20)));
            m.put(Stage.INFER, StageSettings.passThrough(Duration.ofMinutes(30)));
            m.put(Stage.MIX, new StageSettings(
                    CommandTemplate.of("ffmpeg", "-y", "-i", "{converted_vocal}", "-i", "{instrumental}",
                            "-filter_complex",
                            "[0:a]volume=1.0[v];[1:a]volume=0.9[i];[v][i]amix=inputs=2:normalize=1[m]",
                            "-map", "[m]", "-c:a", "pcm_s16le", "{output_mix}"),
                    Duration.ofMinutes(5)));
            m.put(Stage.FINALIZE, StageSettings.passThrough(Duration.ofMinutes(5)));
            return m;
        }

        private static Map<String, String> defaultVariables() {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("python_exec", "python");
            m.put("project_root", "");
            m.put("uvr_model", "HP2_all_vocals");
            return m;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", assetRoot=" + assetRoot +
                ", workers=" + workerCount +
                ", retention=" + retentionWindow +
                ", stages=" + stages.keySet() +
                '}';
    }
}
