package voicecover.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one voice cover request.
 * Updates go through the repository's conditional writes; use toBuilder() for
 * local copies only.
 */
public final class CoverJob {
    private final String id;
    private final JobStatus status;
    private final Stage stage; // null until the job starts running
    private final int progress;
    private final String referenceVoicePath;
    private final String songPath;
    private final JobParameters parameters;
    private final String outputPath;
    private final String errorMessage;
    private final boolean cancelRequested;
    private final String externalTaskHandle;
    private final String claimedBy;
    private final Instant heartbeatAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant expiresAt;
    private final Instant artifactsPurgedAt;

    private CoverJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.stage = builder.stage;
        this.progress = builder.progress;
        this.referenceVoicePath = Objects.requireNonNull(builder.referenceVoicePath, "referenceVoicePath is required");
        this.songPath = Objects.requireNonNull(builder.songPath, "songPath is required");
        this.parameters = Objects.requireNonNull(builder.parameters, "parameters is required");
        this.outputPath = builder.outputPath;
        this.errorMessage = builder.errorMessage;
        this.cancelRequested = builder.cancelRequested;
        this.externalTaskHandle = builder.externalTaskHandle;
        this.claimedBy = builder.claimedBy;
        this.heartbeatAt = builder.heartbeatAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.expiresAt = builder.expiresAt;
        this.artifactsPurgedAt = builder.artifactsPurgedAt;
    }

    public String id() {
        return id;
    }

    public JobStatus status() {
        return status;
    }

    public Stage stage() {
        return stage;
    }

    public int progress() {
        return progress;
    }

    public String referenceVoicePath() {
        return referenceVoicePath;
    }

    public String songPath() {
        return songPath;
    }

    public JobParameters parameters() {
        return parameters;
    }

    public String outputPath() {
        return outputPath;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public String externalTaskHandle() {
        return externalTaskHandle;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant artifactsPurgedAt() {
        return artifactsPurgedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True once the sweeper has removed the job's files */
    public boolean artifactsPurged() {
        return artifactsPurgedAt != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .stage(stage)
                .progress(progress)
                .referenceVoicePath(referenceVoicePath)
                .songPath(songPath)
                .parameters(parameters)
                .outputPath(outputPath)
                .errorMessage(errorMessage)
                .cancelRequested(cancelRequested)
                .externalTaskHandle(externalTaskHandle)
                .claimedBy(claimedBy)
                .heartbeatAt(heartbeatAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .expiresAt(expiresAt)
                .artifactsPurgedAt(artifactsPurgedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobStatus status = JobStatus.QUEUED;
        private Stage stage;
        private int progress;
        private String referenceVoicePath;
        private String songPath;
        private JobParameters parameters = JobParameters.of(null, 0);
        private String outputPath;
        private String errorMessage;
        private boolean cancelRequested;
        private String externalTaskHandle;
        private String claimedBy;
        private Instant heartbeatAt;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant expiresAt;
        private Instant artifactsPurgedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder referenceVoicePath(String referenceVoicePath) {
            this.referenceVoicePath = referenceVoicePath;
            return this;
        }

        public Builder songPath(String songPath) {
            this.songPath = songPath;
            return this;
        }

        public Builder parameters(JobParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder externalTaskHandle(String externalTaskHandle) {
            this.externalTaskHandle = externalTaskHandle;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder artifactsPurgedAt(Instant artifactsPurgedAt) {
            this.artifactsPurgedAt = artifactsPurgedAt;
            return this;
        }

        public CoverJob build() {
            return new CoverJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CoverJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CoverJob{id='" + id + "', status=" + status + ", stage=" + stage
                + ", progress=" + progress + "%, cancelRequested=" + cancelRequested + "}";
    }
}
