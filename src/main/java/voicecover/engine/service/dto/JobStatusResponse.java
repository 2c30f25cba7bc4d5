package voicecover.engine.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import voicecover.engine.model.CoverJob;

import java.time.Instant;

/**
 * Status view of a cover job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("stage") String stage,
        @JsonProperty("progress") int progress,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("modelId") String modelId,
        @JsonProperty("pitchShift") int pitchShift,
        @JsonProperty("resultAvailable") boolean resultAvailable,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("expiresAt") Instant expiresAt) {

    /** Create response from domain model */
    public static JobStatusResponse from(CoverJob job) {
        return new JobStatusResponse(
                job.id(),
                job.status().value(),
                job.stage() != null ? job.stage().value() : null,
                job.progress(),
                job.errorMessage(),
                job.parameters().modelId(),
                job.parameters().pitchShift(),
                job.outputPath() != null && !job.artifactsPurged(),
                job.createdAt(),
                job.updatedAt(),
                job.expiresAt());
    }
}
