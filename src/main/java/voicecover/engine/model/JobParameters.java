package voicecover.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import voicecover.engine.util.Json;

import java.util.Map;

/**
 * Immutable parameter snapshot taken when a job is created.
 * Persisted as JSON in the job record.
 */
public record JobParameters(
        @JsonProperty("modelId") String modelId,
        @JsonProperty("pitchShift") int pitchShift,
        @JsonProperty("extras") Map<String, String> extras) {

    public static final String DEFAULT_MODEL = "default";
    public static final int MIN_PITCH_SHIFT = -24;
    public static final int MAX_PITCH_SHIFT = 24;

    @JsonCreator
    public JobParameters {
        modelId = modelId == null || modelId.isBlank() ? DEFAULT_MODEL : modelId;
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static JobParameters of(String modelId, int pitchShift) {
        return new JobParameters(modelId, pitchShift, Map.of());
    }

    /** Validate parameter bounds */
    public void validate() {
        if (pitchShift < MIN_PITCH_SHIFT || pitchShift > MAX_PITCH_SHIFT) {
            throw new IllegalArgumentException(
                    "pitchShift must be between " + MIN_PITCH_SHIFT + " and " + MAX_PITCH_SHIFT
                            + ", got " + pitchShift);
        }
        if (modelId.length() > 128) {
            throw new IllegalArgumentException("modelId is too long");
        }
    }

    public String toJson() {
        try {
            return Json.mapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job parameters", e);
        }
    }

    public static JobParameters fromJson(String json) {
        try {
            return Json.mapper().readValue(json, JobParameters.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt job parameters: " + json, e);
        }
    }
}
