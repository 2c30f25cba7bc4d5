package voicecover.engine.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import voicecover.engine.model.CancelResult;
import voicecover.engine.model.CoverJob;
import voicecover.engine.model.JobParameters;
import voicecover.engine.model.JobStatus;
import voicecover.engine.model.Stage;
import voicecover.engine.util.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the status and cancel views.
 */
class JobStatusResponseTest {

    private static CoverJob.Builder job() {
        return CoverJob.builder()
                .id("cover-001")
                .referenceVoicePath("/a/input/reference_voice.wav")
                .songPath("/a/input/song.wav")
                .parameters(JobParameters.of("tenor", 2))
                .createdAt(Instant.parse("2026-01-28T16:00:00Z"))
                .updatedAt(Instant.parse("2026-01-28T16:05:00Z"));
    }

    @Test
    @DisplayName("Failed job exposes stage, progress and error message")
    void failedJob() throws Exception {
        CoverJob failed = job()
                .status(JobStatus.FAILED)
                .stage(Stage.INFER)
                .progress(35)
                .errorMessage("infer stage failed (infer.sh): NON_ZERO_EXIT exit=2 - model not found")
                .expiresAt(Instant.parse("2026-01-29T16:05:00Z"))
                .build();

        JsonNode json = Json.mapper().readTree(Json.mapper().writeValueAsString(JobStatusResponse.from(failed)));

        assertEquals("cover-001", json.get("jobId").asText());
        assertEquals("failed", json.get("status").asText());
        assertEquals("infer", json.get("stage").asText());
        assertEquals(35, json.get("progress").asInt());
        assertTrue(json.get("errorMessage").asText().contains("model not found"));
        assertEquals("tenor", json.get("modelId").asText());
        assertEquals(2, json.get("pitchShift").asInt());
        assertFalse(json.get("resultAvailable").asBoolean());
        assertEquals("2026-01-29T16:05:00Z", json.get("expiresAt").asText());
    }

    @Test
    void queuedJobOmitsAbsentFields() throws Exception {
        JsonNode json = Json.mapper().readTree(
                Json.mapper().writeValueAsString(JobStatusResponse.from(job().build())));

        assertEquals("queued", json.get("status").asText());
        assertFalse(json.has("stage"));
        assertFalse(json.has("errorMessage"));
        assertFalse(json.has("expiresAt"));
        assertEquals("2026-01-28T16:00:00Z", json.get("createdAt").asText());
    }

    @Test
    void succeededJobWithPurgedArtifactsHasNoResult() {
        CoverJob purged = job()
                .status(JobStatus.SUCCEEDED)
                .stage(Stage.FINALIZE)
                .progress(100)
                .outputPath("/a/output/final.wav")
                .artifactsPurgedAt(Instant.parse("2026-01-30T00:00:00Z"))
                .build();

        assertFalse(JobStatusResponse.from(purged).resultAvailable());
        assertTrue(JobStatusResponse.from(purged.toBuilder().artifactsPurgedAt(null).build()).resultAvailable());
    }

    @Test
    void cancelResponseJson() throws Exception {
        String json = Json.mapper().writeValueAsString(new CancelJobResponse("cover-x", CancelResult.NOT_FOUND, null));

        assertEquals("{\"jobId\":\"cover-x\",\"result\":\"NOT_FOUND\"}", json);
    }
}
