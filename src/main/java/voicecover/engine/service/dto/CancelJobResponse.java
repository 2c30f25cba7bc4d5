package voicecover.engine.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import voicecover.engine.model.CancelResult;

/**
 * Outcome of a cancel request.
 * {@code status} is the job's status right after the request, absent when
 * the job does not exist.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelJobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("result") CancelResult result,
        @JsonProperty("status") String status) {
}
