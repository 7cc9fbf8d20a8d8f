package com.github.stormino.transcoder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Status payload returned by the download endpoint.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private JobStatus status;
    private String id;
    private String result;
    private String message;

    /**
     * Percentage, rounded to two decimals.
     */
    private Double progress;

    /**
     * Seconds, rounded to two decimals.
     */
    @JsonProperty("estimated_remaining_time")
    private Double estimatedRemainingTime;

    public static JobStatusResponse error(String message) {
        return JobStatusResponse.builder()
                .status(JobStatus.ERROR)
                .message(message)
                .build();
    }
}
