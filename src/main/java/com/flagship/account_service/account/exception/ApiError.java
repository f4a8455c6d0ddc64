package com.flagship.account_service.account.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    @JsonProperty("correlation_id")
    String correlationId;
    Instant timestamp;
}
