package com.flagship.live_event_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every failing endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String code;
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
