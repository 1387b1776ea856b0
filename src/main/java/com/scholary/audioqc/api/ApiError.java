package com.scholary.audioqc.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Body returned for internal errors.
 *
 * <p>Carries no {@code status_code}; internal failures stay outside the in-band code set.
 */
public record ApiError(
    String error,
    String message,
    @JsonProperty("request_id") String requestId,
    Instant timestamp) {}
