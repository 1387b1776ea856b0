package com.scholary.audioqc.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Response envelope returned for every analysis request.
 *
 * <p>{@code data} is the full {@link QcResult} for status 200 and an empty object otherwise.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record QcResponse(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("status_code") StatusCode statusCode,
    Object data) {

  public static QcResponse success(String requestId, QcResult result) {
    return new QcResponse(requestId, StatusCode.OK, result);
  }

  public static QcResponse failure(String requestId, StatusCode statusCode) {
    if (statusCode == StatusCode.OK) {
      throw new IllegalArgumentException("Failure response needs a failure code");
    }
    return new QcResponse(requestId, statusCode, Map.of());
  }
}
