package com.scholary.audioqc.service;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of in-band status codes. Exactly one per request. */
public enum StatusCode {
  OK(200),
  MISSING_AUDIO(1001),
  DURATION_OUT_OF_RANGE(1002),
  FILE_TOO_LARGE(1003),
  DECODE_FAILED(2001),
  RESAMPLE_FAILED(2002),
  INVALID_AUDIO(2003),
  VAD_INFER_FAILED(3001);

  private final int code;

  StatusCode(int code) {
    this.code = code;
  }

  @JsonValue
  public int code() {
    return code;
  }
}
