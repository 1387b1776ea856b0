package com.scholary.audioqc.decode;

import com.scholary.audioqc.service.QcException;
import com.scholary.audioqc.service.StatusCode;

/**
 * Thrown when an upload cannot be turned into usable mono 16 kHz samples.
 *
 * <p>Covers the input checks (missing, too large, duration) as well as ffmpeg and WAV read
 * failures.
 */
public class DecodeException extends QcException {

  public DecodeException(StatusCode statusCode, String message) {
    super(statusCode, message);
  }

  public DecodeException(StatusCode statusCode, String message, Throwable cause) {
    super(statusCode, message, cause);
  }
}
