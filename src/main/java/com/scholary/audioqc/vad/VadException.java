package com.scholary.audioqc.vad;

import com.scholary.audioqc.service.QcException;
import com.scholary.audioqc.service.StatusCode;

/**
 * Exception thrown when the VAD engine cannot produce segments.
 *
 * <p>This could be due to network issues, model server errors, or an unparseable reply.
 */
public class VadException extends QcException {

  public VadException(String message) {
    super(StatusCode.VAD_INFER_FAILED, message);
  }

  public VadException(String message, Throwable cause) {
    super(StatusCode.VAD_INFER_FAILED, message, cause);
  }
}
