package com.scholary.audioqc.api;

/** An admitted request that ended in an internal error. */
public class QcProcessingException extends RuntimeException {

  private final String requestId;

  public QcProcessingException(String requestId, Throwable cause) {
    super("Request " + requestId + " failed: " + cause.getMessage(), cause);
    this.requestId = requestId;
  }

  public String getRequestId() {
    return requestId;
  }
}
