package com.scholary.audioqc.service;

/**
 * An expected failure that ends a request with a non-200 status code.
 *
 * <p>Anything else thrown while processing a request is treated as an internal error.
 */
public class QcException extends RuntimeException {

  private final StatusCode statusCode;

  public QcException(StatusCode statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public QcException(StatusCode statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public StatusCode getStatusCode() {
    return statusCode;
  }
}
