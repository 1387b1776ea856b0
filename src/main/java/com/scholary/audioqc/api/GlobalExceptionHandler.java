package com.scholary.audioqc.api;

import com.scholary.audioqc.service.QcOrchestrator;
import com.scholary.audioqc.service.QcResponse;
import com.scholary.audioqc.service.StatusCode;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Exception handling at the REST boundary.
 *
 * <p>An upload the servlet container refuses for size is still an expected failure and gets the
 * in-band {@code 1003}. Everything else reaching this class is an internal error: it is logged and
 * answered with an {@link ApiError}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final QcOrchestrator orchestrator;

  public GlobalExceptionHandler(QcOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<QcResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload rejected by container: {}", ex.getMessage());
    return ResponseEntity.ok(orchestrator.reject(null, StatusCode.FILE_TOO_LARGE));
  }

  @ExceptionHandler(QcProcessingException.class)
  public ResponseEntity<ApiError> handleProcessingFailure(QcProcessingException ex) {
    LOGGER.error("Internal error for request {}", ex.getRequestId(), ex.getCause());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError",
                "An unexpected error occurred while analysing the audio",
                ex.getRequestId(),
                Instant.now()));
  }

  /** Catch-all. Spring's own web exceptions keep their status, anything else is a 500. */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatusCode status = errorResponse.getStatusCode();
      LOGGER.warn("Request failed with {}: {}", status, ex.getMessage());
      return ResponseEntity.status(status)
          .body(new ApiError(ex.getClass().getSimpleName(), ex.getMessage(), null, Instant.now()));
    }
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                "InternalServerError", "An unexpected error occurred", null, Instant.now()));
  }
}
