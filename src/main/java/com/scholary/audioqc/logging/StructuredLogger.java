package com.scholary.audioqc.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts its event fields into the MDC, logs one line, then removes the fields again
 * so they don't leak into unrelated log lines on the same thread.
 */
public class StructuredLogger {

  public static final String REQUEST_ID = "requestId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a request entering a pipeline stage. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage that completed normally. */
  public void logStageFinished(String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: {} in {}ms", stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log an expected failure that ends the request with a non-200 code. */
  public void logStageFailed(String stage, int statusCode, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("status_code", String.valueOf(statusCode));

      logger.warn("Stage failed: {}, status={}, message={}", stage, statusCode, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the terminal outcome of a request. */
  public void logRequestCompleted(int statusCode, long elapsedMs) {
    try {
      MDC.put("event_type", "request_completed");
      MDC.put("status_code", String.valueOf(statusCode));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Request completed: status={}, elapsed={}ms", statusCode, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId) {
    MDC.put(REQUEST_ID, requestId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove(REQUEST_ID);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("status_code");
    MDC.remove("elapsedMs");
  }
}
