package com.scholary.audioqc.service;

/**
 * States a request passes through.
 *
 * <p>{@code METRICS_DONE} and {@code VAD_DONE} are the two parallel branches after {@code
 * DECODED}; both must be reached before {@code ASSEMBLED}.
 */
public enum QcState {
  RECEIVED,
  VALIDATED,
  DECODED,
  METRICS_DONE,
  VAD_DONE,
  ASSEMBLED,
  FAILED,
  /** The caller went away before a response was produced. */
  ABANDONED;

  public boolean isTerminal() {
    return this == ASSEMBLED || this == FAILED || this == ABANDONED;
  }
}
