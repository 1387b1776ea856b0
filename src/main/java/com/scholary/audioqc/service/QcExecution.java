package com.scholary.audioqc.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-request state machine.
 *
 * <p>Out-of-order transitions between non-terminal states are contract violations and throw. Once
 * a terminal state is reached further transitions are ignored, so a branch that finishes after
 * the request has already failed or been abandoned cannot resurrect it.
 */
public class QcExecution {

  private final String requestId;
  private QcState state = QcState.RECEIVED;
  private final Set<QcState> branchesDone = EnumSet.noneOf(QcState.class);
  private StatusCode failure;

  public QcExecution(String requestId) {
    this.requestId = requestId;
  }

  public String requestId() {
    return requestId;
  }

  public synchronized QcState state() {
    return state;
  }

  public synchronized StatusCode failure() {
    return failure;
  }

  public synchronized boolean isBranchDone(QcState branch) {
    return branchesDone.contains(branch);
  }

  public synchronized boolean markValidated() {
    return move(QcState.RECEIVED, QcState.VALIDATED);
  }

  public synchronized boolean markDecoded() {
    return move(QcState.VALIDATED, QcState.DECODED);
  }

  public synchronized boolean markMetricsDone() {
    return completeBranch(QcState.METRICS_DONE);
  }

  public synchronized boolean markVadDone() {
    return completeBranch(QcState.VAD_DONE);
  }

  public synchronized boolean markAssembled() {
    if (state.isTerminal()) {
      return false;
    }
    if (state != QcState.DECODED
        || !branchesDone.containsAll(EnumSet.of(QcState.METRICS_DONE, QcState.VAD_DONE))) {
      throw new IllegalStateException(
          String.format(
              "Request %s cannot be assembled from %s with branches %s",
              requestId, state, branchesDone));
    }
    state = QcState.ASSEMBLED;
    return true;
  }

  /**
   * Move to {@code FAILED(code)} from any non-terminal state.
   *
   * @return false if the request had already reached a terminal state
   */
  public synchronized boolean fail(StatusCode code) {
    if (code == StatusCode.OK) {
      throw new IllegalArgumentException("A failed request needs a failure code");
    }
    if (state.isTerminal()) {
      return false;
    }
    state = QcState.FAILED;
    failure = code;
    return true;
  }

  /**
   * Move to {@code ABANDONED} from any non-terminal state.
   *
   * @return false if the request had already reached a terminal state
   */
  public synchronized boolean markAbandoned() {
    if (state.isTerminal()) {
      return false;
    }
    state = QcState.ABANDONED;
    return true;
  }

  private boolean move(QcState from, QcState to) {
    if (state.isTerminal()) {
      return false;
    }
    if (state != from) {
      throw new IllegalStateException(
          String.format("Request %s cannot move %s -> %s", requestId, state, to));
    }
    state = to;
    return true;
  }

  private boolean completeBranch(QcState branch) {
    if (state.isTerminal()) {
      return false;
    }
    if (state != QcState.DECODED) {
      throw new IllegalStateException(
          String.format("Request %s cannot reach %s from %s", requestId, branch, state));
    }
    return branchesDone.add(branch);
  }
}
