package com.scholary.audioqc.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handle on an admitted request.
 *
 * <p>{@link #abandon()} cancels every pool task the request has submitted or will submit. Tasks
 * that have not reached a worker are then skipped by the pools; tasks already running finish.
 */
public final class QcTicket {

  private final QcExecution execution;
  private final CompletableFuture<QcResponse> response = new CompletableFuture<>();
  private final List<CompletableFuture<?>> pending = new CopyOnWriteArrayList<>();
  private volatile boolean abandoned;

  QcTicket(QcExecution execution) {
    this.execution = execution;
  }

  static QcTicket completed(QcExecution execution, QcResponse response) {
    QcTicket ticket = new QcTicket(execution);
    ticket.response.complete(response);
    return ticket;
  }

  public String requestId() {
    return execution.requestId();
  }

  QcState state() {
    return execution.state();
  }

  /** Completes with the envelope, or exceptionally for internal errors and abandonment. */
  public CompletableFuture<QcResponse> response() {
    return response;
  }

  public boolean isAbandoned() {
    return abandoned;
  }

  public void abandon() {
    abandoned = true;
    for (CompletableFuture<?> future : pending) {
      future.cancel(false);
    }
  }

  <T> CompletableFuture<T> track(CompletableFuture<T> future) {
    pending.add(future);
    if (abandoned) {
      future.cancel(false);
    }
    return future;
  }

  void complete(QcResponse value) {
    response.complete(value);
  }

  void fail(Throwable cause) {
    response.completeExceptionally(cause);
  }
}
