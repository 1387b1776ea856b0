package com.scholary.audioqc.gate;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * A bounded pool for decode and metrics work.
 *
 * <p>Tasks are served first come, first served. If the returned future is completed or cancelled
 * before the task reaches a worker, the task is skipped without running.
 */
public interface CpuPool {

  <T> CompletableFuture<T> submit(Callable<T> task);

  CpuPoolStats stats();
}
