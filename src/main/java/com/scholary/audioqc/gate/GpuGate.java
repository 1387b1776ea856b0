package com.scholary.audioqc.gate;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Admission gate for GPU inference.
 *
 * <p>At most {@code permits} submitted tasks run at the same time, never more, even transiently.
 * The permit is released when the task returns or throws. A task whose future is already done when
 * a worker picks it up is dropped before a permit is taken.
 */
public interface GpuGate {

  <T> CompletableFuture<T> submit(Callable<T> task);

  GpuGateStats stats();
}
