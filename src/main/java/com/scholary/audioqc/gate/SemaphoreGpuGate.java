package com.scholary.audioqc.gate;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * {@link GpuGate} made of a fair counting semaphore in front of a fixed pool of VAD workers.
 *
 * <p>Permits are acquired on the worker thread, so a request waiting for the GPU never blocks the
 * thread that accepted it. With {@code workers == permits} the semaphore never blocks; with more
 * workers than permits it is what holds concurrency at the permit count.
 */
public class SemaphoreGpuGate implements GpuGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(SemaphoreGpuGate.class);

  private final int permits;
  private final Semaphore semaphore;
  private final ThreadPoolTaskExecutor workers;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();

  public SemaphoreGpuGate(int permits, ThreadPoolTaskExecutor workers) {
    if (permits < 1) {
      throw new IllegalArgumentException("permits must be at least 1: " + permits);
    }
    this.permits = permits;
    this.semaphore = new Semaphore(permits, true);
    this.workers = workers;
  }

  @Override
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      workers.execute(() -> run(task, future));
    } catch (TaskRejectedException e) {
      LOGGER.warn("GPU worker pool rejected task: {}", e.getMessage());
      future.completeExceptionally(e);
    }
    return future;
  }

  private <T> void run(Callable<T> task, CompletableFuture<T> future) {
    if (future.isDone()) {
      skipped.incrementAndGet();
      LOGGER.debug("Skipping abandoned GPU task");
      return;
    }
    try {
      semaphore.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.completeExceptionally(e);
      return;
    }
    if (future.isDone()) {
      // abandoned while waiting for a permit
      semaphore.release();
      skipped.incrementAndGet();
      return;
    }
    try {
      inFlight.incrementAndGet();
      future.complete(task.call());
    } catch (Throwable t) {
      future.completeExceptionally(t);
    } finally {
      inFlight.decrementAndGet();
      completed.incrementAndGet();
      semaphore.release();
    }
  }

  @Override
  public GpuGateStats stats() {
    return new GpuGateStats(
        permits, semaphore.availablePermits(), inFlight.get(), completed.get(), skipped.get());
  }
}
