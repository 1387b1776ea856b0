package com.scholary.audioqc.gate;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * {@link CpuPool} backed by a fixed-size {@link ThreadPoolTaskExecutor}.
 *
 * <p>The executor's queue is a FIFO {@code LinkedBlockingQueue}, so waiting tasks start in
 * submission order. The counters are the only shared state this class mutates.
 */
public class ExecutorCpuPool implements CpuPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorCpuPool.class);

  private final ThreadPoolTaskExecutor executor;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();

  public ExecutorCpuPool(ThreadPoolTaskExecutor executor) {
    this.executor = executor;
  }

  @Override
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      executor.execute(() -> run(task, future));
    } catch (TaskRejectedException e) {
      LOGGER.warn("CPU pool rejected task: {}", e.getMessage());
      future.completeExceptionally(e);
    }
    return future;
  }

  private <T> void run(Callable<T> task, CompletableFuture<T> future) {
    if (future.isDone()) {
      skipped.incrementAndGet();
      LOGGER.debug("Skipping abandoned CPU task");
      return;
    }
    inFlight.incrementAndGet();
    try {
      future.complete(task.call());
    } catch (Throwable t) {
      future.completeExceptionally(t);
    } finally {
      inFlight.decrementAndGet();
      completed.incrementAndGet();
    }
  }

  @Override
  public CpuPoolStats stats() {
    return new CpuPoolStats(
        executor.getMaxPoolSize(), inFlight.get(), completed.get(), skipped.get());
  }
}
