package com.scholary.audioqc.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class SemaphoreGpuGateTest {

  private ThreadPoolTaskExecutor workers;

  @AfterEach
  void tearDown() {
    workers.shutdown();
  }

  private SemaphoreGpuGate gate(int permits, int workerCount) {
    workers = PoolTestSupport.executor(workerCount, Integer.MAX_VALUE);
    return new SemaphoreGpuGate(permits, workers);
  }

  /** Records the highest number of tasks seen running at once. */
  private static final class ConcurrencyProbe {
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();

    Integer call() throws InterruptedException {
      int now = current.incrementAndGet();
      max.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(20);
        return now;
      } finally {
        current.decrementAndGet();
      }
    }
  }

  @Test
  void submit_shouldNeverExceedPermitsEvenWithSpareWorkers() {
    SemaphoreGpuGate gate = gate(2, 6);
    ConcurrencyProbe probe = new ConcurrencyProbe();

    List<CompletableFuture<Integer>> calls = new ArrayList<>();
    for (int i = 0; i < 24; i++) {
      calls.add(gate.submit(probe::call));
    }
    CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).join();

    assertThat(probe.max.get()).isBetween(1, 2);
  }

  @Test
  void submit_shouldSerialiseWithSinglePermit() {
    SemaphoreGpuGate gate = gate(1, 1);
    ConcurrencyProbe probe = new ConcurrencyProbe();

    List<CompletableFuture<Integer>> calls = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      calls.add(gate.submit(probe::call));
    }
    CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).join();

    assertThat(probe.max.get()).isEqualTo(1);
  }

  @Test
  void submit_shouldReleasePermitWhenTaskFails() {
    SemaphoreGpuGate gate = gate(1, 2);

    CompletableFuture<Object> failing =
        gate.submit(
            () -> {
              throw new IllegalStateException("inference failed");
            });
    assertThatThrownBy(failing::join).hasCauseInstanceOf(IllegalStateException.class);

    assertThat(gate.submit(() -> "next").orTimeout(5, TimeUnit.SECONDS).join()).isEqualTo("next");
  }

  @Test
  void submit_shouldSkipCancelledTaskWithoutTakingPermit() throws InterruptedException {
    SemaphoreGpuGate gate = gate(1, 1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean ran = new AtomicBoolean();

    CompletableFuture<Boolean> busy = gate.submit(() -> release.await(5, TimeUnit.SECONDS));
    CompletableFuture<Boolean> abandoned = gate.submit(() -> ran.getAndSet(true));
    abandoned.cancel(false);
    release.countDown();
    gate.submit(() -> true).join();

    assertThat(busy.join()).isTrue();
    assertThat(ran).isFalse();
    assertThat(gate.stats().skipped()).isEqualTo(1);
    assertThat(gate.stats().permits()).isEqualTo(1);
  }

  @Test
  void constructor_shouldRequireAtLeastOnePermit() {
    workers = PoolTestSupport.executor(1, 1);

    assertThatThrownBy(() -> new SemaphoreGpuGate(0, workers))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
