package com.scholary.audioqc.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcTaskDecoratorTest {

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void decorate_shouldCarrySubmitterContextToWorker() throws Exception {
    StructuredLogger.setRequestContext("req-9");
    AtomicReference<String> seen = new AtomicReference<>();
    Runnable task = new MdcTaskDecorator().decorate(() -> seen.set(MDC.get("requestId")));
    StructuredLogger.clearRequestContext();

    Thread worker = new Thread(task);
    worker.start();
    worker.join();

    assertThat(seen.get()).isEqualTo("req-9");
  }

  @Test
  void decorate_shouldRestoreWorkerContextAfterTask() {
    Runnable task = new MdcTaskDecorator().decorate(() -> MDC.put("requestId", "inside"));
    MDC.put("requestId", "worker-own");

    task.run();

    assertThat(MDC.get("requestId")).isEqualTo("worker-own");
  }
}
