package com.scholary.audioqc.vad;

import com.scholary.audioqc.gate.GpuGate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Pushes one short silent clip per VAD worker through the GPU gate once the application is up.
 *
 * <p>The first inference on a cold model is slow; paying it here keeps it off a real request. A
 * failed warm-up fails start-up.
 */
public class VadWarmup {

  private static final Logger LOGGER = LoggerFactory.getLogger(VadWarmup.class);

  static final int WARMUP_SAMPLE_RATE = 16000;
  static final int WARMUP_SAMPLES = WARMUP_SAMPLE_RATE / 10;

  private final GpuGate gpuGate;
  private final VadEngine vadEngine;
  private final int workers;
  private final boolean enabled;

  public VadWarmup(GpuGate gpuGate, VadEngine vadEngine, int workers, boolean enabled) {
    this.gpuGate = gpuGate;
    this.vadEngine = vadEngine;
    this.workers = workers;
    this.enabled = enabled;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!enabled) {
      LOGGER.info("VAD warm-up disabled");
      return;
    }
    warmUp();
  }

  void warmUp() {
    LOGGER.info("Warming up {} VAD worker(s)", workers);
    List<CompletableFuture<?>> calls = new ArrayList<>();
    for (int i = 0; i < workers; i++) {
      calls.add(
          gpuGate.submit(() -> vadEngine.detect(new float[WARMUP_SAMPLES], WARMUP_SAMPLE_RATE)));
    }
    try {
      CompletableFuture.allOf(calls.toArray(new CompletableFuture<?>[0])).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("VAD warm-up interrupted", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("VAD warm-up failed: " + e.getCause().getMessage(), e.getCause());
    }
    LOGGER.info("VAD warm-up complete");
  }
}
