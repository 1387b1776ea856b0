package com.scholary.audioqc.config;

import com.scholary.audioqc.decode.AudioDecoder;
import com.scholary.audioqc.decode.DecodeStage;
import com.scholary.audioqc.gate.CpuPool;
import com.scholary.audioqc.gate.ExecutorCpuPool;
import com.scholary.audioqc.gate.GpuGate;
import com.scholary.audioqc.gate.SemaphoreGpuGate;
import com.scholary.audioqc.metrics.ClarityScorer;
import com.scholary.audioqc.metrics.ClippingDetector;
import com.scholary.audioqc.metrics.SilenceDetector;
import com.scholary.audioqc.metrics.VadSegmentMerger;
import com.scholary.audioqc.monitoring.ServiceStats;
import com.scholary.audioqc.service.QcOrchestrator;
import com.scholary.audioqc.service.ResponseAssembler;
import com.scholary.audioqc.vad.VadEngine;
import com.scholary.audioqc.vad.VadProperties;
import com.scholary.audioqc.vad.VadWarmup;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the QC pipeline from {@link AudioQcProperties}.
 *
 * <p>The metric components are plain objects built from configuration here rather than scanned
 * components, so tests can build them with any settings.
 */
@Configuration
@EnableConfigurationProperties(AudioQcProperties.class)
public class AudioQcConfig {

  @Bean
  public SilenceDetector silenceDetector(AudioQcProperties properties) {
    AudioQcProperties.Silence silence = properties.silence();
    return new SilenceDetector(
        silence.dbfs(), silence.mode(), silence.frameMs(), silence.hopMs(), silence.activeRatio());
  }

  @Bean
  public ClippingDetector clippingDetector(AudioQcProperties properties) {
    return new ClippingDetector(
        properties.clipping().clipThreshold(), properties.clipping().minEventSamples());
  }

  @Bean
  public ClarityScorer clarityScorer(AudioQcProperties properties) {
    return new ClarityScorer(properties.clarity().toSettings());
  }

  @Bean
  public VadSegmentMerger vadSegmentMerger(AudioQcProperties properties) {
    return new VadSegmentMerger(properties.mergeGapMs());
  }

  @Bean
  public ResponseAssembler responseAssembler(AudioQcProperties properties) {
    return new ResponseAssembler(
        properties.needClarity(), properties.returnSegments(), properties.minSpeechMs());
  }

  @Bean
  public DecodeStage decodeStage(AudioDecoder audioDecoder, AudioQcProperties properties) {
    return new DecodeStage(
        audioDecoder,
        properties.maxFileSizeMb(),
        properties.minDurationMs(),
        properties.maxDurationMs());
  }

  @Bean
  public CpuPool cpuPool(@Qualifier("cpuTaskExecutor") ThreadPoolTaskExecutor cpuTaskExecutor) {
    return new ExecutorCpuPool(cpuTaskExecutor);
  }

  @Bean
  public GpuGate gpuGate(
      AudioQcProperties properties,
      @Qualifier("vadTaskExecutor") ThreadPoolTaskExecutor vadTaskExecutor) {
    return new SemaphoreGpuGate(properties.gpuInferConcurrency(), vadTaskExecutor);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ServiceStats serviceStats(
      CpuPool cpuPool, GpuGate gpuGate, AudioQcProperties properties, Clock clock) {
    return new ServiceStats(cpuPool, gpuGate, properties.serviceVersion(), clock);
  }

  @Bean
  public QcOrchestrator qcOrchestrator(
      DecodeStage decodeStage,
      SilenceDetector silenceDetector,
      ClippingDetector clippingDetector,
      ClarityScorer clarityScorer,
      VadEngine vadEngine,
      VadSegmentMerger vadSegmentMerger,
      ResponseAssembler responseAssembler,
      CpuPool cpuPool,
      GpuGate gpuGate,
      ServiceStats serviceStats,
      AudioQcProperties properties) {
    return new QcOrchestrator(
        decodeStage,
        silenceDetector,
        clippingDetector,
        clarityScorer,
        vadEngine,
        vadSegmentMerger,
        responseAssembler,
        cpuPool,
        gpuGate,
        serviceStats,
        Path.of(properties.tempDir()));
  }

  @Bean
  public VadWarmup vadWarmup(
      GpuGate gpuGate,
      VadEngine vadEngine,
      AudioQcProperties properties,
      VadProperties vadProperties) {
    return new VadWarmup(
        gpuGate, vadEngine, properties.vadNumWorkers(), vadProperties.warmupOnStartup());
  }
}
