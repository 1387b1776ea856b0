package com.scholary.audioqc.config;

import com.scholary.audioqc.metrics.ClaritySettings;
import com.scholary.audioqc.metrics.ClarityWeights;
import com.scholary.audioqc.metrics.SilenceMode;
import com.scholary.audioqc.metrics.TwoSegmentRamp;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audio QC.
 *
 * <p>Loaded once at start-up and shared read-only by every request. Field constraints are checked
 * by bean validation; rules that span fields are checked in the compact constructors, so a bad
 * combination fails start-up as well.
 */
@ConfigurationProperties(prefix = "audio-qc")
@Validated
public record AudioQcProperties(
    @Positive int threadpoolWorkers,
    @Positive int gpuInferConcurrency,
    @Positive int vadNumWorkers,
    @Positive long maxFileSizeMb,
    @PositiveOrZero long minDurationMs,
    @Positive long maxDurationMs,
    boolean needClarity,
    boolean returnSegments,
    @PositiveOrZero long mergeGapMs,
    @PositiveOrZero long minSpeechMs,
    @NotBlank String tempDir,
    @NotBlank String serviceVersion,
    @NotNull @Valid Silence silence,
    @NotNull @Valid Clipping clipping,
    @NotNull @Valid Clarity clarity) {

  public AudioQcProperties {
    if (minDurationMs > maxDurationMs) {
      throw new IllegalArgumentException(
          String.format(
              "audio-qc.min-duration-ms (%d) must not exceed max-duration-ms (%d)",
              minDurationMs, maxDurationMs));
    }
  }

  /**
   * @param dbfs level at or below which audio is silent
   * @param mode whole-signal RMS or per-frame classification
   * @param activeRatio FRAMES mode: minimum share of active frames for non-silent audio
   */
  public record Silence(
      @DecimalMax("0") double dbfs,
      @NotNull SilenceMode mode,
      @Positive int frameMs,
      @Positive int hopMs,
      @DecimalMin("0") @DecimalMax("1") double activeRatio) {}

  public record Clipping(
      @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false)
          double clipThreshold,
      @Positive int minEventSamples) {}

  public record Clarity(
      @Positive int winMs,
      @Positive int hopMs,
      @PositiveOrZero double hfLoHz,
      @Positive double hfHiHz,
      double snrMinDb,
      double snrMaxDb,
      double snrMinDb2,
      double snrMaxDb2,
      @Positive double hfRef,
      @Positive double hfRef2L,
      @Positive double hfRef2H,
      @Positive double flatRef,
      @PositiveOrZero double wSnr,
      @PositiveOrZero double wHf,
      @PositiveOrZero double wFlat,
      @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") double noiseFrameFraction,
      @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") double signalFrameFraction) {

    public Clarity {
      // ramp ordering and weight sum are enforced by the metric types themselves
      snrRamp(snrMinDb, snrMaxDb, snrMinDb2, snrMaxDb2);
      hfRamp(hfRef, hfRef2L, hfRef2H);
      new ClarityWeights(wSnr, wHf, wFlat);
    }

    public ClaritySettings toSettings() {
      return new ClaritySettings(
          winMs,
          hopMs,
          hfLoHz,
          hfHiHz,
          snrRamp(snrMinDb, snrMaxDb, snrMinDb2, snrMaxDb2),
          hfRamp(hfRef, hfRef2L, hfRef2H),
          flatRef,
          new ClarityWeights(wSnr, wHf, wFlat),
          noiseFrameFraction,
          signalFrameFraction);
    }

    private static TwoSegmentRamp snrRamp(double min, double max, double min2, double max2) {
      return new TwoSegmentRamp(min, max, min2, max2);
    }

    private static TwoSegmentRamp hfRamp(double ref, double ref2L, double ref2H) {
      return new TwoSegmentRamp(0.0, ref, ref2L, ref2H);
    }
  }
}
