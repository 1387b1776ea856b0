package com.scholary.audioqc.metrics;

import static com.scholary.audioqc.metrics.TestSignals.SAMPLE_RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SilenceDetectorTest {

  private final SilenceDetector detector = new SilenceDetector(-60.0);

  @Test
  void detect_shouldFlagDigitalSilence() {
    SilenceResult result = detector.detect(new float[SAMPLE_RATE], SAMPLE_RATE);

    assertThat(result.silent()).isTrue();
    assertThat(result.levelDbfs()).isCloseTo(-120.0, within(1e-6));
  }

  @Test
  void detect_shouldReportZeroDbfsForFullScale() {
    SilenceResult result = detector.detect(TestSignals.constant(1.0f, SAMPLE_RATE), SAMPLE_RATE);

    assertThat(result.silent()).isFalse();
    assertThat(result.levelDbfs()).isCloseTo(0.0, within(1e-6));
  }

  @Test
  void detect_shouldTreatQuietSignalBelowThresholdAsSilent() {
    // 0.0005 full scale is about -66 dBFS
    SilenceResult result = detector.detect(TestSignals.constant(0.0005f, SAMPLE_RATE), SAMPLE_RATE);

    assertThat(result.levelDbfs()).isCloseTo(-66.02, within(0.01));
    assertThat(result.silent()).isTrue();
  }

  @Test
  void detect_shouldTreatSpeechLevelSignalAsNotSilent() {
    SilenceResult result = detector.detect(TestSignals.sine(440, 0.3, SAMPLE_RATE), SAMPLE_RATE);

    assertThat(result.silent()).isFalse();
    assertThat(result.levelDbfs()).isBetween(-14.0, -13.0);
  }

  @Test
  void detect_shouldRejectEmptyInput() {
    assertThatThrownBy(() -> detector.detect(new float[0], SAMPLE_RATE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void framesMode_shouldIgnoreShortBurstThatRmsModeCounts() {
    float[] samples = new float[SAMPLE_RATE];
    for (int i = 8000; i < 8160; i++) {
      samples[i] = 0.5f;
    }
    SilenceDetector frames = new SilenceDetector(-60.0, SilenceMode.FRAMES, 20, 10, 0.05);

    assertThat(detector.detect(samples, SAMPLE_RATE).silent()).isFalse();
    assertThat(frames.detect(samples, SAMPLE_RATE).silent()).isTrue();
  }

  @Test
  void framesMode_shouldFallBackToRmsWhenShorterThanOneFrame() {
    SilenceDetector frames = new SilenceDetector(-60.0, SilenceMode.FRAMES, 20, 10, 0.05);

    assertThat(frames.detect(TestSignals.constant(0.5f, 100), SAMPLE_RATE).silent()).isFalse();
    assertThat(frames.detect(new float[100], SAMPLE_RATE).silent()).isTrue();
  }
}
