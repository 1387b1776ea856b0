package com.scholary.audioqc.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class VadSegmentMergerTest {

  private static final List<VadSegment> TWO_CLOSE =
      List.of(new VadSegment(100, 500), new VadSegment(520, 900));

  @Test
  void merge_shouldJoinSegmentsWithinGap() {
    List<VadSegment> merged = new VadSegmentMerger(120).merge(TWO_CLOSE);

    assertThat(merged).containsExactly(new VadSegment(100, 900));
  }

  @Test
  void merge_shouldKeepSegmentsApartWhenGapTooLarge() {
    List<VadSegment> merged = new VadSegmentMerger(10).merge(TWO_CLOSE);

    assertThat(merged).containsExactly(new VadSegment(100, 500), new VadSegment(520, 900));
  }

  @Test
  void merge_shouldTreatGapEqualToThresholdAsMergeable() {
    List<VadSegment> merged = new VadSegmentMerger(20).merge(TWO_CLOSE);

    assertThat(merged).hasSize(1);
  }

  @Test
  void merge_shouldSortAndAbsorbOverlaps() {
    List<VadSegment> raw =
        List.of(
            new VadSegment(3000, 3500),
            new VadSegment(100, 800),
            new VadSegment(200, 400),
            new VadSegment(700, 1200));

    List<VadSegment> merged = new VadSegmentMerger(0).merge(raw);

    assertThat(merged).containsExactly(new VadSegment(100, 1200), new VadSegment(3000, 3500));
  }

  @Test
  void merge_shouldReturnEmptyForNoSegments() {
    assertThat(new VadSegmentMerger(120).merge(List.of())).isEmpty();
  }

  @Test
  void summarize_shouldSumDurationsNotSpan() {
    List<VadSegment> raw = List.of(new VadSegment(0, 1000), new VadSegment(5000, 6000));

    VadResult result = new VadSegmentMerger(120).summarize(raw);

    assertThat(result.speechMs()).isEqualTo(2000);
    assertThat(result.segments()).hasSize(2);
  }

  @Test
  void speechRatio_shouldRoundToFourDecimals() {
    assertThat(VadSegmentMerger.speechRatio(1, 3)).isEqualTo(0.3333);
    assertThat(VadSegmentMerger.speechRatio(2, 3)).isEqualTo(0.6667);
  }

  @Test
  void speechRatio_shouldClampToUnitInterval() {
    assertThat(VadSegmentMerger.speechRatio(5000, 4000)).isEqualTo(1.0);
    assertThat(VadSegmentMerger.speechRatio(0, 4000)).isEqualTo(0.0);
    assertThat(VadSegmentMerger.speechRatio(10, 0)).isEqualTo(1.0);
  }

  @Test
  void segment_shouldRejectEmptyOrInvertedInterval() {
    assertThatThrownBy(() -> new VadSegment(500, 500)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new VadSegment(500, 100)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new VadSegment(-1, 100)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectNegativeGap() {
    assertThatThrownBy(() -> new VadSegmentMerger(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
