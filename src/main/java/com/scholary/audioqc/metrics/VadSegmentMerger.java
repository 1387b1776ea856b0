package com.scholary.audioqc.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges raw VAD intervals and derives the speech totals.
 *
 * <p>Raw intervals are sorted by start time; any interval that starts within {@code mergeGapMs}
 * of the end of the previous merged interval (overlaps included) is folded into it.
 */
public class VadSegmentMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(VadSegmentMerger.class);

  private final long mergeGapMs;

  public VadSegmentMerger(long mergeGapMs) {
    if (mergeGapMs < 0) {
      throw new IllegalArgumentException("mergeGapMs must be >= 0");
    }
    this.mergeGapMs = mergeGapMs;
  }

  /**
   * Merge raw segments.
   *
   * @param raw segments in any order, possibly overlapping
   * @return ordered, non-overlapping segments
   */
  public List<VadSegment> merge(List<VadSegment> raw) {
    if (raw.isEmpty()) {
      return List.of();
    }

    List<VadSegment> sorted = new ArrayList<>(raw);
    sorted.sort(Comparator.comparingLong(VadSegment::startMs).thenComparingLong(VadSegment::endMs));

    List<VadSegment> merged = new ArrayList<>();
    VadSegment current = sorted.get(0);
    for (int i = 1; i < sorted.size(); i++) {
      VadSegment next = sorted.get(i);
      if (current.gapTo(next) <= mergeGapMs) {
        current = new VadSegment(current.startMs(), Math.max(current.endMs(), next.endMs()));
      } else {
        merged.add(current);
        current = next;
      }
    }
    merged.add(current);

    LOGGER.debug("Merged {} raw VAD segments into {} (mergeGapMs={})", raw.size(), merged.size(), mergeGapMs);
    return List.copyOf(merged);
  }

  /** Merge, then total the speech time. */
  public VadResult summarize(List<VadSegment> raw) {
    List<VadSegment> merged = merge(raw);
    return new VadResult(merged, speechMs(merged));
  }

  public static long speechMs(List<VadSegment> segments) {
    long total = 0;
    for (VadSegment segment : segments) {
      total += segment.durationMs();
    }
    return total;
  }

  /**
   * Fraction of the audio covered by speech, clamped to [0, 1] and rounded to 4 decimals.
   *
   * @param speechMs total merged speech time
   * @param durationMs decoded audio duration
   */
  public static double speechRatio(long speechMs, long durationMs) {
    double ratio = (double) speechMs / Math.max(1L, durationMs);
    return MetricRounding.round4(MetricRounding.clamp01(ratio));
  }
}
