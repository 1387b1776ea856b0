package com.scholary.audioqc.metrics;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * A speech interval reported by the VAD engine, in milliseconds from the start of the audio.
 *
 * <p>Serialized as a two-element array {@code [start_ms, end_ms]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
public record VadSegment(long startMs, long endMs) {

  public VadSegment {
    if (startMs < 0) {
      throw new IllegalArgumentException("Segment start cannot be negative: " + startMs);
    }
    if (endMs <= startMs) {
      throw new IllegalArgumentException(
          String.format("Segment end must be after start: [%d, %d]", startMs, endMs));
    }
  }

  public long durationMs() {
    return endMs - startMs;
  }

  /**
   * Gap between the end of this segment and the start of the next one.
   *
   * <p>Negative when the two segments overlap.
   */
  public long gapTo(VadSegment next) {
    return next.startMs - this.endMs;
  }
}
