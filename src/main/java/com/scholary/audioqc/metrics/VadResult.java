package com.scholary.audioqc.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Merged VAD output for one request.
 *
 * <p>{@code speechMs} is the sum of the merged segment durations, not the span from the first
 * start to the last end.
 */
public record VadResult(
    @JsonProperty("segments_ms") List<VadSegment> segments,
    @JsonProperty("speech_ms") long speechMs) {

  public VadResult {
    segments = List.copyOf(segments);
  }

  /** Same speech total with the segment list dropped. */
  public VadResult withoutSegments() {
    return new VadResult(List.of(), speechMs);
  }
}
