package com.scholary.audioqc.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Aggregated clipping events, ordered by start time. */
public record ClipDetail(
    @JsonProperty("clip_count") int clipCount, @JsonProperty("times_ms") List<Double> timesMs) {

  public ClipDetail {
    timesMs = List.copyOf(timesMs);
    if (timesMs.size() != clipCount) {
      throw new IllegalArgumentException(
          String.format("clip_count %d does not match %d timestamps", clipCount, timesMs.size()));
    }
  }

  /** Build the detail for a list of events, or {@code null} when there are none. */
  public static ClipDetail of(List<ClipEvent> events) {
    if (events.isEmpty()) {
      return null;
    }
    return new ClipDetail(events.size(), events.stream().map(ClipEvent::startMs).toList());
  }
}
