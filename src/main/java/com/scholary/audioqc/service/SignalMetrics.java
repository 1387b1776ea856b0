package com.scholary.audioqc.service;

import com.scholary.audioqc.metrics.ClarityResult;
import com.scholary.audioqc.metrics.ClipEvent;
import com.scholary.audioqc.metrics.SilenceResult;
import java.util.List;

/**
 * Output of the CPU metrics branch.
 *
 * @param clarity {@code null} when clarity is disabled
 */
public record SignalMetrics(SilenceResult silence, List<ClipEvent> clips, ClarityResult clarity) {

  public SignalMetrics {
    clips = List.copyOf(clips);
  }
}
