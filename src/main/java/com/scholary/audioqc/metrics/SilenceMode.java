package com.scholary.audioqc.metrics;

/** How silence is decided. */
public enum SilenceMode {
  /** Whole-signal RMS level against the threshold. */
  RMS,
  /** Share of frames whose level exceeds the threshold. */
  FRAMES
}
