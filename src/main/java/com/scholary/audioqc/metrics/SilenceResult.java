package com.scholary.audioqc.metrics;

/**
 * Outcome of silence detection.
 *
 * @param levelDbfs whole-signal RMS level in dBFS, at full precision
 * @param silent whether the audio is considered silent
 */
public record SilenceResult(double levelDbfs, boolean silent) {}
