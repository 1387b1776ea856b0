package com.scholary.audioqc.metrics;

/**
 * Composite clarity in [0, 100] (rounded to 4 decimals) with its breakdown.
 */
public record ClarityResult(double clarity, ClarityDetail detail) {}
