package com.scholary.audioqc.metrics;

/**
 * One clipping event: a run of consecutive samples at or above the clip threshold.
 *
 * @param startSample index of the first clipped sample
 * @param startMs start time in milliseconds, rounded to 4 decimals
 * @param lengthSamples number of samples in the run
 */
public record ClipEvent(long startSample, double startMs, int lengthSamples) {}
