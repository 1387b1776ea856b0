package com.scholary.audioqc.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time view of the GPU gate. */
public record GpuGateStats(
    int permits,
    @JsonProperty("available_permits") int availablePermits,
    @JsonProperty("in_flight") int inFlight,
    long completed,
    long skipped) {}
