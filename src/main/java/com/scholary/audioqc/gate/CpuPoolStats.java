package com.scholary.audioqc.gate;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time view of the CPU pool. */
public record CpuPoolStats(
    int workers,
    @JsonProperty("in_flight") int inFlight,
    long completed,
    long skipped) {}
