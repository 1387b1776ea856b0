package com.scholary.audioqc.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.audioqc.gate.CpuPoolStats;
import com.scholary.audioqc.gate.GpuGateStats;
import java.util.List;

/** Body of {@code GET /v1/audio/health}. */
public record HealthSnapshot(
    String status,
    String version,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("uptime_seconds") long uptimeSeconds,
    @JsonProperty("uptime_formatted") String uptimeFormatted,
    long total,
    long success,
    long failed,
    int processing,
    int queued,
    @JsonProperty("processing_ids") List<String> processingIds,
    @JsonProperty("queued_ids") List<String> queuedIds,
    @JsonProperty("cpu_pool") CpuPoolStats cpuPool,
    @JsonProperty("gpu_gate") GpuGateStats gpuGate) {}
