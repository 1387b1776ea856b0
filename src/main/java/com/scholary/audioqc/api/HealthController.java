package com.scholary.audioqc.api;

import com.scholary.audioqc.monitoring.HealthSnapshot;
import com.scholary.audioqc.monitoring.ServiceStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Process-wide request counters. */
@RestController
@RequestMapping("/v1/audio")
@Tag(name = "Health", description = "Service counters and pool status")
public class HealthController {

  private final ServiceStats stats;

  public HealthController(ServiceStats stats) {
    this.stats = stats;
  }

  @GetMapping("/health")
  @Operation(summary = "Request counters, uptime and pool status")
  public HealthSnapshot health() {
    return stats.snapshot();
  }
}
