package com.scholary.audioqc.monitoring;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audioqc.gate.CpuPool;
import com.scholary.audioqc.gate.GpuGate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide request counters.
 *
 * <p>Created once at start-up and injected wherever requests change state; nothing resets it short
 * of a restart. A request is counted in {@code queued} from admission until its decode starts on
 * the CPU pool, then in {@code processing} until it finishes. Abandoned requests count as failed.
 *
 * <p>Health snapshots are cached briefly so a polling monitor doesn't sort the id sets on every
 * call; any counter change invalidates the cached snapshot.
 */
public class ServiceStats {

  private static final Logger LOGGER = LoggerFactory.getLogger(ServiceStats.class);

  static final Duration SNAPSHOT_TTL = Duration.ofMillis(500);
  private static final String SNAPSHOT_KEY = "health";

  private final CpuPool cpuPool;
  private final GpuGate gpuGate;
  private final String version;
  private final Clock clock;
  private final Instant startTime;

  private final AtomicLong total = new AtomicLong();
  private final AtomicLong success = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final Set<String> queuedIds = ConcurrentHashMap.newKeySet();
  private final Set<String> processingIds = ConcurrentHashMap.newKeySet();

  private final Cache<String, HealthSnapshot> snapshots;

  public ServiceStats(CpuPool cpuPool, GpuGate gpuGate, String version, Clock clock) {
    this.cpuPool = cpuPool;
    this.gpuGate = gpuGate;
    this.version = version;
    this.clock = clock;
    this.startTime = clock.instant();
    this.snapshots = Caffeine.newBuilder().maximumSize(1).expireAfterWrite(SNAPSHOT_TTL).build();

    LOGGER.info("Service stats started at {}", startTime);
  }

  public void requestReceived(String requestId) {
    total.incrementAndGet();
    queuedIds.add(requestId);
    snapshots.invalidateAll();
  }

  /** Moves a queued request to processing; no-op if the request already finished. */
  public synchronized void requestStarted(String requestId) {
    if (queuedIds.remove(requestId)) {
      processingIds.add(requestId);
    }
    snapshots.invalidateAll();
  }

  public void requestSucceeded(String requestId) {
    finish(requestId);
    success.incrementAndGet();
    snapshots.invalidateAll();
  }

  public void requestFailed(String requestId) {
    finish(requestId);
    failed.incrementAndGet();
    snapshots.invalidateAll();
  }

  private synchronized void finish(String requestId) {
    queuedIds.remove(requestId);
    processingIds.remove(requestId);
  }

  public HealthSnapshot snapshot() {
    return snapshots.get(SNAPSHOT_KEY, key -> buildSnapshot());
  }

  private HealthSnapshot buildSnapshot() {
    long uptimeSeconds = Math.max(0, Duration.between(startTime, clock.instant()).getSeconds());
    List<String> processing = processingIds.stream().sorted().toList();
    List<String> queued = queuedIds.stream().sorted().toList();

    return new HealthSnapshot(
        "ok",
        version,
        startTime.toString(),
        uptimeSeconds,
        formatUptime(uptimeSeconds),
        total.get(),
        success.get(),
        failed.get(),
        processing.size(),
        queued.size(),
        processing,
        queued,
        cpuPool.stats(),
        gpuGate.stats());
  }

  /** Formats seconds as {@code 1d 2h 3m 4s}, leaving out leading zero units. */
  static String formatUptime(long seconds) {
    long days = seconds / 86_400;
    long hours = (seconds % 86_400) / 3_600;
    long minutes = (seconds % 3_600) / 60;
    long secs = seconds % 60;

    StringBuilder sb = new StringBuilder();
    if (days > 0) {
      sb.append(days).append("d ");
    }
    if (days > 0 || hours > 0) {
      sb.append(hours).append("h ");
    }
    if (days > 0 || hours > 0 || minutes > 0) {
      sb.append(minutes).append("m ");
    }
    sb.append(secs).append('s');
    return sb.toString();
  }
}
