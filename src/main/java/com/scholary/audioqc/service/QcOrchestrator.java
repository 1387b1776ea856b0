package com.scholary.audioqc.service;

import com.scholary.audioqc.decode.DecodeException;
import com.scholary.audioqc.decode.DecodeStage;
import com.scholary.audioqc.decode.DecodedAudio;
import com.scholary.audioqc.gate.CpuPool;
import com.scholary.audioqc.gate.GpuGate;
import com.scholary.audioqc.logging.StructuredLogger;
import com.scholary.audioqc.metrics.ClarityResult;
import com.scholary.audioqc.metrics.ClarityScorer;
import com.scholary.audioqc.metrics.ClipEvent;
import com.scholary.audioqc.metrics.ClippingDetector;
import com.scholary.audioqc.metrics.SilenceDetector;
import com.scholary.audioqc.metrics.SilenceResult;
import com.scholary.audioqc.metrics.VadResult;
import com.scholary.audioqc.metrics.VadSegmentMerger;
import com.scholary.audioqc.monitoring.ServiceStats;
import com.scholary.audioqc.storage.TempWorkspace;
import com.scholary.audioqc.storage.UploadSource;
import com.scholary.audioqc.vad.VadEngine;
import com.scholary.audioqc.vad.VadException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one uploaded file through the QC pipeline.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Presence and size checks, on the calling thread
 *   <li>Stage the upload into a per-request workspace, on the calling thread
 *   <li>Decode on the CPU pool; the workspace is deleted as soon as decode ends
 *   <li>Silence, clipping and clarity as independent CPU tasks, in parallel with VAD behind the
 *       GPU gate
 *   <li>Assemble once both branches succeed
 * </ol>
 *
 * <p>{@link #submit} never blocks on a pool. Expected failures complete the ticket with an in-band
 * status code; anything else completes it exceptionally.
 */
public class QcOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(QcOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final DecodeStage decodeStage;
  private final SilenceDetector silenceDetector;
  private final ClippingDetector clippingDetector;
  private final ClarityScorer clarityScorer;
  private final VadEngine vadEngine;
  private final VadSegmentMerger segmentMerger;
  private final ResponseAssembler assembler;
  private final CpuPool cpuPool;
  private final GpuGate gpuGate;
  private final ServiceStats stats;
  private final Path tempDir;

  public QcOrchestrator(
      DecodeStage decodeStage,
      SilenceDetector silenceDetector,
      ClippingDetector clippingDetector,
      ClarityScorer clarityScorer,
      VadEngine vadEngine,
      VadSegmentMerger segmentMerger,
      ResponseAssembler assembler,
      CpuPool cpuPool,
      GpuGate gpuGate,
      ServiceStats stats,
      Path tempDir) {
    this.decodeStage = decodeStage;
    this.silenceDetector = silenceDetector;
    this.clippingDetector = clippingDetector;
    this.clarityScorer = clarityScorer;
    this.vadEngine = vadEngine;
    this.segmentMerger = segmentMerger;
    this.assembler = assembler;
    this.cpuPool = cpuPool;
    this.gpuGate = gpuGate;
    this.stats = stats;
    this.tempDir = tempDir;
  }

  /**
   * Admit a request.
   *
   * @throws UncheckedIOException if the upload cannot be staged to disk
   */
  public QcTicket submit(QcRequest request) {
    String requestId = RequestIds.next(request.audioId());
    long startNanos = System.nanoTime();
    StructuredLogger.setRequestContext(requestId);
    try {
      QcExecution execution = new QcExecution(requestId);
      stats.requestReceived(requestId);
      LOGGER.info("Received QC request: filename={}", request.originalFilename());

      UploadSource source = request.source();
      try {
        decodeStage.validateUpload(source != null, source == null ? 0 : source.size());
      } catch (DecodeException e) {
        return QcTicket.completed(execution, rejected(execution, e, startNanos));
      }
      execution.markValidated();

      TempWorkspace workspace = openWorkspace(requestId);
      Path input = stageUpload(requestId, workspace, source, request.originalFilename());
      return start(execution, workspace, input, startNanos);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Record a request that was refused before it reached {@link #submit}, e.g. by the servlet
   * container's upload limit.
   */
  public QcResponse reject(String audioId, StatusCode statusCode) {
    String requestId = RequestIds.next(audioId);
    StructuredLogger.setRequestContext(requestId);
    try {
      stats.requestReceived(requestId);
      stats.requestFailed(requestId);
      structuredLogger.logStageFailed("validate", statusCode.code(), "rejected before admission");
      structuredLogger.logRequestCompleted(statusCode.code(), 0);
      return QcResponse.failure(requestId, statusCode);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private TempWorkspace openWorkspace(String requestId) {
    try {
      return TempWorkspace.create(tempDir);
    } catch (IOException e) {
      stats.requestFailed(requestId);
      throw new UncheckedIOException("Failed to create request workspace", e);
    }
  }

  private Path stageUpload(
      String requestId, TempWorkspace workspace, UploadSource source, String originalFilename) {
    try {
      return workspace.stage(source, originalFilename);
    } catch (IOException e) {
      workspace.close();
      stats.requestFailed(requestId);
      throw new UncheckedIOException("Failed to stage upload", e);
    }
  }

  private QcTicket start(
      QcExecution execution, TempWorkspace workspace, Path input, long startNanos) {
    QcTicket ticket = new QcTicket(execution);
    AtomicBoolean workspaceClaimed = new AtomicBoolean();

    CompletableFuture<DecodedAudio> decoded =
        ticket.track(
            cpuPool.submit(
                () -> {
                  if (!workspaceClaimed.compareAndSet(false, true)) {
                    throw new CancellationException("Request abandoned before decode");
                  }
                  try {
                    return decode(execution, input, workspace);
                  } finally {
                    workspace.close();
                  }
                }));

    CompletableFuture<SignalMetrics> metrics =
        decoded.thenCompose(audio -> computeMetrics(ticket, execution, audio));
    CompletableFuture<VadResult> vad = decoded.thenCompose(audio -> runVad(ticket, execution, audio));

    metrics
        .thenCombine(vad, (m, v) -> assemble(execution, decoded.join(), m, v))
        .whenComplete(
            (response, error) -> {
              if (workspaceClaimed.compareAndSet(false, true)) {
                workspace.close();
              }
              finish(ticket, execution, response, error, startNanos);
            });
    return ticket;
  }

  private DecodedAudio decode(QcExecution execution, Path input, TempWorkspace workspace) {
    stats.requestStarted(execution.requestId());
    structuredLogger.logStageStarted("decode");
    long t0 = System.nanoTime();

    DecodedAudio audio = decodeStage.decode(input, workspace.directory());
    execution.markDecoded();

    structuredLogger.logStageFinished("decode", elapsedMs(t0));
    return audio;
  }

  private CompletableFuture<SignalMetrics> computeMetrics(
      QcTicket ticket, QcExecution execution, DecodedAudio audio) {
    structuredLogger.logStageStarted("metrics");
    long t0 = System.nanoTime();
    float[] samples = audio.samples();
    int sampleRate = audio.sampleRate();

    CompletableFuture<SilenceResult> silence =
        ticket.track(cpuPool.submit(() -> silenceDetector.detect(samples, sampleRate)));
    CompletableFuture<List<ClipEvent>> clips =
        ticket.track(cpuPool.submit(() -> clippingDetector.detect(samples, sampleRate)));
    CompletableFuture<ClarityResult> clarity =
        assembler.needClarity()
            ? ticket.track(cpuPool.submit(() -> clarityScorer.score(samples, sampleRate)))
            : CompletableFuture.completedFuture(null);

    return CompletableFuture.allOf(silence, clips, clarity)
        .thenApply(
            ignored -> {
              SignalMetrics result =
                  new SignalMetrics(silence.join(), clips.join(), clarity.join());
              execution.markMetricsDone();
              structuredLogger.logStageFinished("metrics", elapsedMs(t0));
              return result;
            });
  }

  private CompletableFuture<VadResult> runVad(
      QcTicket ticket, QcExecution execution, DecodedAudio audio) {
    structuredLogger.logStageStarted("vad");
    long t0 = System.nanoTime();

    return ticket
        .track(gpuGate.submit(() -> vadEngine.detect(audio.samples(), audio.sampleRate())))
        .thenApply(
            raw -> {
              VadResult result = segmentMerger.summarize(raw);
              execution.markVadDone();
              LOGGER.debug("Merged VAD segments: {}", result.segments());
              structuredLogger.logStageFinished("vad", elapsedMs(t0));
              return result;
            });
  }

  private QcResponse assemble(
      QcExecution execution, DecodedAudio audio, SignalMetrics metrics, VadResult vad) {
    QcResult result = assembler.assemble(audio, metrics, vad);
    execution.markAssembled();
    return QcResponse.success(execution.requestId(), result);
  }

  private void finish(
      QcTicket ticket,
      QcExecution execution,
      QcResponse response,
      Throwable error,
      long startNanos) {
    String requestId = execution.requestId();
    if (error == null) {
      stats.requestSucceeded(requestId);
      structuredLogger.logRequestCompleted(StatusCode.OK.code(), elapsedMs(startNanos));
      ticket.complete(response);
      return;
    }

    Throwable cause = unwrap(error);
    if (cause instanceof QcException qcException) {
      StatusCode code = qcException.getStatusCode();
      execution.fail(code);
      stats.requestFailed(requestId);
      structuredLogger.logStageFailed(stageOf(qcException), code.code(), cause.getMessage());
      structuredLogger.logRequestCompleted(code.code(), elapsedMs(startNanos));
      ticket.complete(QcResponse.failure(requestId, code));
    } else if (cause instanceof CancellationException) {
      execution.markAbandoned();
      stats.requestFailed(requestId);
      LOGGER.info("Request {} abandoned by caller in state {}", requestId, execution.state());
      ticket.fail(cause);
    } else {
      stats.requestFailed(requestId);
      LOGGER.error("Internal error processing request {}", requestId, cause);
      ticket.fail(cause);
    }
  }

  private static String stageOf(QcException e) {
    if (e instanceof DecodeException) {
      return "decode";
    }
    if (e instanceof VadException) {
      return "vad";
    }
    return "pipeline";
  }

  private static Throwable unwrap(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private QcResponse rejected(QcExecution execution, DecodeException e, long startNanos) {
    execution.fail(e.getStatusCode());
    stats.requestFailed(execution.requestId());
    structuredLogger.logStageFailed("validate", e.getStatusCode().code(), e.getMessage());
    structuredLogger.logRequestCompleted(e.getStatusCode().code(), elapsedMs(startNanos));
    return QcResponse.failure(execution.requestId(), e.getStatusCode());
  }
}
