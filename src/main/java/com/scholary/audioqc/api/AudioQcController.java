package com.scholary.audioqc.api;

import com.scholary.audioqc.service.QcOrchestrator;
import com.scholary.audioqc.service.QcRequest;
import com.scholary.audioqc.service.QcResponse;
import com.scholary.audioqc.service.QcTicket;
import com.scholary.audioqc.storage.MultipartUploadSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for audio quality checks.
 *
 * <p>The servlet thread only validates and stages the upload; the analysis itself completes a
 * {@link DeferredResult}. If the client goes away or the async timeout fires first, the request is
 * abandoned and any of its work still queued is skipped.
 */
@RestController
@RequestMapping("/v1/audio")
@Tag(name = "Audio QC", description = "Silence, speech, clipping, clarity and VAD checks")
public class AudioQcController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioQcController.class);

  private final QcOrchestrator orchestrator;

  public AudioQcController(QcOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/qc")
  @Operation(
      summary = "Analyse an uploaded audio file",
      description =
          "Always answers HTTP 200 with {request_id, status_code, data}. "
              + "status_code 200 carries the full report; any other code carries data={}.")
  public DeferredResult<QcResponse> qc(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "audio_id", required = false) String audioId) {

    String filename = file == null ? null : file.getOriginalFilename();
    QcTicket ticket =
        orchestrator.submit(
            new QcRequest(audioId, filename, file == null ? null : new MultipartUploadSource(file)));

    DeferredResult<QcResponse> result = new DeferredResult<>();
    result.onTimeout(
        () -> {
          LOGGER.warn("Request {} timed out, abandoning", ticket.requestId());
          ticket.abandon();
        });
    result.onError(
        error -> {
          LOGGER.warn("Request {} connection error, abandoning: {}", ticket.requestId(), error.getMessage());
          ticket.abandon();
        });

    ticket
        .response()
        .whenComplete(
            (response, error) -> {
              if (error == null) {
                result.setResult(response);
                return;
              }
              Throwable cause = error instanceof CompletionException ? error.getCause() : error;
              if (!(cause instanceof CancellationException)) {
                result.setErrorResult(new QcProcessingException(ticket.requestId(), cause));
              }
            });
    return result;
  }
}
