package com.scholary.audioqc.service;

import com.scholary.audioqc.decode.DecodedAudio;
import com.scholary.audioqc.metrics.ClarityResult;
import com.scholary.audioqc.metrics.ClipDetail;
import com.scholary.audioqc.metrics.MetricRounding;
import com.scholary.audioqc.metrics.VadResult;
import com.scholary.audioqc.metrics.VadSegmentMerger;

/**
 * Combines both branches into a {@link QcResult} and applies the response-shaping flags.
 *
 * <p>{@code needClarity=false} nulls {@code clarity} and {@code clarity_detail} whatever was
 * computed. {@code returnSegments=false} empties {@code vad.segments_ms} but keeps {@code
 * vad.speech_ms}.
 */
public class ResponseAssembler {

  private final boolean needClarity;
  private final boolean returnSegments;
  private final long minSpeechMs;

  public ResponseAssembler(boolean needClarity, boolean returnSegments, long minSpeechMs) {
    this.needClarity = needClarity;
    this.returnSegments = returnSegments;
    this.minSpeechMs = minSpeechMs;
  }

  public boolean needClarity() {
    return needClarity;
  }

  public QcResult assemble(DecodedAudio audio, SignalMetrics metrics, VadResult vad) {
    ClipDetail clipDetail = ClipDetail.of(metrics.clips());
    ClarityResult clarity = needClarity ? metrics.clarity() : null;

    return new QcResult(
        metrics.silence().silent(),
        vad.speechMs() > minSpeechMs,
        VadSegmentMerger.speechRatio(vad.speechMs(), audio.durationMs()),
        clipDetail != null,
        clipDetail,
        clarity == null ? null : clarity.clarity(),
        clarity == null ? null : clarity.detail(),
        returnSegments ? vad : vad.withoutSegments(),
        audio.durationMs(),
        MetricRounding.round4(metrics.silence().levelDbfs()));
  }
}
