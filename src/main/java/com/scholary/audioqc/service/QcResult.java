package com.scholary.audioqc.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.audioqc.metrics.ClarityDetail;
import com.scholary.audioqc.metrics.ClipDetail;
import com.scholary.audioqc.metrics.VadResult;

/** The {@code data} object of a successful response. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record QcResult(
    @JsonProperty("is_silent") boolean silent,
    @JsonProperty("has_speech") boolean hasSpeech,
    @JsonProperty("speech_ratio") double speechRatio,
    @JsonProperty("has_clip") boolean hasClip,
    @JsonProperty("clip_detail") ClipDetail clipDetail,
    Double clarity,
    @JsonProperty("clarity_detail") ClarityDetail clarityDetail,
    VadResult vad,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("level_dbfs") double levelDbfs) {}
