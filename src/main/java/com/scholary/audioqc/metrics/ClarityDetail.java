package com.scholary.audioqc.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw clarity measurements and their normalised sub-scores.
 *
 * <p>The three raw values are rounded to 4 decimals; the sub-scores keep full precision.
 */
public record ClarityDetail(
    @JsonProperty("snr_db") double snrDb,
    @JsonProperty("hf_ratio") double hfRatio,
    @JsonProperty("spectral_flatness") double spectralFlatness,
    @JsonProperty("snr_score") double snrScore,
    @JsonProperty("hf_score") double hfScore,
    @JsonProperty("flat_score") double flatScore) {}
