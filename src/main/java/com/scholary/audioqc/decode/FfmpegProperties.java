package com.scholary.audioqc.decode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ffmpeg decode step.
 *
 * @param binary ffmpeg executable, resolved on the PATH when not absolute
 * @param timeoutSeconds how long a single decode may run before it is killed
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @Positive int timeoutSeconds) {}
