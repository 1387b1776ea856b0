package com.scholary.audioqc.vad;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the VAD model server client.
 *
 * @param baseUrl root URL of the model server
 * @param model model name forwarded with every request
 * @param device inference target, e.g. {@code cuda:0} or {@code cpu}
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout per-request timeout in seconds
 * @param warmupOnStartup send silent clips through every worker once the app is ready
 */
@ConfigurationProperties(prefix = "vad")
@Validated
public record VadProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    @NotBlank String device,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    boolean warmupOnStartup) {}
