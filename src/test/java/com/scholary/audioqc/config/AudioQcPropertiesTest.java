package com.scholary.audioqc.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audioqc.metrics.SilenceMode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySource;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class AudioQcPropertiesTest {

  private static AudioQcProperties bind(Map<String, String> overrides) throws IOException {
    List<PropertySource<?>> yaml =
        new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
    List<ConfigurationPropertySource> sources = new ArrayList<>();
    sources.add(new MapConfigurationPropertySource(overrides));
    ConfigurationPropertySources.from(yaml).forEach(sources::add);
    return new Binder(sources).bind("audio-qc", AudioQcProperties.class).get();
  }

  @Test
  void bind_shouldLoadShippedDefaults() throws Exception {
    AudioQcProperties properties = bind(Map.of());

    assertThat(properties.threadpoolWorkers()).isEqualTo(8);
    assertThat(properties.gpuInferConcurrency()).isEqualTo(1);
    assertThat(properties.maxFileSizeMb()).isEqualTo(300);
    assertThat(properties.minDurationMs()).isEqualTo(180_000);
    assertThat(properties.maxDurationMs()).isEqualTo(3_300_000);
    assertThat(properties.mergeGapMs()).isEqualTo(120);
    assertThat(properties.silence().mode()).isEqualTo(SilenceMode.RMS);
    assertThat(properties.silence().dbfs()).isEqualTo(-60.0);
    assertThat(properties.clipping().clipThreshold()).isEqualTo(0.99);
    assertThat(properties.clarity().hfRef2L()).isEqualTo(0.25);
    assertThat(properties.clarity().wSnr()).isEqualTo(0.5);
    assertThat(properties.clarity().toSettings()).isNotNull();
  }

  @Test
  void bind_shouldRejectInvertedDurationRange() {
    assertThatThrownBy(
            () ->
                bind(
                    Map.of(
                        "audio-qc.min-duration-ms", "60000",
                        "audio-qc.max-duration-ms", "1000")))
        .isInstanceOf(BindException.class)
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bind_shouldRejectOverlappingSnrRamp() {
    assertThatThrownBy(() -> bind(Map.of("audio-qc.clarity.snr-min-db2", "5")))
        .isInstanceOf(BindException.class)
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bind_shouldRejectAllZeroWeights() {
    assertThatThrownBy(
            () ->
                bind(
                    Map.of(
                        "audio-qc.clarity.w-snr", "0",
                        "audio-qc.clarity.w-hf", "0",
                        "audio-qc.clarity.w-flat", "0")))
        .isInstanceOf(BindException.class)
        .hasRootCauseInstanceOf(IllegalArgumentException.class);
  }
}
