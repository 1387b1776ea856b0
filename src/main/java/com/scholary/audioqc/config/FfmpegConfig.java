package com.scholary.audioqc.config;

import com.scholary.audioqc.decode.AudioDecoder;
import com.scholary.audioqc.decode.FfmpegAudioDecoder;
import com.scholary.audioqc.decode.FfmpegProperties;
import com.scholary.audioqc.decode.WavReader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for ffmpeg-related beans.
 *
 * <p>Enables the FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class FfmpegConfig {

  @Bean
  public AudioDecoder audioDecoder(FfmpegProperties properties) {
    return new FfmpegAudioDecoder(properties, new WavReader());
  }
}
