package com.scholary.audioqc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audioqc.vad.VadEngine;
import com.scholary.audioqc.vad.VadHttpClient;
import com.scholary.audioqc.vad.VadProperties;
import com.scholary.audioqc.vad.VadResponseParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the VAD engine client.
 *
 * <p>Enables the VadProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(VadProperties.class)
public class VadConfig {

  @Bean
  public VadEngine vadEngine(VadProperties properties, ObjectMapper objectMapper) {
    return new VadHttpClient(properties, new VadResponseParser(objectMapper));
  }
}
