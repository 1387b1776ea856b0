package com.scholary.audioqc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Audio QC service.
 *
 * <p>Accepts a single uploaded audio file and reports silence, speech ratio, clipping, clarity and
 * voice-activity segments, with GPU inference admitted through a bounded gate.
 */
@SpringBootApplication
public class AudioQcApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioQcApplication.class, args);
  }
}
