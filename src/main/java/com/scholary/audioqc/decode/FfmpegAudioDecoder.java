package com.scholary.audioqc.decode;

import com.scholary.audioqc.service.StatusCode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes any container/codec ffmpeg understands into mono 16 kHz PCM.
 *
 * <p>ffmpeg writes a WAV into the request's work directory, which is then read back by {@link
 * WavReader}. stderr goes to a log file next to it so a chatty ffmpeg can never block on a full
 * pipe.
 */
public class FfmpegAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioDecoder.class);

  public static final int TARGET_SAMPLE_RATE = 16000;

  private final FfmpegProperties properties;
  private final WavReader wavReader;

  public FfmpegAudioDecoder(FfmpegProperties properties, WavReader wavReader) {
    this.properties = properties;
    this.wavReader = wavReader;
  }

  @Override
  public DecodedAudio decode(Path input, Path workDir) {
    Path wavFile = workDir.resolve("input_16k_mono.wav");
    Path stderrFile = workDir.resolve("ffmpeg.log");

    List<String> command = buildCommand(input, wavFile);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    int exitCode = run(command, stderrFile);
    if (exitCode != 0) {
      String stderr = readQuietly(stderrFile);
      LOGGER.warn("ffmpeg exited with code {}: {}", exitCode, stderr);
      throw new DecodeException(
          StatusCode.DECODE_FAILED, "ffmpeg decode/resample failed with exit code " + exitCode);
    }
    if (!Files.isRegularFile(wavFile)) {
      throw new DecodeException(StatusCode.DECODE_FAILED, "ffmpeg produced no output file");
    }

    DecodedAudio audio = wavReader.read(wavFile);
    LOGGER.info(
        "Decoded {} samples at {} Hz ({} ms)", audio.length(), audio.sampleRate(), audio.durationMs());
    return audio;
  }

  List<String> buildCommand(Path input, Path output) {
    // -ac 1: mono, -ar 16000: resample, -vn: drop any video stream
    return List.of(
        properties.binary(),
        "-y",
        "-hide_banner",
        "-loglevel",
        "error",
        "-i",
        input.toString(),
        "-ac",
        "1",
        "-ar",
        String.valueOf(TARGET_SAMPLE_RATE),
        "-vn",
        "-f",
        "wav",
        output.toString());
  }

  private int run(List<String> command, Path stderrFile) {
    Process process;
    try {
      process =
          new ProcessBuilder(command)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .redirectError(stderrFile.toFile())
              .start();
    } catch (IOException e) {
      throw new DecodeException(StatusCode.DECODE_FAILED, "Failed to start ffmpeg", e);
    }

    try {
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new DecodeException(
            StatusCode.DECODE_FAILED,
            String.format("ffmpeg did not finish within %ds", properties.timeoutSeconds()));
      }
      return process.exitValue();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new DecodeException(StatusCode.DECODE_FAILED, "Decode interrupted", e);
    }
  }

  private static String readQuietly(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      return "<stderr unavailable: " + e.getMessage() + ">";
    }
  }
}
