package com.scholary.audioqc.decode;

import com.scholary.audioqc.service.StatusCode;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates an upload and turns it into well-formed mono 16 kHz samples.
 *
 * <p>Cheap checks run first: presence and size are rejected before the decoder is ever invoked.
 * Duration is only known after decoding, so it is checked last.
 */
public class DecodeStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(DecodeStage.class);

  private final AudioDecoder decoder;
  private final long maxFileSizeBytes;
  private final long minDurationMs;
  private final long maxDurationMs;

  public DecodeStage(
      AudioDecoder decoder, long maxFileSizeMb, long minDurationMs, long maxDurationMs) {
    if (maxFileSizeMb <= 0) {
      throw new IllegalArgumentException("maxFileSizeMb must be positive: " + maxFileSizeMb);
    }
    if (minDurationMs < 0 || minDurationMs > maxDurationMs) {
      throw new IllegalArgumentException(
          String.format("Invalid duration range [%d, %d]", minDurationMs, maxDurationMs));
    }
    this.decoder = decoder;
    this.maxFileSizeBytes = maxFileSizeMb * 1024L * 1024L;
    this.minDurationMs = minDurationMs;
    this.maxDurationMs = maxDurationMs;
  }

  /**
   * Presence and size checks.
   *
   * @param present whether a file part was supplied at all
   * @param declaredSize size in bytes as reported by the upload
   * @throws DecodeException {@code MISSING_AUDIO} or {@code FILE_TOO_LARGE}
   */
  public void validateUpload(boolean present, long declaredSize) {
    if (!present || declaredSize <= 0) {
      throw new DecodeException(StatusCode.MISSING_AUDIO, "Audio file is missing or empty");
    }
    if (declaredSize > maxFileSizeBytes) {
      throw new DecodeException(
          StatusCode.FILE_TOO_LARGE,
          String.format("File size %d exceeds limit of %d bytes", declaredSize, maxFileSizeBytes));
    }
  }

  /**
   * Decode a staged upload and validate the result.
   *
   * @throws DecodeException {@code DECODE_FAILED}, {@code RESAMPLE_FAILED}, {@code INVALID_AUDIO}
   *     or {@code DURATION_OUT_OF_RANGE}
   */
  public DecodedAudio decode(Path input, Path workDir) {
    DecodedAudio audio = decoder.decode(input, workDir);

    if (audio.sampleRate() != FfmpegAudioDecoder.TARGET_SAMPLE_RATE) {
      throw new DecodeException(
          StatusCode.RESAMPLE_FAILED,
          String.format(
              "Expected %d Hz after resampling, got %d Hz",
              FfmpegAudioDecoder.TARGET_SAMPLE_RATE, audio.sampleRate()));
    }
    if (!audio.isWellFormed()) {
      throw new DecodeException(
          StatusCode.INVALID_AUDIO, "Decoded audio is empty or contains non-finite samples");
    }
    if (audio.durationMs() < minDurationMs || audio.durationMs() > maxDurationMs) {
      throw new DecodeException(
          StatusCode.DURATION_OUT_OF_RANGE,
          String.format(
              "Duration %d ms outside [%d, %d]", audio.durationMs(), minDurationMs, maxDurationMs));
    }

    LOGGER.debug("Decoded audio accepted: {} ms", audio.durationMs());
    return audio;
  }
}
