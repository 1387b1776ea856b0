package com.scholary.audioqc.decode;

import java.nio.file.Path;

/**
 * Turns an uploaded audio file into mono PCM samples.
 *
 * <p>This abstraction lets the ffmpeg subprocess be swapped for another decoder, or for a test
 * double that returns fixed samples.
 */
public interface AudioDecoder {

  /**
   * Decode and resample an audio file.
   *
   * @param input the uploaded file
   * @param workDir a request-owned directory for intermediate files
   * @return the decoded samples; sample rate and content are validated by the caller
   * @throws DecodeException with {@code DECODE_FAILED} or {@code RESAMPLE_FAILED}
   */
  DecodedAudio decode(Path input, Path workDir);
}
