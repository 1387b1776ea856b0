package com.scholary.audioqc.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audioqc.service.StatusCode;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioDecoderTest {

  @TempDir Path tempDir;

  private static FfmpegAudioDecoder decoder(String binary) {
    return new FfmpegAudioDecoder(new FfmpegProperties(binary, 10), new WavReader());
  }

  private static void assertDecodeFailed(Runnable call) {
    assertThatThrownBy(call::run)
        .isInstanceOfSatisfying(
            DecodeException.class,
            e -> assertThat(e.getStatusCode()).isEqualTo(StatusCode.DECODE_FAILED));
  }

  @Test
  void buildCommand_shouldResampleToMono16k() {
    List<String> command =
        decoder("ffmpeg").buildCommand(Path.of("/in/a.mp3"), Path.of("/out/a.wav"));

    assertThat(command)
        .containsExactly(
            "ffmpeg", "-y", "-hide_banner", "-loglevel", "error", "-i", "/in/a.mp3", "-ac", "1",
            "-ar", "16000", "-vn", "-f", "wav", "/out/a.wav");
  }

  @Test
  void decode_shouldFailWhenBinaryMissing() {
    FfmpegAudioDecoder missing = decoder(tempDir.resolve("no-such-ffmpeg").toString());

    assertDecodeFailed(() -> missing.decode(tempDir.resolve("a.mp3"), tempDir));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void decode_shouldFailOnNonZeroExit() {
    assertDecodeFailed(() -> decoder("false").decode(tempDir.resolve("a.mp3"), tempDir));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void decode_shouldFailWhenNoOutputWritten() {
    assertDecodeFailed(() -> decoder("true").decode(tempDir.resolve("a.mp3"), tempDir));
  }
}
