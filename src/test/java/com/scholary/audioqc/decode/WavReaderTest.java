package com.scholary.audioqc.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.audioqc.service.StatusCode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WavReaderTest {

  @TempDir Path tempDir;

  private final WavReader reader = new WavReader();

  private Path writeWav(short[] interleaved, int sampleRate, int channels) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(interleaved.length * 2).order(ByteOrder.LITTLE_ENDIAN);
    for (short s : interleaved) {
      buffer.putShort(s);
    }
    AudioFormat format = new AudioFormat(sampleRate, 16, channels, true, false);
    Path file = tempDir.resolve("test_" + sampleRate + "_" + channels + ".wav");
    try (AudioInputStream stream =
        new AudioInputStream(
            new ByteArrayInputStream(buffer.array()), format, interleaved.length / channels)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, file.toFile());
    }
    return file;
  }

  @Test
  void read_shouldNormaliseMonoPcm() throws IOException {
    Path wav = writeWav(new short[] {0, 16384, -16384, Short.MIN_VALUE}, 16000, 1);

    DecodedAudio audio = reader.read(wav);

    assertThat(audio.sampleRate()).isEqualTo(16000);
    assertThat(audio.samples()).containsExactly(new float[] {0f, 0.5f, -0.5f, -1f}, within(1e-6f));
  }

  @Test
  void read_shouldDownmixStereoByAveraging() throws IOException {
    Path wav = writeWav(new short[] {16384, 0, -16384, -16384}, 16000, 2);

    DecodedAudio audio = reader.read(wav);

    assertThat(audio.samples()).containsExactly(new float[] {0.25f, -0.5f}, within(1e-6f));
  }

  @Test
  void read_shouldDeriveDurationFromSampleCount() throws IOException {
    Path wav = writeWav(new short[16000], 16000, 1);

    assertThat(reader.read(wav).durationMs()).isEqualTo(1000);
  }

  @Test
  void read_shouldReportReadableButNon16BitAsResampleFailure() throws IOException {
    AudioFormat format = new AudioFormat(16000, 8, 1, true, false);
    Path file = tempDir.resolve("eight_bit.wav");
    try (AudioInputStream stream =
        new AudioInputStream(new ByteArrayInputStream(new byte[100]), format, 100)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, file.toFile());
    }

    assertThatThrownBy(() -> reader.read(file))
        .isInstanceOfSatisfying(
            DecodeException.class,
            e -> assertThat(e.getStatusCode()).isEqualTo(StatusCode.RESAMPLE_FAILED));
  }

  @Test
  void read_shouldReportGarbageAsDecodeFailure() throws IOException {
    Path file = tempDir.resolve("garbage.wav");
    Files.writeString(file, "this is not audio");

    assertThatThrownBy(() -> reader.read(file))
        .isInstanceOfSatisfying(
            DecodeException.class,
            e -> assertThat(e.getStatusCode()).isEqualTo(StatusCode.DECODE_FAILED));
  }
}
