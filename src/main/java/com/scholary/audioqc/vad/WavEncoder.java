package com.scholary.audioqc.vad;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

/** Encodes mono float samples as an in-memory 16-bit little-endian PCM WAV. */
final class WavEncoder {

  private WavEncoder() {}

  static byte[] encode(float[] samples, int sampleRate) throws IOException {
    byte[] pcm = new byte[samples.length * 2];
    for (int i = 0; i < samples.length; i++) {
      float clamped = Math.max(-1.0f, Math.min(1.0f, samples[i]));
      short value = (short) Math.round(clamped * Short.MAX_VALUE);
      pcm[2 * i] = (byte) value;
      pcm[2 * i + 1] = (byte) (value >> 8);
    }

    AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
    ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 44);
    try (AudioInputStream stream =
        new AudioInputStream(new ByteArrayInputStream(pcm), format, samples.length)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, out);
    }
    return out.toByteArray();
  }
}
