package com.scholary.audioqc.decode;

import com.scholary.audioqc.service.StatusCode;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

/**
 * Reads the 16-bit PCM WAV written by ffmpeg into normalised float samples.
 *
 * <p>Multi-channel input is down-mixed to mono by averaging the channels.
 */
public class WavReader {

  private static final double FULL_SCALE = 32768.0;

  public DecodedAudio read(Path wavFile) {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(wavFile));
        AudioInputStream ais = AudioSystem.getAudioInputStream(in)) {
      AudioFormat format = ais.getFormat();

      if (format.getEncoding() != AudioFormat.Encoding.PCM_SIGNED
          || format.getSampleSizeInBits() != 16) {
        throw new DecodeException(
            StatusCode.RESAMPLE_FAILED,
            String.format(
                "Expected 16-bit signed PCM, got %s %d-bit",
                format.getEncoding(), format.getSampleSizeInBits()));
      }
      int channels = format.getChannels();
      int sampleRate = Math.round(format.getSampleRate());
      if (channels < 1 || sampleRate <= 0) {
        throw new DecodeException(
            StatusCode.RESAMPLE_FAILED,
            String.format("Invalid WAV layout: channels=%d, sampleRate=%d", channels, sampleRate));
      }

      byte[] pcm = ais.readAllBytes();
      return DecodedAudio.of(toMono(pcm, channels, format.isBigEndian()), sampleRate);

    } catch (UnsupportedAudioFileException e) {
      throw new DecodeException(StatusCode.DECODE_FAILED, "Decoded output is not a readable WAV", e);
    } catch (IOException e) {
      throw new DecodeException(StatusCode.DECODE_FAILED, "Failed to read decoded WAV: " + wavFile, e);
    }
  }

  private static float[] toMono(byte[] pcm, int channels, boolean bigEndian) {
    int frameBytes = 2 * channels;
    int frames = pcm.length / frameBytes;
    float[] samples = new float[frames];

    for (int f = 0; f < frames; f++) {
      double sum = 0.0;
      for (int c = 0; c < channels; c++) {
        int i = f * frameBytes + c * 2;
        int hi = bigEndian ? pcm[i] : pcm[i + 1];
        int lo = (bigEndian ? pcm[i + 1] : pcm[i]) & 0xff;
        sum += (short) ((hi << 8) | lo);
      }
      samples[f] = (float) (sum / channels / FULL_SCALE);
    }
    return samples;
  }
}
