package com.scholary.audioqc.vad;

import com.scholary.audioqc.metrics.VadSegment;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the VAD model server.
 *
 * <p>Each call WAV-encodes the samples in memory and posts them as multipart/form-data together
 * with the configured model and device. There are no retries: a failed call ends the request with
 * {@code VAD_INFER_FAILED}.
 */
public class VadHttpClient implements VadEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(VadHttpClient.class);

  static final String SEGMENTS_PATH = "/vad/segments";

  private final HttpClient httpClient;
  private final VadProperties properties;
  private final VadResponseParser parser;

  public VadHttpClient(VadProperties properties, VadResponseParser parser) {
    this.properties = properties;
    this.parser = parser;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized VAD client: baseUrl={}, model={}, device={}",
        properties.baseUrl(),
        properties.model(),
        properties.device());
  }

  @Override
  public List<VadSegment> detect(float[] samples, int sampleRate) {
    HttpResponse<String> response;
    try {
      String boundary = UUID.randomUUID().toString();
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + SEGMENTS_PATH))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(buildMultipartBody(WavEncoder.encode(samples, sampleRate), boundary))
              .build();

      LOGGER.debug("Sending VAD request to {} ({} samples)", request.uri(), samples.length);
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new VadException("VAD request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VadException("VAD request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new VadException(
          String.format("VAD server returned status %d: %s", response.statusCode(), response.body()));
    }

    List<VadSegment> segments = parser.parse(response.body());
    LOGGER.debug("VAD returned {} raw segments", segments.size());
    return segments;
  }

  /**
   * Build the multipart body by hand, the JDK client has no multipart support.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.wav"
   * Content-Type: audio/wav
   *
   * [wav bytes]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * silero
   * --boundary
   * Content-Disposition: form-data; name="device"
   *
   * cuda:0
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(byte[] wav, String boundary) throws IOException {
    ByteArrayOutputStream body = new ByteArrayOutputStream(wav.length + 512);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"audio.wav\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");
    body.write(sb.toString().getBytes(StandardCharsets.UTF_8));
    body.write(wav);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "model", properties.model());
    appendField(sb, boundary, "device", properties.device());
    sb.append("--").append(boundary).append("--\r\n");
    body.write(sb.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
