package com.scholary.audioqc.vad;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audioqc.metrics.VadSegment;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the segment list returned by the VAD model server.
 *
 * <p>Three reply shapes are accepted:
 *
 * <pre>
 * [[s, e], ...]
 * [{"value": [[s, e], ...]}]
 * {"value": [[s, e], ...]}
 * </pre>
 *
 * <p>Values are milliseconds and are rounded to whole ms. Any other well-formed JSON means no
 * speech. Pairs that don't describe a forward interval are dropped.
 */
public class VadResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(VadResponseParser.class);

  private final ObjectMapper objectMapper;

  public VadResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<VadSegment> parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new VadException("Malformed VAD response", e);
    }
    if (root == null) {
      throw new VadException("Empty VAD response");
    }
    return toSegments(pairsNode(root));
  }

  private static JsonNode pairsNode(JsonNode root) {
    if (root.isObject()) {
      return root.path("value");
    }
    if (root.isArray() && root.size() > 0 && root.get(0).isObject()) {
      return root.get(0).path("value");
    }
    return root;
  }

  private static List<VadSegment> toSegments(JsonNode pairs) {
    List<VadSegment> segments = new ArrayList<>();
    if (!pairs.isArray()) {
      return segments;
    }
    for (JsonNode pair : pairs) {
      if (!pair.isArray() || pair.size() < 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
        LOGGER.debug("Skipping malformed VAD pair: {}", pair);
        continue;
      }
      long start = Math.round(pair.get(0).asDouble());
      long end = Math.round(pair.get(1).asDouble());
      if (start < 0 || end <= start) {
        LOGGER.debug("Skipping empty or inverted VAD pair: [{}, {}]", start, end);
        continue;
      }
      segments.add(new VadSegment(start, end));
    }
    return segments;
  }
}
