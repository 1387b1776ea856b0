package com.scholary.audioqc.vad;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audioqc.metrics.VadSegment;
import com.scholary.audioqc.service.StatusCode;
import org.junit.jupiter.api.Test;

class VadResponseParserTest {

  private final VadResponseParser parser = new VadResponseParser(new ObjectMapper());

  @Test
  void parse_shouldReadBareListOfPairs() {
    assertThat(parser.parse("[[100, 500], [520, 900]]"))
        .containsExactly(new VadSegment(100, 500), new VadSegment(520, 900));
  }

  @Test
  void parse_shouldReadListWrappedValue() {
    assertThat(parser.parse("[{\"key\": \"audio\", \"value\": [[0, 250]]}]"))
        .containsExactly(new VadSegment(0, 250));
  }

  @Test
  void parse_shouldReadObjectWrappedValue() {
    assertThat(parser.parse("{\"value\": [[10, 20], [30, 40]]}"))
        .containsExactly(new VadSegment(10, 20), new VadSegment(30, 40));
  }

  @Test
  void parse_shouldRoundFractionalMilliseconds() {
    assertThat(parser.parse("[[99.6, 500.4]]")).containsExactly(new VadSegment(100, 500));
  }

  @Test
  void parse_shouldSkipMalformedAndInvertedPairs() {
    assertThat(parser.parse("[[100], [\"a\", 5], [900, 800], [40, 40], [-5, 10], [1, 2]]"))
        .containsExactly(new VadSegment(1, 2));
  }

  @Test
  void parse_shouldTreatUnknownShapesAsNoSpeech() {
    assertThat(parser.parse("[]")).isEmpty();
    assertThat(parser.parse("{\"segments\": [[1, 2]]}")).isEmpty();
    assertThat(parser.parse("[{\"value\": null}]")).isEmpty();
    assertThat(parser.parse("42")).isEmpty();
  }

  @Test
  void parse_shouldFailOnInvalidJson() {
    assertThatThrownBy(() -> parser.parse("[[1, 2"))
        .isInstanceOfSatisfying(
            VadException.class,
            e -> assertThat(e.getStatusCode()).isEqualTo(StatusCode.VAD_INFER_FAILED));
  }
}
