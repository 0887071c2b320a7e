package com.flamingo.ai.researchchat.service.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RelevanceScores")
class RelevanceScoresTest {

  @Test
  @DisplayName("Should clamp numeric scores into [0,1]")
  void shouldClamp() {
    assertThat(RelevanceScores.sanitize(1.7)).isEqualTo(1.0);
    assertThat(RelevanceScores.sanitize(-0.2)).isEqualTo(0.0);
    assertThat(RelevanceScores.sanitize(0.42)).isEqualTo(0.42);
    assertThat(RelevanceScores.sanitize(1)).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should drop NaN and non-numeric input instead of coercing to zero")
  void shouldDropInvalidInput() {
    assertThat(RelevanceScores.sanitize(Double.NaN)).isNull();
    assertThat(RelevanceScores.sanitize("0.5")).isNull();
    assertThat(RelevanceScores.sanitize((Object) null)).isNull();
  }

  @Test
  @DisplayName("Should only accept numeric JSON nodes")
  void shouldSanitizeJsonNodes() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    assertThat(RelevanceScores.sanitize(mapper.readTree("{\"s\":2.5}").get("s"))).isEqualTo(1.0);
    assertThat(RelevanceScores.sanitize(mapper.readTree("{\"s\":\"high\"}").get("s"))).isNull();
    assertThat(RelevanceScores.sanitize(mapper.readTree("{}").get("s"))).isNull();
  }
}
