/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryConfigTest {

  @Test
  void should_use_defaults_when_nothing_is_set() {
    QueryConfig config = QueryConfig.defaults();

    assertEquals(1, config.getDefaultSpread());
    assertEquals(300_000L, config.getStaleSampleAfterMs());
    assertEquals(1_000L, config.getMinStepMs());
  }

  @Test
  void should_build_config_with_overrides() {
    QueryConfig config =
        QueryConfig.builder()
            .defaultSpread(3)
            .staleSampleAfter(Duration.ofMinutes(2))
            .minStep(Duration.ofMillis(500))
            .build();

    assertEquals(3, config.getDefaultSpread());
    assertEquals(120_000L, config.getStaleSampleAfterMs());
    assertEquals(500L, config.getMinStepMs());
    assertEquals(config, QueryConfig.builder()
        .defaultSpread(3)
        .staleSampleAfter(Duration.ofMinutes(2))
        .minStep(Duration.ofMillis(500))
        .build());
  }

  @Test
  void should_reject_negative_spread() {
    assertThrows(
        IllegalArgumentException.class, () -> QueryConfig.builder().defaultSpread(-1).build());
  }

  @Test
  void should_reject_non_positive_min_step() {
    assertThrows(
        IllegalArgumentException.class,
        () -> QueryConfig.builder().minStep(Duration.ZERO).build());
  }
}
