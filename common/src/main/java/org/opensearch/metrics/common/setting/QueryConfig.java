/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.common.setting;

import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable settings for query planning. A single instance is built at startup and handed to
 * every planner explicitly; planners never look settings up from a global registry.
 */
@Getter
@ToString
@EqualsAndHashCode
public class QueryConfig {

  public static final int DEFAULT_SPREAD = 1;
  public static final Duration DEFAULT_STALE_SAMPLE_AFTER = Duration.ofMinutes(5);
  public static final Duration DEFAULT_MIN_STEP = Duration.ofSeconds(1);

  /** Number of bits of the shard-key hash left free, i.e. 2^spread shards per shard key. */
  private final int defaultSpread;

  /** Lookback window applied by periodic sampling when the query gives none. */
  private final long staleSampleAfterMs;

  /** Smallest accepted step of a range query. */
  private final long minStepMs;

  private QueryConfig(int defaultSpread, long staleSampleAfterMs, long minStepMs) {
    if (defaultSpread < 0) {
      throw new IllegalArgumentException("Spread must not be negative: " + defaultSpread);
    }
    if (staleSampleAfterMs <= 0 || minStepMs <= 0) {
      throw new IllegalArgumentException("Stale sample window and min step must be positive");
    }
    this.defaultSpread = defaultSpread;
    this.staleSampleAfterMs = staleSampleAfterMs;
    this.minStepMs = minStepMs;
  }

  /** Settings with every value at its default. */
  public static QueryConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int defaultSpread = DEFAULT_SPREAD;
    private long staleSampleAfterMs = DEFAULT_STALE_SAMPLE_AFTER.toMillis();
    private long minStepMs = DEFAULT_MIN_STEP.toMillis();

    public Builder defaultSpread(int defaultSpread) {
      this.defaultSpread = defaultSpread;
      return this;
    }

    public Builder staleSampleAfter(Duration staleSampleAfter) {
      this.staleSampleAfterMs = staleSampleAfter.toMillis();
      return this;
    }

    public Builder minStep(Duration minStep) {
      this.minStepMs = minStep.toMillis();
      return this;
    }

    public QueryConfig build() {
      return new QueryConfig(defaultSpread, staleSampleAfterMs, minStepMs);
    }
  }
}
