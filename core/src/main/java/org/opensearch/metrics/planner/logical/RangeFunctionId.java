/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Functions evaluated over a sliding window of raw samples. */
@Getter
@RequiredArgsConstructor
public enum RangeFunctionId {
  RATE("rate"),
  IRATE("irate"),
  INCREASE("increase"),
  DELTA("delta"),
  AVG_OVER_TIME("avg_over_time"),
  SUM_OVER_TIME("sum_over_time"),
  COUNT_OVER_TIME("count_over_time"),
  MIN_OVER_TIME("min_over_time"),
  MAX_OVER_TIME("max_over_time"),
  QUANTILE_OVER_TIME("quantile_over_time");

  private final String promQlName;
}
