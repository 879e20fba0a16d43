/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Aggregation operators. An associative operator can be computed as a partial aggregate on each
 * partition and merged afterwards; the others need every candidate series in one place.
 */
@Getter
@RequiredArgsConstructor
public enum AggregationOperator {
  SUM("sum", "Sum", true),
  AVG("avg", "Avg", true),
  COUNT("count", "Count", true),
  MIN("min", "Min", true),
  MAX("max", "Max", true),
  GROUP("group", "Group", true),
  STDDEV("stddev", "Stddev", true),
  STDVAR("stdvar", "Stdvar", true),
  TOPK("topk", "TopK", false),
  BOTTOMK("bottomk", "BottomK", false),
  COUNT_VALUES("count_values", "CountValues", false),
  QUANTILE("quantile", "Quantile", false);

  private final String promQlName;
  private final String displayName;
  private final boolean associative;
}
