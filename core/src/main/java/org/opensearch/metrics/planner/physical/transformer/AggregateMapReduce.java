/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.AggregationOperator;

/** Partial aggregation of the series produced by one node, grouped by the output labels. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AggregateMapReduce implements RangeVectorTransformer {

  private final AggregationOperator operator;
  private final List<Object> params;
  private final List<String> by;
  private final List<String> without;

  @Override
  public String args() {
    return String.format(
        "aggrOp=%s, aggrParams=%s, without=%s, by=%s", operator.name(), params, without, by);
  }
}
