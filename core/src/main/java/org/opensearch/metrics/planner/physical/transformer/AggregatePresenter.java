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
import org.opensearch.metrics.query.RangeParams;

/** Converts merged aggregation state into the values the user sees, e.g. sum/count for avg. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AggregatePresenter implements RangeVectorTransformer {

  private final AggregationOperator operator;
  private final List<Object> params;
  private final RangeParams rangeParams;

  @Override
  public String args() {
    return String.format("aggrOp=%s, aggrParams=%s, rangeParams=%s", operator.name(), params,
        rangeParams);
  }
}
