/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.aggregator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.metrics.planner.logical.AggregationOperator;

/** State: [min] or [max]. */
@RequiredArgsConstructor
public class MinMaxRowAggregator implements RowAggregator {

  @Getter
  private final AggregationOperator operator;

  @Override
  public double[] map(double sample) {
    return new double[] {sample};
  }

  @Override
  public double[] reduce(double[] left, double[] right) {
    return new double[] {
      operator == AggregationOperator.MIN
          ? Math.min(left[0], right[0])
          : Math.max(left[0], right[0])
    };
  }

  @Override
  public double present(double[] state) {
    return state[0];
  }
}
