/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.aggregator;

import lombok.Getter;
import org.opensearch.metrics.planner.logical.AggregationOperator;

/**
 * State: [sum, sum of squares, count]. Population variance is derived from the three terms at
 * presentation; stddev is its square root.
 */
public class StdvarRowAggregator implements RowAggregator {

  @Getter
  private final AggregationOperator operator;

  public StdvarRowAggregator(AggregationOperator operator) {
    if (operator != AggregationOperator.STDVAR && operator != AggregationOperator.STDDEV) {
      throw new IllegalArgumentException("Not a variance operator: " + operator);
    }
    this.operator = operator;
  }

  @Override
  public double[] map(double sample) {
    return new double[] {sample, sample * sample, 1d};
  }

  @Override
  public double[] reduce(double[] left, double[] right) {
    return new double[] {left[0] + right[0], left[1] + right[1], left[2] + right[2]};
  }

  @Override
  public double present(double[] state) {
    double mean = state[0] / state[2];
    double variance = Math.max(0d, state[1] / state[2] - mean * mean);
    return operator == AggregationOperator.STDDEV ? Math.sqrt(variance) : variance;
  }
}
