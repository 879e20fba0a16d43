/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.aggregator;

import org.opensearch.metrics.planner.logical.AggregationOperator;

/**
 * State: [sum, count]. Averages of partitions cannot be averaged again, so the partial step keeps
 * both terms and only the presenter divides.
 */
public class AvgRowAggregator implements RowAggregator {

  @Override
  public AggregationOperator getOperator() {
    return AggregationOperator.AVG;
  }

  @Override
  public double[] map(double sample) {
    return new double[] {sample, 1d};
  }

  @Override
  public double[] reduce(double[] left, double[] right) {
    return new double[] {left[0] + right[0], left[1] + right[1]};
  }

  @Override
  public double present(double[] state) {
    return state[0] / state[1];
  }
}
