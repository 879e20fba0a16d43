/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.aggregator;

import org.opensearch.metrics.planner.logical.AggregationOperator;

public class GroupRowAggregator implements RowAggregator {

  @Override
  public AggregationOperator getOperator() {
    return AggregationOperator.GROUP;
  }

  @Override
  public double[] map(double sample) {
    return new double[] {1d};
  }

  @Override
  public double[] reduce(double[] left, double[] right) {
    return new double[] {1d};
  }

  @Override
  public double present(double[] state) {
    return state[0];
  }
}
