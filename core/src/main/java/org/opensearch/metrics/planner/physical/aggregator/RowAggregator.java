/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.aggregator;

import java.util.Arrays;
import java.util.List;
import org.opensearch.metrics.planner.logical.AggregationOperator;

/**
 * Partial/merge arithmetic of an associative aggregation. A partition maps each sample to an
 * intermediate state and reduces the states of its own series; the merge node reduces the partial
 * states of every partition; the presenter turns the final state into the user-visible value.
 * Reducing in any grouping gives the same state as reducing every sample at once.
 */
public interface RowAggregator {

  AggregationOperator getOperator();

  /** Intermediate state of one sample. */
  double[] map(double sample);

  /** Combines two intermediate states. */
  double[] reduce(double[] left, double[] right);

  /** Final value of an intermediate state. */
  double present(double[] state);

  /** Reduces the states of the given samples, as a partition does for its own series. */
  default double[] partial(double... samples) {
    if (samples.length == 0) {
      throw new IllegalArgumentException("Cannot aggregate zero samples");
    }
    return Arrays.stream(samples).mapToObj(this::map).reduce(this::reduce).get();
  }

  /** Reduces partial states coming from several partitions. */
  default double[] merge(List<double[]> partials) {
    return partials.stream()
        .reduce(this::reduce)
        .orElseThrow(() -> new IllegalArgumentException("Cannot merge zero partial states"));
  }

  /**
   * Aggregator of an associative operator.
   *
   * @throws UnsupportedOperationException for operators whose partial results cannot be merged
   */
  static RowAggregator forOperator(AggregationOperator operator) {
    switch (operator) {
      case SUM:
        return new SumRowAggregator();
      case COUNT:
        return new CountRowAggregator();
      case MIN:
        return new MinMaxRowAggregator(AggregationOperator.MIN);
      case MAX:
        return new MinMaxRowAggregator(AggregationOperator.MAX);
      case AVG:
        return new AvgRowAggregator();
      case GROUP:
        return new GroupRowAggregator();
      case STDVAR:
        return new StdvarRowAggregator(AggregationOperator.STDVAR);
      case STDDEV:
        return new StdvarRowAggregator(AggregationOperator.STDDEV);
      default:
        throw new UnsupportedOperationException(
            "Partial results of " + operator.getDisplayName() + " cannot be merged");
    }
  }
}
