/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.planner.physical.aggregator.RowAggregator;
import org.opensearch.metrics.query.QueryContext;

/** Merges the partial aggregates computed by several partitions. */
public class MultiPartitionReduceAggregateExec extends ReduceAggregateExec {

  public MultiPartitionReduceAggregateExec(
      QueryContext queryContext,
      List<ExecPlan> children,
      AggregationOperator operator,
      List<Object> params) {
    super(queryContext, children, operator, params);
  }

  /** Arithmetic the runtime uses to merge the partial states of the children. */
  public RowAggregator getRowAggregator() {
    return RowAggregator.forOperator(getOperator());
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitMultiPartitionReduceAggregate(this, context);
  }
}
