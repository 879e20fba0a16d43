/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.query.QueryContext;

/** Reduces the partial aggregates of the shards of one partition. */
public class LocalPartitionReduceAggregateExec extends ReduceAggregateExec {

  public LocalPartitionReduceAggregateExec(
      QueryContext queryContext,
      List<ExecPlan> children,
      AggregationOperator operator,
      List<Object> params) {
    super(queryContext, children, operator, params);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLocalPartitionReduceAggregate(this, context);
  }
}
