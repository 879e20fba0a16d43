/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.query.QueryContext;

/** Reduces the partial aggregates produced by its children into one aggregate per group. */
@Getter
public abstract class ReduceAggregateExec extends NonLeafExecPlan {

  private final AggregationOperator operator;
  private final List<Object> params;

  protected ReduceAggregateExec(
      QueryContext queryContext,
      List<ExecPlan> children,
      AggregationOperator operator,
      List<Object> params) {
    super(queryContext, children);
    this.operator = operator;
    this.params = ImmutableList.copyOf(params);
  }
}
