/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import lombok.Getter;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.RangeParams;

/** Emits the same literal at every step. */
@Getter
public class ScalarFixedDoubleExec extends LeafExecPlan {

  private final RangeParams rangeParams;
  private final double value;

  public ScalarFixedDoubleExec(QueryContext queryContext, RangeParams rangeParams, double value) {
    super(queryContext);
    this.rangeParams = rangeParams;
    this.value = value;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitScalarFixedDouble(this, context);
  }
}
