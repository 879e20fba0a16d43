/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import lombok.Getter;
import org.opensearch.metrics.planner.logical.ScalarFunctionId;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.RangeParams;

/** Generates a scalar from each evaluation instant, e.g. {@code time()}; reads no data. */
@Getter
public class TimeScalarGeneratorExec extends LeafExecPlan {

  private final RangeParams rangeParams;
  private final ScalarFunctionId function;

  public TimeScalarGeneratorExec(
      QueryContext queryContext, RangeParams rangeParams, ScalarFunctionId function) {
    super(queryContext);
    this.rangeParams = rangeParams;
    this.function = function;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitTimeScalarGenerator(this, context);
  }
}
