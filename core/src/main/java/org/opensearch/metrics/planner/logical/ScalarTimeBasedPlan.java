/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.query.RangeParams;

/** Scalar derived from the evaluation time only, e.g. {@code time()} or {@code hour()}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ScalarTimeBasedPlan extends ScalarPlan {

  private final ScalarFunctionId function;
  private final RangeParams rangeParams;

  public ScalarTimeBasedPlan(ScalarFunctionId function, RangeParams rangeParams) {
    super(ImmutableList.of());
    if (!function.isTimeBased()) {
      throw new IllegalArgumentException(function.getPromQlName() + "() is not time based");
    }
    this.function = function;
    this.rangeParams = rangeParams;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScalarTimeBasedPlan(this, context);
  }
}
