/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Scalar computed from a vector at every step, i.e. {@code scalar(v)}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ScalarVaryingDoublePlan extends ScalarPlan {

  private final LogicalPlan vectors;
  private final ScalarFunctionId function;

  public ScalarVaryingDoublePlan(LogicalPlan vectors, ScalarFunctionId function) {
    super(ImmutableList.of(vectors));
    this.vectors = vectors;
    this.function = function;
  }

  public ScalarVaryingDoublePlan withVectors(LogicalPlan newVectors) {
    return new ScalarVaryingDoublePlan(newVectors, function);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScalarVaryingDoublePlan(this, context);
  }
}
