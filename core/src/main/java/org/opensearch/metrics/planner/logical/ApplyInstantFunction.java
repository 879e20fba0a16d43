/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Instant function over a vector, e.g. {@code histogram_quantile(0.9, v)} or {@code exp(v)}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ApplyInstantFunction extends LogicalPlan {

  private final LogicalPlan vectors;
  private final InstantFunctionId function;
  private final List<ScalarPlan> functionArgs;

  public ApplyInstantFunction(
      LogicalPlan vectors, InstantFunctionId function, List<ScalarPlan> functionArgs) {
    super(ImmutableList.<LogicalPlan>builder().add(vectors).addAll(functionArgs).build());
    this.vectors = vectors;
    this.function = function;
    this.functionArgs = ImmutableList.copyOf(functionArgs);
  }

  public ApplyInstantFunction withVectors(LogicalPlan newVectors) {
    return new ApplyInstantFunction(newVectors, function, functionArgs);
  }

  public ApplyInstantFunction withFunctionArgs(List<ScalarPlan> newArgs) {
    return new ApplyInstantFunction(vectors, function, newArgs);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitApplyInstantFunction(this, context);
  }
}
