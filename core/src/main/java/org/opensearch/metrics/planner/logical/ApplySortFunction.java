/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ApplySortFunction extends LogicalPlan {

  private final LogicalPlan vectors;
  private final SortFunctionId function;

  public ApplySortFunction(LogicalPlan vectors, SortFunctionId function) {
    super(ImmutableList.of(vectors));
    this.vectors = vectors;
    this.function = function;
  }

  public ApplySortFunction withVectors(LogicalPlan newVectors) {
    return new ApplySortFunction(newVectors, function);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitApplySortFunction(this, context);
  }
}
