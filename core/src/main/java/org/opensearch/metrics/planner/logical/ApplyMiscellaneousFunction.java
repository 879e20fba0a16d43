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

/** Label manipulation over a vector, e.g. {@code label_replace(v, "dst", "$1", "src", "(.*)")}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ApplyMiscellaneousFunction extends LogicalPlan {

  private final LogicalPlan vectors;
  private final MiscellaneousFunctionId function;
  private final List<String> stringArgs;

  public ApplyMiscellaneousFunction(
      LogicalPlan vectors, MiscellaneousFunctionId function, List<String> stringArgs) {
    super(ImmutableList.of(vectors));
    this.vectors = vectors;
    this.function = function;
    this.stringArgs = ImmutableList.copyOf(stringArgs);
  }

  public ApplyMiscellaneousFunction withVectors(LogicalPlan newVectors) {
    return new ApplyMiscellaneousFunction(newVectors, function, stringArgs);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitApplyMiscellaneousFunction(this, context);
  }
}
