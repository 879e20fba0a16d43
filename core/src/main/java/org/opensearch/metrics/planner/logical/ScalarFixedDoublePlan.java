/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.OptionalDouble;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.query.RangeParams;

/** Number literal. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ScalarFixedDoublePlan extends ScalarPlan {

  private final double scalar;
  private final RangeParams rangeParams;

  public ScalarFixedDoublePlan(double scalar, RangeParams rangeParams) {
    super(ImmutableList.of());
    this.scalar = scalar;
    this.rangeParams = rangeParams;
  }

  @Override
  public OptionalDouble literalValue() {
    return OptionalDouble.of(scalar);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScalarFixedDoublePlan(this, context);
  }
}
