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

/** Binary operation between two scalars, e.g. {@code 1 + 2} or {@code scalar(v) * 2}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ScalarBinaryOperation extends ScalarPlan {

  private final BinaryOperator operator;
  private final ScalarPlan lhs;
  private final ScalarPlan rhs;
  private final RangeParams rangeParams;

  public ScalarBinaryOperation(
      BinaryOperator operator, ScalarPlan lhs, ScalarPlan rhs, RangeParams rangeParams) {
    super(ImmutableList.of(lhs, rhs));
    if (operator.isSetOperator()) {
      throw new IllegalArgumentException(
          "Set operator " + operator.getSymbol() + " not allowed between scalars");
    }
    this.operator = operator;
    this.lhs = lhs;
    this.rhs = rhs;
    this.rangeParams = rangeParams;
  }

  public ScalarBinaryOperation withOperands(ScalarPlan newLhs, ScalarPlan newRhs) {
    return new ScalarBinaryOperation(operator, newLhs, newRhs, rangeParams);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScalarBinaryOperation(this, context);
  }
}
