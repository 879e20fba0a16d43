/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Binary operation between a scalar and a vector, e.g. {@code 1 + http_requests}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class ScalarVectorBinaryOperation extends LogicalPlan {

  private final BinaryOperator operator;
  private final ScalarPlan scalarArg;
  private final LogicalPlan vector;
  private final boolean scalarIsLhs;

  public ScalarVectorBinaryOperation(
      BinaryOperator operator, ScalarPlan scalarArg, LogicalPlan vector, boolean scalarIsLhs) {
    super(ImmutableList.of(scalarArg, vector));
    this.operator = operator;
    this.scalarArg = scalarArg;
    this.vector = vector;
    this.scalarIsLhs = scalarIsLhs;
  }

  public ScalarVectorBinaryOperation withOperands(ScalarPlan newScalarArg, LogicalPlan newVector) {
    return new ScalarVectorBinaryOperation(operator, newScalarArg, newVector, scalarIsLhs);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitScalarVectorBinaryOperation(this, context);
  }
}
