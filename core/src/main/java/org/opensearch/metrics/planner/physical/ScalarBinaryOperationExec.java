/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import lombok.Getter;
import org.opensearch.metrics.planner.logical.BinaryOperator;
import org.opensearch.metrics.planner.physical.transformer.FuncArgs;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.RangeParams;

/**
 * Computes a binary operation between two scalar operands per step. Operands backed by an exec
 * plan are evaluated first.
 */
@Getter
public class ScalarBinaryOperationExec extends LeafExecPlan {

  private final RangeParams rangeParams;
  private final BinaryOperator operator;
  private final FuncArgs lhs;
  private final FuncArgs rhs;

  public ScalarBinaryOperationExec(
      QueryContext queryContext,
      RangeParams rangeParams,
      BinaryOperator operator,
      FuncArgs lhs,
      FuncArgs rhs) {
    super(queryContext);
    this.rangeParams = rangeParams;
    this.operator = operator;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitScalarBinaryOperation(this, context);
  }
}
