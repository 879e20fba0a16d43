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

/** Vector-to-vector binary operation with its label matching modifiers. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class BinaryJoin extends LogicalPlan {

  private final LogicalPlan lhs;
  private final BinaryOperator operator;
  private final Cardinality cardinality;
  private final LogicalPlan rhs;
  private final List<String> on;
  private final List<String> ignoring;

  /** Labels copied from the "one" side with group_left / group_right. */
  private final List<String> include;

  public BinaryJoin(
      LogicalPlan lhs,
      BinaryOperator operator,
      Cardinality cardinality,
      LogicalPlan rhs,
      List<String> on,
      List<String> ignoring,
      List<String> include) {
    super(ImmutableList.of(lhs, rhs));
    this.lhs = lhs;
    this.operator = operator;
    this.cardinality = cardinality;
    this.rhs = rhs;
    this.on = ImmutableList.copyOf(on);
    this.ignoring = ImmutableList.copyOf(ignoring);
    this.include = ImmutableList.copyOf(include);
  }

  public BinaryJoin(LogicalPlan lhs, BinaryOperator operator, LogicalPlan rhs) {
    this(
        lhs,
        operator,
        operator.isSetOperator() ? Cardinality.MANY_TO_MANY : Cardinality.ONE_TO_ONE,
        rhs,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of());
  }

  public BinaryJoin withSides(LogicalPlan newLhs, LogicalPlan newRhs) {
    return new BinaryJoin(newLhs, operator, cardinality, newRhs, on, ignoring, include);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitBinaryJoin(this, context);
  }
}
