/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.metrics.planner.logical.BinaryOperator;
import org.opensearch.metrics.planner.logical.Cardinality;
import org.opensearch.metrics.query.QueryContext;

/** Joins the complete results of its two sides; the join itself always runs above them. */
@Getter
public class BinaryJoinExec extends NonLeafExecPlan {

  private final ExecPlan lhs;
  private final ExecPlan rhs;
  private final BinaryOperator operator;
  private final Cardinality cardinality;
  private final List<String> on;
  private final List<String> ignoring;
  private final List<String> include;

  public BinaryJoinExec(
      QueryContext queryContext,
      ExecPlan lhs,
      ExecPlan rhs,
      BinaryOperator operator,
      Cardinality cardinality,
      List<String> on,
      List<String> ignoring,
      List<String> include) {
    super(queryContext, ImmutableList.of(lhs, rhs));
    this.lhs = lhs;
    this.rhs = rhs;
    this.operator = operator;
    this.cardinality = cardinality;
    this.on = ImmutableList.copyOf(on);
    this.ignoring = ImmutableList.copyOf(ignoring);
    this.include = ImmutableList.copyOf(include);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitBinaryJoin(this, context);
  }
}
