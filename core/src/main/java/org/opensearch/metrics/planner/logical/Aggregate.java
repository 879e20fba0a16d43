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

/**
 * Aggregation across series, e.g. {@code sum(v) by (job)}. Params carry the operator's leading
 * argument: the k of topk, the label of count_values, the quantile of quantile.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class Aggregate extends LogicalPlan {

  private final AggregationOperator operator;
  private final LogicalPlan vectors;
  private final List<Object> params;
  private final List<String> by;
  private final List<String> without;

  public Aggregate(
      AggregationOperator operator,
      LogicalPlan vectors,
      List<Object> params,
      List<String> by,
      List<String> without) {
    super(ImmutableList.of(vectors));
    if (!by.isEmpty() && !without.isEmpty()) {
      throw new IllegalArgumentException("An aggregation cannot group both by and without labels");
    }
    this.operator = operator;
    this.vectors = vectors;
    this.params = ImmutableList.copyOf(params);
    this.by = ImmutableList.copyOf(by);
    this.without = ImmutableList.copyOf(without);
  }

  public Aggregate(AggregationOperator operator, LogicalPlan vectors) {
    this(operator, vectors, ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  public Aggregate withVectors(LogicalPlan newVectors) {
    return new Aggregate(operator, newVectors, params, by, without);
  }

  @Override
  public List<AggregationOperator> getAggregationOperators() {
    return ImmutableList.<AggregationOperator>builder()
        .add(operator)
        .addAll(super.getAggregationOperators())
        .build();
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitAggregate(this, context);
  }
}
