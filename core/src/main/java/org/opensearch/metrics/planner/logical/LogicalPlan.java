/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Node of the logical plan produced by the PromQL parser. Plans are immutable; every rewrite
 * builds a new tree and may share untouched subtrees with the old one.
 */
@ToString
@EqualsAndHashCode
public abstract class LogicalPlan {

  @Getter
  private final List<LogicalPlan> children;

  protected LogicalPlan(List<LogicalPlan> children) {
    this.children = ImmutableList.copyOf(children);
  }

  /**
   * Filters of every series selector in this subtree, one list per selector, in left to right
   * order.
   */
  public List<List<ColumnFilter>> getSelectorFilters() {
    return children.stream()
        .flatMap(child -> child.getSelectorFilters().stream())
        .collect(Collectors.toList());
  }

  /** Operators of every aggregation in this subtree, outermost first. */
  public List<AggregationOperator> getAggregationOperators() {
    return children.stream()
        .flatMap(child -> child.getAggregationOperators().stream())
        .collect(Collectors.toList());
  }

  /**
   * Dispatches to the visit method of this node type.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> result type
   * @param <C> context type
   * @return visitor result
   */
  public abstract <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context);
}
