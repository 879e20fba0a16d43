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
import org.opensearch.metrics.query.filter.ColumnFilter;

/** Metadata query returning the distinct values of the given labels among matching series. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class LabelValues extends LogicalPlan {

  private final List<String> labelNames;
  private final List<ColumnFilter> filters;
  private final long startMs;
  private final long endMs;

  public LabelValues(
      List<String> labelNames, List<ColumnFilter> filters, long startMs, long endMs) {
    super(ImmutableList.of());
    this.labelNames = ImmutableList.copyOf(labelNames);
    this.filters = ImmutableList.copyOf(filters);
    this.startMs = startMs;
    this.endMs = endMs;
  }

  public LabelValues withFilters(List<ColumnFilter> newFilters) {
    return new LabelValues(labelNames, newFilters, startMs, endMs);
  }

  @Override
  public List<List<ColumnFilter>> getSelectorFilters() {
    return ImmutableList.of(filters);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitLabelValues(this, context);
  }
}
