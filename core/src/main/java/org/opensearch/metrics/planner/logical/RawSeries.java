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

/** Raw samples of every series matching the filters, e.g. {@code http_requests{job="api"}[5m]}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class RawSeries extends LogicalPlan {

  private final IntervalSelector rangeSelector;
  private final List<ColumnFilter> filters;

  /** Range written after the selector, zero when the selector has none. */
  private final long lookbackMs;

  private final long offsetMs;

  public RawSeries(
      IntervalSelector rangeSelector, List<ColumnFilter> filters, long lookbackMs, long offsetMs) {
    super(ImmutableList.of());
    this.rangeSelector = rangeSelector;
    this.filters = ImmutableList.copyOf(filters);
    this.lookbackMs = lookbackMs;
    this.offsetMs = offsetMs;
  }

  public RawSeries(IntervalSelector rangeSelector, List<ColumnFilter> filters) {
    this(rangeSelector, filters, 0L, 0L);
  }

  public RawSeries withFilters(List<ColumnFilter> newFilters) {
    return new RawSeries(rangeSelector, newFilters, lookbackMs, offsetMs);
  }

  @Override
  public List<List<ColumnFilter>> getSelectorFilters() {
    return ImmutableList.of(filters);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitRawSeries(this, context);
  }
}
