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

/** Metadata query returning the label sets of the series matching the filters. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class SeriesKeysByFilters extends LogicalPlan {

  private final List<ColumnFilter> filters;
  private final boolean fetchFirstLastSampleTimes;
  private final long startMs;
  private final long endMs;

  public SeriesKeysByFilters(
      List<ColumnFilter> filters, boolean fetchFirstLastSampleTimes, long startMs, long endMs) {
    super(ImmutableList.of());
    this.filters = ImmutableList.copyOf(filters);
    this.fetchFirstLastSampleTimes = fetchFirstLastSampleTimes;
    this.startMs = startMs;
    this.endMs = endMs;
  }

  public SeriesKeysByFilters withFilters(List<ColumnFilter> newFilters) {
    return new SeriesKeysByFilters(newFilters, fetchFirstLastSampleTimes, startMs, endMs);
  }

  @Override
  public List<List<ColumnFilter>> getSelectorFilters() {
    return ImmutableList.of(filters);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSeriesKeysByFilters(this, context);
  }
}
