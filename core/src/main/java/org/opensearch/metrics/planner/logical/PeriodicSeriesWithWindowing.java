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

/** Range function over a sliding window of raw samples, e.g. {@code rate(http_requests[5m])}. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class PeriodicSeriesWithWindowing extends LogicalPlan {

  private final RawSeries series;
  private final long startMs;
  private final long stepMs;
  private final long endMs;
  private final long windowMs;
  private final RangeFunctionId function;
  private final List<Double> functionArgs;
  private final long offsetMs;

  public PeriodicSeriesWithWindowing(
      RawSeries series,
      long startMs,
      long stepMs,
      long endMs,
      long windowMs,
      RangeFunctionId function,
      List<Double> functionArgs,
      long offsetMs) {
    super(ImmutableList.of(series));
    this.series = series;
    this.startMs = startMs;
    this.stepMs = stepMs;
    this.endMs = endMs;
    this.windowMs = windowMs;
    this.function = function;
    this.functionArgs = ImmutableList.copyOf(functionArgs);
    this.offsetMs = offsetMs;
  }

  public PeriodicSeriesWithWindowing withSeries(RawSeries newSeries) {
    return new PeriodicSeriesWithWindowing(
        newSeries, startMs, stepMs, endMs, windowMs, function, functionArgs, offsetMs);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitPeriodicSeriesWithWindowing(this, context);
  }
}
