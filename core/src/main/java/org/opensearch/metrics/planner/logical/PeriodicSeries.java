/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Instant vector selector sampled at every step between start and end. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = true)
public class PeriodicSeries extends LogicalPlan {

  private final RawSeries rawSeries;
  private final long startMs;
  private final long stepMs;
  private final long endMs;
  private final long offsetMs;

  public PeriodicSeries(RawSeries rawSeries, long startMs, long stepMs, long endMs, long offsetMs) {
    super(ImmutableList.of(rawSeries));
    this.rawSeries = rawSeries;
    this.startMs = startMs;
    this.stepMs = stepMs;
    this.endMs = endMs;
    this.offsetMs = offsetMs;
  }

  public PeriodicSeries(RawSeries rawSeries, long startMs, long stepMs, long endMs) {
    this(rawSeries, startMs, stepMs, endMs, 0L);
  }

  public PeriodicSeries withRawSeries(RawSeries newRawSeries) {
    return new PeriodicSeries(newRawSeries, startMs, stepMs, endMs, offsetMs);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitPeriodicSeries(this, context);
  }
}
