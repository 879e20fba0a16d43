/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.RangeFunctionId;

/** Samples raw series at every step, optionally applying a range function over a window. */
@Getter
@ToString
@EqualsAndHashCode
public class PeriodicSamplesMapper implements RangeVectorTransformer {

  private final long startMs;
  private final long stepMs;
  private final long endMs;
  private final long windowMs;
  private final Optional<RangeFunctionId> function;
  private final List<Double> functionArgs;
  private final long offsetMs;

  public PeriodicSamplesMapper(
      long startMs,
      long stepMs,
      long endMs,
      long windowMs,
      Optional<RangeFunctionId> function,
      List<Double> functionArgs,
      long offsetMs) {
    this.startMs = startMs;
    this.stepMs = stepMs;
    this.endMs = endMs;
    this.windowMs = windowMs;
    this.function = function;
    this.functionArgs = ImmutableList.copyOf(functionArgs);
    this.offsetMs = offsetMs;
  }

  @Override
  public String args() {
    return String.format(
        "start=%d, step=%d, end=%d, window=%d, functionId=%s, rawSource=true, offsetMs=%d",
        startMs, stepMs, endMs, windowMs, function.map(Enum::name).orElse("None"), offsetMs);
  }
}
