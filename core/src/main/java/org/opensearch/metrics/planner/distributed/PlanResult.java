/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.planner.physical.ExecPlan;

/** Plans produced for one logical node, not yet combined under a common parent. */
@Getter
@ToString
public class PlanResult {

  private final List<ExecPlan> plans;

  public PlanResult(List<ExecPlan> plans) {
    if (plans.isEmpty()) {
      throw new IllegalArgumentException("A plan result needs at least one plan");
    }
    this.plans = ImmutableList.copyOf(plans);
  }

  public static PlanResult of(ExecPlan plan) {
    return new PlanResult(ImmutableList.of(plan));
  }
}
