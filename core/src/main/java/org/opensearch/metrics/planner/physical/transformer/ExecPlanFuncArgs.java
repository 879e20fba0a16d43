/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.query.RangeParams;

/**
 * Function argument computed by its own exec plan. The referenced plan belongs to this argument
 * only: it is not a child of any other node and is never inlined into a transformer chain.
 */
@Getter
@RequiredArgsConstructor
public class ExecPlanFuncArgs implements FuncArgs {
  private final ExecPlan execPlan;
  private final RangeParams timeStepParams;

  @Override
  public String toString() {
    return "ExecPlanFuncArgs(" + execPlan.getClass().getSimpleName() + ", " + timeStepParams + ")";
  }
}
