/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner;

import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.query.QueryContext;

/** Turns a logical plan into an executable plan. */
public interface QueryPlanner {

  /**
   * Materialize the logical plan.
   *
   * @param logicalPlan plan to materialize
   * @param queryContext context of the request, copied onto the produced nodes
   * @return root of the exec plan tree
   */
  ExecPlan materialize(LogicalPlan logicalPlan, QueryContext queryContext);
}
