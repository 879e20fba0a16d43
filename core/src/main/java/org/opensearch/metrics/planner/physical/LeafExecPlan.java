/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/** Exec plan that produces data itself instead of combining children. */
public abstract class LeafExecPlan extends ExecPlan {

  protected LeafExecPlan(QueryContext queryContext) {
    super(queryContext);
  }

  @Override
  public List<ExecPlan> getChildren() {
    return List.of();
  }
}
