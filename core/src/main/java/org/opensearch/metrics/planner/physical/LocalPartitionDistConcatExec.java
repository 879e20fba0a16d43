/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/** Concatenates the series of shards that all belong to one partition. */
public class LocalPartitionDistConcatExec extends NonLeafExecPlan {

  public LocalPartitionDistConcatExec(QueryContext queryContext, List<ExecPlan> children) {
    super(queryContext, children);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLocalPartitionDistConcat(this, context);
  }
}
