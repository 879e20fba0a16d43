/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/**
 * Concatenates the results of several partitions. Each child is the complete plan of one
 * partition, in the order the partitions were resolved.
 */
public class MultiPartitionDistConcatExec extends NonLeafExecPlan {

  public MultiPartitionDistConcatExec(QueryContext queryContext, List<ExecPlan> children) {
    super(queryContext, children);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitMultiPartitionDistConcat(this, context);
  }
}
