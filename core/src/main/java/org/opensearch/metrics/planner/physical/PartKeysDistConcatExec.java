/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/** Concatenates series label sets returned by metadata lookups. */
public class PartKeysDistConcatExec extends NonLeafExecPlan {

  public PartKeysDistConcatExec(QueryContext queryContext, List<ExecPlan> children) {
    super(queryContext, children);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitPartKeysDistConcat(this, context);
  }
}
