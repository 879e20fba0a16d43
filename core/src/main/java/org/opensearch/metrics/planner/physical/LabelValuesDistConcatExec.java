/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/** Unions the label values returned by its children, dropping duplicates. */
public class LabelValuesDistConcatExec extends NonLeafExecPlan {

  public LabelValuesDistConcatExec(QueryContext queryContext, List<ExecPlan> children) {
    super(queryContext, children);
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLabelValuesDistConcat(this, context);
  }
}
