/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.metrics.query.QueryContext;

/** Exec plan combining the results of its children. */
public abstract class NonLeafExecPlan extends ExecPlan {

  private final List<ExecPlan> children;

  protected NonLeafExecPlan(QueryContext queryContext, List<ExecPlan> children) {
    super(queryContext);
    if (children.isEmpty()) {
      throw new IllegalArgumentException(
          getClass().getSimpleName() + " needs at least one child plan");
    }
    this.children = ImmutableList.copyOf(children);
  }

  @Override
  public List<ExecPlan> getChildren() {
    return children;
  }
}
