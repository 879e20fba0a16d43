/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import org.opensearch.metrics.planner.physical.transformer.RangeVectorTransformer;
import org.opensearch.metrics.query.QueryContext;

/**
 * Node of the physical plan handed to the execution runtime. The runtime evaluates the children,
 * combines their results the way the node type dictates, then applies the transformers strictly in
 * the order they were added.
 */
public abstract class ExecPlan {

  @Getter
  private final QueryContext queryContext;

  private final List<RangeVectorTransformer> transformers = new ArrayList<>();

  protected ExecPlan(QueryContext queryContext) {
    this.queryContext = queryContext;
  }

  /** Child plans in evaluation order. */
  public abstract List<ExecPlan> getChildren();

  public List<RangeVectorTransformer> getRangeVectorTransformers() {
    return Collections.unmodifiableList(transformers);
  }

  /** Appends a transformer after every transformer already on this node. */
  public ExecPlan addRangeVectorTransformer(RangeVectorTransformer transformer) {
    transformers.add(transformer);
    return this;
  }

  public abstract <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context);

  /** Multi-line rendering of this plan and its subtrees, for diagnostics. */
  public String printTree() {
    return new ExecPlanPrinter().print(this);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "(children="
        + getChildren().size()
        + ", transformers="
        + transformers.size()
        + ")";
  }
}
