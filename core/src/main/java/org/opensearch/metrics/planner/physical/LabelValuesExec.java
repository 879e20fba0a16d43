/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.filter.ColumnFilter;

/** Looks up distinct label values in one shard's index. */
@Getter
public class LabelValuesExec extends LeafExecPlan {

  private final int shard;
  private final String nodeId;
  private final List<ColumnFilter> filters;
  private final List<String> labelNames;
  private final long startMs;
  private final long endMs;

  public LabelValuesExec(
      QueryContext queryContext,
      int shard,
      String nodeId,
      List<ColumnFilter> filters,
      List<String> labelNames,
      long startMs,
      long endMs) {
    super(queryContext);
    this.shard = shard;
    this.nodeId = nodeId;
    this.filters = ImmutableList.copyOf(filters);
    this.labelNames = ImmutableList.copyOf(labelNames);
    this.startMs = startMs;
    this.endMs = endMs;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitLabelValues(this, context);
  }
}
