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

/** Looks up the label sets of matching series in one shard's index. */
@Getter
public class PartKeysExec extends LeafExecPlan {

  private final int shard;
  private final String nodeId;
  private final List<ColumnFilter> filters;
  private final boolean fetchFirstLastSampleTimes;
  private final long startMs;
  private final long endMs;

  public PartKeysExec(
      QueryContext queryContext,
      int shard,
      String nodeId,
      List<ColumnFilter> filters,
      boolean fetchFirstLastSampleTimes,
      long startMs,
      long endMs) {
    super(queryContext);
    this.shard = shard;
    this.nodeId = nodeId;
    this.filters = ImmutableList.copyOf(filters);
    this.fetchFirstLastSampleTimes = fetchFirstLastSampleTimes;
    this.startMs = startMs;
    this.endMs = endMs;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitPartKeys(this, context);
  }
}
