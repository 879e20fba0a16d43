/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.metrics.planner.logical.IntervalSelector;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.filter.ColumnFilter;

/** Reads the raw samples of the matching series stored in one shard. */
@Getter
public class MultiSchemaPartitionsExec extends LeafExecPlan {

  private final int shard;
  private final String nodeId;
  private final List<ColumnFilter> filters;
  private final IntervalSelector chunkScan;

  public MultiSchemaPartitionsExec(
      QueryContext queryContext,
      int shard,
      String nodeId,
      List<ColumnFilter> filters,
      IntervalSelector chunkScan) {
    super(queryContext);
    this.shard = shard;
    this.nodeId = nodeId;
    this.filters = ImmutableList.copyOf(filters);
    this.chunkScan = chunkScan;
  }

  @Override
  public <R, C> R accept(ExecPlanVisitor<R, C> visitor, C context) {
    return visitor.visitMultiSchemaPartitions(this, context);
  }
}
