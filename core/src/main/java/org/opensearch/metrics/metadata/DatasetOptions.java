/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.metadata;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Shard-key layout of a time-series dataset. The metric column is part of the shard key but is
 * never expanded; the remaining shard-key columns are the ones resolved against the partition
 * universe.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DatasetOptions {

  public static final String DEFAULT_METRIC_COLUMN = "__name__";

  private final List<String> shardKeyColumns;
  private final String metricColumn;

  public DatasetOptions(List<String> shardKeyColumns, String metricColumn) {
    if (!shardKeyColumns.contains(metricColumn)) {
      throw new IllegalArgumentException(
          "Metric column " + metricColumn + " must be one of the shard key columns");
    }
    this.shardKeyColumns = ImmutableList.copyOf(shardKeyColumns);
    this.metricColumn = metricColumn;
  }

  /** Shard-key columns other than the metric column, in declaration order. */
  public List<String> getNonMetricShardColumns() {
    return shardKeyColumns.stream()
        .filter(column -> !column.equals(metricColumn))
        .collect(ImmutableList.toImmutableList());
  }

  public boolean isNonMetricShardColumn(String column) {
    return !column.equals(metricColumn) && shardKeyColumns.contains(column);
  }
}
