/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.shardkey;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * One concrete partition: an equality predicate per shard-key column, e.g. {@code
 * _ws_="demo",_ns_="App-1"}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ShardKeyCombination {

  private final List<ColumnFilter> filters;

  public ShardKeyCombination(List<ColumnFilter> filters) {
    for (ColumnFilter filter : filters) {
      if (!filter.isConcrete()) {
        throw new IllegalArgumentException(
            "Shard key combination must only hold equality filters, found " + filter);
      }
    }
    this.filters = ImmutableList.copyOf(filters);
  }

  public static ShardKeyCombination of(ColumnFilter... filters) {
    return new ShardKeyCombination(Arrays.asList(filters));
  }

  /** True when every given column is bound by exactly one filter of this combination. */
  public boolean binds(Collection<String> columns) {
    return columns.stream()
        .allMatch(
            column -> filters.stream().filter(f -> f.getColumn().equals(column)).count() == 1);
  }
}
