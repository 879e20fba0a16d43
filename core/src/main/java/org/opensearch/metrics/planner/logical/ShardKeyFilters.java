/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;
import org.opensearch.metrics.metadata.DatasetOptions;
import org.opensearch.metrics.query.filter.ColumnFilter;

/** Reads the predicates a plan places on the non-metric shard-key columns. */
@UtilityClass
public class ShardKeyFilters {

  /** Shard-key predicates of every selector of the plan, one list per selector. */
  public List<List<ColumnFilter>> perSelector(LogicalPlan plan, DatasetOptions options) {
    return plan.getSelectorFilters().stream()
        .map(filters -> restrict(filters, options))
        .collect(Collectors.toList());
  }

  /** Distinct shard-key predicate sets of the plan, ignoring predicate order within a selector. */
  public List<List<ColumnFilter>> distinctSets(LogicalPlan plan, DatasetOptions options) {
    Set<Set<ColumnFilter>> seen = new HashSet<>();
    return perSelector(plan, options).stream()
        .filter(filters -> seen.add(new LinkedHashSet<>(filters)))
        .collect(Collectors.toList());
  }

  /** True when some selector leaves a shard-key column open, e.g. with a regex. */
  public boolean hasOpenShardKeyFilter(LogicalPlan plan, DatasetOptions options) {
    return perSelector(plan, options).stream()
        .flatMap(List::stream)
        .anyMatch(filter -> !filter.isConcrete());
  }

  public List<ColumnFilter> restrict(List<ColumnFilter> filters, DatasetOptions options) {
    return filters.stream()
        .filter(filter -> options.isNonMetricShardColumn(filter.getColumn()))
        .collect(Collectors.toList());
  }
}
