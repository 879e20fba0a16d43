/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.shardkey;

import java.util.List;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Resolves shard-key predicates, concrete or not, to the concrete shard-key combinations that
 * currently exist. Implementations are supplied by the embedding application.
 */
@FunctionalInterface
public interface ShardKeyMatcher {

  /**
   * @param shardKeyFilters predicates on the non-metric shard-key columns of one selector
   * @return matching combinations, possibly empty
   */
  List<ShardKeyCombination> match(List<ColumnFilter> shardKeyFilters);
}
