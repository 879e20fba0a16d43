/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.shardkey;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Matches shard-key predicates against a fixed universe of known shard-key values. Results keep
 * the order of the universe and bind the columns in declaration order. Regex predicates must
 * match the whole value.
 */
public class ShardKeyValuesMatcher implements ShardKeyMatcher {

  @Getter
  private final List<String> shardColumns;

  private final List<Map<String, String>> shardKeys;

  public ShardKeyValuesMatcher(List<String> shardColumns, List<Map<String, String>> shardKeys) {
    for (Map<String, String> shardKey : shardKeys) {
      if (!shardKey.keySet().containsAll(shardColumns)) {
        throw new IllegalArgumentException(
            "Shard key " + shardKey + " does not bind all of " + shardColumns);
      }
    }
    this.shardColumns = ImmutableList.copyOf(shardColumns);
    this.shardKeys =
        shardKeys.stream().map(ImmutableMap::copyOf).collect(ImmutableList.toImmutableList());
  }

  @Override
  public List<ShardKeyCombination> match(List<ColumnFilter> shardKeyFilters) {
    return shardKeys.stream()
        .filter(shardKey -> shardKeyFilters.stream().allMatch(f -> matches(f, shardKey)))
        .map(this::toCombination)
        .collect(Collectors.toList());
  }

  private ShardKeyCombination toCombination(Map<String, String> shardKey) {
    return new ShardKeyCombination(
        shardColumns.stream()
            .map(column -> ColumnFilter.equalTo(column, shardKey.get(column)))
            .collect(Collectors.toList()));
  }

  private static boolean matches(ColumnFilter filter, Map<String, String> shardKey) {
    String value = shardKey.getOrDefault(filter.getColumn(), "");
    switch (filter.getType()) {
      case EQUALS:
        return value.equals(filter.getValue());
      case NOT_EQUALS:
        return !value.equals(filter.getValue());
      case EQUALS_REGEX:
        return Pattern.matches(filter.getValue(), value);
      case NOT_EQUALS_REGEX:
        return !Pattern.matches(filter.getValue(), value);
      default:
        throw new IllegalStateException("Unexpected filter type: " + filter.getType());
    }
  }
}
