/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Assignment of the shards of one cluster to nodes. The shard count is a power of two so that a
 * shard-key hash and a spread select a contiguous, aligned group of {@code 2^spread} shards.
 */
@ToString
@EqualsAndHashCode
public class ShardMapper {

  private final List<String> nodes;

  /**
   * @param nodes node owning each shard, indexed by shard number
   */
  public ShardMapper(List<String> nodes) {
    int numShards = nodes.size();
    if (numShards == 0 || (numShards & (numShards - 1)) != 0) {
      throw new IllegalArgumentException(
          "Number of shards must be a power of two, got " + numShards);
    }
    this.nodes = ImmutableList.copyOf(nodes);
  }

  /** Assigns {@code numShards} shards to the given nodes round robin. */
  public static ShardMapper roundRobin(int numShards, List<String> nodeIds) {
    if (nodeIds.isEmpty()) {
      throw new IllegalArgumentException("At least one node is required");
    }
    return new ShardMapper(
        IntStream.range(0, numShards)
            .mapToObj(shard -> nodeIds.get(shard % nodeIds.size()))
            .collect(Collectors.toList()));
  }

  /** Hash of the shard-key values, given in shard-key column order. */
  public static int shardKeyHash(List<String> shardKeyValues) {
    return Hashing.murmur3_32_fixed()
        .hashString(String.join("\u0000", shardKeyValues), StandardCharsets.UTF_8)
        .asInt();
  }

  public int numShards() {
    return nodes.size();
  }

  public String nodeForShard(int shard) {
    return nodes.get(shard);
  }

  public List<Integer> allShards() {
    return IntStream.range(0, numShards()).boxed().collect(Collectors.toList());
  }

  /** Shards holding the series of one shard key. */
  public List<Integer> queryShards(int shardKeyHash, int spread) {
    int count = 1 << spread;
    if (count >= numShards()) {
      return allShards();
    }
    int first = shardKeyHash & (numShards() - 1) & ~(count - 1);
    return IntStream.range(first, first + count).boxed().collect(Collectors.toList());
  }
}
