/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.config;

import com.google.common.base.Splitter;
import java.time.Duration;
import java.util.List;
import org.opensearch.metrics.common.setting.QueryConfig;
import org.opensearch.metrics.metadata.DatasetOptions;
import org.opensearch.metrics.planner.distributed.ShardKeyRegexPlanner;
import org.opensearch.metrics.planner.distributed.ShardMapper;
import org.opensearch.metrics.planner.distributed.SingleClusterPlanner;
import org.opensearch.metrics.planner.shardkey.ShardKeyMatcher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.PropertySource;

/**
 * Wires the planners from {@code query-planner.properties}. The {@link ShardKeyMatcher} is not
 * defined here; the embedding application provides it.
 */
@Configuration
@PropertySource("classpath:query-planner.properties")
public class QueryPlannerConfig {

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  @Value("${metrics.dataset.shard-key-columns}")
  private String shardKeyColumns;

  @Value("${metrics.dataset.metric-column:" + DatasetOptions.DEFAULT_METRIC_COLUMN + "}")
  private String metricColumn;

  @Value("${metrics.cluster.num-shards}")
  private int numShards;

  @Value("${metrics.cluster.nodes}")
  private String nodes;

  @Value("${metrics.query.default-spread:" + QueryConfig.DEFAULT_SPREAD + "}")
  private int defaultSpread;

  @Value("${metrics.query.stale-sample-after-ms:300000}")
  private long staleSampleAfterMs;

  @Value("${metrics.query.min-step-ms:1000}")
  private long minStepMs;

  @Bean
  public QueryConfig queryConfig() {
    return QueryConfig.builder()
        .defaultSpread(defaultSpread)
        .staleSampleAfter(Duration.ofMillis(staleSampleAfterMs))
        .minStep(Duration.ofMillis(minStepMs))
        .build();
  }

  @Bean
  public DatasetOptions datasetOptions() {
    return new DatasetOptions(LIST_SPLITTER.splitToList(shardKeyColumns), metricColumn);
  }

  @Bean
  public ShardMapper shardMapper() {
    List<String> nodeIds = LIST_SPLITTER.splitToList(nodes);
    return ShardMapper.roundRobin(numShards, nodeIds);
  }

  @Bean
  public SingleClusterPlanner singleClusterPlanner(
      DatasetOptions datasetOptions, ShardMapper shardMapper, QueryConfig queryConfig) {
    return new SingleClusterPlanner(datasetOptions, shardMapper, queryConfig);
  }

  /**
   * Entry point for queries: expands shard-key regexes and delegates to the single-cluster
   * planner.
   */
  @Bean
  @Primary
  public ShardKeyRegexPlanner shardKeyRegexPlanner(
      DatasetOptions datasetOptions,
      SingleClusterPlanner singleClusterPlanner,
      ShardKeyMatcher shardKeyMatcher) {
    return new ShardKeyRegexPlanner(datasetOptions, singleClusterPlanner, shardKeyMatcher);
  }
}
