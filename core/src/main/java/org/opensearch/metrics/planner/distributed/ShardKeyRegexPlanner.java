/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.metrics.common.exception.NoMatchingShardKeysException;
import org.opensearch.metrics.metadata.DatasetOptions;
import org.opensearch.metrics.planner.QueryPlanner;
import org.opensearch.metrics.planner.logical.Aggregate;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.planner.logical.BinaryJoin;
import org.opensearch.metrics.planner.logical.LabelValues;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.logical.PeriodicSeries;
import org.opensearch.metrics.planner.logical.PeriodicSeriesWithWindowing;
import org.opensearch.metrics.planner.logical.RawSeries;
import org.opensearch.metrics.planner.logical.SeriesKeysByFilters;
import org.opensearch.metrics.planner.logical.ShardKeyFilterRewriter;
import org.opensearch.metrics.planner.logical.ShardKeyFilters;
import org.opensearch.metrics.planner.physical.BinaryJoinExec;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.planner.physical.MultiPartitionDistConcatExec;
import org.opensearch.metrics.planner.physical.MultiPartitionReduceAggregateExec;
import org.opensearch.metrics.planner.physical.ReduceAggregateExec;
import org.opensearch.metrics.planner.physical.transformer.AggregateMapReduce;
import org.opensearch.metrics.planner.physical.transformer.AggregatePresenter;
import org.opensearch.metrics.planner.shardkey.ShardKeyCombination;
import org.opensearch.metrics.planner.shardkey.ShardKeyMatcher;
import org.opensearch.metrics.promql.PromQlRenderer;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Expands regex and other non-equality predicates on the shard-key columns into one sub-query per
 * matching shard-key combination. Each sub-query is planned by the delegate planner with its
 * shard-key predicates replaced by the concrete combination and its query text rewritten to the
 * part it evaluates; the sub-plans are merged by the multi-partition combinators.
 *
 * <p>Queries without open shard-key predicates, and queries whose routing was already resolved,
 * are handed to the delegate unchanged.
 */
@Log4j2
@Getter
public class ShardKeyRegexPlanner extends PlannerMaterializer {

  private final DatasetOptions datasetOptions;
  private final QueryPlanner queryPlanner;
  private final ShardKeyMatcher shardKeyMatcher;
  private final ShardKeyFilterRewriter filterRewriter;
  private final PromQlRenderer renderer;

  public ShardKeyRegexPlanner(
      DatasetOptions datasetOptions, QueryPlanner queryPlanner, ShardKeyMatcher shardKeyMatcher) {
    this.datasetOptions = datasetOptions;
    this.queryPlanner = queryPlanner;
    this.shardKeyMatcher = shardKeyMatcher;
    this.filterRewriter = new ShardKeyFilterRewriter(datasetOptions);
    this.renderer = new PromQlRenderer(datasetOptions.getMetricColumn());
  }

  @Override
  public ExecPlan materialize(LogicalPlan logicalPlan, QueryContext queryContext) {
    if (queryContext.getPlannerParams().isRoutingResolved() || !isOpen(logicalPlan)) {
      log.debug("Query {} has no shard key to expand, delegating", queryContext.getQueryId());
      return queryPlanner.materialize(logicalPlan, queryContext);
    }
    ExecPlan plan = walkAndStitch(logicalPlan, queryContext);
    if (log.isDebugEnabled()) {
      log.debug(
          "Expanded query {} [{}] into:\n{}",
          queryContext.getQueryId(),
          queryContext.getOrigQueryParams().getPromQl(),
          plan.printTree());
    }
    return plan;
  }

  @Override
  protected ExecPlan stitch(List<ExecPlan> plans, QueryContext context) {
    return plans.size() == 1 ? plans.get(0) : new MultiPartitionDistConcatExec(context, plans);
  }

  @Override
  public PlanResult visitRawSeries(RawSeries plan, QueryContext context) {
    return PlanResult.of(expandSelection(plan, context));
  }

  @Override
  public PlanResult visitPeriodicSeries(PeriodicSeries plan, QueryContext context) {
    return PlanResult.of(expandSelection(plan, context));
  }

  @Override
  public PlanResult visitPeriodicSeriesWithWindowing(
      PeriodicSeriesWithWindowing plan, QueryContext context) {
    return PlanResult.of(expandSelection(plan, context));
  }

  @Override
  public PlanResult visitSeriesKeysByFilters(SeriesKeysByFilters plan, QueryContext context) {
    return PlanResult.of(expandSelection(plan, context));
  }

  @Override
  public PlanResult visitLabelValues(LabelValues plan, QueryContext context) {
    return PlanResult.of(expandSelection(plan, context));
  }

  @Override
  public PlanResult visitBinaryJoin(BinaryJoin plan, QueryContext context) {
    return PlanResult.of(
        new BinaryJoinExec(
            context,
            expandSubtree(plan.getLhs(), context),
            expandSubtree(plan.getRhs(), context),
            plan.getOperator(),
            plan.getCardinality(),
            plan.getOn(),
            plan.getIgnoring(),
            plan.getInclude()));
  }

  /**
   * An aggregation over a single shard-key predicate set is pushed down to every partition and
   * merged. Partial results of non-associative operators cannot be merged, so a subtree holding
   * one at any depth is only accepted when exactly one partition matches.
   */
  @Override
  public PlanResult visitAggregate(Aggregate plan, QueryContext context) {
    if (!isOpen(plan)) {
      return PlanResult.of(delegate(plan, context));
    }
    List<List<ColumnFilter>> shardKeySets = ShardKeyFilters.distinctSets(plan, datasetOptions);
    if (shardKeySets.size() > 1) {
      log.info(
          "Aggregation {} of query {} spans {} shard key sets, aggregating over expanded child",
          plan.getOperator().getDisplayName(),
          context.getQueryId(),
          shardKeySets.size());
      return PlanResult.of(aggregateOnTop(plan, context));
    }
    List<ShardKeyCombination> combinations = resolve(shardKeySets.get(0), context);
    if (combinations.size() == 1) {
      return PlanResult.of(delegate(bind(plan, combinations.get(0)), context));
    }
    Optional<AggregationOperator> nonAssociative =
        plan.getAggregationOperators().stream()
            .filter(operator -> !operator.isAssociative())
            .findFirst();
    if (nonAssociative.isPresent()) {
      throw new UnsupportedOperationException(
          "Shard Key regex not supported for " + nonAssociative.get().getDisplayName());
    }
    QueryContext partialContext =
        context.withPlannerParams(context.getPlannerParams().withSkipAggregatePresent(true));
    List<ExecPlan> partials =
        combinations.stream()
            .map(combination -> delegate(bind(plan, combination), partialContext))
            .collect(Collectors.toList());
    return PlanResult.of(reduce(plan, partials, context));
  }

  private ExecPlan aggregateOnTop(Aggregate plan, QueryContext context) {
    ExecPlan child =
        walkAndStitch(
            plan.getVectors(),
            context.withPlannerParams(
                context.getPlannerParams().withSkipAggregatePresent(false)));
    child.addRangeVectorTransformer(
        new AggregateMapReduce(
            plan.getOperator(), plan.getParams(), plan.getBy(), plan.getWithout()));
    return reduce(plan, List.of(child), context);
  }

  private ExecPlan reduce(Aggregate plan, List<ExecPlan> children, QueryContext context) {
    ReduceAggregateExec reducer =
        new MultiPartitionReduceAggregateExec(
            context, children, plan.getOperator(), plan.getParams());
    if (!context.getPlannerParams().isSkipAggregatePresent()) {
      reducer.addRangeVectorTransformer(
          new AggregatePresenter(plan.getOperator(), plan.getParams(), rangeParams(context)));
    }
    return reducer;
  }

  private ExecPlan expandSelection(LogicalPlan plan, QueryContext context) {
    if (!isOpen(plan)) {
      return delegate(plan, context);
    }
    List<ShardKeyCombination> combinations =
        resolve(ShardKeyFilters.distinctSets(plan, datasetOptions).get(0), context);
    return stitch(
        combinations.stream()
            .map(combination -> delegate(bind(plan, combination), context))
            .collect(Collectors.toList()),
        context);
  }

  private ExecPlan expandSubtree(LogicalPlan plan, QueryContext context) {
    return isOpen(plan) ? walkAndStitch(plan, context) : delegate(plan, context);
  }

  private List<ShardKeyCombination> resolve(
      List<ColumnFilter> shardKeyFilters, QueryContext context) {
    List<ShardKeyCombination> combinations = shardKeyMatcher.match(shardKeyFilters);
    if (combinations.isEmpty()) {
      throw new NoMatchingShardKeysException(
          "No shard key matches " + shardKeyFilters + " in query " + context.getQueryId());
    }
    List<String> shardColumns = datasetOptions.getNonMetricShardColumns();
    for (ShardKeyCombination combination : combinations) {
      if (!combination.binds(shardColumns)) {
        throw new IllegalStateException(
            "Shard key matcher returned "
                + combination
                + " which does not bind each of "
                + shardColumns
                + " exactly once");
      }
    }
    log.info(
        "Shard key filters {} of query {} resolved to {} combinations",
        shardKeyFilters,
        context.getQueryId(),
        combinations.size());
    return combinations;
  }

  private LogicalPlan bind(LogicalPlan plan, ShardKeyCombination combination) {
    return filterRewriter.rewrite(plan, combination.getFilters());
  }

  /** Plans a fully bound sub-plan with the delegate, under a context carrying its own text. */
  private ExecPlan delegate(LogicalPlan plan, QueryContext context) {
    String promQl = renderer.render(plan);
    log.debug("Delegating [{}] of query {}", promQl, context.getQueryId());
    QueryContext childContext =
        context
            .withQueryParams(context.getOrigQueryParams().withPromQl(promQl))
            .withPlannerParams(context.getPlannerParams().withRoutingResolved(true));
    return queryPlanner.materialize(plan, childContext);
  }

  private boolean isOpen(LogicalPlan plan) {
    return ShardKeyFilters.hasOpenShardKeyFilter(plan, datasetOptions);
  }
}
