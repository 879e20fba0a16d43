/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.metrics.common.exception.BadQueryException;
import org.opensearch.metrics.common.setting.QueryConfig;
import org.opensearch.metrics.metadata.DatasetOptions;
import org.opensearch.metrics.planner.logical.Aggregate;
import org.opensearch.metrics.planner.logical.BinaryJoin;
import org.opensearch.metrics.planner.logical.IntervalSelector;
import org.opensearch.metrics.planner.logical.LabelValues;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.logical.PeriodicSeries;
import org.opensearch.metrics.planner.logical.PeriodicSeriesWithWindowing;
import org.opensearch.metrics.planner.logical.RawSeries;
import org.opensearch.metrics.planner.logical.SeriesKeysByFilters;
import org.opensearch.metrics.planner.physical.BinaryJoinExec;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.planner.physical.LabelValuesDistConcatExec;
import org.opensearch.metrics.planner.physical.LabelValuesExec;
import org.opensearch.metrics.planner.physical.LocalPartitionDistConcatExec;
import org.opensearch.metrics.planner.physical.LocalPartitionReduceAggregateExec;
import org.opensearch.metrics.planner.physical.MultiSchemaPartitionsExec;
import org.opensearch.metrics.planner.physical.PartKeysDistConcatExec;
import org.opensearch.metrics.planner.physical.PartKeysExec;
import org.opensearch.metrics.planner.physical.ReduceAggregateExec;
import org.opensearch.metrics.planner.physical.transformer.AggregateMapReduce;
import org.opensearch.metrics.planner.physical.transformer.AggregatePresenter;
import org.opensearch.metrics.planner.physical.transformer.PeriodicSamplesMapper;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Plans a query against the shards of one cluster. Series selections become one leaf per shard
 * owning the selected shard key; aggregations map on every leaf and reduce once.
 */
@Log4j2
@Getter
@RequiredArgsConstructor
public class SingleClusterPlanner extends PlannerMaterializer {

  private final DatasetOptions datasetOptions;
  private final ShardMapper shardMapper;
  private final QueryConfig queryConfig;

  @Override
  public ExecPlan materialize(LogicalPlan logicalPlan, QueryContext queryContext) {
    ExecPlan plan = walkAndStitch(logicalPlan, queryContext);
    log.debug(
        "Planned query {} [{}] on {} shards",
        queryContext.getQueryId(),
        queryContext.getOrigQueryParams().getPromQl(),
        shardMapper.numShards());
    return plan;
  }

  @Override
  protected ExecPlan stitch(List<ExecPlan> plans, QueryContext context) {
    return plans.size() == 1 ? plans.get(0) : new LocalPartitionDistConcatExec(context, plans);
  }

  @Override
  public PlanResult visitRawSeries(RawSeries plan, QueryContext context) {
    return new PlanResult(selectSeries(plan, plan.getRangeSelector(), context));
  }

  @Override
  public PlanResult visitPeriodicSeries(PeriodicSeries plan, QueryContext context) {
    validateStep(plan.getStartMs(), plan.getStepMs(), plan.getEndMs());
    IntervalSelector chunkScan =
        new IntervalSelector(
            plan.getStartMs() - queryConfig.getStaleSampleAfterMs() - plan.getOffsetMs(),
            plan.getEndMs() - plan.getOffsetMs());
    List<ExecPlan> leaves = selectSeries(plan.getRawSeries(), chunkScan, context);
    leaves.forEach(
        leaf ->
            leaf.addRangeVectorTransformer(
                new PeriodicSamplesMapper(
                    plan.getStartMs(),
                    plan.getStepMs(),
                    plan.getEndMs(),
                    0L,
                    Optional.empty(),
                    List.of(),
                    plan.getOffsetMs())));
    return new PlanResult(leaves);
  }

  @Override
  public PlanResult visitPeriodicSeriesWithWindowing(
      PeriodicSeriesWithWindowing plan, QueryContext context) {
    validateStep(plan.getStartMs(), plan.getStepMs(), plan.getEndMs());
    IntervalSelector chunkScan =
        new IntervalSelector(
            plan.getStartMs() - plan.getWindowMs() - plan.getOffsetMs(),
            plan.getEndMs() - plan.getOffsetMs());
    List<ExecPlan> leaves = selectSeries(plan.getSeries(), chunkScan, context);
    leaves.forEach(
        leaf ->
            leaf.addRangeVectorTransformer(
                new PeriodicSamplesMapper(
                    plan.getStartMs(),
                    plan.getStepMs(),
                    plan.getEndMs(),
                    plan.getWindowMs(),
                    Optional.of(plan.getFunction()),
                    plan.getFunctionArgs(),
                    plan.getOffsetMs())));
    return new PlanResult(leaves);
  }

  @Override
  public PlanResult visitAggregate(Aggregate plan, QueryContext context) {
    // Only the outermost aggregation may hand unpresented state to a remote merge.
    QueryContext childContext =
        context.withPlannerParams(context.getPlannerParams().withSkipAggregatePresent(false));
    List<ExecPlan> mapped = walk(plan.getVectors(), childContext).getPlans();
    mapped.forEach(
        child ->
            child.addRangeVectorTransformer(
                new AggregateMapReduce(
                    plan.getOperator(), plan.getParams(), plan.getBy(), plan.getWithout())));
    ReduceAggregateExec reducer =
        new LocalPartitionReduceAggregateExec(
            context, mapped, plan.getOperator(), plan.getParams());
    if (!context.getPlannerParams().isSkipAggregatePresent()) {
      reducer.addRangeVectorTransformer(
          new AggregatePresenter(plan.getOperator(), plan.getParams(), rangeParams(context)));
    }
    return PlanResult.of(reducer);
  }

  @Override
  public PlanResult visitBinaryJoin(BinaryJoin plan, QueryContext context) {
    return PlanResult.of(
        new BinaryJoinExec(
            context,
            walkAndStitch(plan.getLhs(), context),
            walkAndStitch(plan.getRhs(), context),
            plan.getOperator(),
            plan.getCardinality(),
            plan.getOn(),
            plan.getIgnoring(),
            plan.getInclude()));
  }

  @Override
  public PlanResult visitSeriesKeysByFilters(SeriesKeysByFilters plan, QueryContext context) {
    List<ExecPlan> leaves =
        metadataShards(plan.getFilters()).stream()
            .map(
                shard ->
                    (ExecPlan)
                        new PartKeysExec(
                            context,
                            shard,
                            shardMapper.nodeForShard(shard),
                            plan.getFilters(),
                            plan.isFetchFirstLastSampleTimes(),
                            plan.getStartMs(),
                            plan.getEndMs()))
            .collect(Collectors.toList());
    return PlanResult.of(new PartKeysDistConcatExec(context, leaves));
  }

  @Override
  public PlanResult visitLabelValues(LabelValues plan, QueryContext context) {
    List<ExecPlan> leaves =
        metadataShards(plan.getFilters()).stream()
            .map(
                shard ->
                    (ExecPlan)
                        new LabelValuesExec(
                            context,
                            shard,
                            shardMapper.nodeForShard(shard),
                            plan.getFilters(),
                            plan.getLabelNames(),
                            plan.getStartMs(),
                            plan.getEndMs()))
            .collect(Collectors.toList());
    return PlanResult.of(new LabelValuesDistConcatExec(context, leaves));
  }

  private List<ExecPlan> selectSeries(
      RawSeries series, IntervalSelector chunkScan, QueryContext context) {
    Optional<List<String>> shardKey = shardKeyValues(series.getFilters());
    if (shardKey.isEmpty()) {
      throw new BadQueryException(
          "Series selection must bind every shard key column "
              + datasetOptions.getShardKeyColumns()
              + " with an equality filter: "
              + series.getFilters());
    }
    return shardMapper
        .queryShards(ShardMapper.shardKeyHash(shardKey.get()), queryConfig.getDefaultSpread())
        .stream()
        .map(
            shard ->
                (ExecPlan)
                    new MultiSchemaPartitionsExec(
                        context,
                        shard,
                        shardMapper.nodeForShard(shard),
                        series.getFilters(),
                        chunkScan))
        .collect(Collectors.toList());
  }

  /** Metadata queries fan out to every shard unless the shard key is fully bound. */
  private List<Integer> metadataShards(List<ColumnFilter> filters) {
    return shardKeyValues(filters)
        .map(
            values ->
                shardMapper.queryShards(
                    ShardMapper.shardKeyHash(values), queryConfig.getDefaultSpread()))
        .orElseGet(shardMapper::allShards);
  }

  /** Values of the shard-key columns in declaration order, when all are bound by equality. */
  private Optional<List<String>> shardKeyValues(List<ColumnFilter> filters) {
    Map<String, String> bound =
        filters.stream()
            .filter(ColumnFilter::isConcrete)
            .collect(
                Collectors.toMap(
                    ColumnFilter::getColumn, ColumnFilter::getValue, (first, second) -> first));
    List<String> columns = datasetOptions.getShardKeyColumns();
    if (!bound.keySet().containsAll(columns)) {
      return Optional.empty();
    }
    return Optional.of(columns.stream().map(bound::get).collect(Collectors.toList()));
  }

  /** Instant queries, where start equals end, carry no meaningful step. */
  private void validateStep(long startMs, long stepMs, long endMs) {
    if (startMs != endMs && stepMs < queryConfig.getMinStepMs()) {
      throw new BadQueryException(
          String.format(
              "Step %dms is smaller than the minimum step %dms",
              stepMs, queryConfig.getMinStepMs()));
    }
  }
}
