/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.opensearch.metrics.planner.PlanFixtures.DATASET;
import static org.opensearch.metrics.planner.PlanFixtures.END_SECS;
import static org.opensearch.metrics.planner.PlanFixtures.RANGE;
import static org.opensearch.metrics.planner.PlanFixtures.START_SECS;
import static org.opensearch.metrics.planner.PlanFixtures.context;
import static org.opensearch.metrics.planner.PlanFixtures.forEachNode;
import static org.opensearch.metrics.planner.PlanFixtures.leaves;
import static org.opensearch.metrics.planner.PlanFixtures.ns;
import static org.opensearch.metrics.planner.PlanFixtures.nsRegex;
import static org.opensearch.metrics.planner.PlanFixtures.partition;
import static org.opensearch.metrics.planner.PlanFixtures.periodic;
import static org.opensearch.metrics.planner.PlanFixtures.rate;
import static org.opensearch.metrics.planner.PlanFixtures.selector;
import static org.opensearch.metrics.planner.PlanFixtures.transformerTypes;
import static org.opensearch.metrics.planner.PlanFixtures.ws;

import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.metrics.common.exception.NoMatchingShardKeysException;
import org.opensearch.metrics.common.setting.QueryConfig;
import org.opensearch.metrics.planner.QueryPlanner;
import org.opensearch.metrics.planner.logical.Aggregate;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.planner.logical.ApplyInstantFunction;
import org.opensearch.metrics.planner.logical.BinaryJoin;
import org.opensearch.metrics.planner.logical.BinaryOperator;
import org.opensearch.metrics.planner.logical.InstantFunctionId;
import org.opensearch.metrics.planner.logical.LabelValues;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.logical.ScalarFixedDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarFunctionId;
import org.opensearch.metrics.planner.logical.ScalarTimeBasedPlan;
import org.opensearch.metrics.planner.logical.ScalarVaryingDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarVectorBinaryOperation;
import org.opensearch.metrics.planner.logical.SeriesKeysByFilters;
import org.opensearch.metrics.planner.physical.BinaryJoinExec;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.planner.physical.LabelValuesDistConcatExec;
import org.opensearch.metrics.planner.physical.LocalPartitionDistConcatExec;
import org.opensearch.metrics.planner.physical.LocalPartitionReduceAggregateExec;
import org.opensearch.metrics.planner.physical.MultiPartitionDistConcatExec;
import org.opensearch.metrics.planner.physical.MultiPartitionReduceAggregateExec;
import org.opensearch.metrics.planner.physical.MultiSchemaPartitionsExec;
import org.opensearch.metrics.planner.physical.PartKeysDistConcatExec;
import org.opensearch.metrics.planner.physical.TimeScalarGeneratorExec;
import org.opensearch.metrics.planner.physical.transformer.AggregateMapReduce;
import org.opensearch.metrics.planner.physical.transformer.AggregatePresenter;
import org.opensearch.metrics.planner.physical.transformer.ExecPlanFuncArgs;
import org.opensearch.metrics.planner.physical.transformer.InstantVectorFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.PeriodicSamplesMapper;
import org.opensearch.metrics.planner.physical.transformer.ScalarFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.ScalarOperationMapper;
import org.opensearch.metrics.planner.physical.transformer.StaticFuncArgs;
import org.opensearch.metrics.planner.shardkey.ShardKeyCombination;
import org.opensearch.metrics.planner.shardkey.ShardKeyMatcher;
import org.opensearch.metrics.planner.shardkey.ShardKeyValuesMatcher;
import org.opensearch.metrics.promql.SelectorParser;
import org.opensearch.metrics.query.PlannerParams;
import org.opensearch.metrics.query.PromQlQueryParams;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.filter.ColumnFilter;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ShardKeyRegexPlannerTest {

  private static final ShardKeyMatcher TWO_APPS =
      filters -> List.of(partition("demo", "App-1"), partition("demo", "App-2"));

  private static final ShardKeyMatcher ONE_APP = filters -> List.of(partition("demo", "App-1"));

  @Mock
  private QueryPlanner queryPlanner;

  @Mock
  private ShardKeyMatcher shardKeyMatcher;

  private SingleClusterPlanner singleClusterPlanner;

  @BeforeEach
  void setUp() {
    singleClusterPlanner =
        new SingleClusterPlanner(
            DATASET,
            ShardMapper.roundRobin(4, List.of("node-0", "node-1")),
            QueryConfig.defaults());
  }

  private ShardKeyRegexPlanner planner(ShardKeyMatcher matcher) {
    return new ShardKeyRegexPlanner(DATASET, singleClusterPlanner, matcher);
  }

  private static LogicalPlan regexSelector(String metric) {
    return periodic(selector(metric, ws("demo"), nsRegex("App.*")));
  }

  private static String promQl(ExecPlan plan) {
    return plan.getQueryContext().getOrigQueryParams().getPromQl();
  }

  @Test
  void should_expand_regex_selector_into_one_child_per_combination() {
    LogicalPlan plan =
        periodic(
            selector(
                "test", ws("demo"), nsRegex("App.*"), ColumnFilter.equalTo("instance", "Inst-1")));
    QueryContext context = context("test{_ws_=\"demo\",_ns_=~\"App.*\",instance=\"Inst-1\"}");

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context);

    assertInstanceOf(MultiPartitionDistConcatExec.class, execPlan);
    assertEquals(2, execPlan.getChildren().size());
    ExecPlan first = execPlan.getChildren().get(0);
    ExecPlan second = execPlan.getChildren().get(1);
    assertInstanceOf(LocalPartitionDistConcatExec.class, first);
    assertInstanceOf(MultiSchemaPartitionsExec.class, first.getChildren().get(0));
    assertEquals("test{instance=\"Inst-1\",_ws_=\"demo\",_ns_=\"App-1\"}", promQl(first));
    assertEquals("test{instance=\"Inst-1\",_ws_=\"demo\",_ns_=\"App-2\"}", promQl(second));
    assertTrue(first.getQueryContext().getPlannerParams().isRoutingResolved());
    assertEquals(context.getOrigQueryParams().getPromQl(), promQl(execPlan));
  }

  @Test
  void should_bind_leaf_filters_to_their_combination() {
    ExecPlan execPlan = planner(TWO_APPS).materialize(regexSelector("test"), context("q"));

    for (ExecPlan leaf : leaves(execPlan.getChildren().get(1))) {
      MultiSchemaPartitionsExec partitions = (MultiSchemaPartitionsExec) leaf;
      assertTrue(partitions.getFilters().contains(ns("App-2")));
      assertFalse(partitions.getFilters().contains(nsRegex("App.*")));
    }
  }

  @Test
  void should_order_children_as_the_matcher_returns_combinations() {
    ShardKeyMatcher reversed =
        filters -> List.of(partition("demo", "App-2"), partition("demo", "App-1"));

    ExecPlan execPlan = planner(reversed).materialize(regexSelector("test"), context("q"));

    assertEquals(
        List.of(
            "test{_ws_=\"demo\",_ns_=\"App-2\"}", "test{_ws_=\"demo\",_ns_=\"App-1\"}"),
        execPlan.getChildren().stream()
            .map(ShardKeyRegexPlannerTest::promQl)
            .collect(Collectors.toList()));
  }

  @Test
  void should_expand_range_function_selector() {
    LogicalPlan plan = rate(selector("test", ws("demo"), nsRegex("App.*")), 300_000L);

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("q"));

    assertInstanceOf(MultiPartitionDistConcatExec.class, execPlan);
    assertEquals(
        "rate(test{_ws_=\"demo\",_ns_=\"App-1\"}[300s])", promQl(execPlan.getChildren().get(0)));
  }

  @Test
  void should_push_down_sum_and_present_once_above_merge() {
    Aggregate sum = new Aggregate(AggregationOperator.SUM, regexSelector("test"));

    ExecPlan execPlan = planner(TWO_APPS).materialize(sum, context("sum(test{_ns_=~\"App.*\"})"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(List.of(AggregatePresenter.class), transformerTypes(execPlan));
    assertEquals(2, execPlan.getChildren().size());
    ExecPlan child = execPlan.getChildren().get(0);
    assertInstanceOf(LocalPartitionReduceAggregateExec.class, child);
    assertTrue(child.getRangeVectorTransformers().isEmpty());
    assertTrue(child.getQueryContext().getPlannerParams().isSkipAggregatePresent());
    assertEquals("sum(test{_ws_=\"demo\",_ns_=\"App-1\"})", promQl(child));
    for (ExecPlan leaf : leaves(execPlan)) {
      assertEquals(
          List.of(PeriodicSamplesMapper.class, AggregateMapReduce.class), transformerTypes(leaf));
    }
  }

  @ParameterizedTest
  @EnumSource(
      value = AggregationOperator.class,
      names = {"SUM", "AVG", "COUNT", "MIN", "MAX", "GROUP", "STDDEV", "STDVAR"})
  void should_merge_associative_aggregations_across_partitions(AggregationOperator operator) {
    ExecPlan execPlan =
        planner(TWO_APPS).materialize(new Aggregate(operator, regexSelector("test")), context("q"));

    MultiPartitionReduceAggregateExec reducer =
        assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(operator, reducer.getOperator());
    assertEquals(operator, reducer.getRowAggregator().getOperator());
  }

  @Test
  void should_apply_outer_instant_function_after_presenter() {
    LogicalPlan plan =
        new ApplyInstantFunction(
            new Aggregate(AggregationOperator.SUM, regexSelector("test")),
            InstantFunctionId.EXP,
            List.of());

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("exp(sum(test))"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(
        List.of(AggregatePresenter.class, InstantVectorFunctionMapper.class),
        transformerTypes(execPlan));
  }

  @Test
  void should_apply_histogram_quantile_above_merged_sum() {
    LogicalPlan plan =
        new ApplyInstantFunction(
            new Aggregate(AggregationOperator.SUM, regexSelector("test")),
            InstantFunctionId.HISTOGRAM_QUANTILE,
            List.of(new ScalarFixedDoublePlan(0.9, RANGE)));

    ExecPlan execPlan =
        planner(TWO_APPS).materialize(plan, context("histogram_quantile(0.9, sum(test))"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(
        List.of(AggregatePresenter.class, InstantVectorFunctionMapper.class),
        transformerTypes(execPlan));
    InstantVectorFunctionMapper mapper =
        (InstantVectorFunctionMapper) execPlan.getRangeVectorTransformers().get(1);
    assertEquals(InstantFunctionId.HISTOGRAM_QUANTILE, mapper.getFunction());
    assertEquals(0.9, ((StaticFuncArgs) mapper.getFuncParams().get(0)).getScalar());
    assertEquals(2, execPlan.getChildren().size());
    for (ExecPlan child : execPlan.getChildren()) {
      assertTrue(promQl(child).startsWith("sum("), promQl(child));
      assertFalse(promQl(child).contains("histogram_quantile"), promQl(child));
    }
  }

  @Test
  void should_plan_aggregation_over_single_partition_locally() {
    Aggregate topk =
        new Aggregate(
            AggregationOperator.TOPK, regexSelector("test"), List.of(2.0), List.of(), List.of());

    ExecPlan execPlan = planner(ONE_APP).materialize(topk, context("topk(2, test)"));

    assertInstanceOf(LocalPartitionReduceAggregateExec.class, execPlan);
    assertEquals(List.of(AggregatePresenter.class), transformerTypes(execPlan));
    assertEquals("topk(2.0,test{_ws_=\"demo\",_ns_=\"App-1\"})", promQl(execPlan));
  }

  @Test
  void should_reject_topk_over_several_partitions() {
    Aggregate topk =
        new Aggregate(
            AggregationOperator.TOPK, regexSelector("test"), List.of(2.0), List.of(), List.of());

    UnsupportedOperationException exception =
        assertThrows(
            UnsupportedOperationException.class,
            () -> planner(TWO_APPS).materialize(topk, context("topk(2, test)")));
    assertEquals("Shard Key regex not supported for TopK", exception.getMessage());
  }

  @ParameterizedTest
  @EnumSource(
      value = AggregationOperator.class,
      names = {"TOPK", "BOTTOMK", "COUNT_VALUES", "QUANTILE"})
  void should_reject_non_associative_aggregations_over_several_partitions(
      AggregationOperator operator) {
    Aggregate aggregate =
        new Aggregate(operator, regexSelector("test"), List.of(0.5), List.of(), List.of());

    UnsupportedOperationException exception =
        assertThrows(
            UnsupportedOperationException.class,
            () -> planner(TWO_APPS).materialize(aggregate, context("q")));
    assertEquals(
        "Shard Key regex not supported for " + operator.getDisplayName(), exception.getMessage());
  }

  @Test
  void should_reject_non_associative_aggregation_nested_below_associative_one() {
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            new Aggregate(
                AggregationOperator.TOPK,
                regexSelector("test"),
                List.of(2.0),
                List.of(),
                List.of()));

    UnsupportedOperationException exception =
        assertThrows(
            UnsupportedOperationException.class,
            () -> planner(TWO_APPS).materialize(plan, context("sum(topk(2, test))")));
    assertEquals("Shard Key regex not supported for TopK", exception.getMessage());
  }

  @Test
  void should_plan_nested_non_associative_aggregation_over_single_partition() {
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            new Aggregate(
                AggregationOperator.TOPK,
                regexSelector("test"),
                List.of(2.0),
                List.of(),
                List.of()));

    ExecPlan execPlan = planner(ONE_APP).materialize(plan, context("sum(topk(2, test))"));

    assertInstanceOf(LocalPartitionReduceAggregateExec.class, execPlan);
    assertEquals(List.of(AggregatePresenter.class), transformerTypes(execPlan));
  }

  @Test
  void should_keep_presenter_of_inner_aggregation_when_outer_is_pushed_down() {
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            new Aggregate(
                AggregationOperator.AVG,
                regexSelector("test"),
                List.of(),
                List.of("job"),
                List.of()));

    ExecPlan execPlan =
        planner(TWO_APPS).materialize(plan, context("sum(avg(test) by (job))"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(List.of(AggregatePresenter.class), transformerTypes(execPlan));
    assertEquals(2, execPlan.getChildren().size());
    for (ExecPlan partial : execPlan.getChildren()) {
      assertTrue(partial.getRangeVectorTransformers().isEmpty());
      ExecPlan inner = partial.getChildren().get(0);
      LocalPartitionReduceAggregateExec avg =
          assertInstanceOf(LocalPartitionReduceAggregateExec.class, inner);
      assertEquals(AggregationOperator.AVG, avg.getOperator());
      assertEquals(
          List.of(AggregatePresenter.class, AggregateMapReduce.class), transformerTypes(inner));
    }
  }

  @Test
  void should_delegate_time_function() {
    ExecPlan execPlan =
        planner(TWO_APPS)
            .materialize(new ScalarTimeBasedPlan(ScalarFunctionId.TIME, RANGE), context("time()"));

    assertInstanceOf(TimeScalarGeneratorExec.class, execPlan);
  }

  @Test
  void should_apply_scalar_operation_above_expanded_vector() {
    LogicalPlan plan =
        new ScalarVectorBinaryOperation(
            BinaryOperator.ADD, new ScalarFixedDoublePlan(1.0, RANGE), regexSelector("test"), true);

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("1 + test"));

    assertInstanceOf(MultiPartitionDistConcatExec.class, execPlan);
    assertEquals(List.of(ScalarOperationMapper.class), transformerTypes(execPlan));
    ScalarOperationMapper mapper =
        (ScalarOperationMapper) execPlan.getRangeVectorTransformers().get(0);
    assertInstanceOf(StaticFuncArgs.class, mapper.getFuncParams().get(0));
  }

  @Test
  void should_expand_scalar_argument_of_time_based_operation() {
    LogicalPlan plan =
        new ScalarVectorBinaryOperation(
            BinaryOperator.SUB,
            new ScalarVaryingDoublePlan(regexSelector("test"), ScalarFunctionId.SCALAR),
            new ScalarTimeBasedPlan(ScalarFunctionId.TIME, RANGE),
            true);

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("scalar(test) - time()"));

    assertInstanceOf(TimeScalarGeneratorExec.class, execPlan);
    assertEquals(List.of(ScalarOperationMapper.class), transformerTypes(execPlan));
    ScalarOperationMapper mapper =
        (ScalarOperationMapper) execPlan.getRangeVectorTransformers().get(0);
    ExecPlanFuncArgs funcArgs =
        assertInstanceOf(ExecPlanFuncArgs.class, mapper.getFuncParams().get(0));
    ExecPlan argument = funcArgs.getExecPlan();
    assertInstanceOf(MultiPartitionDistConcatExec.class, argument);
    assertEquals(List.of(ScalarFunctionMapper.class), transformerTypes(argument));
  }

  @Test
  void should_delegate_query_without_open_shard_key_unchanged() {
    LogicalPlan plan =
        new BinaryJoin(
            periodic(selector("test1", ws("demo"), ns("App"))),
            BinaryOperator.ADD,
            periodic(selector("test2", ws("demo"), ns("App"))));
    QueryContext context = context("test1{_ws_=\"demo\",_ns_=\"App\"} + test2");
    ExecPlan delegated = new TimeScalarGeneratorExec(context, RANGE, ScalarFunctionId.TIME);
    when(queryPlanner.materialize(any(), any())).thenReturn(delegated);

    ExecPlan execPlan =
        new ShardKeyRegexPlanner(DATASET, queryPlanner, shardKeyMatcher).materialize(plan, context);

    assertSame(delegated, execPlan);
    verify(queryPlanner).materialize(same(plan), same(context));
    verifyNoInteractions(shardKeyMatcher);
  }

  @Test
  void should_plan_binary_join_without_regex_as_single_join() {
    LogicalPlan plan =
        new BinaryJoin(
            periodic(selector("test1", ws("demo"), ns("App"))),
            BinaryOperator.ADD,
            periodic(selector("test2", ws("demo"), ns("App"))));

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("test1 + test2"));

    assertInstanceOf(BinaryJoinExec.class, execPlan);
  }

  @Test
  void should_expand_only_the_regex_side_of_binary_join() {
    LogicalPlan plan =
        new BinaryJoin(
            periodic(selector("test1", ws("demo"), ns("App"))),
            BinaryOperator.ADD,
            regexSelector("test2"));

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("test1 + test2"));

    BinaryJoinExec join = assertInstanceOf(BinaryJoinExec.class, execPlan);
    assertInstanceOf(LocalPartitionDistConcatExec.class, join.getLhs());
    assertEquals("test1{_ws_=\"demo\",_ns_=\"App\"}", promQl(join.getLhs()));
    assertInstanceOf(MultiPartitionDistConcatExec.class, join.getRhs());
    assertEquals(2, join.getRhs().getChildren().size());
  }

  @Test
  void should_push_down_aggregation_over_join_with_same_shard_key_filters() {
    Aggregate sum =
        new Aggregate(
            AggregationOperator.SUM,
            new BinaryJoin(regexSelector("a"), BinaryOperator.DIV, regexSelector("b")));

    ExecPlan execPlan = planner(TWO_APPS).materialize(sum, context("sum(a / b)"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    ExecPlan child = execPlan.getChildren().get(0);
    assertEquals(
        "sum(a{_ws_=\"demo\",_ns_=\"App-1\"} / b{_ws_=\"demo\",_ns_=\"App-1\"})", promQl(child));
    ExecPlan join = child.getChildren().get(0);
    assertInstanceOf(BinaryJoinExec.class, join);
    assertEquals(List.of(AggregateMapReduce.class), transformerTypes(join));
  }

  @Test
  void should_aggregate_on_top_when_shard_key_filters_differ_within_aggregation() {
    Aggregate sum =
        new Aggregate(
            AggregationOperator.SUM,
            new BinaryJoin(
                regexSelector("a"),
                BinaryOperator.ADD,
                periodic(selector("b", ws("demo"), ns("B")))));

    ExecPlan execPlan = planner(TWO_APPS).materialize(sum, context("sum(a + b)"));

    assertInstanceOf(MultiPartitionReduceAggregateExec.class, execPlan);
    assertEquals(List.of(AggregatePresenter.class), transformerTypes(execPlan));
    assertEquals(1, execPlan.getChildren().size());
    BinaryJoinExec join = assertInstanceOf(BinaryJoinExec.class, execPlan.getChildren().get(0));
    assertEquals(List.of(AggregateMapReduce.class), transformerTypes(join));
    assertInstanceOf(MultiPartitionDistConcatExec.class, join.getLhs());
    assertInstanceOf(LocalPartitionDistConcatExec.class, join.getRhs());
  }

  @Test
  void should_delegate_metadata_query_without_shard_key() {
    LogicalPlan plan =
        new SeriesKeysByFilters(
            List.of(ColumnFilter.equalTo("job", "api")),
            true,
            START_SECS * 1000,
            END_SECS * 1000);

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("{job=\"api\"}"));

    assertInstanceOf(PartKeysDistConcatExec.class, execPlan);
    assertEquals(4, execPlan.getChildren().size());
  }

  @Test
  void should_expand_metadata_query_with_regex() {
    LogicalPlan plan =
        new SeriesKeysByFilters(
            List.of(ws("demo"), nsRegex("App.*")), true, START_SECS * 1000, END_SECS * 1000);

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("q"));

    assertInstanceOf(MultiPartitionDistConcatExec.class, execPlan);
    assertInstanceOf(PartKeysDistConcatExec.class, execPlan.getChildren().get(0));
    assertEquals("{_ws_=\"demo\",_ns_=\"App-2\"}", promQl(execPlan.getChildren().get(1)));
  }

  @Test
  void should_not_expand_label_values_when_routing_is_resolved() {
    LogicalPlan plan =
        new LabelValues(
            List.of("_ns_"),
            List.of(ws("demo"), nsRegex("App.*")),
            START_SECS * 1000,
            END_SECS * 1000);
    QueryContext context =
        QueryContext.of(
            new PromQlQueryParams("q", START_SECS, 0, END_SECS),
            PlannerParams.DEFAULT.withRoutingResolved(true));

    ExecPlan execPlan =
        new ShardKeyRegexPlanner(DATASET, singleClusterPlanner, shardKeyMatcher)
            .materialize(plan, context);

    assertInstanceOf(LabelValuesDistConcatExec.class, execPlan);
    verify(shardKeyMatcher, never()).match(any());
  }

  @Test
  void should_plan_single_combination_as_delegate_on_bound_plan() {
    LogicalPlan plan = regexSelector("test");
    LogicalPlan bound = periodic(selector("test", ws("demo"), ns("App-1")));
    QueryContext context = context("q");
    ExecPlan delegated = new TimeScalarGeneratorExec(context, RANGE, ScalarFunctionId.TIME);
    when(queryPlanner.materialize(any(), any())).thenReturn(delegated);

    ExecPlan execPlan =
        new ShardKeyRegexPlanner(DATASET, queryPlanner, ONE_APP).materialize(plan, context);

    assertSame(delegated, execPlan);
    verify(queryPlanner)
        .materialize(
            eq(bound),
            argThat(
                child ->
                    child.getPlannerParams().isRoutingResolved()
                        && child.getQueryId().equals(context.getQueryId())
                        && child
                            .getOrigQueryParams()
                            .getPromQl()
                            .equals("test{_ws_=\"demo\",_ns_=\"App-1\"}")));
  }

  @Test
  void should_treat_not_equals_on_shard_key_as_open() {
    ShardKeyMatcher universe =
        new ShardKeyValuesMatcher(
            List.of("_ws_", "_ns_"),
            List.of(
                ImmutableMap.of("_ws_", "demo", "_ns_", "App-1"),
                ImmutableMap.of("_ws_", "demo", "_ns_", "App-2"),
                ImmutableMap.of("_ws_", "demo", "_ns_", "Other")));
    LogicalPlan plan =
        periodic(selector("test", ws("demo"), ColumnFilter.notEqualTo("_ns_", "Other")));

    ExecPlan execPlan = planner(universe).materialize(plan, context("q"));

    assertInstanceOf(MultiPartitionDistConcatExec.class, execPlan);
    assertEquals(2, execPlan.getChildren().size());
  }

  @Test
  void should_copy_query_identity_to_every_node() {
    QueryContext context = context("sum(test)");

    ExecPlan execPlan =
        planner(TWO_APPS)
            .materialize(new Aggregate(AggregationOperator.SUM, regexSelector("test")), context);

    forEachNode(
        execPlan,
        node -> {
          assertEquals(context.getQueryId(), node.getQueryContext().getQueryId());
          assertEquals(context.getSubmitTime(), node.getQueryContext().getSubmitTime());
        });
  }

  @Test
  void should_rewrite_selector_child_text_to_the_filters_its_leaves_select() {
    LogicalPlan plan =
        periodic(
            selector("test", ws("demo"), nsRegex("App.*"), ColumnFilter.regex("job", "a.*")));

    assertChildTextSelectsLeafFilters(planner(TWO_APPS).materialize(plan, context("q")));
  }

  @Test
  void should_rewrite_aggregate_child_text_to_the_filters_its_leaves_select() {
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            periodic(
                selector("test", ws("demo"), nsRegex("App.*"), ColumnFilter.regex("job", "a.*"))),
            List.of(),
            List.of("job"),
            List.of());

    assertChildTextSelectsLeafFilters(planner(TWO_APPS).materialize(plan, context("q")));
  }

  @Test
  void should_rewrite_function_wrapped_child_text_to_the_filters_its_leaves_select() {
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            rate(selector("test", ws("demo"), nsRegex("App.*")), 300_000L));

    ExecPlan execPlan = planner(TWO_APPS).materialize(plan, context("q"));

    for (ExecPlan child : execPlan.getChildren()) {
      assertTrue(promQl(child).startsWith("sum(rate("), promQl(child));
    }
    assertChildTextSelectsLeafFilters(execPlan);
  }

  private static void assertChildTextSelectsLeafFilters(ExecPlan execPlan) {
    SelectorParser parser = new SelectorParser(DATASET.getMetricColumn());
    assertEquals(2, execPlan.getChildren().size());
    for (ExecPlan child : execPlan.getChildren()) {
      List<List<ColumnFilter>> parsed = parser.parse(promQl(child));
      assertEquals(1, parsed.size(), promQl(child));
      for (ExecPlan leaf : leaves(child)) {
        assertEquals(
            new HashSet<>(((MultiSchemaPartitionsExec) leaf).getFilters()),
            Set.copyOf(parsed.get(0)));
      }
    }
  }

  @Test
  void should_fail_when_no_shard_key_matches() {
    ShardKeyMatcher none = filters -> List.of();

    assertThrows(
        NoMatchingShardKeysException.class,
        () -> planner(none).materialize(regexSelector("test"), context("q")));
  }

  @Test
  void should_fail_when_matcher_leaves_shard_key_column_unbound() {
    ShardKeyMatcher incomplete = filters -> List.of(ShardKeyCombination.of(ns("App-1")));

    assertThrows(
        IllegalStateException.class,
        () -> planner(incomplete).materialize(regexSelector("test"), context("q")));
  }

  @Test
  void should_propagate_matcher_failure() {
    when(shardKeyMatcher.match(any())).thenThrow(new IllegalStateException("index unavailable"));

    IllegalStateException exception =
        assertThrows(
            IllegalStateException.class,
            () -> planner(shardKeyMatcher).materialize(regexSelector("test"), context("q")));
    assertEquals("index unavailable", exception.getMessage());
  }
}
