/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.opensearch.metrics.metadata.DatasetOptions;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Copies a plan with the shard-key predicates of every selector replaced by a concrete binding.
 * Other predicates keep their relative order and the binding is appended after them.
 */
@RequiredArgsConstructor
public class ShardKeyFilterRewriter
    implements LogicalPlanNodeVisitor<LogicalPlan, List<ColumnFilter>> {

  private final DatasetOptions options;

  public LogicalPlan rewrite(LogicalPlan plan, List<ColumnFilter> shardKeyFilters) {
    return plan.accept(this, shardKeyFilters);
  }

  private List<ColumnFilter> replace(List<ColumnFilter> filters, List<ColumnFilter> binding) {
    return ImmutableList.<ColumnFilter>builder()
        .addAll(
            filters.stream()
                .filter(filter -> !options.isNonMetricShardColumn(filter.getColumn()))
                .collect(Collectors.toList()))
        .addAll(binding)
        .build();
  }

  private ScalarPlan rewriteScalar(ScalarPlan plan, List<ColumnFilter> binding) {
    return (ScalarPlan) plan.accept(this, binding);
  }

  @Override
  public LogicalPlan visitRawSeries(RawSeries plan, List<ColumnFilter> binding) {
    return plan.withFilters(replace(plan.getFilters(), binding));
  }

  @Override
  public LogicalPlan visitPeriodicSeries(PeriodicSeries plan, List<ColumnFilter> binding) {
    return plan.withRawSeries((RawSeries) plan.getRawSeries().accept(this, binding));
  }

  @Override
  public LogicalPlan visitPeriodicSeriesWithWindowing(
      PeriodicSeriesWithWindowing plan, List<ColumnFilter> binding) {
    return plan.withSeries((RawSeries) plan.getSeries().accept(this, binding));
  }

  @Override
  public LogicalPlan visitAggregate(Aggregate plan, List<ColumnFilter> binding) {
    return plan.withVectors(plan.getVectors().accept(this, binding));
  }

  @Override
  public LogicalPlan visitBinaryJoin(BinaryJoin plan, List<ColumnFilter> binding) {
    return plan.withSides(plan.getLhs().accept(this, binding), plan.getRhs().accept(this, binding));
  }

  @Override
  public LogicalPlan visitScalarVectorBinaryOperation(
      ScalarVectorBinaryOperation plan, List<ColumnFilter> binding) {
    return plan.withOperands(
        rewriteScalar(plan.getScalarArg(), binding), plan.getVector().accept(this, binding));
  }

  @Override
  public LogicalPlan visitApplyInstantFunction(
      ApplyInstantFunction plan, List<ColumnFilter> binding) {
    return plan.withVectors(plan.getVectors().accept(this, binding))
        .withFunctionArgs(
            plan.getFunctionArgs().stream()
                .map(arg -> rewriteScalar(arg, binding))
                .collect(Collectors.toList()));
  }

  @Override
  public LogicalPlan visitApplyMiscellaneousFunction(
      ApplyMiscellaneousFunction plan, List<ColumnFilter> binding) {
    return plan.withVectors(plan.getVectors().accept(this, binding));
  }

  @Override
  public LogicalPlan visitApplySortFunction(ApplySortFunction plan, List<ColumnFilter> binding) {
    return plan.withVectors(plan.getVectors().accept(this, binding));
  }

  @Override
  public LogicalPlan visitScalarVaryingDoublePlan(
      ScalarVaryingDoublePlan plan, List<ColumnFilter> binding) {
    return plan.withVectors(plan.getVectors().accept(this, binding));
  }

  @Override
  public LogicalPlan visitScalarTimeBasedPlan(
      ScalarTimeBasedPlan plan, List<ColumnFilter> binding) {
    return plan;
  }

  @Override
  public LogicalPlan visitScalarFixedDoublePlan(
      ScalarFixedDoublePlan plan, List<ColumnFilter> binding) {
    return plan;
  }

  @Override
  public LogicalPlan visitScalarBinaryOperation(
      ScalarBinaryOperation plan, List<ColumnFilter> binding) {
    return plan.withOperands(
        rewriteScalar(plan.getLhs(), binding), rewriteScalar(plan.getRhs(), binding));
  }

  @Override
  public LogicalPlan visitSeriesKeysByFilters(
      SeriesKeysByFilters plan, List<ColumnFilter> binding) {
    return plan.withFilters(replace(plan.getFilters(), binding));
  }

  @Override
  public LogicalPlan visitLabelValues(LabelValues plan, List<ColumnFilter> binding) {
    return plan.withFilters(replace(plan.getFilters(), binding));
  }
}
