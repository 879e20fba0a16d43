/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

/**
 * Visitor over every logical plan node type. There is deliberately no fallback method, so adding
 * a node type breaks every visitor until it handles the new node.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface LogicalPlanNodeVisitor<R, C> {

  R visitRawSeries(RawSeries plan, C context);

  R visitPeriodicSeries(PeriodicSeries plan, C context);

  R visitPeriodicSeriesWithWindowing(PeriodicSeriesWithWindowing plan, C context);

  R visitAggregate(Aggregate plan, C context);

  R visitBinaryJoin(BinaryJoin plan, C context);

  R visitScalarVectorBinaryOperation(ScalarVectorBinaryOperation plan, C context);

  R visitApplyInstantFunction(ApplyInstantFunction plan, C context);

  R visitApplyMiscellaneousFunction(ApplyMiscellaneousFunction plan, C context);

  R visitApplySortFunction(ApplySortFunction plan, C context);

  R visitScalarVaryingDoublePlan(ScalarVaryingDoublePlan plan, C context);

  R visitScalarTimeBasedPlan(ScalarTimeBasedPlan plan, C context);

  R visitScalarFixedDoublePlan(ScalarFixedDoublePlan plan, C context);

  R visitScalarBinaryOperation(ScalarBinaryOperation plan, C context);

  R visitSeriesKeysByFilters(SeriesKeysByFilters plan, C context);

  R visitLabelValues(LabelValues plan, C context);
}
