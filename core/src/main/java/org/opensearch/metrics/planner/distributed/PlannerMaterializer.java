/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.distributed;

import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import org.opensearch.metrics.planner.QueryPlanner;
import org.opensearch.metrics.planner.logical.ApplyInstantFunction;
import org.opensearch.metrics.planner.logical.ApplyMiscellaneousFunction;
import org.opensearch.metrics.planner.logical.ApplySortFunction;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.logical.LogicalPlanNodeVisitor;
import org.opensearch.metrics.planner.logical.ScalarBinaryOperation;
import org.opensearch.metrics.planner.logical.ScalarFixedDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarPlan;
import org.opensearch.metrics.planner.logical.ScalarTimeBasedPlan;
import org.opensearch.metrics.planner.logical.ScalarVaryingDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarVectorBinaryOperation;
import org.opensearch.metrics.planner.physical.ExecPlan;
import org.opensearch.metrics.planner.physical.ScalarBinaryOperationExec;
import org.opensearch.metrics.planner.physical.ScalarFixedDoubleExec;
import org.opensearch.metrics.planner.physical.TimeScalarGeneratorExec;
import org.opensearch.metrics.planner.physical.transformer.ExecPlanFuncArgs;
import org.opensearch.metrics.planner.physical.transformer.FuncArgs;
import org.opensearch.metrics.planner.physical.transformer.InstantVectorFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.MiscellaneousFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.ScalarFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.ScalarOperationMapper;
import org.opensearch.metrics.planner.physical.transformer.SortFunctionMapper;
import org.opensearch.metrics.planner.physical.transformer.StaticFuncArgs;
import org.opensearch.metrics.query.QueryContext;
import org.opensearch.metrics.query.RangeParams;

/**
 * Composition rules shared by the planners: functions and scalar arithmetic are applied as
 * transformers on top of whatever plans the subclass produced for their operand. Subclasses
 * decide how selections, aggregations and joins are planned and how sibling plans are combined.
 */
public abstract class PlannerMaterializer
    implements QueryPlanner, LogicalPlanNodeVisitor<PlanResult, QueryContext> {

  protected PlanResult walk(LogicalPlan plan, QueryContext context) {
    return plan.accept(this, context);
  }

  /** Combines sibling plans under a single parent; a single plan is returned as is. */
  protected abstract ExecPlan stitch(List<ExecPlan> plans, QueryContext context);

  protected ExecPlan walkAndStitch(LogicalPlan plan, QueryContext context) {
    return stitch(walk(plan, context).getPlans(), context);
  }

  protected RangeParams rangeParams(QueryContext context) {
    return context.getOrigQueryParams().toRangeParams();
  }

  /** Every argument is materialized on its own so that no exec plan is shared. */
  protected List<FuncArgs> materializeFunctionArgs(List<ScalarPlan> args, QueryContext context) {
    return args.stream().map(arg -> functionArg(arg, context)).collect(Collectors.toList());
  }

  private FuncArgs functionArg(ScalarPlan arg, QueryContext context) {
    OptionalDouble literal = arg.literalValue();
    if (literal.isPresent()) {
      return new StaticFuncArgs(literal.getAsDouble(), rangeParams(context));
    }
    return new ExecPlanFuncArgs(walkAndStitch(arg, context), rangeParams(context));
  }

  @Override
  public PlanResult visitApplyInstantFunction(ApplyInstantFunction plan, QueryContext context) {
    PlanResult vectors = walk(plan.getVectors(), context);
    for (ExecPlan vector : vectors.getPlans()) {
      vector.addRangeVectorTransformer(
          new InstantVectorFunctionMapper(
              plan.getFunction(), materializeFunctionArgs(plan.getFunctionArgs(), context)));
    }
    return vectors;
  }

  @Override
  public PlanResult visitApplyMiscellaneousFunction(
      ApplyMiscellaneousFunction plan, QueryContext context) {
    PlanResult vectors = walk(plan.getVectors(), context);
    for (ExecPlan vector : vectors.getPlans()) {
      vector.addRangeVectorTransformer(
          new MiscellaneousFunctionMapper(plan.getFunction(), plan.getStringArgs()));
    }
    return vectors;
  }

  @Override
  public PlanResult visitApplySortFunction(ApplySortFunction plan, QueryContext context) {
    ExecPlan vectors = walkAndStitch(plan.getVectors(), context);
    vectors.addRangeVectorTransformer(new SortFunctionMapper(plan.getFunction()));
    return PlanResult.of(vectors);
  }

  @Override
  public PlanResult visitScalarVectorBinaryOperation(
      ScalarVectorBinaryOperation plan, QueryContext context) {
    PlanResult vectors = walk(plan.getVector(), context);
    for (ExecPlan vector : vectors.getPlans()) {
      vector.addRangeVectorTransformer(
          new ScalarOperationMapper(
              plan.getOperator(),
              plan.isScalarIsLhs(),
              materializeFunctionArgs(List.of(plan.getScalarArg()), context)));
    }
    return vectors;
  }

  @Override
  public PlanResult visitScalarVaryingDoublePlan(
      ScalarVaryingDoublePlan plan, QueryContext context) {
    ExecPlan vectors = walkAndStitch(plan.getVectors(), context);
    vectors.addRangeVectorTransformer(
        new ScalarFunctionMapper(plan.getFunction(), rangeParams(context)));
    return PlanResult.of(vectors);
  }

  @Override
  public PlanResult visitScalarTimeBasedPlan(ScalarTimeBasedPlan plan, QueryContext context) {
    return PlanResult.of(
        new TimeScalarGeneratorExec(context, plan.getRangeParams(), plan.getFunction()));
  }

  @Override
  public PlanResult visitScalarFixedDoublePlan(ScalarFixedDoublePlan plan, QueryContext context) {
    return PlanResult.of(
        new ScalarFixedDoubleExec(context, plan.getRangeParams(), plan.getScalar()));
  }

  @Override
  public PlanResult visitScalarBinaryOperation(ScalarBinaryOperation plan, QueryContext context) {
    return PlanResult.of(
        new ScalarBinaryOperationExec(
            context,
            plan.getRangeParams(),
            plan.getOperator(),
            functionArg(plan.getLhs(), context),
            functionArg(plan.getRhs(), context)));
  }
}
