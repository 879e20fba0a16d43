/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.promql;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.opensearch.metrics.planner.logical.Aggregate;
import org.opensearch.metrics.planner.logical.ApplyInstantFunction;
import org.opensearch.metrics.planner.logical.ApplyMiscellaneousFunction;
import org.opensearch.metrics.planner.logical.ApplySortFunction;
import org.opensearch.metrics.planner.logical.BinaryJoin;
import org.opensearch.metrics.planner.logical.Cardinality;
import org.opensearch.metrics.planner.logical.LabelValues;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.planner.logical.LogicalPlanNodeVisitor;
import org.opensearch.metrics.planner.logical.PeriodicSeries;
import org.opensearch.metrics.planner.logical.PeriodicSeriesWithWindowing;
import org.opensearch.metrics.planner.logical.RawSeries;
import org.opensearch.metrics.planner.logical.ScalarBinaryOperation;
import org.opensearch.metrics.planner.logical.ScalarFixedDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarPlan;
import org.opensearch.metrics.planner.logical.ScalarTimeBasedPlan;
import org.opensearch.metrics.planner.logical.ScalarVaryingDoublePlan;
import org.opensearch.metrics.planner.logical.ScalarVectorBinaryOperation;
import org.opensearch.metrics.planner.logical.SeriesKeysByFilters;
import org.opensearch.metrics.query.filter.ColumnFilter;

/**
 * Serializes a logical plan back to PromQL. Selectors print the metric name first and the other
 * predicates in plan order, so a plan whose shard-key predicates were replaced prints them last.
 * The context flag tells whether the expression is an operand of a binary operator and needs
 * parentheses.
 */
public class PromQlRenderer implements LogicalPlanNodeVisitor<String, Boolean> {

  private final String metricColumn;

  public PromQlRenderer(String metricColumn) {
    this.metricColumn = metricColumn;
  }

  public String render(LogicalPlan plan) {
    return plan.accept(this, false);
  }

  /** Prints a selector, e.g. {@code http_requests{job="api",_ns_="App-1"}}. */
  public String selector(List<ColumnFilter> filters) {
    String metric =
        filters.stream()
            .filter(f -> f.getColumn().equals(metricColumn) && f.isConcrete())
            .map(ColumnFilter::getValue)
            .findFirst()
            .orElse("");
    String matchers =
        filters.stream()
            .filter(f -> !(f.getColumn().equals(metricColumn) && f.isConcrete()))
            .map(PromQlRenderer::matcher)
            .collect(Collectors.joining(","));
    if (metric.isEmpty() || !matchers.isEmpty()) {
      return metric + "{" + matchers + "}";
    }
    return metric;
  }

  static String matcher(ColumnFilter filter) {
    return filter.getColumn() + filter.getType().getOperator() + quote(filter.getValue());
  }

  static String quote(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  static String scalar(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    return Double.toString(value);
  }

  static String duration(long millis) {
    return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
  }

  private static String offset(long offsetMs) {
    return offsetMs == 0 ? "" : " offset " + duration(offsetMs);
  }

  private static String labels(List<String> labels) {
    return "(" + String.join(",", labels) + ")";
  }

  private static String binary(String lhs, String operator, String rhs, boolean operand) {
    String expression = lhs + " " + operator + " " + rhs;
    return operand ? "(" + expression + ")" : expression;
  }

  private String call(String function, Stream<String> args) {
    return function + "(" + args.collect(Collectors.joining(",")) + ")";
  }

  private String scalarArg(ScalarPlan plan) {
    return plan.accept(this, true);
  }

  @Override
  public String visitRawSeries(RawSeries plan, Boolean operand) {
    String window = plan.getLookbackMs() > 0 ? "[" + duration(plan.getLookbackMs()) + "]" : "";
    return selector(plan.getFilters()) + window + offset(plan.getOffsetMs());
  }

  @Override
  public String visitPeriodicSeries(PeriodicSeries plan, Boolean operand) {
    return selector(plan.getRawSeries().getFilters()) + offset(plan.getOffsetMs());
  }

  @Override
  public String visitPeriodicSeriesWithWindowing(
      PeriodicSeriesWithWindowing plan, Boolean operand) {
    String series =
        selector(plan.getSeries().getFilters())
            + "["
            + duration(plan.getWindowMs())
            + "]"
            + offset(plan.getOffsetMs());
    return call(
        plan.getFunction().getPromQlName(),
        Stream.concat(
            plan.getFunctionArgs().stream().map(PromQlRenderer::scalar), Stream.of(series)));
  }

  @Override
  public String visitAggregate(Aggregate plan, Boolean operand) {
    Stream<String> params =
        plan.getParams().stream()
            .map(p -> p instanceof Double ? scalar((Double) p) : quote(String.valueOf(p)));
    String aggregate =
        call(
            plan.getOperator().getPromQlName(),
            Stream.concat(params, Stream.of(plan.getVectors().accept(this, false))));
    if (!plan.getBy().isEmpty()) {
      return aggregate + " by " + labels(plan.getBy());
    }
    if (!plan.getWithout().isEmpty()) {
      return aggregate + " without " + labels(plan.getWithout());
    }
    return aggregate;
  }

  @Override
  public String visitBinaryJoin(BinaryJoin plan, Boolean operand) {
    StringBuilder operator = new StringBuilder(plan.getOperator().getSymbol());
    if (!plan.getOn().isEmpty()) {
      operator.append(" on").append(labels(plan.getOn()));
    } else if (!plan.getIgnoring().isEmpty()) {
      operator.append(" ignoring").append(labels(plan.getIgnoring()));
    }
    if (plan.getCardinality() == Cardinality.MANY_TO_ONE) {
      operator.append(" group_left").append(labels(plan.getInclude()));
    } else if (plan.getCardinality() == Cardinality.ONE_TO_MANY) {
      operator.append(" group_right").append(labels(plan.getInclude()));
    }
    return binary(
        plan.getLhs().accept(this, true),
        operator.toString(),
        plan.getRhs().accept(this, true),
        operand);
  }

  @Override
  public String visitScalarVectorBinaryOperation(
      ScalarVectorBinaryOperation plan, Boolean operand) {
    String scalar = scalarArg(plan.getScalarArg());
    String vector = plan.getVector().accept(this, true);
    String operator = plan.getOperator().getSymbol();
    return plan.isScalarIsLhs()
        ? binary(scalar, operator, vector, operand)
        : binary(vector, operator, scalar, operand);
  }

  @Override
  public String visitApplyInstantFunction(ApplyInstantFunction plan, Boolean operand) {
    Stream<String> args = plan.getFunctionArgs().stream().map(arg -> arg.accept(this, false));
    Stream<String> vector = Stream.of(plan.getVectors().accept(this, false));
    return call(
        plan.getFunction().getPromQlName(),
        plan.getFunction().isArgsBeforeVector()
            ? Stream.concat(args, vector)
            : Stream.concat(vector, args));
  }

  @Override
  public String visitApplyMiscellaneousFunction(
      ApplyMiscellaneousFunction plan, Boolean operand) {
    return call(
        plan.getFunction().getPromQlName(),
        Stream.concat(
            Stream.of(plan.getVectors().accept(this, false)),
            plan.getStringArgs().stream().map(PromQlRenderer::quote)));
  }

  @Override
  public String visitApplySortFunction(ApplySortFunction plan, Boolean operand) {
    return call(
        plan.getFunction().getPromQlName(), Stream.of(plan.getVectors().accept(this, false)));
  }

  @Override
  public String visitScalarVaryingDoublePlan(ScalarVaryingDoublePlan plan, Boolean operand) {
    return call(
        plan.getFunction().getPromQlName(), Stream.of(plan.getVectors().accept(this, false)));
  }

  @Override
  public String visitScalarTimeBasedPlan(ScalarTimeBasedPlan plan, Boolean operand) {
    return plan.getFunction().getPromQlName() + "()";
  }

  @Override
  public String visitScalarFixedDoublePlan(ScalarFixedDoublePlan plan, Boolean operand) {
    return scalar(plan.getScalar());
  }

  @Override
  public String visitScalarBinaryOperation(ScalarBinaryOperation plan, Boolean operand) {
    return binary(
        scalarArg(plan.getLhs()),
        plan.getOperator().getSymbol(),
        scalarArg(plan.getRhs()),
        operand);
  }

  @Override
  public String visitSeriesKeysByFilters(SeriesKeysByFilters plan, Boolean operand) {
    return selector(plan.getFilters());
  }

  @Override
  public String visitLabelValues(LabelValues plan, Boolean operand) {
    return selector(plan.getFilters());
  }
}
