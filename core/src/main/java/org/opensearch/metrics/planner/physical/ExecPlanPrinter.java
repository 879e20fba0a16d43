/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

import com.google.common.base.Strings;
import java.util.List;
import org.opensearch.metrics.planner.physical.transformer.ExecPlanFuncArgs;
import org.opensearch.metrics.planner.physical.transformer.FuncArgs;
import org.opensearch.metrics.planner.physical.transformer.RangeVectorTransformer;
import org.opensearch.metrics.planner.physical.transformer.StaticFuncArgs;

/**
 * Renders an exec plan as an indented tree. Each node prints its transformers first, outermost
 * on top, prefixed {@code T~}, then itself prefixed {@code E~}, then its children one level deeper.
 * Function arguments backed by an exec plan print their plan below the transformer using them.
 *
 * <pre>
 * E~MultiPartitionDistConcatExec()
 * -E~LocalPartitionDistConcatExec()
 * --T~PeriodicSamplesMapper(start=1000000, step=1000000, ...)
 * --E~MultiSchemaPartitionsExec(shard=2, filters=[...]) on node-1
 * </pre>
 */
public class ExecPlanPrinter implements ExecPlanVisitor<String, Void> {

  public String print(ExecPlan plan) {
    StringBuilder out = new StringBuilder();
    print(plan, 0, out);
    return out.toString().trim();
  }

  private void print(ExecPlan plan, int depth, StringBuilder out) {
    String prefix = Strings.repeat("-", depth);
    List<RangeVectorTransformer> transformers = plan.getRangeVectorTransformers();
    for (int i = transformers.size() - 1; i >= 0; i--) {
      RangeVectorTransformer transformer = transformers.get(i);
      out.append(prefix)
          .append("T~")
          .append(transformer.getClass().getSimpleName())
          .append('(')
          .append(transformer.args())
          .append(")\n");
      List<FuncArgs> funcParams = transformer.getFuncParams();
      for (int j = 0; j < funcParams.size(); j++) {
        printFuncArgs(funcParams.get(j), j + 1, depth + 1, out);
      }
    }
    out.append(prefix).append("E~").append(plan.accept(this, null)).append('\n');
    for (ExecPlan child : plan.getChildren()) {
      print(child, depth + 1, out);
    }
  }

  private void printFuncArgs(FuncArgs funcArgs, int index, int depth, StringBuilder out) {
    String prefix = Strings.repeat("-", depth);
    if (funcArgs instanceof ExecPlanFuncArgs) {
      out.append(prefix).append("FA").append(index).append("~\n");
      print(((ExecPlanFuncArgs) funcArgs).getExecPlan(), depth, out);
    } else {
      out.append(prefix).append("FA").append(index).append("~").append(describe(funcArgs))
          .append('\n');
    }
  }

  private static String describe(FuncArgs funcArgs) {
    if (funcArgs instanceof StaticFuncArgs) {
      return "StaticFuncArgs(" + ((StaticFuncArgs) funcArgs).getScalar() + ")";
    }
    return funcArgs.toString();
  }

  private static String node(String name, String args, String nodeId) {
    return name + "(" + args + ")" + (nodeId == null ? "" : " on " + nodeId);
  }

  @Override
  public String visitMultiSchemaPartitions(MultiSchemaPartitionsExec plan, Void context) {
    return node(
        "MultiSchemaPartitionsExec",
        String.format(
            "shard=%d, chunkMethod=TimeRangeChunkScan(%d,%d), filters=%s",
            plan.getShard(),
            plan.getChunkScan().getFromMs(),
            plan.getChunkScan().getToMs(),
            plan.getFilters()),
        plan.getNodeId());
  }

  @Override
  public String visitPartKeys(PartKeysExec plan, Void context) {
    return node(
        "PartKeysExec",
        String.format(
            "shard=%d, filters=%s, limit=-1, start=%d, end=%d",
            plan.getShard(), plan.getFilters(), plan.getStartMs(), plan.getEndMs()),
        plan.getNodeId());
  }

  @Override
  public String visitLabelValues(LabelValuesExec plan, Void context) {
    return node(
        "LabelValuesExec",
        String.format(
            "shard=%d, filters=%s, labels=%s, start=%d, end=%d",
            plan.getShard(),
            plan.getFilters(),
            plan.getLabelNames(),
            plan.getStartMs(),
            plan.getEndMs()),
        plan.getNodeId());
  }

  @Override
  public String visitLocalPartitionDistConcat(LocalPartitionDistConcatExec plan, Void context) {
    return node("LocalPartitionDistConcatExec", "", null);
  }

  @Override
  public String visitMultiPartitionDistConcat(MultiPartitionDistConcatExec plan, Void context) {
    return node("MultiPartitionDistConcatExec", "", null);
  }

  @Override
  public String visitLocalPartitionReduceAggregate(
      LocalPartitionReduceAggregateExec plan, Void context) {
    return node(
        "LocalPartitionReduceAggregateExec",
        "aggrOp=" + plan.getOperator().name() + ", aggrParams=" + plan.getParams(),
        null);
  }

  @Override
  public String visitMultiPartitionReduceAggregate(
      MultiPartitionReduceAggregateExec plan, Void context) {
    return node(
        "MultiPartitionReduceAggregateExec",
        "aggrOp=" + plan.getOperator().name() + ", aggrParams=" + plan.getParams(),
        null);
  }

  @Override
  public String visitBinaryJoin(BinaryJoinExec plan, Void context) {
    return node(
        "BinaryJoinExec",
        String.format(
            "binaryOp=%s, on=%s, ignoring=%s",
            plan.getOperator().name(), plan.getOn(), plan.getIgnoring()),
        null);
  }

  @Override
  public String visitPartKeysDistConcat(PartKeysDistConcatExec plan, Void context) {
    return node("PartKeysDistConcatExec", "", null);
  }

  @Override
  public String visitLabelValuesDistConcat(LabelValuesDistConcatExec plan, Void context) {
    return node("LabelValuesDistConcatExec", "", null);
  }

  @Override
  public String visitTimeScalarGenerator(TimeScalarGeneratorExec plan, Void context) {
    return node(
        "TimeScalarGeneratorExec",
        "params=" + plan.getRangeParams() + ", function=" + plan.getFunction().name(),
        null);
  }

  @Override
  public String visitScalarFixedDouble(ScalarFixedDoubleExec plan, Void context) {
    return node(
        "ScalarFixedDoubleExec",
        "params=" + plan.getRangeParams() + ", value=" + plan.getValue(),
        null);
  }

  @Override
  public String visitScalarBinaryOperation(ScalarBinaryOperationExec plan, Void context) {
    return node(
        "ScalarBinaryOperationExec",
        String.format(
            "params=%s, operator=%s, lhs=%s, rhs=%s",
            plan.getRangeParams(),
            plan.getOperator().name(),
            describe(plan.getLhs()),
            describe(plan.getRhs())),
        null);
  }
}
