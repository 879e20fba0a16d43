/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical;

/**
 * Visitor over every exec plan node type, without a fallback method.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface ExecPlanVisitor<R, C> {

  R visitMultiSchemaPartitions(MultiSchemaPartitionsExec plan, C context);

  R visitPartKeys(PartKeysExec plan, C context);

  R visitLabelValues(LabelValuesExec plan, C context);

  R visitLocalPartitionDistConcat(LocalPartitionDistConcatExec plan, C context);

  R visitMultiPartitionDistConcat(MultiPartitionDistConcatExec plan, C context);

  R visitLocalPartitionReduceAggregate(LocalPartitionReduceAggregateExec plan, C context);

  R visitMultiPartitionReduceAggregate(MultiPartitionReduceAggregateExec plan, C context);

  R visitBinaryJoin(BinaryJoinExec plan, C context);

  R visitPartKeysDistConcat(PartKeysDistConcatExec plan, C context);

  R visitLabelValuesDistConcat(LabelValuesDistConcatExec plan, C context);

  R visitTimeScalarGenerator(TimeScalarGeneratorExec plan, C context);

  R visitScalarFixedDouble(ScalarFixedDoubleExec plan, C context);

  R visitScalarBinaryOperation(ScalarBinaryOperationExec plan, C context);
}
