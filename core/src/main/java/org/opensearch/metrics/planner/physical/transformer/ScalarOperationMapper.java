/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.BinaryOperator;

/** Applies a binary operator between every sample and a scalar argument. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class ScalarOperationMapper implements RangeVectorTransformer {

  private final BinaryOperator operator;
  private final boolean scalarOnLhs;
  private final List<FuncArgs> funcParams;

  @Override
  public String args() {
    return String.format("operator=%s, scalarOnLhs=%s", operator.name(), scalarOnLhs);
  }
}
