/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.ScalarFunctionId;
import org.opensearch.metrics.query.RangeParams;

/** Turns a single-series vector into a scalar, NaN when the vector does not hold one series. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class ScalarFunctionMapper implements RangeVectorTransformer {

  private final ScalarFunctionId function;
  private final RangeParams timeStepParams;

  @Override
  public String args() {
    return String.format("function=%s, funcParams=%s", function.name(), timeStepParams);
  }
}
