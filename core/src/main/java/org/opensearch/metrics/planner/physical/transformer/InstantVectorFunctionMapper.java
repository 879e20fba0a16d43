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
import org.opensearch.metrics.planner.logical.InstantFunctionId;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class InstantVectorFunctionMapper implements RangeVectorTransformer {

  private final InstantFunctionId function;
  private final List<FuncArgs> funcParams;

  @Override
  public String args() {
    return "function=" + function.name();
  }
}
