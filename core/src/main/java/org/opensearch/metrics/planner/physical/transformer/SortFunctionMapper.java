/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.SortFunctionId;

/** Orders the series of a result by value; it must see the whole result to be correct. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class SortFunctionMapper implements RangeVectorTransformer {

  private final SortFunctionId function;

  @Override
  public String args() {
    return "function=" + function.name();
  }
}
