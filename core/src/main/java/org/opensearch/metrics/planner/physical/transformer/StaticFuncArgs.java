/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.query.RangeParams;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class StaticFuncArgs implements FuncArgs {
  private final double scalar;
  private final RangeParams timeStepParams;
}
