/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Functions applied sample by sample to an instant vector. */
@Getter
@RequiredArgsConstructor
public enum InstantFunctionId {
  ABS("abs", false),
  CEIL("ceil", false),
  CLAMP_MAX("clamp_max", false),
  CLAMP_MIN("clamp_min", false),
  EXP("exp", false),
  FLOOR("floor", false),
  HISTOGRAM_QUANTILE("histogram_quantile", true),
  LN("ln", false),
  LOG10("log10", false),
  LOG2("log2", false),
  ROUND("round", false),
  SQRT("sqrt", false);

  private final String promQlName;

  /** Scalar arguments are written before the vector, as in {@code histogram_quantile(0.9, v)}. */
  private final boolean argsBeforeVector;
}
