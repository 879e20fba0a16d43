/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Functions producing a scalar, either from a vector or from the evaluation time alone. */
@Getter
@RequiredArgsConstructor
public enum ScalarFunctionId {
  SCALAR("scalar", false),
  TIME("time", true),
  HOUR("hour", true),
  MINUTE("minute", true),
  MONTH("month", true),
  YEAR("year", true),
  DAY_OF_MONTH("day_of_month", true),
  DAY_OF_WEEK("day_of_week", true),
  DAYS_IN_MONTH("days_in_month", true);

  private final String promQlName;
  private final boolean timeBased;
}
