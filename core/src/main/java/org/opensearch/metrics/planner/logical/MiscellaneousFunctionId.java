/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Label manipulation functions taking string arguments. */
@Getter
@RequiredArgsConstructor
public enum MiscellaneousFunctionId {
  LABEL_REPLACE("label_replace"),
  LABEL_JOIN("label_join");

  private final String promQlName;
}
