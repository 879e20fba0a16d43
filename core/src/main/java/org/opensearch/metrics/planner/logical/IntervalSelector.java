/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Time range of raw samples to read, in epoch milliseconds, both ends inclusive. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class IntervalSelector {
  private final long fromMs;
  private final long toMs;
}
