/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Evaluation instants of a range query, in seconds. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class RangeParams {
  private final long startSecs;
  private final long stepSecs;
  private final long endSecs;
}
