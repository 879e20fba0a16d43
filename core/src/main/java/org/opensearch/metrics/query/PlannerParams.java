/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Routing flags that travel with a query through the planners. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class PlannerParams {

  public static final PlannerParams DEFAULT = new PlannerParams(false, false);

  /**
   * Partition routing of this query is already resolved: its shard-key predicates must not be
   * expanded again.
   */
  private final boolean routingResolved;

  /**
   * The aggregation of this query is a partial one pushed to a partition; the merge node above it
   * adds the presenter.
   */
  private final boolean skipAggregatePresent;

  public PlannerParams withRoutingResolved(boolean resolved) {
    return new PlannerParams(resolved, skipAggregatePresent);
  }

  public PlannerParams withSkipAggregatePresent(boolean skip) {
    return new PlannerParams(routingResolved, skip);
  }
}
