/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.common.exception;

/**
 * Thrown when the shard-key predicates of a query resolve to no partition at all. Planning an
 * empty result here would be indistinguishable from a query that matched no series.
 */
public class NoMatchingShardKeysException extends QueryPlanningException {

  public NoMatchingShardKeysException(String message) {
    super(message);
  }
}
