/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.common.exception;

/** Thrown when a query cannot be planned as written, for example a range query with a zero step. */
public class BadQueryException extends QueryPlanningException {

  public BadQueryException(String message) {
    super(message);
  }
}
