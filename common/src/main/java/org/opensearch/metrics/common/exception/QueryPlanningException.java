/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.common.exception;

/** Base class of the errors raised while turning a logical plan into an exec plan. */
public class QueryPlanningException extends RuntimeException {

  public QueryPlanningException(String message) {
    super(message);
  }

  public QueryPlanningException(String message, Throwable cause) {
    super(message, cause);
  }
}
