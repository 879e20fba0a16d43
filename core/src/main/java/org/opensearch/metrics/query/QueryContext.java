/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query;

import java.util.UUID;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-request context attached to every exec plan node. The query id and submit time are copied
 * unchanged to every child; only the query text and the planner flags are rewritten.
 */
@Getter
@ToString
@EqualsAndHashCode
public class QueryContext {

  private final PromQlQueryParams origQueryParams;
  private final String queryId;
  private final long submitTime;
  private final PlannerParams plannerParams;

  public QueryContext(
      PromQlQueryParams origQueryParams,
      String queryId,
      long submitTime,
      PlannerParams plannerParams) {
    this.origQueryParams = origQueryParams;
    this.queryId = queryId;
    this.submitTime = submitTime;
    this.plannerParams = plannerParams;
  }

  /** A fresh context for a newly submitted query. */
  public static QueryContext of(PromQlQueryParams params) {
    return of(params, PlannerParams.DEFAULT);
  }

  public static QueryContext of(PromQlQueryParams params, PlannerParams plannerParams) {
    return new QueryContext(
        params, UUID.randomUUID().toString(), System.currentTimeMillis(), plannerParams);
  }

  public QueryContext withQueryParams(PromQlQueryParams params) {
    return new QueryContext(params, queryId, submitTime, plannerParams);
  }

  public QueryContext withPlannerParams(PlannerParams params) {
    return new QueryContext(origQueryParams, queryId, submitTime, params);
  }
}
