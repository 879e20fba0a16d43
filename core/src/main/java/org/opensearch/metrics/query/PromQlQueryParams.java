/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Textual form of a request: the PromQL text plus its time range. The text of a per-partition
 * child is rewritten to the part of the query that child evaluates.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PromQlQueryParams {

  private final String promQl;
  private final long startSecs;
  private final long stepSecs;
  private final long endSecs;

  /** HTTP path used when the text is sent to a remote cluster, e.g. a label values endpoint. */
  private final Optional<String> remoteQueryPath;

  public PromQlQueryParams(String promQl, long startSecs, long stepSecs, long endSecs) {
    this(promQl, startSecs, stepSecs, endSecs, Optional.empty());
  }

  public PromQlQueryParams(
      String promQl,
      long startSecs,
      long stepSecs,
      long endSecs,
      Optional<String> remoteQueryPath) {
    this.promQl = promQl;
    this.startSecs = startSecs;
    this.stepSecs = stepSecs;
    this.endSecs = endSecs;
    this.remoteQueryPath = remoteQueryPath;
  }

  public PromQlQueryParams withPromQl(String newPromQl) {
    return new PromQlQueryParams(newPromQl, startSecs, stepSecs, endSecs, remoteQueryPath);
  }

  public RangeParams toRangeParams() {
    return new RangeParams(startSecs, stepSecs, endSecs);
  }
}
