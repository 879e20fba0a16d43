/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query.filter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Match kinds of a label predicate, with the operator they are written with in PromQL. */
@Getter
@RequiredArgsConstructor
public enum FilterType {
  EQUALS("="),
  NOT_EQUALS("!="),
  EQUALS_REGEX("=~"),
  NOT_EQUALS_REGEX("!~");

  private final String operator;

  /** Resolves an operator token such as {@code =~} to its filter type. */
  public static FilterType fromOperator(String operator) {
    for (FilterType type : values()) {
      if (type.operator.equals(operator)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown label match operator: " + operator);
  }
}
