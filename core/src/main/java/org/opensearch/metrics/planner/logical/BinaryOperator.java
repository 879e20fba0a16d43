/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Binary operators between two vectors or between a scalar and a vector. */
@Getter
@RequiredArgsConstructor
public enum BinaryOperator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  POW("^"),
  EQL("=="),
  NEQ("!="),
  GTR(">"),
  LSS("<"),
  GTE(">="),
  LTE("<="),
  LAND("and"),
  LOR("or"),
  LUNLESS("unless");

  private final String symbol;

  /** Set operators only apply between two vectors. */
  public boolean isSetOperator() {
    return this == LAND || this == LOR || this == LUNLESS;
  }
}
