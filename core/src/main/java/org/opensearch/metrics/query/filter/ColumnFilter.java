/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.query.filter;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A predicate on one column of a time series, e.g. {@code _ns_=~"App.*"}. Only {@link
 * FilterType#EQUALS} pins the column to a single value; every other kind is open and may match
 * any number of values.
 */
@Getter
@EqualsAndHashCode
public final class ColumnFilter {

  private final String column;
  private final FilterType type;
  private final String value;

  public ColumnFilter(String column, FilterType type, String value) {
    this.column = Objects.requireNonNull(column, "column");
    this.type = Objects.requireNonNull(type, "type");
    this.value = Objects.requireNonNull(value, "value");
  }

  public static ColumnFilter equalTo(String column, String value) {
    return new ColumnFilter(column, FilterType.EQUALS, value);
  }

  public static ColumnFilter notEqualTo(String column, String value) {
    return new ColumnFilter(column, FilterType.NOT_EQUALS, value);
  }

  public static ColumnFilter regex(String column, String pattern) {
    return new ColumnFilter(column, FilterType.EQUALS_REGEX, pattern);
  }

  public static ColumnFilter notRegex(String column, String pattern) {
    return new ColumnFilter(column, FilterType.NOT_EQUALS_REGEX, pattern);
  }

  /** True when the filter binds its column to exactly one value. */
  public boolean isConcrete() {
    return type == FilterType.EQUALS;
  }

  public boolean isRegex() {
    return type == FilterType.EQUALS_REGEX || type == FilterType.NOT_EQUALS_REGEX;
  }

  @Override
  public String toString() {
    return column + type.getOperator() + '"' + value + '"';
  }
}
