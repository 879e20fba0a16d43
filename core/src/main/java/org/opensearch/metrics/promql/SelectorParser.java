/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.promql;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.opensearch.metrics.query.filter.ColumnFilter;
import org.opensearch.metrics.query.filter.FilterType;

/**
 * Extracts the series selectors of a PromQL expression as lists of column filters, one list per
 * selector in the order they appear. The metric name of a selector becomes an equality filter on
 * the metric column placed first. Everything else in the expression is skipped.
 */
public class SelectorParser {

  /** Keywords that are followed by a parenthesized label list. */
  private static final Set<String> LABEL_LIST_KEYWORDS =
      ImmutableSet.of("by", "without", "on", "ignoring", "group_left", "group_right");

  private static final Set<String> KEYWORDS =
      ImmutableSet.of("offset", "and", "or", "unless", "bool", "inf", "nan");

  private final String metricColumn;

  public SelectorParser(String metricColumn) {
    this.metricColumn = metricColumn;
  }

  public List<List<ColumnFilter>> parse(String query) {
    return new Scanner(query).selectors();
  }

  private class Scanner {
    private final String text;
    private int pos;

    Scanner(String text) {
      this.text = text;
    }

    List<List<ColumnFilter>> selectors() {
      ImmutableList.Builder<List<ColumnFilter>> selectors = ImmutableList.builder();
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (c == '"' || c == '\'') {
          readString();
        } else if (c == '[') {
          skipPast(']');
        } else if (c == '{') {
          selectors.add(matchers(new ArrayList<>()));
        } else if (Character.isDigit(c) || c == '.') {
          skipNumber();
        } else if (isIdentifierStart(c)) {
          String identifier = readIdentifier();
          skipWhitespace();
          boolean parenthesis = pos < text.length() && text.charAt(pos) == '(';
          String keyword = identifier.toLowerCase();
          if (LABEL_LIST_KEYWORDS.contains(keyword)) {
            if (parenthesis) {
              skipPast(')');
            }
          } else if (!parenthesis && !KEYWORDS.contains(keyword) && !isGroupedAggregation()) {
            List<ColumnFilter> filters = new ArrayList<>();
            filters.add(ColumnFilter.equalTo(metricColumn, identifier));
            if (pos < text.length() && text.charAt(pos) == '{') {
              matchers(filters);
            }
            selectors.add(ImmutableList.copyOf(filters));
          }
        } else {
          pos++;
        }
      }
      return selectors.build();
    }

    /** True for {@code sum by (job) (...)}, where the grouping precedes the arguments. */
    private boolean isGroupedAggregation() {
      int end = pos;
      while (end < text.length() && isIdentifierPart(text.charAt(end))) {
        end++;
      }
      String next = text.substring(pos, end).toLowerCase();
      return next.equals("by") || next.equals("without");
    }

    private List<ColumnFilter> matchers(List<ColumnFilter> filters) {
      expect('{');
      skipWhitespace();
      while (peek() != '}') {
        String column = readIdentifier();
        skipWhitespace();
        FilterType type = readOperator();
        skipWhitespace();
        filters.add(new ColumnFilter(column, type, readString()));
        skipWhitespace();
        if (peek() == ',') {
          pos++;
          skipWhitespace();
        } else if (peek() != '}') {
          throw error("expected ',' or '}'");
        }
      }
      pos++;
      return ImmutableList.copyOf(filters);
    }

    private FilterType readOperator() {
      for (String operator : new String[] {"=~", "!~", "!=", "="}) {
        if (text.startsWith(operator, pos)) {
          pos += operator.length();
          return FilterType.fromOperator(operator);
        }
      }
      throw error("expected a label matcher operator");
    }

    private String readString() {
      char quote = peek();
      if (quote != '"' && quote != '\'') {
        throw error("expected a quoted string");
      }
      pos++;
      StringBuilder value = new StringBuilder();
      while (pos < text.length() && text.charAt(pos) != quote) {
        char c = text.charAt(pos++);
        if (c == '\\' && pos < text.length()) {
          c = text.charAt(pos++);
        }
        value.append(c);
      }
      expect(quote);
      return value.toString();
    }

    private String readIdentifier() {
      int start = pos;
      if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
        throw error("expected a label name");
      }
      while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
        pos++;
      }
      return text.substring(start, pos);
    }

    private void skipNumber() {
      while (pos < text.length()
          && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
        pos++;
      }
    }

    private void skipPast(char end) {
      int index = text.indexOf(end, pos);
      if (index < 0) {
        throw error("unterminated '" + text.charAt(pos) + "'");
      }
      pos = index + 1;
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      if (pos >= text.length()) {
        throw error("unexpected end of query");
      }
      return text.charAt(pos);
    }

    private void expect(char c) {
      if (peek() != c) {
        throw error("expected '" + c + "'");
      }
      pos++;
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(
          String.format("Cannot parse selectors of [%s] at %d: %s", text, pos, message));
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == ':';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || Character.isDigit(c);
  }
}
