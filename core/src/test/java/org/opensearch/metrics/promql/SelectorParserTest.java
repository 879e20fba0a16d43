/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.promql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.opensearch.metrics.planner.PlanFixtures.DATASET;
import static org.opensearch.metrics.planner.PlanFixtures.ns;
import static org.opensearch.metrics.planner.PlanFixtures.nsRegex;
import static org.opensearch.metrics.planner.PlanFixtures.periodic;
import static org.opensearch.metrics.planner.PlanFixtures.selector;
import static org.opensearch.metrics.planner.PlanFixtures.ws;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.metrics.planner.logical.Aggregate;
import org.opensearch.metrics.planner.logical.AggregationOperator;
import org.opensearch.metrics.planner.logical.BinaryJoin;
import org.opensearch.metrics.planner.logical.BinaryOperator;
import org.opensearch.metrics.planner.logical.LogicalPlan;
import org.opensearch.metrics.query.filter.ColumnFilter;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SelectorParserTest {

  private final SelectorParser parser = new SelectorParser("__name__");

  @Test
  void should_parse_selector_with_metric_name() {
    assertEquals(
        List.of(
            selector(
                "test", ColumnFilter.equalTo("instance", "Inst-1"), ws("demo"), ns("App-1"))),
        parser.parse("test{instance=\"Inst-1\",_ws_=\"demo\",_ns_=\"App-1\"}"));
  }

  @Test
  void should_parse_every_operator_and_bare_matchers() {
    assertEquals(
        List.of(
            List.of(
                ColumnFilter.notEqualTo("a", "1"),
                ColumnFilter.regex("b", "x.*"),
                ColumnFilter.notRegex("c", "y"))),
        parser.parse("{a != \"1\", b=~'x.*', c!~\"y\"}"));
  }

  @Test
  void should_skip_functions_grouping_durations_and_strings() {
    String query =
        "sum by (job) (rate(http_requests{code=\"500\"}[5m] offset 1h)) / on(job) "
            + "label_replace(up, \"dst\", \"{x=\\\"y\\\"}\", \"src\", \"(.*)\") * 2.5e3";

    assertEquals(
        List.of(
            selector("http_requests", ColumnFilter.equalTo("code", "500")), selector("up")),
        parser.parse(query));
  }

  @Test
  void should_unescape_quoted_values() {
    assertEquals(
        List.of(selector("test", ColumnFilter.equalTo("path", "a\\b\"c"))),
        parser.parse("test{path=\"a\\\\b\\\"c\"}"));
  }

  @Test
  void should_read_back_rendered_plan() {
    PromQlRenderer renderer = new PromQlRenderer(DATASET.getMetricColumn());
    LogicalPlan plan =
        new Aggregate(
            AggregationOperator.SUM,
            new BinaryJoin(
                periodic(selector("a", ws("demo"), nsRegex("App.*"))),
                BinaryOperator.ADD,
                periodic(selector("b", ws("demo"), ns("B")))));

    assertEquals(plan.getSelectorFilters(), parser.parse(renderer.render(plan)));
  }

  @Test
  void should_reject_malformed_selector() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("test{a=}"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("test{a=\"1\""));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("test{a~\"1\"}"));
  }
}
