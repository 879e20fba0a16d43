/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.logical;

import java.util.List;
import java.util.OptionalDouble;

/** A plan that evaluates to one scalar per step. Scalar plans are the arguments of functions. */
public abstract class ScalarPlan extends LogicalPlan {

  protected ScalarPlan(List<LogicalPlan> children) {
    super(children);
  }

  /** The value of this scalar when it is a literal, empty when it must be computed. */
  public OptionalDouble literalValue() {
    return OptionalDouble.empty();
  }
}
