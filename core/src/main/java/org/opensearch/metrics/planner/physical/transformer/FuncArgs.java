/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import org.opensearch.metrics.query.RangeParams;

/**
 * Argument of a function transformer: either a literal or a reference to an exec plan that the
 * runtime evaluates before the function and substitutes per step.
 */
public interface FuncArgs {

  RangeParams getTimeStepParams();
}
