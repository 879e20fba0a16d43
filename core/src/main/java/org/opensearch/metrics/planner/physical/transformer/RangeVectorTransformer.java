/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import java.util.List;

/**
 * Step applied to the result stream of an exec plan node. Transformers of one node run in the
 * order they were added.
 */
public interface RangeVectorTransformer {

  /** Arguments shown when the plan tree is printed. */
  String args();

  /** Function arguments whose exec plans must be evaluated before this step runs. */
  default List<FuncArgs> getFuncParams() {
    return List.of();
  }
}
