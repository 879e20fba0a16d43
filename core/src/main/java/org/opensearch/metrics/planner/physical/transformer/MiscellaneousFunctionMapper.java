/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.metrics.planner.physical.transformer;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.metrics.planner.logical.MiscellaneousFunctionId;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class MiscellaneousFunctionMapper implements RangeVectorTransformer {

  private final MiscellaneousFunctionId function;
  private final List<String> stringArgs;

  @Override
  public String args() {
    return String.format("function=%s, stringArgs=%s", function.name(), stringArgs);
  }
}
