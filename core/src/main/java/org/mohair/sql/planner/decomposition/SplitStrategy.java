/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import java.util.Arrays;
import java.util.Optional;

/** How {@link PlanSplitter} chooses the breaker that anchors the superplan. */
public enum SplitStrategy {
  /** Highest interior breaker of a narrow plan, else the breaker leaf with the longest pipeline. */
  LONGEST_CHAIN,
  MIDDLE_BREAKER,
  LOWEST_BREAKER,
  BY_WEIGHT;

  /** Looks up a strategy by name, ignoring case. */
  public static Optional<SplitStrategy> of(String name) {
    return Arrays.stream(values()).filter(s -> s.name().equalsIgnoreCase(name)).findFirst();
  }
}
