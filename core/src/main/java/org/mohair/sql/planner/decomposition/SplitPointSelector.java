/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

/** Chooses the anchor of a decomposition for one {@link SplitStrategy}. */
public interface SplitPointSelector {

  /**
   * Selects the breaker that is retained as the anchor root. Its inputs become the subplans.
   *
   * @param plan the annotated plan to split
   * @return one of the breakers indexed by {@code plan}
   * @throws org.mohair.sql.exception.NoSplitPointException if the plan has no breaker
   */
  AnnotatedPlan selectAnchor(AnnotatedPlan plan);
}
