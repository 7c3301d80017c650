/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Structural properties of the plan rooted at one operator.
 *
 * <ul>
 *   <li>{@code pipelineLength}: length of the pipeline ending at the operator
 *   <li>{@code planWidth}: number of leaves, at least 1
 *   <li>{@code planHeight}: number of operators on the longest root-to-leaf path
 *   <li>{@code breakerCount}: total pipeline breakers in the plan
 *   <li>{@code breakerHeight}: max number of breakers on one root-to-leaf path
 * </ul>
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class PlanStats {

  private final int pipelineLength;
  private final int planWidth;
  private final int planHeight;
  private final int breakerCount;
  private final int breakerHeight;
}
