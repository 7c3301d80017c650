/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import java.util.List;
import lombok.Getter;
import org.mohair.sql.planner.operator.OperatorNode;

/**
 * An operator together with the {@link PlanStats} of the plan it roots, produced by {@link
 * PlanWalker}. Also indexes the pipeline breakers of that plan:
 *
 * <ul>
 *   <li>{@code breakerLeaves}: the bottom-most breakers, i.e. breakers with no breaker below them
 *   <li>{@code breakerList}: every other breaker, in walk order
 * </ul>
 *
 * <p>Immutable once returned by the walker.
 */
@Getter
public class AnnotatedPlan {

  private final OperatorNode planRoot;
  private final PlanStats stats;

  /** Annotated inputs, in the operator's input order. */
  private final List<AnnotatedPlan> inputPlans;

  private final List<AnnotatedPlan> breakerLeaves;
  private final List<AnnotatedPlan> breakerList;

  AnnotatedPlan(
      OperatorNode planRoot,
      PlanStats stats,
      List<AnnotatedPlan> inputPlans,
      List<AnnotatedPlan> breakerLeaves,
      List<AnnotatedPlan> breakerList) {
    this.planRoot = planRoot;
    this.stats = stats;
    this.inputPlans = inputPlans;
    this.breakerLeaves = breakerLeaves;
    this.breakerList = breakerList;
  }

  public int getPipelineLength() {
    return stats.getPipelineLength();
  }

  public int getPlanWidth() {
    return stats.getPlanWidth();
  }

  public int getPlanHeight() {
    return stats.getPlanHeight();
  }

  public int getBreakerCount() {
    return stats.getBreakerCount();
  }

  public int getBreakerHeight() {
    return stats.getBreakerHeight();
  }

  public boolean isBreaker() {
    return planRoot.isBreaker();
  }

  /**
   * Returns the pipeline length a parent would see through this plan: 1 if the root is a breaker
   * (the parent starts a new pipeline), otherwise {@code pipelineLength + 1}.
   */
  public int incrementPipelineLength() {
    if (isBreaker()) {
      return 1;
    }
    return stats.getPipelineLength() + 1;
  }

  @Override
  public String toString() {
    return "AnnotatedPlan{root=" + planRoot + ", " + stats + '}';
  }
}
