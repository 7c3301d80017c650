/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.decomposer;

import com.google.common.collect.ImmutableList;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.mohair.sql.planner.decomposition.AnnotatedPlan;
import org.mohair.sql.planner.decomposition.DecomposedPlan;
import org.mohair.sql.planner.decomposition.PlanSplitter;
import org.mohair.sql.planner.decomposition.PlanViewer;
import org.mohair.sql.planner.decomposition.PlanWalker;
import org.mohair.sql.protocol.mohair.PlanAnchor;
import org.mohair.sql.substrait.SubstraitPlan;

/**
 * Entry point for plan decomposition. Decodes a plan, splits it at a pipeline breaker and builds
 * one sub-plan message per input of that breaker. Each sub-plan carries the anchor so a receiver
 * can rebuild the superplan around its result.
 */
@Log4j2
@RequiredArgsConstructor
public class QueryDecomposer {

  private final PlanWalker planWalker;

  private final PlanSplitter planSplitter;

  private final PlanViewer planViewer;

  public DecompositionResult decompose(byte[] planBytes) {
    return decompose(SubstraitPlan.fromMessageBytes(planBytes));
  }

  public DecompositionResult decompose(SubstraitPlan plan) {
    AnnotatedPlan annotatedPlan = planWalker.walk(plan.toOperatorTree());
    if (log.isDebugEnabled()) {
      log.debug("Decomposing plan:{}", planViewer.view(annotatedPlan));
      log.debug("Breaker leaves:\n{}", planViewer.viewBreakers(annotatedPlan, "  "));
    }

    DecomposedPlan decomposedPlan = planSplitter.splitPlan(annotatedPlan);
    PlanAnchor planAnchor = plan.anchorFor(decomposedPlan);

    ImmutableList.Builder<SubstraitPlan> subplans = ImmutableList.builder();
    for (int i = 0; i < decomposedPlan.getSubplanRoots().size(); i++) {
      subplans.add(plan.toSubPlanMessage(decomposedPlan, i));
    }

    DecompositionResult result =
        new DecompositionResult(plan, decomposedPlan, planAnchor, subplans.build());
    log.info(
        "Decomposed plan at {} into {} subplan(s)",
        decomposedPlan.getAnchorNode(),
        result.getSubplans().size());
    return result;
  }
}
