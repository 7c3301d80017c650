/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.mohair.sql.exception.MalformedPlanException;
import org.mohair.sql.planner.operator.OperatorNode;
import org.mohair.sql.planner.operator.OperatorTree;

/**
 * Annotates an operator tree with {@link PlanStats} in one bottom-up pass.
 *
 * <p>For each operator the annotated inputs are stably sorted ascending by {@link
 * AnnotatedPlan#incrementPipelineLength()}. The first input after sorting decides the operator's
 * own pipeline length, and breaker leaves and interior breakers are concatenated in that order.
 * Choosing the shortest extended input keeps pipeline length estimates conservative; inputs of
 * equal length keep their input order.
 */
@Log4j2
public class PlanWalker {

  private static final Comparator<AnnotatedPlan> BY_INCREMENTED_PIPELINE_LENGTH =
      Comparator.comparingInt(AnnotatedPlan::incrementPipelineLength);

  /** Walks the tree from its root. */
  public AnnotatedPlan walk(OperatorTree tree) {
    if (tree == null) {
      throw new MalformedPlanException("Cannot walk a missing operator tree");
    }
    AnnotatedPlan plan = walk(tree.getRoot());
    log.debug("Walked {} operators: {}", tree.size(), plan);
    return plan;
  }

  /** Builds the annotated plan rooted at {@code planOp}. */
  public AnnotatedPlan walk(OperatorNode planOp) {
    if (planOp == null) {
      throw new MalformedPlanException("Cannot walk a plan without a root operator");
    }

    List<AnnotatedPlan> inputPlans =
        planOp.getInputs().stream().map(this::walk).collect(Collectors.toList());
    List<AnnotatedPlan> sortedInputs = new ArrayList<>(inputPlans);
    sortedInputs.sort(BY_INCREMENTED_PIPELINE_LENGTH);

    int pipelineLength = 1;
    int planWidth = 0;
    int planHeight = 0;
    int breakerCount = 0;
    int breakerHeight = 0;
    List<AnnotatedPlan> breakerLeaves = new ArrayList<>();
    List<AnnotatedPlan> breakerList = new ArrayList<>();

    for (AnnotatedPlan inputPlan : sortedInputs) {
      planWidth += inputPlan.getPlanWidth();
      planHeight = Math.max(planHeight, inputPlan.getPlanHeight());

      breakerCount += inputPlan.getBreakerCount();
      breakerHeight = Math.max(breakerHeight, inputPlan.getBreakerHeight());

      // a breaker below an input is still a breaker leaf for this plan
      breakerLeaves.addAll(inputPlan.getBreakerLeaves());
      breakerList.addAll(inputPlan.getBreakerList());
    }

    if (planOp.isBreaker()) {
      breakerCount += 1;
      breakerHeight += 1;
    }

    if (!sortedInputs.isEmpty()) {
      pipelineLength = sortedInputs.get(0).incrementPipelineLength();
    }

    PlanStats stats =
        new PlanStats(
            pipelineLength,
            Math.max(planWidth, 1),
            planHeight + 1,
            breakerCount,
            breakerHeight);
    AnnotatedPlan plan =
        new AnnotatedPlan(
            planOp,
            stats,
            Collections.unmodifiableList(inputPlans),
            Collections.unmodifiableList(breakerLeaves),
            Collections.unmodifiableList(breakerList));

    // the plan is not visible to callers until it is returned
    if (planOp.isBreaker()) {
      if (breakerLeaves.isEmpty()) {
        breakerLeaves.add(plan);
      } else {
        breakerList.add(plan);
      }
    }

    return plan;
  }
}
