/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.mohair.sql.planner.operator.OperatorNode;

/**
 * The result of splitting a plan: the full annotated plan, the breaker retained as anchor root of
 * the superplan, and the anchor's inputs, each the root of a subplan that runs elsewhere.
 */
@Getter
public class DecomposedPlan {

  private final AnnotatedPlan queryPlan;
  private final AnnotatedPlan anchorRoot;
  private final List<OperatorNode> subplanRoots;

  public DecomposedPlan(AnnotatedPlan queryPlan, AnnotatedPlan anchorRoot) {
    this.queryPlan = queryPlan;
    this.anchorRoot = anchorRoot;
    this.subplanRoots = ImmutableList.copyOf(anchorRoot.getPlanRoot().getInputs());
  }

  public OperatorNode getAnchorNode() {
    return anchorRoot.getPlanRoot();
  }

  @Override
  public String toString() {
    return "DecomposedPlan{anchor=" + anchorRoot.getPlanRoot() + ", subplans=" + subplanRoots + '}';
  }
}
