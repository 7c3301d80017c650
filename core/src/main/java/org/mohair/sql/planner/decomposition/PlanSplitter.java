/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Splits an annotated plan at a pipeline breaker chosen by a {@link SplitPointSelector}. The
 * chosen breaker stays in the superplan as the anchor; its inputs are the subplans.
 */
@Log4j2
public class PlanSplitter {

  private final Map<SplitStrategy, SplitPointSelector> selectors;

  @Getter private final SplitStrategy defaultStrategy;

  /** Splitter with only {@link SplitStrategy#LONGEST_CHAIN} available. */
  public PlanSplitter() {
    this(SplitStrategy.LONGEST_CHAIN);
  }

  public PlanSplitter(SplitStrategy defaultStrategy) {
    this(ImmutableMap.of(SplitStrategy.LONGEST_CHAIN, new LongestChainSelector()), defaultStrategy);
  }

  public PlanSplitter(
      Map<SplitStrategy, SplitPointSelector> selectors, SplitStrategy defaultStrategy) {
    Preconditions.checkNotNull(defaultStrategy, "default strategy");
    Preconditions.checkArgument(
        selectors.containsKey(defaultStrategy),
        "no selector registered for default strategy %s",
        defaultStrategy);
    this.selectors = ImmutableMap.copyOf(selectors);
    this.defaultStrategy = defaultStrategy;
  }

  public DecomposedPlan splitPlan(AnnotatedPlan plan) {
    return splitPlan(plan, defaultStrategy);
  }

  public DecomposedPlan splitPlan(AnnotatedPlan plan, SplitStrategy strategy) {
    Preconditions.checkNotNull(plan, "plan");
    SplitPointSelector selector = selectors.get(strategy);
    if (selector == null) {
      throw new UnsupportedOperationException("Split strategy " + strategy + " is not supported");
    }

    AnnotatedPlan anchor = selector.selectAnchor(plan);
    DecomposedPlan decomposed = new DecomposedPlan(plan, anchor);
    log.debug("Split {} with {}: {}", plan.getPlanRoot(), strategy, decomposed);
    return decomposed;
  }

  public boolean supports(SplitStrategy strategy) {
    return selectors.containsKey(strategy);
  }
}
