/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.mohair.sql.exception.NoSplitPointException;

/**
 * Prefers the tallest interior breaker whose plan reads at most {@link #MAX_CHAIN_WIDTH} leaves.
 * When no interior breaker qualifies, falls back to the breaker leaf closing the longest pipeline.
 * Ties go to the breaker seen first.
 */
@Log4j2
public class LongestChainSelector implements SplitPointSelector {

  public static final int MAX_CHAIN_WIDTH = 2;

  @Override
  public AnnotatedPlan selectAnchor(AnnotatedPlan plan) {
    Optional<AnnotatedPlan> chainTop =
        firstMax(
            plan.getBreakerList().stream()
                .filter(breaker -> breaker.getPlanWidth() <= MAX_CHAIN_WIDTH)
                .collect(Collectors.toList()),
            AnnotatedPlan::getPlanHeight);
    if (chainTop.isPresent()) {
      log.debug("Longest chain ends at interior breaker {}", chainTop.get().getPlanRoot());
      return chainTop.get();
    }

    AnnotatedPlan leaf =
        firstMax(plan.getBreakerLeaves(), AnnotatedPlan::getPipelineLength)
            .orElseThrow(
                () ->
                    new NoSplitPointException(
                        "No pipeline breaker to split at in plan rooted at "
                            + plan.getPlanRoot()));
    log.debug("Longest chain ends at breaker leaf {}", leaf.getPlanRoot());
    return leaf;
  }

  /** Max by {@code key}, keeping the earliest element on ties. */
  private static Optional<AnnotatedPlan> firstMax(
      List<AnnotatedPlan> plans, ToIntFunction<AnnotatedPlan> key) {
    Comparator<AnnotatedPlan> byKey = Comparator.comparingInt(key);
    return plans.stream().reduce((best, next) -> byKey.compare(next, best) > 0 ? next : best);
  }
}
