/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The relational operators that appear in a decomposable plan. {@link #EXTENSION} covers
 * operators whose semantics live in an opaque extension payload.
 */
@Getter
@RequiredArgsConstructor
public enum OperatorKind {
  PROJECTION("Π", "ProjectRel"),
  SELECTION("σ", "FilterRel"),
  LIMIT("Lim", "FetchRel"),
  SORT("Sort", "SortRel"),
  READ("Read", "ReadRel"),
  EXTERNAL_PARTITION_READ("SkyRead", "SkyRel"),
  AGGREGATION("Aggr", "AggregateRel"),
  JOIN("⋈", "JoinRel"),
  HASH_JOIN("⋈→", "HashJoinRel"),
  MERGE_JOIN("⋈⊕", "MergeJoinRel"),
  CROSS_JOIN("×", "CrossRel"),
  SET_OP("∪", "SetRel"),
  EXTENSION("Ext", "ExtensionRel");

  /** Short label used when rendering a plan. */
  private final String symbol;

  /** Name of the relation message in the plan IR, also the fallback display name. */
  private final String tag;

  public OperatorCategory getCategory() {
    return OperatorCategory.of(this);
  }

  public boolean isBreaker() {
    return getCategory() == OperatorCategory.BREAKER;
  }

  /** Returns true if an operator of this kind may have {@code inputCount} inputs. */
  public boolean acceptsInputCount(int inputCount) {
    return switch (this) {
      case READ, EXTERNAL_PARTITION_READ -> inputCount == 0;
      case PROJECTION, SELECTION, LIMIT, SORT, AGGREGATION -> inputCount == 1;
      case JOIN, HASH_JOIN, MERGE_JOIN, CROSS_JOIN -> inputCount == 2;
      case SET_OP, EXTENSION -> inputCount >= 1;
    };
  }
}
