/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Whether tuples can stream through an operator ({@link #PIPELINE}) or the operator must exhaust
 * its input before emitting anything ({@link #BREAKER}).
 */
@Getter
@RequiredArgsConstructor
public enum OperatorCategory {
  PIPELINE("←"),
  BREAKER("↤");

  /** Marker used when rendering a plan. */
  private final String symbol;

  /** Classifies an operator kind. Adding a kind without classifying it does not compile. */
  public static OperatorCategory of(OperatorKind kind) {
    return switch (kind) {
      case PROJECTION, SELECTION, LIMIT, SORT, READ, EXTERNAL_PARTITION_READ -> PIPELINE;
      case AGGREGATION, JOIN, HASH_JOIN, MERGE_JOIN, CROSS_JOIN, SET_OP, EXTENSION -> BREAKER;
    };
  }
}
