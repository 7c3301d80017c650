/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import io.substrait.proto.Rel;
import lombok.RequiredArgsConstructor;
import org.mohair.sql.planner.operator.OperatorKind;
import org.mohair.sql.planner.operator.OperatorNode;
import org.mohair.sql.planner.operator.OperatorTree;
import org.mohair.sql.protocol.mohair.PlanAnchor;

/**
 * Builds the {@link PlanAnchor} describing the operator retained in a superplan. The anchor is a
 * copy of the operator's relation with its inputs removed; the tree's own nodes are never
 * modified.
 */
@RequiredArgsConstructor
public class PlanAnchorBuilder {

  private final SubstraitRelWriter relWriter;

  public PlanAnchorBuilder() {
    this(new SubstraitRelWriter());
  }

  /** Builds the anchor for the node with id {@code nodeId} in {@code tree}. */
  public PlanAnchor anchorFor(OperatorTree tree, int nodeId) {
    OperatorNode node = tree.getNode(nodeId);
    Rel anchorRel = withoutInputs(node.getKind(), relWriter.toRel(node));
    return PlanAnchor.newBuilder().setAnchorRel(anchorRel).build();
  }

  private Rel withoutInputs(OperatorKind kind, Rel rel) {
    Rel.Builder anchor = rel.toBuilder();
    switch (kind) {
      case PROJECTION -> anchor.getProjectBuilder().clearInput();
      case SELECTION -> anchor.getFilterBuilder().clearInput();
      case LIMIT -> anchor.getFetchBuilder().clearInput();
      case SORT -> anchor.getSortBuilder().clearInput();
      case AGGREGATION -> anchor.getAggregateBuilder().clearInput();
      case JOIN -> anchor.getJoinBuilder().clearLeft().clearRight();
      case HASH_JOIN -> anchor.getHashJoinBuilder().clearLeft().clearRight();
      case MERGE_JOIN -> anchor.getMergeJoinBuilder().clearLeft().clearRight();
      case CROSS_JOIN -> anchor.getCrossBuilder().clearLeft().clearRight();
      case SET_OP -> anchor.getSetBuilder().clearInputs();
      case EXTENSION -> {
        if (anchor.hasExtensionSingle()) {
          anchor.getExtensionSingleBuilder().clearInput();
        } else {
          anchor.getExtensionMultiBuilder().clearInputs();
        }
      }
      case READ, EXTERNAL_PARTITION_READ -> {
        // leaves have no inputs
      }
    }
    return anchor.build();
  }
}
