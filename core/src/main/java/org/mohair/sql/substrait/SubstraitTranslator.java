/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import io.substrait.proto.Rel;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.mohair.sql.exception.MalformedPlanException;
import org.mohair.sql.planner.operator.OperatorKind;
import org.mohair.sql.planner.operator.OperatorNode;
import org.mohair.sql.planner.operator.OperatorTree;
import org.mohair.sql.planner.operator.SkyPartition;

/**
 * Translates a relation tree into an {@link OperatorTree}. Each node keeps the relation it was
 * translated from as payload. Inputs are translated left to right before their parent.
 */
@Log4j2
public class SubstraitTranslator {

  public OperatorTree translate(Rel rel) {
    OperatorTree.Builder builder = OperatorTree.builder();
    OperatorNode root = translate(rel, builder);
    return builder.build(root);
  }

  private OperatorNode translate(Rel rel, OperatorTree.Builder builder) {
    if (rel == null) {
      throw new MalformedPlanException("Missing relation");
    }
    log.debug("translating {}", rel.getRelTypeCase());

    return switch (rel.getRelTypeCase()) {
      case READ -> builder.add(OperatorKind.READ, rel, List.of());
      case EXTENSION_LEAF -> builder.addPartitionRead(
          rel, SkyPartition.fromRel(SkyRelExtension.fromRel(rel.getExtensionLeaf())));
      case PROJECT -> unary(
          OperatorKind.PROJECTION, rel, rel.getProject().hasInput(), rel.getProject().getInput(),
          builder);
      case FILTER -> unary(
          OperatorKind.SELECTION, rel, rel.getFilter().hasInput(), rel.getFilter().getInput(),
          builder);
      case FETCH -> unary(
          OperatorKind.LIMIT, rel, rel.getFetch().hasInput(), rel.getFetch().getInput(), builder);
      case SORT -> unary(
          OperatorKind.SORT, rel, rel.getSort().hasInput(), rel.getSort().getInput(), builder);
      case AGGREGATE -> unary(
          OperatorKind.AGGREGATION, rel, rel.getAggregate().hasInput(),
          rel.getAggregate().getInput(), builder);
      case EXTENSION_SINGLE -> unary(
          OperatorKind.EXTENSION, rel, rel.getExtensionSingle().hasInput(),
          rel.getExtensionSingle().getInput(), builder);
      case JOIN -> binary(
          OperatorKind.JOIN, rel, rel.getJoin().hasLeft(), rel.getJoin().getLeft(),
          rel.getJoin().hasRight(), rel.getJoin().getRight(), builder);
      case HASH_JOIN -> binary(
          OperatorKind.HASH_JOIN, rel, rel.getHashJoin().hasLeft(), rel.getHashJoin().getLeft(),
          rel.getHashJoin().hasRight(), rel.getHashJoin().getRight(), builder);
      case MERGE_JOIN -> binary(
          OperatorKind.MERGE_JOIN, rel, rel.getMergeJoin().hasLeft(), rel.getMergeJoin().getLeft(),
          rel.getMergeJoin().hasRight(), rel.getMergeJoin().getRight(), builder);
      case CROSS -> binary(
          OperatorKind.CROSS_JOIN, rel, rel.getCross().hasLeft(), rel.getCross().getLeft(),
          rel.getCross().hasRight(), rel.getCross().getRight(), builder);
      case SET -> multi(OperatorKind.SET_OP, rel, rel.getSet().getInputsList(), builder);
      case EXTENSION_MULTI -> multi(
          OperatorKind.EXTENSION, rel, rel.getExtensionMulti().getInputsList(), builder);
      case RELTYPE_NOT_SET -> throw new MalformedPlanException("Relation has no operator set");
      default -> throw new MalformedPlanException(
          "Unsupported relation " + rel.getRelTypeCase());
    };
  }

  private OperatorNode unary(
      OperatorKind kind, Rel rel, boolean hasInput, Rel input, OperatorTree.Builder builder) {
    if (!hasInput) {
      throw new MalformedPlanException(kind.getTag() + " has no input");
    }
    return builder.add(kind, rel, List.of(translate(input, builder)));
  }

  private OperatorNode binary(
      OperatorKind kind,
      Rel rel,
      boolean hasLeft,
      Rel left,
      boolean hasRight,
      Rel right,
      OperatorTree.Builder builder) {
    if (!hasLeft || !hasRight) {
      throw new MalformedPlanException(kind.getTag() + " is missing a join input");
    }
    OperatorNode leftOp = translate(left, builder);
    OperatorNode rightOp = translate(right, builder);
    return builder.add(kind, rel, List.of(leftOp, rightOp));
  }

  private OperatorNode multi(
      OperatorKind kind, Rel rel, List<Rel> inputs, OperatorTree.Builder builder) {
    if (inputs.isEmpty()) {
      throw new MalformedPlanException(kind.getTag() + " has no inputs");
    }
    List<OperatorNode> inputOps = new ArrayList<>(inputs.size());
    for (Rel input : inputs) {
      inputOps.add(translate(input, builder));
    }
    return builder.add(kind, rel, inputOps);
  }
}
