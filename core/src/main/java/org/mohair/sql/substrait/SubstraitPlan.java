/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import com.google.common.base.Preconditions;
import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import io.substrait.proto.Plan;
import io.substrait.proto.PlanRel;
import io.substrait.proto.Rel;
import io.substrait.proto.RelRoot;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.mohair.sql.exception.InvalidSubplanException;
import org.mohair.sql.exception.MalformedPlanException;
import org.mohair.sql.exception.MultipleRootsException;
import org.mohair.sql.exception.NoRootException;
import org.mohair.sql.exception.PlanDecodeException;
import org.mohair.sql.planner.decomposition.AnnotatedPlan;
import org.mohair.sql.planner.decomposition.DecomposedPlan;
import org.mohair.sql.planner.decomposition.PlanWalker;
import org.mohair.sql.planner.operator.OperatorNode;
import org.mohair.sql.planner.operator.OperatorTree;
import org.mohair.sql.protocol.mohair.PlanAnchor;

/**
 * A query plan message, both as received bytes and as parsed structure. The plan must have
 * exactly one root relation; its input is translated into an {@link OperatorTree} when the plan
 * is created.
 *
 * <p>Instances are immutable. Sub-plan messages are built from a copy of the parsed plan.
 */
@Log4j2
public class SubstraitPlan {

  private final byte[] bytes;

  @Getter private final Plan plan;

  /** Position of the root relation in {@link Plan#getRelationsList()}. */
  @Getter private final int rootIndex;

  private final OperatorTree operatorTree;

  private SubstraitPlan(byte[] bytes, Plan plan) {
    this.bytes = bytes;
    this.plan = plan;
    this.rootIndex = findRootIndex(plan);

    RelRoot root = plan.getRelations(rootIndex).getRoot();
    if (!root.hasInput()) {
      throw new MalformedPlanException("Root relation has no input");
    }
    this.operatorTree = new SubstraitTranslator().translate(root.getInput());
  }

  /** Decodes a serialized plan message. */
  public static SubstraitPlan fromMessageBytes(byte[] planBytes) {
    Preconditions.checkNotNull(planBytes, "plan bytes");
    Plan plan;
    try {
      plan = Plan.parseFrom(planBytes);
    } catch (InvalidProtocolBufferException e) {
      throw new PlanDecodeException("Unable to decode plan message", e);
    }
    return new SubstraitPlan(planBytes.clone(), plan);
  }

  public static SubstraitPlan fromMessageProto(Plan plan) {
    Preconditions.checkNotNull(plan, "plan");
    return new SubstraitPlan(plan.toByteArray(), plan);
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  /** Returns a builder holding a copy of this plan. */
  public Plan.Builder copyPlan() {
    return plan.toBuilder();
  }

  /** Returns the input of the root relation, the top operator of the query. */
  public Rel getRootRelation() {
    return plan.getRelations(rootIndex).getRoot().getInput();
  }

  public OperatorTree toOperatorTree() {
    return operatorTree;
  }

  public AnnotatedPlan toAnnotatedPlan() {
    return new PlanWalker().walk(operatorTree);
  }

  /**
   * Builds the message for one subplan of {@code dplan}: this plan with the root relation's input
   * replaced by the subplan, and the anchor packed into the optimization extension. The anchor's
   * type URL is added to the plan's expected type URLs.
   *
   * @param dplan a decomposition of this plan
   * @param subplanIndex index into {@link DecomposedPlan#getSubplanRoots()}
   * @throws InvalidSubplanException if the anchor is the root of this plan, the index is out of
   *     range or {@code dplan} was derived from another plan
   */
  public SubstraitPlan toSubPlanMessage(DecomposedPlan dplan, int subplanIndex) {
    Preconditions.checkNotNull(dplan, "decomposed plan");
    if (dplan.getQueryPlan().getPlanRoot() != operatorTree.getRoot()) {
      throw new InvalidSubplanException("Decomposed plan was not derived from this plan");
    }

    OperatorNode anchor = dplan.getAnchorNode();
    if (operatorTree.isRoot(anchor) || anchor.getPayload() == getRootRelation()) {
      log.error("Anchor {} is the root of the plan, there is no superplan to keep", anchor);
      throw new InvalidSubplanException(
          "Cannot split at " + anchor + ": it is the root of the plan");
    }

    int subplanCount = dplan.getSubplanRoots().size();
    if (subplanIndex < 0 || subplanIndex >= subplanCount) {
      throw new InvalidSubplanException(
          "Subplan index " + subplanIndex + " is out of range for " + subplanCount + " subplan(s)");
    }

    OperatorNode subplanRoot = dplan.getSubplanRoots().get(subplanIndex);
    Rel subplanRel = new SubstraitRelWriter().toRel(subplanRoot);
    PlanAnchor planAnchor = anchorFor(dplan);

    Plan.Builder subPlan = copyPlan();
    subPlan.getRelationsBuilder(rootIndex).getRootBuilder().setInput(subplanRel);
    Any packedAnchor = Any.pack(planAnchor);
    subPlan.getAdvancedExtensionsBuilder().setOptimization(packedAnchor);
    if (!subPlan.getExpectedTypeUrlsList().contains(packedAnchor.getTypeUrl())) {
      subPlan.addExpectedTypeUrls(packedAnchor.getTypeUrl());
    }

    log.debug("Built subplan {} rooted at {} under anchor {}", subplanIndex, subplanRoot, anchor);
    return fromMessageProto(subPlan.build());
  }

  /** Builds the anchor describing the operator {@code dplan} retains in the superplan. */
  public PlanAnchor anchorFor(DecomposedPlan dplan) {
    return new PlanAnchorBuilder().anchorFor(operatorTree, dplan.getAnchorNode().getId());
  }

  /** Returns the anchor carried by this plan, if it is a sub-plan message. */
  public Optional<PlanAnchor> getPlanAnchor() {
    if (!plan.hasAdvancedExtensions() || !plan.getAdvancedExtensions().hasOptimization()) {
      return Optional.empty();
    }

    Any optimization = plan.getAdvancedExtensions().getOptimization();
    if (!optimization.is(PlanAnchor.class)) {
      return Optional.empty();
    }
    try {
      return Optional.of(optimization.unpack(PlanAnchor.class));
    } catch (InvalidProtocolBufferException e) {
      throw new PlanDecodeException("Unable to decode plan anchor", e);
    }
  }

  @Override
  public String toString() {
    return "SubstraitPlan{root=" + operatorTree.getRoot() + ", size=" + bytes.length + '}';
  }

  private static int findRootIndex(Plan plan) {
    int rootIndex = -1;
    for (int i = 0; i < plan.getRelationsCount(); i++) {
      PlanRel relation = plan.getRelations(i);
      if (!relation.hasRoot()) {
        continue;
      }
      if (rootIndex >= 0) {
        throw new MultipleRootsException(
            "Plan has root relations at positions " + rootIndex + " and " + i);
      }
      rootIndex = i;
    }

    if (rootIndex < 0) {
      throw new NoRootException("Plan has no root relation");
    }
    return rootIndex;
  }
}
