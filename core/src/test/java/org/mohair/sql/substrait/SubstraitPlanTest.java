/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mohair.sql.utils.RelFixtures.aggregate;
import static org.mohair.sql.utils.RelFixtures.filter;
import static org.mohair.sql.utils.RelFixtures.join;
import static org.mohair.sql.utils.RelFixtures.plan;
import static org.mohair.sql.utils.RelFixtures.project;
import static org.mohair.sql.utils.RelFixtures.read;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.UnknownFieldSet;
import io.substrait.proto.Plan;
import io.substrait.proto.PlanRel;
import io.substrait.proto.Rel;
import io.substrait.proto.RelRoot;
import io.substrait.proto.SimpleExtensionURI;
import io.substrait.proto.Version;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.mohair.sql.exception.InvalidSubplanException;
import org.mohair.sql.exception.MalformedPlanException;
import org.mohair.sql.exception.MultipleRootsException;
import org.mohair.sql.exception.NoRootException;
import org.mohair.sql.exception.PlanDecodeException;
import org.mohair.sql.planner.decomposition.DecomposedPlan;
import org.mohair.sql.planner.decomposition.PlanSplitter;
import org.mohair.sql.planner.operator.OperatorKind;
import org.mohair.sql.protocol.mohair.PlanAnchor;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubstraitPlanTest {

  private final PlanSplitter splitter = new PlanSplitter();

  @Test
  void should_decode_plan_bytes() {
    Plan plan = plan(project(filter(read("A"))));

    SubstraitPlan decoded = SubstraitPlan.fromMessageBytes(plan.toByteArray());

    assertEquals(plan, decoded.getPlan());
    assertEquals(0, decoded.getRootIndex());
    assertEquals(3, decoded.toOperatorTree().size());
    assertEquals(OperatorKind.PROJECTION, decoded.toOperatorTree().getRoot().getKind());
    assertArrayEquals(plan.toByteArray(), decoded.getBytes());
  }

  @Test
  void should_decode_plan_with_version_and_expected_type_urls() {
    Plan plan =
        plan(read("A")).toBuilder()
            .setVersion(Version.newBuilder().setMinorNumber(54).setProducer("isthmus"))
            .addExtensionUris(
                SimpleExtensionURI.newBuilder()
                    .setExtensionUriAnchor(1)
                    .setUri("/functions_arithmetic.yaml"))
            .addExpectedTypeUrls("type.googleapis.com/example.Detail")
            .build();

    SubstraitPlan decoded = SubstraitPlan.fromMessageBytes(plan.toByteArray());

    assertEquals(plan, decoded.getPlan());
    assertTrue(decoded.getPlan().getUnknownFields().asMap().isEmpty());
    assertEquals(54, decoded.getPlan().getVersion().getMinorNumber());
    assertEquals(OperatorKind.READ, decoded.toOperatorTree().getRoot().getKind());
    assertFalse(decoded.getPlanAnchor().isPresent());
  }

  @Test
  void should_write_subplan_with_standard_plan_field_numbers()
      throws InvalidProtocolBufferException {
    Plan plan =
        plan(project(aggregate(join(read("A"), read("B"))))).toBuilder()
            .setVersion(Version.newBuilder().setMinorNumber(54))
            .addExpectedTypeUrls("type.googleapis.com/example.Detail")
            .build();
    SubstraitPlan original = SubstraitPlan.fromMessageBytes(plan.toByteArray());

    byte[] subplanBytes =
        original.toSubPlanMessage(splitter.splitPlan(original.toAnnotatedPlan()), 0).getBytes();
    Plan parsed = Plan.parseFrom(subplanBytes);
    UnknownFieldSet fields = UnknownFieldSet.parseFrom(subplanBytes);

    assertTrue(parsed.hasAdvancedExtensions());
    assertTrue(parsed.getAdvancedExtensions().getOptimization().is(PlanAnchor.class));
    assertTrue(parsed.getUnknownFields().asMap().isEmpty());
    assertEquals(54, parsed.getVersion().getMinorNumber());
    assertTrue(fields.hasField(Plan.ADVANCED_EXTENSIONS_FIELD_NUMBER));
    assertTrue(fields.hasField(Plan.VERSION_FIELD_NUMBER));
    assertEquals(4, Plan.ADVANCED_EXTENSIONS_FIELD_NUMBER);
    assertEquals(6, Plan.VERSION_FIELD_NUMBER);
    assertEquals(
        List.of(
            "type.googleapis.com/example.Detail",
            Any.pack(PlanAnchor.getDefaultInstance()).getTypeUrl()),
        parsed.getExpectedTypeUrlsList());
  }

  @Test
  void should_not_repeat_anchor_type_url() {
    String anchorTypeUrl = Any.pack(PlanAnchor.getDefaultInstance()).getTypeUrl();
    SubstraitPlan original =
        SubstraitPlan.fromMessageProto(
            plan(project(aggregate(join(read("A"), read("B"))))).toBuilder()
                .addExpectedTypeUrls(anchorTypeUrl)
                .build());

    Plan subplan =
        original.toSubPlanMessage(splitter.splitPlan(original.toAnnotatedPlan()), 0).getPlan();

    assertEquals(List.of(anchorTypeUrl), subplan.getExpectedTypeUrlsList());
  }

  @Test
  void should_fail_on_malformed_bytes() {
    byte[] garbage = {(byte) 0x1a, (byte) 0xff, (byte) 0xff, (byte) 0xff};

    assertThrows(PlanDecodeException.class, () -> SubstraitPlan.fromMessageBytes(garbage));
  }

  @Test
  void should_fail_without_root_relation() {
    Plan plan = Plan.newBuilder().addRelations(PlanRel.newBuilder().setRel(read("A"))).build();

    assertThrows(NoRootException.class, () -> SubstraitPlan.fromMessageProto(plan));
  }

  @Test
  void should_fail_with_two_root_relations() {
    Plan plan =
        plan(read("A")).toBuilder()
            .addRelations(PlanRel.newBuilder().setRoot(RelRoot.newBuilder().setInput(read("B"))))
            .build();

    assertThrows(MultipleRootsException.class, () -> SubstraitPlan.fromMessageProto(plan));
  }

  @Test
  void should_fail_when_root_has_no_input() {
    Plan plan =
        Plan.newBuilder()
            .addRelations(PlanRel.newBuilder().setRoot(RelRoot.newBuilder().addNames("out")))
            .build();

    assertThrows(MalformedPlanException.class, () -> SubstraitPlan.fromMessageProto(plan));
  }

  @Test
  void should_find_root_after_plain_relations() {
    Plan plan =
        Plan.newBuilder()
            .addRelations(PlanRel.newBuilder().setRel(read("side")))
            .addRelations(PlanRel.newBuilder().setRoot(RelRoot.newBuilder().setInput(read("A"))))
            .build();

    SubstraitPlan substraitPlan = SubstraitPlan.fromMessageProto(plan);

    assertEquals(1, substraitPlan.getRootIndex());
    assertEquals(read("A"), substraitPlan.getRootRelation());
  }

  @Test
  void should_build_subplan_message_with_anchor() {
    Rel join = join(read("A"), read("B"));
    SubstraitPlan original = SubstraitPlan.fromMessageProto(plan(project(aggregate(join))));
    DecomposedPlan decomposed = splitter.splitPlan(original.toAnnotatedPlan());

    SubstraitPlan subplan = original.toSubPlanMessage(decomposed, 0);
    SubstraitPlan received = SubstraitPlan.fromMessageBytes(subplan.getBytes());

    assertEquals(join, received.getRootRelation());
    assertEquals(OperatorKind.JOIN, received.toOperatorTree().getRoot().getKind());
    assertEquals(
        decomposed.getSubplanRoots().get(0).getPayload(),
        received.toOperatorTree().getRoot().getPayload());

    PlanAnchor anchor = received.getPlanAnchor().orElseThrow();
    assertTrue(anchor.getAnchorRel().hasAggregate());
    assertFalse(anchor.getAnchorRel().getAggregate().hasInput());
    assertEquals(original.anchorFor(decomposed), anchor);
  }

  @Test
  void should_keep_original_plan_unchanged() {
    Plan plan = plan(project(aggregate(join(read("A"), read("B")))));
    SubstraitPlan original = SubstraitPlan.fromMessageProto(plan);
    byte[] before = original.getBytes();

    original.toSubPlanMessage(splitter.splitPlan(original.toAnnotatedPlan()), 0);

    assertEquals(plan, original.getPlan());
    assertArrayEquals(before, original.getBytes());
    assertFalse(original.getPlanAnchor().isPresent());
  }

  @Test
  void should_keep_names_of_root_relation() {
    SubstraitPlan original =
        SubstraitPlan.fromMessageProto(plan(project(aggregate(join(read("A"), read("B"))))));

    SubstraitPlan subplan =
        original.toSubPlanMessage(splitter.splitPlan(original.toAnnotatedPlan()), 0);

    assertEquals(
        original.getPlan().getRelations(0).getRoot().getNamesList(),
        subplan.getPlan().getRelations(0).getRoot().getNamesList());
  }

  @Test
  void should_reject_anchor_at_plan_root() {
    SubstraitPlan original = SubstraitPlan.fromMessageProto(plan(join(read("A"), read("B"))));
    DecomposedPlan decomposed = splitter.splitPlan(original.toAnnotatedPlan());

    assertThrows(InvalidSubplanException.class, () -> original.toSubPlanMessage(decomposed, 0));
  }

  @Test
  void should_reject_subplan_index_out_of_range() {
    SubstraitPlan original =
        SubstraitPlan.fromMessageProto(plan(project(aggregate(join(read("A"), read("B"))))));
    DecomposedPlan decomposed = splitter.splitPlan(original.toAnnotatedPlan());

    assertThrows(InvalidSubplanException.class, () -> original.toSubPlanMessage(decomposed, 1));
    assertThrows(InvalidSubplanException.class, () -> original.toSubPlanMessage(decomposed, -1));
  }

  @Test
  void should_reject_decomposition_of_another_plan() {
    Plan plan = plan(project(aggregate(join(read("A"), read("B")))));
    SubstraitPlan original = SubstraitPlan.fromMessageProto(plan);
    SubstraitPlan other = SubstraitPlan.fromMessageProto(plan);
    DecomposedPlan decomposed = splitter.splitPlan(other.toAnnotatedPlan());

    assertThrows(InvalidSubplanException.class, () -> original.toSubPlanMessage(decomposed, 0));
  }

  @Test
  void should_copy_plan_into_new_builder() {
    SubstraitPlan original = SubstraitPlan.fromMessageProto(plan(read("A")));

    Plan.Builder copy = original.copyPlan();
    copy.clearRelations();

    assertEquals(1, original.getPlan().getRelationsCount());
    assertNotSame(original.getPlan(), copy.build());
  }
}
