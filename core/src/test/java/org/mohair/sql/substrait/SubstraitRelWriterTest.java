/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mohair.sql.utils.RelFixtures.aggregate;
import static org.mohair.sql.utils.RelFixtures.join;
import static org.mohair.sql.utils.RelFixtures.read;

import io.substrait.proto.Rel;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.mohair.sql.exception.PlanSerializationException;
import org.mohair.sql.planner.operator.OperatorKind;
import org.mohair.sql.planner.operator.OperatorNode;
import org.mohair.sql.planner.operator.OperatorTree;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubstraitRelWriterTest {

  private final SubstraitRelWriter writer = new SubstraitRelWriter();

  @Test
  void should_write_translated_relation() {
    Rel rel = aggregate(join(read("A"), read("B")));
    OperatorTree tree = new SubstraitTranslator().translate(rel);

    assertSame(rel, writer.toRel(tree.getRoot()));
    assertArrayEquals(rel.toByteArray(), writer.toBytes(tree.getRoot()));
  }

  @Test
  void should_reject_operator_without_relation() {
    OperatorNode node = OperatorTree.builder().add(OperatorKind.READ, null, List.of());

    assertThrows(PlanSerializationException.class, () -> writer.toRel(node));
  }

  @Test
  void should_reject_relation_of_another_kind() {
    OperatorNode node =
        OperatorTree.builder().add(OperatorKind.READ, aggregate(read("A")), List.of());

    assertThrows(PlanSerializationException.class, () -> writer.toRel(node));
  }
}
