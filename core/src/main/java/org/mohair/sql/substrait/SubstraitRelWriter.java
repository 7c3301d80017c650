/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import io.substrait.proto.Rel.RelTypeCase;
import io.substrait.proto.Rel;
import org.mohair.sql.exception.PlanSerializationException;
import org.mohair.sql.planner.operator.OperatorKind;
import org.mohair.sql.planner.operator.OperatorNode;

/** Serializes operators back into relation messages. */
public class SubstraitRelWriter {

  /**
   * Returns the relation message of {@code node}, including its whole input subtree.
   *
   * @throws PlanSerializationException if the node carries no relation or one that does not
   *     match its kind
   */
  public Rel toRel(OperatorNode node) {
    Rel payload = node.getPayload();
    if (payload == null) {
      throw new PlanSerializationException("Operator " + node + " has no relation to serialize");
    }
    if (!matches(node.getKind(), payload)) {
      throw new PlanSerializationException(
          "Operator "
              + node
              + " of kind "
              + node.getKind()
              + " carries a "
              + payload.getRelTypeCase()
              + " relation");
    }
    return payload;
  }

  public byte[] toBytes(OperatorNode node) {
    return toRel(node).toByteArray();
  }

  private boolean matches(OperatorKind kind, Rel rel) {
    RelTypeCase relType = rel.getRelTypeCase();
    return switch (kind) {
      case PROJECTION -> relType == RelTypeCase.PROJECT;
      case SELECTION -> relType == RelTypeCase.FILTER;
      case LIMIT -> relType == RelTypeCase.FETCH;
      case SORT -> relType == RelTypeCase.SORT;
      case READ -> relType == RelTypeCase.READ;
      case EXTERNAL_PARTITION_READ -> relType == RelTypeCase.EXTENSION_LEAF
          && SkyRelExtension.isSkyRel(rel.getExtensionLeaf());
      case AGGREGATION -> relType == RelTypeCase.AGGREGATE;
      case JOIN -> relType == RelTypeCase.JOIN;
      case HASH_JOIN -> relType == RelTypeCase.HASH_JOIN;
      case MERGE_JOIN -> relType == RelTypeCase.MERGE_JOIN;
      case CROSS_JOIN -> relType == RelTypeCase.CROSS;
      case SET_OP -> relType == RelTypeCase.SET;
      case EXTENSION -> relType == RelTypeCase.EXTENSION_SINGLE
          || relType == RelTypeCase.EXTENSION_MULTI;
    };
  }
}
