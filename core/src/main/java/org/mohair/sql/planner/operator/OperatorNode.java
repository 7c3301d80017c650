/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.substrait.proto.ReadRel;
import io.substrait.proto.Rel;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * A single operator in a query plan. Wraps the operator's relation message and owns its inputs.
 *
 * <p>Nodes are created through {@link OperatorTree.Builder}, which assigns each node an id that
 * is unique within its tree. A node is immutable: its display name and, for partition reads, its
 * {@link SkyPartition} are derived once at construction.
 */
@Getter
public class OperatorNode {

  private final int id;
  private final OperatorKind kind;
  private final Rel payload;
  private final List<OperatorNode> inputs;
  private final SkyPartition partition;
  private final String displayName;

  OperatorNode(
      int id, OperatorKind kind, Rel payload, List<OperatorNode> inputs, SkyPartition partition) {
    this.id = id;
    this.kind = kind;
    this.payload = payload;
    this.inputs = ImmutableList.copyOf(inputs);
    this.partition = partition;
    this.displayName = deriveDisplayName();
  }

  public OperatorCategory getCategory() {
    return kind.getCategory();
  }

  public boolean isBreaker() {
    return kind.isBreaker();
  }

  public boolean isLeaf() {
    return inputs.isEmpty();
  }

  /** Returns this operator prefixed by its category marker, e.g. {@code ↤ Aggr(lineitem)}. */
  public String viewString() {
    return getCategory().getSymbol() + " " + this;
  }

  @Override
  public String toString() {
    return kind.getSymbol() + "(" + displayName + ")";
  }

  private String deriveDisplayName() {
    String name =
        switch (kind) {
          case READ -> readName();
          case EXTERNAL_PARTITION_READ -> partition == null ? null : partition.getName();
          case PROJECTION, SELECTION, LIMIT, SORT, AGGREGATION -> inputs.get(0).getDisplayName();
          case JOIN, HASH_JOIN, MERGE_JOIN, CROSS_JOIN, SET_OP, EXTENSION -> joinedInputNames();
        };
    return Strings.isNullOrEmpty(name) ? kind.getTag() : name;
  }

  private String readName() {
    if (payload == null || !payload.hasRead()) {
      return null;
    }

    ReadRel read = payload.getRead();
    if (read.hasNamedTable() && read.getNamedTable().getNamesCount() > 0) {
      return String.join("/", read.getNamedTable().getNamesList());
    }
    if (read.hasLocalFiles() && read.getLocalFiles().getItemsCount() > 0) {
      ReadRel.LocalFiles.FileOrFiles file = read.getLocalFiles().getItems(0);
      return file.getUriPath().isEmpty() ? file.getUriFile() : file.getUriPath();
    }
    if (read.getReadTypeCase().getNumber() != 0) {
      return read.getReadTypeCase().name().toLowerCase();
    }
    return null;
  }

  private String joinedInputNames() {
    return inputs.stream().map(OperatorNode::getDisplayName).collect(Collectors.joining(":"));
  }
}
