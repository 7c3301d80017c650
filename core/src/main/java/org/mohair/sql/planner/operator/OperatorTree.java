/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import com.google.common.base.Preconditions;
import io.substrait.proto.Rel;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import org.mohair.sql.exception.MalformedPlanException;

/**
 * Owns every {@link OperatorNode} of one plan, indexed by node id, and designates the root.
 *
 * <p>Ids are assigned in creation order. Since inputs must exist before the operator that
 * consumes them, a tree built bottom-up is numbered in post-order and the root has the largest
 * id. Work that derives new messages from a node (for example clearing its inputs) looks the node
 * up here by id and copies its payload, never touching the node held by the tree.
 */
public class OperatorTree {

  private final List<OperatorNode> nodes;
  private final OperatorNode root;

  private OperatorTree(List<OperatorNode> nodes, OperatorNode root) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.root = root;
  }

  public static Builder builder() {
    return new Builder();
  }

  public OperatorNode getRoot() {
    return root;
  }

  /** Returns the node with the given id. */
  public OperatorNode getNode(int id) {
    Preconditions.checkElementIndex(id, nodes.size(), "operator id");
    return nodes.get(id);
  }

  /** Returns all nodes in id order. */
  public List<OperatorNode> getNodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  /** Returns true if {@code node} is this tree's node and it is the root. */
  public boolean isRoot(OperatorNode node) {
    return node != null && node == root;
  }

  /** Returns true if {@code node} is owned by this tree. */
  public boolean contains(OperatorNode node) {
    return node != null
        && node.getId() >= 0
        && node.getId() < nodes.size()
        && nodes.get(node.getId()) == node;
  }

  @Override
  public String toString() {
    return "OperatorTree{root=" + root + ", size=" + nodes.size() + '}';
  }

  /**
   * Creates nodes bottom-up. Every input handed to {@link #add} must have been created by this
   * builder and may be consumed by only one parent, so the result is always a tree.
   */
  public static class Builder {

    private final List<OperatorNode> nodes = new ArrayList<>();
    private final BitSet consumed = new BitSet();

    public OperatorNode add(OperatorKind kind, Rel payload, List<OperatorNode> inputs) {
      Preconditions.checkArgument(
          kind != OperatorKind.EXTERNAL_PARTITION_READ,
          "external partition reads are created with addPartitionRead");
      return create(kind, payload, inputs, null);
    }

    public OperatorNode addPartitionRead(Rel payload, SkyPartition partition) {
      Preconditions.checkNotNull(partition, "partition");
      return create(OperatorKind.EXTERNAL_PARTITION_READ, payload, List.of(), partition);
    }

    public OperatorTree build(OperatorNode root) {
      Preconditions.checkArgument(owns(root), "root %s was not created by this builder", root);
      if (consumed.get(root.getId())) {
        throw new MalformedPlanException("Root " + root + " is an input of another operator");
      }
      return new OperatorTree(new ArrayList<>(nodes), root);
    }

    private OperatorNode create(
        OperatorKind kind, Rel payload, List<OperatorNode> inputs, SkyPartition partition) {
      Preconditions.checkNotNull(kind, "kind");
      if (!kind.acceptsInputCount(inputs.size())) {
        throw new MalformedPlanException(
            kind.getTag() + " cannot have " + inputs.size() + " input(s)");
      }

      for (OperatorNode input : inputs) {
        Preconditions.checkArgument(owns(input), "input %s was not created by this builder", input);
        if (consumed.get(input.getId())) {
          throw new MalformedPlanException("Operator " + input + " is shared by two parents");
        }
        consumed.set(input.getId());
      }

      OperatorNode node = new OperatorNode(nodes.size(), kind, payload, inputs, partition);
      nodes.add(node);
      return node;
    }

    private boolean owns(OperatorNode node) {
      return node != null
          && node.getId() < nodes.size()
          && nodes.get(node.getId()) == node;
    }
  }
}
