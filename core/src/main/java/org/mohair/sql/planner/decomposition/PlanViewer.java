/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.decomposition;

import java.util.stream.Collectors;
import lombok.Getter;
import org.mohair.sql.planner.operator.OperatorNode;

/**
 * Renders an operator tree as text. Pipeline operators continue the current line; each breaker
 * starts a new line indented one level deeper than its parent.
 *
 * <pre>
 *   ← Π(A:B)
 *   ↤ Aggr(A:B)
 *     ↤ ⋈(A:B)  ← Read(A)  ← Read(B)
 * </pre>
 */
public class PlanViewer {

  public static final String DEFAULT_INDENT = "  ";

  @Getter private final String indentUnit;

  public PlanViewer() {
    this(DEFAULT_INDENT);
  }

  public PlanViewer(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  public String view(AnnotatedPlan plan) {
    return view(plan, "");
  }

  public String view(AnnotatedPlan plan, String indent) {
    return viewOp(plan.getPlanRoot(), indent);
  }

  public String viewOp(OperatorNode op, String indent) {
    String prefix = op.isBreaker() ? "\n" + indent : indentUnit;
    StringBuilder view = new StringBuilder(prefix).append(op.viewString());
    for (OperatorNode input : op.getInputs()) {
      view.append(viewOp(input, indent + indentUnit));
    }
    return view.toString();
  }

  /** Lists the bottom-most breakers of {@code plan}, one per line. */
  public String viewBreakers(AnnotatedPlan plan, String indent) {
    return plan.getBreakerLeaves().stream()
        .map(leaf -> indent + leaf.getPlanRoot().viewString() + " " + leaf.getStats())
        .collect(Collectors.joining("\n"));
  }
}
