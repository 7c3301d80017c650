/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.decomposer;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.mohair.sql.planner.decomposition.DecomposedPlan;
import org.mohair.sql.protocol.mohair.PlanAnchor;
import org.mohair.sql.substrait.SubstraitPlan;

/** Outcome of decomposing one query plan. */
@Getter
@ToString
@RequiredArgsConstructor
public class DecompositionResult {

  /** The plan that was decomposed. */
  private final SubstraitPlan source;

  private final DecomposedPlan decomposedPlan;

  /** The operator kept in the superplan, with its inputs cleared. */
  private final PlanAnchor planAnchor;

  /** One message per subplan, in the order of the anchor's inputs. */
  private final List<SubstraitPlan> subplans;
}
