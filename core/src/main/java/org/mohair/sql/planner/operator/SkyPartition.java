/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.mohair.sql.protocol.mohair.SkyRel;

/**
 * A partition of a remote storage domain, as referenced by an external partition read. Slices and
 * execution statistics stay in the read's relation, which is forwarded unchanged.
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class SkyPartition {

  private final String domainKey;
  private final String partitionKey;

  public static SkyPartition fromRel(SkyRel skyRel) {
    return new SkyPartition(skyRel.getDomain(), skyRel.getPartition());
  }

  /** Returns {@code domain/partition}. */
  public String getName() {
    return domainKey + "/" + partitionKey;
  }
}
