/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.planner.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.mohair.sql.protocol.mohair.ExecutionStats;
import org.mohair.sql.protocol.mohair.SkyRel;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SkyPartitionTest {

  @Test
  void should_name_partition_by_domain_and_partition_key() {
    SkyRel skyRel =
        SkyRel.newBuilder()
            .setDomain("e-commerce")
            .setPartition("orders-7")
            .addSlices(0)
            .addSlices(4)
            .setExecstats(ExecutionStats.newBuilder().setExecuted(true).setRowCount(42))
            .build();

    assertEquals("e-commerce/orders-7", SkyPartition.fromRel(skyRel).getName());
  }

  @Test
  void should_identify_partition_by_keys_only() {
    SkyRel slicesZero =
        SkyRel.newBuilder().setDomain("d").setPartition("p").addSlices(0).build();
    SkyRel slicesOne = slicesZero.toBuilder().clearSlices().addSlices(1).build();

    assertEquals(SkyPartition.fromRel(slicesZero), SkyPartition.fromRel(slicesOne));
    assertNotEquals(
        SkyPartition.fromRel(slicesZero),
        SkyPartition.fromRel(slicesZero.toBuilder().setPartition("q").build()));
  }
}
