/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.substrait;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import io.substrait.proto.ExtensionLeafRel;
import io.substrait.proto.Rel;
import io.substrait.proto.RelCommon;
import lombok.experimental.UtilityClass;
import org.mohair.sql.exception.MalformedPlanException;
import org.mohair.sql.exception.PlanDecodeException;
import org.mohair.sql.protocol.mohair.SkyRel;

/** Carries a {@link SkyRel} partition read in the {@code detail} of an extension leaf. */
@UtilityClass
public class SkyRelExtension {

  /** Wraps {@code skyRel} in an extension leaf relation with direct output. */
  public static Rel toRel(SkyRel skyRel) {
    ExtensionLeafRel leaf =
        ExtensionLeafRel.newBuilder()
            .setCommon(RelCommon.newBuilder().setDirect(RelCommon.Direct.getDefaultInstance()))
            .setDetail(Any.pack(skyRel))
            .build();
    return Rel.newBuilder().setExtensionLeaf(leaf).build();
  }

  public static boolean isSkyRel(ExtensionLeafRel leaf) {
    return leaf.hasDetail() && leaf.getDetail().is(SkyRel.class);
  }

  /** Unpacks the partition read carried by {@code leaf}. */
  public static SkyRel fromRel(ExtensionLeafRel leaf) {
    if (!leaf.hasDetail()) {
      throw new MalformedPlanException("Extension leaf has no detail");
    }

    Any detail = leaf.getDetail();
    if (!detail.is(SkyRel.class)) {
      throw new MalformedPlanException(
          "Unsupported extension leaf detail: " + detail.getTypeUrl());
    }

    try {
      return detail.unpack(SkyRel.class);
    } catch (InvalidProtocolBufferException e) {
      throw new PlanDecodeException("Unable to decode SkyRel extension detail", e);
    }
  }
}
