/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.common.setting;

import com.google.common.base.Strings;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Setting.
 */
public abstract class Settings {
  @RequiredArgsConstructor
  public enum Key {

    /**
     * Decomposition Settings.
     */
    SPLIT_STRATEGY("mohair.decomposition.split_strategy", "LONGEST_CHAIN"),
    VIEW_INDENT("mohair.decomposition.view_indent", "  ");

    @Getter
    private final String keyValue;

    @Getter
    private final String defaultValue;

    public static Optional<Key> of(String keyValue) {
      String key = Strings.isNullOrEmpty(keyValue) ? "" : keyValue.toLowerCase();
      return Arrays.stream(values())
          .filter(v -> v.keyValue.equals(key))
          .findFirst();
    }
  }

  /**
   * Get Setting Value.
   */
  public abstract <T> T getSettingValue(Key key);
}
