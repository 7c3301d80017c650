/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.common.setting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link Settings} read from a flat JSON object, for example:
 *
 * <pre>
 * { "mohair.decomposition.split_strategy": "LONGEST_CHAIN" }
 * </pre>
 *
 * <p>Unknown keys are ignored and missing keys fall back to {@link Key#getDefaultValue()}. Every
 * known key takes a string value.
 */
public class JsonSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger();

  public static final String DEFAULT_RESOURCE = "mohair-settings.json";

  private final Map<Key, Object> values;

  /**
   * Creates settings from {@code values}.
   *
   * @throws IllegalArgumentException if a value is not a string
   */
  public JsonSettings(Map<Key, ?> values) {
    Map<Key, Object> copy = new EnumMap<>(Key.class);
    values.forEach((key, value) -> copy.put(key, checkValue(key, value)));
    this.values = Collections.unmodifiableMap(copy);
  }

  /** Settings with every key at its default value. */
  public static JsonSettings defaults() {
    return new JsonSettings(new EnumMap<>(Key.class));
  }

  /**
   * Converts inputstream of bytes into settings.
   *
   * @param inputStream inputstream.
   * @return settings.
   */
  public static JsonSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(inputStream, new TypeReference<>() {
      });
    } catch (IOException e) {
      LOG.error("Settings file is malformed. Verify its content.");
      throw new IllegalArgumentException("Malformed settings json: " + e.getMessage(), e);
    }

    Map<Key, Object> values = new EnumMap<>(Key.class);
    raw.forEach((name, value) -> Key.of(name).ifPresentOrElse(
        key -> values.put(key, value),
        () -> LOG.debug("Ignoring unknown setting: {}", name)));
    return new JsonSettings(values);
  }

  /**
   * Loads settings from a classpath resource, or defaults when the resource is absent.
   */
  public static JsonSettings fromClasspath(String resourceName) {
    InputStream inputStream = JsonSettings.class.getClassLoader().getResourceAsStream(resourceName);
    if (inputStream == null) {
      LOG.info("No {} on classpath, using default settings", resourceName);
      return defaults();
    }

    try (InputStream in = inputStream) {
      return fromInputStream(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to close settings resource " + resourceName, e);
    }
  }

  private static String checkValue(Key key, Object value) {
    if (!(value instanceof String)) {
      LOG.error("Setting {} has a non-string value: {}", key.getKeyValue(), value);
      throw new IllegalArgumentException(
          "Setting " + key.getKeyValue() + " must be a string but was " + value);
    }
    return (String) value;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.getOrDefault(key, key.getDefaultValue());
  }
}
