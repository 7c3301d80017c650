/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.config;

import org.mohair.sql.common.setting.JsonSettings;
import org.mohair.sql.common.setting.Settings;
import org.mohair.sql.decomposer.QueryDecomposer;
import org.mohair.sql.planner.decomposition.PlanSplitter;
import org.mohair.sql.planner.decomposition.PlanViewer;
import org.mohair.sql.planner.decomposition.PlanWalker;
import org.mohair.sql.planner.decomposition.SplitStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecompositionConfig {

  /**
   * Settings Bean, read from {@code mohair-settings.json} on the classpath.
   *
   * @return Settings.
   */
  @Bean
  public Settings settings() {
    return JsonSettings.fromClasspath(JsonSettings.DEFAULT_RESOURCE);
  }

  @Bean
  public PlanWalker planWalker() {
    return new PlanWalker();
  }

  /**
   * PlanSplitter Bean. Its default strategy comes from the split strategy setting.
   *
   * @return PlanSplitter.
   */
  @Bean
  public PlanSplitter planSplitter(Settings settings) {
    String name = settings.getSettingValue(Settings.Key.SPLIT_STRATEGY);
    SplitStrategy strategy =
        SplitStrategy.of(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown split strategy: " + name));
    return new PlanSplitter(strategy);
  }

  @Bean
  public PlanViewer planViewer(Settings settings) {
    String indent = settings.getSettingValue(Settings.Key.VIEW_INDENT);
    return new PlanViewer(indent);
  }

  @Bean
  public QueryDecomposer queryDecomposer(
      PlanWalker planWalker, PlanSplitter planSplitter, PlanViewer planViewer) {
    return new QueryDecomposer(planWalker, planSplitter, planViewer);
  }
}
