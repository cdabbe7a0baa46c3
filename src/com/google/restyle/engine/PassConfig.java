/*
 * Copyright 2026 The Restyle Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.restyle.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The registry of known passes. Maps pass names to factories and turns a configured pass list into
 * the factories a {@link StylePipeline} runs.
 */
public class PassConfig {

  private final ImmutableMap<String, PassFactory> passesByName;

  /**
   * @param passes The known passes in their default order.
   * @throws IllegalArgumentException if two passes share a name
   */
  public PassConfig(List<PassFactory> passes) {
    Map<String, PassFactory> byName = new LinkedHashMap<>();
    for (PassFactory pass : passes) {
      PassFactory previous = byName.put(pass.getName(), pass);
      checkArgument(previous == null, "duplicate pass name %s", pass.getName());
    }
    this.passesByName = ImmutableMap.copyOf(byName);
  }

  /** Returns every known pass in the default order. */
  public final ImmutableList<PassFactory> getDefaultPasses() {
    return passesByName.values().asList();
  }

  public final @Nullable PassFactory getPass(String name) {
    return passesByName.get(name);
  }

  /** Returns a registry with every pass of this one plus {@code pass}, last in default order. */
  public final PassConfig plus(PassFactory pass) {
    return new PassConfig(
        ImmutableList.<PassFactory>builder().addAll(getDefaultPasses()).add(pass).build());
  }

  /**
   * Resolves configured settings to factories, in the configured order.
   *
   * @param settings The configured passes, or null to run every known pass in the default order.
   *     An empty list runs no pass at all.
   * @throws ConfigError if a setting names an unknown pass or names a pass twice
   */
  public final ImmutableList<PassFactory> resolve(@Nullable List<PassSetting> settings) {
    if (settings == null) {
      return getDefaultPasses();
    }
    ImmutableList.Builder<PassFactory> result = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    for (PassSetting setting : settings) {
      PassFactory factory = passesByName.get(setting.getName());
      if (factory == null) {
        throw new ConfigError(
            "Unknown pass \"" + setting.getName() + "\". Known passes: " + passesByName.keySet());
      }
      if (!seen.add(setting.getName())) {
        throw new ConfigError("Pass \"" + setting.getName() + "\" is configured more than once");
      }
      result.add(
          setting.getIgnorePrefixes().isEmpty()
              ? factory
              : factory.withIgnorePrefixes(setting.getIgnorePrefixes()));
    }
    return result.build();
  }
}
