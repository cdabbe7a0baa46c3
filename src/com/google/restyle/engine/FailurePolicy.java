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

import com.google.common.base.Ascii;
import org.jspecify.annotations.Nullable;

/** What a pipeline does when a pass throws. */
public enum FailurePolicy {
  /**
   * Record a diagnostic, log the failure and go on with the tree as it was before the failing
   * pass.
   */
  LOG("log"),

  /** Abort the whole run with a {@link PassFailure}. */
  RAISE("raise");

  private final String configName;

  FailurePolicy(String configName) {
    this.configName = configName;
  }

  /** The name of the policy in configuration files. */
  public String getConfigName() {
    return configName;
  }

  public static @Nullable FailurePolicy forConfigName(String name) {
    String lower = Ascii.toLowerCase(name);
    for (FailurePolicy policy : values()) {
      if (policy.configName.equals(lower)) {
        return policy;
      }
    }
    return null;
  }
}
