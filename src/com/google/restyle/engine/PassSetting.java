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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/** One entry of the configured pass list: a pass name and the path prefixes it ignores. */
@AutoValue
public abstract class PassSetting {

  public abstract String getName();

  public abstract ImmutableSet<String> getIgnorePrefixes();

  public static PassSetting create(String name) {
    return create(name, ImmutableSet.of());
  }

  public static PassSetting create(String name, Iterable<String> ignorePrefixes) {
    return new AutoValue_PassSetting(name, ImmutableSet.copyOf(ignorePrefixes));
  }
}
