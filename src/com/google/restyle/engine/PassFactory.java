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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Supplier;

/**
 * A factory for creating styling passes, together with the pass's name and the files it must not
 * touch.
 *
 * <p>A fresh pass is created for every file, so passes may keep per-file state in fields.
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it appears in configuration and logs. */
  public abstract String getName();

  /**
   * Path prefixes of files the pass is not run on, relative to the working directory or absolute.
   * Empty if the pass runs on every file.
   */
  public abstract ImmutableSet<String> getIgnorePrefixes();

  /**
   * A simple factory function for creating actual pass instances.
   *
   * <p>Users should call {@link #create()} rather than use this object directly.
   */
  abstract Supplier<? extends StylePass> getInternalFactory();

  public abstract Builder toBuilder();

  PassFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setIgnorePrefixes(Iterable<String> x);

    public abstract Builder setInternalFactory(Supplier<? extends StylePass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder().setIgnorePrefixes(ImmutableSet.of());
  }

  /** Creates a factory that hands out the same, stateless, pass for every file. */
  public static PassFactory of(String name, StylePass pass) {
    return builder().setName(name).setInternalFactory(() -> pass).build();
  }

  /** Returns a copy of this factory that skips files under any of {@code prefixes}. */
  public final PassFactory withIgnorePrefixes(Iterable<String> prefixes) {
    return toBuilder().setIgnorePrefixes(prefixes).build();
  }

  /** Creates a new pass to be run. */
  final StylePass create() {
    return getInternalFactory().get();
  }
}
