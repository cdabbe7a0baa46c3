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
import com.google.restyle.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * What a {@link StylePass} tells the traversal after visiting a node: an optional replacement for
 * the node, an optional new context, and how to go on.
 */
@AutoValue
public abstract class Signal {

  /** How the traversal continues after the visited node. */
  public enum Action {
    /** Visit the node's children next, then its following siblings. */
    CONTINUE,
    /** Do not visit the node's children; go on with its following siblings. */
    SKIP,
    /** Stop this pass. Nodes not visited yet are left as they are. */
    HALT
  }

  public abstract Action getAction();

  /** The node to put in place of the visited node, or null to keep it. */
  public abstract @Nullable Node getReplacement();

  /** The context for the rest of the pass, or null to keep the current one. */
  public abstract @Nullable StyleContext getContext();

  private static Signal create(
      Action action, @Nullable Node replacement, @Nullable StyleContext context) {
    return new AutoValue_Signal(action, replacement, context);
  }

  private static final Signal PROCEED = create(Action.CONTINUE, null, null);
  private static final Signal SKIP = create(Action.SKIP, null, null);
  private static final Signal HALT = create(Action.HALT, null, null);

  public static Signal proceed() {
    return PROCEED;
  }

  public static Signal proceed(Node replacement) {
    return create(Action.CONTINUE, replacement, null);
  }

  public static Signal proceed(@Nullable Node replacement, StyleContext context) {
    return create(Action.CONTINUE, replacement, context);
  }

  public static Signal skip() {
    return SKIP;
  }

  public static Signal skip(Node replacement) {
    return create(Action.SKIP, replacement, null);
  }

  public static Signal skip(@Nullable Node replacement, StyleContext context) {
    return create(Action.SKIP, replacement, context);
  }

  public static Signal halt() {
    return HALT;
  }

  public static Signal halt(StyleContext context) {
    return create(Action.HALT, null, context);
  }

  /** Halts after putting {@code replacement} in place of the visited node. */
  public static Signal halt(Node replacement) {
    return create(Action.HALT, replacement, null);
  }

  public static Signal halt(@Nullable Node replacement, StyleContext context) {
    return create(Action.HALT, replacement, context);
  }
}
