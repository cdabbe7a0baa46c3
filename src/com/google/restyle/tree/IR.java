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

package com.google.restyle.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A tree construction helper class. Nodes built here carry {@link NodeMetadata#EMPTY}; use
 * {@link Node#withMetadata} to attach a source position.
 */
public class IR {

  private IR() {}

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    return composite(Kind.BLOCK, null, ImmutableList.copyOf(stmts));
  }

  public static Node call(Node target, Node... args) {
    return call(target, ImmutableList.copyOf(args));
  }

  public static Node call(Node target, List<Node> args) {
    return composite(
        Kind.CALL, null, ImmutableList.<Node>builder().add(target).addAll(args).build());
  }

  public static Node binaryOp(String operator, Node left, Node right) {
    checkArgument(!operator.isEmpty(), "empty operator");
    return composite(Kind.BINARY_OP, operator, ImmutableList.of(left, right));
  }

  public static Node list(Node... elements) {
    return collection(CollectionKind.LIST, ImmutableList.copyOf(elements));
  }

  public static Node tuple(Node... elements) {
    return collection(CollectionKind.TUPLE, ImmutableList.copyOf(elements));
  }

  /** A map literal; elements are expected to be key/value tuples. */
  public static Node map(Node... entries) {
    return collection(CollectionKind.MAP, ImmutableList.copyOf(entries));
  }

  public static Node collection(CollectionKind collectionKind, List<Node> elements) {
    return composite(Kind.COLLECTION, collectionKind, ImmutableList.copyOf(elements));
  }

  public static Node assign(Node pattern, Node value) {
    return composite(Kind.ASSIGNMENT, null, ImmutableList.of(pattern, value));
  }

  public static Node annotated(Node inner, Map<String, String> annotations) {
    return new Node(
        Kind.ANNOTATED,
        null,
        ImmutableList.of(inner),
        NodeMetadata.EMPTY,
        ImmutableMap.copyOf(annotations));
  }

  private static Node composite(Kind kind, @Nullable Object value, ImmutableList<Node> children) {
    return new Node(kind, value, children, NodeMetadata.EMPTY, ImmutableMap.of());
  }
}
