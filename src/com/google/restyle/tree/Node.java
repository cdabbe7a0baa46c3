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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the immutable syntax tree the styling passes operate on.
 *
 * <p>A node never changes after construction. Every "edit" builds a new node, and unchanged
 * subtrees are shared between the old and the new tree. Nodes hold no reference to their parent;
 * parent and sibling context is derived on demand by a cursor walking the tree.
 *
 * <p>Use {@link IR} to build composite nodes.
 */
public final class Node {

  private final Kind kind;
  // The literal of a LEAF, the name of an IDENTIFIER, the operator of a BINARY_OP and the
  // CollectionKind of a COLLECTION. Null for the other kinds and for the nil literal.
  private final @Nullable Object value;
  private final ImmutableList<Node> children;
  private final NodeMetadata metadata;
  private final ImmutableMap<String, String> annotations;

  // Lazily computed, nodes are immutable.
  private int hash;

  Node(
      Kind kind,
      @Nullable Object value,
      ImmutableList<Node> children,
      NodeMetadata metadata,
      ImmutableMap<String, String> annotations) {
    checkArgument(
        kind.acceptsChildCount(children.size()),
        "%s node cannot have %s children",
        kind,
        children.size());
    checkArgument(
        annotations.isEmpty() || kind == Kind.ANNOTATED, "only ANNOTATED nodes carry annotations");
    this.kind = kind;
    this.value = value;
    this.children = children;
    this.metadata = checkNotNull(metadata);
    this.annotations = annotations;
  }

  /**
   * Creates a literal. Integral numbers are widened to {@code long}; strings, booleans, doubles and
   * {@code null} are kept as they are.
   */
  public static Node newLeaf(@Nullable Object literal) {
    return newLeaf(literal, NodeMetadata.EMPTY);
  }

  public static Node newLeaf(@Nullable Object literal, NodeMetadata metadata) {
    return new Node(
        Kind.LEAF, normalizeLiteral(literal), ImmutableList.of(), metadata, ImmutableMap.of());
  }

  public static Node newIdentifier(String name) {
    return newIdentifier(name, NodeMetadata.EMPTY);
  }

  public static Node newIdentifier(String name, NodeMetadata metadata) {
    checkArgument(!name.isEmpty(), "empty identifier");
    return new Node(Kind.IDENTIFIER, name, ImmutableList.of(), metadata, ImmutableMap.of());
  }

  private static @Nullable Object normalizeLiteral(@Nullable Object literal) {
    if (literal instanceof Integer || literal instanceof Short || literal instanceof Byte) {
      return ((Number) literal).longValue();
    }
    checkArgument(
        literal == null
            || literal instanceof Long
            || literal instanceof Double
            || literal instanceof String
            || literal instanceof Boolean,
        "unsupported literal %s",
        literal);
    return literal;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isLeaf() {
    return kind == Kind.LEAF;
  }

  public boolean isIdentifier() {
    return kind == Kind.IDENTIFIER;
  }

  public boolean isCall() {
    return kind == Kind.CALL;
  }

  public boolean isBlock() {
    return kind == Kind.BLOCK;
  }

  public boolean isBinaryOp() {
    return kind == Kind.BINARY_OP;
  }

  public boolean isCollection() {
    return kind == Kind.COLLECTION;
  }

  public boolean isAssignment() {
    return kind == Kind.ASSIGNMENT;
  }

  public boolean isAnnotated() {
    return kind == Kind.ANNOTATED;
  }

  /** Returns the literal of a LEAF node, which may be null. */
  public @Nullable Object getLiteral() {
    checkState(isLeaf(), "not a leaf: %s", this);
    return value;
  }

  /** Whether this is a LEAF holding a {@code long}. */
  public boolean isIntegerLiteral() {
    return isLeaf() && value instanceof Long;
  }

  public long getLong() {
    checkState(isIntegerLiteral(), "not an integer literal: %s", this);
    return (Long) value;
  }

  /** Returns the name of an IDENTIFIER or the operator of a BINARY_OP. */
  public String getString() {
    checkState(isIdentifier() || isBinaryOp(), "%s has no string", kind);
    return (String) value;
  }

  public CollectionKind getCollectionKind() {
    checkState(isCollection(), "not a collection: %s", this);
    return (CollectionKind) value;
  }

  /** Returns the annotations of an ANNOTATED node; empty for all other kinds. */
  public ImmutableMap<String, String> getAnnotations() {
    return annotations;
  }

  public ImmutableList<Node> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public Node getCallTarget() {
    checkState(isCall(), "not a call: %s", this);
    return children.get(0);
  }

  public ImmutableList<Node> getCallArguments() {
    checkState(isCall(), "not a call: %s", this);
    return children.subList(1, children.size());
  }

  public Node getLeft() {
    checkState(isBinaryOp(), "not a binary op: %s", this);
    return children.get(0);
  }

  public Node getRight() {
    checkState(isBinaryOp(), "not a binary op: %s", this);
    return children.get(1);
  }

  public Node getPattern() {
    checkState(isAssignment(), "not an assignment: %s", this);
    return children.get(0);
  }

  public Node getAssignedValue() {
    checkState(isAssignment(), "not an assignment: %s", this);
    return children.get(1);
  }

  public Node getInner() {
    checkState(isAnnotated(), "not annotated: %s", this);
    return children.get(0);
  }

  public NodeMetadata getMetadata() {
    return metadata;
  }

  public int getLineno() {
    return metadata.getLineno();
  }

  /**
   * Rebuilds this node around a new child list, keeping its kind, value, metadata and annotations.
   * This is how a cursor reconstructs a parent after one of its children was edited.
   *
   * @throws IllegalArgumentException if the kind does not allow that many children
   * @return this node if every child is the same instance as before
   */
  @CheckReturnValue
  public Node withChildren(List<Node> newChildren) {
    if (newChildren.size() == children.size()) {
      boolean same = true;
      for (int i = 0; i < newChildren.size(); i++) {
        if (newChildren.get(i) != children.get(i)) {
          same = false;
          break;
        }
      }
      if (same) {
        return this;
      }
    }
    return new Node(kind, value, ImmutableList.copyOf(newChildren), metadata, annotations);
  }

  @CheckReturnValue
  public Node withMetadata(NodeMetadata newMetadata) {
    if (newMetadata.equals(metadata)) {
      return this;
    }
    return new Node(kind, value, children, newMetadata, annotations);
  }

  /** Returns a LEAF with the same metadata holding another literal. */
  @CheckReturnValue
  public Node withLiteral(@Nullable Object literal) {
    checkState(isLeaf(), "not a leaf: %s", this);
    return newLeaf(literal, metadata);
  }

  /** Returns an ANNOTATED node with the same inner node and the given annotations. */
  @CheckReturnValue
  public Node withAnnotations(Map<String, String> newAnnotations) {
    checkState(isAnnotated(), "not annotated: %s", this);
    return new Node(kind, value, children, metadata, ImmutableMap.copyOf(newAnnotations));
  }

  /**
   * Structural equality: same kind, value, annotations and metadata, with equal children in the
   * same order.
   */
  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    Node that = (Node) o;
    return hashCode() == that.hashCode()
        && kind == that.kind
        && Objects.equals(value, that.value)
        && metadata.equals(that.metadata)
        && annotations.equals(that.annotations)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      h = Objects.hash(kind, value, metadata, annotations, children);
      hash = h;
    }
    return h;
  }

  /** Like {@link #equals} but ignores metadata, so trees from different sources can be compared. */
  public boolean isEquivalentTo(Node node) {
    if (kind != node.kind
        || children.size() != node.children.size()
        || !Objects.equals(value, node.value)
        || !annotations.equals(node.annotations)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(node.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind);
    if (value != null) {
      sb.append(' ');
      if (value instanceof String && isLeaf()) {
        sb.append('"').append(value).append('"');
      } else {
        sb.append(value);
      }
    } else if (isLeaf()) {
      sb.append(" nil");
    }
    if (!annotations.isEmpty()) {
      sb.append(' ').append(annotations);
    }
    if (metadata.hasLineno()) {
      sb.append(" @").append(metadata.getLineno());
    }
    return sb.toString();
  }

  @CheckReturnValue
  public String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node child : n.children) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
