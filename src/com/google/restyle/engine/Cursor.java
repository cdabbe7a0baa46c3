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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.restyle.tree.Node;
import java.util.function.Function;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * A zipper over an immutable {@link Node} tree: a focused node plus the trail of parents and
 * siblings that leads back to the root.
 *
 * <p>Cursors are values. Every navigation or edit returns a new cursor and leaves the receiver
 * usable, so a cursor can be kept as a bookmark and resumed later. Navigation methods return {@code
 * null} when the move is not possible.
 *
 * <p>Edits are cheap: {@link #replace} only swaps the focus. The parent is rebuilt when the cursor
 * moves {@link #up}, once per level actually climbed. Levels below which nothing was edited are
 * not rebuilt at all, so {@code Cursor.enter(tree).root()} returns {@code tree} itself.
 */
@CheckReturnValue
public final class Cursor {

  private final Node focus;
  private final @Nullable Crumb crumb;
  // Whether the focus or any sibling at this level differs from the children of crumb.parent.
  private final boolean changed;

  /**
   * One level of the trail: the parent as it was when the cursor descended into it, the siblings
   * to the left of the focus (nearest first) and those to its right.
   */
  private static final class Crumb {
    final Node parent;
    final @Nullable Siblings lefts;
    final @Nullable Siblings rights;
    final @Nullable Crumb up;
    final boolean parentChanged;
    final int index;
    final int depth;

    Crumb(
        Node parent,
        @Nullable Siblings lefts,
        @Nullable Siblings rights,
        @Nullable Crumb up,
        boolean parentChanged,
        int index) {
      this.parent = parent;
      this.lefts = lefts;
      this.rights = rights;
      this.up = up;
      this.parentChanged = parentChanged;
      this.index = index;
      this.depth = up == null ? 1 : up.depth + 1;
    }

    Crumb withSiblings(@Nullable Siblings newLefts, @Nullable Siblings newRights, int newIndex) {
      return new Crumb(parent, newLefts, newRights, up, parentChanged, newIndex);
    }
  }

  /** A persistent singly linked list, so moving sideways never copies the sibling lists. */
  private static final class Siblings {
    final Node head;
    final @Nullable Siblings tail;

    Siblings(Node head, @Nullable Siblings tail) {
      this.head = head;
      this.tail = tail;
    }
  }

  private Cursor(Node focus, @Nullable Crumb crumb, boolean changed) {
    this.focus = focus;
    this.crumb = crumb;
    this.changed = changed;
  }

  /** Returns a cursor focused on the root of {@code tree}. */
  public static Cursor enter(Node tree) {
    return new Cursor(checkNotNull(tree), null, false);
  }

  public Node getNode() {
    return focus;
  }

  public boolean isRoot() {
    return crumb == null;
  }

  /** The number of ancestors of the focus. The root has depth 0. */
  public int getDepth() {
    return crumb == null ? 0 : crumb.depth;
  }

  /** The position of the focus among its siblings, counting edits made at this level. */
  public int getIndex() {
    return crumb == null ? 0 : crumb.index;
  }

  /**
   * Returns the parent as it was when this cursor moved into it, or null at the root. Edits made
   * at this level are not reflected; call {@link #up} to see them.
   */
  public @Nullable Node getParent() {
    return crumb == null ? null : crumb.parent;
  }

  public boolean hasRightSibling() {
    return crumb != null && crumb.rights != null;
  }

  public boolean hasLeftSibling() {
    return crumb != null && crumb.lefts != null;
  }

  /** Whether anything at the focus level was edited since the cursor moved down into it. */
  public boolean isChanged() {
    return changed;
  }

  /** Moves to the first child, or returns null if the focus has no children. */
  public @Nullable Cursor down() {
    ImmutableList<Node> children = focus.getChildren();
    if (children.isEmpty()) {
      return null;
    }
    Siblings rights = null;
    for (int i = children.size() - 1; i > 0; i--) {
      rights = new Siblings(children.get(i), rights);
    }
    return new Cursor(children.get(0), new Crumb(focus, null, rights, crumb, changed, 0), false);
  }

  /** Moves to the next sibling, or returns null at the last sibling and at the root. */
  public @Nullable Cursor right() {
    if (crumb == null || crumb.rights == null) {
      return null;
    }
    return new Cursor(
        crumb.rights.head,
        crumb.withSiblings(new Siblings(focus, crumb.lefts), crumb.rights.tail, crumb.index + 1),
        changed);
  }

  /** Moves to the previous sibling, or returns null at the first sibling and at the root. */
  public @Nullable Cursor left() {
    if (crumb == null || crumb.lefts == null) {
      return null;
    }
    return new Cursor(
        crumb.lefts.head,
        crumb.withSiblings(crumb.lefts.tail, new Siblings(focus, crumb.rights), crumb.index - 1),
        changed);
  }

  public Cursor leftmost() {
    Cursor c = this;
    for (Cursor l = c.left(); l != null; l = c.left()) {
      c = l;
    }
    return c;
  }

  public Cursor rightmost() {
    Cursor c = this;
    for (Cursor r = c.right(); r != null; r = c.right()) {
      c = r;
    }
    return c;
  }

  /**
   * Moves to the parent, rebuilding it from the current focus and siblings if anything at this
   * level was edited. Returns null at the root.
   *
   * @throws IllegalArgumentException if the edits left the parent with a number of children its
   *     kind does not allow
   */
  public @Nullable Cursor up() {
    if (crumb == null) {
      return null;
    }
    Node parent = changed ? crumb.parent.withChildren(currentSiblings()) : crumb.parent;
    return new Cursor(parent, crumb.up, changed || crumb.parentChanged);
  }

  /** Returns a cursor focused on the root of the (possibly edited) tree. */
  public Cursor top() {
    Cursor c = this;
    for (Cursor u = c.up(); u != null; u = c.up()) {
      c = u;
    }
    return c;
  }

  /** Rebuilds and returns the whole tree, including every edit made through this cursor. */
  public Node root() {
    return top().getNode();
  }

  /** Replaces the focus. The trail is untouched until the cursor moves up. */
  public Cursor replace(Node node) {
    checkNotNull(node);
    if (node == focus) {
      return this;
    }
    return new Cursor(node, crumb, true);
  }

  public Cursor update(Function<Node, Node> fn) {
    return replace(fn.apply(focus));
  }

  /** Inserts a sibling directly to the left of the focus. The focus does not move. */
  public Cursor insertLeft(Node node) {
    checkState(crumb != null, "cannot insert a sibling of the root");
    return new Cursor(
        focus,
        crumb.withSiblings(
            new Siblings(checkNotNull(node), crumb.lefts), crumb.rights, crumb.index + 1),
        true);
  }

  /** Inserts a sibling directly to the right of the focus. The focus does not move. */
  public Cursor insertRight(Node node) {
    checkState(crumb != null, "cannot insert a sibling of the root");
    return new Cursor(
        focus,
        crumb.withSiblings(
            crumb.lefts, new Siblings(checkNotNull(node), crumb.rights), crumb.index),
        true);
  }

  /** Adds {@code node} as the first child of the focus. */
  public Cursor insertChild(Node node) {
    checkState(focus.getKind().hasVariableArity(), "cannot add children to %s", focus);
    return replace(
        focus.withChildren(
            ImmutableList.<Node>builder().add(node).addAll(focus.getChildren()).build()));
  }

  /** Adds {@code node} as the last child of the focus. */
  public Cursor appendChild(Node node) {
    checkState(focus.getKind().hasVariableArity(), "cannot add children to %s", focus);
    return replace(
        focus.withChildren(
            ImmutableList.<Node>builder().addAll(focus.getChildren()).add(node).build()));
  }

  /**
   * Removes the focus and moves to the node that precedes it in pre-order: the deepest last
   * descendant of the left sibling, or the parent when there is no left sibling.
   */
  public Cursor remove() {
    checkState(crumb != null, "cannot remove the root");
    if (crumb.lefts != null) {
      Cursor c =
          new Cursor(
              crumb.lefts.head,
              crumb.withSiblings(crumb.lefts.tail, crumb.rights, crumb.index - 1),
              true);
      return c.lastDescendant();
    }
    ImmutableList.Builder<Node> remaining = ImmutableList.builder();
    for (Siblings s = crumb.rights; s != null; s = s.tail) {
      remaining.add(s.head);
    }
    return new Cursor(crumb.parent.withChildren(remaining.build()), crumb.up, true);
  }

  /**
   * Moves to the next node in pre-order: the first child, else the next sibling, else the next
   * sibling of the nearest ancestor that has one. Returns null when the walk is complete.
   */
  public @Nullable Cursor next() {
    Cursor down = down();
    return down != null ? down : skip();
  }

  /** Like {@link #next} but does not enter the focus's children. */
  public @Nullable Cursor skip() {
    Cursor c = this;
    while (true) {
      Cursor right = c.right();
      if (right != null) {
        return right;
      }
      c = c.up();
      if (c == null) {
        return null;
      }
    }
  }

  /** Moves to the previous node in pre-order, or returns null at the root. */
  public @Nullable Cursor prev() {
    Cursor left = left();
    if (left == null) {
      return up();
    }
    return left.lastDescendant();
  }

  private Cursor lastDescendant() {
    Cursor c = this;
    for (Cursor d = c.down(); d != null; d = c.down()) {
      c = d.rightmost();
    }
    return c;
  }

  /**
   * Searches forward in pre-order, starting with the focus itself and continuing past the focus's
   * subtree to the end of the tree.
   *
   * @return a cursor on the first matching node, or null if there is none
   */
  public @Nullable Cursor find(Predicate<Node> predicate) {
    for (Cursor c = this; c != null; c = c.next()) {
      if (predicate.test(c.focus)) {
        return c;
      }
    }
    return null;
  }

  private ImmutableList<Node> currentSiblings() {
    checkNotNull(crumb);
    ImmutableList.Builder<Node> lefts = ImmutableList.builder();
    for (Siblings s = crumb.lefts; s != null; s = s.tail) {
      lefts.add(s.head);
    }
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    result.addAll(lefts.build().reverse()).add(focus);
    for (Siblings s = crumb.rights; s != null; s = s.tail) {
      result.add(s.head);
    }
    return result.build();
  }

  @Override
  public String toString() {
    return "Cursor{" + focus + ", depth=" + getDepth() + ", index=" + getIndex() + "}";
  }
}
