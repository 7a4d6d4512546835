/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.stanc.mir;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * MIR expression: a {@link Pattern} whose children are expressions, and a
 * piece of metadata.
 *
 * <p>The same class serves every kind of metadata: {@link NoMeta} for
 * syntax-only trees, {@link TypedMeta} after type-checking, and
 * {@link LabelledMeta} when nodes need to be cross-referenced.
 *
 * <p>Expressions are immutable. Traversals ({@link #map}, {@link #fold},
 * {@link #preOrder}, {@link #equals}, {@link #hashCode}) use explicit
 * work-lists rather than recursion, so that very deep trees, such as those
 * produced by long chains of nested parentheses, do not overflow the stack.
 *
 * @param <M> Metadata type
 */
public final class Expr<M> {
  public final M meta;
  public final Pattern<Expr<M>> pattern;
  private final int hash;

  private Expr(M meta, Pattern<Expr<M>> pattern) {
    this.meta = requireNonNull(meta);
    this.pattern = requireNonNull(pattern);
    int h = meta.hashCode() * 31 + pattern.shapeHash();
    for (Expr<M> child : pattern.children()) {
      h = h * 37 + child.hash;
    }
    this.hash = h;
  }

  /** Creates an expression from its metadata and one level of structure
   * whose children are already expressions. */
  public static <M> Expr<M> fix(M meta, Pattern<Expr<M>> pattern) {
    return new Expr<>(meta, pattern);
  }

  /** Returns the metadata. */
  public M meta() {
    return meta;
  }

  /** Returns the top level of structure. */
  public Pattern<Expr<M>> pattern() {
    return pattern;
  }

  /** Returns this expression and all of its descendants, in pre-order; a
   * node precedes its children, and children occur in canonical order. */
  public List<Expr<M>> preOrder() {
    final List<Expr<M>> list = new ArrayList<>();
    final Deque<Expr<M>> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final Expr<M> e = stack.pop();
      list.add(e);
      final List<Expr<M>> children = e.pattern.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return list;
  }

  /** Returns the number of nodes in this expression, including index
   * bounds. */
  public int size() {
    return preOrder().size();
  }

  /**
   * Folds this expression bottom-up.
   *
   * <p>The function receives the metadata of a node and its pattern whose
   * children have already been replaced by their results.
   */
  public <R> R fold(BiFunction<? super M, Pattern<R>, ? extends R> f) {
    final List<Expr<M>> nodes = preOrder();
    final List<R> stack = new ArrayList<>();
    for (int i = nodes.size() - 1; i >= 0; i--) {
      final Expr<M> node = nodes.get(i);
      stack.add(f.apply(node.meta, node.pattern.withChildren(pop(stack,
          node.pattern.children().size()))));
    }
    return stack.get(0);
  }

  /**
   * Transforms the metadata of every node, preserving shape and the order of
   * children.
   *
   * <p>The function is applied to nodes in pre-order, so a stateful function
   * sees nodes in a deterministic order.
   */
  public <N> Expr<N> map(Function<? super M, ? extends N> f) {
    final List<Expr<M>> nodes = preOrder();
    final List<N> metas = new ArrayList<>(nodes.size());
    for (Expr<M> node : nodes) {
      metas.add(f.apply(node.meta));
    }
    final List<Expr<N>> stack = new ArrayList<>();
    for (int i = nodes.size() - 1; i >= 0; i--) {
      final Pattern<Expr<M>> pattern = nodes.get(i).pattern;
      stack.add(
          fix(metas.get(i),
              pattern.withChildren(pop(stack, pattern.children().size()))));
    }
    return stack.get(0);
  }

  /** Removes the last {@code n} elements of a stack. The element that was on
   * top is first in the returned list. */
  private static <E> List<E> pop(List<E> stack, int n) {
    final List<E> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(stack.remove(stack.size() - 1));
    }
    return list;
  }

  @Override public int hashCode() {
    return hash;
  }

  @Override public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Expr) || ((Expr<?>) o).hash != hash) {
      return false;
    }
    final Deque<Expr<?>> lefts = new ArrayDeque<>();
    final Deque<Expr<?>> rights = new ArrayDeque<>();
    lefts.push(this);
    rights.push((Expr<?>) o);
    while (!lefts.isEmpty()) {
      final Expr<?> left = lefts.pop();
      final Expr<?> right = rights.pop();
      if (left == right) {
        continue;
      }
      if (left.hash != right.hash
          || !left.meta.equals(right.meta)
          || !left.pattern.sameShape(right.pattern)) {
        return false;
      }
      pushChildren(lefts, left);
      pushChildren(rights, right);
    }
    return true;
  }

  /** Returns a structural ordering of expressions, given an ordering of
   * their metadata.
   *
   * <p>Compares in pre-order: metadata, then one-level shape, then
   * children. Consistent with {@link #equals} if the metadata ordering is
   * consistent with the metadata's {@code equals}. */
  public static <M> Comparator<Expr<M>> ordering(
      Comparator<? super M> metaComparator) {
    requireNonNull(metaComparator);
    return (e1, e2) -> {
      final Deque<Expr<M>> lefts = new ArrayDeque<>();
      final Deque<Expr<M>> rights = new ArrayDeque<>();
      lefts.push(e1);
      rights.push(e2);
      while (!lefts.isEmpty()) {
        final Expr<M> left = lefts.pop();
        final Expr<M> right = rights.pop();
        if (left == right) {
          continue;
        }
        int c = metaComparator.compare(left.meta, right.meta);
        if (c != 0) {
          return c;
        }
        c = left.pattern.compareShape(right.pattern);
        if (c != 0) {
          return c;
        }
        pushChildren(lefts, left);
        pushChildren(rights, right);
      }
      return 0;
    };
  }

  /** Pushes the children of an expression onto a stack so that the first
   * child is on top. */
  private static <E extends Expr<?>> void pushChildren(Deque<E> stack,
      E e) {
    @SuppressWarnings("unchecked")
    final List<E> children = (List<E>) e.pattern.children();
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.get(i));
    }
  }

  /** Prints the expression in MIR syntax; metadata is not printed. */
  @Override public String toString() {
    return fold((meta, p) -> p.toString());
  }

  /** Returns whether two expressions are equal, ignoring metadata. */
  public static boolean equalsIgnoringMeta(Expr<?> e1, Expr<?> e2) {
    return Objects.equals(NoMeta.removeMeta(e1), NoMeta.removeMeta(e2));
  }
}

// End Expr.java
