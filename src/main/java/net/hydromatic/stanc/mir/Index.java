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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Index specifier in an indexed expression, generic over the type of its
 * bounds.
 *
 * <p>For example, in {@code x[i, 2:, :]}, the indices are
 * {@code Single(i)}, {@code Upfrom(2)} and {@code All}.
 *
 * @param <C> Type of bound expressions
 */
public abstract class Index<C> {
  public final Kind kind;

  Index(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates an index that selects all elements. */
  @SuppressWarnings("unchecked")
  public static <C> Index<C> all() {
    return (Index<C>) All.INSTANCE;
  }

  /** Creates an index that selects one element. */
  public static <C> Index<C> single(C e) {
    return new Single<>(Kind.SINGLE, e);
  }

  /** Creates an index that selects the elements from a lower bound. */
  public static <C> Index<C> upfrom(C e) {
    return new Single<>(Kind.UPFROM, e);
  }

  /** Creates an index that selects several elements, given by an
   * integer array. */
  public static <C> Index<C> multi(C e) {
    return new Single<>(Kind.MULTI_INDEX, e);
  }

  /** Creates an index that selects the elements between two bounds. */
  public static <C> Index<C> between(C lower, C upper) {
    return new Between<>(lower, upper);
  }

  /** Returns the bounds of this index, in order; empty for {@code All},
   * lower then upper for {@code Between}. */
  public abstract List<C> bounds();

  /** Creates an index of the same kind with new bounds. The number of bounds
   * must be the same as {@link #bounds()}. */
  public abstract <D> Index<D> withBounds(List<D> bounds);

  /** Applies a function to each bound. */
  public <D> Index<D> map(Function<? super C, ? extends D> fn) {
    final ImmutableList.Builder<D> list = ImmutableList.builder();
    for (C c : bounds()) {
      list.add(fn.apply(c));
    }
    return withBounds(list.build());
  }

  /** Writes this index, given its bounds already converted to strings. */
  abstract StringBuilder describe(StringBuilder buf, List<String> bounds);

  @Override public String toString() {
    final ImmutableList.Builder<String> list = ImmutableList.builder();
    bounds().forEach(c -> list.add(String.valueOf(c)));
    return describe(new StringBuilder(), list.build()).toString();
  }

  /** Kind of index. */
  public enum Kind {
    ALL,
    SINGLE,
    UPFROM,
    BETWEEN,
    MULTI_INDEX
  }

  /** Index that selects all elements, written ":". */
  private static class All extends Index<Object> {
    static final All INSTANCE = new All();

    All() {
      super(Kind.ALL);
    }

    @Override public List<Object> bounds() {
      return ImmutableList.of();
    }

    @SuppressWarnings("unchecked")
    @Override public <D> Index<D> withBounds(List<D> bounds) {
      checkArgument(bounds.isEmpty());
      return (Index<D>) this;
    }

    @Override StringBuilder describe(StringBuilder buf, List<String> bounds) {
      return buf.append(':');
    }

    @Override public int hashCode() {
      return Kind.ALL.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof All;
    }
  }

  /** Index with one bound: {@code Single}, {@code Upfrom} or
   * {@code MultiIndex}. */
  private static class Single<C> extends Index<C> {
    final C e;

    Single(Kind kind, C e) {
      super(kind);
      this.e = requireNonNull(e);
      checkArgument(kind == Kind.SINGLE
          || kind == Kind.UPFROM
          || kind == Kind.MULTI_INDEX);
    }

    @Override public List<C> bounds() {
      return ImmutableList.of(e);
    }

    @Override public <D> Index<D> withBounds(List<D> bounds) {
      checkArgument(bounds.size() == 1, "expected 1 bound: %s", bounds);
      return new Single<>(kind, bounds.get(0));
    }

    @Override StringBuilder describe(StringBuilder buf, List<String> bounds) {
      buf.append(bounds.get(0));
      return kind == Kind.UPFROM ? buf.append(':') : buf;
    }

    @Override public int hashCode() {
      return Objects.hash(kind, e);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Single
          && kind == ((Single<?>) o).kind
          && e.equals(((Single<?>) o).e);
    }
  }

  /** Index between a lower and an upper bound, written "lower:upper". */
  private static class Between<C> extends Index<C> {
    final C lower;
    final C upper;

    Between(C lower, C upper) {
      super(Kind.BETWEEN);
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
    }

    @Override public List<C> bounds() {
      return ImmutableList.of(lower, upper);
    }

    @Override public <D> Index<D> withBounds(List<D> bounds) {
      checkArgument(bounds.size() == 2, "expected 2 bounds: %s", bounds);
      return new Between<>(bounds.get(0), bounds.get(1));
    }

    @Override StringBuilder describe(StringBuilder buf, List<String> bounds) {
      return buf.append(bounds.get(0)).append(':').append(bounds.get(1));
    }

    @Override public int hashCode() {
      return Objects.hash(lower, upper);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Between
          && lower.equals(((Between<?>) o).lower)
          && upper.equals(((Between<?>) o).upper);
    }
  }
}

// End Index.java
