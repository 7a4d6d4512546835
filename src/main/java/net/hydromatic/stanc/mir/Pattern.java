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
 * One level of a MIR expression, generic over the type of its children.
 *
 * <p>A {@code Pattern<C>} knows nothing about metadata. Tie it to itself with
 * {@link Expr} to get a tree; use a different {@code C} to hold the
 * intermediate results of a {@link Expr#fold fold}.
 *
 * <p>The order of children is significant. {@link #children()} returns them
 * in a canonical order (function arguments in order; for an indexed
 * expression, the base followed by the bounds of each index in order), and
 * {@link #withChildren} consumes them in the same order.
 *
 * @param <C> Type of child references
 */
public abstract class Pattern<C> {
  public final Kind kind;

  Pattern(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the children, in canonical order. */
  public abstract List<C> children();

  /** Creates a pattern of the same shape, with given children.
   *
   * <p>Inverse of {@link #children()}; the number of children must match. */
  public abstract <D> Pattern<D> withChildren(List<D> children);

  /** Applies a function to each child, returning a pattern of the same
   * shape. */
  public <D> Pattern<D> map(Function<? super C, ? extends D> fn) {
    final ImmutableList.Builder<D> list = ImmutableList.builder();
    for (C c : children()) {
      list.add(fn.apply(c));
    }
    return withChildren(list.build());
  }

  /** Returns whether this pattern has the same one-level shape as another,
   * ignoring children. If true, the two have the same number of children. */
  public abstract boolean sameShape(Pattern<?> pattern);

  /** Compares the one-level shape of this pattern with another, ignoring
   * children. Returns 0 if and only if {@link #sameShape} is true. */
  public int compareShape(Pattern<?> pattern) {
    return kind.compareTo(pattern.kind);
  }

  /** Hash code of the one-level shape, ignoring children. */
  public abstract int shapeHash();

  /** Writes this pattern, given its children already converted to
   * strings. */
  abstract String describe(List<String> children);

  @Override public int hashCode() {
    return shapeHash() * 31 + children().hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pattern
        && sameShape((Pattern<?>) o)
        && children().equals(((Pattern<?>) o).children());
  }

  @Override public String toString() {
    final ImmutableList.Builder<String> list = ImmutableList.builder();
    children().forEach(c -> list.add(String.valueOf(c)));
    return describe(list.build());
  }

  /** Creates a variable pattern. */
  public static <C> Pattern<C> var(String name) {
    return new Var<>(name);
  }

  /** Creates a literal pattern. */
  public static <C> Pattern<C> lit(LitType litType, String value) {
    return new Lit<>(litType, value);
  }

  /** Creates a function application pattern. */
  public static <C> Pattern<C> funApp(FunKind funKind, String name,
      List<? extends C> args) {
    return new FunApp<>(funKind, name, ImmutableList.copyOf(args));
  }

  /** Creates a ternary "if" pattern. */
  public static <C> Pattern<C> ternaryIf(C pred, C ifTrue, C ifFalse) {
    return new TernaryIf<>(pred, ifTrue, ifFalse);
  }

  /** Creates a logical "and" pattern. */
  public static <C> Pattern<C> and(C a, C b) {
    return new Binary<>(Kind.E_AND, a, b);
  }

  /** Creates a logical "or" pattern. */
  public static <C> Pattern<C> or(C a, C b) {
    return new Binary<>(Kind.E_OR, a, b);
  }

  /** Creates an indexed pattern. */
  public static <C> Pattern<C> indexed(C e, List<Index<C>> indices) {
    return new Indexed<>(e, ImmutableList.copyOf(indices));
  }

  /** Kind of pattern. */
  public enum Kind {
    VAR,
    LIT,
    FUN_APP,
    TERNARY_IF,
    E_AND,
    E_OR,
    INDEXED
  }

  /** Reference to a variable. */
  public static class Var<C> extends Pattern<C> {
    public final String name;

    Var(String name) {
      super(Kind.VAR);
      this.name = requireNonNull(name);
    }

    @Override public List<C> children() {
      return ImmutableList.of();
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      checkArgument(children.isEmpty());
      return new Var<>(name);
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      return pattern instanceof Var
          && name.equals(((Var<?>) pattern).name);
    }

    @Override public int compareShape(Pattern<?> pattern) {
      int c = super.compareShape(pattern);
      return c != 0 ? c : name.compareTo(((Var<?>) pattern).name);
    }

    @Override public int shapeHash() {
      return name.hashCode();
    }

    @Override String describe(List<String> children) {
      return name;
    }
  }

  /** Literal. Its value is held as text, exactly as written. */
  public static class Lit<C> extends Pattern<C> {
    public final LitType litType;
    public final String value;

    Lit(LitType litType, String value) {
      super(Kind.LIT);
      this.litType = requireNonNull(litType);
      this.value = requireNonNull(value);
    }

    @Override public List<C> children() {
      return ImmutableList.of();
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      checkArgument(children.isEmpty());
      return new Lit<>(litType, value);
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      return pattern instanceof Lit
          && litType == ((Lit<?>) pattern).litType
          && value.equals(((Lit<?>) pattern).value);
    }

    @Override public int compareShape(Pattern<?> pattern) {
      int c = super.compareShape(pattern);
      if (c != 0) {
        return c;
      }
      final Lit<?> lit = (Lit<?>) pattern;
      c = litType.compareTo(lit.litType);
      return c != 0 ? c : value.compareTo(lit.value);
    }

    @Override public int shapeHash() {
      return Objects.hash(litType, value);
    }

    @Override String describe(List<String> children) {
      return litType == LitType.STRING ? "\"" + value + "\"" : value;
    }
  }

  /** Application of a function, operator or distribution. */
  public static class FunApp<C> extends Pattern<C> {
    public final FunKind funKind;
    public final String name;
    public final List<C> args;

    FunApp(FunKind funKind, String name, ImmutableList<C> args) {
      super(Kind.FUN_APP);
      this.funKind = requireNonNull(funKind);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override public List<C> children() {
      return args;
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      checkArgument(children.size() == args.size(),
          "expected %s arguments: %s", args.size(), children);
      return new FunApp<>(funKind, name, ImmutableList.copyOf(children));
    }

    /** Returns whether this is an application of a given library operator. */
    public boolean isOperator(Operator op) {
      return funKind == FunKind.STAN_LIB && name.equals(op.mirName);
    }

    /** Returns whether this is an application of a given library function. */
    public boolean isStanLib(String fnName) {
      return funKind == FunKind.STAN_LIB && name.equals(fnName);
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      return pattern instanceof FunApp
          && funKind == ((FunApp<?>) pattern).funKind
          && name.equals(((FunApp<?>) pattern).name)
          && args.size() == ((FunApp<?>) pattern).args.size();
    }

    @Override public int compareShape(Pattern<?> pattern) {
      int c = super.compareShape(pattern);
      if (c != 0) {
        return c;
      }
      final FunApp<?> funApp = (FunApp<?>) pattern;
      c = funKind.compareTo(funApp.funKind);
      if (c != 0) {
        return c;
      }
      c = name.compareTo(funApp.name);
      return c != 0 ? c : Integer.compare(args.size(), funApp.args.size());
    }

    @Override public int shapeHash() {
      return Objects.hash(funKind, name, args.size());
    }

    @Override String describe(List<String> children) {
      final StringBuilder b = new StringBuilder(name).append('(');
      for (int i = 0; i < children.size(); i++) {
        if (i > 0) {
          b.append(i == 1 && funKind == FunKind.COND_DIST_APP ? " | " : ", ");
        }
        b.append(children.get(i));
      }
      return b.append(')').toString();
    }
  }

  /** Ternary "if", {@code pred ? ifTrue : ifFalse}. */
  public static class TernaryIf<C> extends Pattern<C> {
    public final C pred;
    public final C ifTrue;
    public final C ifFalse;

    TernaryIf(C pred, C ifTrue, C ifFalse) {
      super(Kind.TERNARY_IF);
      this.pred = requireNonNull(pred);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public List<C> children() {
      return ImmutableList.of(pred, ifTrue, ifFalse);
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      checkArgument(children.size() == 3);
      return new TernaryIf<>(children.get(0), children.get(1),
          children.get(2));
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      return pattern instanceof TernaryIf;
    }

    @Override public int shapeHash() {
      return kind.ordinal();
    }

    @Override String describe(List<String> children) {
      return "(" + children.get(0) + " ? " + children.get(1)
          + " : " + children.get(2) + ")";
    }
  }

  /** Short-circuiting logical "and" ({@link Kind#E_AND}) or "or"
   * ({@link Kind#E_OR}). */
  public static class Binary<C> extends Pattern<C> {
    public final C left;
    public final C right;

    Binary(Kind kind, C left, C right) {
      super(kind);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(kind == Kind.E_AND || kind == Kind.E_OR);
    }

    @Override public List<C> children() {
      return ImmutableList.of(left, right);
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      checkArgument(children.size() == 2);
      return new Binary<>(kind, children.get(0), children.get(1));
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      return pattern.kind == kind;
    }

    @Override public int shapeHash() {
      return kind.ordinal();
    }

    @Override String describe(List<String> children) {
      return "(" + children.get(0) + (kind == Kind.E_AND ? " && " : " || ")
          + children.get(1) + ")";
    }
  }

  /** Indexed expression, such as {@code x[i, 2:3]}. */
  public static class Indexed<C> extends Pattern<C> {
    public final C e;
    public final List<Index<C>> indices;

    Indexed(C e, ImmutableList<Index<C>> indices) {
      super(Kind.INDEXED);
      this.e = requireNonNull(e);
      this.indices = requireNonNull(indices);
    }

    @Override public List<C> children() {
      final ImmutableList.Builder<C> list = ImmutableList.builder();
      list.add(e);
      indices.forEach(index -> list.addAll(index.bounds()));
      return list.build();
    }

    @Override public <D> Pattern<D> withChildren(List<D> children) {
      final ImmutableList.Builder<Index<D>> list = ImmutableList.builder();
      int i = 1;
      for (Index<C> index : indices) {
        final int n = index.bounds().size();
        checkArgument(i + n <= children.size(), "too few children");
        list.add(index.withBounds(children.subList(i, i + n)));
        i += n;
      }
      checkArgument(i == children.size(), "too many children");
      return new Indexed<>(children.get(0), list.build());
    }

    @Override public boolean sameShape(Pattern<?> pattern) {
      if (!(pattern instanceof Indexed)) {
        return false;
      }
      final List<? extends Index<?>> indices2 = ((Indexed<?>) pattern).indices;
      if (indices.size() != indices2.size()) {
        return false;
      }
      for (int i = 0; i < indices.size(); i++) {
        if (indices.get(i).kind != indices2.get(i).kind) {
          return false;
        }
      }
      return true;
    }

    @Override public int compareShape(Pattern<?> pattern) {
      int c = super.compareShape(pattern);
      if (c != 0) {
        return c;
      }
      final List<? extends Index<?>> indices2 = ((Indexed<?>) pattern).indices;
      c = Integer.compare(indices.size(), indices2.size());
      for (int i = 0; c == 0 && i < indices.size(); i++) {
        c = indices.get(i).kind.compareTo(indices2.get(i).kind);
      }
      return c;
    }

    @Override public int shapeHash() {
      int h = kind.ordinal();
      for (Index<C> index : indices) {
        h = h * 31 + index.kind.ordinal();
      }
      return h;
    }

    @Override String describe(List<String> children) {
      final StringBuilder b = new StringBuilder(children.get(0));
      if (indices.isEmpty()) {
        return b.toString();
      }
      b.append('[');
      int i = 1;
      for (int j = 0; j < indices.size(); j++) {
        final Index<C> index = indices.get(j);
        final int n = index.bounds().size();
        if (j > 0) {
          b.append(", ");
        }
        index.describe(b, children.subList(i, i + n));
        i += n;
      }
      return b.append(']').toString();
    }
  }
}

// End Pattern.java
