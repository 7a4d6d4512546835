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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import java.util.List;
import net.hydromatic.stanc.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds MIR expressions.
 *
 * <p>Most methods are generic in the type of metadata. Methods that take
 * a {@link TypedMeta}, such as {@link #pow} and {@link #times}, look at the
 * types of their arguments and may return a simpler expression; see
 * {@link Simplifier}. */
public enum MirBuilder {
  /** The singleton instance of the MIR builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  mir;

  /** Creates a reference to a variable. */
  public <M> Expr<M> var(M meta, String name) {
    return Expr.fix(meta, Pattern.var(name));
  }

  /** Creates a literal. */
  public <M> Expr<M> lit(M meta, LitType litType, String value) {
    return Expr.fix(meta, Pattern.lit(litType, value));
  }

  /** Creates an {@code int} literal. */
  public <M> Expr<M> intLit(M meta, int value) {
    return lit(meta, LitType.INT, Integer.toString(value));
  }

  /** Creates a {@code real} literal. */
  public <M> Expr<M> realLit(M meta, double value) {
    return lit(meta, LitType.REAL, Double.toString(value));
  }

  /** Creates a string literal. */
  public <M> Expr<M> stringLit(M meta, String value) {
    return lit(meta, LitType.STRING, value);
  }

  /** Creates a short-circuiting "and", {@code a && b}. */
  public <M> Expr<M> and(M meta, Expr<M> a, Expr<M> b) {
    return Expr.fix(meta, Pattern.and(a, b));
  }

  /** Creates a short-circuiting "or", {@code a || b}. */
  public <M> Expr<M> or(M meta, Expr<M> a, Expr<M> b) {
    return Expr.fix(meta, Pattern.or(a, b));
  }

  /** Creates an indexed expression. */
  public <M> Expr<M> indexed(M meta, Expr<M> e,
      List<Index<Expr<M>>> indices) {
    return Expr.fix(meta, Pattern.indexed(e, indices));
  }

  /** Creates {@code e[:]}. */
  public <M> Expr<M> indexAll(M meta, Expr<M> e) {
    return indexed(meta, e, ImmutableList.of(Index.all()));
  }

  /** Creates {@code e[i]}. */
  public <M> Expr<M> indexSingle(M meta, Expr<M> e, Expr<M> idx) {
    return indexed(meta, e, ImmutableList.of(Index.single(idx)));
  }

  /** Creates {@code e[idx]} where {@code idx} is an array of integers. */
  public <M> Expr<M> indexMulti(M meta, Expr<M> e, Expr<M> idx) {
    return indexed(meta, e, ImmutableList.of(Index.multi(idx)));
  }

  /** Creates {@code e[idx:]}. */
  public <M> Expr<M> indexUpfrom(M meta, Expr<M> e, Expr<M> idx) {
    return indexed(meta, e, ImmutableList.of(Index.upfrom(idx)));
  }

  /** Creates {@code e[lower:upper]}. */
  public <M> Expr<M> indexBetween(M meta, Expr<M> e, Expr<M> lower,
      Expr<M> upper) {
    return indexed(meta, e, ImmutableList.of(Index.between(lower, upper)));
  }

  /** Creates {@code pred ? ifTrue : ifFalse}. */
  public <M> Expr<M> ifThenElse(M meta, Expr<M> pred, Expr<M> ifTrue,
      Expr<M> ifFalse) {
    return Expr.fix(meta, Pattern.ternaryIf(pred, ifTrue, ifFalse));
  }

  /** Creates a function application. */
  public <M> Expr<M> funApp(M meta, FunKind funKind, String name,
      List<Expr<M>> args) {
    return Expr.fix(meta, Pattern.funApp(funKind, name, args));
  }

  /** Creates a call to a compiler-internal function. */
  public <M> Expr<M> internalFun(M meta, InternalFun fn, List<Expr<M>> args) {
    return funApp(meta, FunKind.COMPILER_INTERNAL, fn.funName, args);
  }

  /** Creates a call to a function in the math library. */
  public <M> Expr<M> stanLibFun(M meta, String name, List<Expr<M>> args) {
    return funApp(meta, FunKind.STAN_LIB, name, args);
  }

  /** Creates a call to a user-defined function. */
  public <M> Expr<M> userFun(M meta, String name, List<Expr<M>> args) {
    return funApp(meta, FunKind.USER_DEFINED, name, args);
  }

  /** Creates a conditional distribution application, such as
   * {@code normal_lpdf(y | mu, sigma)}. */
  public <M> Expr<M> condDistApp(M meta, String name, List<Expr<M>> args) {
    return funApp(meta, FunKind.COND_DIST_APP, name, args);
  }

  /** Creates a call to a binary operator, or returns null if {@code op}
   * takes one operand. */
  public <M> @Nullable Expr<M> applyBinop(M meta, Operator op, Expr<M> a,
      Expr<M> b) {
    return op.isUnary() ? null : binop(meta, op, a, b);
  }

  /** Creates a call to a unary operator, or returns null if {@code op}
   * takes two operands. */
  public <M> @Nullable Expr<M> applyUnop(M meta, Operator op, Expr<M> e) {
    return op.isUnary() ? unop(meta, op, e) : null;
  }

  /** Creates a call to a binary operator. */
  public <M> Expr<M> binop(M meta, Operator op, Expr<M> a, Expr<M> b) {
    return stanLibFun(meta, op.mirName, ImmutableList.of(a, b));
  }

  /** Creates a call to a unary operator. */
  public <M> Expr<M> unop(M meta, Operator op, Expr<M> e) {
    return stanLibFun(meta, op.mirName, ImmutableList.of(e));
  }

  public <M> Expr<M> plus(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.PLUS, a, b);
  }

  public <M> Expr<M> minus(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.MINUS, a, b);
  }

  public <M> Expr<M> divide(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.DIVIDE, a, b);
  }

  /** Creates an integer division, {@code a %/% b}. */
  public <M> Expr<M> intDivide(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.INT_DIVIDE, a, b);
  }

  public <M> Expr<M> modulo(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.MODULO, a, b);
  }

  public <M> Expr<M> eq(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.EQUALS, a, b);
  }

  public <M> Expr<M> neq(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.NEQUALS, a, b);
  }

  public <M> Expr<M> lt(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.LESS, a, b);
  }

  public <M> Expr<M> leq(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.LEQ, a, b);
  }

  public <M> Expr<M> gt(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.GREATER, a, b);
  }

  public <M> Expr<M> geq(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.GEQ, a, b);
  }

  /** Creates a call to the non-short-circuiting "and" operator,
   * {@code And__(a, b)}. */
  public <M> Expr<M> logicalAnd(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.AND, a, b);
  }

  public <M> Expr<M> logicalOr(M meta, Expr<M> a, Expr<M> b) {
    return binop(meta, Operator.OR, a, b);
  }

  public <M> Expr<M> transpose(M meta, Expr<M> e) {
    return unop(meta, Operator.TRANSPOSE, e);
  }

  public <M> Expr<M> logicalNot(M meta, Expr<M> e) {
    return unop(meta, Operator.PNOT, e);
  }

  public <M> Expr<M> negate(M meta, Expr<M> e) {
    return unop(meta, Operator.PMINUS, e);
  }

  public <M> Expr<M> positive(M meta, Expr<M> e) {
    return unop(meta, Operator.PPLUS, e);
  }

  /** Creates {@code e + 1}, with the metadata of {@code e}. */
  public <M> Expr<M> incr(Expr<M> e) {
    return plus(e.meta, e, intLit(e.meta, 1));
  }

  /** Creates {@code e - 1}, with the metadata of {@code e}. */
  public <M> Expr<M> decr(Expr<M> e) {
    return minus(e.meta, e, intLit(e.meta, 1));
  }

  /** Returns the integer literal 0. */
  public Expr<TypedMeta> zero() {
    return intLit(TypedMeta.EMPTY, 0);
  }

  /** Returns the integer literal 1, the first index of a loop. */
  public Expr<TypedMeta> loopBottom() {
    return intLit(TypedMeta.EMPTY, 1);
  }

  /** Returns the real literal for the square root of 2. */
  public <M> Expr<M> sqrt2(M meta) {
    return realLit(meta, Math.sqrt(2d));
  }

  // Typed constructors that simplify

  /** Creates {@code a ^ b}; if the exponent is 2 or 0.5, creates a call to
   * {@code square} or {@code sqrt}. */
  public Expr<TypedMeta> pow(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    final Expr<TypedMeta> e = Simplifier.pow(meta, a, b);
    return e != null ? e : binop(meta, Operator.POW, a, b);
  }

  /** Creates {@code a * b}; a vector times its own transpose becomes a call
   * to {@code dot_self}. */
  public Expr<TypedMeta> times(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    final Expr<TypedMeta> e = Simplifier.times(meta, a, b);
    return e != null ? e : binop(meta, Operator.TIMES, a, b);
  }

  /** Creates {@code log(e)}; {@code log(exp(x))} becomes {@code x}. */
  public Expr<TypedMeta> log(TypedMeta meta, Expr<TypedMeta> e) {
    final Expr<TypedMeta> e2 = Simplifier.log(meta, e);
    return e2 != null ? e2 : stanLibFun(meta, "log", ImmutableList.of(e));
  }

  public Expr<TypedMeta> exp(TypedMeta meta, Expr<TypedMeta> e) {
    return stanLibFun(meta, "exp", ImmutableList.of(e));
  }

  public Expr<TypedMeta> square(TypedMeta meta, Expr<TypedMeta> e) {
    return stanLibFun(meta, "square", ImmutableList.of(e));
  }

  public Expr<TypedMeta> sqrt(TypedMeta meta, Expr<TypedMeta> e) {
    return stanLibFun(meta, "sqrt", ImmutableList.of(e));
  }

  /** Creates {@code sum(e)}; the sum of a scalar is the scalar. */
  public Expr<TypedMeta> sum(TypedMeta meta, Expr<TypedMeta> e) {
    final Expr<TypedMeta> e2 = Simplifier.sum(meta, e);
    return e2 != null ? e2 : stanLibFun(meta, "sum", ImmutableList.of(e));
  }

  /** Creates {@code inv(e)}; {@code inv(inv(x))} becomes {@code x}. */
  public Expr<TypedMeta> inv(TypedMeta meta, Expr<TypedMeta> e) {
    final Expr<TypedMeta> e2 = Simplifier.inv(meta, e);
    return e2 != null ? e2 : stanLibFun(meta, "inv", ImmutableList.of(e));
  }

  /** Creates {@code trace(e)}; {@code trace(m')} becomes {@code trace(m)}. */
  public Expr<TypedMeta> trace(TypedMeta meta, Expr<TypedMeta> e) {
    final Expr<TypedMeta> e2 = Simplifier.trace(meta, e);
    return e2 != null ? e2 : stanLibFun(meta, "trace", ImmutableList.of(e));
  }

  public Expr<TypedMeta> dotSelf(TypedMeta meta, Expr<TypedMeta> e) {
    return stanLibFun(meta, "dot_self", ImmutableList.of(e));
  }

  /** Creates {@code dot_product(a, b)}, or {@code dot_self(a)} if the
   * arguments are the same. */
  public Expr<TypedMeta> dotProduct(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    final Expr<TypedMeta> e = Simplifier.selfProduct(meta, "dot_product", a, b);
    return e != null ? e
        : stanLibFun(meta, "dot_product", ImmutableList.of(a, b));
  }

  /** Creates {@code rows_dot_product(a, b)}, or {@code rows_dot_self(a)} if
   * the arguments are the same. */
  public Expr<TypedMeta> rowsDotProduct(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    final Expr<TypedMeta> e =
        Simplifier.selfProduct(meta, "rows_dot_product", a, b);
    return e != null ? e
        : stanLibFun(meta, "rows_dot_product", ImmutableList.of(a, b));
  }

  /** Creates {@code columns_dot_product(a, b)}, or
   * {@code columns_dot_self(a)} if the arguments are the same. */
  public Expr<TypedMeta> columnsDotProduct(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    final Expr<TypedMeta> e =
        Simplifier.selfProduct(meta, "columns_dot_product", a, b);
    return e != null ? e
        : stanLibFun(meta, "columns_dot_product", ImmutableList.of(a, b));
  }

  // Queries

  /** Returns whether an expression is a literal. */
  public boolean isLit(Expr<?> e) {
    return e.pattern instanceof Pattern.Lit;
  }

  /** Returns whether an expression is a literal of a given type. */
  public boolean isLit(Expr<?> e, LitType litType) {
    return e.pattern instanceof Pattern.Lit
        && ((Pattern.Lit<?>) e.pattern).litType == litType;
  }

  /** Returns the value of an {@code int} literal, or null if the expression
   * is not an {@code int} literal. */
  public @Nullable Integer intOfLit(Expr<?> e) {
    return isLit(e, LitType.INT)
        ? Ints.tryParse(((Pattern.Lit<?>) e.pattern).value)
        : null;
  }

  /** Returns the value of a numeric literal, or null if the expression
   * is not a numeric literal. */
  public @Nullable Double realOfLit(Expr<?> e) {
    return isLit(e, LitType.REAL) || isLit(e, LitType.INT)
        ? Doubles.tryParse(((Pattern.Lit<?>) e.pattern).value)
        : null;
  }

  /** Returns the value of a string literal, or null. */
  public @Nullable String stringOfLit(Expr<?> e) {
    return isLit(e, LitType.STRING)
        ? ((Pattern.Lit<?>) e.pattern).value
        : null;
  }

  /** Returns whether an expression is a function application. */
  public boolean isFun(Expr<?> e) {
    return isFun(e, null, null);
  }

  /** Returns whether an expression is a function application of a given
   * kind and name; a null kind or name matches any. */
  public boolean isFun(Expr<?> e, @Nullable FunKind funKind,
      @Nullable String name) {
    return e.pattern instanceof Pattern.FunApp
        && matches((Pattern.FunApp<?>) e.pattern, funKind, name);
  }

  /** Returns whether an expression is a call to a given compiler-internal
   * function, or to any if {@code fn} is null. */
  public boolean isInternalFun(Expr<?> e, @Nullable InternalFun fn) {
    return isFun(e, FunKind.COMPILER_INTERNAL, fn == null ? null : fn.funName);
  }

  /** Returns whether an expression is a call to a given operator, or to any
   * function in the math library if {@code op} is null. */
  public boolean isOperator(Expr<?> e, @Nullable Operator op) {
    return isFun(e, FunKind.STAN_LIB, op == null ? null : op.mirName);
  }

  /** Returns whether an expression or any of its descendants is a function
   * application of a given kind and name; a null kind or name matches any. */
  public <M> boolean containsFun(Expr<M> e, @Nullable FunKind funKind,
      @Nullable String name) {
    return e.<Boolean>fold((meta, p) -> {
      if (p instanceof Pattern.FunApp
          && matches((Pattern.FunApp<?>) p, funKind, name)) {
        return true;
      }
      return p.children().contains(true);
    });
  }

  /** Returns whether an expression contains a call to a given operator. */
  public <M> boolean containsOperator(Expr<M> e, @Nullable Operator op) {
    return containsFun(e, FunKind.STAN_LIB, op == null ? null : op.mirName);
  }

  /** Returns whether an expression contains a call to a given
   * compiler-internal function. */
  public <M> boolean containsInternalFun(Expr<M> e, @Nullable InternalFun fn) {
    return containsFun(e, FunKind.COMPILER_INTERNAL,
        fn == null ? null : fn.funName);
  }

  private static boolean matches(Pattern.FunApp<?> funApp,
      @Nullable FunKind funKind, @Nullable String name) {
    return (funKind == null || funApp.funKind == funKind)
        && (name == null || funApp.name.equals(name));
  }

  /** Returns the bounds of an index. */
  public <C> List<C> indexBounds(Index<C> index) {
    return index.bounds();
  }

  /** Returns the indices of an indexed expression, or an empty list. */
  public <M> List<Index<Expr<M>>> indicesOf(Expr<M> e) {
    if (!(e.pattern instanceof Pattern.Indexed)) {
      return ImmutableList.of();
    }
    @SuppressWarnings("unchecked")
    final Pattern.Indexed<Expr<M>> indexed =
        (Pattern.Indexed<Expr<M>>) e.pattern;
    return indexed.indices;
  }

  /** Returns whether an expression has a given primitive type. */
  static boolean isType(Expr<? extends Annotation> e, PrimitiveType type) {
    return e.meta.type() == type;
  }
}

// End MirBuilder.java
