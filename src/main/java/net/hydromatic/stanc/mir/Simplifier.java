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

import static net.hydromatic.stanc.mir.MirBuilder.isType;
import static net.hydromatic.stanc.mir.MirBuilder.mir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.stanc.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of MIR expressions.
 *
 * <p>Applies a fixed set of identities that depend only on the shape and
 * types of an expression, never on the values of its operands:
 *
 * <ul>
 *   <li>{@code x ^ 2} &rarr; {@code square(x)}
 *   <li>{@code x ^ 0.5} &rarr; {@code sqrt(x)}
 *   <li>{@code log(exp(x))} &rarr; {@code x}, if {@code x} has the type of
 *       the result
 *   <li>{@code v' * v} &rarr; {@code dot_self(v)}, if {@code v} is a vector
 *   <li>{@code r * r'} &rarr; {@code dot_self(r)}, if {@code r} is a row
 *       vector
 *   <li>{@code dot_product(x, x)} &rarr; {@code dot_self(x)}, and likewise
 *       {@code rows_dot_product} and {@code columns_dot_product}
 * </ul>
 *
 * <p>Each rule method returns null if its rule does not apply.
 */
public abstract class Simplifier {
  private Simplifier() {}

  /** Maps each "product" function to the "self" function that it becomes
   * when both arguments are the same. */
  private static final ImmutableMap<String, String> SELF_PRODUCTS =
      ImmutableMap.of("dot_product", "dot_self",
          "rows_dot_product", "rows_dot_self",
          "columns_dot_product", "columns_dot_self");

  /** Simplifies every node of an expression, bottom-up. */
  public static Expr<TypedMeta> simplify(Expr<TypedMeta> e) {
    return e.<Expr<TypedMeta>>fold((meta, p) -> {
      final Expr<TypedMeta> e2 = Expr.fix(meta, p);
      final Expr<TypedMeta> e3 = simplifyNode(e2);
      return e3 != null ? e3 : e2;
    });
  }

  /** Simplifies the top node of an expression, or returns null. */
  static @Nullable Expr<TypedMeta> simplifyNode(Expr<TypedMeta> e) {
    if (!(e.pattern instanceof Pattern.FunApp)) {
      return null;
    }
    @SuppressWarnings("unchecked")
    final Pattern.FunApp<Expr<TypedMeta>> funApp =
        (Pattern.FunApp<Expr<TypedMeta>>) e.pattern;
    if (funApp.funKind != FunKind.STAN_LIB) {
      return null;
    }
    final List<Expr<TypedMeta>> args = funApp.args;
    if (args.size() == 1) {
      switch (funApp.name) {
      case "log":
        return log(e.meta, args.get(0));
      case "sum":
        return sum(e.meta, args.get(0));
      case "inv":
        return inv(e.meta, args.get(0));
      case "trace":
        return trace(e.meta, args.get(0));
      default:
        return null;
      }
    }
    if (args.size() != 2) {
      return null;
    }
    if (funApp.isOperator(Operator.POW)) {
      return pow(e.meta, args.get(0), args.get(1));
    }
    if (funApp.isOperator(Operator.TIMES)) {
      return times(e.meta, args.get(0), args.get(1));
    }
    if (SELF_PRODUCTS.containsKey(funApp.name)) {
      return selfProduct(e.meta, funApp.name, args.get(0), args.get(1));
    }
    return null;
  }

  /** Simplifies {@code a ^ b}. */
  static @Nullable Expr<TypedMeta> pow(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    if (isLiteral(b, 2d)) {
      return mir.square(meta, a);
    }
    if (isLiteral(b, 0.5d)) {
      return mir.sqrt(meta, a);
    }
    return null;
  }

  /** Simplifies {@code log(e)}. */
  static @Nullable Expr<TypedMeta> log(TypedMeta meta, Expr<TypedMeta> e) {
    if (mir.isFun(e, FunKind.STAN_LIB, "exp")) {
      final Expr<TypedMeta> x = e.pattern.children().get(0);
      if (x.meta.type.equals(meta.type)) {
        return x;
      }
    }
    return null;
  }

  /** Simplifies {@code sum(e)}. */
  static @Nullable Expr<TypedMeta> sum(TypedMeta meta, Expr<TypedMeta> e) {
    if (e.meta.type.isScalar() && e.meta.type.equals(meta.type)) {
      return e;
    }
    return null;
  }

  /** Simplifies {@code inv(e)}. */
  static @Nullable Expr<TypedMeta> inv(TypedMeta meta, Expr<TypedMeta> e) {
    if (mir.isFun(e, FunKind.STAN_LIB, "inv")) {
      final Expr<TypedMeta> x = e.pattern.children().get(0);
      if (x.meta.type.equals(meta.type)) {
        return x;
      }
    }
    return null;
  }

  /** Simplifies {@code trace(e)}. */
  static @Nullable Expr<TypedMeta> trace(TypedMeta meta, Expr<TypedMeta> e) {
    if (mir.isOperator(e, Operator.TRANSPOSE)) {
      return mir.trace(meta, e.pattern.children().get(0));
    }
    return null;
  }

  /** Simplifies {@code a * b}. */
  static @Nullable Expr<TypedMeta> times(TypedMeta meta, Expr<TypedMeta> a,
      Expr<TypedMeta> b) {
    if (mir.isOperator(a, Operator.TRANSPOSE)
        && isType(b, PrimitiveType.VECTOR)
        && a.pattern.children().get(0).equals(b)) {
      return mir.dotSelf(meta, b);
    }
    if (mir.isOperator(b, Operator.TRANSPOSE)
        && isType(a, PrimitiveType.ROW_VECTOR)
        && b.pattern.children().get(0).equals(a)) {
      return mir.dotSelf(meta, a);
    }
    return null;
  }

  /** Simplifies {@code dot_product(a, b)}, {@code rows_dot_product(a, b)} or
   * {@code columns_dot_product(a, b)}. */
  static @Nullable Expr<TypedMeta> selfProduct(TypedMeta meta, String name,
      Expr<TypedMeta> a, Expr<TypedMeta> b) {
    final String selfName = SELF_PRODUCTS.get(name);
    if (selfName != null && a.equals(b)) {
      return mir.stanLibFun(meta, selfName, ImmutableList.of(a));
    }
    return null;
  }

  /** Returns whether an expression is a numeric literal whose text is
   * exactly a given value. */
  private static boolean isLiteral(Expr<?> e, double value) {
    final Double d = mir.realOfLit(e);
    return d != null && d == value;
  }
}

// End Simplifier.java
