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

import static net.hydromatic.stanc.mir.MirBuilder.mir;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Simplifier} and the simplifying methods of
 * {@link MirBuilder}. */
public class SimplifierTest {
  private static final TypedMeta REAL =
      TypedMeta.create(PrimitiveType.REAL, AdLevel.AUTO_DIFFABLE);
  private static final TypedMeta INT =
      TypedMeta.create(PrimitiveType.INT, AdLevel.DATA_ONLY);
  private static final TypedMeta VECTOR =
      TypedMeta.create(PrimitiveType.VECTOR, AdLevel.AUTO_DIFFABLE);
  private static final TypedMeta ROW_VECTOR =
      TypedMeta.create(PrimitiveType.ROW_VECTOR, AdLevel.AUTO_DIFFABLE);

  private final Expr<TypedMeta> x = mir.var(REAL, "x");
  private final Expr<TypedMeta> v = mir.var(VECTOR, "v");
  private final Expr<TypedMeta> r = mir.var(ROW_VECTOR, "r");

  @Test void testPow() {
    assertThat(mir.pow(REAL, x, mir.intLit(INT, 2)),
        hasToString("square(x)"));
    assertThat(mir.pow(REAL, x, mir.realLit(REAL, 2d)),
        hasToString("square(x)"));
    assertThat(mir.pow(REAL, x, mir.realLit(REAL, 0.5d)),
        hasToString("sqrt(x)"));
    assertThat(mir.pow(REAL, x, mir.intLit(INT, 3)),
        hasToString("Pow__(x, 3)"));
    assertThat(mir.pow(REAL, x, mir.var(INT, "n")),
        hasToString("Pow__(x, n)"));
  }

  /** Building {@code x ^ 2} directly and simplifying it gives the same
   * expression as the smart constructor. */
  @Test void testSimplifyPow() {
    final Expr<TypedMeta> raw =
        mir.binop(REAL, Operator.POW, x, mir.intLit(INT, 2));
    assertThat(raw, hasToString("Pow__(x, 2)"));
    assertThat(Simplifier.simplify(raw),
        is(mir.pow(REAL, x, mir.intLit(INT, 2))));
    assertThat(Simplifier.simplify(raw), is(mir.square(REAL, x)));
  }

  @Test void testLog() {
    assertThat(mir.log(REAL, mir.exp(REAL, x)), sameInstance(x));
    assertThat(mir.log(REAL, x), hasToString("log(x)"));

    // The type of the argument of "exp" must match the type of the result
    final Expr<TypedMeta> n = mir.var(INT, "n");
    assertThat(mir.log(REAL, mir.exp(REAL, n)), hasToString("log(exp(n))"));
  }

  @Test void testTimes() {
    assertThat(mir.times(REAL, mir.transpose(ROW_VECTOR, v), v),
        hasToString("dot_self(v)"));
    assertThat(mir.times(REAL, r, mir.transpose(VECTOR, r)),
        hasToString("dot_self(r)"));

    // v * v' is a matrix, not a dot product
    assertThat(mir.times(REAL, v, mir.transpose(ROW_VECTOR, v)),
        hasToString("Times__(v, Transpose__(v))"));

    // different operands
    final Expr<TypedMeta> w = mir.var(VECTOR, "w");
    assertThat(mir.times(REAL, mir.transpose(ROW_VECTOR, v), w),
        hasToString("Times__(Transpose__(v), w)"));
    assertThat(mir.times(REAL, x, x), hasToString("Times__(x, x)"));
  }

  @Test void testSelfProducts() {
    assertThat(mir.dotProduct(REAL, v, v), hasToString("dot_self(v)"));
    assertThat(mir.rowsDotProduct(VECTOR, v, v),
        hasToString("rows_dot_self(v)"));
    assertThat(mir.columnsDotProduct(ROW_VECTOR, v, v),
        hasToString("columns_dot_self(v)"));
    final Expr<TypedMeta> w = mir.var(VECTOR, "w");
    assertThat(mir.dotProduct(REAL, v, w), hasToString("dot_product(v, w)"));
  }

  @Test void testSum() {
    assertThat(mir.sum(REAL, x), sameInstance(x));
    assertThat(mir.sum(REAL, v), hasToString("sum(v)"));
    // an int argument does not simplify to a real result
    final Expr<TypedMeta> n = mir.var(INT, "n");
    assertThat(mir.sum(REAL, n), hasToString("sum(n)"));
    assertThat(Simplifier.simplify(mir.stanLibFun(REAL, "sum",
        ImmutableList.of(x))), is(x));
  }

  @Test void testInv() {
    assertThat(mir.inv(REAL, mir.inv(REAL, x)), sameInstance(x));
    assertThat(mir.inv(REAL, x), hasToString("inv(x)"));
    assertThat(mir.inv(REAL, mir.inv(REAL, mir.inv(REAL, x))),
        hasToString("inv(x)"));
    final Expr<TypedMeta> raw = mir.stanLibFun(REAL, "inv",
        ImmutableList.of(mir.stanLibFun(REAL, "inv", ImmutableList.of(x))));
    assertThat(raw, hasToString("inv(inv(x))"));
    assertThat(Simplifier.simplify(raw), is(x));
  }

  @Test void testTrace() {
    final TypedMeta matrix =
        TypedMeta.create(PrimitiveType.MATRIX, AdLevel.AUTO_DIFFABLE);
    final Expr<TypedMeta> m = mir.var(matrix, "m");
    assertThat(mir.trace(REAL, m), hasToString("trace(m)"));
    assertThat(mir.trace(REAL, mir.transpose(matrix, m)),
        hasToString("trace(m)"));
    final Expr<TypedMeta> raw = mir.stanLibFun(REAL, "trace",
        ImmutableList.of(mir.transpose(matrix, m)));
    assertThat(raw, hasToString("trace(Transpose__(m))"));
    assertThat(Simplifier.simplify(raw), is(mir.trace(REAL, m)));
  }

  /** Rules apply at every level of the tree, bottom-up. */
  @Test void testSimplifyNested() {
    final Expr<TypedMeta> e =
        mir.plus(REAL,
            mir.stanLibFun(REAL, "log",
                ImmutableList.of(mir.exp(REAL, x))),
            mir.stanLibFun(REAL, "dot_product", ImmutableList.of(v, v)));
    assertThat(Simplifier.simplify(e), hasToString("Plus__(x, dot_self(v))"));

    // log(exp(x)) ^ 0.5; the inner node is rewritten first
    final Expr<TypedMeta> e2 =
        mir.binop(REAL, Operator.POW,
            mir.stanLibFun(REAL, "log", ImmutableList.of(mir.exp(REAL, x))),
            mir.realLit(REAL, 0.5d));
    assertThat(Simplifier.simplify(e2), hasToString("sqrt(x)"));

    // an expression with nothing to simplify is unchanged
    final Expr<TypedMeta> e3 = mir.plus(REAL, x, mir.intLit(INT, 1));
    assertThat(Simplifier.simplify(e3), is(e3));
  }
}

// End SimplifierTest.java
