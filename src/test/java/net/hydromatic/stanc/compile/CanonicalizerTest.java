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
package net.hydromatic.stanc.compile;

import static net.hydromatic.stanc.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.AstNode;
import net.hydromatic.stanc.ast.Op;
import net.hydromatic.stanc.ast.Pos;
import net.hydromatic.stanc.eval.Prop;
import net.hydromatic.stanc.mir.FunKind;
import net.hydromatic.stanc.mir.Index;
import net.hydromatic.stanc.mir.Operator;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Canonicalizer}. */
public class CanonicalizerTest {
  private static final Pos POS = Pos.ZERO;

  private final Canonicalizer canonicalizer = Canonicalizer.create();

  private static Ast.Exp v(String name) {
    return ast.variable(POS, name);
  }

  private static Ast.Exp real(String name) {
    return v(name).withType(PrimitiveType.REAL, AdLevel.AUTO_DIFFABLE);
  }

  private static Ast.Exp i(int value) {
    return ast.intNumeral(POS, Integer.toString(value));
  }

  private static Ast.Exp paren(Ast.Exp e) {
    return ast.paren(POS, e);
  }

  private static Ast.Exp plus(Ast.Exp a, Ast.Exp b) {
    return ast.binOp(POS, Operator.PLUS, a, b);
  }

  private static Ast.Exp call(String name, Ast.Exp... args) {
    return ast.funApp(POS, FunKind.STAN_LIB, name,
        ImmutableList.copyOf(args));
  }

  private static Ast.Stmt assign(Ast.Exp lhs, Ast.Exp rhs) {
    return ast.assign(POS, lhs, Ast.AssignOp.ASSIGN, rhs);
  }

  private static Ast.Stmt assign(String name, Ast.Exp rhs) {
    return assign(v(name), rhs);
  }

  private static Ast.Program model(Ast.Stmt... stmts) {
    return ast.program(POS,
        ImmutableMap.of(Ast.BlockKind.MODEL, ImmutableList.copyOf(stmts)));
  }

  /** Returns the text of the only statement of the model block. */
  private static String stmt(Ast.Program program) {
    final List<Ast.Stmt> stmts = program.block(Ast.BlockKind.MODEL);
    assertThat(stmts.size(), is(1));
    return stmts.get(0).toString();
  }

  private String repair(Ast.Stmt stmt) {
    return stmt(canonicalizer.repairSyntax(model(stmt)));
  }

  private String replace(Ast.Stmt stmt) {
    return stmt(canonicalizer.replaceDeprecated(model(stmt)));
  }

  private String canonicalize(Ast.Stmt stmt) {
    return stmt(canonicalizer.canonicalize(model(stmt)));
  }

  @Test void testRepairCalls() {
    assertThat(
        repair(ast.targetPE(POS,
            call("normal_lpdf", v("y"), v("mu"), v("sigma")))),
        is("target += normal_lpdf(y | mu, sigma);"));
    assertThat(
        repair(ast.targetPE(POS,
            ast.condDistApp(POS, FunKind.USER_DEFINED, "foo",
                ImmutableList.of(v("y"), v("a"))))),
        is("target += foo(y, a);"));
    assertThat(
        repair(ast.targetPE(POS,
            call("exp", call("poisson_lccdf", v("n"), v("lambda"))))),
        is("target += exp(poisson_lccdf(n | lambda));"));
  }

  @Test void testRepairTilde() {
    assertThat(
        repair(ast.tilde(POS, v("y"), "normal_lpdf",
            ImmutableList.of(v("mu"), v("sigma")), Ast.Truncation.NONE)),
        is("y ~ normal(mu, sigma);"));
    assertThat(
        repair(ast.tilde(POS, v("n"), "poisson_lpmf",
            ImmutableList.of(v("lambda")), Ast.Truncation.NONE)),
        is("n ~ poisson(lambda);"));
    assertThat(
        repair(ast.tilde(POS, v("y"), "normal",
            ImmutableList.of(call("foo_lpdf", v("a"), v("b")), v("sigma")),
            Ast.Truncation.NONE)),
        is("y ~ normal(foo_lpdf(a | b), sigma);"));
  }

  /** A program that needs no repair is returned unchanged. */
  @Test void testRepairUnchanged() {
    final Ast.Program program =
        model(ast.tilde(POS, v("y"), "normal",
            ImmutableList.of(v("mu"), v("sigma")), Ast.Truncation.NONE));
    assertThat(canonicalizer.repairSyntax(program), sameInstance(program));
  }

  @Test void testReplaceFunctions() {
    assertThat(
        replace(assign("x", call("binomial_coefficient_log", v("n"), v("k")))),
        is("x = lchoose(n, k);"));
    assertThat(replace(assign("x", call("multiply_log", v("a"), v("b")))),
        is("x = lmultiply(a, b);"));
    assertThat(replace(assign("x", call("normal_log", v("y"), v("mu"), v("s")))),
        is("x = normal_lpdf(y | mu, s);"));
    assertThat(
        replace(assign("x", call("normal_cdf_log", v("y"), v("mu"), v("s")))),
        is("x = normal_lcdf(y | mu, s);"));
    assertThat(
        replace(assign("x", call("poisson_ccdf_log", v("n"), v("lambda")))),
        is("x = poisson_lccdf(n | lambda);"));

    // user-defined functions keep their names
    assertThat(
        replace(assign("x",
            ast.funApp(POS, FunKind.USER_DEFINED, "multiply_log",
                ImmutableList.of(v("a"), v("b"))))),
        is("x = multiply_log(a, b);"));
  }

  @Test void testReplaceGetLp() {
    assertThat(replace(assign("x", ast.getLp(POS))), is("x = target();"));
    assertThat(
        replace(ast.assign(POS, v("x"), Ast.AssignOp.ARROW_ASSIGN,
            ast.getLp(POS))),
        is("x = target();"));
    assertThat(
        replace(ast.assign(POS, v("x"), Ast.AssignOp.PLUS_ASSIGN, v("y"))),
        is("x += y;"));
  }

  /** {@code abs} becomes {@code fabs} only if its argument is real. */
  @Test void testReplaceAbs() {
    assertThat(replace(assign("x", call("abs", real("r")))),
        is("x = fabs(r);"));
    final Ast.Exp n = v("n").withType(PrimitiveType.INT, AdLevel.DATA_ONLY);
    assertThat(replace(assign("x", call("abs", n))), is("x = abs(n);"));
    assertThat(replace(assign("x", call("abs", v("u")))), is("x = abs(u);"));
  }

  @Test void testReplaceIfElse() {
    final Ast.Exp ifElse =
        call("if_else", v("c"), call("abs", real("r")), v("b"))
            .withType(PrimitiveType.REAL, AdLevel.AUTO_DIFFABLE);
    final Ast.Stmt stmt =
        assign("y", ast.binOp(POS, Operator.TIMES, i(2), ifElse));
    assertThat(replace(stmt), is("y = 2 * ((c) ? fabs(r) : b);"));
    assertThat(canonicalize(stmt), is("y = 2 * (c ? fabs(r) : b);"));

    // the new expression keeps the type of the call
    final Ast.Program program = canonicalizer.replaceDeprecated(model(stmt));
    final Ast.Assignment assignment =
        (Ast.Assignment) program.block(Ast.BlockKind.MODEL).get(0);
    final Ast.Exp rhs = ((Ast.BinOp) assignment.rhs).a1;
    assertThat(rhs.type, is(PrimitiveType.REAL));
    assertThat(((Ast.Paren) rhs).exp.type, is(PrimitiveType.REAL));
  }

  @Test void testReplaceIncrementLogProb() {
    final Ast.Stmt stmt =
        ast.incrementLogProb(POS,
            call("normal_log", v("y"), v("mu"), v("s")));
    assertThat(replace(stmt), is("target += normal_lpdf(y | mu, s);"));
  }

  @Test void testParens() {
    final Ast.Exp aPlusB = plus(v("a"), v("b"));
    assertThat(canonicalize(assign("y", paren(paren(aPlusB)))),
        is("y = a + b;"));
    assertThat(
        canonicalize(
            assign("y",
                ast.binOp(POS, Operator.TIMES, paren(paren(aPlusB)),
                    v("c")))),
        is("y = (a + b) * c;"));
    assertThat(
        canonicalize(
            assign("y",
                ast.binOp(POS, Operator.TIMES, paren(paren(paren(aPlusB))),
                    v("c")))),
        is("y = (a + b) * c;"));
    assertThat(
        canonicalize(
            assign("y",
                ast.binOp(POS, Operator.TIMES, paren(v("a")), v("c")))),
        is("y = a * c;"));
    assertThat(
        canonicalize(assign("y", call("f", paren(aPlusB), paren(paren(v("c")))))),
        is("y = f(a + b, c);"));
    assertThat(
        canonicalize(
            assign("y", ast.prefixOp(POS, Operator.PMINUS, paren(paren(aPlusB))))),
        is("y = -(a + b);"));
    assertThat(
        canonicalize(
            assign("y",
                ast.ternaryIf(POS, paren(paren(v("c"))), paren(aPlusB),
                    paren(v("b"))))),
        is("y = c ? (a + b) : b;"));
    assertThat(
        canonicalize(
            assign("y",
                ast.rowVectorExpr(POS, ImmutableList.of(paren(aPlusB), i(1))))),
        is("y = [a + b, 1];"));
  }

  @Test void testParensInIndices() {
    final Ast.Exp iPlus1 = plus(v("i"), i(1));
    assertThat(
        canonicalize(
            assign("y",
                ast.indexed(POS, v("x"),
                    ImmutableList.of(Index.single(paren(iPlus1)))))),
        is("y = x[i + 1];"));
    assertThat(
        canonicalize(
            assign("y",
                ast.indexed(POS, v("x"),
                    ImmutableList.of(
                        Index.between(paren(v("i")), paren(iPlus1)))))),
        is("y = x[i:(i + 1)];"));

    // on the left of an assignment, all index bounds lose their parentheses
    assertThat(
        canonicalize(
            assign(
                ast.indexed(POS, v("x"),
                    ImmutableList.of(Index.single(paren(v("i"))),
                        Index.upfrom(paren(iPlus1)))),
                i(1))),
        is("x[i, i + 1:] = 1;"));
  }

  @Test void testParensInStatements() {
    assertThat(
        canonicalize(
            ast.forLoop(POS, "i", paren(i(1)),
                paren(ast.binOp(POS, Operator.MINUS, v("N"), i(1))),
                ast.skip(POS))),
        is("for (i in 1:(N - 1)) ;"));
    assertThat(
        canonicalize(
            ast.varDecl(POS,
                ast.sizedType(PrimitiveType.VECTOR,
                    ImmutableList.of(paren(v("K"))), ImmutableList.of()),
                ast.transformation(Ast.Transformation.Kind.LOWER,
                    ImmutableList.of(paren(plus(v("a"), v("b"))))),
                "w", paren(v("z")))),
        is("vector<lower=(a + b)>[K] w = z;"));
    assertThat(
        canonicalize(
            ast.tilde(POS, paren(v("y")), "normal",
                ImmutableList.of(paren(v("mu")), paren(v("s"))),
                Ast.Truncation.lower(paren(i(0))))),
        is("y ~ normal(mu, s) T[0, ];"));
    assertThat(
        canonicalize(
            ast.whileLoop(POS, paren(v("c")),
                ast.block(POS,
                    ImmutableList.of(
                        ast.ret(POS, paren(paren(v("x")))))))),
        is("while (c) {\n  return x;\n}"));
  }

  /** Normalizing parentheses twice gives the same tree as once. */
  @Test void testParensIdempotent() {
    final Ast.Program program =
        model(
            assign("y",
                ast.binOp(POS, Operator.TIMES,
                    paren(paren(plus(v("a"), paren(v("b"))))),
                    call("f", paren(paren(v("c")))))));
    final Ast.Program once = canonicalizer.normalizeParens(program);
    assertThat(stmt(once), is("y = (a + b) * f(c);"));
    assertThat(canonicalizer.normalizeParens(once), sameInstance(once));
  }

  @Test void testStaticParens() {
    final Ast.Exp e = paren(paren(plus(v("a"), v("b"))));
    assertThat(Canonicalizer.noParens(e), hasToString("a + b"));
    assertThat(Canonicalizer.keepParens(e), hasToString("(a + b)"));
    assertThat(Canonicalizer.keepParens(paren(v("a"))), hasToString("a"));
    assertThat(Canonicalizer.keepParens(plus(v("a"), v("b"))),
        hasToString("a + b"));
  }

  @Test void testExpressionEntryPoints() {
    assertThat(canonicalizer.repairSyntax(call("normal_lpdf", v("y"), v("m"))),
        hasToString("normal_lpdf(y | m)"));
    assertThat(canonicalizer.replaceDeprecated(call("multiply_log", v("a"),
            v("b"))),
        hasToString("lmultiply(a, b)"));
  }

  /** With "normalizeParens" false, deprecated syntax is replaced but
   * parentheses are left alone. */
  @Test void testNormalizeParensOff() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.NORMALIZE_PARENS.set(props, false);
    final List<Canonicalizer.Pass> passes = new ArrayList<>();
    final Tracer tracer =
        new Tracer() {
          @Override public void onPass(Canonicalizer.Pass pass,
              Ast.Program program) {
            passes.add(pass);
          }

          @Override public void onRewrite(AstNode before, AstNode after) {
          }
        };
    final Canonicalizer c = new Canonicalizer(props, tracer);
    final Ast.Program program =
        model(assign("y", paren(paren(call("multiply_log", v("a"), v("b"))))));
    assertThat(stmt(c.canonicalize(program)),
        is("y = ((lmultiply(a, b)));"));
    assertThat(passes, contains(Canonicalizer.Pass.REPLACE_DEPRECATED));

    passes.clear();
    final Canonicalizer c2 = new Canonicalizer(ImmutableMap.of(), tracer);
    assertThat(stmt(c2.canonicalize(program)), is("y = lmultiply(a, b);"));
    assertThat(passes,
        contains(Canonicalizer.Pass.REPLACE_DEPRECATED,
            Canonicalizer.Pass.NORMALIZE_PARENS));
  }

  /** Rewrites are reported in source order, innermost first; each
   * report shows one change. */
  @Test void testTraceRewrites() {
    final List<String> rewrites = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnRewrite(Tracers.empty(),
            (before, after) -> rewrites.add(before + " => " + after));
    final Canonicalizer c = new Canonicalizer(ImmutableMap.of(), tracer);
    c.canonicalize(
        model(
            ast.incrementLogProb(POS,
                call("normal_log", v("y"), ast.getLp(POS), v("s"))),
            ast.assign(POS, v("x"), Ast.AssignOp.ARROW_ASSIGN,
                call("f", ast.getLp(POS),
                    call("multiply_log", v("a"), v("b"))))));
    assertThat(rewrites,
        contains("get_lp() => target()",
            "normal_log(y, target(), s) => normal_lpdf(y | target(), s)",
            "increment_log_prob(normal_lpdf(y | target(), s)); "
                + "=> target += normal_lpdf(y | target(), s);",
            "get_lp() => target()",
            "multiply_log(a, b) => lmultiply(a, b)",
            "x <- f(target(), lmultiply(a, b)); "
                + "=> x = f(target(), lmultiply(a, b));"));
  }

  /** Every pass handles expressions nested thousands of levels deep. */
  @Test void testDeeplyNested() {
    final int depth = 10_000;
    Ast.Exp call =
        call("multiply_log", v("a"), call("normal_lpdf", v("y"), v("mu")));
    Ast.Exp minus = ast.getLp(POS);
    for (int i = 0; i < depth; i++) {
      call = paren(call);
      minus = ast.prefixOp(POS, Operator.PMINUS, paren(minus));
    }
    final Ast.Program program = model(assign("y", call), assign("z", minus));

    final Ast.Program repaired = canonicalizer.repairSyntax(program);
    final Ast.FunApp repairedCall =
        (Ast.FunApp) unwrap(rhs(repaired, 0), depth);
    assertThat(repairedCall.name, is("multiply_log"));
    assertThat(repairedCall.args.get(1).op, is(Op.COND_DIST_APP));

    final Ast.Program replaced = canonicalizer.replaceDeprecated(program);
    assertThat(((Ast.FunApp) unwrap(rhs(replaced, 0), depth)).name,
        is("lmultiply"));

    final Ast.Program canonical = canonicalizer.canonicalize(program);
    assertThat(((Ast.FunApp) rhs(canonical, 0)).name, is("lmultiply"));
    Ast.Exp z = rhs(canonical, 1);
    for (int i = 0; i < depth; i++) {
      final Ast.UnaryOp unaryOp = (Ast.UnaryOp) z;
      z = i < depth - 1 ? ((Ast.Paren) unaryOp.exp).exp : unaryOp.exp;
    }
    assertThat(z.op, is(Op.GET_TARGET));
    assertThat(canonicalizer.normalizeParens(canonical),
        sameInstance(canonical));
  }

  /** Returns the right-hand side of the {@code i}th statement of the model
   * block, which must be an assignment. */
  private static Ast.Exp rhs(Ast.Program program, int i) {
    return ((Ast.Assignment) program.block(Ast.BlockKind.MODEL).get(i)).rhs;
  }

  /** Removes {@code depth} pairs of parentheses. */
  private static Ast.Exp unwrap(Ast.Exp exp, int depth) {
    Ast.Exp e = exp;
    for (int i = 0; i < depth; i++) {
      e = ((Ast.Paren) e).exp;
    }
    return e;
  }
}

// End CanonicalizerTest.java
