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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.Op;
import net.hydromatic.stanc.ast.Shuttle;
import net.hydromatic.stanc.mir.Index;

/** Shuttle that normalizes the parentheses of a program.
 *
 * <p>Parentheses are removed where they are redundant, such as around a
 * function argument or an index, and kept, collapsed to a single pair,
 * around an operator expression that is the operand of another operator.
 * Normalizing a normalized program does not change it.
 *
 * <p>Expressions are rewritten bottom-up. A rewritten expression has at
 * most one pair of parentheses at its top, and it is the parent that
 * decides whether to keep them.
 */
class ParenNormalizer extends Shuttle {
  static final ParenNormalizer INSTANCE = new ParenNormalizer();

  private ParenNormalizer() {}

  /** Removes all parentheses at the top of an expression, and normalizes
   * its descendants. */
  static Ast.Exp noParens(Ast.Exp exp) {
    return strip(INSTANCE.rewrite(exp));
  }

  /** Normalizes an expression that is an operand, keeping one pair of
   * parentheses around an operator expression if the user wrote at least
   * one. */
  static Ast.Exp keepParens(Ast.Exp exp) {
    return keep(INSTANCE.rewrite(exp));
  }

  /** Removes the parentheses, if any, from the top of a rewritten
   * expression. */
  private static Ast.Exp strip(Ast.Exp exp) {
    return exp instanceof Ast.Paren ? ((Ast.Paren) exp).exp : exp;
  }

  /** Removes the parentheses from the top of a rewritten expression unless
   * they enclose an operator. */
  private static Ast.Exp keep(Ast.Exp exp) {
    return exp instanceof Ast.Paren && !((Ast.Paren) exp).exp.op.isOperator()
        ? ((Ast.Paren) exp).exp
        : exp;
  }

  private static List<Ast.Exp> stripAll(List<Ast.Exp> exps) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (Ast.Exp exp : exps) {
      list.add(strip(exp));
    }
    return list;
  }

  /** Normalizes the target of an assignment; index bounds lose their
   * parentheses. */
  private static Ast.Exp lvalue(Ast.Exp lhs) {
    final List<Ast.Indexed> chain = new ArrayList<>();
    Ast.Exp exp = lhs;
    while (exp.op == Op.INDEXED) {
      chain.add((Ast.Indexed) exp);
      exp = ((Ast.Indexed) exp).exp;
    }
    for (int i = chain.size() - 1; i >= 0; i--) {
      final Ast.Indexed indexed = chain.get(i);
      final List<Index<Ast.Exp>> indices = new ArrayList<>();
      for (Index<Ast.Exp> index : indexed.indices) {
        indices.add(index.map(ParenNormalizer::noParens));
      }
      exp = indexed.copy(exp, indices);
    }
    return exp;
  }

  @Override public Ast.Exp visit(Ast.Paren paren) {
    // "((e))" becomes "(e)"
    return paren.exp instanceof Ast.Paren ? paren.exp : paren;
  }

  @Override public Ast.Exp visit(Ast.BinOp binOp) {
    return binOp.copy(keep(binOp.a0), keep(binOp.a1));
  }

  @Override public Ast.Exp visit(Ast.UnaryOp unaryOp) {
    return unaryOp.copy(keep(unaryOp.exp));
  }

  @Override public Ast.Exp visit(Ast.TernaryIf ternaryIf) {
    return ternaryIf.copy(keep(ternaryIf.cond), keep(ternaryIf.ifTrue),
        keep(ternaryIf.ifFalse));
  }

  @Override public Ast.Exp visit(Ast.FunApp funApp) {
    return funApp.copy(funApp.op, funApp.name, stripAll(funApp.args));
  }

  @Override public Ast.Exp visit(Ast.Indexed indexed) {
    final List<Index<Ast.Exp>> indices = new ArrayList<>();
    for (Index<Ast.Exp> index : indexed.indices) {
      indices.add(index.kind == Index.Kind.SINGLE
          ? index.map(ParenNormalizer::strip)
          : index.map(ParenNormalizer::keep));
    }
    return indexed.copy(keep(indexed.exp), indices);
  }

  @Override public Ast.Exp visit(Ast.Container container) {
    return container.copy(stripAll(container.elements));
  }

  @Override protected Ast.Exp visitExp(Ast.Exp exp) {
    return noParens(exp);
  }

  @Override public Ast.Stmt visit(Ast.Assignment assignment) {
    return assignment.copy(lvalue(assignment.lhs), assignment.assignOp,
        noParens(assignment.rhs));
  }

  @Override public Ast.Stmt visit(Ast.For forStmt) {
    return forStmt.copy(keepParens(forStmt.lower),
        keepParens(forStmt.upper), forStmt.body.accept(this));
  }

  @Override public Ast.Stmt visit(Ast.VarDecl varDecl) {
    return varDecl.copy(varDecl.sizedType.map(ParenNormalizer::noParens),
        varDecl.transformation.map(ParenNormalizer::keepParens),
        visitNullable(varDecl.initialValue));
  }
}

// End ParenNormalizer.java
