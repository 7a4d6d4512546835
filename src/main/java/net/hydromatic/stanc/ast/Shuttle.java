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
package net.hydromatic.stanc.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits and transforms syntax trees.
 *
 * <p>Expressions are rewritten bottom-up by {@link #rewrite}, which uses an
 * explicit stack rather than recursion, so that deeply nested expressions
 * do not overflow the call stack. Each {@code visit} method for an
 * expression receives a node whose children have already been rewritten,
 * and returns its replacement; the default returns the node itself.
 *
 * <p>Each {@code visit} method for a statement visits the children of the
 * statement and returns a copy if any of them changed, or the statement
 * itself. Sub-classes override the methods for the nodes they rewrite. */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  /** Rewrites an expression and its descendants.
   *
   * <p>Nodes are visited in post-order, children left to right before
   * their parent. */
  public Ast.Exp rewrite(Ast.Exp exp) {
    // Parent first, then children right to left; reversed, this list is
    // the post-order.
    final List<Ast.Exp> nodes = new ArrayList<>();
    final Deque<Ast.Exp> stack = new ArrayDeque<>();
    stack.push(exp);
    while (!stack.isEmpty()) {
      final Ast.Exp e = stack.pop();
      nodes.add(e);
      for (Ast.Exp child : e.children()) {
        stack.push(child);
      }
    }
    final List<Ast.Exp> results = new ArrayList<>();
    for (int i = nodes.size() - 1; i >= 0; i--) {
      final Ast.Exp node = nodes.get(i);
      final List<Ast.Exp> top =
          results.subList(results.size() - node.children().size(),
              results.size());
      final Ast.Exp node2 = node.withChildren(ImmutableList.copyOf(top));
      top.clear();
      results.add(node2.accept(this));
    }
    return results.get(0);
  }

  /** Visits an expression that is a direct child of a statement.
   * Sub-classes may override to treat such expressions differently from
   * expressions nested inside other expressions. */
  protected Ast.Exp visitExp(Ast.Exp exp) {
    return rewrite(exp);
  }

  protected List<Ast.Exp> visitExps(List<Ast.Exp> exps) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (Ast.Exp exp : exps) {
      list.add(visitExp(exp));
    }
    return list;
  }

  protected Ast.@Nullable Exp visitNullable(Ast.@Nullable Exp exp) {
    return exp == null ? null : visitExp(exp);
  }

  protected Ast.@Nullable Stmt visitNullable(Ast.@Nullable Stmt stmt) {
    return stmt == null ? null : stmt.accept(this);
  }

  // expressions, whose children have already been rewritten

  public Ast.Exp visit(Ast.Variable variable) {
    return variable;
  }

  public Ast.Exp visit(Ast.Literal literal) {
    return literal;
  }

  public Ast.Exp visit(Ast.Target target) {
    return target;
  }

  public Ast.Exp visit(Ast.Paren paren) {
    return paren;
  }

  public Ast.Exp visit(Ast.BinOp binOp) {
    return binOp;
  }

  public Ast.Exp visit(Ast.UnaryOp unaryOp) {
    return unaryOp;
  }

  public Ast.Exp visit(Ast.TernaryIf ternaryIf) {
    return ternaryIf;
  }

  public Ast.Exp visit(Ast.FunApp funApp) {
    return funApp;
  }

  public Ast.Exp visit(Ast.Indexed indexed) {
    return indexed;
  }

  public Ast.Exp visit(Ast.Container container) {
    return container;
  }

  // statements

  public Ast.Stmt visit(Ast.Assignment assignment) {
    return assignment.copy(visitExp(assignment.lhs), assignment.assignOp,
        visitExp(assignment.rhs));
  }

  public Ast.Stmt visit(Ast.NRFunApp nrFunApp) {
    return nrFunApp.copy(visitExps(nrFunApp.args));
  }

  public Ast.Stmt visit(Ast.TargetPE targetPE) {
    return targetPE.copy(targetPE.op, visitExp(targetPE.exp));
  }

  public Ast.Stmt visit(Ast.Tilde tilde) {
    return tilde.copy(visitExp(tilde.arg), tilde.distribution,
        visitExps(tilde.args), tilde.truncation.map(this::visitExp));
  }

  public Ast.Stmt visit(Ast.Print print) {
    return print.copy(visitExps(print.args));
  }

  public Ast.Stmt visit(Ast.Return ret) {
    return ret.copy(visitNullable(ret.exp));
  }

  public Ast.Stmt visit(Ast.IfThenElse ifThenElse) {
    return ifThenElse.copy(visitExp(ifThenElse.cond),
        ifThenElse.ifTrue.accept(this), visitNullable(ifThenElse.ifFalse));
  }

  public Ast.Stmt visit(Ast.While whileStmt) {
    return whileStmt.copy(visitExp(whileStmt.cond),
        whileStmt.body.accept(this));
  }

  public Ast.Stmt visit(Ast.For forStmt) {
    return forStmt.copy(visitExp(forStmt.lower),
        visitExp(forStmt.upper), forStmt.body.accept(this));
  }

  public Ast.Stmt visit(Ast.ForEach forEach) {
    return forEach.copy(visitExp(forEach.exp), forEach.body.accept(this));
  }

  public Ast.Stmt visit(Ast.Block block) {
    return block.copy(visitList(block.stmts));
  }

  public Ast.Stmt visit(Ast.Jump jump) {
    return jump;
  }

  public Ast.Stmt visit(Ast.VarDecl varDecl) {
    return varDecl.copy(varDecl.sizedType.map(this::visitExp),
        varDecl.transformation.map(this::visitExp),
        visitNullable(varDecl.initialValue));
  }

  public Ast.Stmt visit(Ast.FunDef funDef) {
    return funDef.copy(funDef.body.accept(this));
  }

  public Ast.Program visit(Ast.Program program) {
    final Map<Ast.BlockKind, List<Ast.Stmt>> blocks = new LinkedHashMap<>();
    program.blocks.forEach((kind, stmts) -> blocks.put(kind, visitList(stmts)));
    return program.copy(blocks);
  }
}

// End Shuttle.java
