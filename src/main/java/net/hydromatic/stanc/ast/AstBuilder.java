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
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stanc.mir.FunKind;
import net.hydromatic.stanc.mir.Index;
import net.hydromatic.stanc.mir.Operator;
import net.hydromatic.stanc.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>Expressions are created without a type, as the parser creates them;
 * use {@link Ast.Exp#withType} to simulate the type-checker. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  // expressions

  public Ast.Variable variable(Pos pos, String name) {
    return new Ast.Variable(pos, null, null, name);
  }

  public Ast.Literal intNumeral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.INT_NUMERAL, null, null, value);
  }

  public Ast.Literal realNumeral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.REAL_NUMERAL, null, null, value);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, null, null, value);
  }

  /** Creates the deprecated {@code get_lp()}. */
  public Ast.Target getLp(Pos pos) {
    return new Ast.Target(pos, Op.GET_LP, null, null);
  }

  public Ast.Target getTarget(Pos pos) {
    return new Ast.Target(pos, Op.GET_TARGET, null, null);
  }

  public Ast.Paren paren(Pos pos, Ast.Exp exp) {
    return new Ast.Paren(pos, exp.type, exp.adLevel, exp);
  }

  public Ast.BinOp binOp(Pos pos, Operator operator, Ast.Exp a0,
      Ast.Exp a1) {
    return new Ast.BinOp(pos, null, null, operator, a0, a1);
  }

  public Ast.UnaryOp prefixOp(Pos pos, Operator operator, Ast.Exp exp) {
    return new Ast.UnaryOp(pos, Op.PREFIX_OP, null, null, operator, exp);
  }

  public Ast.UnaryOp postfixOp(Pos pos, Operator operator, Ast.Exp exp) {
    return new Ast.UnaryOp(pos, Op.POSTFIX_OP, null, null, operator, exp);
  }

  public Ast.TernaryIf ternaryIf(Pos pos, Ast.Exp cond, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.TernaryIf(pos, null, null, cond, ifTrue, ifFalse);
  }

  /** Creates a function call, {@code f(a, b)}. */
  public Ast.FunApp funApp(Pos pos, FunKind funKind, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.FunApp(pos, Op.FUN_APP, null, null, funKind, name,
        ImmutableList.copyOf(args));
  }

  /** Creates a call with a conditioning bar, {@code f(y | a, b)}. */
  public Ast.FunApp condDistApp(Pos pos, FunKind funKind, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.FunApp(pos, Op.COND_DIST_APP, null, null, funKind, name,
        ImmutableList.copyOf(args));
  }

  public Ast.Indexed indexed(Pos pos, Ast.Exp exp,
      List<Index<Ast.Exp>> indices) {
    return new Ast.Indexed(pos, null, null, exp, ImmutableList.copyOf(indices));
  }

  /** Creates an array expression, {@code {a, b}}. */
  public Ast.Container arrayExpr(Pos pos, List<? extends Ast.Exp> elements) {
    return new Ast.Container(pos, Op.ARRAY_EXPR, null, null,
        ImmutableList.copyOf(elements));
  }

  /** Creates a row vector expression, {@code [a, b]}. */
  public Ast.Container rowVectorExpr(Pos pos,
      List<? extends Ast.Exp> elements) {
    return new Ast.Container(pos, Op.ROW_VECTOR_EXPR, null, null,
        ImmutableList.copyOf(elements));
  }

  // statements

  public Ast.Assignment assign(Pos pos, Ast.Exp lhs, Ast.AssignOp assignOp,
      Ast.Exp rhs) {
    return new Ast.Assignment(pos, lhs, assignOp, rhs);
  }

  public Ast.NRFunApp nrFunApp(Pos pos, FunKind funKind, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.NRFunApp(pos, funKind, name, ImmutableList.copyOf(args));
  }

  /** Creates {@code target += exp;}. */
  public Ast.TargetPE targetPE(Pos pos, Ast.Exp exp) {
    return new Ast.TargetPE(pos, Op.TARGET_PE, exp);
  }

  /** Creates the deprecated {@code increment_log_prob(exp);}. */
  public Ast.TargetPE incrementLogProb(Pos pos, Ast.Exp exp) {
    return new Ast.TargetPE(pos, Op.INCREMENT_LOG_PROB, exp);
  }

  public Ast.Tilde tilde(Pos pos, Ast.Exp arg, String distribution,
      List<? extends Ast.Exp> args, Ast.Truncation truncation) {
    return new Ast.Tilde(pos, arg, distribution, ImmutableList.copyOf(args),
        truncation);
  }

  public Ast.Print print(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Print(pos, Op.PRINT, ImmutableList.copyOf(args));
  }

  public Ast.Print reject(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Print(pos, Op.REJECT, ImmutableList.copyOf(args));
  }

  public Ast.Return ret(Pos pos, Ast.@Nullable Exp exp) {
    return new Ast.Return(pos, exp);
  }

  public Ast.IfThenElse ifThenElse(Pos pos, Ast.Exp cond, Ast.Stmt ifTrue,
      Ast.@Nullable Stmt ifFalse) {
    return new Ast.IfThenElse(pos, cond, ifTrue, ifFalse);
  }

  public Ast.While whileLoop(Pos pos, Ast.Exp cond, Ast.Stmt body) {
    return new Ast.While(pos, cond, body);
  }

  public Ast.For forLoop(Pos pos, String loopVariable, Ast.Exp lower,
      Ast.Exp upper, Ast.Stmt body) {
    return new Ast.For(pos, loopVariable, lower, upper, body);
  }

  public Ast.ForEach forEach(Pos pos, String loopVariable, Ast.Exp exp,
      Ast.Stmt body) {
    return new Ast.ForEach(pos, loopVariable, exp, body);
  }

  public Ast.Block block(Pos pos, List<? extends Ast.Stmt> stmts) {
    return new Ast.Block(pos, ImmutableList.copyOf(stmts));
  }

  public Ast.Jump skip(Pos pos) {
    return new Ast.Jump(pos, Op.SKIP);
  }

  public Ast.Jump breakStmt(Pos pos) {
    return new Ast.Jump(pos, Op.BREAK);
  }

  public Ast.Jump continueStmt(Pos pos) {
    return new Ast.Jump(pos, Op.CONTINUE);
  }

  /** Creates a sized type; {@code sizes} has one element for a vector, two
   * for a matrix. */
  public Ast.SizedType sizedType(PrimitiveType elementType,
      List<? extends Ast.Exp> sizes, List<? extends Ast.Exp> arrayDims) {
    return new Ast.SizedType(elementType, ImmutableList.copyOf(sizes),
        ImmutableList.copyOf(arrayDims));
  }

  /** Creates a scalar type, {@code int} or {@code real}. */
  public Ast.SizedType sizedType(PrimitiveType elementType) {
    return sizedType(elementType, ImmutableList.of(), ImmutableList.of());
  }

  public Ast.Transformation transformation(Ast.Transformation.Kind kind,
      List<? extends Ast.Exp> bounds) {
    return new Ast.Transformation(kind, ImmutableList.copyOf(bounds));
  }

  public Ast.VarDecl varDecl(Pos pos, Ast.SizedType sizedType,
      Ast.Transformation transformation, String identifier,
      Ast.@Nullable Exp initialValue) {
    return new Ast.VarDecl(pos, sizedType, transformation, identifier,
        initialValue);
  }

  public Ast.FunDef funDef(Pos pos, String returnType, String name,
      List<String> params, Ast.Stmt body) {
    return new Ast.FunDef(pos, returnType, name, ImmutableList.copyOf(params),
        body);
  }

  public Ast.Program program(Pos pos,
      Map<Ast.BlockKind, ? extends List<Ast.Stmt>> blocks) {
    final ImmutableSortedMap.Builder<Ast.BlockKind, List<Ast.Stmt>> b =
        ImmutableSortedMap.naturalOrder();
    blocks.forEach((kind, stmts) -> b.put(kind, ImmutableList.copyOf(stmts)));
    return new Ast.Program(pos, b.build());
  }
}

// End AstBuilder.java
