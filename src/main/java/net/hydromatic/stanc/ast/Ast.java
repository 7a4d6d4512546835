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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.stanc.mir.FunKind;
import net.hydromatic.stanc.mir.Index;
import net.hydromatic.stanc.mir.Operator;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.PrimitiveType;
import net.hydromatic.stanc.type.UnsizedType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes for the surface syntax of Stan. */
public class Ast {
  private Ast() {}

  /** Base class for an expression.
   *
   * <p>The parser creates expressions without a type; the type-checker
   * fills in {@link #type} and {@link #adLevel}. */
  public abstract static class Exp extends AstNode {
    public final @Nullable UnsizedType type;
    public final @Nullable AdLevel adLevel;

    Exp(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      super(pos, op);
      this.type = type;
      this.adLevel = adLevel;
    }

    @Override public abstract Exp accept(Shuttle shuttle);

    /** Returns a copy of this expression with a given type and autodiff
     * level. */
    public abstract Exp withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel);

    /** Returns whether the type of this expression is known to be
     * {@code real}. */
    public boolean isRealType() {
      return type != null && type.isRealType();
    }

    /** Returns the sub-expressions of this expression, left to right. The
     * sub-expressions of an indexed expression are its base followed by
     * the bounds of each index. */
    public List<Exp> children() {
      return ImmutableList.of();
    }

    /** Returns a copy of this expression with new sub-expressions, or
     * {@code this} if they are the same. The list must have as many
     * elements as {@link #children()}. */
    public Exp withChildren(List<Exp> children) {
      checkArgument(children.isEmpty());
      return this;
    }
  }

  /** Reference to a variable. */
  public static class Variable extends Exp {
    public final String name;

    Variable(Pos pos, @Nullable UnsizedType type, @Nullable AdLevel adLevel,
        String name) {
      super(pos, Op.VARIABLE, type, adLevel);
      this.name = requireNonNull(name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(name);
    }

    @Override public Variable withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Variable(pos, type, adLevel, name);
    }
  }

  /** Numeric or string literal, held as text exactly as written. */
  public static class Literal extends Exp {
    public final String value;

    Literal(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel, String value) {
      super(pos, op, type, adLevel);
      this.value = requireNonNull(value);
      checkArgument(op == Op.INT_NUMERAL
          || op == Op.REAL_NUMERAL
          || op == Op.STRING_LITERAL);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return op == Op.STRING_LITERAL
          ? w.append("\"").append(value).append("\"")
          : w.append(value);
    }

    @Override public Literal withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Literal(pos, op, type, adLevel, value);
    }
  }

  /** Read of the log density accumulator, {@code get_lp()}
   * ({@link Op#GET_LP}, deprecated) or {@code target()}
   * ({@link Op#GET_TARGET}). */
  public static class Target extends Exp {
    Target(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      super(pos, op, type, adLevel);
      checkArgument(op == Op.GET_LP || op == Op.GET_TARGET);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword);
    }

    @Override public Target withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Target(pos, op, type, adLevel);
    }

    /** Returns a copy of this node with a different kind. */
    public Target copy(Op op) {
      return op == this.op ? this : new Target(pos, op, type, adLevel);
    }
  }

  /** Parenthesized expression. */
  public static class Paren extends Exp {
    public final Exp exp;

    Paren(Pos pos, @Nullable UnsizedType type, @Nullable AdLevel adLevel,
        Exp exp) {
      super(pos, Op.PAREN, type, adLevel);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("(").append(exp).append(")");
    }

    @Override public Paren withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Paren(pos, type, adLevel, exp);
    }

    @Override public List<Exp> children() {
      return ImmutableList.of(exp);
    }

    @Override public Paren withChildren(List<Exp> children) {
      checkArgument(children.size() == 1);
      return copy(children.get(0));
    }

    public Paren copy(Exp exp) {
      return exp == this.exp ? this : new Paren(pos, type, adLevel, exp);
    }
  }

  /** Call to a binary operator. */
  public static class BinOp extends Exp {
    public final Operator operator;
    public final Exp a0;
    public final Exp a1;

    BinOp(Pos pos, @Nullable UnsizedType type, @Nullable AdLevel adLevel,
        Operator operator, Exp a0, Exp a1) {
      super(pos, Op.BIN_OP, type, adLevel);
      this.operator = requireNonNull(operator);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.binary(a0, " " + operator.symbol + " ", a1);
    }

    @Override public BinOp withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new BinOp(pos, type, adLevel, operator, a0, a1);
    }

    @Override public List<Exp> children() {
      return ImmutableList.of(a0, a1);
    }

    @Override public BinOp withChildren(List<Exp> children) {
      checkArgument(children.size() == 2);
      return copy(children.get(0), children.get(1));
    }

    /** Creates a copy of this {@code BinOp} with given operands,
     * or {@code this} if the operands are the same. */
    public BinOp copy(Exp a0, Exp a1) {
      return a0 == this.a0 && a1 == this.a1
          ? this
          : new BinOp(pos, type, adLevel, operator, a0, a1);
    }
  }

  /** Call to a prefix ({@link Op#PREFIX_OP}) or postfix
   * ({@link Op#POSTFIX_OP}) operator. */
  public static class UnaryOp extends Exp {
    public final Operator operator;
    public final Exp exp;

    UnaryOp(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel, Operator operator, Exp exp) {
      super(pos, op, type, adLevel);
      this.operator = requireNonNull(operator);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.PREFIX_OP || op == Op.POSTFIX_OP);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return op == Op.PREFIX_OP
          ? w.append(operator.symbol).append(exp)
          : w.append(exp).append(operator.symbol);
    }

    @Override public UnaryOp withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new UnaryOp(pos, op, type, adLevel, operator, exp);
    }

    @Override public List<Exp> children() {
      return ImmutableList.of(exp);
    }

    @Override public UnaryOp withChildren(List<Exp> children) {
      checkArgument(children.size() == 1);
      return copy(children.get(0));
    }

    public UnaryOp copy(Exp exp) {
      return exp == this.exp
          ? this
          : new UnaryOp(pos, op, type, adLevel, operator, exp);
    }
  }

  /** Conditional expression, {@code cond ? ifTrue : ifFalse}. */
  public static class TernaryIf extends Exp {
    public final Exp cond;
    public final Exp ifTrue;
    public final Exp ifFalse;

    TernaryIf(Pos pos, @Nullable UnsizedType type, @Nullable AdLevel adLevel,
        Exp cond, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.TERNARY_IF, type, adLevel);
      this.cond = requireNonNull(cond);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.binary(cond, " ? ", ifTrue).append(" : ").append(ifFalse);
    }

    @Override public TernaryIf withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new TernaryIf(pos, type, adLevel, cond, ifTrue, ifFalse);
    }

    @Override public List<Exp> children() {
      return ImmutableList.of(cond, ifTrue, ifFalse);
    }

    @Override public TernaryIf withChildren(List<Exp> children) {
      checkArgument(children.size() == 3);
      return copy(children.get(0), children.get(1), children.get(2));
    }

    public TernaryIf copy(Exp cond, Exp ifTrue, Exp ifFalse) {
      return cond == this.cond && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : new TernaryIf(pos, type, adLevel, cond, ifTrue, ifFalse);
    }
  }

  /** Call to a function ({@link Op#FUN_APP}) or to a density or mass
   * function with a conditioning bar ({@link Op#COND_DIST_APP}). */
  public static class FunApp extends Exp {
    public final FunKind funKind;
    public final String name;
    public final List<Exp> args;

    FunApp(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel, FunKind funKind, String name,
        ImmutableList<Exp> args) {
      super(pos, op, type, adLevel);
      this.funKind = requireNonNull(funKind);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      checkArgument(op == Op.FUN_APP || op == Op.COND_DIST_APP);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.call(name, args, op == Op.COND_DIST_APP);
    }

    @Override public FunApp withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new FunApp(pos, op, type, adLevel, funKind, name,
          ImmutableList.copyOf(args));
    }

    /** Returns whether this is a call to a given library function. */
    public boolean isStanLib(String name) {
      return funKind == FunKind.STAN_LIB && this.name.equals(name);
    }

    @Override public List<Exp> children() {
      return args;
    }

    @Override public FunApp withChildren(List<Exp> children) {
      checkArgument(children.size() == args.size());
      return copy(op, name, children);
    }

    public FunApp copy(Op op, String name, List<Exp> args) {
      return op == this.op && name.equals(this.name) && args.equals(this.args)
          ? this
          : new FunApp(pos, op, type, adLevel, funKind, name,
              ImmutableList.copyOf(args));
    }
  }

  /** Indexed expression, such as {@code x[i, 2:3]}. */
  public static class Indexed extends Exp {
    public final Exp exp;
    public final List<Index<Exp>> indices;

    Indexed(Pos pos, @Nullable UnsizedType type, @Nullable AdLevel adLevel,
        Exp exp, ImmutableList<Index<Exp>> indices) {
      super(pos, Op.INDEXED, type, adLevel);
      this.exp = requireNonNull(exp);
      this.indices = requireNonNull(indices);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append(exp).append("[");
      for (int i = 0; i < indices.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.index(indices.get(i));
      }
      return w.append("]");
    }

    @Override public Indexed withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Indexed(pos, type, adLevel, exp,
          ImmutableList.copyOf(indices));
    }

    @Override public List<Exp> children() {
      final ImmutableList.Builder<Exp> list = ImmutableList.builder();
      list.add(exp);
      for (Index<Exp> index : indices) {
        list.addAll(index.bounds());
      }
      return list.build();
    }

    @Override public Indexed withChildren(List<Exp> children) {
      final Iterator<Exp> iterator = children.iterator();
      final Exp exp = iterator.next();
      final List<Index<Exp>> indices = new ArrayList<>();
      for (Index<Exp> index : this.indices) {
        indices.add(index.map(bound -> iterator.next()));
      }
      checkArgument(!iterator.hasNext());
      return copy(exp, indices);
    }

    public Indexed copy(Exp exp, List<Index<Exp>> indices) {
      return exp == this.exp && indices.equals(this.indices)
          ? this
          : new Indexed(pos, type, adLevel, exp, ImmutableList.copyOf(indices));
    }
  }

  /** Array expression {@code {a, b}} ({@link Op#ARRAY_EXPR}) or row vector
   * expression {@code [a, b]} ({@link Op#ROW_VECTOR_EXPR}). */
  public static class Container extends Exp {
    public final List<Exp> elements;

    Container(Pos pos, Op op, @Nullable UnsizedType type,
        @Nullable AdLevel adLevel, ImmutableList<Exp> elements) {
      super(pos, op, type, adLevel);
      this.elements = requireNonNull(elements);
      checkArgument(op == Op.ARRAY_EXPR || op == Op.ROW_VECTOR_EXPR);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      final boolean array = op == Op.ARRAY_EXPR;
      return w.append(array ? "{" : "[")
          .appendAll(elements, ", ")
          .append(array ? "}" : "]");
    }

    @Override public Container withType(@Nullable UnsizedType type,
        @Nullable AdLevel adLevel) {
      return new Container(pos, op, type, adLevel,
          ImmutableList.copyOf(elements));
    }

    @Override public List<Exp> children() {
      return elements;
    }

    @Override public Container withChildren(List<Exp> children) {
      checkArgument(children.size() == elements.size());
      return copy(children);
    }

    public Container copy(List<Exp> elements) {
      return elements.equals(this.elements)
          ? this
          : new Container(pos, op, type, adLevel,
              ImmutableList.copyOf(elements));
    }
  }

  /** Base class for a statement. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Stmt accept(Shuttle shuttle);
  }

  /** Assignment operator. */
  public enum AssignOp {
    ASSIGN("="),
    /** Deprecated. */
    ARROW_ASSIGN("<-"),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),
    TIMES_ASSIGN("*="),
    DIVIDE_ASSIGN("/="),
    ELT_TIMES_ASSIGN(".*="),
    ELT_DIVIDE_ASSIGN("./=");

    public final String symbol;

    AssignOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Assignment statement, such as {@code x[i] = e;} or {@code x += e;}. */
  public static class Assignment extends Stmt {
    /** Variable or indexed variable being assigned. */
    public final Exp lhs;
    public final AssignOp assignOp;
    public final Exp rhs;

    Assignment(Pos pos, Exp lhs, AssignOp assignOp, Exp rhs) {
      super(pos, Op.ASSIGNMENT);
      this.lhs = requireNonNull(lhs);
      this.assignOp = requireNonNull(assignOp);
      this.rhs = requireNonNull(rhs);
      checkArgument(lhs.op == Op.VARIABLE || lhs.op == Op.INDEXED,
          "not assignable: %s", lhs);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.binary(lhs, " " + assignOp.symbol + " ", rhs).append(";");
    }

    public Assignment copy(Exp lhs, AssignOp assignOp, Exp rhs) {
      return lhs == this.lhs && assignOp == this.assignOp && rhs == this.rhs
          ? this
          : new Assignment(pos, lhs, assignOp, rhs);
    }
  }

  /** Call to a function that returns no value, as a statement. */
  public static class NRFunApp extends Stmt {
    public final FunKind funKind;
    public final String name;
    public final List<Exp> args;

    NRFunApp(Pos pos, FunKind funKind, String name, ImmutableList<Exp> args) {
      super(pos, Op.NR_FUN_APP);
      this.funKind = requireNonNull(funKind);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.call(name, args, false).append(";");
    }

    public NRFunApp copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new NRFunApp(pos, funKind, name, ImmutableList.copyOf(args));
    }
  }

  /** Increment of the log density, {@code target += e;}
   * ({@link Op#TARGET_PE}) or the deprecated
   * {@code increment_log_prob(e);} ({@link Op#INCREMENT_LOG_PROB}). */
  public static class TargetPE extends Stmt {
    public final Exp exp;

    TargetPE(Pos pos, Op op, Exp exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.TARGET_PE || op == Op.INCREMENT_LOG_PROB);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return op == Op.TARGET_PE
          ? w.append("target += ").append(exp).append(";")
          : w.append("increment_log_prob(").append(exp).append(");");
    }

    public TargetPE copy(Op op, Exp exp) {
      return op == this.op && exp == this.exp
          ? this
          : new TargetPE(pos, op, exp);
    }
  }

  /** Truncation of a sampling statement, such as {@code T[0, ]}. */
  public static class Truncation {
    public static final Truncation NONE =
        new Truncation(Kind.NONE, null, null);

    public final Kind kind;
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;

    private Truncation(Kind kind, @Nullable Exp lower, @Nullable Exp upper) {
      this.kind = requireNonNull(kind);
      this.lower = lower;
      this.upper = upper;
    }

    public static Truncation lower(Exp lower) {
      return new Truncation(Kind.LOWER, requireNonNull(lower), null);
    }

    public static Truncation upper(Exp upper) {
      return new Truncation(Kind.UPPER, null, requireNonNull(upper));
    }

    public static Truncation both(Exp lower, Exp upper) {
      return new Truncation(Kind.BOTH, requireNonNull(lower),
          requireNonNull(upper));
    }

    /** Applies a function to each bound. */
    public Truncation map(UnaryOperator<Exp> fn) {
      if (kind == Kind.NONE) {
        return this;
      }
      final @Nullable Exp lower2 = lower == null ? null : fn.apply(lower);
      final @Nullable Exp upper2 = upper == null ? null : fn.apply(upper);
      return lower2 == lower && upper2 == upper
          ? this
          : new Truncation(kind, lower2, upper2);
    }

    AstWriter unparse(AstWriter w) {
      if (kind == Kind.NONE) {
        return w;
      }
      w.append(" T[");
      if (lower != null) {
        w.append(lower);
      }
      w.append(", ");
      if (upper != null) {
        w.append(upper);
      }
      return w.append("]");
    }

    /** Which bounds a truncation has. */
    public enum Kind {
      NONE, LOWER, UPPER, BOTH
    }
  }

  /** Sampling statement, such as {@code y ~ normal(mu, sigma) T[0, ];}. */
  public static class Tilde extends Stmt {
    public final Exp arg;
    /** Name of the distribution family, such as "normal". */
    public final String distribution;
    public final List<Exp> args;
    public final Truncation truncation;

    Tilde(Pos pos, Exp arg, String distribution, ImmutableList<Exp> args,
        Truncation truncation) {
      super(pos, Op.TILDE);
      this.arg = requireNonNull(arg);
      this.distribution = requireNonNull(distribution);
      this.args = requireNonNull(args);
      this.truncation = requireNonNull(truncation);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append(arg).append(" ~ ").call(distribution, args, false);
      return truncation.unparse(w).append(";");
    }

    public Tilde copy(Exp arg, String distribution, List<Exp> args,
        Truncation truncation) {
      return arg == this.arg
          && distribution.equals(this.distribution)
          && args.equals(this.args)
          && truncation == this.truncation
          ? this
          : new Tilde(pos, arg, distribution, ImmutableList.copyOf(args),
              truncation);
    }
  }

  /** Statement that takes a list of printables: {@code print(...)}
   * ({@link Op#PRINT}) or {@code reject(...)} ({@link Op#REJECT}). */
  public static class Print extends Stmt {
    public final List<Exp> args;

    Print(Pos pos, Op op, ImmutableList<Exp> args) {
      super(pos, op);
      this.args = requireNonNull(args);
      checkArgument(op == Op.PRINT || op == Op.REJECT);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.call(op.keyword, args, false).append(";");
    }

    public Print copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Print(pos, op, ImmutableList.copyOf(args));
    }
  }

  /** Return statement, with or without a value. */
  public static class Return extends Stmt {
    public final @Nullable Exp exp;

    Return(Pos pos, @Nullable Exp exp) {
      super(pos, Op.RETURN);
      this.exp = exp;
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return exp == null
          ? w.append("return;")
          : w.append("return ").append(exp).append(";");
    }

    public Return copy(@Nullable Exp exp) {
      return exp == this.exp ? this : new Return(pos, exp);
    }
  }

  /** "if" statement, with an optional "else" branch. */
  public static class IfThenElse extends Stmt {
    public final Exp cond;
    public final Stmt ifTrue;
    public final @Nullable Stmt ifFalse;

    IfThenElse(Pos pos, Exp cond, Stmt ifTrue, @Nullable Stmt ifFalse) {
      super(pos, Op.IF_THEN_ELSE);
      this.cond = requireNonNull(cond);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("if (").append(cond).append(") ").append(ifTrue);
      return ifFalse == null ? w : w.append(" else ").append(ifFalse);
    }

    public IfThenElse copy(Exp cond, Stmt ifTrue, @Nullable Stmt ifFalse) {
      return cond == this.cond && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : new IfThenElse(pos, cond, ifTrue, ifFalse);
    }
  }

  /** "while" loop. */
  public static class While extends Stmt {
    public final Exp cond;
    public final Stmt body;

    While(Pos pos, Exp cond, Stmt body) {
      super(pos, Op.WHILE);
      this.cond = requireNonNull(cond);
      this.body = requireNonNull(body);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("while (").append(cond).append(") ").append(body);
    }

    public While copy(Exp cond, Stmt body) {
      return cond == this.cond && body == this.body
          ? this
          : new While(pos, cond, body);
    }
  }

  /** "for" loop over a range, {@code for (i in lower:upper) body}. */
  public static class For extends Stmt {
    public final String loopVariable;
    public final Exp lower;
    public final Exp upper;
    public final Stmt body;

    For(Pos pos, String loopVariable, Exp lower, Exp upper, Stmt body) {
      super(pos, Op.FOR);
      this.loopVariable = requireNonNull(loopVariable);
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
      this.body = requireNonNull(body);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("for (").append(loopVariable).append(" in ")
          .binary(lower, ":", upper).append(") ").append(body);
    }

    public For copy(Exp lower, Exp upper, Stmt body) {
      return lower == this.lower && upper == this.upper && body == this.body
          ? this
          : new For(pos, loopVariable, lower, upper, body);
    }
  }

  /** "for" loop over the elements of a container,
   * {@code for (x in e) body}. */
  public static class ForEach extends Stmt {
    public final String loopVariable;
    public final Exp exp;
    public final Stmt body;

    ForEach(Pos pos, String loopVariable, Exp exp, Stmt body) {
      super(pos, Op.FOR_EACH);
      this.loopVariable = requireNonNull(loopVariable);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("for (").append(loopVariable).append(" in ")
          .append(exp).append(") ").append(body);
    }

    public ForEach copy(Exp exp, Stmt body) {
      return exp == this.exp && body == this.body
          ? this
          : new ForEach(pos, loopVariable, exp, body);
    }
  }

  /** Block of statements, {@code { s1 s2 }}. */
  public static class Block extends Stmt {
    public final List<Stmt> stmts;

    Block(Pos pos, ImmutableList<Stmt> stmts) {
      super(pos, Op.BLOCK);
      this.stmts = requireNonNull(stmts);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("{").indented(stmts).append("}");
    }

    public Block copy(List<Stmt> stmts) {
      return stmts.equals(this.stmts)
          ? this
          : new Block(pos, ImmutableList.copyOf(stmts));
    }
  }

  /** Statement with no content: {@code ;} ({@link Op#SKIP}),
   * {@code break;} ({@link Op#BREAK}) or {@code continue;}
   * ({@link Op#CONTINUE}). */
  public static class Jump extends Stmt {
    Jump(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.SKIP || op == Op.BREAK || op == Op.CONTINUE);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword);
    }
  }

  /** Type of a declared variable, with sizes; for example
   * {@code array[N] vector[K]}. */
  public static class SizedType {
    public final PrimitiveType elementType;
    /** Sizes of the element type: one for a vector or row vector, two for a
     * matrix, none for a scalar. */
    public final List<Exp> sizes;
    /** Sizes of the array dimensions, outermost first; empty if not an
     * array. */
    public final List<Exp> arrayDims;

    SizedType(PrimitiveType elementType, ImmutableList<Exp> sizes,
        ImmutableList<Exp> arrayDims) {
      this.elementType = requireNonNull(elementType);
      this.sizes = requireNonNull(sizes);
      this.arrayDims = requireNonNull(arrayDims);
    }

    /** Applies a function to each size expression. */
    public SizedType map(UnaryOperator<Exp> fn) {
      final ImmutableList<Exp> sizes2 =
          ImmutableList.copyOf(sizes.stream().map(fn).iterator());
      final ImmutableList<Exp> arrayDims2 =
          ImmutableList.copyOf(arrayDims.stream().map(fn).iterator());
      return sizes2.equals(sizes) && arrayDims2.equals(arrayDims)
          ? this
          : new SizedType(elementType, sizes2, arrayDims2);
    }
  }

  /** Constraint on a declared variable, such as {@code <lower=0>}. */
  public static class Transformation {
    public static final Transformation IDENTITY =
        new Transformation(Kind.IDENTITY, ImmutableList.of());

    public final Kind kind;
    public final List<Exp> bounds;

    Transformation(Kind kind, ImmutableList<Exp> bounds) {
      this.kind = requireNonNull(kind);
      this.bounds = requireNonNull(bounds);
      checkArgument(bounds.size() == kind.boundNames.size(),
          "expected %s bounds for %s", kind.boundNames.size(), kind);
    }

    /** Applies a function to each bound. */
    public Transformation map(UnaryOperator<Exp> fn) {
      final ImmutableList<Exp> bounds2 =
          ImmutableList.copyOf(bounds.stream().map(fn).iterator());
      return bounds2.equals(bounds) ? this : new Transformation(kind, bounds2);
    }

    AstWriter unparse(AstWriter w) {
      if (kind == Kind.IDENTITY) {
        return w;
      }
      w.append("<");
      for (int i = 0; i < bounds.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(kind.boundNames.get(i)).append("=").append(bounds.get(i));
      }
      return w.append(">");
    }

    /** Kind of transformation. */
    public enum Kind {
      IDENTITY(),
      LOWER("lower"),
      UPPER("upper"),
      LOWER_UPPER("lower", "upper"),
      OFFSET("offset"),
      MULTIPLIER("multiplier"),
      OFFSET_MULTIPLIER("offset", "multiplier");

      public final List<String> boundNames;

      Kind(String... boundNames) {
        this.boundNames = ImmutableList.copyOf(boundNames);
      }
    }
  }

  /** Variable declaration, such as {@code real<lower=0> sigma = 1;}. */
  public static class VarDecl extends Stmt {
    public final SizedType sizedType;
    public final Transformation transformation;
    public final String identifier;
    public final @Nullable Exp initialValue;

    VarDecl(Pos pos, SizedType sizedType, Transformation transformation,
        String identifier, @Nullable Exp initialValue) {
      super(pos, Op.VAR_DECL);
      this.sizedType = requireNonNull(sizedType);
      this.transformation = requireNonNull(transformation);
      this.identifier = requireNonNull(identifier);
      this.initialValue = initialValue;
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      // Stan writes the constraint between the element type and its sizes,
      // as in "vector<lower=0>[K] x".
      if (!sizedType.arrayDims.isEmpty()) {
        w.append("array[").appendAll(sizedType.arrayDims, ", ").append("] ");
      }
      w.append(sizedType.elementType.stanName);
      transformation.unparse(w);
      if (!sizedType.sizes.isEmpty()) {
        w.append("[").appendAll(sizedType.sizes, ", ").append("]");
      }
      w.append(" ").append(identifier);
      if (initialValue != null) {
        w.append(" = ").append(initialValue);
      }
      return w.append(";");
    }

    public VarDecl copy(SizedType sizedType, Transformation transformation,
        @Nullable Exp initialValue) {
      return sizedType == this.sizedType
          && transformation == this.transformation
          && initialValue == this.initialValue
          ? this
          : new VarDecl(pos, sizedType, transformation, identifier,
              initialValue);
    }
  }

  /** Definition of a user-defined function, such as
   * {@code real f(real x) { return x; }}. */
  public static class FunDef extends Stmt {
    public final String returnType;
    public final String name;
    /** Parameter declarations, such as "data real x". */
    public final List<String> params;
    public final Stmt body;

    FunDef(Pos pos, String returnType, String name,
        ImmutableList<String> params, Stmt body) {
      super(pos, Op.FUN_DEF);
      this.returnType = requireNonNull(returnType);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(returnType).append(" ").append(name).append("(")
          .append(String.join(", ", params)).append(") ").append(body);
    }

    public FunDef copy(Stmt body) {
      return body == this.body
          ? this
          : new FunDef(pos, returnType, name, ImmutableList.copyOf(params),
              body);
    }
  }

  /** Block of a Stan program. */
  public enum BlockKind {
    FUNCTIONS("functions"),
    DATA("data"),
    TRANSFORMED_DATA("transformed data"),
    PARAMETERS("parameters"),
    TRANSFORMED_PARAMETERS("transformed parameters"),
    MODEL("model"),
    GENERATED_QUANTITIES("generated quantities");

    public final String blockName;

    BlockKind(String blockName) {
      this.blockName = blockName;
    }
  }

  /** Stan program: a sequence of optional blocks, each a list of
   * statements. */
  public static class Program extends AstNode {
    /** The blocks that are present, in the order Stan requires. */
    public final ImmutableSortedMap<BlockKind, List<Stmt>> blocks;

    Program(Pos pos, ImmutableSortedMap<BlockKind, List<Stmt>> blocks) {
      super(pos, Op.PROGRAM);
      this.blocks = requireNonNull(blocks);
    }

    @Override public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      blocks.forEach((kind, stmts) ->
          w.append(kind.blockName).append(" {").indented(stmts).append("}")
              .newline());
      return w;
    }

    /** Returns the statements of a block, or null if the block is
     * absent. */
    public @Nullable List<Stmt> block(BlockKind kind) {
      return blocks.get(kind);
    }

    public Program copy(Map<BlockKind, List<Stmt>> blocks) {
      if (blocks.equals(this.blocks)) {
        return this;
      }
      final ImmutableSortedMap.Builder<BlockKind, List<Stmt>> b =
          ImmutableSortedMap.naturalOrder();
      blocks.forEach((kind, stmts) -> b.put(kind, ImmutableList.copyOf(stmts)));
      return new Program(pos, b.build());
    }
  }
}

// End Ast.java
