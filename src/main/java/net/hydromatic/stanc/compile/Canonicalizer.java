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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.eval.Prop;

/**
 * Rewrites Stan programs into canonical form.
 *
 * <p>There are two entry points, which run at different stages of the
 * front end:
 *
 * <ul>
 *   <li>{@link #repairSyntax} runs on the untyped program, straight after
 *       parsing, and fixes up the distinction between plain calls and calls
 *       with a conditioning bar;
 *   <li>{@link #canonicalize} runs on the type-checked program, replacing
 *       deprecated syntax and then normalizing parentheses.
 * </ul>
 *
 * <p>Each pass is a {@link net.hydromatic.stanc.ast.Shuttle}, and returns the
 * original node wherever it makes no change.
 */
public class Canonicalizer {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  /** Creates a Canonicalizer. */
  public Canonicalizer(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Canonicalizer with default properties and no tracing. */
  public static Canonicalizer create() {
    return new Canonicalizer(ImmutableMap.of(), Tracers.empty());
  }

  /** Fixes up function calls in an untyped program. */
  public Ast.Program repairSyntax(Ast.Program program) {
    final Ast.Program program2 = program.accept(new SyntaxRepairer());
    tracer.onPass(Pass.REPAIR_SYNTAX, program2);
    return program2;
  }

  /** Fixes up function calls in an untyped expression. */
  public Ast.Exp repairSyntax(Ast.Exp exp) {
    return new SyntaxRepairer().rewrite(exp);
  }

  /** Replaces deprecated syntax in a type-checked program. */
  public Ast.Program replaceDeprecated(Ast.Program program) {
    final Ast.Program program2 =
        program.accept(new DeprecationReplacer(tracer));
    tracer.onPass(Pass.REPLACE_DEPRECATED, program2);
    return program2;
  }

  /** Replaces deprecated syntax in a type-checked expression. */
  public Ast.Exp replaceDeprecated(Ast.Exp exp) {
    return new DeprecationReplacer(tracer).rewrite(exp);
  }

  /** Normalizes parentheses throughout a program. */
  public Ast.Program normalizeParens(Ast.Program program) {
    final Ast.Program program2 = program.accept(ParenNormalizer.INSTANCE);
    tracer.onPass(Pass.NORMALIZE_PARENS, program2);
    return program2;
  }

  /** Removes redundant parentheses from an expression that is not the
   * operand of an operator, such as a function argument. */
  public static Ast.Exp noParens(Ast.Exp exp) {
    return ParenNormalizer.noParens(exp);
  }

  /** Normalizes the parentheses of an expression that is the operand of an
   * operator. */
  public static Ast.Exp keepParens(Ast.Exp exp) {
    return ParenNormalizer.keepParens(exp);
  }

  /** Canonicalizes a type-checked program.
   *
   * <p>Replaces deprecated syntax, then, unless
   * {@link Prop#NORMALIZE_PARENS} is false, normalizes parentheses. */
  public Ast.Program canonicalize(Ast.Program program) {
    final Ast.Program program2 = replaceDeprecated(program);
    return Prop.NORMALIZE_PARENS.booleanValue(props)
        ? normalizeParens(program2)
        : program2;
  }

  /** Pass of the canonicalizer, reported to {@link Tracer#onPass}. */
  public enum Pass {
    REPAIR_SYNTAX,
    REPLACE_DEPRECATED,
    NORMALIZE_PARENS
  }
}

// End Canonicalizer.java
