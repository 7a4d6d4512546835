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
import static net.hydromatic.stanc.ast.AstBuilder.ast;

import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.AstNode;
import net.hydromatic.stanc.ast.Op;
import net.hydromatic.stanc.ast.Shuttle;
import net.hydromatic.stanc.mir.FunKind;

/** Shuttle that replaces deprecated constructs in a type-checked program
 * with their modern equivalents.
 *
 * <ul>
 *   <li>{@code get_lp()} &rarr; {@code target()}
 *   <li>{@code abs(x)}, {@code x} real &rarr; {@code fabs(x)}
 *   <li>{@code if_else(c, t, e)} &rarr; {@code ((c) ? t : e)}
 *   <li>{@code normal_log(y, mu, sigma)} &rarr;
 *       {@code normal_lpdf(y | mu, sigma)}, and likewise "_cdf_log" and
 *       "_ccdf_log"
 *   <li>{@code multiply_log}, {@code binomial_coefficient_log},
 *       {@code integrate_ode} &rarr; {@code lmultiply}, {@code lchoose},
 *       {@code integrate_ode_rk45}
 *   <li>{@code increment_log_prob(e);} &rarr; {@code target += e;}
 *   <li>{@code x <- e;} &rarr; {@code x = e;}
 * </ul>
 *
 * <p>Assumes that {@link SyntaxRepairer} has already run.
 */
class DeprecationReplacer extends Shuttle {
  private final Tracer tracer;

  DeprecationReplacer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  private <N extends AstNode> N rewrote(AstNode before, N after) {
    tracer.onRewrite(before, after);
    return after;
  }

  @Override public Ast.Exp visit(Ast.Target target) {
    return target.op == Op.GET_LP
        ? rewrote(target, target.copy(Op.GET_TARGET))
        : target;
  }

  @Override public Ast.Exp visit(Ast.FunApp funApp) {
    if (funApp.op != Op.FUN_APP || funApp.funKind != FunKind.STAN_LIB) {
      return funApp;
    }
    if (funApp.name.equals("abs")
        && funApp.args.size() == 1
        && funApp.args.get(0).isRealType()) {
      return rewrote(funApp, funApp.copy(Op.FUN_APP, "fabs", funApp.args));
    }
    if (funApp.name.equals("if_else") && funApp.args.size() == 3) {
      final Ast.Exp cond = funApp.args.get(0);
      final Ast.Exp ternaryIf =
          ast.ternaryIf(funApp.pos, ast.paren(cond.pos, cond),
                  funApp.args.get(1), funApp.args.get(2))
              .withType(funApp.type, funApp.adLevel);
      return rewrote(funApp,
          ast.paren(funApp.pos, ternaryIf)
              .withType(funApp.type, funApp.adLevel));
    }
    if (DeprecatedNames.isDeprecatedDistribution(funApp.name)) {
      return rewrote(funApp,
          funApp.copy(Op.COND_DIST_APP,
              DeprecatedNames.renameDistribution(funApp.name), funApp.args));
    }
    final String name = DeprecatedNames.renameFunction(funApp.name);
    return name.equals(funApp.name)
        ? funApp
        : rewrote(funApp, funApp.copy(Op.FUN_APP, name, funApp.args));
  }

  @Override public Ast.Stmt visit(Ast.TargetPE targetPE) {
    final Ast.TargetPE targetPE2 = (Ast.TargetPE) super.visit(targetPE);
    return targetPE2.op == Op.INCREMENT_LOG_PROB
        ? rewrote(targetPE2, targetPE2.copy(Op.TARGET_PE, targetPE2.exp))
        : targetPE2;
  }

  @Override public Ast.Stmt visit(Ast.Assignment assignment) {
    final Ast.Assignment assignment2 =
        (Ast.Assignment) super.visit(assignment);
    return assignment2.assignOp == Ast.AssignOp.ARROW_ASSIGN
        ? rewrote(assignment2,
            assignment2.copy(assignment2.lhs, Ast.AssignOp.ASSIGN,
                assignment2.rhs))
        : assignment2;
  }
}

// End DeprecationReplacer.java
