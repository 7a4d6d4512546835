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

import static net.hydromatic.stanc.compile.DeprecatedNames.hasDistributionSuffix;
import static net.hydromatic.stanc.compile.DeprecatedNames.withoutSuffix;

import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.Op;
import net.hydromatic.stanc.ast.Shuttle;

/** Shuttle that repairs the syntax of an untyped program.
 *
 * <ul>
 *   <li>A call to a function whose name ends with "_lpdf", "_lpmf",
 *       "_lcdf" or "_lccdf" becomes a call with a conditioning bar,
 *       and a call with a conditioning bar to any other function becomes a
 *       plain call;
 *   <li>The distribution of a sampling statement loses its "_lpdf" or
 *       "_lpmf" suffix, because the statement names a family, not a
 *       function.
 * </ul>
 */
class SyntaxRepairer extends Shuttle {
  @Override public Ast.Exp visit(Ast.FunApp funApp) {
    final boolean suffix = hasDistributionSuffix(funApp.name);
    final Op op =
        funApp.op == Op.FUN_APP && suffix ? Op.COND_DIST_APP
            : funApp.op == Op.COND_DIST_APP && !suffix ? Op.FUN_APP
            : funApp.op;
    return funApp.copy(op, funApp.name, funApp.args);
  }

  @Override public Ast.Stmt visit(Ast.Tilde tilde) {
    return tilde.copy(visitExp(tilde.arg), withoutSuffix(tilde.distribution),
        visitExps(tilde.args), tilde.truncation.map(this::visitExp));
  }
}

// End SyntaxRepairer.java
