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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tracers} and {@link CompileException}. */
public class TracersTest {
  private static final Ast.Program EMPTY =
      ast.program(Pos.ZERO, ImmutableMap.of());

  @Test void testEmpty() {
    final Tracer tracer = Tracers.empty();
    tracer.onPass(Canonicalizer.Pass.NORMALIZE_PARENS, EMPTY);
    tracer.onRewrite(ast.getLp(Pos.ZERO), ast.getTarget(Pos.ZERO));
  }

  /** Tracers stack; each handles its own events and passes all events to
   * the tracer beneath it. */
  @Test void testChain() {
    final List<String> events = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPass(
            Tracers.withOnRewrite(Tracers.empty(),
                (before, after) -> events.add(before + "->" + after)),
            Canonicalizer.Pass.REPAIR_SYNTAX,
            program -> events.add("repaired"));
    tracer.onPass(Canonicalizer.Pass.REPAIR_SYNTAX, EMPTY);
    tracer.onPass(Canonicalizer.Pass.NORMALIZE_PARENS, EMPTY);
    final Ast.Exp x = ast.variable(Pos.ZERO, "x");
    final Ast.Exp y = ast.variable(Pos.ZERO, "y");
    tracer.onRewrite(ast.assign(Pos.ZERO, x, Ast.AssignOp.ARROW_ASSIGN, y),
        ast.assign(Pos.ZERO, x, Ast.AssignOp.ASSIGN, y));
    assertThat(events, contains("repaired", "x <- y;->x = y;"));
  }

  @Test void testOnPass() {
    final List<Ast.Program> programs = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPass(Tracers.empty(),
            Canonicalizer.Pass.REPLACE_DEPRECATED, programs::add);
    final Canonicalizer canonicalizer =
        new Canonicalizer(ImmutableMap.of(), tracer);
    canonicalizer.repairSyntax(EMPTY);
    assertThat(programs, empty());
    canonicalizer.canonicalize(EMPTY);
    assertThat(programs.size(), is(1));
  }

  @Test void testCompileException() {
    final Pos pos = Pos.of("model.stan", 3, 5, 9);
    final CompileException e = new CompileException("duplicate label", pos);
    assertThat(e.pos(), is(pos));
    assertThat(e.getMessage(), is("duplicate label"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is(pos.describeTo(new StringBuilder()) + " Error: duplicate label"));
    assertThat(e.toString(),
        is(CompileException.class.getName() + ": duplicate label at " + pos));
  }
}

// End TracersTest.java
