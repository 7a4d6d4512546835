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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.AstNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the program produced
   * by a given pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, Canonicalizer.Pass pass,
      Consumer<Ast.Program> consumer) {
    final Canonicalizer.Pass expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onPass(Canonicalizer.Pass pass,
          Ast.Program program) {
        if (pass == expectedPass) {
          consumer.accept(program);
        }
        super.onPass(pass, program);
      }
    };
  }

  /** Returns a tracer that performs the given action on the source code
   * before and after each rewrite of a deprecated construct, then calls the
   * underlying tracer. The nodes are converted to source code only if a
   * tracer asks for them. */
  public static Tracer withOnRewrite(Tracer tracer,
      BiConsumer<String, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(AstNode before, AstNode after) {
        consumer.accept(before.toString(), after.toString());
        super.onRewrite(before, after);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPass(Canonicalizer.Pass pass,
        Ast.Program program) {
    }

    @Override public void onRewrite(AstNode before, AstNode after) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onPass(Canonicalizer.Pass pass,
        Ast.Program program) {
      tracer.onPass(pass, program);
    }

    @Override public void onRewrite(AstNode before, AstNode after) {
      tracer.onRewrite(before, after);
    }
  }
}

// End Tracers.java
