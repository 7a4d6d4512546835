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

import net.hydromatic.stanc.ast.Ast;
import net.hydromatic.stanc.ast.AstNode;

/** Called on various events during canonicalization. */
public interface Tracer {
  /** Called with the program that a pass has produced. */
  void onPass(Canonicalizer.Pass pass, Ast.Program program);

  /** Called when a deprecated construct is replaced by its modern
   * equivalent. The children of {@code before} have already been
   * rewritten, so the two nodes differ only at the top. */
  void onRewrite(AstNode before, AstNode after);
}

// End Tracer.java
