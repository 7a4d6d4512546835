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

import java.util.List;
import net.hydromatic.stanc.mir.Index;

/** Context for writing an AST out as Stan source code. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private int indent;

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes, separated by a string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i));
    }
    return this;
  }

  /** Appends a call to a binary operator (e.g. "a + b"). */
  public AstWriter binary(AstNode a0, String mid, AstNode a1) {
    return append(a0).append(mid).append(a1);
  }

  /** Appends a call such as "f(a, b)", or "f(y | a, b)" if
   * {@code conditional}. */
  public AstWriter call(String name, List<? extends AstNode> args,
      boolean conditional) {
    append(name).append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(i == 1 && conditional ? " | " : ", ");
      }
      append(args.get(i));
    }
    return append(")");
  }

  /** Appends an index, such as "i", "i:", "i:j" or ":". */
  public AstWriter index(Index<? extends AstNode> index) {
    final List<? extends AstNode> bounds = index.bounds();
    switch (index.kind) {
    case ALL:
      return append(":");
    case UPFROM:
      return append(bounds.get(0)).append(":");
    case BETWEEN:
      return binary(bounds.get(0), ":", bounds.get(1));
    default:
      return append(bounds.get(0));
    }
  }

  /** Starts a new line at the current indentation. */
  public AstWriter newline() {
    b.append('\n');
    for (int i = 0; i < indent; i++) {
      b.append("  ");
    }
    return this;
  }

  /** Appends a list of statements, each on a new line and indented by one
   * level more than the current line. */
  public AstWriter indented(List<? extends AstNode> stmts) {
    ++indent;
    for (AstNode stmt : stmts) {
      newline().append(stmt);
    }
    --indent;
    return newline();
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
