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

/** Kind of node in the surface syntax tree. */
public enum Op {
  // expressions
  VARIABLE,
  INT_NUMERAL,
  REAL_NUMERAL,
  STRING_LITERAL,
  GET_LP("get_lp()"),
  GET_TARGET("target()"),
  PAREN,
  BIN_OP,
  PREFIX_OP,
  POSTFIX_OP,
  TERNARY_IF,
  FUN_APP,
  COND_DIST_APP,
  INDEXED,
  ARRAY_EXPR,
  ROW_VECTOR_EXPR,

  // statements
  ASSIGNMENT,
  NR_FUN_APP,
  TARGET_PE,
  INCREMENT_LOG_PROB,
  TILDE,
  PRINT("print"),
  REJECT("reject"),
  RETURN,
  IF_THEN_ELSE,
  WHILE,
  FOR,
  FOR_EACH,
  BLOCK,
  VAR_DECL,
  FUN_DEF,
  SKIP(";"),
  BREAK("break;"),
  CONTINUE("continue;"),

  PROGRAM;

  /** Keyword that is printed for nodes of this kind, or the empty string. */
  public final String keyword;

  Op() {
    this("");
  }

  Op(String keyword) {
    this.keyword = keyword;
  }

  /** Returns whether an expression of this kind needs parentheses when it is
   * the operand of another operator: binary, prefix, postfix and ternary
   * expressions. */
  public boolean isOperator() {
    switch (this) {
    case BIN_OP:
    case PREFIX_OP:
    case POSTFIX_OP:
    case TERNARY_IF:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
