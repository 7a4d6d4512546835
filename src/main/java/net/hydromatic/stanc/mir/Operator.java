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
package net.hydromatic.stanc.mir;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operators of the Stan language.
 *
 * <p>In the MIR, an operator application is a {@link FunKind#STAN_LIB}
 * function application whose name is {@link #mirName}, for example
 * {@code Plus__(a, b)}.
 */
public enum Operator {
  PLUS("Plus__", "+"),
  PPLUS("PPlus__", "+"),
  MINUS("Minus__", "-"),
  PMINUS("PMinus__", "-"),
  TIMES("Times__", "*"),
  DIVIDE("Divide__", "/"),
  INT_DIVIDE("IntDivide__", "%/%"),
  MODULO("Modulo__", "%"),
  LDIVIDE("LDivide__", "\\"),
  ELT_TIMES("EltTimes__", ".*"),
  ELT_DIVIDE("EltDivide__", "./"),
  POW("Pow__", "^"),
  ELT_POW("EltPow__", ".^"),
  OR("Or__", "||"),
  AND("And__", "&&"),
  EQUALS("Equals__", "=="),
  NEQUALS("NEquals__", "!="),
  LESS("Less__", "<"),
  LEQ("Leq__", "<="),
  GREATER("Greater__", ">"),
  GEQ("Geq__", ">="),
  PNOT("PNot__", "!"),
  TRANSPOSE("Transpose__", "'");

  /** Symbol in Stan surface syntax, e.g. "+". */
  public final String symbol;

  /** Name of the function in the MIR, e.g. "Plus__". */
  public final String mirName;

  private static final ImmutableMap<String, Operator> BY_MIR_NAME;

  static {
    final ImmutableMap.Builder<String, Operator> b = ImmutableMap.builder();
    for (Operator op : values()) {
      b.put(op.mirName, op);
    }
    BY_MIR_NAME = b.build();
  }

  Operator(String mirName, String symbol) {
    this.mirName = mirName;
    this.symbol = symbol;
  }

  /** Returns the operator with a given MIR name, or null. */
  public static @Nullable Operator ofMirName(String name) {
    return BY_MIR_NAME.get(name);
  }

  /** Returns whether this operator takes one operand, for example
   * {@code PMinus__} and {@code Transpose__}. */
  public boolean isUnary() {
    switch (this) {
    case PPLUS:
    case PMINUS:
    case PNOT:
    case TRANSPOSE:
      return true;
    default:
      return false;
    }
  }

  @Override public String toString() {
    return mirName;
  }
}

// End Operator.java
