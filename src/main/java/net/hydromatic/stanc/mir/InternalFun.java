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

/**
 * Functions that the compiler introduces while lowering a program.
 *
 * <p>They occur as {@link FunKind#COMPILER_INTERNAL} applications whose name
 * is {@link #funName}.
 */
public enum InternalFun {
  MAKE_ARRAY("FnMakeArray__"),
  MAKE_ROW_VEC("FnMakeRowVec__"),
  NEG_INF("FnNegInf__"),
  LENGTH("FnLength__"),
  READ_DATA("FnReadData__"),
  READ_PARAM("FnReadParam__"),
  WRITE_PARAM("FnWriteParam__"),
  CONSTRAIN("FnConstrain__"),
  UNCONSTRAIN("FnUnconstrain__"),
  CHECK("FnCheck__"),
  PRINT("FnPrint__"),
  REJECT("FnReject__");

  /** Name of the function in the MIR. */
  public final String funName;

  InternalFun(String funName) {
    this.funName = funName;
  }

  @Override public String toString() {
    return funName;
  }
}

// End InternalFun.java
