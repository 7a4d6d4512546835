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
package net.hydromatic.stanc.type;

/** Unsized types that have no type parameters. */
public enum PrimitiveType implements UnsizedType {
  INT("int"),
  REAL("real"),
  VECTOR("vector"),
  ROW_VECTOR("row_vector"),
  MATRIX("matrix"),
  /** Type of a reference to a function in the math library, e.g. the
   * first argument of {@code map_rect}. */
  MATH_LIBRARY_FUNCTION("<math library function>");

  /** Name in Stan syntax. */
  public final String stanName;

  PrimitiveType(String stanName) {
    this.stanName = stanName;
  }

  @Override public boolean isScalar() {
    return this == INT || this == REAL;
  }

  @Override public boolean isRealType() {
    return this == REAL;
  }

  @Override public boolean isIntType() {
    return this == INT;
  }

  @Override public boolean isEigenType() {
    return this == VECTOR || this == ROW_VECTOR || this == MATRIX;
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    return buf.append(stanName);
  }

  @Override public String toString() {
    return stanName;
  }
}

// End PrimitiveType.java
