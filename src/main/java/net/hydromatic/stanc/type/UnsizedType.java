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

/**
 * Type of a Stan expression, without sizes.
 *
 * <p>A {@code vector[N]} and a {@code vector[M]} have the same unsized type,
 * {@link PrimitiveType#VECTOR}. Implementations are immutable and compare by
 * structure.
 */
public interface UnsizedType {
  /** Returns the number of array dimensions; 0 if this is not an array. */
  default int dims() {
    return 0;
  }

  /** Returns whether this is {@code int} or {@code real}. */
  default boolean isScalar() {
    return false;
  }

  /** Returns whether this is {@code real}. */
  default boolean isRealType() {
    return false;
  }

  /** Returns whether this is {@code int}. */
  default boolean isIntType() {
    return false;
  }

  /** Returns whether this is a vector, row vector or matrix. */
  default boolean isEigenType() {
    return false;
  }

  /** Writes this type in Stan syntax, e.g. "array[,] real". */
  StringBuilder describe(StringBuilder buf);

  /** Total order on types, consistent with {@link Object#equals}.
   *
   * <p>Orders first by number of array dimensions, then by the innermost
   * element type. */
  static int compare(UnsizedType t1, UnsizedType t2) {
    int c = Integer.compare(t1.dims(), t2.dims());
    if (c != 0) {
      return c;
    }
    while (t1 instanceof ArrayType) {
      t1 = ((ArrayType) t1).elementType;
      t2 = ((ArrayType) t2).elementType;
    }
    return ((PrimitiveType) t1).compareTo((PrimitiveType) t2);
  }
}

// End UnsizedType.java
