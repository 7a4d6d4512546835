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

import static java.util.Objects.requireNonNull;

/** Array type, e.g. {@code array[] real}. */
public class ArrayType implements UnsizedType {
  public final UnsizedType elementType;

  ArrayType(UnsizedType elementType) {
    this.elementType = requireNonNull(elementType);
  }

  /** Creates an array type. */
  public static ArrayType of(UnsizedType elementType) {
    return new ArrayType(elementType);
  }

  /** Creates an array type with a given number of dimensions. */
  public static UnsizedType of(UnsizedType elementType, int dims) {
    UnsizedType type = elementType;
    for (int i = 0; i < dims; i++) {
      type = new ArrayType(type);
    }
    return type;
  }

  /** Returns the innermost element type; for {@code array[,] int},
   * returns {@code int}. */
  public UnsizedType innerType() {
    UnsizedType type = elementType;
    while (type instanceof ArrayType) {
      type = ((ArrayType) type).elementType;
    }
    return type;
  }

  @Override public int dims() {
    return 1 + elementType.dims();
  }

  @Override public int hashCode() {
    return elementType.hashCode() * 31 + 5;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayType
        && elementType.equals(((ArrayType) o).elementType);
  }

  @Override public StringBuilder describe(StringBuilder buf) {
    buf.append("array[");
    for (int i = 1; i < dims(); i++) {
      buf.append(',');
    }
    buf.append("] ");
    return innerType().describe(buf);
  }

  @Override public String toString() {
    return describe(new StringBuilder()).toString();
  }
}

// End ArrayType.java
