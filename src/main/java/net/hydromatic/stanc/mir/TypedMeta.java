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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.stanc.ast.Pos;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.PrimitiveType;
import net.hydromatic.stanc.type.UnsizedType;

/**
 * Metadata of a type-checked expression: its type, source location and
 * autodiff level.
 *
 * <p>The location is not part of {@link #equals}, {@link #hashCode} or
 * {@link #compareTo}; two expressions that differ only in where they were
 * written are equal.
 */
public class TypedMeta
    implements Annotation, Comparable<TypedMeta> {
  /** Metadata for compiler-generated integer constants. */
  public static final TypedMeta EMPTY =
      new TypedMeta(PrimitiveType.INT, Pos.ZERO, AdLevel.DATA_ONLY);

  public final UnsizedType type;
  public final Pos pos;
  public final AdLevel adLevel;

  TypedMeta(UnsizedType type, Pos pos, AdLevel adLevel) {
    this.type = requireNonNull(type);
    this.pos = requireNonNull(pos);
    this.adLevel = requireNonNull(adLevel);
  }

  /** Creates a TypedMeta. */
  public static TypedMeta create(UnsizedType type, Pos pos, AdLevel adLevel) {
    return new TypedMeta(type, pos, adLevel);
  }

  /** Creates a TypedMeta with no source location. */
  public static TypedMeta create(UnsizedType type, AdLevel adLevel) {
    return new TypedMeta(type, Pos.ZERO, adLevel);
  }

  /** Returns a copy with a different type; location and autodiff level are
   * unchanged. */
  public TypedMeta withType(UnsizedType type) {
    return type.equals(this.type) ? this : new TypedMeta(type, pos, adLevel);
  }

  @Override public UnsizedType type() {
    return type;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public AdLevel adLevel() {
    return adLevel;
  }

  @Override public int hashCode() {
    return Objects.hash(type, adLevel);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TypedMeta
        && type.equals(((TypedMeta) o).type)
        && adLevel == ((TypedMeta) o).adLevel;
  }

  @Override public int compareTo(TypedMeta o) {
    int c = UnsizedType.compare(type, o.type);
    return c != 0 ? c : adLevel.compareTo(o.adLevel);
  }

  @Override public String toString() {
    return "{type: " + type + ", pos: " + pos + ", adLevel: " + adLevel + "}";
  }
}

// End TypedMeta.java
