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
import net.hydromatic.stanc.type.UnsizedType;

/**
 * Metadata of a type-checked expression that has been given a label.
 *
 * <p>Neither the location nor the label is part of {@link #equals},
 * {@link #hashCode} or {@link #compareTo}.
 *
 * @see Labeller#label
 */
public class LabelledMeta
    implements Annotation, Comparable<LabelledMeta> {
  public final UnsizedType type;
  public final Pos pos;
  public final AdLevel adLevel;
  public final int label;

  LabelledMeta(UnsizedType type, Pos pos, AdLevel adLevel, int label) {
    this.type = requireNonNull(type);
    this.pos = requireNonNull(pos);
    this.adLevel = requireNonNull(adLevel);
    this.label = label;
  }

  /** Creates a LabelledMeta. */
  public static LabelledMeta create(UnsizedType type, Pos pos,
      AdLevel adLevel, int label) {
    return new LabelledMeta(type, pos, adLevel, label);
  }

  /** Creates a LabelledMeta from a TypedMeta and a label. */
  public static LabelledMeta of(TypedMeta meta, int label) {
    return new LabelledMeta(meta.type, meta.pos, meta.adLevel, label);
  }

  /** Discards the label. */
  public TypedMeta toTyped() {
    return TypedMeta.create(type, pos, adLevel);
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
        || o instanceof LabelledMeta
        && type.equals(((LabelledMeta) o).type)
        && adLevel == ((LabelledMeta) o).adLevel;
  }

  @Override public int compareTo(LabelledMeta o) {
    int c = UnsizedType.compare(type, o.type);
    return c != 0 ? c : adLevel.compareTo(o.adLevel);
  }

  @Override public String toString() {
    return "{type: " + type + ", pos: " + pos + ", adLevel: " + adLevel
        + ", label: " + label + "}";
  }
}

// End LabelledMeta.java
