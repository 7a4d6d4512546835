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

import net.hydromatic.stanc.ast.Pos;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.UnsizedType;

/** Accessors for the metadata of typed and labelled expressions. */
public abstract class Exprs {
  private Exprs() {}

  /** Returns the type of an expression. */
  public static UnsizedType typeOf(Expr<? extends Annotation> e) {
    return e.meta.type();
  }

  /** Returns the source location of an expression. */
  public static Pos posOf(Expr<? extends Annotation> e) {
    return e.meta.pos();
  }

  /** Returns the autodiff level of an expression. */
  public static AdLevel adLevelOf(Expr<? extends Annotation> e) {
    return e.meta.adLevel();
  }

  /** Returns the label of an expression. */
  public static int labelOf(Expr<LabelledMeta> e) {
    return e.meta.label;
  }

  /** Returns whether an expression has a given type. */
  public static boolean hasType(Expr<? extends Annotation> e,
      UnsizedType type) {
    return e.meta.type().equals(type);
  }

  /** Returns a copy of an expression with a different type at the root.
   * Location, autodiff level and children are unchanged. */
  public static Expr<TypedMeta> withType(UnsizedType type,
      Expr<TypedMeta> e) {
    final TypedMeta meta = e.meta.withType(type);
    return meta == e.meta ? e : Expr.fix(meta, e.pattern);
  }

  /** Discards the metadata of every node of an expression.
   *
   * @see NoMeta#removeMeta */
  public static Expr<NoMeta> removeMeta(Expr<?> e) {
    return NoMeta.removeMeta(e);
  }
}

// End Exprs.java
