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
 * Metadata of an expression that has no metadata.
 *
 * <p>Used for syntax-only trees, and for comparing trees by shape alone.
 */
public enum NoMeta {
  INSTANCE;

  /** Discards the metadata of every node of an expression. */
  public static Expr<NoMeta> removeMeta(Expr<?> e) {
    return e.map(meta -> INSTANCE);
  }

  @Override public String toString() {
    return "()";
  }
}

// End NoMeta.java
