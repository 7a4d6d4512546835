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

/** Automatic-differentiation level of an expression.
 *
 * <p>Data-only expressions can be evaluated once, with plain doubles;
 * auto-diffable expressions depend on parameters and must carry
 * derivatives. */
public enum AdLevel {
  DATA_ONLY,
  AUTO_DIFFABLE;

  /** Returns the least upper bound of two levels. */
  public AdLevel lub(AdLevel other) {
    return this == AUTO_DIFFABLE || other == AUTO_DIFFABLE
        ? AUTO_DIFFABLE
        : DATA_ONLY;
  }
}

// End AdLevel.java
