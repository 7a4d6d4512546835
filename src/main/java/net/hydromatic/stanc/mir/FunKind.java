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

/** Kind of function application. */
public enum FunKind {
  /** Function or operator in the Stan math library. */
  STAN_LIB,
  /** Function defined in the "functions" block of the program. */
  USER_DEFINED,
  /** Function introduced by the compiler; see {@link InternalFun}. */
  COMPILER_INTERNAL,
  /** Conditional distribution application, such as
   * {@code normal_lpdf(y | mu, sigma)}. The first argument is the observed
   * variate. */
  COND_DIST_APP
}

// End FunKind.java
