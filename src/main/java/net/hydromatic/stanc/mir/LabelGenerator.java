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
 * Generates labels.
 *
 * <p>Each call to {@link #next()} returns one more than the previous call.
 * A generator is used by a single labelling traversal and then discarded.
 */
public class LabelGenerator {
  private int label;

  /** Creates a LabelGenerator whose first label is {@code init}. */
  public LabelGenerator(int init) {
    this.label = init;
  }

  /** Returns a label that has not been returned before. */
  public int next() {
    return label++;
  }
}

// End LabelGenerator.java
