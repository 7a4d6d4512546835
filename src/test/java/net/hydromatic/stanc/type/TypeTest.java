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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;

import org.junit.jupiter.api.Test;

/** Tests for {@link UnsizedType} and its implementations. */
public class TypeTest {
  @Test void testDescribe() {
    assertThat(PrimitiveType.ROW_VECTOR, hasToString("row_vector"));
    assertThat(ArrayType.of(PrimitiveType.REAL), hasToString("array[] real"));
    assertThat(ArrayType.of(PrimitiveType.INT, 3),
        hasToString("array[,,] int"));
    assertThat(ArrayType.of(PrimitiveType.INT, 0), is(PrimitiveType.INT));
  }

  @Test void testArrayType() {
    final UnsizedType t = ArrayType.of(PrimitiveType.VECTOR, 2);
    assertThat(t.dims(), is(2));
    assertThat(((ArrayType) t).innerType(), is(PrimitiveType.VECTOR));
    assertThat(t, is(ArrayType.of(ArrayType.of(PrimitiveType.VECTOR))));
    assertThat(t.hashCode(),
        is(ArrayType.of(ArrayType.of(PrimitiveType.VECTOR)).hashCode()));
    assertThat(t, not(is(ArrayType.of(PrimitiveType.VECTOR, 1))));
    assertThat(t.isScalar(), is(false));
    assertThat(t.isEigenType(), is(false));
  }

  @Test void testPredicates() {
    assertThat(PrimitiveType.REAL.isRealType(), is(true));
    assertThat(PrimitiveType.INT.isRealType(), is(false));
    assertThat(PrimitiveType.INT.isIntType(), is(true));
    assertThat(PrimitiveType.INT.isScalar(), is(true));
    assertThat(PrimitiveType.MATRIX.isEigenType(), is(true));
    assertThat(PrimitiveType.MATRIX.isScalar(), is(false));
    assertThat(PrimitiveType.MATH_LIBRARY_FUNCTION.isEigenType(), is(false));
  }

  @Test void testCompare() {
    assertThat(UnsizedType.compare(PrimitiveType.INT, PrimitiveType.REAL),
        lessThan(0));
    assertThat(
        UnsizedType.compare(ArrayType.of(PrimitiveType.INT),
            PrimitiveType.MATRIX),
        greaterThan(0));
    assertThat(
        UnsizedType.compare(ArrayType.of(PrimitiveType.VECTOR),
            ArrayType.of(PrimitiveType.REAL)),
        greaterThan(0));
    assertThat(
        UnsizedType.compare(ArrayType.of(PrimitiveType.REAL, 2),
            ArrayType.of(PrimitiveType.REAL, 2)),
        is(0));
  }

  @Test void testAdLevel() {
    assertThat(AdLevel.DATA_ONLY.lub(AdLevel.DATA_ONLY),
        is(AdLevel.DATA_ONLY));
    assertThat(AdLevel.DATA_ONLY.lub(AdLevel.AUTO_DIFFABLE),
        is(AdLevel.AUTO_DIFFABLE));
    assertThat(AdLevel.AUTO_DIFFABLE.lub(AdLevel.DATA_ONLY),
        is(AdLevel.AUTO_DIFFABLE));
  }
}

// End TypeTest.java
