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
package net.hydromatic.stanc.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.LABEL_INIT.intValue(map), is(0));
    assertThat(Prop.NORMALIZE_PARENS.booleanValue(map), is(true));
    assertThat(
        Prop.DUPLICATE_LABELS.enumValue(map, Prop.DuplicateLabels.class),
        is(Prop.DuplicateLabels.FAIL));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("labelInit"), is(Prop.LABEL_INIT));
    assertThat(Prop.lookup("LABEL_INIT"), is(Prop.LABEL_INIT));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DUPLICATE_LABELS));
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> Prop.lookup("foo"));
    assertThat(e.getMessage(), is("property foo not found"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.NORMALIZE_PARENS.set(map, false);
    assertThat(Prop.NORMALIZE_PARENS.booleanValue(map), is(false));
    Prop.DUPLICATE_LABELS.setLenient(map, "Keep_First");
    assertThat(
        Prop.DUPLICATE_LABELS.enumValue(map, Prop.DuplicateLabels.class),
        is(Prop.DuplicateLabels.KEEP_FIRST));
    assertThat(Prop.LABEL_INIT.get(map), is((Object) 0));

    RuntimeException e =
        assertThrows(RuntimeException.class,
            () -> Prop.DUPLICATE_LABELS.setLenient(map, "sometimes"));
    assertThat(e.getMessage(),
        is("value must be one of: 'FAIL', 'KEEP_FIRST'"));
    e = assertThrows(RuntimeException.class,
        () -> Prop.LABEL_INIT.set(map, "7"));
    assertThat(e.getMessage(),
        is("value for property must have type class java.lang.Integer"));
    e = assertThrows(RuntimeException.class,
        () -> Prop.LABEL_INIT.set(map, null));
    assertThat(e.getMessage(), is("property is required"));

    // Asking for a value of the wrong type is an error
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LABEL_INIT.booleanValue(map));
  }
}

// End PropTest.java
