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

import static net.hydromatic.stanc.mir.MirBuilder.mir;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stanc.ast.Pos;
import net.hydromatic.stanc.compile.CompileException;
import net.hydromatic.stanc.eval.Prop;
import net.hydromatic.stanc.type.AdLevel;
import net.hydromatic.stanc.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Labeller}. */
public class LabellerTest {
  private static final TypedMeta REAL =
      TypedMeta.create(PrimitiveType.REAL, AdLevel.AUTO_DIFFABLE);
  private static final TypedMeta INT =
      TypedMeta.create(PrimitiveType.INT, AdLevel.DATA_ONLY);

  /** Returns {@code f(x[i:j], y)}. */
  private static Expr<TypedMeta> sample() {
    final Expr<TypedMeta> x =
        mir.indexBetween(REAL, mir.var(REAL, "x"), mir.var(INT, "i"),
            mir.var(INT, "j"));
    return mir.userFun(REAL, "f", ImmutableList.of(x, mir.var(REAL, "y")));
  }

  private static List<Integer> labels(Expr<LabelledMeta> e) {
    final List<Integer> list = new ArrayList<>();
    e.preOrder().forEach(node -> list.add(node.meta.label));
    return list;
  }

  /** Labels are contiguous and follow pre-order, index bounds after the
   * indexed expression. */
  @Test void testLabel() {
    final Expr<LabelledMeta> e = Labeller.label(sample());
    assertThat(labels(e), contains(0, 1, 2, 3, 4, 5));
    final List<String> strings = new ArrayList<>();
    e.preOrder().forEach(node -> strings.add(node.toString()));
    assertThat(strings,
        contains("f(x[i:j], y)", "x[i:j]", "x", "i", "j", "y"));

    // Labelling is deterministic
    assertThat(labels(Labeller.label(sample())), is(labels(e)));
  }

  @Test void testLabelInit() {
    assertThat(labels(Labeller.label(sample(), 10)),
        contains(10, 11, 12, 13, 14, 15));

    final Map<Prop, Object> props = new HashMap<>();
    Prop.LABEL_INIT.set(props, 7);
    assertThat(labels(Labeller.label(sample(), props)),
        contains(7, 8, 9, 10, 11, 12));
  }

  /** Labelling keeps types and locations. */
  @Test void testLabelKeepsMeta() {
    final Pos pos = Pos.of("m.stan", 3, 5, 6);
    final Expr<TypedMeta> v =
        mir.var(TypedMeta.create(PrimitiveType.VECTOR, pos,
            AdLevel.DATA_ONLY), "v");
    final Expr<LabelledMeta> e = Labeller.label(v, 4);
    assertThat(Exprs.typeOf(e), is(PrimitiveType.VECTOR));
    assertThat(Exprs.posOf(e), is(pos));
    assertThat(Exprs.adLevelOf(e), is(AdLevel.DATA_ONLY));
    assertThat(Exprs.labelOf(e), is(4));
    assertThat(e.meta.toTyped(), is(v.meta));
  }

  @Test void testAssociate() {
    final Expr<LabelledMeta> e = Labeller.label(sample());
    final ImmutableSortedMap<Integer, Expr<LabelledMeta>> map =
        Labeller.associate(e);
    assertThat(map.size(), is(e.size()));
    assertThat(map.get(0), sameInstance(e));
    assertThat(map.get(2), hasToString("x"));
    assertThat(map.get(4), hasToString("j"));
    map.forEach((label, node) -> assertThat(node.meta.label, is(label)));
  }

  @Test void testAssociateIndex() {
    final Expr<LabelledMeta> e = Labeller.label(sample());
    final Expr<LabelledMeta> indexed = e.pattern.children().get(0);
    final Index<Expr<LabelledMeta>> index = mir.indicesOf(indexed).get(0);
    final ImmutableSortedMap<Integer, Expr<LabelledMeta>> map =
        Labeller.associateIndex(ImmutableSortedMap.of(), index);
    assertThat(map.keySet(), contains(3, 4));

    // Adding the same nodes again is an error
    final CompileException x =
        assertThrows(CompileException.class,
            () -> Labeller.associateIndex(map, index));
    assertThat(x.getMessage(), is("duplicate label 3"));
  }

  /** Two nodes with the same label. */
  private static Expr<LabelledMeta> duplicated() {
    final LabelledMeta meta0 =
        LabelledMeta.create(PrimitiveType.REAL, Pos.ZERO,
            AdLevel.AUTO_DIFFABLE, 0);
    final LabelledMeta meta1 =
        LabelledMeta.create(PrimitiveType.REAL, Pos.of("d.stan", 2, 1, 2),
            AdLevel.AUTO_DIFFABLE, 1);
    final LabelledMeta meta1b =
        LabelledMeta.create(PrimitiveType.REAL, Pos.of("d.stan", 2, 5, 6),
            AdLevel.AUTO_DIFFABLE, 1);
    return mir.plus(meta0, mir.var(meta1, "a"), mir.var(meta1b, "b"));
  }

  @Test void testDuplicateLabelsFail() {
    final CompileException x =
        assertThrows(CompileException.class,
            () -> Labeller.associate(duplicated()));
    assertThat(x.getMessage(), is("duplicate label 1"));
    assertThat(x.pos(), is(Pos.of("d.stan", 2, 5, 6)));
  }

  /** With "duplicateLabels" set to "keep_first", the node that comes first
   * in pre-order wins. */
  @Test void testDuplicateLabelsKeepFirst() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.DUPLICATE_LABELS.setLenient(props, "keep_first");
    final ImmutableSortedMap<Integer, Expr<LabelledMeta>> map =
        Labeller.associate(duplicated(), props);
    assertThat(map.size(), is(2));
    assertThat(map.get(1), hasToString("a"));
  }
}

// End LabellerTest.java
