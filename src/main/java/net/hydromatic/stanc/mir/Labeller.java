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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.stanc.compile.CompileException;
import net.hydromatic.stanc.eval.Prop;
import net.hydromatic.stanc.eval.Prop.DuplicateLabels;

/**
 * Gives each node of a typed expression a unique integer label, and builds
 * a map from labels back to nodes.
 *
 * <p>Labels are assigned in pre-order: a node before its children, children
 * left to right, and the bounds of each index in order after the indexed
 * expression. Labelling the same expression from the same initial label
 * always gives the same result.
 */
public abstract class Labeller {
  private Labeller() {}

  /** Labels an expression, starting from 0. */
  public static Expr<LabelledMeta> label(Expr<TypedMeta> e) {
    return label(e, 0);
  }

  /** Labels an expression, starting from the value of the
   * {@link Prop#LABEL_INIT} property. */
  public static Expr<LabelledMeta> label(Expr<TypedMeta> e,
      Map<Prop, Object> props) {
    return label(e, Prop.LABEL_INIT.intValue(props));
  }

  /** Labels an expression, starting from a given label. */
  public static Expr<LabelledMeta> label(Expr<TypedMeta> e, int init) {
    final LabelGenerator generator = new LabelGenerator(init);
    return e.map(meta -> LabelledMeta.of(meta, generator.next()));
  }

  /** Builds a map from each label to the node that has that label.
   * Throws if two nodes have the same label. */
  public static ImmutableSortedMap<Integer, Expr<LabelledMeta>> associate(
      Expr<LabelledMeta> e) {
    return associate(e, ImmutableSortedMap.of(), DuplicateLabels.FAIL);
  }

  /** Builds a map from each label to the node that has that label, using
   * the {@link Prop#DUPLICATE_LABELS} property to decide what to do if two
   * nodes have the same label. */
  public static ImmutableSortedMap<Integer, Expr<LabelledMeta>> associate(
      Expr<LabelledMeta> e, Map<Prop, Object> props) {
    return associate(e, ImmutableSortedMap.of(),
        Prop.DUPLICATE_LABELS.enumValue(props, DuplicateLabels.class));
  }

  /** Adds each node of an expression to an existing label map. */
  public static ImmutableSortedMap<Integer, Expr<LabelledMeta>> associate(
      Expr<LabelledMeta> e, Map<Integer, Expr<LabelledMeta>> init,
      DuplicateLabels duplicateLabels) {
    final Map<Integer, Expr<LabelledMeta>> map = new TreeMap<>(init);
    add(map, e, duplicateLabels);
    return ImmutableSortedMap.copyOf(map);
  }

  /** Adds the nodes of the bounds of an index to an existing label map.
   * Throws if two nodes have the same label. */
  public static ImmutableSortedMap<Integer, Expr<LabelledMeta>> associateIndex(
      Map<Integer, Expr<LabelledMeta>> init,
      Index<Expr<LabelledMeta>> index) {
    final Map<Integer, Expr<LabelledMeta>> map = new TreeMap<>(init);
    for (Expr<LabelledMeta> bound : index.bounds()) {
      add(map, bound, DuplicateLabels.FAIL);
    }
    return ImmutableSortedMap.copyOf(map);
  }

  private static void add(Map<Integer, Expr<LabelledMeta>> map,
      Expr<LabelledMeta> e, DuplicateLabels duplicateLabels) {
    requireNonNull(duplicateLabels);
    for (Expr<LabelledMeta> node : e.preOrder()) {
      final Expr<LabelledMeta> previous =
          map.putIfAbsent(node.meta.label, node);
      if (previous != null && duplicateLabels == DuplicateLabels.FAIL) {
        throw new CompileException("duplicate label " + node.meta.label,
            node.meta.pos);
      }
    }
  }
}

// End Labeller.java
