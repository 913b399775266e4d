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
package net.hydromatic.stencil.compile;

import static net.hydromatic.stencil.ast.IrBuilder.ir;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.stencil.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interval}, {@link Box} and {@link Scope}. */
public class BoxTest {
  private final Ir.Var x = ir.var("x");

  @Test
  void testInterval() {
    final Interval i = Interval.of(0, 9);
    assertThat(i, hasToString("[0, 9]"));
    assertThat(i.isBounded(), is(true));
    assertThat(i.isPoint(), is(false));
    assertThat(i, is(Interval.of(0, 9)));
    assertThat(i.hashCode(), is(Interval.of(0, 9).hashCode()));
    assertThat(i, not(Interval.of(0, 8)));

    assertThat(Interval.everything(), hasToString("[-inf, +inf]"));
    assertThat(Interval.everything().isEverything(), is(true));
    assertThat(
        Interval.create(null, null), sameInstance(Interval.everything()));
    assertThat(Interval.atLeast(x), hasToString("[x, +inf]"));
    assertThat(Interval.atLeast(x).hasUpperBound(), is(false));
    assertThat(Interval.atMost(x), hasToString("[-inf, x]"));
    assertThat(Interval.atMost(x).isBounded(), is(false));
    assertThat(Interval.point(x).isPoint(), is(true));
    assertThat(Interval.of(3, 3).isConstant(3), is(true));
    assertThat(Interval.point(x).isConstant(3), is(false));
    assertThrows(
        NullPointerException.class, () -> Interval.atLeast(x).upperBound());
  }

  @Test
  void testIntervalUnion() {
    final Interval a = Interval.of(0, 9);
    final Interval b = Interval.of(5, 19);
    assertThat(a.union(b), hasToString("[min(0, 5), max(9, 19)]"));
    assertThat(Simplifier.simplify(a.union(b)), hasToString("[0, 19]"));

    // Ends that are the same expression are kept
    final Interval c = Interval.of(x, ir.plus(x, 5));
    final Interval d = Interval.of(x, ir.plus(x, 2));
    assertThat(c.union(d), hasToString("[x, max(x + 5, x + 2)]"));
    assertThat(Simplifier.simplify(c.union(d)), hasToString("[x, x + 5]"));

    // An end is bounded only if it is bounded in both
    assertThat(a.union(Interval.atLeast(x)), hasToString("[min(0, x), +inf]"));
    assertThat(a.union(Interval.everything()).isEverything(), is(true));
    assertThat(a.union(a), is(a));
  }

  @Test
  void testIntervalMap() {
    final Interval a = Interval.of(x, ir.plus(x, 1));
    assertThat(a.map(e -> e), sameInstance(a));
    assertThat(
        a.map(e -> ir.times(e, ir.intLiteral(2))),
        hasToString("[x * 2, (x + 1) * 2]"));
    final Interval p = Interval.point(x).map(e -> ir.plus(e, 1));
    assertThat(p.isPoint(), is(true));
    assertThat(p.min, sameInstance(p.max));
  }

  @Test
  void testBox() {
    final Box box = Box.of(Interval.of(0, 9), Interval.of(0, 49));
    assertThat(box, hasToString("[[0, 9], [0, 49]]"));
    assertThat(box.size(), is(2));
    assertThat(box.get(1), is(Interval.of(0, 49)));
    assertThat(box.isEmpty(), is(false));
    assertThat(Box.of(), sameInstance(Box.EMPTY));
    assertThat(Box.EMPTY, hasToString("[]"));
    assertThat(
        box.with(0, Interval.of(-1, 100)),
        hasToString("[[-1, 100], [0, 49]]"));
    // "with" does not modify the original
    assertThat(box, hasToString("[[0, 9], [0, 49]]"));
  }

  @Test
  void testBoxUnion() {
    final Box a = Box.of(Interval.of(0, 9), Interval.of(0, 49));
    final Box b = Box.of(Interval.of(-1, 8), Interval.of(10, 60));
    assertThat(
        Simplifier.simplify(a.union(b)),
        hasToString("[[-1, 9], [0, 60]]"));

    // The empty box is the identity
    assertThat(a.union(Box.EMPTY), sameInstance(a));
    assertThat(Box.EMPTY.union(a), sameInstance(a));
    assertThat(Box.union(ImmutableList.of()), sameInstance(Box.EMPTY));
    assertThat(
        Simplifier.simplify(Box.union(ImmutableList.of(a, b, Box.EMPTY))),
        is(Simplifier.simplify(a.union(b))));

    // The union contains each operand
    final Box u = Simplifier.simplify(a.union(b));
    for (Box box : ImmutableList.of(a, b)) {
      for (int i = 0; i < box.size(); i++) {
        assertThat(
            value(u.get(i).lowerBound()) <= value(box.get(i).lowerBound()),
            is(true));
        assertThat(
            value(u.get(i).upperBound()) >= value(box.get(i).upperBound()),
            is(true));
      }
    }

    final Box c = Box.of(Interval.of(0, 1));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> a.union(c));
    assertThat(
        e.getMessage(), is("cannot union boxes of 2 and 1 dimensions"));
  }

  private static long value(Ir.Exp e) {
    return ((Ir.IntLiteral) e).value;
  }

  @Test
  void testScope() {
    final Scope empty = Scope.empty();
    assertThat(empty.getOpt("x"), nullValue());
    assertThat(empty.contains("x"), is(false));

    final Scope s1 = empty.bind("x", Interval.of(0, 9));
    final Scope s2 = s1.declare("y");
    assertThat(s2.getOpt("x"), is(Interval.of(0, 9)));
    assertThat(s2.getOpt("y"), is(Interval.point(ir.var("y"))));
    assertThat(s1.contains("y"), is(false));

    // An inner binding hides an outer one
    final Scope s3 = s2.bind("x", Interval.of(5, 5));
    assertThat(s3.getOpt("x"), is(Interval.of(5, 5)));
    assertThat(s2.getOpt("x"), is(Interval.of(0, 9)));

    final List<String> names = ImmutableList.of("a", "b");
    final Scope s4 = s3.declareAll(names);
    assertThat(s4.getOpt("b"), hasToString("[b, b]"));
    assertThat(s4.getOpt("x"), is(Interval.of(5, 5)));
    assertThat(s3.bindAll(ImmutableMap.of()), sameInstance(s3));
    final Scope s5 = s3.bindAll(ImmutableMap.of("x", Interval.of(1, 2)));
    assertThat(s5.getOpt("x"), is(Interval.of(1, 2)));
  }

  @Test
  void testBoundKey() {
    final BoundKey key = BoundKey.of("f", 1);
    assertThat(key, hasToString("f.1"));
    assertThat(key, is(BoundKey.of("f", 1)));
    assertThat(key.hashCode(), is(BoundKey.of("f", 1).hashCode()));
    assertThat(key, not(BoundKey.of("f", 0)));
    assertThrows(IllegalArgumentException.class, () -> BoundKey.of("f", -1));
  }
}

// End BoxTest.java
