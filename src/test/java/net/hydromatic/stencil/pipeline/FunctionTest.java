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
package net.hydromatic.stencil.pipeline;

import static net.hydromatic.stencil.ast.IrBuilder.ir;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stencil.ast.Ir;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Function}, {@link LoopLevel}, {@link ReductionDomain} and
 * {@link Target}.
 */
public class FunctionTest {
  private static final Ir.Var X = ir.var("x");
  private static final Ir.Var Y = ir.var("y");

  /** Returns "hist(x) = 0; hist(in(r)) = hist(in(r)) + 1", r in [0, 100). */
  private static Function histogram() {
    final Ir.Exp bin = ir.image("in", ir.var("r"));
    return Function.create("hist", ImmutableList.of("x"), ir.intLiteral(0))
        .update(
            ImmutableList.of(bin),
            ir.plus(ir.call("hist", bin), 1),
            ReductionDomain.of("r", ir.intLiteral(0), ir.intLiteral(100)));
  }

  @Test
  void testCreate() {
    final Function f =
        Function.create("f", ImmutableList.of("x", "y"), ir.plus(X, Y));
    assertThat(f.dimensions(), is(2));
    assertThat(f.stageCount(), is(1));
    assertThat(f.updates().isEmpty(), is(true));
    assertThat(f.computeAt.isRoot(), is(true));
    assertThat(f.storeAt.isRoot(), is(true));
    assertThat(f, hasToString("f[x, y]"));
    assertThat(f.definition(0), hasToString("[x, y] = [x + y]"));
    assertThat(f.isPure(0, 1), is(true));
  }

  @Test
  void testInvalid() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Function.create("f", ImmutableList.of("x", "x"), X));
    assertThat(e.getMessage(), is("duplicate variable x"));

    e = assertThrows(
        IllegalArgumentException.class,
        () -> Function.create("f.g", ImmutableList.of("x"), X));
    assertThat(e.getMessage(), is("bad name f.g"));

    // an update must have one argument per dimension
    final Function f = Function.create("f", ImmutableList.of("x"), X);
    e = assertThrows(
        IllegalArgumentException.class,
        () -> f.update(ImmutableList.of(X, Y), X, null));
    assertThat(e.getMessage(),
        is("definition of f has 2 arguments, expected 1"));

    // a reduction variable must not hide a pure variable
    e = assertThrows(
        IllegalArgumentException.class,
        () ->
            f.update(
                ImmutableList.of(X),
                X,
                ReductionDomain.of("x", ir.intLiteral(0), ir.intLiteral(3))));
    assertThat(e.getMessage(),
        is("reduction variable x has the same name as a variable of f"));

    e = assertThrows(
        IllegalArgumentException.class,
        () ->
            f.update(
                ImmutableList.of(X),
                ImmutableList.of(X, Y),
                null));
    assertThat(e.getMessage(), is("definition of f has 2 values, expected 1"));
  }

  @Test
  void testStages() {
    final Function hist = histogram();
    assertThat(hist.stageCount(), is(2));
    assertThat(hist.isPure(0, 0), is(true));
    assertThat(hist.isPure(1, 0), is(false));
    assertThat(hist.updates().size(), is(1));
    assertThat(hist.stageVariables(0), hasToString("{x=hist.s0.x}"));
    assertThat(hist.stageVariables(1), hasToString("{r=hist.s1.r}"));
    assertThat(hist.definition(1).rdom(), hasToString("[r in [0, 100]]"));
    assertThrows(NullPointerException.class, () -> hist.definition(0).rdom());

    // an update of a pure dimension keeps its loop
    final Function g =
        Function.create("g", ImmutableList.of("x", "y"), ir.plus(X, Y))
            .update(
                ImmutableList.of(X, ir.var("r")),
                ir.call("g", X, ir.var("r")),
                ReductionDomain.of("r", ir.intLiteral(0), ir.intLiteral(4)));
    assertThat(g.isPure(1, 0), is(true));
    assertThat(g.isPure(1, 1), is(false));
    assertThat(g.stageVariables(1), hasToString("{x=g.s1.x, r=g.s1.r}"));

    // a parameter with the name of a pure variable is not pure
    final Function h =
        Function.create("h", ImmutableList.of("x"), X)
            .update(ImmutableList.of(ir.param("x")), X, null);
    assertThat(h.isPure(1, 0), is(false));
  }

  @Test
  void testNames() {
    final Function f = Function.create("f", ImmutableList.of("x"), X);
    assertThat(Function.stageName("f", 1), is("f.s1"));
    assertThat(Function.loopVar("f", 0, "x"), is("f.s0.x"));
    assertThat(f.loopVar(2, "r"), is("f.s2.r"));
    assertThat(f.loopMin(0, "x"), is("f.s0.x.min"));
    assertThat(f.loopMax(1, "x"), is("f.s1.x.max"));
    assertThat(Function.realizeMin("f", 0), is("f.min.0"));
    assertThat(Function.realizeExtent("f", 1), is("f.extent.1"));
  }

  /** Moving the compute level moves the store level if they were equal. */
  @Test
  void testSchedule() {
    final Function f =
        Function.create("f", ImmutableList.of("x", "y"), ir.plus(X, Y));
    final LoopLevel gy = LoopLevel.at("g", "y");
    final LoopLevel gx = LoopLevel.at("g", "x");

    final Function f1 = f.computeAt(gy);
    assertThat(f1.computeAt, is(gy));
    assertThat(f1.storeAt, is(gy));
    assertThat(f.computeAt.isRoot(), is(true));

    final Function f2 = f1.storeAt(LoopLevel.root()).computeAt(gx);
    assertThat(f2.computeAt, is(gx));
    assertThat(f2.storeAt, is(LoopLevel.root()));
  }

  @Test
  void testLoopLevel() {
    assertThat(LoopLevel.root(), hasToString("root"));
    assertThat(LoopLevel.root().isRoot(), is(true));
    assertThat(LoopLevel.at("g", "y"), hasToString("g.s0.y"));
    assertThat(LoopLevel.at("g", "y", 2).loopName(), is("g.s2.y"));
    assertThat(LoopLevel.at("g", "y"), is(LoopLevel.at("g", "y", 0)));
    assertThat(LoopLevel.at("g", "y"), not(is(LoopLevel.at("g", "x"))));
    assertThrows(IllegalStateException.class,
        () -> LoopLevel.root().loopName());
    assertThrows(IllegalArgumentException.class,
        () -> LoopLevel.at("g", "y", -1));
  }

  @Test
  void testReductionDomain() {
    final ReductionDomain.RVar r =
        new ReductionDomain.RVar("r", ir.intLiteral(0), ir.param("n"));
    final ReductionDomain.RVar s =
        new ReductionDomain.RVar("s", ir.intLiteral(1), ir.intLiteral(2));
    final ReductionDomain rdom = ReductionDomain.of(ImmutableList.of(r, s));
    assertThat(rdom.contains("s"), is(true));
    assertThat(rdom.contains("x"), is(false));
    assertThat(rdom, hasToString("[r in [0, n], s in [1, 2]]"));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ReductionDomain.of(ImmutableList.of(r, r)));
    assertThat(e.getMessage(), is("duplicate reduction variable r"));
    assertThrows(IllegalArgumentException.class,
        () -> ReductionDomain.of(ImmutableList.of()));
  }

  @Test
  void testTarget() {
    assertThat(Target.HOST, hasToString("x86-64-linux"));
    assertThat(Target.HOST.bits, is(64));
    assertThat(Target.HOST.has("avx2"), is(false));

    final Target t = Target.parse("arm-32-android-neon-debug");
    assertThat(t.arch, is("arm"));
    assertThat(t.os, is("android"));
    assertThat(t.has("neon"), is(true));
    assertThat(t, hasToString("arm-32-android-debug-neon"));
    assertThat(Target.parse(t.toString()), is(t));
    assertThat(Target.parse("x86-64-linux"), is(Target.HOST));

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> Target.parse("x86-64"));
    assertThat(e.getMessage(), is("invalid target 'x86-64'"));
    e = assertThrows(
        IllegalArgumentException.class, () -> Target.parse("x86-abc-linux"));
    assertThat(e.getMessage(), is("invalid target 'x86-abc-linux'"));
    e = assertThrows(
        IllegalArgumentException.class, () -> Target.parse("x86-16-linux"));
    assertThat(e.getMessage(), is("invalid bits in target 'x86-16-linux'"));
  }
}

// End FunctionTest.java
