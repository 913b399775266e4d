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

import static net.hydromatic.stencil.PipelineFixture.exps;
import static net.hydromatic.stencil.PipelineFixture.pipeline;
import static net.hydromatic.stencil.ast.IrBuilder.ir;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stencil.PipelineFixture;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.pipeline.LoopLevel;
import net.hydromatic.stencil.pipeline.ReductionDomain;
import org.junit.jupiter.api.Test;

/** Tests for {@link LoopNests}. */
public class LoopNestsTest {
  private static final Ir.Var X = ir.var("x");
  private static final Ir.Var Y = ir.var("y");

  /**
   * Returns a pipeline with {@code f(x, y) = x + y} and an output {@code g(x,
   * y) = f(x, y) + f(x, y + 1)} over [0, 9] x [0, 4].
   */
  private static PipelineFixture twoDimensional() {
    return pipeline()
        .define("f", ImmutableList.of("x", "y"), ir.plus(X, Y))
        .define(
            "g",
            ImmutableList.of("x", "y"),
            ir.plus(ir.call("f", X, Y), ir.call("f", X, ir.plus(Y, 1))))
        .output("g", 0, 9, 0, 4);
  }

  @Test
  void testSimple() {
    final String expected = "realize f([f.min.0, f.extent.0]) {\n"
        + " produce f {\n"
        + "  for (f.s0.x, f.s0.x.min, f.s0.x.max + 1 - f.s0.x.min) {\n"
        + "   f(f.s0.x) = f.s0.x * 2\n"
        + "  }\n"
        + " }\n"
        + " consume f {\n"
        + "  produce g {\n"
        + "   for (g.s0.x, g.s0.x.min, g.s0.x.max + 1 - g.s0.x.min) {\n"
        + "    g(g.s0.x) = f(g.s0.x) + f(g.s0.x + 1)\n"
        + "   }\n"
        + "  }\n"
        + " }\n"
        + "}\n";
    assertThat(PipelineFixture.simple().lower(), hasToString(expected));
  }

  /** The last dimension is the outermost loop. */
  @Test
  void testTwoDimensions() {
    final String expected = "produce blur {\n"
        + " for (blur.s0.y, blur.s0.y.min, blur.s0.y.max + 1 - blur.s0.y.min)"
        + " {\n"
        + "  for (blur.s0.x, blur.s0.x.min, blur.s0.x.max + 1 - blur.s0.x.min)"
        + " {\n"
        + "   blur(blur.s0.x, blur.s0.y) = in(blur.s0.x - 1, blur.s0.y)"
        + " + in(blur.s0.x, blur.s0.y) + in(blur.s0.x + 1, blur.s0.y)\n"
        + "  }\n"
        + " }\n"
        + "}\n";
    assertThat(PipelineFixture.blur().lower(), hasToString(expected));
  }

  /** An update has its own loop nest, after the pure definition's. */
  @Test
  void testUpdate() {
    final String expected = "realize hist([hist.min.0, hist.extent.0]) {\n"
        + " produce hist {\n"
        + "  for (hist.s0.x, hist.s0.x.min, hist.s0.x.max + 1 - hist.s0.x.min)"
        + " {\n"
        + "   hist(hist.s0.x) = 0\n"
        + "  }\n"
        + "  for (hist.s1.r, 0, 1000) {\n"
        + "   hist(max(min(in(hist.s1.r), 255), 0))"
        + " = hist(max(min(in(hist.s1.r), 255), 0)) + 1\n"
        + "  }\n"
        + " }\n"
        + " consume hist {\n"
        + "  produce out {\n"
        + "   for (out.s0.x, out.s0.x.min, out.s0.x.max + 1 - out.s0.x.min) {\n"
        + "    out(out.s0.x) = hist(out.s0.x)\n"
        + "   }\n"
        + "  }\n"
        + " }\n"
        + "}\n";
    assertThat(PipelineFixture.histogram(true).lower(), hasToString(expected));
  }

  /** Reduction variables loop inside the pure dimensions of an update. */
  @Test
  void testUpdateWithPureDimension() {
    final Ir.Var r = ir.var("r");
    final Ir.Stmt s =
        pipeline()
            .define("f", ImmutableList.of("x"), ir.intLiteral(0))
            .update(
                "f",
                exps(X),
                ir.plus(ir.call("f", X), ir.image("in", X, r)),
                ReductionDomain.of("r", ir.intLiteral(0), ir.intLiteral(3)))
            .define("g", ImmutableList.of("x"), ir.call("f", X))
            .output("g", 0, 9)
            .lower();
    assertThat(
        s.toString(),
        containsString(
            "  for (f.s1.x, f.s1.x.min, f.s1.x.max + 1 - f.s1.x.min) {\n"
                + "   for (f.s1.r, 0, 3) {\n"
                + "    f(f.s1.x) = f(f.s1.x) + in(f.s1.x, f.s1.r)\n"));
  }

  /**
   * The members of a fused group share a level, and are produced in
   * realization order.
   */
  @Test
  void testFused() {
    final String s = PipelineFixture.fused().lower().toString();
    assertThat(s, containsString("realize b([b.min.0, b.extent.0]) {\n"
        + " realize a([a.min.0, a.extent.0]) {\n"
        + "  produce a {\n"));
    assertThat(s, containsString("  produce b {\n"));
    assertThat(s, containsString("  consume a {\n"
        + "   consume b {\n"
        + "    produce c {\n"));
    assertThat(s.indexOf("produce a") < s.indexOf("produce b"), is(true));
  }

  /** A function computed inside a loop of its consumer. */
  @Test
  void testComputeAt() {
    final String s =
        twoDimensional()
            .computeAt("f", LoopLevel.at("g", "y"))
            .lower()
            .toString();
    assertThat(s, containsString("produce g {\n"
        + " for (g.s0.y, g.s0.y.min, g.s0.y.max + 1 - g.s0.y.min) {\n"
        + "  realize f([f.min.0, f.extent.0], [f.min.1, f.extent.1]) {\n"
        + "   produce f {\n"));
    assertThat(s, containsString("   consume f {\n"
        + "    for (g.s0.x, g.s0.x.min, g.s0.x.max + 1 - g.s0.x.min) {\n"));
  }

  /** A function computed inside a loop, stored outside it. */
  @Test
  void testStoreAt() {
    final String s =
        twoDimensional()
            .computeAt("f", LoopLevel.at("g", "x"))
            .storeAt("f", LoopLevel.root())
            .lower()
            .toString();
    assertThat(s, containsString("realize f([f.min.0, f.extent.0], "
        + "[f.min.1, f.extent.1]) {\n"
        + " produce g {\n"));
    assertThat(s, containsString(
        "   for (g.s0.x, g.s0.x.min, g.s0.x.max + 1 - g.s0.x.min) {\n"
            + "    produce f {\n"));
  }

  @Test
  void testUnknownLevel() {
    final CompileException e =
        assertThrows(
            CompileException.class,
            () -> twoDimensional()
                .computeAt("f", LoopLevel.at("g", "z"))
                .lower());
    assertThat(e.getMessage(), is("unknown loop level g.s0.z of 'f'"));
  }

  @Test
  void testStoreInsideCompute() {
    final CompileException e =
        assertThrows(
            CompileException.class,
            () -> twoDimensional()
                .storeAt("f", LoopLevel.at("g", "y"))
                .lower());
    assertThat(
        e.getMessage(),
        is("store level g.s0.y of 'f' is inside its compute level root"));

    final CompileException e2 =
        assertThrows(
            CompileException.class,
            () -> twoDimensional()
                .computeAt("f", LoopLevel.at("g", "y"))
                .storeAt("f", LoopLevel.at("g", "x"))
                .lower());
    assertThat(
        e2.getMessage(),
        is("store level g.s0.x of 'f' does not enclose its compute level "
            + "g.s0.y"));
  }

  /** A function computed in a loop may only be called inside that loop. */
  @Test
  void testConsumerOutsideLoop() {
    final CompileException e =
        assertThrows(
            CompileException.class,
            () -> PipelineFixture.simple()
                .define("h", ImmutableList.of("x"), ir.call("f", X))
                .output("h", 0, 9)
                .computeAt("f", LoopLevel.at("g", "x"))
                .lower());
    assertThat(
        e.getMessage(),
        is("function 'f' is computed at loop g.s0.x but 'h' calls it outside "
            + "that loop"));
    assertThat(e.site(), is("f(h.s0.x)"));
  }

  @Test
  void testErrors() {
    CompileException e =
        assertThrows(
            CompileException.class,
            () -> PipelineFixture.simple()
                .define("h", ImmutableList.of("x"), ir.call("g", X))
                .output("h", 0, 9)
                .computeAt("h", LoopLevel.at("g", "x"))
                .lower());
    assertThat(
        e.getMessage(), is("output 'h' must be computed at root, not g.s0.x"));

    e = assertThrows(
        CompileException.class,
        () -> pipeline()
            .define("f", ImmutableList.of("x"), X)
            .lower());
    assertThat(e.getMessage(), is("pipeline has no outputs"));

    e = assertThrows(
        CompileException.class,
        () -> PipelineFixture.simple().order("f", "g", "zz").lower());
    assertThat(e.getMessage(), is("function 'zz' is not defined"));

    e = assertThrows(
        CompileException.class,
        () -> PipelineFixture.simple().order("f").lower());
    assertThat(
        e.getMessage(), is("output 'g' is not in the realization order"));

    e = assertThrows(
        CompileException.class,
        () -> PipelineFixture.fused().order("a", "c").lower());
    assertThat(
        e.getMessage(),
        is("inconsistent fusion in group [a, b]: not every member is in the "
            + "realization order"));
  }
}

// End LoopNestsTest.java
