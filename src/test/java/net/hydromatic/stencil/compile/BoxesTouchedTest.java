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
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.pipeline.Function;
import net.hydromatic.stencil.pipeline.ReductionDomain;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoxesTouched}. */
public class BoxesTouchedTest {
  /** Test fixture with common setup. */
  private static class Fixture {
    final BoxesTouched boxesTouched = new BoxesTouched(Bounds.create());
    final Ir.Var x = ir.var("x");
    final Ir.Var y = ir.var("y");

    Ir.IntLiteral lit(long v) {
      return ir.intLiteral(v);
    }

    /** Returns "for (x, 0, 10) body". */
    Ir.Stmt loopX(Ir.Stmt body) {
      return ir.forLoop("x", lit(0), lit(10), body);
    }
  }

  /** The calls in a loop require the union over every iteration. */
  @Test
  void testLoop() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        f.loopX(
            ir.evaluate(
                ir.plus(
                    ir.call("f", ir.minus(f.x, f.lit(1))),
                    ir.call("f", ir.plus(f.x, f.lit(1))))));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty()),
        hasToString("[[-1, 10]]"));
    // No calls to "g", so the box is empty
    assertThat(
        f.boxesTouched.boxRequired(s, "g", Scope.empty()),
        sameInstance(Box.EMPTY));
  }

  /** A loop whose bounds are symbolic gives a symbolic box. */
  @Test
  void testSymbolicLoop() {
    final Fixture f = new Fixture();
    final Ir.Var min = ir.var("m");
    final Ir.Var extent = ir.var("e");
    final Ir.Stmt s =
        ir.forLoop(
            "x",
            min,
            extent,
            ir.evaluate(ir.call("f", ir.plus(f.x, f.lit(2)))));
    final Scope scope = Scope.empty().declare("m").declare("e");
    assertThat(
        f.boxesTouched.boxRequired(s, "f", scope),
        hasToString("[[m + 2, m + e + 1]]"));
  }

  /**
   * A loop over [lo, hi] whose bounds are lets that vary with an outer loop
   * relaxes to the range of lo and hi, not to lo plus the widest extent.
   */
  @Test
  void testLoopOverLetBounds() {
    final Fixture f = new Fixture();
    final Ir.Var i = ir.var("i");
    final Ir.Var lo = ir.var("lo");
    final Ir.Var hi = ir.var("hi");
    final Ir.Stmt s =
        ir.forLoop(
            "i",
            f.lit(0),
            f.lit(10),
            ir.letStmt(
                "lo",
                i,
                ir.letStmt(
                    "hi",
                    i,
                    ir.forLoop(
                        "x",
                        lo,
                        ir.minus(ir.plus(hi, 1), lo),
                        ir.evaluate(ir.call("f", f.x))))));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty()),
        hasToString("[[0, 9]]"));
  }

  /**
   * A call with no arguments requires the empty box, which is different from
   * there being no call at all.
   */
  @Test
  void testRequiredIfCalled() {
    final Fixture f = new Fixture();
    final Ir.Stmt s = f.loopX(ir.evaluate(ir.plus(ir.call("f"), f.x)));
    final Box box =
        f.boxesTouched.boxRequiredIfCalled(s, "f", Scope.empty(), false);
    assertThat(box, is(Box.EMPTY));
    assertThat(
        f.boxesTouched.boxRequiredIfCalled(s, "g", Scope.empty(), false),
        nullValue());
    assertThat(
        f.boxesTouched.boxRequired(s, "g", Scope.empty()),
        sameInstance(Box.EMPTY));
  }

  /** Lets bind their variable to the interval of their value. */
  @Test
  void testLet() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        f.loopX(
            ir.letStmt(
                "t",
                ir.times(f.x, f.lit(2)),
                ir.evaluate(
                    ir.let(
                        "u",
                        ir.plus(ir.var("t"), f.lit(1)),
                        ir.call("f", ir.var("u"))))));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty()),
        hasToString("[[1, 19]]"));
  }

  /** Reads and writes of a function in two dimensions. */
  @Test
  void testProvide() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        ir.forLoop(
            "y",
            f.lit(0),
            f.lit(50),
            f.loopX(
                ir.provide(
                    "g",
                    ImmutableList.of(
                        ir.plus(
                            ir.call("f", f.x, ir.plus(f.y, f.lit(1))),
                            ir.call("g", ir.minus(f.x, f.lit(1)), f.y))),
                    ImmutableList.of(f.x, f.y))));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty()),
        hasToString("[[0, 9], [1, 50]]"));
    assertThat(
        f.boxesTouched.boxProvided(s, "g", Scope.empty()),
        hasToString("[[0, 9], [0, 49]]"));
    assertThat(
        f.boxesTouched.boxRequired(s, "g", Scope.empty()),
        hasToString("[[-1, 8], [0, 49]]"));
    assertThat(
        f.boxesTouched.boxTouched(s, "g", Scope.empty(), false),
        hasToString("[[-1, 9], [0, 49]]"));
    assertThat(
        f.boxesTouched.boxProvided(s, "f", Scope.empty()),
        sameInstance(Box.EMPTY));
  }

  /** Calls inside the producer of a function can be ignored. */
  @Test
  void testSkipProducer() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        ir.block(
            ir.produce("f", f.loopX(ir.evaluate(ir.call("f", f.lit(100))))),
            ir.consume("f", f.loopX(ir.evaluate(ir.call("f", f.x)))));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty(), false),
        hasToString("[[0, 100]]"));
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty(), true),
        hasToString("[[0, 9]]"));
  }

  /** Images are found by call type; externs are never regions. */
  @Test
  void testImages() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        f.loopX(
            ir.evaluate(
                ir.plus(
                    ir.image("in", ir.minus(f.x, f.lit(1)), f.lit(0)),
                    ir.plus(
                        ir.image("alpha", f.x),
                        ir.extern("abs", ir.call("f", f.x))))));
    assertThat(
        f.boxesTouched.imagesRequired(s, Scope.empty()),
        hasToString("{alpha=[[0, 9]], in=[[-1, 8], [0, 0]]}"));
    assertThat(
        f.boxesTouched.boxRequired(s, "abs", Scope.empty()),
        sameInstance(Box.EMPTY));
    // A call inside the argument of an extern still counts
    assertThat(
        f.boxesTouched.boxRequired(s, "f", Scope.empty()),
        hasToString("[[0, 9]]"));
  }

  @Test
  void testUnresolvable() {
    final Fixture f = new Fixture();
    final Ir.Stmt s = f.loopX(ir.evaluate(ir.call("f", ir.var("q"))));
    final CompileException e =
        assertThrows(
            CompileException.class,
            () -> f.boxesTouched.boxRequired(s, "f", Scope.empty()));
    assertThat(e.getMessage(), is("unresolvable free variable 'q'"));
    assertThat(e.site(), is("f(q)"));
  }

  @Test
  void testDimensionMismatch() {
    final Fixture f = new Fixture();
    final Ir.Stmt s =
        f.loopX(
            ir.evaluate(ir.plus(ir.call("f", f.x), ir.call("f", f.x, f.x))));
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> f.boxesTouched.boxRequired(s, "f", Scope.empty()));
    assertThat(e.getMessage(), is("f is accessed with 1 and 2 arguments"));
  }

  /**
   * The region of an update covers the region it writes and the region of
   * its own values that it reads.
   */
  @Test
  void testUpdateRegion() {
    final Fixture f = new Fixture();
    final Ir.Var r = ir.var("r");

    // f(x) = x; f(x) = f(x) + f(x - 1)
    final Function scan =
        Function.create("f", ImmutableList.of("x"), f.x)
            .update(
                ImmutableList.of(f.x),
                ir.plus(
                    ir.call("f", f.x),
                    ir.call("f", ir.minus(f.x, f.lit(1)))),
                null);
    assertThat(
        f.boxesTouched.updateRegion(scan, 1, Scope.empty()),
        hasToString("[[f.s1.x.min - 1, f.s1.x.max]]"));

    // h(x) = 0; h(clamp(in(r), 0, 255)) += 1 over r in [0, 1000)
    final Ir.Exp bin = ir.clamp(ir.image("in", r), f.lit(0), f.lit(255));
    final Function hist =
        Function.create("h", ImmutableList.of("x"), f.lit(0))
            .update(
                ImmutableList.of(bin),
                ir.plus(ir.call("h", bin), f.lit(1)),
                ReductionDomain.of("r", f.lit(0), f.lit(1000)));
    assertThat(
        f.boxesTouched.updateRegion(hist, 1, Scope.empty()),
        hasToString("[[0, 255]]"));

    // Without the clamp, the region is unbounded
    final Function hist2 =
        Function.create("h", ImmutableList.of("x"), f.lit(0))
            .update(
                ImmutableList.of(ir.image("in", r)),
                ir.plus(ir.call("h", ir.image("in", r)), f.lit(1)),
                ReductionDomain.of("r", f.lit(0), f.lit(1000)));
    assertThat(
        f.boxesTouched.updateRegion(hist2, 1, Scope.empty()),
        hasToString("[[-inf, +inf]]"));

    assertThrows(
        IllegalArgumentException.class,
        () -> f.boxesTouched.updateRegion(scan, 0, Scope.empty()));
  }
}

// End BoxesTouchedTest.java
