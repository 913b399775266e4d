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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.stencil.ast.IrBuilder.ir;
import static net.hydromatic.stencil.util.Static.transformEager;

import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.IrNode;
import net.hydromatic.stencil.ast.Visitor;
import net.hydromatic.stencil.pipeline.Definition;
import net.hydromatic.stencil.pipeline.Function;
import net.hydromatic.stencil.pipeline.ReductionDomain;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the region of a function that a piece of a program reads or
 * writes.
 *
 * <p>The walk keeps a {@link Scope}. A loop binds its variable to the
 * interval {@code [min, min + extent - 1]}, and a let binds its variable to
 * the interval of its value; so the region of a call inside a loop covers
 * every iteration of the loop. At each call (or provide) the box of its
 * arguments is computed, and the boxes of all sites are unioned.
 */
public class BoxesTouched {
  private final Bounds bounds;

  public BoxesTouched(Bounds bounds) {
    this.bounds = bounds;
  }

  /** Returns the region of {@code func} that calls in {@code node} read. */
  public Box boxRequired(IrNode node, String func, Scope scope) {
    return boxRequired(node, func, scope, false);
  }

  /**
   * Returns the region of {@code func} that calls in {@code node} read.
   *
   * @param skipProducer Whether to ignore calls inside the node that produces
   *     {@code func}; they are calls of an update to the function itself
   */
  public Box boxRequired(
      IrNode node, String func, Scope scope, boolean skipProducer) {
    return orEmpty(walk(node, func, scope, true, false, skipProducer));
  }

  /**
   * Returns the region of {@code func} that calls in {@code node} read, or
   * null if {@code node} does not call it.
   *
   * <p>A function of zero dimensions that is called has region
   * {@link Box#EMPTY}, which {@link #boxRequired} cannot tell apart from a
   * function that is not called.
   */
  public @Nullable Box boxRequiredIfCalled(
      IrNode node, String func, Scope scope, boolean skipProducer) {
    return walk(node, func, scope, true, false, skipProducer);
  }

  /** Returns the region of {@code func} that provides in {@code node} write. */
  public Box boxProvided(IrNode node, String func, Scope scope) {
    return orEmpty(walk(node, func, scope, false, true, false));
  }

  /** Returns the region of {@code func} that {@code node} reads or writes. */
  public Box boxTouched(
      IrNode node, String func, Scope scope, boolean skipProducer) {
    return orEmpty(walk(node, func, scope, true, true, skipProducer));
  }

  /**
   * Returns the region of each input image that calls in {@code node} read,
   * sorted by image name.
   */
  public ImmutableSortedMap<String, Box> imagesRequired(
      IrNode node, Scope scope) {
    final Walker walker =
        new Walker(scope, name -> true, Ir.CallType.IMAGE, true, false, false);
    node.accept(walker);
    return ImmutableSortedMap.copyOf(walker.simplifiedBoxes());
  }

  /**
   * Returns the region of a function that an update stage touches: the
   * region it writes, and the region of its own previous values that it
   * reads.
   *
   * <p>The stage's pure variables range over the stage's loop bounds (for
   * example "f.s1.x" over {@code [f.s1.x.min, f.s1.x.max]}) and its reduction
   * variables over the reduction domain.
   */
  public Box updateRegion(Function function, int stage, Scope scope) {
    checkArgument(stage > 0, "stage %s is not an update", stage);
    final Definition definition = function.definition(stage);
    Scope s = scope;
    for (int i = 0; i < function.dimensions(); i++) {
      final String arg = function.args.get(i);
      if (definition.isPure(i, arg)) {
        s = s.bind(
            function.loopVar(stage, arg),
            Interval.of(
                ir.var(function.loopMin(stage, arg)),
                ir.var(function.loopMax(stage, arg))));
      }
    }
    if (definition.rdom != null) {
      for (ReductionDomain.RVar v : definition.rdom.vars) {
        s = s.bind(
            function.loopVar(stage, v.name), loopInterval(v.min, v.extent, s));
      }
    }
    final Map<String, Ir.Var> variables = function.stageVariables(stage);
    final Ir.Stmt provide =
        ir.provide(
            function.name,
            transformEager(
                definition.values, e -> Substituter.substitute(variables, e)),
            transformEager(
                definition.args, e -> Substituter.substitute(variables, e)));
    return boxTouched(provide, function.name, s, false);
  }

  /**
   * Returns the interval of the variable of a loop that starts at {@code min}
   * and runs for {@code extent} iterations.
   *
   * <p>The last iteration, "min + extent - 1", is simplified before its bounds
   * are computed. A lowered loop has extent "v.max + 1 - v.min", so the last
   * iteration is "v.max"; if "v.min" were bounded as two separate
   * occurrences, the upper bound would grow by the width of its interval.
   */
  Interval loopInterval(Ir.Exp min, Ir.Exp extent, Scope scope) {
    final Interval minInterval = bounds.of(min, scope);
    final Interval maxInterval =
        bounds.of(
            Simplifier.simplify(ir.plus(ir.plus(min, extent), -1)), scope);
    return bounds.simplify(Interval.create(minInterval.min, maxInterval.max));
  }

  private static Box orEmpty(@Nullable Box box) {
    return box == null ? Box.EMPTY : box;
  }

  private @Nullable Box walk(
      IrNode node,
      String func,
      Scope scope,
      boolean calls,
      boolean provides,
      boolean skipProducer) {
    final Walker walker =
        new Walker(scope, func::equals, null, calls, provides, skipProducer);
    node.accept(walker);
    return walker.simplifiedBoxes().get(func);
  }

  /** Visitor that accumulates the boxes of calls and provides. */
  private class Walker extends Visitor {
    private Scope scope;
    private final Predicate<String> names;
    /** Type of call to look for; null means a call of any type. */
    private final Ir.@Nullable CallType callType;
    private final boolean calls;
    private final boolean provides;
    private final boolean skipProducer;
    final Map<String, Box> boxes = new TreeMap<>();

    Walker(
        Scope scope,
        Predicate<String> names,
        Ir.@Nullable CallType callType,
        boolean calls,
        boolean provides,
        boolean skipProducer) {
      this.scope = scope;
      this.names = names;
      this.callType = callType;
      this.calls = calls;
      this.provides = provides;
      this.skipProducer = skipProducer;
    }

    Map<String, Box> simplifiedBoxes() {
      final Map<String, Box> map = new TreeMap<>();
      boxes.forEach((name, box) -> map.put(name, bounds.simplify(box)));
      return map;
    }

    private void add(String name, List<Ir.Exp> args, IrNode site) {
      final Box box =
          Box.of(transformEager(args, arg -> bounds.of(arg, scope, site)));
      final Box previous = boxes.get(name);
      if (previous != null) {
        checkArgument(
            previous.size() == box.size(),
            "%s is accessed with %s and %s arguments",
            name,
            previous.size(),
            box.size());
      }
      boxes.put(name, previous == null ? box : previous.union(box));
    }

    @Override
    protected void visit(Ir.Call call) {
      if (calls
          && (callType == null || call.callType == callType)
          && call.callType != Ir.CallType.EXTERN
          && names.test(call.name)) {
        add(call.name, call.args, call);
      }
      super.visit(call);
    }

    @Override
    protected void visit(Ir.Provide provide) {
      if (provides && names.test(provide.name)) {
        add(provide.name, provide.args, provide);
      }
      super.visit(provide);
    }

    @Override
    protected void visit(Ir.Let let) {
      let.value.accept(this);
      final Scope saved = scope;
      scope = scope.bind(let.name, bounds.of(let.value, scope));
      let.body.accept(this);
      scope = saved;
    }

    @Override
    protected void visit(Ir.LetStmt letStmt) {
      letStmt.value.accept(this);
      final Scope saved = scope;
      scope = scope.bind(letStmt.name, bounds.of(letStmt.value, scope));
      letStmt.body.accept(this);
      scope = saved;
    }

    @Override
    protected void visit(Ir.For forLoop) {
      forLoop.min.accept(this);
      forLoop.extent.accept(this);
      final Scope saved = scope;
      scope =
          scope.bind(
              forLoop.name, loopInterval(forLoop.min, forLoop.extent, scope));
      forLoop.body.accept(this);
      scope = saved;
    }

    @Override
    protected void visit(Ir.ProducerConsumer producerConsumer) {
      if (skipProducer
          && producerConsumer.producer
          && names.test(producerConsumer.name)) {
        return;
      }
      super.visit(producerConsumer);
    }
  }
}

// End BoxesTouched.java
