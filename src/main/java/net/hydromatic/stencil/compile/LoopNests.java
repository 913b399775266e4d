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
import static net.hydromatic.stencil.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.Shuttle;
import net.hydromatic.stencil.ast.Visitor;
import net.hydromatic.stencil.pipeline.Definition;
import net.hydromatic.stencil.pipeline.Function;
import net.hydromatic.stencil.pipeline.LoopLevel;
import net.hydromatic.stencil.pipeline.ReductionDomain;

/**
 * Builds the loop nests of a pipeline, according to the schedule of each
 * function.
 *
 * <p>The result is the input to {@link BoundsInference}: each stage is a nest
 * of loops whose bounds are variables such as "f.s0.x.min" and "f.s0.x.max",
 * and each function that is not an output is wrapped in a {@code realize}
 * node at its storage level.
 *
 * <p>For example, if {@code g(x) = f(x - 1) + f(x + 1)} is an output and
 * {@code f(x) = x} is computed at root, the result is
 *
 * <pre>{@code
 * realize f([f.min.0, f.extent.0]) {
 *  produce f {
 *   for (f.s0.x, f.s0.x.min, f.s0.x.max + 1 - f.s0.x.min) {
 *    f(f.s0.x) = f.s0.x
 *   }
 *  }
 *  consume f {
 *   produce g {
 *    for (g.s0.x, g.s0.x.min, g.s0.x.max + 1 - g.s0.x.min) {
 *     g(g.s0.x) = f(g.s0.x - 1) + f(g.s0.x + 1)
 *    }
 *   }
 *  }
 * }
 * }</pre>
 */
public class LoopNests {
  private final Map<String, Function> environment;

  private LoopNests(Map<String, Function> environment) {
    this.environment = environment;
  }

  /**
   * Creates the loop nests of a pipeline.
   *
   * @param outputs Functions whose values the pipeline returns; each must be
   *     computed at root
   * @param realizationOrder All functions, each before the functions that
   *     call it; the members of a fused group are contiguous
   * @param fusedGroups Groups of functions computed in the same loop nest
   * @param environment Definitions of functions, keyed by name
   */
  public static Ir.Stmt lower(
      List<String> outputs,
      List<String> realizationOrder,
      List<List<String>> fusedGroups,
      Map<String, Function> environment) {
    return new LoopNests(environment)
        .lowerAll(outputs, realizationOrder, fusedGroups);
  }

  private Function function(String name) {
    final Function function = environment.get(name);
    if (function == null) {
      throw new CompileException("function '" + name + "' is not defined");
    }
    return function;
  }

  private Ir.Stmt lowerAll(
      List<String> outputs,
      List<String> realizationOrder,
      List<List<String>> fusedGroups) {
    final Map<String, List<String>> groups = new HashMap<>();
    for (String name : realizationOrder) {
      function(name);
      groups.put(name, ImmutableList.of(name));
    }
    for (List<String> group : fusedGroups) {
      // keep the members in realization order
      final List<String> members = new ArrayList<>();
      for (String name : realizationOrder) {
        if (group.contains(name)) {
          members.add(name);
        }
      }
      if (members.size() != group.size()) {
        throw new CompileException(
            "inconsistent fusion in group " + group
                + ": not every member is in the realization order");
      }
      members.forEach(name -> groups.put(name, members));
    }

    final List<Ir.Stmt> produces = new ArrayList<>();
    for (String name : realizationOrder) {
      if (outputs.contains(name)) {
        final Function function = function(name);
        if (!function.computeAt.isRoot()) {
          throw new CompileException(
              "output '" + name + "' must be computed at root, not "
                  + function.computeAt);
        }
        produces.add(ir.produce(name, stages(function)));
      }
    }
    for (String output : outputs) {
      if (!realizationOrder.contains(output)) {
        throw new CompileException(
            "output '" + output + "' is not in the realization order");
      }
    }
    if (produces.isEmpty()) {
      throw new CompileException("pipeline has no outputs");
    }
    Ir.Stmt root = ir.block(produces);

    // Wrap producers around their consumers, last function first
    final Set<String> done = new HashSet<>();
    for (String name : Lists.reverse(realizationOrder)) {
      if (outputs.contains(name) || done.contains(name)) {
        continue;
      }
      final List<String> group = groups.get(name);
      done.addAll(group);
      root = lowerUnit(root, group);
    }
    checkConsumers(root, realizationOrder);
    return root;
  }

  /** Places the loop nests of a fused group (or a single function). */
  private Ir.Stmt lowerUnit(Ir.Stmt root, List<String> group) {
    final LoopLevel computeAt = function(group.get(0)).computeAt;
    final List<Ir.Stmt> produces = new ArrayList<>();
    for (String member : group) {
      final Function function = function(member);
      if (!function.computeAt.equals(computeAt)) {
        throw new CompileException(
            "inconsistent fusion in group " + group
                + ": members are computed at different levels");
      }
      produces.add(ir.produce(member, stages(function)));
    }
    Ir.Stmt s =
        replaceLevel(
            root,
            computeAt,
            group.get(0),
            body -> {
              Ir.Stmt consume = body;
              for (String member : Lists.reverse(group)) {
                consume = ir.consume(member, consume);
              }
              return ir.block(
                  ImmutableList.<Ir.Stmt>builder()
                      .addAll(produces)
                      .add(consume)
                      .build());
            });
    for (String member : group) {
      final Function function = function(member);
      final LoopLevel storeAt = function.storeAt;
      if (!storeAt.equals(computeAt)) {
        if (computeAt.isRoot()) {
          throw new CompileException(
              "store level " + storeAt + " of '" + member
                  + "' is inside its compute level root");
        }
        if (!storeAt.isRoot()
            && !encloses(s, storeAt.loopName(), computeAt.loopName())) {
          throw new CompileException(
              "store level " + storeAt + " of '" + member
                  + "' does not enclose its compute level " + computeAt);
        }
      }
      s = replaceLevel(s, storeAt, member, body -> realize(function, body));
    }
    return s;
  }

  /** Wraps a statement in a realize node for a function. */
  private static Ir.Stmt realize(Function function, Ir.Stmt body) {
    final List<Ir.Range> bounds = new ArrayList<>();
    for (int i = 0; i < function.dimensions(); i++) {
      bounds.add(
          ir.range(
              ir.var(Function.realizeMin(function.name, i)),
              ir.var(Function.realizeExtent(function.name, i))));
    }
    return ir.realize(function.name, bounds, body);
  }

  /** Applies a transform to the body of a level. */
  private static Ir.Stmt replaceLevel(
      Ir.Stmt root,
      LoopLevel level,
      String func,
      UnaryOperator<Ir.Stmt> transform) {
    if (level.isRoot()) {
      return transform.apply(root);
    }
    final String loopName = level.loopName();
    final boolean[] found = {false};
    final Ir.Stmt s =
        root.accept(
            new Shuttle() {
              @Override
              protected Ir.Stmt visit(Ir.For forLoop) {
                if (forLoop.name.equals(loopName)) {
                  found[0] = true;
                  return forLoop.copy(
                      forLoop.min,
                      forLoop.extent,
                      transform.apply(forLoop.body));
                }
                return super.visit(forLoop);
              }
            });
    if (!found[0]) {
      throw new CompileException(
          "unknown loop level " + level + " of '" + func + "'");
    }
    return s;
  }

  /** Returns whether loop {@code outer} contains loop {@code inner}. */
  private static boolean encloses(Ir.Stmt root, String outer, String inner) {
    final Deque<String> loops = new ArrayDeque<>();
    final boolean[] found = {false};
    root.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.For forLoop) {
            if (forLoop.name.equals(inner) && loops.contains(outer)) {
              found[0] = true;
            }
            loops.push(forLoop.name);
            super.visit(forLoop);
            loops.pop();
          }
        });
    return found[0];
  }

  /**
   * Checks that each function computed inside a loop is only called inside
   * that loop.
   */
  private void checkConsumers(Ir.Stmt root, List<String> realizationOrder) {
    final Map<String, String> computeLoops = new HashMap<>();
    for (String name : realizationOrder) {
      final LoopLevel computeAt = function(name).computeAt;
      if (!computeAt.isRoot()) {
        computeLoops.put(name, computeAt.loopName());
      }
    }
    if (computeLoops.isEmpty()) {
      return;
    }
    final Deque<String> loops = new ArrayDeque<>();
    final Deque<String> producers = new ArrayDeque<>();
    root.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.For forLoop) {
            loops.push(forLoop.name);
            super.visit(forLoop);
            loops.pop();
          }

          @Override
          protected void visit(Ir.ProducerConsumer producerConsumer) {
            if (producerConsumer.producer) {
              producers.push(producerConsumer.name);
              super.visit(producerConsumer);
              producers.pop();
            } else {
              super.visit(producerConsumer);
            }
          }

          @Override
          protected void visit(Ir.Call call) {
            final String loop = computeLoops.get(call.name);
            if (call.callType == Ir.CallType.FUNCTION
                && loop != null
                && !loops.contains(loop)) {
              throw new CompileException(
                  "function '" + call.name + "' is computed at loop " + loop
                      + " but '" + producers.peek() + "' calls it outside "
                      + "that loop",
                  call.toString());
            }
            super.visit(call);
          }
        });
  }

  /** Returns the loop nests of every stage of a function, in order. */
  private static Ir.Stmt stages(Function function) {
    final List<Ir.Stmt> stmts = new ArrayList<>();
    for (int stage = 0; stage < function.stageCount(); stage++) {
      stmts.add(stage(function, stage));
    }
    return ir.block(stmts);
  }

  /**
   * Returns the loop nest of a stage. The last dimension is the outermost
   * loop; reduction variables are inside every pure dimension.
   */
  private static Ir.Stmt stage(Function function, int stage) {
    final Map<String, Ir.Var> variables = function.stageVariables(stage);
    final UnaryOperator<Ir.Exp> qualify =
        e -> Substituter.substitute(variables, e);
    final Definition definition = function.definition(stage);
    Ir.Stmt s =
        ir.provide(
            function.name,
            transformEager(definition.values, qualify),
            transformEager(definition.args, qualify));
    if (definition.rdom != null) {
      for (ReductionDomain.RVar v : definition.rdom.vars) {
        s =
            ir.forLoop(
                function.loopVar(stage, v.name),
                qualify.apply(v.min),
                qualify.apply(v.extent),
                s);
      }
    }
    for (int i = 0; i < function.dimensions(); i++) {
      final String arg = function.args.get(i);
      if (function.isPure(stage, i)) {
        final Ir.Var min = ir.var(function.loopMin(stage, arg));
        final Ir.Var max = ir.var(function.loopMax(stage, arg));
        s =
            ir.forLoop(
                function.loopVar(stage, arg),
                min,
                ir.minus(ir.plus(max, 1), min),
                s);
      }
    }
    return s;
  }
}

// End LoopNests.java
