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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.stencil.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.Shuttle;
import net.hydromatic.stencil.ast.Visitor;
import net.hydromatic.stencil.pipeline.Function;
import net.hydromatic.stencil.pipeline.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the region that each stage of each function must compute, and
 * injects into the program the bindings that define it.
 *
 * <p>The input is a program in which the loops of each stage run from
 * variables such as "f.s0.x.min" to "f.s0.x.max", and each {@code realize}
 * node allocates "f.min.0" to "f.min.0 + f.extent.0 - 1"; those variables are
 * not yet bound. The output is the same program with a {@code let} for each of
 * them.
 *
 * <p>The program is processed bottom-up, one <em>level</em> at a time. A level
 * is the root of the program or the body of a loop. The bindings of the
 * functions computed at a level are placed at the top of the level, and are
 * computed from the calls in the level, with nested loops relaxed to the
 * whole of their range. Variables defined outside the level (enclosing loops
 * and lets, parameters, and the bindings of other functions computed at this
 * or enclosing levels) remain symbolic. The bindings of a {@code realize}
 * are placed immediately around it.
 *
 * <p>An instance holds the state of one invocation of {@link #inferBounds}
 * and is not visible outside it.
 */
public class BoundsInference {
  /** Prefix of the message of each assertion that this pass injects. */
  static final String ASSERT_PREFIX = "required region of ";

  private static final Pattern IMAGE_BINDING =
      Pattern.compile("[^.]+\\.(min|extent)\\.[0-9]+\\.required");

  private final List<String> outputs;
  private final List<String> realizationOrder;
  private final Map<String, Function> environment;
  private final Map<BoundKey, Interval> funcBounds;
  private final Tracer tracer;
  private final boolean assertDeclaredBounds;
  private final boolean inferInputBounds;
  private final Bounds bounds;
  private final BoxesTouched boxesTouched;

  /** Position of each function in the realization order. */
  private final Map<String, Integer> orderIndex = new HashMap<>();
  /** Fused group of each function; a singleton if the function is unfused. */
  private final Map<String, List<String>> groups = new HashMap<>();
  /** Names of all bindings that this pass creates, except for images. */
  private final Set<String> bindingNames = new HashSet<>();
  /** State of each stage, keyed by stage name, such as "f.s1". */
  private final Map<String, StageState> states = new HashMap<>();

  private BoundsInference(
      List<String> outputs,
      List<String> realizationOrder,
      List<List<String>> fusedGroups,
      Map<String, Function> environment,
      Map<BoundKey, Interval> funcBounds,
      Map<Prop, Object> config,
      Tracer tracer) {
    this.outputs = ImmutableList.copyOf(outputs);
    this.realizationOrder = ImmutableList.copyOf(realizationOrder);
    this.environment = ImmutableMap.copyOf(environment);
    this.funcBounds = ImmutableMap.copyOf(funcBounds);
    this.tracer = requireNonNull(tracer);
    this.assertDeclaredBounds =
        Prop.ASSERT_DECLARED_BOUNDS.booleanValue(config);
    this.inferInputBounds = Prop.INFER_INPUT_BOUNDS.booleanValue(config);
    this.bounds = new Bounds(Prop.SIMPLIFY.booleanValue(config));
    this.boxesTouched = new BoxesTouched(bounds);
    validate(realizationOrder, fusedGroups);
  }

  /**
   * Infers bounds, with default configuration.
   *
   * @param stmt Program, with loops over symbolic stage bounds
   * @param outputs Names of the functions whose values the pipeline returns
   * @param realizationOrder All functions, each before the functions that
   *     call it
   * @param fusedGroups Groups of functions that share loop bounds
   * @param environment Definitions of functions, keyed by name
   * @param funcBounds Bounds given by the user; required for every dimension
   *     of every output
   * @param target Target machine
   * @return Program with bindings for every stage bound
   */
  public static Ir.Stmt inferBounds(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> realizationOrder,
      List<List<String>> fusedGroups,
      Map<String, Function> environment,
      Map<BoundKey, Interval> funcBounds,
      Target target) {
    return inferBounds(
        stmt,
        outputs,
        realizationOrder,
        fusedGroups,
        environment,
        funcBounds,
        target,
        ImmutableMap.of(),
        Tracers.empty());
  }

  /** Infers bounds. */
  public static Ir.Stmt inferBounds(
      Ir.Stmt stmt,
      List<String> outputs,
      List<String> realizationOrder,
      List<List<String>> fusedGroups,
      Map<String, Function> environment,
      Map<BoundKey, Interval> funcBounds,
      Target target,
      Map<Prop, Object> config,
      Tracer tracer) {
    tracer.onTarget(target);
    try {
      final BoundsInference inference =
          new BoundsInference(
              outputs,
              realizationOrder,
              fusedGroups,
              environment,
              funcBounds,
              config,
              tracer);
      return inference.run(stmt);
    } catch (CompileException e) {
      tracer.handleCompileException(e);
      throw e;
    }
  }

  private void validate(
      List<String> realizationOrder, List<List<String>> fusedGroups) {
    for (String name : realizationOrder) {
      final Function function = environment.get(name);
      if (function == null) {
        throw new CompileException(
            "function '" + name + "' in realization order is not defined");
      }
      if (orderIndex.put(name, orderIndex.size()) != null) {
        throw new CompileException(
            "function '" + name + "' occurs more than once in realization "
                + "order");
      }
      groups.put(name, ImmutableList.of(name));
      for (int stage = 0; stage < function.stageCount(); stage++) {
        states.put(Function.stageName(name, stage), StageState.UNVISITED);
        for (int i = 0; i < function.dimensions(); i++) {
          if (function.isPure(stage, i)) {
            bindingNames.add(function.loopMin(stage, function.args.get(i)));
            bindingNames.add(function.loopMax(stage, function.args.get(i)));
          }
        }
      }
      for (int i = 0; i < function.dimensions(); i++) {
        bindingNames.add(Function.realizeMin(name, i));
        bindingNames.add(Function.realizeExtent(name, i));
      }
    }
    for (String output : outputs) {
      final Function function = environment.get(output);
      if (function == null || !orderIndex.containsKey(output)) {
        throw new CompileException(
            "output '" + output + "' is not in the realization order");
      }
      for (int i = 0; i < function.dimensions(); i++) {
        final Interval interval = funcBounds.get(BoundKey.of(output, i));
        if (interval == null || !interval.isBounded()) {
          throw new CompileException(
              "missing bound for dimension " + i + " ('"
                  + function.args.get(i) + "') of output '" + output + "'");
        }
      }
    }
    funcBounds.forEach((key, interval) -> {
      final Function function = environment.get(key.func);
      if (function == null || key.dim >= function.dimensions()) {
        throw new CompileException(
            "bound given for unknown dimension " + key);
      }
      if (!interval.isBounded()) {
        throw new CompileException("bound given for " + key + " is unbounded");
      }
    });
    for (List<String> group : fusedGroups) {
      if (group.isEmpty()) {
        throw inconsistentFusion(group, "group is empty");
      }
      final Function first = environment.get(group.get(0));
      final List<Integer> positions = new ArrayList<>();
      for (String name : group) {
        final Function function = environment.get(name);
        final Integer position = orderIndex.get(name);
        if (function == null || position == null) {
          throw inconsistentFusion(group, "'" + name + "' is not defined");
        }
        if (function.dimensions() != first.dimensions()) {
          throw inconsistentFusion(
              group, "members have different numbers of dimensions");
        }
        if (!function.computeAt.equals(first.computeAt)) {
          throw inconsistentFusion(
              group, "members are computed at different levels");
        }
        if (outputs.contains(name)) {
          throw inconsistentFusion(group, "'" + name + "' is an output");
        }
        if (groups.get(name).size() > 1) {
          throw inconsistentFusion(
              group, "'" + name + "' is in more than one group");
        }
        for (String callee : calls(function)) {
          if (group.contains(callee)) {
            throw inconsistentFusion(
                group, "'" + name + "' calls '" + callee + "'");
          }
        }
        positions.add(position);
      }
      positions.sort(Comparator.naturalOrder());
      if (positions.get(positions.size() - 1) - positions.get(0)
          != positions.size() - 1) {
        throw inconsistentFusion(
            group, "members are not contiguous in realization order");
      }
      final ImmutableList<String> sorted =
          ImmutableList.sortedCopyOf(
              Comparator.comparing(orderIndex::get), group);
      sorted.forEach(name -> groups.put(name, sorted));
    }
  }

  /** Returns the names of the functions that a function calls. */
  private static Set<String> calls(Function function) {
    final Set<String> names = new HashSet<>();
    final Visitor visitor =
        new Visitor() {
          @Override
          protected void visit(Ir.Call call) {
            if (call.callType == Ir.CallType.FUNCTION
                && !call.name.equals(function.name)) {
              names.add(call.name);
            }
            super.visit(call);
          }
        };
    function.definitions.forEach(definition -> {
      definition.args.forEach(arg -> arg.accept(visitor));
      definition.values.forEach(value -> value.accept(visitor));
    });
    return names;
  }

  private static CompileException inconsistentFusion(
      List<String> group, String reason) {
    return new CompileException(
        "inconsistent fusion in group " + group + ": " + reason);
  }

  private Function function(String name) {
    final Function function = environment.get(name);
    if (function == null) {
      throw new CompileException("function '" + name + "' is not defined");
    }
    return function;
  }

  private Ir.Stmt run(Ir.Stmt stmt) {
    Ir.Stmt s = stmt.accept(new Stripper());
    s = new Injector().visitLevel("root", s);
    for (String name : realizationOrder) {
      if (states.get(Function.stageName(name, 0)) != StageState.INJECTED) {
        throw new CompileException(
            "function '" + name + "' is not computed in the program");
      }
    }
    s = injectOutputBindings(s);
    if (inferInputBounds) {
      s = injectImageBindings(s);
    }
    return s;
  }

  /** Returns whether a variable is one that this pass binds. */
  private boolean isInjected(String name) {
    return bindingNames.contains(name) || IMAGE_BINDING.matcher(name).matches();
  }

  /**
   * Returns the names of the functions computed at a level, in realization
   * order.
   */
  private List<String> computedAt(Ir.Stmt body) {
    final List<String> names = new ArrayList<>();
    body.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.For forLoop) {
            // the body of a loop is another level
          }

          @Override
          protected void visit(Ir.ProducerConsumer producerConsumer) {
            if (producerConsumer.producer) {
              names.add(producerConsumer.name);
            }
            super.visit(producerConsumer);
          }
        });
    for (String name : names) {
      function(name);
      if (!orderIndex.containsKey(name)) {
        throw new CompileException(
            "function '" + name + "' is not in the realization order");
      }
    }
    names.sort(Comparator.comparing(orderIndex::get));
    return names;
  }

  /** Returns the names of the stage bounds of a function, for every stage. */
  private static List<String> stageBindingNames(Function function) {
    final List<String> names = new ArrayList<>();
    for (int stage = 0; stage < function.stageCount(); stage++) {
      for (int i = 0; i < function.dimensions(); i++) {
        if (function.isPure(stage, i)) {
          names.add(function.loopMin(stage, function.args.get(i)));
          names.add(function.loopMax(stage, function.args.get(i)));
        }
      }
    }
    return names;
  }

  private static List<String> realizeBindingNames(Function function) {
    final List<String> names = new ArrayList<>();
    for (int i = 0; i < function.dimensions(); i++) {
      names.add(Function.realizeMin(function.name, i));
      names.add(Function.realizeExtent(function.name, i));
    }
    return names;
  }

  /** Moves a stage to the next state; fails if it is not in state "from". */
  private void transition(String stageName, StageState from, StageState to) {
    final StageState state = states.get(stageName);
    if (state != from) {
      throw new CompileException(
          "stage " + stageName + " is computed more than once");
    }
    states.put(stageName, to);
  }

  /**
   * Injects the bindings of the functions computed at a level.
   *
   * @param level Name of the level, "root" or the name of a loop
   * @param computed Functions computed at the level, in realization order
   * @param body Body of the level, after nested levels have been processed
   * @param scope Variables defined outside the level, and the bindings of
   *     the functions computed at the level
   */
  private Ir.Stmt injectLevel(
      String level, List<String> computed, Ir.Stmt body, Scope scope) {
    if (computed.isEmpty()) {
      return body;
    }
    // Null if nothing at the level calls the function
    final Map<String, @Nullable Box> required = new LinkedHashMap<>();
    for (String name : computed) {
      final Function function = function(name);
      final @Nullable Box box =
          boxesTouched.boxRequiredIfCalled(body, name, scope, true);
      if (box != null) {
        checkArgument(
            box.size() == function.dimensions(),
            "%s is called with %s arguments, expected %s",
            name,
            box.size(),
            function.dimensions());
      }
      required.put(name, box);
    }

    // Each unit (a fused group, or a single function) contributes a list of
    // bindings, outermost first. Units later in realization order are
    // outermost.
    final List<Binding> bindings = new ArrayList<>();
    final List<Ir.Stmt> asserts = new ArrayList<>();
    final Set<String> done = new HashSet<>();
    for (String name : Lists.reverse(computed)) {
      if (done.contains(name)) {
        continue;
      }
      final List<String> group = groups.get(name);
      for (String member : group) {
        if (!computed.contains(member)) {
          throw inconsistentFusion(
              group, "members are computed at different levels");
        }
      }
      done.addAll(group);
      bindings.addAll(injectUnit(group, required, scope, asserts));
    }

    Ir.Stmt s = body;
    if (!asserts.isEmpty()) {
      s = ir.block(
          ImmutableList.<Ir.Stmt>builder().addAll(asserts).add(s).build());
    }
    tracer.onBindings(level, Lists.transform(bindings, b -> b.name));
    return wrap(bindings, s);
  }

  /**
   * Computes the region of each stage of the members of a unit, and returns
   * the bindings, outermost first. Adds the assertions for declared bounds to
   * {@code asserts}.
   */
  private List<Binding> injectUnit(
      List<String> group,
      Map<String, @Nullable Box> required,
      Scope scope,
      List<Ir.Stmt> asserts) {
    // What the consumers of the unit require, with and without the bounds
    // that the user declared. Null while no member has a consumer or a
    // declared region.
    @Nullable Box groupRequired = null;
    Box groupDemand = Box.EMPTY;
    for (String member : group) {
      final Function function = function(member);
      final @Nullable Box box = required.get(member);
      final @Nullable Box region =
          box == null ? declaredBox(function) : declared(function, box);
      if (region != null) {
        groupRequired =
            groupRequired == null ? region : groupRequired.union(region);
      }
      if (box != null) {
        groupDemand = groupDemand.union(box);
      }
    }
    if (groupRequired == null) {
      throw new CompileException(
          "function '" + group.get(0) + "' is computed but never used");
    }

    // The region of each update stage, touched by the update itself
    final Map<String, Box> updateRegions = new HashMap<>();
    Box allUpdates = Box.EMPTY;
    int stageCount = 0;
    for (String member : group) {
      final Function function = function(member);
      stageCount = Math.max(stageCount, function.stageCount());
      for (int stage = 1; stage < function.stageCount(); stage++) {
        final Box box = boxesTouched.updateRegion(function, stage, scope);
        updateRegions.put(Function.stageName(member, stage), box);
        allUpdates = allUpdates.union(box);
      }
    }

    final List<Binding> bindings = new ArrayList<>();
    for (int stage = stageCount - 1; stage >= 0; stage--) {
      for (String member : Lists.reverse(group)) {
        final Function function = function(member);
        if (stage >= function.stageCount()) {
          continue;
        }
        final String stageName = Function.stageName(member, stage);
        transition(
            stageName, StageState.UNVISITED, StageState.REGION_ACCUMULATED);

        // Stage k covers what consumers require, plus what later updates
        // touch. Stage 0 of a fused group covers the updates of every member.
        Box later = Box.EMPTY;
        if (stage == 0) {
          later = allUpdates;
        } else {
          for (int j = stage + 1; j < function.stageCount(); j++) {
            later = later.union(
                requireNonNull(
                    updateRegions.get(Function.stageName(member, j))));
          }
        }
        final Box region =
            bounds.simplify(declared(function, groupRequired.union(later)));
        final Box demand = bounds.simplify(groupDemand.union(later));
        tracer.onBox(member, stage, region);

        for (int i = 0; i < function.dimensions(); i++) {
          if (!function.isPure(stage, i)) {
            continue;
          }
          final String arg = function.args.get(i);
          final Interval interval = region.get(i);
          if (!interval.isBounded()) {
            throw new CompileException(
                "could not infer bounds of " + stageName + " in dimension "
                    + i + " ('" + arg + "'); required region is " + interval,
                function.loopVar(stage, arg));
          }
          bindings.add(
              new Binding(function.loopMin(stage, arg), interval.lowerBound()));
          bindings.add(
              new Binding(function.loopMax(stage, arg), interval.upperBound()));
          if (stage == 0 && assertDeclaredBounds && !demand.isEmpty()) {
            final Interval declared = funcBounds.get(BoundKey.of(member, i));
            if (declared != null) {
              addAssert(asserts, stageName, arg, declared, demand.get(i));
            }
          }
        }
        transition(
            stageName, StageState.REGION_ACCUMULATED, StageState.INJECTED);
      }
    }
    return bindings;
  }

  /**
   * Returns the bounds the user declared for a function that nothing calls,
   * or null if it has none. An output of zero dimensions has the empty box.
   */
  private @Nullable Box declaredBox(Function function) {
    final List<Interval> intervals = new ArrayList<>();
    for (int i = 0; i < function.dimensions(); i++) {
      final Interval interval = funcBounds.get(BoundKey.of(function.name, i));
      if (interval == null) {
        return null;
      }
      intervals.add(interval);
    }
    if (intervals.isEmpty() && !outputs.contains(function.name)) {
      return null;
    }
    return Box.of(intervals);
  }

  /** Replaces the dimensions of a box for which the user declared bounds. */
  private Box declared(Function function, Box box) {
    Box b = box;
    for (int i = 0; i < function.dimensions(); i++) {
      final Interval interval = funcBounds.get(BoundKey.of(function.name, i));
      if (interval != null) {
        b = b.with(i, interval);
      }
    }
    return b;
  }

  /**
   * Adds an assertion that the region required of a stage lies within the
   * bounds the user declared.
   */
  private void addAssert(
      List<Ir.Stmt> asserts,
      String stageName,
      String arg,
      Interval declared,
      Interval demand) {
    if (!demand.isBounded()) {
      return;
    }
    final Ir.Exp condition =
        Simplifier.simplify(
            ir.and(
                ir.lessThanOrEqualTo(
                    declared.lowerBound(), demand.lowerBound()),
                ir.lessThanOrEqualTo(
                    demand.upperBound(), declared.upperBound())));
    if (condition.equals(ir.intLiteral(1))) {
      return;
    }
    asserts.add(
        ir.assertStmt(
            condition,
            ASSERT_PREFIX + stageName + " in dimension '" + arg
                + "' exceeds its declared bounds " + declared));
  }

  /**
   * Injects "f.min.i" and "f.extent.i" around the realize node of f.
   *
   * <p>The bounds are the stage 0 bounds of f, relaxed over each loop and let
   * between the realize node and the node that produces f.
   */
  private Ir.Stmt injectRealize(
      Function function, Ir.Stmt realize, Scope scope) {
    final Scope producerScope = scopeAtProducer(realize, function.name, scope);
    if (producerScope == null) {
      throw new CompileException(
          "realization of '" + function.name + "' does not contain its "
              + "producer");
    }
    final List<Binding> bindings = new ArrayList<>();
    for (int i = 0; i < function.dimensions(); i++) {
      final String arg = function.args.get(i);
      final Interval min =
          bounds.of(ir.var(function.loopMin(0, arg)), producerScope);
      final Interval max =
          bounds.of(ir.var(function.loopMax(0, arg)), producerScope);
      if (!min.hasLowerBound() || !max.hasUpperBound()) {
        throw new CompileException(
            "could not infer bounds of realization of '" + function.name
                + "' in dimension " + i + " ('" + arg + "')",
            function.name);
      }
      bindings.add(
          new Binding(Function.realizeMin(function.name, i), min.lowerBound()));
      bindings.add(
          new Binding(
              Function.realizeExtent(function.name, i),
              extent(min.lowerBound(), max.upperBound())));
    }
    tracer.onBindings(
        "realize " + function.name, Lists.transform(bindings, b -> b.name));
    return wrap(bindings, realize);
  }

  /**
   * Returns the scope at the node that produces a function, with the
   * variables of loops and lets on the way bound to their ranges; or null if
   * the function is not produced in {@code stmt}.
   */
  private @Nullable Scope scopeAtProducer(
      Ir.Stmt stmt, String name, Scope scope) {
    switch (stmt.op) {
      case FOR:
        final Ir.For forLoop = (Ir.For) stmt;
        return scopeAtProducer(
            forLoop.body,
            name,
            scope.bind(
                forLoop.name,
                boxesTouched.loopInterval(forLoop.min, forLoop.extent, scope)));

      case LET_STMT:
        final Ir.LetStmt letStmt = (Ir.LetStmt) stmt;
        return scopeAtProducer(
            letStmt.body,
            name,
            scope.bind(letStmt.name, bounds.of(letStmt.value, scope)));

      case PRODUCER_CONSUMER:
        final Ir.ProducerConsumer producerConsumer = (Ir.ProducerConsumer) stmt;
        if (producerConsumer.producer && producerConsumer.name.equals(name)) {
          return scope;
        }
        return scopeAtProducer(producerConsumer.body, name, scope);

      case REALIZE:
        return scopeAtProducer(((Ir.Realize) stmt).body, name, scope);

      case BLOCK:
        for (Ir.Stmt s : ((Ir.Block) stmt).stmts) {
          final Scope scope2 = scopeAtProducer(s, name, scope);
          if (scope2 != null) {
            return scope2;
          }
        }
        return null;

      case IF_THEN_ELSE:
        final Ir.IfThenElse ifThenElse = (Ir.IfThenElse) stmt;
        final Scope thenScope =
            scopeAtProducer(ifThenElse.thenCase, name, scope);
        if (thenScope != null || ifThenElse.elseCase == null) {
          return thenScope;
        }
        return scopeAtProducer(ifThenElse.elseCase, name, scope);

      default:
        return null;
    }
  }

  /** Binds "g.min.i" and "g.extent.i" of each output from its bounds. */
  private Ir.Stmt injectOutputBindings(Ir.Stmt stmt) {
    final List<Binding> bindings = new ArrayList<>();
    for (String output : outputs) {
      final Function function = function(output);
      for (int i = 0; i < function.dimensions(); i++) {
        final Interval interval =
            requireNonNull(funcBounds.get(BoundKey.of(output, i)));
        bindings.add(
            new Binding(Function.realizeMin(output, i), interval.lowerBound()));
        bindings.add(
            new Binding(
                Function.realizeExtent(output, i),
                extent(interval.lowerBound(), interval.upperBound())));
      }
    }
    if (bindings.isEmpty()) {
      return stmt;
    }
    tracer.onBindings("root", Lists.transform(bindings, b -> b.name));
    return wrap(bindings, stmt);
  }

  /**
   * Binds "img.min.i.required" and "img.extent.i.required" for each input
   * image to the region of the image that the program reads.
   */
  private Ir.Stmt injectImageBindings(Ir.Stmt stmt) {
    final Map<String, Box> boxes =
        boxesTouched.imagesRequired(stmt, Scope.empty());
    final List<Binding> bindings = new ArrayList<>();
    boxes.forEach((image, box) -> {
      for (int i = 0; i < box.size(); i++) {
        final Interval interval = box.get(i);
        if (!interval.isBounded()) {
          throw new CompileException(
              "could not infer bounds of input image '" + image
                  + "' in dimension " + i + "; required region is " + interval,
              image);
        }
        bindings.add(
            new Binding(
                image + ".min." + i + ".required", interval.lowerBound()));
        bindings.add(
            new Binding(
                image + ".extent." + i + ".required",
                extent(interval.lowerBound(), interval.upperBound())));
      }
    });
    if (bindings.isEmpty()) {
      return stmt;
    }
    tracer.onBindings("root", Lists.transform(bindings, b -> b.name));
    return wrap(bindings, stmt);
  }

  /** Returns "max - min + 1", simplified if configured. */
  private Ir.Exp extent(Ir.Exp min, Ir.Exp max) {
    return bounds
        .simplify(Interval.point(ir.plus(ir.minus(max, min), 1)))
        .lowerBound();
  }

  /** Wraps a statement in let statements; the first binding is outermost. */
  private static Ir.Stmt wrap(List<Binding> bindings, Ir.Stmt stmt) {
    Ir.Stmt s = stmt;
    for (Binding binding : Lists.reverse(bindings)) {
      s = ir.letStmt(binding.name, binding.value, s);
    }
    return s;
  }

  /** State of a stage during bounds inference. */
  enum StageState {
    /** The stage's level has not been processed yet. */
    UNVISITED,
    /** The stage's region has been computed. */
    REGION_ACCUMULATED,
    /** The stage's bindings have been injected into the program. */
    INJECTED
  }

  /** Variable that this pass binds, and its value. */
  private static class Binding {
    final String name;
    final Ir.Exp value;

    Binding(String name, Ir.Exp value) {
      this.name = name;
      this.value = value;
    }
  }

  /** Removes the bindings and assertions that a previous run injected. */
  private class Stripper extends Shuttle {
    @Override
    protected Ir.Stmt visit(Ir.LetStmt letStmt) {
      if (isInjected(letStmt.name)) {
        return letStmt.body.accept(this);
      }
      return super.visit(letStmt);
    }

    @Override
    protected Ir.Stmt visit(Ir.Block block) {
      final List<Ir.Stmt> stmts = new ArrayList<>();
      for (Ir.Stmt stmt : block.stmts) {
        if (stmt instanceof Ir.AssertStmt
            && ((Ir.AssertStmt) stmt).message.startsWith(ASSERT_PREFIX)) {
          continue;
        }
        stmts.add(stmt.accept(this));
      }
      return stmts.isEmpty() ? ir.noOp() : block.copy(stmts);
    }
  }

  /**
   * Walks the program, processing each level after the levels nested within
   * it, and keeping track of the variables defined outside the current node.
   */
  private class Injector extends Shuttle {
    private Scope known = Scope.empty();

    Ir.Stmt visitLevel(String level, Ir.Stmt body) {
      final List<String> computed = computedAt(body);
      final Scope saved = known;
      for (String name : computed) {
        known = known.declareAll(stageBindingNames(function(name)));
      }
      final Ir.Stmt newBody = body.accept(this);
      final Ir.Stmt result = injectLevel(level, computed, newBody, known);
      known = saved;
      return result;
    }

    @Override
    protected Ir.Stmt visit(Ir.For forLoop) {
      final Scope saved = known;
      known = known.declare(forLoop.name);
      final Ir.Stmt body = visitLevel(forLoop.name, forLoop.body);
      known = saved;
      return forLoop.copy(forLoop.min, forLoop.extent, body);
    }

    @Override
    protected Ir.Stmt visit(Ir.LetStmt letStmt) {
      final Scope saved = known;
      known = known.declare(letStmt.name);
      final Ir.Stmt body = letStmt.body.accept(this);
      known = saved;
      return letStmt.copy(letStmt.value, body);
    }

    @Override
    protected Ir.Stmt visit(Ir.Realize realize) {
      final Function function = environment.get(realize.name);
      if (function == null) {
        return super.visit(realize);
      }
      final Scope saved = known;
      known = known.declareAll(realizeBindingNames(function));
      final Ir.Stmt body = realize.body.accept(this);
      known = saved;
      return injectRealize(function, realize.copy(body), known);
    }
  }
}

// End BoundsInference.java
