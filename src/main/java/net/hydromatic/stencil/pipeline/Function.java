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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.stencil.ast.IrBuilder.ir;
import static net.hydromatic.stencil.util.Static.append;
import static net.hydromatic.stencil.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.stencil.ast.Ir;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function of a pipeline.
 *
 * <p>A function has a name, a list of pure variables (its dimensions), a pure
 * definition and zero or more update definitions. Each definition is a
 * <em>stage</em>; stage 0 is the pure definition. The schedule says at which
 * loop level the function is computed and at which it is stored.
 *
 * <p>A function is immutable; methods such as {@link #update} and {@link
 * #computeAt} return a new function.
 */
public class Function {
  public final String name;
  public final List<String> args;
  public final List<Definition> definitions;
  public final LoopLevel computeAt;
  public final LoopLevel storeAt;

  private Function(
      String name,
      ImmutableList<String> args,
      ImmutableList<Definition> definitions,
      LoopLevel computeAt,
      LoopLevel storeAt) {
    this.name = requireNonNull(name);
    this.args = requireNonNull(args);
    this.definitions = requireNonNull(definitions);
    this.computeAt = requireNonNull(computeAt);
    this.storeAt = requireNonNull(storeAt);
    checkArgument(!name.isEmpty() && !name.contains("."), "bad name %s", name);
    checkArgument(!definitions.isEmpty(), "function has no definition");
    final Set<String> argSet = new HashSet<>();
    for (String arg : args) {
      checkArgument(
          !arg.isEmpty() && !arg.contains("."), "bad variable name %s", arg);
      checkArgument(argSet.add(arg), "duplicate variable %s", arg);
    }
    final int valueCount = definitions.get(0).values.size();
    for (Definition definition : definitions) {
      checkArgument(
          definition.args.size() == args.size(),
          "definition of %s has %s arguments, expected %s",
          name,
          definition.args.size(),
          args.size());
      checkArgument(
          definition.values.size() == valueCount,
          "definition of %s has %s values, expected %s",
          name,
          definition.values.size(),
          valueCount);
      if (definition.rdom != null) {
        for (ReductionDomain.RVar v : definition.rdom.vars) {
          checkArgument(
              !argSet.contains(v.name),
              "reduction variable %s has the same name as a variable of %s",
              v.name,
              name);
        }
      }
    }
    final Definition pure = definitions.get(0);
    for (int i = 0; i < args.size(); i++) {
      checkArgument(
          pure.isPure(i, args.get(i)),
          "argument %s of pure definition of %s must be %s",
          i,
          name,
          args.get(i));
    }
    checkArgument(pure.rdom == null, "pure definition has reduction domain");
  }

  /** Creates a function with a pure definition, computed and stored at root. */
  public static Function create(
      String name, List<String> args, List<? extends Ir.Exp> values) {
    final ImmutableList<Ir.Exp> argExps = transformEager(args, ir::var);
    return new Function(
        name,
        ImmutableList.copyOf(args),
        ImmutableList.of(new Definition(argExps, values, null)),
        LoopLevel.root(),
        LoopLevel.root());
  }

  /** Creates a function whose pure definition has a single value. */
  public static Function create(String name, List<String> args, Ir.Exp value) {
    return create(name, args, ImmutableList.of(value));
  }

  /** Returns a function that is this plus an update definition. */
  public Function update(
      List<? extends Ir.Exp> args,
      List<? extends Ir.Exp> values,
      @Nullable ReductionDomain rdom) {
    final Definition update = new Definition(args, values, rdom);
    return new Function(
        name,
        ImmutableList.copyOf(this.args),
        ImmutableList.copyOf(append(definitions, update)),
        computeAt,
        storeAt);
  }

  /** Returns a function that is this plus an update with a single value. */
  public Function update(
      List<? extends Ir.Exp> args,
      Ir.Exp value,
      @Nullable ReductionDomain rdom) {
    return update(args, ImmutableList.of(value), rdom);
  }

  /**
   * Returns a copy of this function computed at a given level. If the storage
   * level was the same as the old compute level, it moves too.
   */
  public Function computeAt(LoopLevel level) {
    final LoopLevel storeAt =
        this.storeAt.equals(this.computeAt) ? level : this.storeAt;
    return new Function(
        name, ImmutableList.copyOf(args), ImmutableList.copyOf(definitions),
        level, storeAt);
  }

  /** Returns a copy of this function stored at a given level. */
  public Function storeAt(LoopLevel level) {
    return new Function(
        name, ImmutableList.copyOf(args), ImmutableList.copyOf(definitions),
        computeAt, level);
  }

  /** Returns the number of dimensions. */
  public int dimensions() {
    return args.size();
  }

  /** Returns the number of stages, 1 plus the number of updates. */
  public int stageCount() {
    return definitions.size();
  }

  /** Returns the definition of a stage. */
  public Definition definition(int stage) {
    return definitions.get(stage);
  }

  /** Returns the update definitions. */
  public List<Definition> updates() {
    return definitions.subList(1, definitions.size());
  }

  /** Returns whether dimension {@code i} is a loop of stage {@code stage}. */
  public boolean isPure(int stage, int i) {
    return definition(stage).isPure(i, args.get(i));
  }

  /** Returns the name of a stage, for example "f.s1". */
  public static String stageName(String func, int stage) {
    return func + ".s" + stage;
  }

  /** Returns the name of a stage's loop variable, for example "f.s1.x". */
  public static String loopVar(String func, int stage, String var) {
    return stageName(func, stage) + "." + var;
  }

  /** Returns the name of this function's loop variable, e.g. "f.s1.x". */
  public String loopVar(int stage, String var) {
    return loopVar(name, stage, var);
  }

  /** Returns the name of the lower bound of a stage's loop, "f.s1.x.min". */
  public String loopMin(int stage, String var) {
    return loopVar(stage, var) + ".min";
  }

  /** Returns the name of the upper bound of a stage's loop, "f.s1.x.max". */
  public String loopMax(int stage, String var) {
    return loopVar(stage, var) + ".max";
  }

  /** Returns the name of the minimum of dimension {@code i} of storage. */
  public static String realizeMin(String func, int i) {
    return func + ".min." + i;
  }

  /** Returns the name of the extent of dimension {@code i} of storage. */
  public static String realizeExtent(String func, int i) {
    return func + ".extent." + i;
  }

  /**
   * Returns the loop variables of a stage, keyed by the names used in its
   * definition.
   *
   * <p>For example, if {@code f(x, y)} has an update {@code f(x, r) = ...}
   * over the reduction domain {@code r}, stage 1 has variables {@code x:
   * f.s1.x, r: f.s1.r}; {@code y} is not a variable of that stage.
   */
  public ImmutableMap<String, Ir.Var> stageVariables(int stage) {
    final Definition definition = definition(stage);
    final ImmutableMap.Builder<String, Ir.Var> b = ImmutableMap.builder();
    for (int i = 0; i < args.size(); i++) {
      if (definition.isPure(i, args.get(i))) {
        b.put(args.get(i), ir.var(loopVar(stage, args.get(i))));
      }
    }
    if (definition.rdom != null) {
      for (ReductionDomain.RVar v : definition.rdom.vars) {
        b.put(v.name, ir.var(loopVar(stage, v.name)));
      }
    }
    return b.build();
  }

  @Override
  public String toString() {
    return name + args;
  }
}

// End Function.java
