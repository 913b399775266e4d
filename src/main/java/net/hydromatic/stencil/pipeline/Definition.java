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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.stencil.ast.Ir;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of one stage of a function: "f(args) = values".
 *
 * <p>The pure definition (stage 0) has the function's pure variables as its
 * arguments. An update definition (stage 1 or later) may have arbitrary
 * argument expressions, and may iterate over a {@link ReductionDomain}.
 */
public class Definition {
  public final List<Ir.Exp> args;
  public final List<Ir.Exp> values;
  public final @Nullable ReductionDomain rdom;

  Definition(
      List<? extends Ir.Exp> args,
      List<? extends Ir.Exp> values,
      @Nullable ReductionDomain rdom) {
    this.args = ImmutableList.copyOf(args);
    this.values = ImmutableList.copyOf(values);
    this.rdom = rdom;
    checkArgument(!this.values.isEmpty(), "definition has no values");
  }

  /**
   * Returns whether argument {@code i} is the pure variable {@code var}, that
   * is, whether this stage iterates over dimension {@code i} in its own loop.
   */
  public boolean isPure(int i, String var) {
    final Ir.Exp arg = args.get(i);
    return arg instanceof Ir.Var
        && ((Ir.Var) arg).name.equals(var)
        && !((Ir.Var) arg).param;
  }

  /** Returns the reduction domain; throws if there is none. */
  public ReductionDomain rdom() {
    return requireNonNull(rdom, "rdom");
  }

  @Override
  public String toString() {
    return args + " = " + values + (rdom == null ? "" : " over " + rdom);
  }
}

// End Definition.java
