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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.stencil.ast.Ir;

/**
 * Domain of a reduction: the variables an update definition iterates over in
 * addition to its pure variables.
 *
 * <p>Variables are listed innermost first. The bounds of each variable are
 * expressions that may refer only to parameters of the pipeline.
 */
public class ReductionDomain {
  public final List<RVar> vars;

  private ReductionDomain(ImmutableList<RVar> vars) {
    this.vars = requireNonNull(vars);
    checkArgument(!vars.isEmpty(), "reduction domain has no variables");
    final Set<String> names = new HashSet<>();
    vars.forEach(
        v ->
            checkArgument(
                names.add(v.name), "duplicate reduction variable %s", v.name));
  }

  /** Creates a reduction domain. */
  public static ReductionDomain of(List<RVar> vars) {
    return new ReductionDomain(ImmutableList.copyOf(vars));
  }

  /** Creates a reduction domain of one variable. */
  public static ReductionDomain of(String name, Ir.Exp min, Ir.Exp extent) {
    return of(ImmutableList.of(new RVar(name, min, extent)));
  }

  /** Returns whether this domain has a variable of the given name. */
  public boolean contains(String name) {
    return vars.stream().anyMatch(v -> v.name.equals(name));
  }

  @Override
  public String toString() {
    return vars.toString();
  }

  /** Reduction variable; ranges over {@code [min, min + extent)}. */
  public static class RVar {
    public final String name;
    public final Ir.Exp min;
    public final Ir.Exp extent;

    public RVar(String name, Ir.Exp min, Ir.Exp extent) {
      this.name = requireNonNull(name);
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
      checkArgument(
          !name.isEmpty() && !name.contains("."), "bad name %s", name);
    }

    @Override
    public String toString() {
      return name + " in [" + min + ", " + extent + "]";
    }
  }
}

// End ReductionDomain.java
