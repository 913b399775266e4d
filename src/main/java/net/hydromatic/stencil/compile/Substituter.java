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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.Shuttle;

/**
 * Replaces variables with expressions.
 *
 * <p>Parameters are never replaced. A {@link Ir.Let} that binds a variable of
 * the substitution hides it in the let's body.
 */
public class Substituter extends Shuttle {
  protected final Map<String, ? extends Ir.Exp> substitution;

  private Substituter(Map<String, ? extends Ir.Exp> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Replaces variables in an expression. */
  public static Ir.Exp substitute(
      Map<String, ? extends Ir.Exp> substitution, Ir.Exp exp) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return exp.accept(new Substituter(substitution));
  }

  @Override
  protected Ir.Exp visit(Ir.Var var) {
    if (var.param) {
      return var;
    }
    final Ir.Exp exp = substitution.get(var.name);
    return exp != null ? exp : var;
  }

  @Override
  protected Ir.Exp visit(Ir.Let let) {
    final Ir.Exp value = let.value.accept(this);
    if (!substitution.containsKey(let.name)) {
      return let.copy(value, let.body.accept(this));
    }
    final Map<String, Ir.Exp> map = new LinkedHashMap<>(substitution);
    map.remove(let.name);
    return let.copy(value, substitute(ImmutableMap.copyOf(map), let.body));
  }
}

// End Substituter.java
