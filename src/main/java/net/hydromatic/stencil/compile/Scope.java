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
import static net.hydromatic.stencil.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable map from variable names to the intervals over which they range.
 *
 * <p>A scope is a chain; binding a variable returns a new scope whose parent
 * is the old one, and a binding hides any binding of the same name in its
 * ancestors.
 *
 * <p>A variable that is <em>declared</em> is bound to the point interval of
 * itself: its value is not known, but it is fixed while the region being
 * analyzed executes, so bounds may refer to it.
 */
public abstract class Scope {
  /** Returns the empty scope. */
  public static Scope empty() {
    return EmptyScope.INSTANCE;
  }

  /** Returns the interval of a variable, or null if it is not bound. */
  public abstract @Nullable Interval getOpt(String name);

  /** Returns whether a variable is bound. */
  public boolean contains(String name) {
    return getOpt(name) != null;
  }

  /** Creates a scope that is this plus a binding. */
  public Scope bind(String name, Interval interval) {
    return new SubScope(this, name, interval);
  }

  /** Creates a scope that is this plus several bindings. */
  public Scope bindAll(Map<String, Interval> map) {
    return map.isEmpty() ? this : new MapScope(this, ImmutableMap.copyOf(map));
  }

  /** Creates a scope in which a variable stands for itself. */
  public Scope declare(String name) {
    return bind(name, Interval.point(ir.var(name)));
  }

  /** Creates a scope in which several variables stand for themselves. */
  public Scope declareAll(Iterable<String> names) {
    final Map<String, Interval> map = new LinkedHashMap<>();
    names.forEach(name -> map.put(name, Interval.point(ir.var(name))));
    return bindAll(map);
  }

  /** Scope that binds one variable. */
  private static class SubScope extends Scope {
    private final Scope parent;
    private final String name;
    private final Interval interval;

    SubScope(Scope parent, String name, Interval interval) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.interval = requireNonNull(interval);
    }

    @Override
    public @Nullable Interval getOpt(String name) {
      return name.equals(this.name) ? interval : parent.getOpt(name);
    }

    @Override
    public String toString() {
      return name + ": " + interval + "; " + parent;
    }
  }

  /** Scope that keeps bindings in a map. */
  private static class MapScope extends Scope {
    private final Scope parent;
    private final ImmutableMap<String, Interval> map;

    MapScope(Scope parent, ImmutableMap<String, Interval> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override
    public @Nullable Interval getOpt(String name) {
      final Interval interval = map.get(name);
      return interval != null ? interval : parent.getOpt(name);
    }

    @Override
    public String toString() {
      return map + "; " + parent;
    }
  }

  /** Empty scope. */
  private static class EmptyScope extends Scope {
    static final EmptyScope INSTANCE = new EmptyScope();

    @Override
    public @Nullable Interval getOpt(String name) {
      return null;
    }

    @Override
    public String toString() {
      return "{}";
    }
  }
}

// End Scope.java
