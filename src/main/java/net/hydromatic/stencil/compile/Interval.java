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

import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.stencil.ast.Ir;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Closed range of integer values whose ends are symbolic expressions.
 *
 * <p>Each end is either an expression or absent; an absent end means that
 * the range is unbounded in that direction. (There is no expression for
 * infinity.) Like {@link com.google.common.collect.Range}, call {@link
 * #hasLowerBound()} before {@link #lowerBound()}.
 */
public class Interval {
  private static final Interval EVERYTHING = new Interval(null, null);

  public final Ir.@Nullable Exp min;
  public final Ir.@Nullable Exp max;

  private Interval(Ir.@Nullable Exp min, Ir.@Nullable Exp max) {
    this.min = min;
    this.max = max;
  }

  /** Creates an interval that contains only the value of {@code e}. */
  public static Interval point(Ir.Exp e) {
    return new Interval(requireNonNull(e), e);
  }

  /** Creates an interval {@code [min, max]}. */
  public static Interval of(Ir.Exp min, Ir.Exp max) {
    return new Interval(requireNonNull(min), requireNonNull(max));
  }

  /** Creates an interval {@code [min, max]}. */
  public static Interval of(long min, long max) {
    return of(ir.intLiteral(min), ir.intLiteral(max));
  }

  /** Creates an interval with either end optional. */
  public static Interval create(Ir.@Nullable Exp min, Ir.@Nullable Exp max) {
    return min == null && max == null ? EVERYTHING : new Interval(min, max);
  }

  /** Returns the interval that contains every value. */
  public static Interval everything() {
    return EVERYTHING;
  }

  /** Creates an interval that is bounded below only. */
  public static Interval atLeast(Ir.Exp min) {
    return new Interval(requireNonNull(min), null);
  }

  /** Creates an interval that is bounded above only. */
  public static Interval atMost(Ir.Exp max) {
    return new Interval(null, requireNonNull(max));
  }

  public boolean hasLowerBound() {
    return min != null;
  }

  public boolean hasUpperBound() {
    return max != null;
  }

  /** Returns the lower bound; throws if there is none. */
  public Ir.Exp lowerBound() {
    return requireNonNull(min, "interval has no lower bound");
  }

  /** Returns the upper bound; throws if there is none. */
  public Ir.Exp upperBound() {
    return requireNonNull(max, "interval has no upper bound");
  }

  /** Returns whether this interval is bounded at both ends. */
  public boolean isBounded() {
    return min != null && max != null;
  }

  /** Returns whether this interval is unbounded at both ends. */
  public boolean isEverything() {
    return min == null && max == null;
  }

  /** Returns whether both ends are the same expression. */
  public boolean isPoint() {
    return min != null && min.equals(max);
  }

  /** Returns whether this interval is the single value {@code v}. */
  public boolean isConstant(long v) {
    return isPoint()
        && min instanceof Ir.IntLiteral
        && ((Ir.IntLiteral) min).value == v;
  }

  /**
   * Returns the smallest interval that contains this interval and another.
   *
   * <p>An end is bounded only if it is bounded in both intervals. Ends that
   * are the same expression are kept as they are; otherwise the end is a call
   * to "min" or "max", which the caller may wish to simplify.
   */
  public Interval union(Interval other) {
    final Ir.Exp min;
    if (this.min == null || other.min == null) {
      min = null;
    } else if (this.min.equals(other.min)) {
      min = this.min;
    } else {
      min = ir.min(this.min, other.min);
    }
    final Ir.Exp max;
    if (this.max == null || other.max == null) {
      max = null;
    } else if (this.max.equals(other.max)) {
      max = this.max;
    } else {
      max = ir.max(this.max, other.max);
    }
    return create(min, max);
  }

  /** Applies a transform to each end of this interval. */
  public Interval map(UnaryOperator<Ir.Exp> transform) {
    final Ir.Exp min = this.min == null ? null : transform.apply(this.min);
    final Ir.Exp max;
    if (this.max == null) {
      max = null;
    } else if (this.max == this.min) {
      max = min;
    } else {
      max = transform.apply(this.max);
    }
    return min == this.min && max == this.max ? this : create(min, max);
  }

  @Override
  public int hashCode() {
    return Objects.hash(min, max);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Interval
            && Objects.equals(((Interval) o).min, min)
            && Objects.equals(((Interval) o).max, max);
  }

  @Override
  public String toString() {
    return "["
        + (min == null ? "-inf" : min.toString())
        + ", "
        + (max == null ? "+inf" : max.toString())
        + "]";
  }
}

// End Interval.java
