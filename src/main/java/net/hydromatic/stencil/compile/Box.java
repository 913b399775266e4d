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
import static net.hydromatic.stencil.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Multi-dimensional region; a list of {@link Interval}, one per dimension.
 *
 * <p>{@link #EMPTY} has no dimensions. It is the identity of {@link #union},
 * and also the region of a function that nothing uses.
 */
public class Box {
  public static final Box EMPTY = new Box(ImmutableList.of());

  public final List<Interval> intervals;

  private Box(ImmutableList<Interval> intervals) {
    this.intervals = intervals;
  }

  public static Box of(List<Interval> intervals) {
    return intervals.isEmpty()
        ? EMPTY
        : new Box(ImmutableList.copyOf(intervals));
  }

  public static Box of(Interval... intervals) {
    return of(ImmutableList.copyOf(intervals));
  }

  /** Returns the number of dimensions. */
  public int size() {
    return intervals.size();
  }

  /** Returns the interval of dimension {@code i}. */
  public Interval get(int i) {
    return intervals.get(i);
  }

  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  /** Returns a copy of this box with dimension {@code i} replaced. */
  public Box with(int i, Interval interval) {
    final List<Interval> list = new ArrayList<>(intervals);
    list.set(i, interval);
    return of(list);
  }

  /** Applies a transform to every interval. */
  public Box map(UnaryOperator<Interval> transform) {
    return of(transformEager(intervals, transform));
  }

  /**
   * Returns the smallest box that contains this box and another.
   *
   * @throws IllegalArgumentException if both boxes are non-empty and have
   *     different numbers of dimensions
   */
  public Box union(Box other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    checkArgument(
        size() == other.size(),
        "cannot union boxes of %s and %s dimensions",
        size(),
        other.size());
    final ImmutableList.Builder<Interval> b = ImmutableList.builder();
    for (int i = 0; i < intervals.size(); i++) {
      b.add(intervals.get(i).union(other.intervals.get(i)));
    }
    return new Box(b.build());
  }

  /** Returns the union of a list of boxes; {@link #EMPTY} if the list is. */
  public static Box union(List<Box> boxes) {
    Box box = EMPTY;
    for (Box b : boxes) {
      box = box.union(b);
    }
    return box;
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Box && ((Box) o).intervals.equals(intervals);
  }

  @Override
  public String toString() {
    return intervals.toString();
  }
}

// End Box.java
