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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Place in the loop nest at which a function is computed or stored.
 *
 * <p>Either the root (outside every loop) or the loop over variable {@code
 * var} of stage {@code stage} of function {@code func}.
 */
public class LoopLevel {
  private static final LoopLevel ROOT = new LoopLevel(null, null, 0);

  public final @Nullable String func;
  public final @Nullable String var;
  public final int stage;

  private LoopLevel(@Nullable String func, @Nullable String var, int stage) {
    this.func = func;
    this.var = var;
    this.stage = stage;
    checkArgument(stage >= 0, "negative stage");
  }

  /** Returns the root level. */
  public static LoopLevel root() {
    return ROOT;
  }

  /** Returns the level of the loop over {@code var} in stage 0 of a func. */
  public static LoopLevel at(String func, String var) {
    return at(func, var, 0);
  }

  /** Returns the level of the loop over {@code var} in a stage of a func. */
  public static LoopLevel at(String func, String var, int stage) {
    return new LoopLevel(requireNonNull(func), requireNonNull(var), stage);
  }

  public boolean isRoot() {
    return func == null;
  }

  /** Returns the name of the loop, for example "g.s0.y"; root has no loop. */
  public String loopName() {
    if (func == null || var == null) {
      throw new IllegalStateException("root has no loop");
    }
    return Function.loopVar(func, stage, var);
  }

  @Override
  public int hashCode() {
    return Objects.hash(func, var, stage);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LoopLevel
            && Objects.equals(((LoopLevel) o).func, func)
            && Objects.equals(((LoopLevel) o).var, var)
            && ((LoopLevel) o).stage == stage;
  }

  @Override
  public String toString() {
    return isRoot() ? "root" : loopName();
  }
}

// End LoopLevel.java
