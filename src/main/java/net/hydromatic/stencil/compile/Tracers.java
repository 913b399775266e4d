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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.stencil.pipeline.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the target, then calls
   * the underlying tracer.
   */
  public static Tracer withOnTarget(Tracer tracer, Consumer<Target> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTarget(Target target) {
        consumer.accept(target);
        super.onTarget(target);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the region of each
   * stage of a given function, then calls the underlying tracer.
   */
  public static Tracer withOnBox(
      Tracer tracer, String func, BiConsumer<Integer, Box> consumer) {
    final String expectedFunc = func;
    return new DelegatingTracer(tracer) {
      @Override
      public void onBox(String func, int stage, Box box) {
        if (func.equals(expectedFunc)) {
          consumer.accept(stage, box);
        }
        super.onBox(func, stage, box);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the bindings injected
   * at each level, then calls the underlying tracer.
   */
  public static Tracer withOnBindings(
      Tracer tracer, BiConsumer<String, List<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBindings(String level, List<String> names) {
        consumer.accept(level, names);
        super.onBindings(level, names);
      }
    };
  }

  public static Tracer withOnCompileException(
      Tracer tracer, Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTarget(Target target) {}

    @Override
    public void onBox(String func, int stage, Box box) {}

    @Override
    public void onBindings(String level, List<String> names) {}

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onTarget(Target target) {
      tracer.onTarget(target);
    }

    @Override
    public void onBox(String func, int stage, Box box) {
      tracer.onBox(func, stage, box);
    }

    @Override
    public void onBindings(String level, List<String> names) {
      tracer.onBindings(level, names);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
