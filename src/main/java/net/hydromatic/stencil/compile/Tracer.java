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
import net.hydromatic.stencil.pipeline.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during bounds inference. */
public interface Tracer {
  /** Called with the target that the pipeline is being compiled for. */
  void onTarget(Target target);

  /**
   * Called when the region that a stage of a function must compute has been
   * determined.
   */
  void onBox(String func, int stage, Box box);

  /**
   * Called when bindings are injected at a level. The level is "root" or the
   * name of a loop; the names are in the order in which they are bound,
   * outermost first.
   */
  void onBindings(String level, List<String> names);

  /**
   * Called with the exception thrown during bounds inference, just before it
   * is re-thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
