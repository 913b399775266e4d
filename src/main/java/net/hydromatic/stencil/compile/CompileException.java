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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred during compilation.
 *
 * <p>Bounds inference and loop-nest construction throw this exception for
 * errors in the pipeline or its schedule. Errors in the compiler itself are
 * reported as {@link IllegalArgumentException} or {@link AssertionError}.
 */
public class CompileException extends RuntimeException {
  private final @Nullable String site;

  public CompileException(String message) {
    this(message, null);
  }

  /**
   * Creates a CompileException.
   *
   * @param message Message
   * @param site Description of the part of the program that caused the error,
   *     for example the call "f(x + 1)"; or null
   */
  public CompileException(String message, @Nullable String site) {
    super(message);
    this.site = site;
  }

  @Override
  public String toString() {
    return site == null ? super.toString() : super.toString() + " at " + site;
  }

  /** Returns the part of the program that caused the error, or null. */
  public @Nullable String site() {
    return site;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage());
    if (site != null) {
      buf.append(" at ").append(site);
    }
    return buf;
  }
}

// End CompileException.java
