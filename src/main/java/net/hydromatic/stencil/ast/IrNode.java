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
package net.hydromatic.stencil.ast;

import static java.util.Objects.requireNonNull;

/** Node of the program tree, either an expression or a statement. */
public abstract class IrNode {
  public final Op op;

  protected IrNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>Derived classes must not override; override {@link #unparse} instead.
   * Expressions are written on one line, with the minimum parentheses their
   * operator precedence requires; statements are written one per line,
   * indented.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new IrWriter());
  }

  /** Converts this node into a string, with a given writer. */
  public final String unparse(IrWriter w) {
    return unparse(w, 0, 0).toString();
  }

  abstract IrWriter unparse(IrWriter w, int left, int right);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public abstract IrNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End IrNode.java
