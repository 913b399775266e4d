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

import com.google.common.base.Strings;
import java.util.List;

/** Context for writing a program tree out as a string. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();
  private int indent;

  /** Appends a string to the output. */
  public IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public IrWriter append(IrNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public IrWriter infix(int left, IrNode a0, Op op, IrNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call in functional notation, e.g. "min(a, b)". */
  public IrWriter call(String name, List<? extends IrNode> args) {
    append(name).append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(args.get(i), 0, 0);
    }
    return append(")");
  }

  /** Starts a line of a statement, at the current indentation. */
  public IrWriter line() {
    return append(Strings.repeat(" ", indent));
  }

  /** Ends a line. */
  public IrWriter endLine() {
    return append("\n");
  }

  /** Appends " {", ends the line and increases the indentation. */
  public IrWriter open() {
    indent++;
    return append(" {").endLine();
  }

  /** Decreases the indentation and writes a closing brace on its own line. */
  public IrWriter close() {
    indent--;
    return line().append("}").endLine();
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End IrWriter.java
