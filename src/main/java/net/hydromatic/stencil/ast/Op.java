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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link IrNode}. */
public enum Op {
  // atoms
  INT_LITERAL(true),
  VAR(true),
  CALL(true),

  // binary operators, in decreasing order of precedence
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  AND(" && ", 2),
  OR(" || ", 1),

  // binary operators that are written as function calls
  MIN(true),
  MAX(true),

  NOT("!"),
  SELECT(true),
  /** Expression "let v = e in b". */
  LET,

  // statements
  LET_STMT,
  FOR,
  PRODUCER_CONSUMER,
  REALIZE,
  PROVIDE,
  BLOCK,
  IF_THEN_ELSE,
  ASSERT,
  EVALUATE;

  /** Padded name, e.g. " + ". */
  public final @Nullable String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  /** Map from the trimmed operator name ("+", "min") to the operator. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isBinary()) {
        b.put(op.opName(), op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this operator is a binary operator. */
  public boolean isBinary() {
    switch (this) {
      case TIMES:
      case DIVIDE:
      case MOD:
      case PLUS:
      case MINUS:
      case LT:
      case LE:
      case GT:
      case GE:
      case EQ:
      case NE:
      case AND:
      case OR:
      case MIN:
      case MAX:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this operator returns 0 or 1. */
  public boolean isBoolean() {
    switch (this) {
      case LT:
      case LE:
      case GT:
      case GE:
      case EQ:
      case NE:
      case AND:
      case OR:
      case NOT:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this operator is commutative. */
  public boolean isCommutative() {
    switch (this) {
      case TIMES:
      case PLUS:
      case EQ:
      case NE:
      case AND:
      case OR:
      case MIN:
      case MAX:
        return true;
      default:
        return false;
    }
  }

  /** Returns the operator's name, e.g. "+" or "min". */
  public String opName() {
    if (this == MIN || this == MAX) {
      return name().toLowerCase(Locale.ROOT);
    }
    if (padded == null || padded.isEmpty()) {
      throw new AssertionError("operator " + this + " has no name");
    }
    return padded.trim();
  }
}

// End Op.java
