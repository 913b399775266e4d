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

import static net.hydromatic.stencil.ast.IrBuilder.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.Op;
import net.hydromatic.stencil.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of expressions.
 *
 * <ul>
 *   <li>{@code 3 + 1} &rarr; {@code 4}, and likewise other operators whose
 *       arguments are literals
 *   <li>{@code (x + 1) + (y - x)} &rarr; {@code y + 1}; sums and differences,
 *       and products with a literal, are normalized to a linear combination of
 *       terms, then re-built with the positive terms first (in order of first
 *       appearance), then the negative terms, then the constant
 *   <li>{@code (x * 4 + 8) / 4} &rarr; {@code x + 2}
 *   <li>{@code min(x + 1, x)} &rarr; {@code x}; {@code max(x, x)} &rarr;
 *       {@code x}; {@code min(min(x, 3), 5)} &rarr; {@code min(x, 3)}
 *   <li>{@code x + 1 > x} &rarr; {@code 1}
 *   <li>{@code 1 && b} &rarr; {@code b} if {@code b} is a comparison
 *   <li>{@code select(1, a, b)} &rarr; {@code a}
 * </ul>
 *
 * <p>Division is floor division and modulo is Euclidean (the result is never
 * negative); literals are folded accordingly. Division or modulo by zero is
 * never folded.
 */
public class Simplifier {
  private static final Shuttle SHUTTLE = new SimplifyShuttle();

  private Simplifier() {}

  /** Simplifies an expression. */
  public static Ir.Exp simplify(Ir.Exp exp) {
    return exp.accept(SHUTTLE);
  }

  /** Simplifies both ends of an interval. */
  public static Interval simplify(Interval interval) {
    return interval.map(Simplifier::simplify);
  }

  /** Simplifies every interval of a box. */
  public static Box simplify(Box box) {
    return box.map(Simplifier::simplify);
  }

  /**
   * Returns {@code a - b} if it is a constant, otherwise null.
   *
   * <p>For example, {@code constantDifference(x + 3, x - 1)} returns 4.
   */
  public static @Nullable Long constantDifference(Ir.Exp a, Ir.Exp b) {
    final Linear linear = new Linear();
    linear.add(a, 1);
    linear.add(b, -1);
    return linear.isConstant() ? linear.constant : null;
  }

  /**
   * Evaluates a binary operator on two literals. Returns null if the result is
   * undefined (division or modulo by zero).
   */
  public static @Nullable Long fold(Op op, long a, long b) {
    switch (op) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case TIMES:
        return a * b;
      case DIVIDE:
        return b == 0 ? null : Math.floorDiv(a, b);
      case MOD:
        return b == 0 ? null : Math.floorMod(a, Math.abs(b));
      case MIN:
        return Math.min(a, b);
      case MAX:
        return Math.max(a, b);
      case LT:
        return a < b ? 1L : 0L;
      case LE:
        return a <= b ? 1L : 0L;
      case GT:
        return a > b ? 1L : 0L;
      case GE:
        return a >= b ? 1L : 0L;
      case EQ:
        return a == b ? 1L : 0L;
      case NE:
        return a != b ? 1L : 0L;
      case AND:
        return a != 0 && b != 0 ? 1L : 0L;
      case OR:
        return a != 0 || b != 0 ? 1L : 0L;
      default:
        throw new AssertionError("unknown operator " + op);
    }
  }

  private static boolean isLiteral(Ir.Exp e) {
    return e instanceof Ir.IntLiteral;
  }

  private static long value(Ir.Exp e) {
    return ((Ir.IntLiteral) e).value;
  }

  /** Returns whether an expression's value is always 0 or 1. */
  private static boolean isBoolean(Ir.Exp e) {
    return e.op.isBoolean()
        || isLiteral(e) && (value(e) == 0 || value(e) == 1);
  }

  /** Shuttle that simplifies each node after simplifying its children. */
  private static class SimplifyShuttle extends Shuttle {
    @Override
    protected Ir.Exp visit(Ir.Binary binary) {
      final Ir.Exp a = binary.a.accept(this);
      final Ir.Exp b = binary.b.accept(this);
      final Ir.Exp e = simplifyBinary(binary.op, a, b);
      return e != null ? e : binary.copy(a, b);
    }

    @Override
    protected Ir.Exp visit(Ir.Not not) {
      final Ir.Exp a = not.a.accept(this);
      if (isLiteral(a)) {
        return ir.intLiteral(value(a) == 0 ? 1 : 0);
      }
      if (a instanceof Ir.Not && isBoolean(((Ir.Not) a).a)) {
        return ((Ir.Not) a).a;
      }
      return not.copy(a);
    }

    @Override
    protected Ir.Exp visit(Ir.Select select) {
      final Ir.Exp condition = select.condition.accept(this);
      final Ir.Exp ifTrue = select.ifTrue.accept(this);
      final Ir.Exp ifFalse = select.ifFalse.accept(this);
      if (isLiteral(condition)) {
        return value(condition) != 0 ? ifTrue : ifFalse;
      }
      if (ifTrue.equals(ifFalse)) {
        return ifTrue;
      }
      return select.copy(condition, ifTrue, ifFalse);
    }

    /** Simplifies a call to a binary operator, or returns null. */
    private static Ir.@Nullable Exp simplifyBinary(Op op, Ir.Exp a, Ir.Exp b) {
      if (isLiteral(a) && isLiteral(b)) {
        final Long v = fold(op, value(a), value(b));
        if (v != null) {
          return ir.intLiteral(v);
        }
        return null;
      }
      Long d;
      switch (op) {
        case PLUS:
        case MINUS:
          return Linear.of(ir.binary(op, a, b)).toExp();

        case TIMES:
          if (isLiteral(a) || isLiteral(b)) {
            return Linear.of(ir.binary(op, a, b)).toExp();
          }
          return null;

        case DIVIDE:
          if (isLiteral(b) && value(b) > 0) {
            final Linear linear = Linear.of(a);
            if (value(b) == 1) {
              return a;
            }
            if (linear.termsDivisibleBy(value(b))) {
              return linear.divide(value(b)).toExp();
            }
          }
          return null;

        case MOD:
          if (isLiteral(b) && value(b) != 0) {
            final long c = Math.abs(value(b));
            final Linear linear = Linear.of(a);
            if (linear.termsDivisibleBy(c)) {
              return ir.intLiteral(Math.floorMod(linear.constant, c));
            }
          }
          return null;

        case MIN:
        case MAX:
          if (a.equals(b)) {
            return a;
          }
          d = constantDifference(a, b);
          if (d != null) {
            // a - b is known, so we know which is smaller
            return (op == Op.MIN) == (d <= 0) ? a : b;
          }
          if (isLiteral(b)
              && a.op == op
              && isLiteral(((Ir.Binary) a).b)) {
            // min(min(x, 3), 5) becomes min(x, 3)
            final long v = op == Op.MIN
                ? Math.min(value(b), value(((Ir.Binary) a).b))
                : Math.max(value(b), value(((Ir.Binary) a).b));
            return ir.binary(op, ((Ir.Binary) a).a, ir.intLiteral(v));
          }
          if (isLiteral(a) && !isLiteral(b)) {
            // canonical order puts the literal second
            final Ir.Exp e = simplifyBinary(op, b, a);
            return e != null ? e : ir.binary(op, b, a);
          }
          return null;

        case LT:
        case LE:
        case GT:
        case GE:
        case EQ:
        case NE:
          d = constantDifference(a, b);
          if (d != null) {
            return ir.intLiteral(fold(op, d, 0));
          }
          return null;

        case AND:
          if (isLiteral(a)) {
            return value(a) == 0 ? a : isBoolean(b) ? b : null;
          }
          if (isLiteral(b)) {
            return value(b) == 0 ? b : isBoolean(a) ? a : null;
          }
          return a.equals(b) && isBoolean(a) ? a : null;

        case OR:
          if (isLiteral(a)) {
            return value(a) != 0 ? ir.intLiteral(1) : isBoolean(b) ? b : null;
          }
          if (isLiteral(b)) {
            return value(b) != 0 ? ir.intLiteral(1) : isBoolean(a) ? a : null;
          }
          return a.equals(b) && isBoolean(a) ? a : null;

        default:
          throw new AssertionError("unknown operator " + op);
      }
    }
  }

  /**
   * Linear combination of terms plus a constant, for example {@code 2 * x - y
   * + 3}. A term is any expression other than a sum, difference, literal, or
   * product with a literal.
   */
  private static class Linear {
    final Map<Ir.Exp, Long> terms = new LinkedHashMap<>();
    long constant;

    static Linear of(Ir.Exp e) {
      final Linear linear = new Linear();
      linear.add(e, 1);
      return linear;
    }

    /** Adds {@code k * e}. */
    void add(Ir.Exp e, long k) {
      if (k == 0) {
        return;
      }
      switch (e.op) {
        case INT_LITERAL:
          constant += k * value(e);
          return;
        case PLUS:
          add(((Ir.Binary) e).a, k);
          add(((Ir.Binary) e).b, k);
          return;
        case MINUS:
          add(((Ir.Binary) e).a, k);
          add(((Ir.Binary) e).b, -k);
          return;
        case TIMES:
          final Ir.Binary times = (Ir.Binary) e;
          if (isLiteral(times.b)) {
            add(times.a, k * value(times.b));
            return;
          }
          if (isLiteral(times.a)) {
            add(times.b, k * value(times.a));
            return;
          }
          break;
        default:
          break;
      }
      terms.merge(e, k, Long::sum);
    }

    boolean isConstant() {
      return terms.values().stream().allMatch(k -> k == 0);
    }

    boolean termsDivisibleBy(long c) {
      return terms.values().stream().allMatch(k -> k % c == 0);
    }

    /** Divides by a positive constant; valid if every term is divisible. */
    Linear divide(long c) {
      final Linear linear = new Linear();
      terms.forEach((e, k) -> linear.terms.put(e, k / c));
      linear.constant = Math.floorDiv(constant, c);
      return linear;
    }

    Ir.Exp toExp() {
      final List<Ir.Exp> positives = new ArrayList<>();
      final List<Ir.Exp> negatives = new ArrayList<>();
      terms.forEach((e, k) -> {
        if (k > 0) {
          positives.add(k == 1 ? e : ir.times(e, ir.intLiteral(k)));
        } else if (k < 0) {
          negatives.add(k == -1 ? e : ir.times(e, ir.intLiteral(-k)));
        }
      });
      Ir.Exp result = null;
      for (Ir.Exp e : positives) {
        result = result == null ? e : ir.plus(result, e);
      }
      boolean constantUsed = false;
      for (Ir.Exp e : negatives) {
        if (result == null) {
          result = ir.minus(ir.intLiteral(constant), e);
          constantUsed = true;
        } else {
          result = ir.minus(result, e);
        }
      }
      if (result == null) {
        return ir.intLiteral(constant);
      }
      if (constantUsed || constant == 0) {
        return result;
      }
      return ir.plus(result, constant);
    }
  }
}

// End Simplifier.java
