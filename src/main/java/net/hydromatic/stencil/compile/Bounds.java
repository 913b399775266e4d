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

import net.hydromatic.stencil.ast.Ir;
import net.hydromatic.stencil.ast.IrNode;
import net.hydromatic.stencil.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the interval of values an expression may take when its variables
 * range over the intervals in a {@link Scope}.
 *
 * <p>The result always contains every value the expression can take; it may
 * be larger. If the engine cannot bound an end (for example, the value of a
 * call to a function, or a division by a divisor that may be zero) that end
 * is unbounded; the engine never fails because a result is unbounded.
 *
 * <p>A variable that is not in scope is a point if it is a parameter of the
 * pipeline; any other unbound variable is an error.
 */
public class Bounds {
  private final boolean simplify;

  public Bounds(boolean simplify) {
    this.simplify = simplify;
  }

  /** Creates an engine that simplifies its results. */
  public static Bounds create() {
    return new Bounds(true);
  }

  /** Returns the interval of an expression. */
  public Interval of(Ir.Exp exp, Scope scope) {
    return of(exp, scope, exp);
  }

  /**
   * Returns the interval of an expression; if it has an unresolvable
   * variable, the error mentions {@code site}.
   */
  public Interval of(Ir.Exp exp, Scope scope, IrNode site) {
    return new Evaluator(scope, site).bounds(exp);
  }

  /** Simplifies an interval, if this engine is configured to simplify. */
  Interval simplify(Interval interval) {
    return simplify ? Simplifier.simplify(interval) : interval;
  }

  /** Simplifies a box, if this engine is configured to simplify. */
  Box simplify(Box box) {
    return simplify ? Simplifier.simplify(box) : box;
  }

  /** Returns the value of an expression if it is an integer literal. */
  private static @Nullable Long constant(Ir.@Nullable Exp e) {
    return e instanceof Ir.IntLiteral ? ((Ir.IntLiteral) e).value : null;
  }

  private static @Nullable Long constant(Interval interval) {
    return interval.isPoint() ? constant(interval.min) : null;
  }

  /** Evaluates the bounds of expressions in a scope. */
  private class Evaluator {
    final Scope scope;
    final IrNode site;

    Evaluator(Scope scope, IrNode site) {
      this.scope = scope;
      this.site = site;
    }

    Interval bounds(Ir.Exp e) {
      switch (e.op) {
        case INT_LITERAL:
          return Interval.point(e);

        case VAR:
          final Ir.Var variable = (Ir.Var) e;
          final Interval interval = scope.getOpt(variable.name);
          if (interval != null) {
            return interval;
          }
          if (variable.param) {
            return Interval.point(variable);
          }
          throw new CompileException(
              "unresolvable free variable '" + variable.name + "'",
              site.toString().trim());

        case PLUS:
        case MINUS:
        case TIMES:
        case DIVIDE:
        case MOD:
        case MIN:
        case MAX:
          final Ir.Binary binary = (Ir.Binary) e;
          final Interval a = bounds(binary.a);
          final Interval b = bounds(binary.b);
          final Interval result = arithmetic(binary.op, a, b);
          return simplify(result);

        case LT:
        case LE:
        case GT:
        case GE:
        case EQ:
        case NE:
        case AND:
        case OR:
          bounds(((Ir.Binary) e).a);
          bounds(((Ir.Binary) e).b);
          return Interval.of(0, 1);

        case NOT:
          bounds(((Ir.Not) e).a);
          return Interval.of(0, 1);

        case SELECT:
          final Ir.Select select = (Ir.Select) e;
          bounds(select.condition);
          return simplify(bounds(select.ifTrue).union(bounds(select.ifFalse)));

        case LET:
          final Ir.Let let = (Ir.Let) e;
          final Interval value = bounds(let.value);
          return new Evaluator(scope.bind(let.name, value), site)
              .bounds(let.body);

        case CALL:
          // The value of a call is not known, but its arguments must resolve
          ((Ir.Call) e).args.forEach(this::bounds);
          return Interval.everything();

        default:
          throw new AssertionError("unknown expression " + e.op);
      }
    }
  }

  /** Applies an arithmetic operator to two intervals. */
  private Interval arithmetic(Op op, Interval a, Interval b) {
    switch (op) {
      case PLUS:
        return Interval.create(
            a.min == null || b.min == null ? null : ir.plus(a.min, b.min),
            a.max == null || b.max == null ? null : ir.plus(a.max, b.max));

      case MINUS:
        return Interval.create(
            a.min == null || b.max == null ? null : ir.minus(a.min, b.max),
            a.max == null || b.min == null ? null : ir.minus(a.max, b.min));

      case TIMES:
        return times(a, b);

      case DIVIDE:
        return divide(a, b);

      case MOD:
        return mod(b);

      case MIN:
        // The upper end of min is bounded if either operand's upper end is;
        // that is what allows clamping to bound an index.
        return Interval.create(
            a.min == null || b.min == null ? null : ir.min(a.min, b.min),
            a.max == null
                ? b.max
                : b.max == null ? a.max : ir.min(a.max, b.max));

      case MAX:
        return Interval.create(
            a.min == null
                ? b.min
                : b.min == null ? a.min : ir.max(a.min, b.min),
            a.max == null || b.max == null ? null : ir.max(a.max, b.max));

      default:
        throw new AssertionError("unknown operator " + op);
    }
  }

  private Interval times(Interval a, Interval b) {
    final Long ca = constant(a);
    if (ca != null && constant(b) == null) {
      return times(b, a);
    }
    final Long c = constant(b);
    if (c != null) {
      final Ir.Exp k = ir.intLiteral(c);
      if (c == 0) {
        return Interval.point(k);
      } else if (c > 0) {
        return Interval.create(
            a.min == null ? null : ir.times(a.min, k),
            a.max == null ? null : ir.times(a.max, k));
      } else {
        return Interval.create(
            a.max == null ? null : ir.times(a.max, k),
            a.min == null ? null : ir.times(a.min, k));
      }
    }
    if (!a.isBounded() || !b.isBounded()) {
      // The sign of an operand is not known, so neither end is
      return Interval.everything();
    }
    if (nonNegative(a) && nonNegative(b)) {
      return Interval.of(
          ir.times(a.lowerBound(), b.lowerBound()),
          ir.times(a.upperBound(), b.upperBound()));
    }
    return corners(Op.TIMES, a, b);
  }

  private Interval divide(Interval a, Interval b) {
    final Long c = constant(b);
    if (c != null) {
      if (c == 0) {
        return Interval.everything();
      }
      final Ir.Exp k = ir.intLiteral(c);
      if (c > 0) {
        return Interval.create(
            a.min == null ? null : ir.divide(a.min, k),
            a.max == null ? null : ir.divide(a.max, k));
      } else {
        return Interval.create(
            a.max == null ? null : ir.divide(a.max, k),
            a.min == null ? null : ir.divide(a.min, k));
      }
    }
    if (!b.isBounded() || !excludesZero(b) || !a.isBounded()) {
      return Interval.everything();
    }
    return corners(Op.DIVIDE, a, b);
  }

  private Interval mod(Interval b) {
    final Long c = constant(b);
    if (c != null) {
      return c == 0
          ? Interval.everything()
          : Interval.of(0, Math.abs(c) - 1);
    }
    final Long lo = constant(b.min);
    if (lo != null && lo > 0 && b.max != null) {
      return Interval.of(ir.intLiteral(0), ir.minus(b.max, ir.intLiteral(1)));
    }
    final Long hi = constant(b.max);
    if (hi != null && hi < 0 && b.min != null) {
      return Interval.of(
          ir.intLiteral(0), ir.minus(ir.intLiteral(-1), b.min));
    }
    return Interval.everything();
  }

  /**
   * Returns the interval from the least to the greatest of the operator
   * applied to the four pairs of ends.
   */
  private Interval corners(Op op, Interval a, Interval b) {
    final Ir.Exp p0 = ir.binary(op, a.lowerBound(), b.lowerBound());
    final Ir.Exp p1 = ir.binary(op, a.lowerBound(), b.upperBound());
    final Ir.Exp p2 = ir.binary(op, a.upperBound(), b.lowerBound());
    final Ir.Exp p3 = ir.binary(op, a.upperBound(), b.upperBound());
    return Interval.of(
        ir.min(ir.min(p0, p1), ir.min(p2, p3)),
        ir.max(ir.max(p0, p1), ir.max(p2, p3)));
  }

  private static boolean nonNegative(Interval interval) {
    final Long lo = constant(interval.min);
    return lo != null && lo >= 0;
  }

  private static boolean excludesZero(Interval interval) {
    final Long lo = constant(interval.min);
    final Long hi = constant(interval.max);
    return lo != null && lo > 0 || hi != null && hi < 0;
  }
}

// End Bounds.java
