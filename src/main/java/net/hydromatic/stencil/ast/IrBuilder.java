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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds program tree nodes. */
public enum IrBuilder {
  /**
   * The singleton instance of the IR builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ir;

  private final Ir.IntLiteral zero = new Ir.IntLiteral(0);
  private final Ir.IntLiteral one = new Ir.IntLiteral(1);

  /** Creates an integer literal. */
  public Ir.IntLiteral intLiteral(long value) {
    if (value == 0) {
      return zero;
    }
    if (value == 1) {
      return one;
    }
    return new Ir.IntLiteral(value);
  }

  /** Creates a reference to a variable. */
  public Ir.Var var(String name) {
    return new Ir.Var(name, false);
  }

  /** Creates a reference to a parameter of the pipeline. */
  public Ir.Var param(String name) {
    return new Ir.Var(name, true);
  }

  /** Creates a call to a binary operator. */
  public Ir.Binary binary(Op op, Ir.Exp a, Ir.Exp b) {
    return new Ir.Binary(op, a, b);
  }

  public Ir.Binary plus(Ir.Exp a, Ir.Exp b) {
    return binary(Op.PLUS, a, b);
  }

  /** Creates "a + i"; for negative {@code i}, creates "a - |i|". */
  public Ir.Binary plus(Ir.Exp a, long i) {
    return i < 0
        ? binary(Op.MINUS, a, intLiteral(-i))
        : binary(Op.PLUS, a, intLiteral(i));
  }

  public Ir.Binary minus(Ir.Exp a, Ir.Exp b) {
    return binary(Op.MINUS, a, b);
  }

  public Ir.Binary times(Ir.Exp a, Ir.Exp b) {
    return binary(Op.TIMES, a, b);
  }

  public Ir.Binary divide(Ir.Exp a, Ir.Exp b) {
    return binary(Op.DIVIDE, a, b);
  }

  public Ir.Binary mod(Ir.Exp a, Ir.Exp b) {
    return binary(Op.MOD, a, b);
  }

  public Ir.Binary min(Ir.Exp a, Ir.Exp b) {
    return binary(Op.MIN, a, b);
  }

  public Ir.Binary max(Ir.Exp a, Ir.Exp b) {
    return binary(Op.MAX, a, b);
  }

  /** Creates "max(min(a, hi), lo)". */
  public Ir.Binary clamp(Ir.Exp a, Ir.Exp lo, Ir.Exp hi) {
    return max(min(a, hi), lo);
  }

  public Ir.Binary lessThan(Ir.Exp a, Ir.Exp b) {
    return binary(Op.LT, a, b);
  }

  public Ir.Binary lessThanOrEqualTo(Ir.Exp a, Ir.Exp b) {
    return binary(Op.LE, a, b);
  }

  public Ir.Binary greaterThan(Ir.Exp a, Ir.Exp b) {
    return binary(Op.GT, a, b);
  }

  public Ir.Binary greaterThanOrEqualTo(Ir.Exp a, Ir.Exp b) {
    return binary(Op.GE, a, b);
  }

  public Ir.Binary equal(Ir.Exp a, Ir.Exp b) {
    return binary(Op.EQ, a, b);
  }

  public Ir.Binary notEqual(Ir.Exp a, Ir.Exp b) {
    return binary(Op.NE, a, b);
  }

  public Ir.Binary and(Ir.Exp a, Ir.Exp b) {
    return binary(Op.AND, a, b);
  }

  public Ir.Binary or(Ir.Exp a, Ir.Exp b) {
    return binary(Op.OR, a, b);
  }

  public Ir.Not not(Ir.Exp a) {
    return new Ir.Not(a);
  }

  public Ir.Select select(Ir.Exp condition, Ir.Exp ifTrue, Ir.Exp ifFalse) {
    return new Ir.Select(condition, ifTrue, ifFalse);
  }

  /** Creates a call. */
  public Ir.Call call(
      Ir.CallType callType, String name, List<? extends Ir.Exp> args) {
    return new Ir.Call(name, ImmutableList.copyOf(args), callType);
  }

  /** Creates a call to a function of the pipeline. */
  public Ir.Call call(String name, Ir.Exp... args) {
    return call(Ir.CallType.FUNCTION, name, Arrays.asList(args));
  }

  /** Creates a call to an input image. */
  public Ir.Call image(String name, Ir.Exp... args) {
    return call(Ir.CallType.IMAGE, name, Arrays.asList(args));
  }

  /** Creates a call to an external function. */
  public Ir.Call extern(String name, Ir.Exp... args) {
    return call(Ir.CallType.EXTERN, name, Arrays.asList(args));
  }

  public Ir.Let let(String name, Ir.Exp value, Ir.Exp body) {
    return new Ir.Let(name, value, body);
  }

  public Ir.LetStmt letStmt(String name, Ir.Exp value, Ir.Stmt body) {
    return new Ir.LetStmt(name, value, body);
  }

  public Ir.For forLoop(String name, Ir.Exp min, Ir.Exp extent, Ir.Stmt body) {
    return new Ir.For(name, min, extent, body);
  }

  public Ir.ProducerConsumer producerConsumer(
      String name, boolean producer, Ir.Stmt body) {
    return new Ir.ProducerConsumer(name, producer, body);
  }

  public Ir.ProducerConsumer produce(String name, Ir.Stmt body) {
    return producerConsumer(name, true, body);
  }

  public Ir.ProducerConsumer consume(String name, Ir.Stmt body) {
    return producerConsumer(name, false, body);
  }

  public Ir.Range range(Ir.Exp min, Ir.Exp extent) {
    return new Ir.Range(min, extent);
  }

  public Ir.Realize realize(
      String name, List<Ir.Range> bounds, Ir.Stmt body) {
    return new Ir.Realize(name, ImmutableList.copyOf(bounds), body);
  }

  public Ir.Provide provide(
      String name, List<? extends Ir.Exp> values, List<? extends Ir.Exp> args) {
    return new Ir.Provide(
        name, ImmutableList.copyOf(values), ImmutableList.copyOf(args));
  }

  /**
   * Creates a sequence of statements. Nested blocks are flattened; a list of
   * one statement returns that statement.
   */
  public Ir.Stmt block(List<? extends Ir.Stmt> stmts) {
    checkArgument(!stmts.isEmpty(), "empty block");
    final ImmutableList.Builder<Ir.Stmt> b = ImmutableList.builder();
    for (Ir.Stmt stmt : stmts) {
      if (stmt instanceof Ir.Block) {
        b.addAll(((Ir.Block) stmt).stmts);
      } else {
        b.add(stmt);
      }
    }
    final ImmutableList<Ir.Stmt> list = b.build();
    return list.size() == 1 ? list.get(0) : new Ir.Block(list);
  }

  public Ir.Stmt block(Ir.Stmt stmt0, Ir.Stmt... stmts) {
    return block(
        ImmutableList.<Ir.Stmt>builder().add(stmt0).add(stmts).build());
  }

  public Ir.IfThenElse ifThenElse(
      Ir.Exp condition, Ir.Stmt thenCase, Ir.@Nullable Stmt elseCase) {
    return new Ir.IfThenElse(condition, thenCase, elseCase);
  }

  public Ir.AssertStmt assertStmt(Ir.Exp condition, String message) {
    return new Ir.AssertStmt(condition, message);
  }

  public Ir.Evaluate evaluate(Ir.Exp exp) {
    return new Ir.Evaluate(exp);
  }

  /** Creates a statement that does nothing. */
  public Ir.Evaluate noOp() {
    return evaluate(zero);
  }
}

// End IrBuilder.java
