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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms program trees.
 *
 * <p>Each {@code visit} method returns the original node if none of its
 * children changed, so that a transformed tree shares unchanged sub-trees with
 * the original.
 */
public class Shuttle {
  protected <E extends IrNode> List<E> visitList(List<E> nodes) {
    final ImmutableList.Builder<E> list = ImmutableList.builder();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list.build();
  }

  // expressions

  protected Ir.Exp visit(Ir.IntLiteral intLiteral) {
    return intLiteral; // leaf
  }

  protected Ir.Exp visit(Ir.Var var) {
    return var; // leaf
  }

  protected Ir.Exp visit(Ir.Binary binary) {
    return binary.copy(binary.a.accept(this), binary.b.accept(this));
  }

  protected Ir.Exp visit(Ir.Not not) {
    return not.copy(not.a.accept(this));
  }

  protected Ir.Exp visit(Ir.Select select) {
    return select.copy(
        select.condition.accept(this),
        select.ifTrue.accept(this),
        select.ifFalse.accept(this));
  }

  protected Ir.Exp visit(Ir.Call call) {
    return call.copy(visitList(call.args));
  }

  protected Ir.Exp visit(Ir.Let let) {
    return let.copy(let.value.accept(this), let.body.accept(this));
  }

  // statements

  protected Ir.Stmt visit(Ir.LetStmt letStmt) {
    return letStmt.copy(letStmt.value.accept(this), letStmt.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.For forLoop) {
    return forLoop.copy(
        forLoop.min.accept(this),
        forLoop.extent.accept(this),
        forLoop.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.ProducerConsumer producerConsumer) {
    return producerConsumer.copy(producerConsumer.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.Realize realize) {
    return realize.copy(realize.body.accept(this));
  }

  protected Ir.Stmt visit(Ir.Provide provide) {
    return provide.copy(visitList(provide.values), visitList(provide.args));
  }

  protected Ir.Stmt visit(Ir.Block block) {
    return block.copy(visitList(block.stmts));
  }

  protected Ir.Stmt visit(Ir.IfThenElse ifThenElse) {
    return ifThenElse.copy(
        ifThenElse.condition.accept(this),
        ifThenElse.thenCase.accept(this),
        ifThenElse.elseCase == null
            ? null
            : ifThenElse.elseCase.accept(this));
  }

  protected Ir.Stmt visit(Ir.AssertStmt assertStmt) {
    return assertStmt.copy(assertStmt.condition.accept(this));
  }

  protected Ir.Stmt visit(Ir.Evaluate evaluate) {
    return evaluate.copy(evaluate.exp.accept(this));
  }
}

// End Shuttle.java
