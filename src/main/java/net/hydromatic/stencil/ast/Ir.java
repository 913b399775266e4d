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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.stencil.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Nodes of the program tree.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Every node is immutable; a tree may share sub-trees with other trees.
 * Use {@link IrBuilder} to create nodes.
 */
public class Ir {
  private Ir() {}

  /** Base class of expressions. Every expression has an integer value. */
  public abstract static class Exp extends IrNode {
    Exp(Op op) {
      super(op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /** Returns whether this expression is an integer literal. */
    public boolean isConstant() {
      return false;
    }
  }

  /** Integer literal. */
  public static class IntLiteral extends Exp {
    public final long value;

    IntLiteral(long value) {
      super(Op.INT_LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IntLiteral && ((IntLiteral) o).value == value;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Reference to a variable.
   *
   * <p>The variable is bound by an enclosing {@link For}, {@link LetStmt} or
   * {@link Let}, unless it is a parameter of the pipeline, in which case
   * {@link #param} is true and its value is supplied when the pipeline runs.
   */
  public static class Var extends Exp {
    public final String name;
    public final boolean param;

    Var(String name, boolean param) {
      super(Op.VAR);
      this.name = requireNonNull(name, "name");
      this.param = param;
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode() + (param ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && ((Var) o).name.equals(name)
              && ((Var) o).param == param;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a binary operator, such as "a + b" or "min(a, b)". */
  public static class Binary extends Exp {
    public final Exp a;
    public final Exp b;

    Binary(Op op, Exp a, Exp b) {
      super(op);
      this.a = requireNonNull(a);
      this.b = requireNonNull(b);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a, b);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && ((Binary) o).op == op
              && ((Binary) o).a.equals(a)
              && ((Binary) o).b.equals(b);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      switch (op) {
        case MIN:
        case MAX:
          return w.call(op.opName(), ImmutableList.of(a, b));
        default:
          return w.infix(left, a, op, b, right);
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Binary} with given arguments, or {@code
     * this} if the arguments are the same.
     */
    public Exp copy(Exp a, Exp b) {
      return a == this.a && b == this.b ? this : ir.binary(op, a, b);
    }
  }

  /** Logical negation, "!a". */
  public static class Not extends Exp {
    public final Exp a;

    Not(Exp a) {
      super(Op.NOT);
      this.a = requireNonNull(a);
    }

    @Override
    public int hashCode() {
      return a.hashCode() * 31 + 7;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Not && ((Not) o).a.equals(a);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("!").append(a, Op.VAR.left, Op.VAR.left);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Not}, or {@code this} if unchanged. */
    public Exp copy(Exp a) {
      return a == this.a ? this : ir.not(a);
    }
  }

  /** Conditional expression, "select(condition, ifTrue, ifFalse)". */
  public static class Select extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Select(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.SELECT);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Select
              && ((Select) o).condition.equals(condition)
              && ((Select) o).ifTrue.equals(ifTrue)
              && ((Select) o).ifFalse.equals(ifFalse);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.call("select", ImmutableList.of(condition, ifTrue, ifFalse));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Select}, or {@code this} if unchanged. */
    public Exp copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : ir.select(condition, ifTrue, ifFalse);
    }
  }

  /** What a {@link Call} calls. */
  public enum CallType {
    /** A function of the pipeline, with a definition in the environment. */
    FUNCTION,
    /** An input image; its contents are supplied when the pipeline runs. */
    IMAGE,
    /** A pure external function, such as "abs". */
    EXTERN
  }

  /** Call to a function, input image or extern, e.g. "f(x, y + 1)". */
  public static class Call extends Exp {
    public final String name;
    public final List<Exp> args;
    public final CallType callType;

    Call(String name, ImmutableList<Exp> args, CallType callType) {
      super(Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.callType = requireNonNull(callType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args, callType);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && ((Call) o).name.equals(name)
              && ((Call) o).args.equals(args)
              && ((Call) o).callType == callType;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.call(name, args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Call}, or {@code this} if unchanged. */
    public Call copy(List<Exp> args) {
      return args.equals(this.args) ? this : ir.call(callType, name, args);
    }
  }

  /** Expression that binds a variable, "let name = value in body". */
  public static class Let extends Exp {
    public final String name;
    public final Exp value;
    public final Exp body;

    Let(String name, Exp value, Exp body) {
      super(Op.LET);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && ((Let) o).name.equals(name)
              && ((Let) o).value.equals(value)
              && ((Let) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append("(let ")
          .append(name)
          .append(" = ")
          .append(value, 0, 0)
          .append(" in ")
          .append(body, 0, 0)
          .append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Let}, or {@code this} if unchanged. */
    public Exp copy(Exp value, Exp body) {
      return value == this.value && body == this.body
          ? this
          : ir.let(name, value, body);
    }
  }

  /** Base class of statements. */
  public abstract static class Stmt extends IrNode {
    Stmt(Op op) {
      super(op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Statement that binds a variable in its body, "let name = value". */
  public static class LetStmt extends Stmt {
    public final String name;
    public final Exp value;
    public final Stmt body;

    LetStmt(String name, Exp value, Stmt body) {
      super(Op.LET_STMT);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LetStmt
              && ((LetStmt) o).name.equals(name)
              && ((LetStmt) o).value.equals(value)
              && ((LetStmt) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append("let ").append(name).append(" = ");
      return w.append(value, 0, 0).endLine().append(body, 0, 0);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code LetStmt}, or {@code this} if unchanged. */
    public Stmt copy(Exp value, Stmt body) {
      return value == this.value && body == this.body
          ? this
          : ir.letStmt(name, value, body);
    }
  }

  /**
   * Loop, "for (name, min, extent) body"; the variable takes the values {@code
   * min} to {@code min + extent - 1}.
   */
  public static class For extends Stmt {
    public final String name;
    public final Exp min;
    public final Exp extent;
    public final Stmt body;

    For(String name, Exp min, Exp extent, Stmt body) {
      super(Op.FOR);
      this.name = requireNonNull(name);
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, min, extent, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof For
              && ((For) o).name.equals(name)
              && ((For) o).min.equals(min)
              && ((For) o).extent.equals(extent)
              && ((For) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append("for (").append(name).append(", ");
      w.append(min, 0, 0).append(", ").append(extent, 0, 0).append(")");
      return w.open().append(body, 0, 0).close();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code For}, or {@code this} if unchanged. */
    public Stmt copy(Exp min, Exp extent, Stmt body) {
      return min == this.min && extent == this.extent && body == this.body
          ? this
          : ir.forLoop(name, min, extent, body);
    }
  }

  /**
   * Marks the statement that computes a function ("produce f"), or the
   * statement that uses it ("consume f").
   */
  public static class ProducerConsumer extends Stmt {
    public final String name;
    public final boolean producer;
    public final Stmt body;

    ProducerConsumer(String name, boolean producer, Stmt body) {
      super(Op.PRODUCER_CONSUMER);
      this.name = requireNonNull(name);
      this.producer = producer;
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, producer, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ProducerConsumer
              && ((ProducerConsumer) o).name.equals(name)
              && ((ProducerConsumer) o).producer == producer
              && ((ProducerConsumer) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append(producer ? "produce " : "consume ").append(name);
      return w.open().append(body, 0, 0).close();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this node, or {@code this} if unchanged. */
    public Stmt copy(Stmt body) {
      return body == this.body
          ? this
          : ir.producerConsumer(name, producer, body);
    }
  }

  /** Minimum and extent of one dimension of a {@link Realize}. */
  public static class Range {
    public final Exp min;
    public final Exp extent;

    Range(Exp min, Exp extent) {
      this.min = requireNonNull(min);
      this.extent = requireNonNull(extent);
    }

    @Override
    public int hashCode() {
      return Objects.hash(min, extent);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Range
              && ((Range) o).min.equals(min)
              && ((Range) o).extent.equals(extent);
    }

    @Override
    public String toString() {
      return "[" + min + ", " + extent + "]";
    }
  }

  /** Allocates storage for a function over its body, "realize f(...)". */
  public static class Realize extends Stmt {
    public final String name;
    public final List<Range> bounds;
    public final Stmt body;

    Realize(String name, ImmutableList<Range> bounds, Stmt body) {
      super(Op.REALIZE);
      this.name = requireNonNull(name);
      this.bounds = requireNonNull(bounds);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, bounds, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Realize
              && ((Realize) o).name.equals(name)
              && ((Realize) o).bounds.equals(bounds)
              && ((Realize) o).body.equals(body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append("realize ").append(name).append("(");
      for (int i = 0; i < bounds.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(bounds.get(i).toString());
      }
      return w.append(")").open().append(body, 0, 0).close();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Realize}, or {@code this} if unchanged. */
    public Stmt copy(Stmt body) {
      return body == this.body ? this : ir.realize(name, bounds, body);
    }
  }

  /** Stores values of a function at a point, "f(args) = values". */
  public static class Provide extends Stmt {
    public final String name;
    public final List<Exp> values;
    public final List<Exp> args;

    Provide(String name, ImmutableList<Exp> values, ImmutableList<Exp> args) {
      super(Op.PROVIDE);
      this.name = requireNonNull(name);
      this.values = requireNonNull(values);
      this.args = requireNonNull(args);
      checkArgument(!values.isEmpty(), "provide has no values");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, values, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Provide
              && ((Provide) o).name.equals(name)
              && ((Provide) o).values.equals(values)
              && ((Provide) o).args.equals(args);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().call(name, args).append(" = ");
      if (values.size() == 1) {
        w.append(values.get(0), 0, 0);
      } else {
        w.call("", values);
      }
      return w.endLine();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Provide}, or {@code this} if unchanged. */
    public Stmt copy(List<Exp> values, List<Exp> args) {
      return values.equals(this.values) && args.equals(this.args)
          ? this
          : ir.provide(name, values, args);
    }
  }

  /** Sequence of statements. */
  public static class Block extends Stmt {
    public final List<Stmt> stmts;

    Block(ImmutableList<Stmt> stmts) {
      super(Op.BLOCK);
      this.stmts = requireNonNull(stmts);
      checkArgument(stmts.size() >= 2, "block must have 2 or more statements");
    }

    @Override
    public int hashCode() {
      return stmts.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Block && ((Block) o).stmts.equals(stmts);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      stmts.forEach(stmt -> w.append(stmt, 0, 0));
      return w;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Block}, or {@code this} if unchanged. */
    public Stmt copy(List<Stmt> stmts) {
      return stmts.equals(this.stmts) ? this : ir.block(stmts);
    }
  }

  /** Conditional statement. */
  public static class IfThenElse extends Stmt {
    public final Exp condition;
    public final Stmt thenCase;
    public final @Nullable Stmt elseCase;

    IfThenElse(Exp condition, Stmt thenCase, @Nullable Stmt elseCase) {
      super(Op.IF_THEN_ELSE);
      this.condition = requireNonNull(condition);
      this.thenCase = requireNonNull(thenCase);
      this.elseCase = elseCase;
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, thenCase, elseCase);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IfThenElse
              && ((IfThenElse) o).condition.equals(condition)
              && ((IfThenElse) o).thenCase.equals(thenCase)
              && Objects.equals(((IfThenElse) o).elseCase, elseCase);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append("if (").append(condition, 0, 0).append(")");
      w.open().append(thenCase, 0, 0).close();
      if (elseCase != null) {
        w.line().append("else").open().append(elseCase, 0, 0).close();
      }
      return w;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this node, or {@code this} if unchanged. */
    public Stmt copy(Exp condition, Stmt thenCase, @Nullable Stmt elseCase) {
      return condition == this.condition
              && thenCase == this.thenCase
              && elseCase == this.elseCase
          ? this
          : ir.ifThenElse(condition, thenCase, elseCase);
    }
  }

  /** Assertion, "assert(condition, message)"; fails at run time if false. */
  public static class AssertStmt extends Stmt {
    public final Exp condition;
    public final String message;

    AssertStmt(Exp condition, String message) {
      super(Op.ASSERT);
      this.condition = requireNonNull(condition);
      this.message = requireNonNull(message);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, message);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof AssertStmt
              && ((AssertStmt) o).condition.equals(condition)
              && ((AssertStmt) o).message.equals(message);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.line().append("assert(").append(condition, 0, 0);
      return w.append(", \"").append(message).append("\")").endLine();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this node, or {@code this} if unchanged. */
    public Stmt copy(Exp condition) {
      return condition == this.condition
          ? this
          : ir.assertStmt(condition, message);
    }
  }

  /** Statement that evaluates an expression and discards its value. */
  public static class Evaluate extends Stmt {
    public final Exp exp;

    Evaluate(Exp exp) {
      super(Op.EVALUATE);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode() + 3;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Evaluate && ((Evaluate) o).exp.equals(exp);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.line().append(exp, 0, 0).endLine();
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this node, or {@code this} if unchanged. */
    public Stmt copy(Exp exp) {
      return exp == this.exp ? this : ir.evaluate(exp);
    }
  }
}

// End Ir.java
