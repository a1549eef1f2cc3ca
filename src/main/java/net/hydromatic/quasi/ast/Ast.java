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
package net.hydromatic.quasi.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.quasi.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import net.hydromatic.quasi.quote.QuotedClosure;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of expression tree nodes.
 *
 * <p>The variant is closed: an expression is a {@link Sym}, a {@link
 * Literal}, a {@link Call}, one of the escape markers ({@link Unquote}, {@link
 * UnquoteSplice}, {@link Define}), or an embedded {@link Quoted} closure.
 * Nodes are immutable, so trees may share sub-trees.
 */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);

    /**
     * Calls a consumer for this node and every node beneath it, depth-first,
     * parents before children.
     */
    public void forEachNode(Consumer<AstNode> consumer) {
      accept(
          new Visitor() {
            @Override
            protected void preVisit(AstNode node) {
              consumer.accept(node);
            }
          });
    }

    /** Returns whether this is the empty argument, as in "f(x, )". */
    public boolean isMissingArg() {
      return false;
    }

    /** Returns whether this tree contains an escape marker at any depth. */
    public boolean containsMarker() {
      final boolean[] found = {false};
      forEachNode(
          node -> {
            if (node.op.isMarker()) {
              found[0] = true;
            }
          });
      return found[0];
    }
  }

  /**
   * Unresolved identifier.
   *
   * <p>For example, "x" in "f(x)".
   */
  public static class Sym extends Exp {
    public final String name;

    Sym(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Sym && this.name.equals(((Sym) o).name);
    }

    @Override
    public boolean isMissingArg() {
      return name.isEmpty();
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.id(name);
    }
  }

  /**
   * Self-evaluating constant.
   *
   * <p>Atomic literals hold null, a {@link Boolean}, a {@link Number} or a
   * {@link String}. A literal whose operator is {@link Op#VALUE_LITERAL} holds
   * an arbitrary value, such as a list, that an escape inlined into a tree.
   */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    Literal(Op op, @Nullable Object value) {
      super(op);
      checkArgument(op.isLiteral(), "not a literal: %s", op);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.appendLiteral(op, value);
    }
  }

  /**
   * Application of a function to arguments.
   *
   * <p>The head is an arbitrary expression, usually a {@link Sym}, so that the
   * target of a call may be computed.
   */
  public static class Call extends Exp {
    public final Exp head;
    public final List<Arg> args;

    Call(Exp head, ImmutableList<Arg> args) {
      super(Op.CALL);
      this.head = requireNonNull(head);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(head, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && head.equals(((Call) o).head)
              && args.equals(((Call) o).args);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.call(this, prec);
    }

    /** Returns the name of the function if the head is a symbol, else null. */
    public @Nullable String fnName() {
      return head instanceof Sym ? ((Sym) head).name : null;
    }

    /**
     * Creates a copy of this {@code Call} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Call copy(Exp head, List<Arg> args) {
      return this.head.equals(head) && this.args.equals(args)
          ? this
          : ast.call(head, args);
    }
  }

  /**
   * Argument to a call; positional if {@link #name} is null.
   *
   * <p>For example, "y = 1" in "f(x, y = 1)".
   */
  public static class Arg extends AstNode {
    public final @Nullable String name;
    public final Exp value;

    Arg(@Nullable String name, Exp value) {
      super(Op.ARG);
      this.name = name;
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Arg
              && Objects.equals(name, ((Arg) o).name)
              && value.equals(((Arg) o).value);
    }

    @Override
    public Arg accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      if (name != null) {
        w.id(name).append(" = ");
      }
      return value.unparse(w, 0);
    }

    /** Returns whether this argument is positional. */
    public boolean isPositional() {
      return name == null;
    }

    /**
     * Creates a copy of this {@code Arg} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Arg copy(@Nullable String name, Exp value) {
      return Objects.equals(this.name, name) && this.value.equals(value)
          ? this
          : ast.arg(name, value);
    }
  }

  /**
   * Escape marker that substitutes the value of its operand.
   *
   * <p>For example, "!!x" in "f(!!x, y)".
   */
  public static class Unquote extends Exp {
    public final Exp operand;

    Unquote(Exp operand) {
      super(Op.UNQUOTE);
      this.operand = requireNonNull(operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Unquote && operand.equals(((Unquote) o).operand);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.prefix(op, operand);
    }

    /**
     * Creates a copy of this {@code Unquote} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Unquote copy(Exp operand) {
      return this.operand.equals(operand) ? this : ast.unquote(operand);
    }
  }

  /**
   * Escape marker that splices each element of its operand's value as a
   * separate argument.
   *
   * <p>For example, "!!!xs" in "f(!!!xs, y)".
   */
  public static class UnquoteSplice extends Exp {
    public final Exp operand;

    UnquoteSplice(Exp operand) {
      super(Op.UNQUOTE_SPLICE);
      this.operand = requireNonNull(operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof UnquoteSplice
              && operand.equals(((UnquoteSplice) o).operand);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.prefix(op, operand);
    }

    /**
     * Creates a copy of this {@code UnquoteSplice} with given contents, or
     * {@code this} if the contents are the same.
     */
    public UnquoteSplice copy(Exp operand) {
      return this.operand.equals(operand) ? this : ast.unquoteSplice(operand);
    }
  }

  /**
   * Escape marker that creates an argument with a computed name.
   *
   * <p>For example, "nm := 10" in "f(!!nm := 10)"; {@link #lhs} is evaluated
   * to obtain the name, {@link #rhs} becomes the argument's value.
   */
  public static class Define extends Exp {
    public final Exp lhs;
    public final Exp rhs;

    Define(Exp lhs, Exp rhs) {
      super(Op.DEFINE);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Define
              && lhs.equals(((Define) o).lhs)
              && rhs.equals(((Define) o).rhs);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      lhs.unparse(w, 0);
      w.append(op.spelling);
      return rhs.unparse(w, 0);
    }

    /**
     * Creates a copy of this {@code Define} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Define copy(Exp lhs, Exp rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : ast.define(lhs, rhs);
    }
  }

  /**
   * Quoted closure embedded in a tree.
   *
   * <p>Arises when a {@link QuotedClosure} value is unquoted into a tree.
   * Evaluating the node evaluates the closure's expression in the closure's
   * own environment.
   */
  public static class Quoted extends Exp {
    public final QuotedClosure closure;

    Quoted(QuotedClosure closure) {
      super(Op.QUOTED);
      this.closure = requireNonNull(closure);
    }

    @Override
    public int hashCode() {
      return closure.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Quoted && closure.equals(((Quoted) o).closure);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int prec) {
      return w.prefix(op, closure.expr);
    }
  }
}

// End Ast.java
