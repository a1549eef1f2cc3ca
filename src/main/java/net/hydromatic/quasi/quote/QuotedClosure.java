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
package net.hydromatic.quasi.quote;

import static java.util.Objects.requireNonNull;

import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.ast.Shuttle;
import net.hydromatic.quasi.eval.Environment;

/**
 * Expression paired with the environment in which it was captured.
 *
 * <p>A quoted closure can be evaluated later, by {@link TidyEval}, regardless
 * of whether the call frame that captured it still exists.
 *
 * <p>Immutable. The environment is shared, not copied; two closures are
 * equal if their expressions are equal and they have the same environment
 * object.
 */
public final class QuotedClosure {
  public final Ast.Exp expr;
  public final Environment env;

  private QuotedClosure(Ast.Exp expr, Environment env) {
    this.expr = requireNonNull(expr);
    this.env = requireNonNull(env);
  }

  /** Creates a QuotedClosure. */
  public static QuotedClosure of(Ast.Exp expr, Environment env) {
    return new QuotedClosure(expr, env);
  }

  @Override
  public String toString() {
    return "<quosure: " + expr + ">";
  }

  @Override
  public int hashCode() {
    return expr.hashCode() * 31 + System.identityHashCode(env);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof QuotedClosure
            && expr.equals(((QuotedClosure) o).expr)
            && env == ((QuotedClosure) o).env;
  }

  /** Returns whether the expression is a symbol. */
  public boolean isSymbol() {
    return expr instanceof Ast.Sym && !expr.isMissingArg();
  }

  /** Returns whether the expression is a call. */
  public boolean isCall() {
    return expr instanceof Ast.Call;
  }

  /** Returns whether the expression is the empty argument. */
  public boolean isMissing() {
    return expr.isMissingArg();
  }

  /** Returns a closure with the same environment and a given expression. */
  public QuotedClosure withExpr(Ast.Exp expr) {
    return expr.equals(this.expr) ? this : new QuotedClosure(expr, env);
  }

  /** Returns a closure with the same expression and a given environment. */
  public QuotedClosure withEnv(Environment env) {
    return env == this.env ? this : new QuotedClosure(expr, env);
  }

  /**
   * Returns the expression, with each embedded quoted closure replaced by
   * its expression, recursively.
   *
   * <p>The environments of the embedded closures are lost, so the result may
   * not evaluate as the closure would.
   */
  public Ast.Exp squash() {
    return squash(expr);
  }

  /** Replaces each quoted closure embedded in an expression by its
   * expression. */
  public static Ast.Exp squash(Ast.Exp exp) {
    return exp.accept(
        new Shuttle() {
          @Override
          protected Ast.Exp visit(Ast.Quoted quoted) {
            return squash(quoted.closure.expr);
          }
        });
  }
}

// End QuotedClosure.java
