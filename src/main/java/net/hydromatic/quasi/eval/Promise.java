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
package net.hydromatic.quasi.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quasi.ast.AstBuilder.ast;

import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression paired with the environment in which it is to be evaluated,
 * evaluated at most once.
 *
 * <p>A promise is created for each argument of a call. Capturing the argument
 * reads {@link #expr} and {@link #env} and never forces the promise.
 *
 * <p>State moves from {@link State#UNFORCED} to {@link State#FORCING} to
 * either {@link State#FORCED} or {@link State#FAILED}; it never goes back.
 * Forcing is synchronized, so if several threads force the same promise, one
 * evaluates and the others wait for, and then share, its result.
 */
public class Promise {
  public final Ast.Exp expr;
  public final Environment env;

  private State state;
  private @Nullable Object value;
  /** The {@link RuntimeException} or {@link Error} that evaluation threw. */
  private @Nullable Throwable failure;

  /** Creates an unforced promise. */
  public Promise(Ast.Exp expr, Environment env) {
    this.expr = requireNonNull(expr);
    this.env = requireNonNull(env);
    this.state = State.UNFORCED;
  }

  private Promise(@Nullable Object value) {
    this.expr = ast.fromValue(value);
    this.env = Environments.empty();
    this.state = State.FORCED;
    this.value = value;
  }

  /** Creates a promise that has already been forced. */
  public static Promise ofValue(@Nullable Object value) {
    return new Promise(value);
  }

  @Override
  public String toString() {
    return "<promise: " + expr + ">";
  }

  /** Returns the current state. */
  public synchronized State state() {
    return state;
  }

  /**
   * Returns the value of this promise, evaluating its expression if this is
   * the first call.
   *
   * <p>If evaluation fails, the promise remembers the failure, and every
   * subsequent call throws the same exception. This includes an
   * {@link Error} such as {@link StackOverflowError}, and an exception thrown
   * by the tracer.
   *
   * @throws QuasiException of kind {@code RECURSIVE_PROMISE} if the promise's
   *     own evaluation forces it again
   */
  public synchronized @Nullable Object force(Evaluator evaluator) {
    switch (state) {
      case FORCED:
        return value;
      case FAILED:
        final Throwable t = requireNonNull(failure);
        if (t instanceof Error) {
          throw (Error) t;
        }
        throw (RuntimeException) t;
      case FORCING:
        throw new QuasiException(QuasiException.Kind.RECURSIVE_PROMISE,
            "promise already under evaluation: " + expr);
      default:
        break;
    }
    try {
      state = State.FORCING;
      evaluator.session.tracer.onForce(this);
      value = evaluator.eval(expr, env);
      state = State.FORCED;
      return value;
    } catch (RuntimeException | Error e) {
      failure = e;
      state = State.FAILED;
      throw e;
    }
  }

  /** States of a promise. */
  public enum State {
    UNFORCED,
    FORCING,
    FORCED,
    FAILED
  }
}

// End Promise.java
