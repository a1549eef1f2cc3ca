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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Actual arguments of a call, each an unforced promise.
 *
 * <p>If the call passed "..." the arguments of the enclosing frame's dots are
 * included, in order, in place of the "...".
 */
public class Args {
  /** The call expression. */
  public final Ast.Call call;
  /** The environment in which the call occurs. */
  public final Environment env;
  public final List<Actual> actuals;

  public Args(Ast.Call call, Environment env, ImmutableList<Actual> actuals) {
    this.call = requireNonNull(call);
    this.env = requireNonNull(env);
    this.actuals = requireNonNull(actuals);
  }

  @Override
  public String toString() {
    return actuals.toString();
  }

  public int size() {
    return actuals.size();
  }

  public Actual get(int i) {
    return actuals.get(i);
  }

  /** Forces the {@code i}th argument. */
  public @Nullable Object force(int i, Evaluator evaluator) {
    return evaluator.valueOf(actuals.get(i).promise);
  }

  /** Forces every argument. */
  public List<@Nullable Object> forceAll(Evaluator evaluator) {
    final List<@Nullable Object> values = new ArrayList<>();
    for (Actual actual : actuals) {
      values.add(evaluator.valueOf(actual.promise));
    }
    return values;
  }

  /** Returns the index of the argument with a given name, or -1. */
  public int indexOf(String name) {
    for (int i = 0; i < actuals.size(); i++) {
      if (name.equals(actuals.get(i).name)) {
        return i;
      }
    }
    return -1;
  }

  /** Throws unless there are between {@code min} and {@code max} arguments. */
  @CanIgnoreReturnValue
  public Args checkArity(int min, int max) {
    if (actuals.size() < min || actuals.size() > max) {
      final String expected = min == max
          ? Integer.toString(min)
          : min + " to " + max;
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          actuals.size() + " arguments passed to '" + call.head
              + "' which requires " + expected);
    }
    return this;
  }

  /** Throws unless there are exactly {@code n} arguments. */
  @CanIgnoreReturnValue
  public Args checkArity(int n) {
    return checkArity(n, n);
  }

  /** Argument supplied to a call: an optional name and a promise. */
  public static class Actual {
    public final @Nullable String name;
    public final Promise promise;

    public Actual(@Nullable String name, Promise promise) {
      this.name = name;
      this.promise = requireNonNull(promise);
    }

    @Override
    public String toString() {
      return name == null
          ? promise.expr.toString()
          : name + " = " + promise.expr;
    }
  }
}

// End Args.java
