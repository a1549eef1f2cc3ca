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
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates expressions.
 *
 * <p>Symbols are looked up in the environment, forcing promises as needed;
 * literals evaluate to their values; a call evaluates its head, wraps each
 * argument in an unforced {@link Promise}, and applies the function. An
 * embedded quoted closure evaluates its expression in its own environment.
 *
 * <p>Escape markers are not evaluable; they must be resolved first.
 */
public class Evaluator {
  public final Session session;

  /**
   * Data mask that applies to quoted closures evaluated by this evaluator, or
   * null. Given a closure's environment, returns the environment in which to
   * evaluate the closure's expression.
   */
  public final @Nullable UnaryOperator<Environment> mask;

  /** Current nesting depth of the calling thread; shared by evaluators
   * derived from this one. */
  private final ThreadLocal<int[]> depth;

  private Evaluator(Session session, @Nullable UnaryOperator<Environment> mask,
      ThreadLocal<int[]> depth) {
    this.session = requireNonNull(session);
    this.mask = mask;
    this.depth = requireNonNull(depth);
  }

  /** Creates an Evaluator. */
  public static Evaluator of(Session session) {
    return new Evaluator(session, null,
        ThreadLocal.withInitial(() -> new int[1]));
  }

  /** Returns an evaluator that is the same as this but with a given mask. */
  public Evaluator withMask(@Nullable UnaryOperator<Environment> mask) {
    return mask == this.mask ? this : new Evaluator(session, mask, depth);
  }

  /** Evaluates an expression in an environment. */
  public @Nullable Object eval(Ast.Exp exp, Environment env) {
    final int maxDepth = Prop.MAX_DEPTH.intValue(session.map);
    final int[] d = depth.get();
    if (d[0] >= maxDepth) {
      throw new QuasiException(QuasiException.Kind.DEPTH,
          "evaluation nested too deeply: infinite recursion?");
    }
    ++d[0];
    try {
      return eval2(exp, env);
    } finally {
      --d[0];
    }
  }

  private @Nullable Object eval2(Ast.Exp exp, Environment env) {
    switch (exp.op) {
      case ID:
        return evalSym((Ast.Sym) exp, env);

      case NULL_LITERAL:
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case VALUE_LITERAL:
        return ((Ast.Literal) exp).value;

      case CALL:
        return evalCall((Ast.Call) exp, env);

      case QUOTED:
        final Ast.Quoted quoted = (Ast.Quoted) exp;
        final Environment env2 =
            mask == null
                ? quoted.closure.env
                : mask.apply(quoted.closure.env);
        return eval(quoted.closure.expr, env2);

      case UNQUOTE:
      case UNQUOTE_SPLICE:
      case DEFINE:
        throw new QuasiException(QuasiException.Kind.SYNTAX,
            "'" + requireNonNull(exp.op.spelling).trim()
                + "' is only allowed inside a quoting function: " + exp);

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  private @Nullable Object evalSym(Ast.Sym sym, Environment env) {
    if (sym.isMissingArg()) {
      throw new QuasiException(QuasiException.Kind.MISSING_ARGUMENT,
          "argument is missing, with no default");
    }
    if (sym.name.equals(Frame.DOTS)) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'...' used in an incorrect context");
    }
    return force(sym.name, env.lookup(sym.name));
  }

  /**
   * Converts the value of a binding to a value, forcing it if it is a
   * promise.
   *
   * @throws QuasiException of kind {@code MISSING_ARGUMENT} if the binding is
   *     a parameter that was not supplied
   */
  public @Nullable Object force(String name, @Nullable Object value) {
    if (value instanceof Promise) {
      return valueOf((Promise) value);
    }
    if (value == Missing.INSTANCE) {
      throw new QuasiException(QuasiException.Kind.MISSING_ARGUMENT,
          "argument \"" + name + "\" is missing, with no default");
    }
    return value;
  }

  /** Returns the value of a promise, forcing it if necessary. */
  public @Nullable Object valueOf(Promise promise) {
    return promise.force(this);
  }

  private @Nullable Object evalCall(Ast.Call call, Environment env) {
    final Object fn = eval(call.head, env);
    if (!(fn instanceof Applicable)) {
      throw new QuasiException(QuasiException.Kind.NOT_A_FUNCTION,
          "attempt to apply non-function: " + call.head);
    }
    final ImmutableList.Builder<Args.Actual> actuals = ImmutableList.builder();
    for (Ast.Arg arg : call.args) {
      if (arg.isPositional()
          && arg.value instanceof Ast.Sym
          && ((Ast.Sym) arg.value).name.equals(Frame.DOTS)) {
        actuals.addAll(dots(env));
      } else {
        actuals.add(new Args.Actual(arg.name, new Promise(arg.value, env)));
      }
    }
    return ((Applicable) fn).apply(this, new Args(call, env, actuals.build()));
  }

  /** Returns the excess arguments of the frame that encloses an
   * environment. */
  @SuppressWarnings("unchecked")
  public static List<Args.Actual> dots(Environment env) {
    final Binding binding = env.getOpt(Frame.DOTS);
    if (binding == null || !(binding.value instanceof List)) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'...' used in an incorrect context");
    }
    return (List<Args.Actual>) binding.value;
  }
}

// End Evaluator.java
