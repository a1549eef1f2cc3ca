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
package net.hydromatic.quasi;

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.eval.Closure;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Environments;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.Prop;
import net.hydromatic.quasi.eval.Session;
import net.hydromatic.quasi.eval.Tracer;
import net.hydromatic.quasi.quote.Captures;
import net.hydromatic.quasi.quote.DataMask;
import net.hydromatic.quasi.quote.QuotedClosure;
import net.hydromatic.quasi.quote.Resolver;
import net.hydromatic.quasi.quote.TidyEval;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry point to the quotation engine.
 *
 * <p>Holds a {@link Session}, an {@link Evaluator}, and a global environment
 * that contains the built-in functions and the variables defined by calls to
 * {@link #define}.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * Quasi quasi = new Quasi().define("a", 5);
 * QuotedClosure q = quasi.quo(ast.call("+", ast.sym("a"), ast.literal(1)));
 * quasi.evalTidy(q);                                  // returns 6
 * quasi.evalTidy(q, ImmutableMap.of("a", 100));       // returns 101
 * </pre></blockquote>
 */
public class Quasi {
  private final Session session;
  private final Evaluator evaluator;
  private Environment env;

  /** Creates a Quasi with default property values and no tracing. */
  public Quasi() {
    this(Session.create());
  }

  /** Creates a Quasi with a given session. */
  public Quasi(Session session) {
    this.session = requireNonNull(session);
    this.evaluator = Evaluator.of(session);
    this.env = Environments.env();
  }

  /** Creates a Quasi that sends events to a tracer. */
  public static Quasi withTracer(Tracer tracer) {
    return new Quasi(Session.create().withTracer(tracer));
  }

  public Session session() {
    return session;
  }

  public Evaluator evaluator() {
    return evaluator;
  }

  /** Returns the global environment. */
  public Environment env() {
    return env;
  }

  /** Sets a property; a string is converted if the property is an enum.
   * Returns this. */
  @CanIgnoreReturnValue
  public Quasi set(Prop prop, @Nullable Object value) {
    prop.setLenient(session.map, value);
    return this;
  }

  /** Sets a property given its name, such as "homonyms" or "maxDepth".
   * Returns this.
   *
   * @see Prop#lookup(String) */
  @CanIgnoreReturnValue
  public Quasi set(String propName, @Nullable Object value) {
    return set(Prop.lookup(propName), value);
  }

  /** Binds a variable in the global environment. Returns this. */
  @CanIgnoreReturnValue
  public Quasi define(String name, @Nullable Object value) {
    env = env.bind(name, value);
    return this;
  }

  /** Defines a function in the global environment. The function may call
   * itself. Returns this. */
  @CanIgnoreReturnValue
  public Quasi defineFunction(String name, List<Closure.Param> params,
      Ast.Exp body) {
    env = Environments.recursive(env, name,
        env2 -> Closure.of(env2, params, body));
    return this;
  }

  /** Evaluates an expression in the global environment. */
  public @Nullable Object eval(Ast.Exp exp) {
    return evaluator.eval(exp, env);
  }

  /** Resolves the escapes in an expression, evaluating their operands in the
   * global environment. */
  public Ast.Exp expr(Ast.Exp exp) {
    return Resolver.resolve(evaluator, exp, env);
  }

  /** Resolves the escapes in an expression and pairs it with the global
   * environment. */
  public QuotedClosure quo(Ast.Exp exp) {
    return new Captures.Captured(null, expr(exp), env).toClosure();
  }

  /** Evaluates a quoted closure. */
  public @Nullable Object evalTidy(QuotedClosure closure) {
    return TidyEval.evalTidy(evaluator, closure);
  }

  /** Evaluates a quoted closure with a data mask. */
  public @Nullable Object evalTidy(QuotedClosure closure,
      Map<String, ?> data) {
    return TidyEval.evalTidy(evaluator, closure, DataMask.of(data));
  }
}

// End Quasi.java
