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
import static net.hydromatic.quasi.ast.AstBuilder.ast;
import static net.hydromatic.quasi.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.eval.Args;
import net.hydromatic.quasi.eval.Binding;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.Frame;
import net.hydromatic.quasi.eval.Missing;
import net.hydromatic.quasi.eval.NamedList;
import net.hydromatic.quasi.eval.Promise;
import net.hydromatic.quasi.eval.Prop;
import net.hydromatic.quasi.eval.Session;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Captures the expressions that a caller supplied as arguments.
 *
 * <p>Capturing reads the expression, and optionally the environment, of the
 * {@link Promise} bound to a parameter. It never forces the promise, so an
 * argument that would fail if evaluated can still be captured.
 */
public class Captures {
  private Captures() {}

  /**
   * Returns the expression that the caller supplied for a parameter.
   *
   * @throws QuasiException of kind {@code MISSING_ARGUMENT} if the caller did
   *     not supply the parameter and it has no default; of kind
   *     {@code BAD_ARGUMENT} if the function has no such parameter
   */
  public static Ast.Exp captureOne(Frame frame, String paramName) {
    return promise(frame, paramName).expr;
  }

  /**
   * Returns the expression that the caller supplied for a parameter, and the
   * environment in which the caller supplied it.
   */
  public static QuotedClosure captureScoped(Frame frame, String paramName) {
    final Promise promise = promise(frame, paramName);
    return QuotedClosure.of(promise.expr, promise.env);
  }

  /** Returns the expressions of the excess arguments of a frame, with their
   * names, in the order the caller wrote them. */
  public static List<Ast.Arg> captureAll(Frame frame) {
    final ImmutableList.Builder<Ast.Arg> list = ImmutableList.builder();
    for (Args.Actual actual : frame.dots) {
      list.add(ast.arg(actual.name, actual.promise.expr));
    }
    return list.build();
  }

  /** Returns the excess arguments of a frame as quoted closures. */
  public static NamedList captureAllScoped(Frame frame) {
    final List<@Nullable String> names = new ArrayList<>();
    final List<@Nullable Object> closures = new ArrayList<>();
    for (Args.Actual actual : frame.dots) {
      names.add(actual.name);
      closures.add(
          QuotedClosure.of(actual.promise.expr, actual.promise.env));
    }
    return NamedList.of(names, closures);
  }

  private static Promise promise(Frame frame, String paramName) {
    if (paramName.equals(Frame.DOTS) || !frame.fn.hasParam(paramName)) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'" + paramName + "' must refer to a parameter of the function");
    }
    final Binding binding =
        requireNonNull(frame.env.getLocalOpt(paramName), paramName);
    if (binding.value == Missing.INSTANCE) {
      throw new QuasiException(QuasiException.Kind.MISSING_ARGUMENT,
          "argument \"" + paramName + "\" is missing, with no default");
    }
    return (Promise) requireNonNull(binding.value);
  }

  /** Returns the frame of the closure whose body contains an environment. */
  public static Frame frame(Environment env, String fnName) {
    final Frame frame = Frame.of(env);
    if (frame == null) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'" + fnName + "' must be called from within a function");
    }
    return frame;
  }

  /**
   * Resolves a list of captured arguments, each in its own environment, and
   * applies the session's options for capturing several arguments.
   *
   * @see Prop#IGNORE_EMPTY
   * @see Prop#HOMONYMS
   * @see Prop#NAMED
   */
  public static List<Captured> resolve(Evaluator evaluator,
      List<Captured> captures) {
    final List<Captured> list = new ArrayList<>();
    for (Captured captured : captures) {
      final List<Ast.Arg> args =
          Resolver.resolveArgs(evaluator,
              ImmutableList.of(ast.arg(captured.name, captured.expr)),
              captured.env);
      for (Ast.Arg arg : args) {
        list.add(new Captured(arg.name, arg.value, captured.env));
      }
    }
    return finish(evaluator.session, list);
  }

  /** Applies the session's options for capturing several arguments. */
  static List<Captured> finish(Session session, List<Captured> captures) {
    List<Captured> list = new ArrayList<>(captures);
    switch (Prop.IGNORE_EMPTY.enumValue(session.map, Prop.IgnoreEmpty.class)) {
      case ALL:
        list.removeIf(captured -> captured.expr.isMissingArg());
        break;
      case TRAILING:
        if (!list.isEmpty() && last(list).expr.isMissingArg()) {
          list.remove(list.size() - 1);
        }
        break;
      default:
        break;
    }

    switch (Prop.HOMONYMS.enumValue(session.map, Prop.Homonyms.class)) {
      case FIRST:
        list = dedup(list);
        break;
      case LAST:
        list = ImmutableList.copyOf(dedup(ImmutableList.copyOf(list).reverse()))
            .reverse();
        break;
      case ERROR:
        final Set<String> names = new HashSet<>();
        for (Captured captured : list) {
          if (captured.name != null && !names.add(captured.name)) {
            throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
                "arguments can't have the same name; found duplicate `"
                    + captured.name + "`");
          }
        }
        break;
      default:
        break;
    }

    if (Prop.NAMED.booleanValue(session.map)) {
      final List<Captured> named = new ArrayList<>();
      for (Captured captured : list) {
        named.add(captured.name != null
            ? captured
            : new Captured(captured.expr.toString(), captured.expr,
                captured.env));
      }
      list = named;
    }
    return list;
  }

  /** Removes arguments whose name has already been seen. */
  private static List<Captured> dedup(List<Captured> list) {
    final Set<String> names = new HashSet<>();
    final List<Captured> result = new ArrayList<>();
    for (Captured captured : list) {
      if (captured.name == null || names.add(captured.name)) {
        result.add(captured);
      }
    }
    return result;
  }

  /** Converts captured arguments to a list of expressions. */
  public static NamedList toExprs(List<Captured> captures) {
    final List<@Nullable String> names = new ArrayList<>();
    final List<@Nullable Object> exprs = new ArrayList<>();
    for (Captured captured : captures) {
      names.add(captured.name);
      exprs.add(captured.expr);
    }
    return NamedList.of(names, exprs);
  }

  /** Converts captured arguments to a list of quoted closures. */
  public static NamedList toQuos(List<Captured> captures) {
    final List<@Nullable String> names = new ArrayList<>();
    final List<@Nullable Object> closures = new ArrayList<>();
    for (Captured captured : captures) {
      names.add(captured.name);
      closures.add(captured.toClosure());
    }
    return NamedList.of(names, closures);
  }

  /** An argument that has been captured: its name (or null), its
   * expression, and the environment in which it was written. */
  public static class Captured {
    public final @Nullable String name;
    public final Ast.Exp expr;
    public final Environment env;

    public Captured(@Nullable String name, Ast.Exp expr, Environment env) {
      this.name = name;
      this.expr = requireNonNull(expr);
      this.env = requireNonNull(env);
    }

    /** Creates a Captured from an argument of a call. */
    public static Captured of(Args.Actual actual) {
      return new Captured(actual.name, actual.promise.expr,
          actual.promise.env);
    }

    @Override
    public String toString() {
      return name == null ? expr.toString() : name + " = " + expr;
    }

    /** Converts to a quoted closure. If the expression is itself an embedded
     * quoted closure, returns that closure. */
    public QuotedClosure toClosure() {
      if (expr instanceof Ast.Quoted) {
        return ((Ast.Quoted) expr).closure;
      }
      return QuotedClosure.of(expr, env);
    }
  }
}

// End Captures.java
