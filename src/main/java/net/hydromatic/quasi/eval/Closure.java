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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function value that is sufficient to bind its arguments and evaluate its
 * body.
 *
 * <p>Arguments are matched to parameters first by exact name, then by
 * position; positional matching stops at the "..." parameter, if any. Excess
 * arguments go into "...", or are an error if the function has no "..."
 * parameter.
 *
 * <p>Each parameter is bound to the caller's {@link Promise}, unforced, so
 * that the body may either evaluate the argument or capture its expression.
 */
public class Closure implements Applicable {
  /** Environment in which the closure was created. Contains the variables
   * "captured" from the environment. */
  public final Environment env;
  public final ImmutableList<Param> params;
  public final Ast.Exp body;

  private Closure(Environment env, ImmutableList<Param> params, Ast.Exp body) {
    this.env = requireNonNull(env);
    this.params = requireNonNull(params);
    this.body = requireNonNull(body);
  }

  /** Creates a closure. */
  public static Closure of(Environment env, List<Param> params, Ast.Exp body) {
    final List<String> names = new ArrayList<>();
    for (Param param : params) {
      if (names.contains(param.name)) {
        throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
            "repeated formal argument '" + param.name + "'");
      }
      names.add(param.name);
    }
    return new Closure(env, ImmutableList.copyOf(params), body);
  }

  @Override
  public String toString() {
    return "function(" + params + ") " + body;
  }

  /** Returns whether this closure has a parameter of a given name. */
  public boolean hasParam(String name) {
    return params.stream().anyMatch(param -> param.name.equals(name));
  }

  private int dotsIndex() {
    for (int i = 0; i < params.size(); i++) {
      if (params.get(i).isDots()) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public @Nullable Object apply(Evaluator evaluator, Args args) {
    final Frame frame = bind(args);
    return evaluator.eval(body, frame.env);
  }

  /** Binds actual arguments to parameters, creating a call frame. */
  Frame bind(Args args) {
    final int paramCount = params.size();
    final int dotsIndex = dotsIndex();
    final Args.Actual[] matched = new Args.Actual[paramCount];
    final boolean[] used = new boolean[args.size()];

    // Pass 1. Match named arguments by exact name.
    for (int j = 0; j < args.size(); j++) {
      final Args.Actual actual = args.get(j);
      if (actual.name == null) {
        continue;
      }
      for (int i = 0; i < paramCount; i++) {
        final Param param = params.get(i);
        if (!param.isDots() && param.name.equals(actual.name)) {
          if (matched[i] != null) {
            throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
                "formal argument \"" + param.name
                    + "\" matched by multiple actual arguments");
          }
          matched[i] = actual;
          used[j] = true;
          break;
        }
      }
    }

    // Pass 2. Match unnamed arguments by position, up to "...".
    final int positionalLimit = dotsIndex < 0 ? paramCount : dotsIndex;
    int i = 0;
    for (int j = 0; j < args.size(); j++) {
      final Args.Actual actual = args.get(j);
      if (used[j] || actual.name != null) {
        continue;
      }
      while (i < positionalLimit && matched[i] != null) {
        ++i;
      }
      if (i >= positionalLimit) {
        break;
      }
      matched[i] = actual;
      used[j] = true;
    }

    // Pass 3. Whatever is left over goes into "...".
    final ImmutableList.Builder<Args.Actual> dots = ImmutableList.builder();
    for (int j = 0; j < args.size(); j++) {
      if (used[j]) {
        continue;
      }
      if (dotsIndex < 0) {
        throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
            "unused argument (" + args.get(j) + ")");
      }
      dots.add(args.get(j));
    }

    final LinkedHashMap<String, @Nullable Object> map = new LinkedHashMap<>();
    final Environment frameEnv = Environments.frame(env, map);
    final ImmutableList<Args.Actual> dotsList = dots.build();
    final ImmutableSet.Builder<String> unsupplied = ImmutableSet.builder();
    for (int k = 0; k < paramCount; k++) {
      final Param param = params.get(k);
      final Args.Actual actual = matched[k];
      if (param.isDots()) {
        map.put(Frame.DOTS, dotsList);
      } else if (actual != null && !actual.promise.expr.isMissingArg()) {
        map.put(param.name, actual.promise);
      } else {
        unsupplied.add(param.name);
        bindUnsupplied(map, param, frameEnv);
      }
    }
    final Frame frame =
        new Frame(this, args, frameEnv, dotsList, unsupplied.build());
    map.put(Frame.FRAME, frame);
    return frame;
  }

  private static void bindUnsupplied(Map<String, @Nullable Object> map,
      Param param, Environment frameEnv) {
    if (param.defaultValue != null) {
      // Default values are evaluated in the frame, so may refer to other
      // parameters.
      map.put(param.name, new Promise(param.defaultValue, frameEnv));
    } else {
      map.put(param.name, Missing.INSTANCE);
    }
  }

  /** Formal parameter of a closure. */
  public static class Param {
    /** The variadic parameter, "...". */
    public static final Param DOTS = new Param(Frame.DOTS, null);

    public final String name;
    /** Default value, evaluated in the call frame; null if none. */
    public final Ast.@Nullable Exp defaultValue;

    private Param(String name, Ast.@Nullable Exp defaultValue) {
      this.name = requireNonNull(name);
      this.defaultValue = defaultValue;
    }

    /** Creates a parameter with no default value. */
    public static Param of(String name) {
      return name.equals(Frame.DOTS) ? DOTS : new Param(name, null);
    }

    /** Creates a parameter with a default value. */
    public static Param of(String name, Ast.Exp defaultValue) {
      return new Param(name, requireNonNull(defaultValue));
    }

    /** Returns whether this is the "..." parameter. */
    public boolean isDots() {
      return name.equals(Frame.DOTS);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, defaultValue);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
              && name.equals(((Param) o).name)
              && Objects.equals(defaultValue, ((Param) o).defaultValue);
    }

    @Override
    public String toString() {
      return defaultValue == null ? name : name + " = " + defaultValue;
    }
  }
}

// End Closure.java
