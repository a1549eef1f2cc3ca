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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions.
 *
 * <p>Most are strict: they force all of their arguments. Those that capture
 * their arguments ({@link #QUOTE}, {@link #EXPR}, {@link #QUO}, and so on)
 * read the expressions of their arguments' promises and never force them.
 *
 * @see Codes#BUILT_IN_VALUES
 */
public enum BuiltIn {
  /** Operator "+", addition. */
  PLUS("+"),

  /** Operator "-", subtraction or, with one argument, negation. */
  MINUS("-"),

  /** Operator "*", multiplication. */
  TIMES("*"),

  /** Operator "/", division; the result is always a double. */
  DIVIDE("/"),

  /** Operator "==". */
  EQ("=="),

  /** Operator "!=". */
  NE("!="),

  /** Operator "&lt;". */
  LT("<"),

  /** Operator "&lt;=". */
  LE("<="),

  /** Operator "&gt;". */
  GT(">"),

  /** Operator "&gt;=". */
  GE(">="),

  /** Operator "!", logical negation. */
  NOT("!"),

  /** Operator "$", element of a list, map or pronoun by name. The name is
   * not evaluated. */
  DOLLAR("$"),

  /** Function "as_string", the name of a symbol. */
  AS_STRING("as_string"),

  /** Function "call2", builds a call from a function name and arguments. */
  CALL2("call2"),

  /** Function "enexpr", the expression supplied for a parameter. */
  ENEXPR("enexpr"),

  /** Function "enexprs", the expressions supplied for parameters. */
  ENEXPRS("enexprs"),

  /** Function "enquo", the expression and environment supplied for a
   * parameter. */
  ENQUO("enquo"),

  /** Function "enquos", the quoted closures supplied for parameters. */
  ENQUOS("enquos"),

  /** Function "eval", evaluates an expression in an environment. */
  EVAL("eval"),

  /** Function "eval_tidy", evaluates a quoted closure with an optional data
   * mask. */
  EVAL_TIDY("eval_tidy"),

  /** Function "expr", its argument's expression with escapes resolved. */
  EXPR("expr"),

  /** Function "exprs", its arguments' expressions with escapes resolved. */
  EXPRS("exprs"),

  /** Function "identity". */
  IDENTITY("identity"),

  /** Function "if", evaluates one of two branches. Lazy. */
  IF("if"),

  /** Function "length". */
  LENGTH("length"),

  /** Function "list", creates a {@link NamedList}. Accepts "!!!" and ":=". */
  LIST("list"),

  /** Function "mean". */
  MEAN("mean"),

  /** Function "missing", whether a parameter was not supplied. */
  MISSING("missing"),

  /** Function "names", the names of a list. */
  NAMES("names"),

  /** Function "new_quosure", creates a quoted closure from an expression and
   * an environment. */
  NEW_QUOSURE("new_quosure"),

  /** Function "paste", concatenates strings. */
  PASTE("paste"),

  /** Function "quo", its argument as a quoted closure. */
  QUO("quo"),

  /** Function "quo_get_env". */
  QUO_GET_ENV("quo_get_env"),

  /** Function "quo_get_expr". */
  QUO_GET_EXPR("quo_get_expr"),

  /** Function "quo_squash", replaces embedded quoted closures by their
   * expressions. */
  QUO_SQUASH("quo_squash"),

  /** Function "quos", its arguments as quoted closures. */
  QUOS("quos"),

  /** Function "quote", its argument's expression, without resolving
   * escapes. */
  QUOTE("quote"),

  /** Function "stop", raises an error. */
  STOP("stop"),

  /** Function "sum". */
  SUM("sum"),

  /** Function "sym", converts a string to a symbol. */
  SYM("sym"),

  /** Function "syms", converts strings to symbols. */
  SYMS("syms");

  /** Name by which the function is bound in the global environment. */
  public final String name;

  /** Map of built-ins, keyed by {@link #name}. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final Map<String, BuiltIn> map = new LinkedHashMap<>();
    for (BuiltIn builtIn : values()) {
      map.put(builtIn.name, builtIn);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  BuiltIn(String name) {
    this.name = requireNonNull(name);
  }

  /** Looks up a built-in by name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }
}

// End BuiltIn.java
