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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.quasi.quote.QuotedClosure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expression tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final Ast.Sym MISSING_ARG = new Ast.Sym("");

  /** Creates a symbol. */
  public Ast.Sym sym(String name) {
    return new Ast.Sym(name);
  }

  /**
   * Creates the empty symbol, which stands for an argument that was left
   * empty, as the second argument in "f(x, )".
   */
  public Ast.Sym missingArg() {
    return MISSING_ARG;
  }

  /**
   * Creates a literal from an atomic value: null, a boolean, a number, or a
   * string.
   */
  public Ast.Literal literal(@Nullable Object value) {
    checkArgument(isAtomic(value), "not an atomic value: %s", value);
    return new Ast.Literal(atomicOp(value), value);
  }

  /** Creates a literal that holds an arbitrary, non-atomic value. */
  public Ast.Literal valueLiteral(Object value) {
    return new Ast.Literal(Op.VALUE_LITERAL, value);
  }

  /** Creates a call. */
  public Ast.Call call(Ast.Exp head, List<Ast.Arg> args) {
    return new Ast.Call(head, ImmutableList.copyOf(args));
  }

  /** Creates a call to a named function with positional arguments. */
  public Ast.Call call(String fnName, Ast.Exp... args) {
    return call(sym(fnName), args(args));
  }

  /** Creates a call to a named function. */
  public Ast.Call call(String fnName, List<Ast.Arg> args) {
    return call(sym(fnName), args);
  }

  /** Creates an argument; positional if {@code name} is null. */
  public Ast.Arg arg(@Nullable String name, Ast.Exp value) {
    return new Ast.Arg(name, value);
  }

  /** Creates a positional argument. */
  public Ast.Arg arg(Ast.Exp value) {
    return new Ast.Arg(null, value);
  }

  /** Creates a named argument. */
  public Ast.Arg namedArg(String name, Ast.Exp value) {
    return new Ast.Arg(name, value);
  }

  /** Converts expressions into a list of positional arguments. */
  public ImmutableList<Ast.Arg> args(Ast.Exp... values) {
    final ImmutableList.Builder<Ast.Arg> list = ImmutableList.builder();
    for (Ast.Exp value : values) {
      list.add(arg(value));
    }
    return list.build();
  }

  /** Creates an unquote marker, "!!operand". */
  public Ast.Unquote unquote(Ast.Exp operand) {
    return new Ast.Unquote(operand);
  }

  /** Creates an unquote-splice marker, "!!!operand". */
  public Ast.UnquoteSplice unquoteSplice(Ast.Exp operand) {
    return new Ast.UnquoteSplice(operand);
  }

  /** Creates a define marker, "lhs := rhs". */
  public Ast.Define define(Ast.Exp lhs, Ast.Exp rhs) {
    return new Ast.Define(lhs, rhs);
  }

  /** Creates a node that embeds a quoted closure. */
  public Ast.Quoted quoted(QuotedClosure closure) {
    return new Ast.Quoted(closure);
  }

  /**
   * Converts a value into an expression, so that it can be substituted into a
   * tree.
   *
   * <p>An expression is returned as is; a {@link QuotedClosure} is embedded as
   * a {@link Ast.Quoted}; an atomic value becomes a {@link Ast.Literal}; any
   * other value becomes a literal of type {@link Op#VALUE_LITERAL}.
   */
  public Ast.Exp fromValue(@Nullable Object value) {
    if (value instanceof Ast.Exp) {
      return (Ast.Exp) value;
    }
    if (value instanceof QuotedClosure) {
      return quoted((QuotedClosure) value);
    }
    if (isAtomic(value)) {
      return literal(value);
    }
    return valueLiteral(value);
  }

  /** Returns whether a value can be held in an atomic literal. */
  public static boolean isAtomic(@Nullable Object value) {
    return value == null
        || value instanceof Boolean
        || value instanceof String
        || isInteger(value)
        || isReal(value);
  }

  private static boolean isInteger(Object value) {
    return value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger;
  }

  private static boolean isReal(Object value) {
    return value instanceof Double
        || value instanceof Float
        || value instanceof BigDecimal;
  }

  private static Op atomicOp(@Nullable Object value) {
    if (value == null) {
      return Op.NULL_LITERAL;
    } else if (value instanceof Boolean) {
      return Op.BOOL_LITERAL;
    } else if (value instanceof String) {
      return Op.STRING_LITERAL;
    } else if (isInteger(value)) {
      return Op.INT_LITERAL;
    } else {
      return Op.REAL_LITERAL;
    }
  }
}

// End AstBuilder.java
