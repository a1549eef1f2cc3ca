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

import static java.util.Objects.requireNonNull;

import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an expression tree out as a string. */
public class AstWriter {
  private static final Pattern SYNTACTIC_NAME =
      Pattern.compile("[A-Za-z.][A-Za-z0-9._]*|\\.\\.\\.");

  /** Precedence of a call's head, tighter than every operator. */
  private static final int HEAD_PREC = 10;

  /** Precedence of a prefix operator ("-", "!!", "!!!", "^"). */
  private static final int PREFIX_PREC = 8;

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(@Nullable String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier, quoting it in back-ticks if necessary. */
  public AstWriter id(String name) {
    if (name.isEmpty()) {
      return this; // empty argument
    }
    if (SYNTACTIC_NAME.matcher(name).matches()) {
      return append(name);
    }
    return append("`").append(name.replace("`", "\\`")).append("`");
  }

  /** Appends a literal value. */
  public AstWriter appendLiteral(Op op, @Nullable Object value) {
    switch (op) {
      case NULL_LITERAL:
        return append("NULL");
      case BOOL_LITERAL:
        return append((Boolean) requireNonNull(value) ? "TRUE" : "FALSE");
      case STRING_LITERAL:
        final String s = (String) requireNonNull(value);
        return append("\"")
            .append(s.replace("\\", "\\\\").replace("\"", "\\\""))
            .append("\"");
      case VALUE_LITERAL:
        return append("<").append(String.valueOf(value)).append(">");
      default:
        return append(String.valueOf(value));
    }
  }

  /**
   * Appends a prefix operator and its operand, adding parentheses if the
   * context binds tighter than a prefix operator.
   */
  public AstWriter prefix(Op op, Ast.Exp operand) {
    append(op.spelling);
    return operand.unparse(this, PREFIX_PREC + 1);
  }

  /** Appends a call, in infix form if its head is a binary operator. */
  public AstWriter call(Ast.Call call, int prec) {
    final String name = call.fnName();
    final Integer opPrec =
        name == null ? null : Op.INFIX_PRECEDENCE.get(name);
    if (opPrec != null
        && call.args.size() == 2
        && call.args.get(0).isPositional()
        && call.args.get(1).isPositional()) {
      if (prec > opPrec) {
        return append("(").call(call, 0).append(")");
      }
      call.args.get(0).value.unparse(this, opPrec);
      append(name.equals("$") ? "$" : " " + name + " ");
      return call.args.get(1).value.unparse(this, opPrec + 1);
    }
    if ("-".equals(name)
        && call.args.size() == 1
        && call.args.get(0).isPositional()) {
      append("-");
      return call.args.get(0).value.unparse(this, PREFIX_PREC + 1);
    }
    if (call.head instanceof Ast.Sym) {
      id(((Ast.Sym) call.head).name);
    } else if (call.head instanceof Ast.Call) {
      call.head.unparse(this, HEAD_PREC);
    } else {
      append("(");
      call.head.unparse(this, 0);
      append(")");
    }
    append("(");
    for (int i = 0; i < call.args.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      call.args.get(i).unparse(this, 0);
    }
    return append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
