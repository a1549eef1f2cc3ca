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
package net.hydromatic.quasi.util;

import static java.util.Objects.requireNonNull;

/**
 * Error raised while capturing, resolving or evaluating an expression.
 *
 * <p>The {@link #kind} says what went wrong. Errors are propagated to the
 * caller of the operation that detected them; the engine never retries.
 */
public class QuasiException extends RuntimeException {
  public final Kind kind;

  /** Creates a QuasiException. */
  public QuasiException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind);
  }

  @Override
  public String toString() {
    return kind.errorName + ": " + getMessage();
  }

  /** Writes a description of this error to a buffer. */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ")
        .append(kind.errorName)
        .append(": ")
        .append(getMessage());
  }

  /** Kinds of error. */
  public enum Kind {
    /** No scope in the environment chain defines a name. */
    UNBOUND_SYMBOL("UnboundSymbolError"),
    /** A parameter that was not supplied was captured or evaluated. */
    MISSING_ARGUMENT("MissingArgumentError"),
    /** A promise was forced while it was already being forced. */
    RECURSIVE_PROMISE("RecursivePromiseError"),
    /**
     * A splice marker occurred where only a single expression is allowed, or
     * its operand did not evaluate to a sequence.
     */
    SPLICE_CONTEXT("SpliceContextError"),
    /** The name operand of a define marker did not evaluate to a string. */
    DEFINE_NAME("DefineNameError"),
    /** An escape marker occurred in a position where it is not allowed. */
    SYNTAX("SyntaxError"),
    /** The head of a call did not evaluate to a function. */
    NOT_A_FUNCTION("NotAFunctionError"),
    /** A function received arguments of the wrong number or type. */
    BAD_ARGUMENT("BadArgumentError"),
    /** Nesting exceeded the session's "maxDepth" property. */
    DEPTH("DepthError"),
    /** Raised by the "stop" built-in function. */
    ERROR("Error");

    public final String errorName;

    Kind(String errorName) {
      this.errorName = errorName;
    }
  }
}

// End QuasiException.java
