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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID,

  // literals
  NULL_LITERAL,
  BOOL_LITERAL,
  INT_LITERAL,
  REAL_LITERAL,
  STRING_LITERAL,
  /**
   * Literal whose value is a non-atomic value, such as a list, that was
   * inlined into a tree by an escape.
   */
  VALUE_LITERAL,

  // calls
  CALL,
  ARG,

  // escape markers; occur between capture and resolution, never after
  UNQUOTE("!!"),
  UNQUOTE_SPLICE("!!!"),
  DEFINE(" := "),

  /** Quoted closure embedded in a tree. */
  QUOTED("^");

  /** Prefix or infix spelling used when rendering, e.g. "!!"; or null. */
  public final @Nullable String spelling;

  /**
   * Binary operators that are rendered infix, and their precedence. Higher
   * binds tighter.
   */
  public static final ImmutableMap<String, Integer> INFIX_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("$", 9)
          .put("*", 7)
          .put("/", 7)
          .put("+", 6)
          .put("-", 6)
          .put("==", 4)
          .put("!=", 4)
          .put("<", 4)
          .put("<=", 4)
          .put(">", 4)
          .put(">=", 4)
          .build();

  Op() {
    this(null);
  }

  Op(@Nullable String spelling) {
    this.spelling = spelling;
  }

  /** Returns whether this is one of the literal operators. */
  public boolean isLiteral() {
    switch (this) {
      case NULL_LITERAL:
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case VALUE_LITERAL:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is an escape marker. */
  public boolean isMarker() {
    return this == UNQUOTE || this == UNQUOTE_SPLICE || this == DEFINE;
  }
}

// End Op.java
