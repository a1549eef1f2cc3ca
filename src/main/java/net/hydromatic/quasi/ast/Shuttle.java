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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms expression trees.
 *
 * <p>Children are transformed before their parent is rebuilt. A node whose
 * children are unchanged is returned as is, so an identity shuttle returns
 * the very tree it was given.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  /**
   * Transforms the arguments of a call. A sub-class may return more or fewer
   * arguments than it was given.
   */
  protected List<Ast.Arg> visitArgs(List<Ast.Arg> args) {
    final ImmutableList.Builder<Ast.Arg> list = ImmutableList.builder();
    for (Ast.Arg arg : args) {
      list.add(arg.accept(this));
    }
    return list.build();
  }

  protected Ast.Exp visit(Ast.Sym sym) {
    return sym; // leaf
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(call.head.accept(this), visitArgs(call.args));
  }

  protected Ast.Arg visit(Ast.Arg arg) {
    return arg.copy(arg.name, arg.value.accept(this));
  }

  protected Ast.Exp visit(Ast.Unquote unquote) {
    return unquote.copy(unquote.operand.accept(this));
  }

  protected Ast.Exp visit(Ast.UnquoteSplice unquoteSplice) {
    return unquoteSplice.copy(unquoteSplice.operand.accept(this));
  }

  protected Ast.Exp visit(Ast.Define define) {
    return define.copy(define.lhs.accept(this), define.rhs.accept(this));
  }

  protected Ast.Exp visit(Ast.Quoted quoted) {
    return quoted; // leaf; its expression belongs to another scope
  }
}

// End Shuttle.java
