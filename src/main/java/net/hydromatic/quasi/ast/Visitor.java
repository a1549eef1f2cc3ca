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

/**
 * Visits expression trees, depth-first, parents before children.
 *
 * <p>Visits the head of every call as well as its arguments, and the
 * operands of escape markers.
 */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  /** Called on each node before its children are visited. */
  protected void preVisit(AstNode node) {}

  protected void visit(Ast.Sym sym) {
    preVisit(sym);
  }

  protected void visit(Ast.Literal literal) {
    preVisit(literal);
  }

  protected void visit(Ast.Call call) {
    preVisit(call);
    call.head.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.Arg arg) {
    preVisit(arg);
    arg.value.accept(this);
  }

  protected void visit(Ast.Unquote unquote) {
    preVisit(unquote);
    unquote.operand.accept(this);
  }

  protected void visit(Ast.UnquoteSplice unquoteSplice) {
    preVisit(unquoteSplice);
    unquoteSplice.operand.accept(this);
  }

  protected void visit(Ast.Define define) {
    preVisit(define);
    define.lhs.accept(this);
    define.rhs.accept(this);
  }

  protected void visit(Ast.Quoted quoted) {
    preVisit(quoted);
    quoted.closure.expr.accept(this);
  }
}

// End Visitor.java
