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

import static net.hydromatic.quasi.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsInstanceOf.instanceOf;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quasi.eval.Environments;
import net.hydromatic.quasi.quote.QuotedClosure;
import org.junit.jupiter.api.Test;

/** Tests for the expression model: {@link Ast}, {@link AstBuilder},
 * {@link Shuttle}, {@link Visitor} and {@link AstWriter}. */
public class AstTest {
  private static final Ast.Sym X = ast.sym("x");
  private static final Ast.Sym Y = ast.sym("y");
  private static final Ast.Sym Z = ast.sym("z");

  @Test
  void testToString() {
    final Ast.Call gz = ast.call("g", Z);
    final Ast.Call call =
        ast.call(ast.sym("f"),
            ImmutableList.of(ast.arg(gz), ast.namedArg("y", ast.literal(1))));
    assertThat(call.toString(), is("f(g(z), y = 1)"));
    assertThat(ast.unquote(X).toString(), is("!!x"));
    assertThat(ast.unquoteSplice(ast.sym("xs")).toString(), is("!!!xs"));
    assertThat(
        ast.define(ast.unquote(ast.sym("nm")), ast.sym("v")).toString(),
        is("!!nm := v"));
    assertThat(ast.call("f", X, ast.missingArg()).toString(), is("f(x, )"));
    assertThat(ast.sym("my var").toString(), is("`my var`"));
    assertThat(ast.sym("...").toString(), is("..."));
  }

  @Test
  void testLiteralToString() {
    assertThat(ast.literal(null).toString(), is("NULL"));
    assertThat(ast.literal(true).toString(), is("TRUE"));
    assertThat(ast.literal(false).toString(), is("FALSE"));
    assertThat(ast.literal(42).toString(), is("42"));
    assertThat(ast.literal(2.5d).toString(), is("2.5"));
    assertThat(ast.literal("a\"b").toString(), is("\"a\\\"b\""));
    assertThat(ast.valueLiteral(ImmutableList.of(1, 2)).toString(),
        is("<[1, 2]>"));
  }

  /** Tests that binary operators are rendered infix, with parentheses only
   * where precedence requires them. */
  @Test
  void testInfix() {
    final Ast.Call plus = ast.call("+", X, Y);
    assertThat(plus.toString(), is("x + y"));
    assertThat(ast.call("*", plus, Z).toString(), is("(x + y) * z"));
    assertThat(ast.call("+", X, ast.call("*", Y, Z)).toString(),
        is("x + y * z"));
    assertThat(ast.call("-", X, ast.call("-", Y, Z)).toString(),
        is("x - (y - z)"));
    assertThat(ast.call("-", ast.call("-", X, Y), Z).toString(),
        is("x - y - z"));
    assertThat(ast.call("-", X).toString(), is("-x"));
    assertThat(ast.call("$", ast.sym(".data"), X).toString(), is(".data$x"));
    assertThat(ast.call("==", plus, ast.literal(1)).toString(),
        is("x + y == 1"));

    // A call with a named argument is not infix
    assertThat(
        ast.call("+", ImmutableList.of(ast.namedArg("e1", X), ast.arg(Y)))
            .toString(),
        is("`+`(e1 = x, y)"));
  }

  @Test
  void testCallHead() {
    final Ast.Call f1 = ast.call("f", ast.literal(1));
    final Ast.Call call = ast.call(f1, ast.args(ast.literal(2)));
    assertThat(call.toString(), is("f(1)(2)"));
    assertThat(call.fnName() == null, is(true));
    assertThat(f1.fnName(), is("f"));
  }

  @Test
  void testQuotedToString() {
    final QuotedClosure q =
        QuotedClosure.of(ast.call("+", X, ast.literal(1)),
            Environments.empty());
    assertThat(ast.quoted(q).toString(), is("^(x + 1)"));
    assertThat(ast.quoted(q.withExpr(X)).toString(), is("^x"));
  }

  /** Tests that equality is structural. */
  @Test
  void testEquals() {
    final Ast.Call c1 = ast.call("f", X, ast.call("g", Y));
    final Ast.Call c2 = ast.call("f", X, ast.call("g", Y));
    assertThat(c1, not(sameInstance(c2)));
    assertThat(c1, is(c2));
    assertThat(c1.hashCode(), is(c2.hashCode()));
    assertThat(c1, not(ast.call("f", X, ast.call("g", Z))));
    assertThat(ast.namedArg("a", X), not(ast.arg(X)));
    assertThat(ast.unquote(X), is(ast.unquote(ast.sym("x"))));
    assertThat(ast.unquote(X), not((Ast.Exp) ast.unquoteSplice(X)));
    assertThat(ast.literal(1), is(ast.literal(1)));
    assertThat(ast.literal(1), not(ast.literal("1")));
  }

  @Test
  void testFromValue() {
    assertThat(ast.fromValue(X), sameInstance(X));
    assertThat(ast.fromValue(3), is(ast.literal(3)));
    assertThat(ast.fromValue(null).op, is(Op.NULL_LITERAL));
    assertThat(ast.fromValue("s").op, is(Op.STRING_LITERAL));
    assertThat(ast.fromValue(1.5d).op, is(Op.REAL_LITERAL));
    assertThat(ast.fromValue(ImmutableList.of(X)).op, is(Op.VALUE_LITERAL));
    final QuotedClosure q = QuotedClosure.of(X, Environments.empty());
    assertThat(ast.fromValue(q), instanceOf(Ast.Quoted.class));
    assertThat(((Ast.Quoted) ast.fromValue(q)).closure, sameInstance(q));
  }

  /** Tests that a shuttle that changes nothing returns the same tree, and
   * that a shuttle that changes a leaf shares the unchanged sub-trees. */
  @Test
  void testShuttle() {
    final Ast.Call gy = ast.call("g", Y);
    final Ast.Call call = ast.call("f", X, gy, ast.call("h", Z));
    assertThat(call.accept(new Shuttle()), sameInstance(call));

    final Ast.Exp call2 =
        call.accept(
            new Shuttle() {
              @Override
              protected Ast.Exp visit(Ast.Sym sym) {
                return sym.name.equals("z") ? ast.literal(0) : sym;
              }
            });
    assertThat(call2.toString(), is("f(x, g(y), h(0))"));
    assertThat(((Ast.Call) call2).args.get(1).value, sameInstance(gy));
  }

  /** Tests that a shuttle can splice arguments. */
  @Test
  void testShuttleVisitArgs() {
    final Ast.Call call = ast.call("f", X, Y);
    final Ast.Exp call2 =
        call.accept(
            new Shuttle() {
              @Override
              protected List<Ast.Arg> visitArgs(List<Ast.Arg> args) {
                final List<Ast.Arg> list = new ArrayList<>();
                for (Ast.Arg arg : args) {
                  list.add(arg);
                  list.add(arg);
                }
                return list;
              }
            });
    assertThat(call2.toString(), is("f(x, x, y, y)"));
  }

  /** Tests that the visitor visits the head and every argument, parents
   * before children. */
  @Test
  void testForEachNode() {
    final Ast.Exp exp =
        ast.call("f", ast.call("g", X), ast.unquote(ast.call("h", Y)));
    final List<String> list = new ArrayList<>();
    exp.forEachNode(node -> {
      if (node instanceof Ast.Sym) {
        list.add(((Ast.Sym) node).name);
      }
    });
    assertThat(list, is(ImmutableList.of("f", "g", "x", "h", "y")));
  }

  @Test
  void testContainsMarker() {
    assertThat(ast.call("f", X).containsMarker(), is(false));
    assertThat(ast.call("f", ast.call("g", ast.unquote(X))).containsMarker(),
        is(true));
    assertThat(
        ast.call("f", ast.define(ast.literal("a"), X)).containsMarker(),
        is(true));
    assertThat(ast.unquoteSplice(X).containsMarker(), is(true));
  }

  @Test
  void testMissingArg() {
    assertThat(ast.missingArg().isMissingArg(), is(true));
    assertThat(ast.sym("").isMissingArg(), is(true));
    assertThat(X.isMissingArg(), is(false));
    assertThat(ast.literal("").isMissingArg(), is(false));
  }
}

// End AstTest.java
