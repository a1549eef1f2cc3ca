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

import static net.hydromatic.quasi.Matchers.isAst;
import static net.hydromatic.quasi.Matchers.throwsA;
import static net.hydromatic.quasi.Ql.assertError;
import static net.hydromatic.quasi.Ql.ql;
import static net.hydromatic.quasi.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Environments;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.NamedList;
import net.hydromatic.quasi.eval.Session;
import net.hydromatic.quasi.eval.Tracers;
import net.hydromatic.quasi.util.QuasiException;
import org.junit.jupiter.api.Test;

/** Tests for {@link TidyEval} and {@link DataMask}. */
public class TidyEvalTest {
  private static final Ast.Sym A = ast.sym("a");
  private static final Ast.Sym B = ast.sym("b");

  private final Evaluator evaluator = Evaluator.of(Session.create());

  private static Environment env(String name, Object value) {
    return Environments.env().bind(name, value);
  }

  private static Ast.Exp dollar(String pronoun, String name) {
    return ast.call("$", ast.sym(pronoun), ast.sym(name));
  }

  /** Tests that a data mask shadows the closure's environment. */
  @Test
  void testEvalTidy() {
    final QuotedClosure closure =
        QuotedClosure.of(ast.call("+", A, ast.literal(1)), env("a", 5));
    assertThat(TidyEval.evalTidy(evaluator, closure), is(6));
    assertThat(
        TidyEval.evalTidy(evaluator, closure, ImmutableMap.of("a", 100)),
        is(101));

    // The closure is unchanged, and can be evaluated again.
    assertThat(TidyEval.evalTidy(evaluator, closure), is(6));
  }

  /** Tests that names not in the mask are still found in the closure's
   * environment. */
  @Test
  void testMaskFallsThrough() {
    final QuotedClosure closure =
        QuotedClosure.of(ast.call("+", A, B), env("a", 5).bind("b", 1));
    assertThat(
        TidyEval.evalTidy(evaluator, closure, ImmutableMap.of("a", 100)),
        is(101));
    final QuotedClosure closure2 =
        QuotedClosure.of(ast.call("+", A, ast.sym("w")), env("a", 5));
    assertError(() ->
            TidyEval.evalTidy(evaluator, closure2, ImmutableMap.of("a", 1)),
        throwsA(QuasiException.Kind.UNBOUND_SYMBOL, "object 'w' not found"));
  }

  @Test
  void testPronouns() {
    final Environment env = env("a", 5);
    final ImmutableMap<String, Integer> data = ImmutableMap.of("a", 100);
    assertThat(
        TidyEval.evalTidy(evaluator,
            QuotedClosure.of(dollar(DataMask.DATA, "a"), env), data),
        is(100));
    assertThat(
        TidyEval.evalTidy(evaluator,
            QuotedClosure.of(dollar(DataMask.ENV, "a"), env), data),
        is(5));
    assertThat(
        TidyEval.evalTidy(evaluator,
            QuotedClosure.of(
                ast.call("-", dollar(DataMask.DATA, "a"),
                    dollar(DataMask.ENV, "a")),
                env),
            data),
        is(95));
    assertError(() ->
            TidyEval.evalTidy(evaluator,
                QuotedClosure.of(dollar(DataMask.DATA, "b"), env), data),
        throwsA(QuasiException.Kind.UNBOUND_SYMBOL,
            "Column `b` not found in `.data`"));

    // Without a mask there are no pronouns.
    assertError(() ->
            TidyEval.evalTidy(evaluator,
                QuotedClosure.of(dollar(DataMask.DATA, "a"), env)),
        throwsA(QuasiException.Kind.UNBOUND_SYMBOL,
            "object '.data' not found"));
  }

  /** Tests that a quoted closure embedded in an expression is evaluated in
   * its own environment, and that a data mask applies to it too. */
  @Test
  void testNestedClosure() {
    final QuotedClosure inner =
        QuotedClosure.of(ast.call("*", B, ast.literal(2)), env("b", 5));
    final QuotedClosure outer =
        QuotedClosure.of(ast.call("+", ast.quoted(inner), ast.literal(1)),
            env("b", 1000));
    assertThat(TidyEval.evalTidy(evaluator, outer), is(11));
    assertThat(TidyEval.evalTidy(evaluator, outer, ImmutableMap.of("b", 100)),
        is(201));

    // Plain evaluation also honors the embedded environment.
    assertThat(evaluator.eval(outer.expr, Environments.env()), is(11));
  }

  @Test
  void testMaskFromEnvironmentAndList() {
    final QuotedClosure closure =
        QuotedClosure.of(ast.call("+", A, ast.literal(1)), env("a", 5));
    final Environment mask = Environments.empty().bind("a", 10);
    assertThat(TidyEval.evalTidy(evaluator, closure, mask), is(11));

    final NamedList list =
        NamedList.of(Arrays.asList("a", null, "a"),
            ImmutableList.of(20, 30, 40));
    final DataMask dataMask = DataMask.of(list);
    assertThat(dataMask.names(), is(ImmutableSet.of("a")));
    assertThat(TidyEval.evalTidy(evaluator, closure, dataMask), is(21));
  }

  /** Tests the "eval_tidy" built-in function. */
  @Test
  void testEvalTidyBuiltIn() {
    final Ast.Call quo = ast.call("quo", ast.call("+", A, ast.literal(1)));
    ql(ast.call("eval_tidy", quo)).with("a", 5).assertEval(is(6));
    ql(ast.call("eval_tidy", quo,
            ast.call("list",
                ImmutableList.of(ast.namedArg("a", ast.literal(100))))))
        .with("a", 5)
        .assertEval(is(101));
    ql(ast.call("eval_tidy",
            ImmutableList.of(
                ast.arg(ast.call("quote", ast.call("*", A, ast.literal(2)))),
                ast.namedArg("data", ast.sym("m")))))
        .with("a", 5)
        .with("m", ImmutableMap.of("a", 4))
        .assertEval(is(8));
    ql(ast.call("eval_tidy", ast.literal(7))).assertEval(is(7));
    ql(ast.call("eval_tidy", quo, ast.literal(1)))
        .with("a", 5)
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "'data' must be a list, a map or an environment, got"));
  }

  @Test
  void testSquash() {
    final QuotedClosure inner =
        QuotedClosure.of(ast.call("*", B, ast.literal(2)), env("b", 5));
    final QuotedClosure outer =
        QuotedClosure.of(ast.call("f", ast.quoted(inner)), env("b", 1));
    assertThat(outer.expr, isAst("f(^(b * 2))"));
    assertThat(outer.squash(), isAst("f(b * 2)"));
    ql(ast.call("quo_squash", ast.sym("q")))
        .with("q", outer)
        .assertEval(isAst("f(b * 2)"));
    ql(ast.call("quo_get_env", ast.sym("q")))
        .with("q", inner)
        .assertEval(is(inner.env));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    final Evaluator evaluator2 =
        Evaluator.of(
            Session.create().withTracer(
                Tracers.withOnEvalTidy(Tracers.empty(), (closure, mask) ->
                    events.add(closure + " "
                        + (mask == null ? "no mask" : mask.names())))));
    final QuotedClosure closure =
        QuotedClosure.of(ast.call("+", A, ast.literal(1)), env("a", 5));
    TidyEval.evalTidy(evaluator2, closure);
    TidyEval.evalTidy(evaluator2, closure, ImmutableMap.of("a", 1));
    assertThat(events,
        is(
            ImmutableList.of("<quosure: a + 1> no mask",
                "<quosure: a + 1> [a]")));
  }
}

// End TidyEvalTest.java
