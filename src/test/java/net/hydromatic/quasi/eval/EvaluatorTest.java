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

import static net.hydromatic.quasi.Matchers.isAst;
import static net.hydromatic.quasi.Matchers.isNamedList;
import static net.hydromatic.quasi.Matchers.throwsA;
import static net.hydromatic.quasi.Ql.ql;
import static net.hydromatic.quasi.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.util.QuasiException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}, {@link Closure} and the built-in functions
 * in {@link Codes}. */
public class EvaluatorTest {
  private static final Ast.Sym X = ast.sym("x");
  private static final Ast.Sym Y = ast.sym("y");

  private static Ast.Literal lit(Object o) {
    return ast.literal(o);
  }

  @Test
  void testLiteral() {
    ql(lit(1)).assertEval(is(1));
    ql(lit("a")).assertEval(is("a"));
    ql(ast.literal(null)).assertEval(nullValue());
  }

  @Test
  void testArithmetic() {
    ql(ast.call("+", lit(1), lit(5))).assertEval(is(6));
    ql(ast.call("-", lit(1), lit(5))).assertEval(is(-4));
    ql(ast.call("-", lit(3))).assertEval(is(-3));
    ql(ast.call("*", lit(4), lit(5))).assertEval(is(20));
    ql(ast.call("/", lit(10), lit(4))).assertEval(is(2.5d));
    ql(ast.call("+", lit(1), lit(2.5d))).assertEval(is(3.5d));
    ql(ast.call("+", lit(1L), lit(2))).assertEval(is(3L));
    ql(ast.call("+", lit(1), lit("a")))
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "non-numeric argument to '+'"));
  }

  @Test
  void testComparison() {
    ql(ast.call("<", lit(1), lit(2))).assertEval(is(true));
    ql(ast.call(">=", lit(1), lit(2.5d))).assertEval(is(false));
    ql(ast.call("==", lit(2), lit(2L))).assertEval(is(true));
    ql(ast.call("!=", lit("a"), lit("b"))).assertEval(is(true));
    ql(ast.call("<", lit("a"), lit("b"))).assertEval(is(true));
    ql(ast.call("==", lit(true), lit(true))).assertEval(is(true));
    ql(ast.call("!", ast.call("==", lit(1), lit(1)))).assertEval(is(false));
    ql(ast.call("<", lit(true), lit(1)))
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "comparison (<) is possible only for numbers and strings"));
  }

  /** Tests comparisons of signed zeros, NaN and longs too large to be
   * represented exactly as doubles. */
  @Test
  void testNumericComparisonEdgeCases() {
    ql(ast.call("==", lit(0.0d), lit(-0.0d))).assertEval(is(true));
    ql(ast.call("<", lit(-0.0d), lit(0.0d))).assertEval(is(false));
    ql(ast.call("==", lit(Double.NaN), lit(Double.NaN))).assertEval(is(false));
    ql(ast.call("!=", lit(Double.NaN), lit(Double.NaN))).assertEval(is(true));
    ql(ast.call("<", lit(Double.NaN), lit(1))).assertEval(is(false));
    ql(ast.call(">=", lit(Double.NaN), lit(1))).assertEval(is(false));
    final long big = 1L << 53;
    ql(ast.call("==", lit(big), lit(big + 1))).assertEval(is(false));
    ql(ast.call("<", lit(big), lit(big + 1))).assertEval(is(true));
  }

  @Test
  void testVariables() {
    ql(ast.call("+", X, Y)).with("x", 3).with("y", 4).assertEval(is(7));
    ql(ast.call("+", X, Y))
        .with("x", 3)
        .assertEvalError(
            throwsA(QuasiException.Kind.UNBOUND_SYMBOL,
                "object 'y' not found"));
  }

  @Test
  void testNotAFunction() {
    ql(ast.call("x", lit(1)))
        .with("x", 3)
        .assertEvalError(
            throwsA(QuasiException.Kind.NOT_A_FUNCTION,
                "attempt to apply non-function"));
  }

  /** Tests that an escape marker cannot be evaluated. */
  @Test
  void testMarkerIsNotEvaluable() {
    ql(ast.call("identity", ast.unquote(X)))
        .with("x", 1)
        .assertEvalError(
            throwsA(QuasiException.Kind.SYNTAX,
                "'!!' is only allowed inside a quoting function"));
  }

  @Test
  void testList() {
    ql(ast.call("list", ImmutableList.of(ast.arg(lit(1)),
            ast.namedArg("b", lit("two")))))
        .assertEval(isNamedList("list(1, b = two)", null, "b"));
    ql(ast.call("length", ast.call("list", lit(1), lit(2), lit(3))))
        .assertEval(is(3));
    ql(ast.call("$",
            ast.call("list", ImmutableList.of(ast.namedArg("b", lit(2)))),
            ast.sym("b")))
        .assertEval(is(2));
    ql(ast.call("$", ast.sym("m"), ast.sym("k")))
        .with("m", ImmutableMap.of("k", "v"))
        .assertEval(is("v"));
  }

  /** Tests that "list" accepts splices and computed names. */
  @Test
  void testListDynamicDots() {
    final Ast.Call call =
        ast.call("list",
            ImmutableList.of(ast.arg(lit(1)),
                ast.arg(ast.unquoteSplice(ast.sym("xs"))),
                ast.arg(ast.define(ast.sym("nm"), lit(4)))));
    ql(call)
        .with("xs", NamedList.of(ImmutableList.of("a", "b"),
            ImmutableList.of(2, 3)))
        .with("nm", "c")
        .assertEval(
            isNamedList("list(1, a = 2, b = 3, c = 4)", null, "a", "b", "c"));
  }

  @Test
  void testSumMeanPaste() {
    ql(ast.call("sum", lit(1), lit(2), lit(3))).assertEval(is(6));
    ql(ast.call("sum")).assertEval(is(0));
    ql(ast.call("sum", lit(1), lit(0.5d))).assertEval(is(1.5d));
    ql(ast.call("mean", ast.call("list", lit(1), lit(2)))).assertEval(is(1.5d));
    ql(ast.call("paste", lit("a"), lit(1), lit(true)))
        .assertEval(is("a 1 TRUE"));
    ql(ast.call("paste",
            ImmutableList.of(ast.arg(lit("a")), ast.arg(lit("b")),
                ast.namedArg("sep", lit("-")))))
        .assertEval(is("a-b"));
  }

  @Test
  void testIf() {
    ql(ast.call("if", lit(true), lit(1), ast.sym("undefined")))
        .assertEval(is(1));
    ql(ast.call("if", lit(false), ast.sym("undefined"), lit(2)))
        .assertEval(is(2));
    ql(ast.call("if", lit(false), lit(1))).assertEval(nullValue());
  }

  @Test
  void testStop() {
    ql(ast.call("stop", lit("bad "), lit(42)))
        .assertEvalError(throwsA(QuasiException.Kind.ERROR, "bad 42"));
  }

  @Test
  void testSymAndCall2() {
    ql(ast.call("sym", lit("a b"))).assertEval(isAst("`a b`"));
    ql(ast.call("as_string", ast.call("quote", X))).assertEval(is("x"));
    ql(ast.call("call2",
            ImmutableList.of(ast.arg(lit("f")), ast.arg(lit(1)),
                ast.namedArg("y", ast.call("quote", X)))))
        .assertEval(isAst("f(1, y = x)"));
    ql(ast.call("syms", ast.call("list", lit("a"), lit("b"))))
        .assertEval(isNamedList("list(a, b)", null, null));
  }

  /** Tests that "eval" evaluates a quoted expression in the caller's
   * environment, or in a given environment. */
  @Test
  void testEval() {
    final Ast.Exp quoted = ast.call("quote", ast.call("+", X, lit(1)));
    ql(ast.call("eval", quoted)).with("x", 1).assertEval(is(2));
    ql(ast.call("eval", quoted,
            ast.call("list", ImmutableList.of(ast.namedArg("x", lit(10))))))
        .with("x", 1)
        .assertEval(is(11));
  }

  /** Tests that arguments are matched by name, then by position. */
  @Test
  void testClosureArgumentMatching() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"), Closure.Param.of("y"));
    final Ast.Call body = ast.call("paste", X, Y);
    ql(ast.call("f", lit("a"), lit("b")))
        .withFunction("f", params, body)
        .assertEval(is("a b"));
    ql(ast.call("f",
            ImmutableList.of(ast.namedArg("y", lit("b")), ast.arg(lit("a")))))
        .withFunction("f", params, body)
        .assertEval(is("a b"));
    ql(ast.call("f", lit("a"), lit("b"), lit("c")))
        .withFunction("f", params, body)
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "unused argument (\"c\")"));
    ql(ast.call("f",
            ImmutableList.of(ast.namedArg("x", lit("a")),
                ast.namedArg("x", lit("b")))))
        .withFunction("f", params, body)
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "formal argument \"x\" matched by multiple actual arguments"));
  }

  @Test
  void testClosureMissingArgument() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"), Closure.Param.of("y"));
    ql(ast.call("f", lit(1)))
        .withFunction("f", params, Y)
        .assertEvalError(
            throwsA(QuasiException.Kind.MISSING_ARGUMENT,
                "argument \"y\" is missing, with no default"));

    // An unused missing argument is fine
    ql(ast.call("f", lit(1)))
        .withFunction("f", params, X)
        .assertEval(is(1));

    // An empty argument counts as missing
    ql(ast.call("f", lit(1), ast.missingArg()))
        .withFunction("f", params, Y)
        .assertEvalError(
            throwsA(QuasiException.Kind.MISSING_ARGUMENT,
                "argument \"y\" is missing, with no default"));
  }

  /** Tests that a default value is evaluated in the call frame, and can
   * refer to other parameters. */
  @Test
  void testClosureDefault() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"),
            Closure.Param.of("y", ast.call("*", X, lit(2))));
    final Ast.Call body = ast.call("+", X, Y);
    ql(ast.call("f", lit(3))).withFunction("f", params, body)
        .assertEval(is(9));
    ql(ast.call("f", lit(3), lit(1))).withFunction("f", params, body)
        .assertEval(is(4));
  }

  /** Tests that arguments are lazy: an argument that is never used is never
   * evaluated. */
  @Test
  void testClosureLazy() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"), Closure.Param.of("y"));
    ql(ast.call("f", lit(1), ast.call("stop", lit("never"))))
        .withFunction("f", params, X)
        .assertEval(is(1));
  }

  /** Tests that excess arguments go to "..." and can be forwarded. */
  @Test
  void testDots() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"), Closure.Param.DOTS);
    ql(ast.call("f", lit(1), lit(2), lit(3)))
        .withFunction("f", params, ast.call("sum", ast.sym("...")))
        .assertEval(is(5));
    ql(ast.call("f",
            ImmutableList.of(ast.arg(lit(1)), ast.namedArg("a", lit(2)))))
        .withFunction("f", params, ast.call("list", ast.sym("...")))
        .assertEval(isNamedList("list(a = 2)", "a"));
    ql(ast.call("sum", ast.sym("...")))
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "'...' used in an incorrect context"));
  }

  @Test
  void testMissing() {
    final ImmutableList<Closure.Param> params =
        ImmutableList.of(Closure.Param.of("x"),
            Closure.Param.of("y", lit(2)));
    final Ast.Call body = ast.call("missing", Y);
    ql(ast.call("f", lit(1))).withFunction("f", params, body)
        .assertEval(is(true));
    ql(ast.call("f", lit(1), lit(3))).withFunction("f", params, body)
        .assertEval(is(false));
    ql(ast.call("missing", X))
        .with("x", 1)
        .assertEvalError(
            throwsA(QuasiException.Kind.BAD_ARGUMENT,
                "'missing' can only be used for arguments"));
  }

  /** Tests a function that calls itself. */
  @Test
  void testRecursion() {
    final Ast.Sym n = ast.sym("n");
    final Ast.Call body =
        ast.call("if", ast.call("<=", n, lit(1)), lit(1),
            ast.call("*", n, ast.call("fact", ast.call("-", n, lit(1)))));
    ql(ast.call("fact", lit(5)))
        .withFunction("fact", ImmutableList.of(Closure.Param.of("n")), body)
        .assertEval(is(120));
  }

  /** Tests that unbounded recursion fails cleanly. */
  @Test
  void testDepth() {
    ql(ast.call("loop"))
        .withFunction("loop", ImmutableList.of(), ast.call("loop"))
        .withProp(Prop.MAX_DEPTH, 100)
        .assertEvalError(
            throwsA(QuasiException.Kind.DEPTH, "nested too deeply"));
  }

  /** Tests that evaluations on different threads do not add to each other's
   * nesting depth. */
  @Test
  void testDepthPerThread() throws Exception {
    final CountDownLatch reached = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    // "down(n, wait)" recurses n times; at the bottom, if "wait" is true, it
    // blocks until released.
    final Applicable down = (ev, args) -> {
      final int n = (Integer) args.force(0, ev);
      final boolean wait = (Boolean) args.force(1, ev);
      if (n > 0) {
        return ev.eval(ast.call("down", lit(n - 1), lit(wait)), args.env);
      }
      if (wait) {
        reached.countDown();
        try {
          release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return n;
    };
    final Session session = Session.create();
    Prop.MAX_DEPTH.set(session.map, 20);
    final Evaluator evaluator = Evaluator.of(session);
    final Environment env = Environments.env().bind("down", down);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<Object> future =
          executor.submit(() ->
              evaluator.eval(ast.call("down", lit(15), lit(true)), env));
      assertThat(reached.await(10, TimeUnit.SECONDS), is(true));
      try {
        final Object o =
            evaluator.eval(ast.call("down", lit(15), lit(false)), env);
        assertThat(o, is(0));
      } finally {
        release.countDown();
      }
      assertThat(future.get(), is(0));
    } finally {
      executor.shutdown();
    }
  }
}

// End EvaluatorTest.java
