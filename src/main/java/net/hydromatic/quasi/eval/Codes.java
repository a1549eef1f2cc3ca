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

import static net.hydromatic.quasi.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.IntPredicate;
import java.util.function.LongBinaryOperator;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.ast.Op;
import net.hydromatic.quasi.quote.Captures;
import net.hydromatic.quasi.quote.DataMask;
import net.hydromatic.quasi.quote.QuotedClosure;
import net.hydromatic.quasi.quote.Resolver;
import net.hydromatic.quasi.quote.TidyEval;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of the built-in functions. */
public abstract class Codes {
  private Codes() {}

  // ---------------------------------------------------------------------------
  // The following section contains fields that implement built-in functions.
  // They are in alphabetical order.

  /** @see BuiltIn#AS_STRING */
  private static final Applicable AS_STRING =
      fn(BuiltIn.AS_STRING, (evaluator, args) -> {
        args.checkArity(1);
        final Object o = args.force(0, evaluator);
        if (o instanceof String) {
          return o;
        }
        if (o instanceof Ast.Sym && !((Ast.Sym) o).isMissingArg()) {
          return ((Ast.Sym) o).name;
        }
        if (o instanceof QuotedClosure && ((QuotedClosure) o).isSymbol()) {
          return ((Ast.Sym) ((QuotedClosure) o).expr).name;
        }
        throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
            "can't convert " + typeName(o) + " to a string");
      });

  /** @see BuiltIn#CALL2 */
  private static final Applicable CALL2 =
      fn(BuiltIn.CALL2, (evaluator, args) -> {
        if (args.size() == 0) {
          args.checkArity(1, Integer.MAX_VALUE);
        }
        final Object fn = args.force(0, evaluator);
        final Ast.Exp head;
        if (fn instanceof String) {
          head = ast.sym((String) fn);
        } else if (fn instanceof Ast.Exp || fn instanceof Applicable) {
          head = ast.fromValue(fn);
        } else {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "'.fn' must be a string, a symbol, a call, or a function");
        }
        final NamedList values =
            dynamicDots(evaluator, args.actuals.subList(1, args.size()));
        final List<Ast.Arg> callArgs = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
          callArgs.add(ast.arg(values.name(i), ast.fromValue(values.get(i))));
        }
        return ast.call(head, callArgs);
      });

  /** @see BuiltIn#DIVIDE */
  private static final Applicable DIVIDE =
      arithmetic(BuiltIn.DIVIDE, null, (x, y) -> x / y);

  /** @see BuiltIn#DOLLAR */
  private static final Applicable DOLLAR =
      fn(BuiltIn.DOLLAR, (evaluator, args) -> {
        args.checkArity(2);
        final Ast.Exp nameExp = args.get(1).promise.expr;
        final String name;
        if (nameExp instanceof Ast.Sym && !nameExp.isMissingArg()) {
          name = ((Ast.Sym) nameExp).name;
        } else if (nameExp.op == Op.STRING_LITERAL) {
          name = (String) ((Ast.Literal) nameExp).value;
        } else {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "invalid subscript type: " + nameExp);
        }
        final Object o = args.force(0, evaluator);
        if (o instanceof DataMask.Pronoun) {
          return ((DataMask.Pronoun) o).get(name, evaluator);
        }
        if (o instanceof NamedList) {
          final NamedList list = (NamedList) o;
          final int i = list.indexOf(name);
          return i < 0 ? null : list.get(i);
        }
        if (o instanceof Map) {
          return ((Map<?, ?>) o).get(name);
        }
        throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
            "$ operator is invalid for " + typeName(o));
      });

  /** @see BuiltIn#ENEXPR */
  private static final Applicable ENEXPR =
      fn(BuiltIn.ENEXPR, (evaluator, args) -> {
        final QuotedClosure q = capture(args, BuiltIn.ENEXPR);
        return Resolver.resolve(evaluator, q.expr, q.env);
      });

  /** @see BuiltIn#ENEXPRS */
  private static final Applicable ENEXPRS =
      fn(BuiltIn.ENEXPRS, (evaluator, args) ->
          Captures.toExprs(
              Captures.resolve(evaluator,
                  captureAll(args, BuiltIn.ENEXPRS))));

  /** @see BuiltIn#ENQUO */
  private static final Applicable ENQUO =
      fn(BuiltIn.ENQUO, (evaluator, args) -> {
        final QuotedClosure q = capture(args, BuiltIn.ENQUO);
        final Ast.Exp resolved = Resolver.resolve(evaluator, q.expr, q.env);
        return new Captures.Captured(null, resolved, q.env).toClosure();
      });

  /** @see BuiltIn#ENQUOS */
  private static final Applicable ENQUOS =
      fn(BuiltIn.ENQUOS, (evaluator, args) ->
          Captures.toQuos(
              Captures.resolve(evaluator,
                  captureAll(args, BuiltIn.ENQUOS))));

  /** @see BuiltIn#EQ */
  private static final Applicable EQ = comparison(BuiltIn.EQ, c -> c == 0);

  /** @see BuiltIn#EVAL */
  private static final Applicable EVAL =
      fn(BuiltIn.EVAL, (evaluator, args) -> {
        args.checkArity(1, 2);
        final Object o = args.force(0, evaluator);
        final Environment env = args.size() > 1
            ? toEnvironment(args.force(1, evaluator), args.env)
            : args.env;
        if (o instanceof QuotedClosure) {
          return evaluator.eval(ast.quoted((QuotedClosure) o), env);
        }
        if (o instanceof Ast.Exp) {
          return evaluator.eval((Ast.Exp) o, env);
        }
        return o;
      });

  /** @see BuiltIn#EVAL_TIDY */
  private static final Applicable EVAL_TIDY =
      fn(BuiltIn.EVAL_TIDY, (evaluator, args) -> {
        args.checkArity(1, 3);
        final Object o = args.force(0, evaluator);
        final Args.Actual dataArg = optionalArg(args, 1, "data");
        final Args.Actual envArg = optionalArg(args, 2, "env");
        final Environment env = envArg == null
            ? args.env
            : toEnvironment(evaluator.valueOf(envArg.promise), args.env);
        final Object data =
            dataArg == null ? null : evaluator.valueOf(dataArg.promise);
        final QuotedClosure closure;
        if (o instanceof QuotedClosure) {
          closure = (QuotedClosure) o;
        } else if (o instanceof Ast.Exp) {
          closure = QuotedClosure.of((Ast.Exp) o, env);
        } else {
          return o;
        }
        return TidyEval.evalTidy(evaluator, closure, toDataMask(data));
      });

  /** @see BuiltIn#EXPR */
  private static final Applicable EXPR =
      fn(BuiltIn.EXPR, (evaluator, args) -> {
        args.checkArity(1);
        final Promise promise = args.get(0).promise;
        return Resolver.resolve(evaluator, promise.expr, promise.env);
      });

  /** @see BuiltIn#EXPRS */
  private static final Applicable EXPRS =
      fn(BuiltIn.EXPRS, (evaluator, args) ->
          Captures.toExprs(Captures.resolve(evaluator, captured(args))));

  /** @see BuiltIn#GE */
  private static final Applicable GE = comparison(BuiltIn.GE, c -> c >= 0);

  /** @see BuiltIn#GT */
  private static final Applicable GT = comparison(BuiltIn.GT, c -> c > 0);

  /** @see BuiltIn#IDENTITY */
  private static final Applicable IDENTITY =
      fn(BuiltIn.IDENTITY, (evaluator, args) ->
          args.checkArity(1).force(0, evaluator));

  /** @see BuiltIn#IF */
  private static final Applicable IF =
      fn(BuiltIn.IF, (evaluator, args) -> {
        args.checkArity(2, 3);
        final Object condition = args.force(0, evaluator);
        if (!(condition instanceof Boolean)) {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "argument is not interpretable as logical: " + condition);
        }
        if ((Boolean) condition) {
          return args.force(1, evaluator);
        }
        return args.size() > 2 ? args.force(2, evaluator) : null;
      });

  /** @see BuiltIn#LE */
  private static final Applicable LE = comparison(BuiltIn.LE, c -> c <= 0);

  /** @see BuiltIn#LENGTH */
  private static final Applicable LENGTH =
      fn(BuiltIn.LENGTH, (evaluator, args) -> {
        final Object o = args.checkArity(1).force(0, evaluator);
        if (o == null) {
          return 0;
        } else if (o instanceof List) {
          return ((List<?>) o).size();
        } else if (o instanceof Map) {
          return ((Map<?, ?>) o).size();
        } else if (o instanceof Ast.Call) {
          return 1 + ((Ast.Call) o).args.size();
        } else {
          return 1;
        }
      });

  /** @see BuiltIn#LIST */
  private static final Applicable LIST =
      fn(BuiltIn.LIST, (evaluator, args) ->
          dynamicDots(evaluator, args.actuals));

  /** @see BuiltIn#LT */
  private static final Applicable LT = comparison(BuiltIn.LT, c -> c < 0);

  /** @see BuiltIn#MEAN */
  private static final Applicable MEAN =
      fn(BuiltIn.MEAN, (evaluator, args) -> {
        final List<Number> numbers = numbers(BuiltIn.MEAN, evaluator, args);
        if (numbers.isEmpty()) {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "mean of no values");
        }
        double sum = 0d;
        for (Number number : numbers) {
          sum += number.doubleValue();
        }
        return sum / numbers.size();
      });

  /** @see BuiltIn#MINUS */
  private static final Applicable MINUS =
      fn(BuiltIn.MINUS, (evaluator, args) -> {
        args.checkArity(1, 2);
        if (args.size() == 1) {
          return arithmetic(BuiltIn.MINUS, 0, args.force(0, evaluator),
              Math::subtractExact, (x, y) -> x - y);
        }
        return arithmetic(BuiltIn.MINUS, args.force(0, evaluator),
            args.force(1, evaluator), Math::subtractExact, (x, y) -> x - y);
      });

  /** @see BuiltIn#MISSING */
  private static final Applicable MISSING =
      fn(BuiltIn.MISSING, (evaluator, args) -> {
        args.checkArity(1);
        final Ast.Exp exp = args.get(0).promise.expr;
        if (!(exp instanceof Ast.Sym) || exp.isMissingArg()) {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "'missing' can only be used for arguments");
        }
        return isMissing(((Ast.Sym) exp).name, args.env);
      });

  /** @see BuiltIn#NAMES */
  private static final Applicable NAMES =
      fn(BuiltIn.NAMES, (evaluator, args) -> {
        final Object o = args.checkArity(1).force(0, evaluator);
        if (o instanceof NamedList && ((NamedList) o).hasNames()) {
          final List<String> names = new ArrayList<>();
          for (String name : ((NamedList) o).names()) {
            names.add(name == null ? "" : name);
          }
          return NamedList.copyOf(names);
        }
        if (o instanceof Map) {
          final List<String> names = new ArrayList<>();
          ((Map<?, ?>) o).keySet().forEach(k -> names.add(String.valueOf(k)));
          return NamedList.copyOf(names);
        }
        return null;
      });

  /** @see BuiltIn#NE */
  private static final Applicable NE = comparison(BuiltIn.NE, c -> c != 0);

  /** @see BuiltIn#NEW_QUOSURE */
  private static final Applicable NEW_QUOSURE =
      fn(BuiltIn.NEW_QUOSURE, (evaluator, args) -> {
        args.checkArity(1, 2);
        final Object o = args.force(0, evaluator);
        final Environment env = args.size() > 1
            ? toEnvironment(args.force(1, evaluator), args.env)
            : args.env;
        return QuotedClosure.of(ast.fromValue(o), env);
      });

  /** @see BuiltIn#NOT */
  private static final Applicable NOT =
      fn(BuiltIn.NOT, (evaluator, args) -> {
        final Object o = args.checkArity(1).force(0, evaluator);
        if (!(o instanceof Boolean)) {
          throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
              "invalid argument type: " + typeName(o));
        }
        return !(Boolean) o;
      });

  /** @see BuiltIn#PASTE */
  private static final Applicable PASTE =
      fn(BuiltIn.PASTE, (evaluator, args) -> {
        String sep = " ";
        final List<String> strings = new ArrayList<>();
        for (Args.Actual actual : args.actuals) {
          final Object o = evaluator.valueOf(actual.promise);
          if ("sep".equals(actual.name)) {
            sep = asString(o);
          } else if (o instanceof List) {
            ((List<?>) o).forEach(e -> strings.add(asString(e)));
          } else {
            strings.add(asString(o));
          }
        }
        return String.join(sep, strings);
      });

  /** @see BuiltIn#PLUS */
  private static final Applicable PLUS =
      arithmetic(BuiltIn.PLUS, Math::addExact, Double::sum);

  /** @see BuiltIn#QUO */
  private static final Applicable QUO =
      fn(BuiltIn.QUO, (evaluator, args) -> {
        args.checkArity(1);
        final Promise promise = args.get(0).promise;
        final Ast.Exp resolved =
            Resolver.resolve(evaluator, promise.expr, promise.env);
        return new Captures.Captured(null, resolved, promise.env).toClosure();
      });

  /** @see BuiltIn#QUO_GET_ENV */
  private static final Applicable QUO_GET_ENV =
      fn(BuiltIn.QUO_GET_ENV, (evaluator, args) ->
          quosure(BuiltIn.QUO_GET_ENV, args.checkArity(1).force(0, evaluator))
              .env);

  /** @see BuiltIn#QUO_GET_EXPR */
  private static final Applicable QUO_GET_EXPR =
      fn(BuiltIn.QUO_GET_EXPR, (evaluator, args) ->
          quosure(BuiltIn.QUO_GET_EXPR, args.checkArity(1).force(0, evaluator))
              .expr);

  /** @see BuiltIn#QUO_SQUASH */
  private static final Applicable QUO_SQUASH =
      fn(BuiltIn.QUO_SQUASH, (evaluator, args) -> {
        final Object o = args.checkArity(1).force(0, evaluator);
        if (o instanceof Ast.Exp) {
          return QuotedClosure.squash((Ast.Exp) o);
        }
        return quosure(BuiltIn.QUO_SQUASH, o).squash();
      });

  /** @see BuiltIn#QUOS */
  private static final Applicable QUOS =
      fn(BuiltIn.QUOS, (evaluator, args) ->
          Captures.toQuos(Captures.resolve(evaluator, captured(args))));

  /** @see BuiltIn#QUOTE */
  private static final Applicable QUOTE =
      fn(BuiltIn.QUOTE, (evaluator, args) ->
          args.checkArity(1).get(0).promise.expr);

  /** @see BuiltIn#STOP */
  private static final Applicable STOP =
      fn(BuiltIn.STOP, (evaluator, args) -> {
        final StringBuilder b = new StringBuilder();
        for (Object o : args.forceAll(evaluator)) {
          b.append(asString(o));
        }
        throw new QuasiException(QuasiException.Kind.ERROR, b.toString());
      });

  /** @see BuiltIn#SUM */
  private static final Applicable SUM =
      fn(BuiltIn.SUM, (evaluator, args) -> {
        final List<Number> numbers = numbers(BuiltIn.SUM, evaluator, args);
        boolean integral = true;
        boolean ints = true;
        for (Number number : numbers) {
          integral &= isIntegral(number);
          ints &= number instanceof Integer;
        }
        if (integral) {
          long sum = 0L;
          for (Number number : numbers) {
            sum = Math.addExact(sum, number.longValue());
          }
          return narrow(sum, ints);
        }
        double sum = 0d;
        for (Number number : numbers) {
          sum += number.doubleValue();
        }
        return sum;
      });

  /** @see BuiltIn#SYM */
  private static final Applicable SYM =
      fn(BuiltIn.SYM, (evaluator, args) ->
          toSym(args.checkArity(1).force(0, evaluator)));

  /** @see BuiltIn#SYMS */
  private static final Applicable SYMS =
      fn(BuiltIn.SYMS, (evaluator, args) -> {
        final NamedList values = dynamicDots(evaluator, args.actuals);
        final List<@Nullable String> names = new ArrayList<>();
        final List<@Nullable Object> syms = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
          final Object o = values.get(i);
          if (o instanceof NamedList) {
            final NamedList list = (NamedList) o;
            for (int j = 0; j < list.size(); j++) {
              names.add(list.name(j));
              syms.add(toSym(list.get(j)));
            }
          } else if (o instanceof List) {
            for (Object e : (List<?>) o) {
              names.add(null);
              syms.add(toSym(e));
            }
          } else {
            names.add(values.name(i));
            syms.add(toSym(o));
          }
        }
        return NamedList.of(names, syms);
      });

  /** @see BuiltIn#TIMES */
  private static final Applicable TIMES =
      arithmetic(BuiltIn.TIMES, Math::multiplyExact, (x, y) -> x * y);

  /** Map of all built-in functions. */
  public static final ImmutableMap<BuiltIn, Applicable> BUILT_IN_VALUES =
      ImmutableMap.<BuiltIn, Applicable>builder()
          .put(BuiltIn.AS_STRING, AS_STRING)
          .put(BuiltIn.CALL2, CALL2)
          .put(BuiltIn.DIVIDE, DIVIDE)
          .put(BuiltIn.DOLLAR, DOLLAR)
          .put(BuiltIn.ENEXPR, ENEXPR)
          .put(BuiltIn.ENEXPRS, ENEXPRS)
          .put(BuiltIn.ENQUO, ENQUO)
          .put(BuiltIn.ENQUOS, ENQUOS)
          .put(BuiltIn.EQ, EQ)
          .put(BuiltIn.EVAL, EVAL)
          .put(BuiltIn.EVAL_TIDY, EVAL_TIDY)
          .put(BuiltIn.EXPR, EXPR)
          .put(BuiltIn.EXPRS, EXPRS)
          .put(BuiltIn.GE, GE)
          .put(BuiltIn.GT, GT)
          .put(BuiltIn.IDENTITY, IDENTITY)
          .put(BuiltIn.IF, IF)
          .put(BuiltIn.LE, LE)
          .put(BuiltIn.LENGTH, LENGTH)
          .put(BuiltIn.LIST, LIST)
          .put(BuiltIn.LT, LT)
          .put(BuiltIn.MEAN, MEAN)
          .put(BuiltIn.MINUS, MINUS)
          .put(BuiltIn.MISSING, MISSING)
          .put(BuiltIn.NAMES, NAMES)
          .put(BuiltIn.NE, NE)
          .put(BuiltIn.NEW_QUOSURE, NEW_QUOSURE)
          .put(BuiltIn.NOT, NOT)
          .put(BuiltIn.PASTE, PASTE)
          .put(BuiltIn.PLUS, PLUS)
          .put(BuiltIn.QUO, QUO)
          .put(BuiltIn.QUO_GET_ENV, QUO_GET_ENV)
          .put(BuiltIn.QUO_GET_EXPR, QUO_GET_EXPR)
          .put(BuiltIn.QUO_SQUASH, QUO_SQUASH)
          .put(BuiltIn.QUOS, QUOS)
          .put(BuiltIn.QUOTE, QUOTE)
          .put(BuiltIn.STOP, STOP)
          .put(BuiltIn.SUM, SUM)
          .put(BuiltIn.SYM, SYM)
          .put(BuiltIn.SYMS, SYMS)
          .put(BuiltIn.TIMES, TIMES)
          .build();

  static {
    for (BuiltIn builtIn : BuiltIn.values()) {
      if (!BUILT_IN_VALUES.containsKey(builtIn)) {
        throw new AssertionError("no implementation for " + builtIn);
      }
    }
  }

  // ---------------------------------------------------------------------------
  // Helpers.

  private static Applicable fn(BuiltIn builtIn, Applicable impl) {
    return new BuiltInFunction(builtIn, impl);
  }

  private static Applicable arithmetic(BuiltIn builtIn,
      @Nullable LongBinaryOperator longOp, DoubleBinaryOperator doubleOp) {
    return fn(builtIn, (evaluator, args) -> {
      args.checkArity(2);
      return arithmetic(builtIn, args.force(0, evaluator),
          args.force(1, evaluator), longOp, doubleOp);
    });
  }

  /** Applies an arithmetic operator. If both operands are integral and
   * {@code longOp} is not null the result is integral, and is an
   * {@link Integer} if both operands are and the result fits. */
  private static Number arithmetic(BuiltIn builtIn, @Nullable Object a,
      @Nullable Object b, @Nullable LongBinaryOperator longOp,
      DoubleBinaryOperator doubleOp) {
    final Number x = number(builtIn, a);
    final Number y = number(builtIn, b);
    if (longOp != null && isIntegral(x) && isIntegral(y)) {
      final long r = longOp.applyAsLong(x.longValue(), y.longValue());
      return narrow(r, x instanceof Integer && y instanceof Integer);
    }
    return doubleOp.applyAsDouble(x.doubleValue(), y.doubleValue());
  }

  private static Number number(BuiltIn builtIn, @Nullable Object o) {
    if (o instanceof Number) {
      return (Number) o;
    }
    throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
        "non-numeric argument to '" + builtIn.name + "': " + typeName(o));
  }

  private static boolean isIntegral(Number number) {
    return number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte;
  }

  private static Number narrow(long value, boolean ints) {
    return ints && value == (int) value ? (Number) (int) value : value;
  }

  /** Returns the numeric arguments of a call. Arguments that are lists
   * contribute their elements. */
  private static List<Number> numbers(BuiltIn builtIn, Evaluator evaluator,
      Args args) {
    final List<Number> numbers = new ArrayList<>();
    for (Object o : args.forceAll(evaluator)) {
      if (o instanceof List) {
        for (Object e : (List<?>) o) {
          numbers.add(number(builtIn, e));
        }
      } else {
        numbers.add(number(builtIn, o));
      }
    }
    return numbers;
  }

  private static Applicable comparison(BuiltIn builtIn, IntPredicate test) {
    return fn(builtIn, (evaluator, args) -> {
      args.checkArity(2);
      final Object a = args.force(0, evaluator);
      final Object b = args.force(1, evaluator);
      if (a instanceof Number && b instanceof Number) {
        final Number x = (Number) a;
        final Number y = (Number) b;
        if (isIntegral(x) && isIntegral(y)) {
          return test.test(Long.compare(x.longValue(), y.longValue()));
        }
        final double dx = x.doubleValue();
        final double dy = y.doubleValue();
        if (Double.isNaN(dx) || Double.isNaN(dy)) {
          // NaN is unordered; only "!=" holds.
          return builtIn == BuiltIn.NE;
        }
        return test.test(dx < dy ? -1 : dx > dy ? 1 : 0);
      }
      if (a instanceof String && b instanceof String) {
        return test.test(((String) a).compareTo((String) b));
      }
      if (builtIn == BuiltIn.EQ) {
        return Objects.equals(a, b);
      }
      if (builtIn == BuiltIn.NE) {
        return !Objects.equals(a, b);
      }
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "comparison (" + builtIn.name
              + ") is possible only for numbers and strings");
    });
  }

  /**
   * Evaluates arguments that may contain "!!!" and ":=" at the top level.
   * Each element of a spliced value becomes an element of the result; ":="
   * gives an element a computed name.
   */
  static NamedList dynamicDots(Evaluator evaluator, List<Args.Actual> actuals) {
    final List<@Nullable String> names = new ArrayList<>();
    final List<@Nullable Object> values = new ArrayList<>();
    for (Args.Actual actual : actuals) {
      final Ast.Exp exp = actual.promise.expr;
      final Environment env = actual.promise.env;
      if (exp instanceof Ast.UnquoteSplice) {
        if (actual.name != null) {
          throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
              "can't splice into a named argument: " + actual);
        }
        final Object value =
            evaluator.eval(((Ast.UnquoteSplice) exp).operand, env);
        Resolver.forEachSpliced(value, (name, element) -> {
          names.add(name);
          values.add(element);
        });
      } else if (exp instanceof Ast.Define) {
        final Ast.Define define = (Ast.Define) exp;
        names.add(Resolver.defineName(evaluator, define, env));
        values.add(evaluator.eval(define.rhs, env));
      } else {
        names.add(actual.name);
        values.add(evaluator.valueOf(actual.promise));
      }
    }
    return NamedList.of(names, values);
  }

  /** Returns whether the caller did not supply a parameter, or supplied a
   * parameter of its own that its caller did not supply. */
  private static boolean isMissing(String name, Environment env) {
    final Frame frame = Frame.of(env);
    if (frame == null || name.equals(Frame.DOTS) || !frame.fn.hasParam(name)) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'missing' can only be used for arguments");
    }
    if (frame.isUnsupplied(name)) {
      return true;
    }
    final Binding binding = frame.env.getLocalOpt(name);
    if (binding != null && binding.value instanceof Promise) {
      final Promise promise = (Promise) binding.value;
      if (promise.expr instanceof Ast.Sym) {
        final String name2 = ((Ast.Sym) promise.expr).name;
        final Frame frame2 = Frame.of(promise.env);
        if (frame2 != null
            && !name2.equals(Frame.DOTS)
            && frame2.fn.hasParam(name2)) {
          return isMissing(name2, promise.env);
        }
      }
    }
    return false;
  }

  /** Returns the closure captured for the single argument of "enexpr" or
   * "enquo", which must be a parameter of the enclosing function. */
  private static QuotedClosure capture(Args args, BuiltIn builtIn) {
    args.checkArity(1);
    final Ast.Exp exp = args.get(0).promise.expr;
    if (!(exp instanceof Ast.Sym)
        || exp.isMissingArg()
        || ((Ast.Sym) exp).name.equals(Frame.DOTS)) {
      throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
          "'" + builtIn.name + "' requires a symbol that refers to a "
              + "parameter: " + exp);
    }
    final Frame frame = Captures.frame(args.env, builtIn.name);
    return Captures.captureScoped(frame, ((Ast.Sym) exp).name);
  }

  /** Returns the arguments captured for "enexprs" or "enquos". Each argument
   * must be a parameter of the enclosing function, or "...". */
  private static List<Captures.Captured> captureAll(Args args,
      BuiltIn builtIn) {
    final Frame frame = Captures.frame(args.env, builtIn.name);
    final List<Captures.Captured> list = new ArrayList<>();
    for (Ast.Arg arg : args.call.args) {
      if (!(arg.value instanceof Ast.Sym) || arg.value.isMissingArg()) {
        throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
            "'" + builtIn.name + "' requires symbols that refer to "
                + "parameters: " + arg);
      }
      final String name = ((Ast.Sym) arg.value).name;
      if (name.equals(Frame.DOTS)) {
        for (Args.Actual actual : frame.dots) {
          list.add(Captures.Captured.of(actual));
        }
      } else {
        final QuotedClosure q = Captures.captureScoped(frame, name);
        list.add(new Captures.Captured(arg.name, q.expr, q.env));
      }
    }
    return list;
  }

  /** Returns the arguments of "exprs" or "quos". */
  private static List<Captures.Captured> captured(Args args) {
    final ImmutableList.Builder<Captures.Captured> list =
        ImmutableList.builder();
    for (Args.Actual actual : args.actuals) {
      list.add(Captures.Captured.of(actual));
    }
    return list.build();
  }

  /** Returns the argument with a given name, or else the {@code i}th
   * argument if it is unnamed; null if there is neither. */
  private static Args.@Nullable Actual optionalArg(Args args, int i,
      String name) {
    final int j = args.indexOf(name);
    if (j >= 0) {
      return args.get(j);
    }
    if (i < args.size() && args.get(i).name == null) {
      return args.get(i);
    }
    return null;
  }

  private static QuotedClosure quosure(BuiltIn builtIn, @Nullable Object o) {
    if (o instanceof QuotedClosure) {
      return (QuotedClosure) o;
    }
    throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
        "'" + builtIn.name + "' requires a quosure, got " + typeName(o));
  }

  private static Ast.Sym toSym(@Nullable Object o) {
    if (o instanceof String) {
      return ast.sym((String) o);
    }
    if (o instanceof Ast.Sym) {
      return (Ast.Sym) o;
    }
    throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
        "can't convert " + typeName(o) + " to a symbol");
  }

  private static Environment toEnvironment(@Nullable Object o,
      Environment env) {
    if (o instanceof Environment) {
      return (Environment) o;
    }
    if (o instanceof NamedList) {
      final NamedList list = (NamedList) o;
      final Map<String, @Nullable Object> map = new LinkedHashMap<>();
      for (int i = 0; i < list.size(); i++) {
        final String name = list.name(i);
        if (name != null) {
          map.put(name, list.get(i));
        }
      }
      return env.bindAll(map);
    }
    if (o instanceof Map) {
      final Map<String, @Nullable Object> map = new LinkedHashMap<>();
      ((Map<?, ?>) o).forEach((k, v) -> map.put(String.valueOf(k), v));
      return env.bindAll(map);
    }
    throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
        "invalid environment: " + typeName(o));
  }

  private static @Nullable DataMask toDataMask(@Nullable Object o) {
    if (o == null) {
      return null;
    }
    if (o instanceof DataMask) {
      return (DataMask) o;
    }
    if (o instanceof NamedList) {
      return DataMask.of((NamedList) o);
    }
    if (o instanceof Environment) {
      return DataMask.of((Environment) o);
    }
    if (o instanceof Map) {
      final Map<String, @Nullable Object> map = new LinkedHashMap<>();
      ((Map<?, ?>) o).forEach((k, v) -> map.put(String.valueOf(k), v));
      return DataMask.of(map);
    }
    throw new QuasiException(QuasiException.Kind.BAD_ARGUMENT,
        "'data' must be a list, a map or an environment, got "
            + typeName(o));
  }

  /** Converts a value to a string, the way "paste" does. */
  static String asString(@Nullable Object o) {
    if (o == null) {
      return "NULL";
    }
    if (o instanceof Boolean) {
      return (Boolean) o ? "TRUE" : "FALSE";
    }
    if (o instanceof Double) {
      final double d = (Double) o;
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Long.toString((long) d);
      }
    }
    return o.toString();
  }

  private static String typeName(@Nullable Object o) {
    return o == null ? "NULL" : o.getClass().getSimpleName();
  }

  /** Built-in function. */
  private static class BuiltInFunction implements Applicable {
    private final BuiltIn builtIn;
    private final Applicable impl;

    BuiltInFunction(BuiltIn builtIn, Applicable impl) {
      this.builtIn = builtIn;
      this.impl = impl;
    }

    @Override
    public String toString() {
      return "<built-in " + builtIn.name + ">";
    }

    @Override
    public @Nullable Object apply(Evaluator evaluator, Args args) {
      return impl.apply(evaluator, args);
    }
  }
}

// End Codes.java
