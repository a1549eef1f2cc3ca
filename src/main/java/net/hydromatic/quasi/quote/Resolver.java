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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quasi.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.ast.Shuttle;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.NamedList;
import net.hydromatic.quasi.eval.Prop;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves the escape markers in an expression tree.
 *
 * <p>Performs one depth-first, post-order rewrite. The operand of each marker
 * is evaluated in the ambient environment, the environment where the quoting
 * occurred, which is passed explicitly and is the same throughout the walk.
 * Nothing outside a marker's operand is evaluated.
 *
 * <ul>
 *   <li>{@code !!x} is replaced by the value of {@code x}, converted to an
 *       expression by {@link net.hydromatic.quasi.ast.AstBuilder#fromValue};
 *   <li>{@code !!!xs}, as an argument, is replaced by one argument per
 *       element of {@code xs}; elements are not flattened further;
 *   <li>{@code nm := v}, as an argument, becomes an argument whose name is
 *       the value of {@code nm} and whose value is {@code v}, resolved.
 * </ul>
 *
 * <p>Values that are substituted are not themselves resolved, so a tree may
 * contain markers after resolution only if a substituted value did.
 */
public class Resolver extends Shuttle {
  private final Evaluator evaluator;
  private final Environment env;
  private final int maxDepth;
  private int depth;

  private Resolver(Evaluator evaluator, Environment env) {
    this.evaluator = requireNonNull(evaluator);
    this.env = requireNonNull(env);
    this.maxDepth = Prop.MAX_DEPTH.intValue(evaluator.session.map);
  }

  /** Resolves the markers in an expression. */
  public static Ast.Exp resolve(Evaluator evaluator, Ast.Exp exp,
      Environment env) {
    if (exp instanceof Ast.UnquoteSplice) {
      throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
          "can't use '!!!' at top level: " + exp);
    }
    if (exp instanceof Ast.Define) {
      throw new QuasiException(QuasiException.Kind.SYNTAX,
          "':=' can only be used within a call's arguments: " + exp);
    }
    final Ast.Exp resolved = exp.accept(new Resolver(evaluator, env));
    evaluator.session.tracer.onResolve(exp, resolved);
    return resolved;
  }

  /** Resolves the markers in a list of arguments. Splices and defines may
   * occur at the top level. */
  public static List<Ast.Arg> resolveArgs(Evaluator evaluator,
      List<Ast.Arg> args, Environment env) {
    return new Resolver(evaluator, env).visitArgs(args);
  }

  @Override
  protected Ast.Exp visit(Ast.Call call) {
    if (call.head instanceof Ast.UnquoteSplice) {
      throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
          "can't splice into the function position of a call: " + call);
    }
    if (call.head instanceof Ast.Define) {
      throw new QuasiException(QuasiException.Kind.SYNTAX,
          "':=' can't be the function of a call: " + call);
    }
    if (++depth > maxDepth) {
      throw new QuasiException(QuasiException.Kind.DEPTH,
          "expression nested too deeply to resolve");
    }
    try {
      return super.visit(call);
    } finally {
      --depth;
    }
  }

  @Override
  protected List<Ast.Arg> visitArgs(List<Ast.Arg> args) {
    final ImmutableList.Builder<Ast.Arg> list = ImmutableList.builder();
    for (Ast.Arg arg : args) {
      if (arg.value instanceof Ast.UnquoteSplice) {
        final Ast.UnquoteSplice splice = (Ast.UnquoteSplice) arg.value;
        if (arg.name != null) {
          throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
              "can't splice into a named argument: " + arg);
        }
        final Object value = evaluator.eval(splice.operand, env);
        final ImmutableList.Builder<Ast.Arg> spliced = ImmutableList.builder();
        forEachSpliced(value, (name, element) ->
            spliced.add(ast.arg(name, ast.fromValue(element))));
        final ImmutableList<Ast.Arg> splicedArgs = spliced.build();
        evaluator.session.tracer.onSplice(splice, splicedArgs);
        list.addAll(splicedArgs);
      } else if (arg.value instanceof Ast.Define) {
        final Ast.Define define = (Ast.Define) arg.value;
        if (arg.name != null) {
          throw new QuasiException(QuasiException.Kind.SYNTAX,
              "':=' can't be used in a named argument: " + arg);
        }
        final String name = defineName(evaluator, define, env);
        list.add(ast.arg(name, define.rhs.accept(this)));
      } else {
        list.add(arg.accept(this));
      }
    }
    return list.build();
  }

  @Override
  protected Ast.Exp visit(Ast.Unquote unquote) {
    final Object value = evaluator.eval(unquote.operand, env);
    final Ast.Exp exp = ast.fromValue(value);
    evaluator.session.tracer.onSubstitute(unquote, exp);
    return exp;
  }

  @Override
  protected Ast.Exp visit(Ast.UnquoteSplice unquoteSplice) {
    throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
        "'!!!' can only be used within a call's arguments: " + unquoteSplice);
  }

  @Override
  protected Ast.Exp visit(Ast.Define define) {
    throw new QuasiException(QuasiException.Kind.SYNTAX,
        "':=' can only be used within a call's arguments: " + define);
  }

  /**
   * Calls a consumer for each element of a value that is being spliced,
   * with the element's name (or null) and value.
   *
   * <p>A {@link NamedList} supplies its names, a {@link Map} its keys, and an
   * {@link Ast.Arg} element of a list its name and value. Null is an empty
   * sequence.
   *
   * @throws QuasiException of kind {@code SPLICE_CONTEXT} if the value is not
   *     a sequence
   */
  public static void forEachSpliced(@Nullable Object value,
      BiConsumer<@Nullable String, @Nullable Object> consumer) {
    if (value == null) {
      return;
    }
    if (value instanceof NamedList) {
      final NamedList list = (NamedList) value;
      for (int i = 0; i < list.size(); i++) {
        consumer.accept(list.name(i), list.get(i));
      }
    } else if (value instanceof List) {
      for (Object element : (List<?>) value) {
        if (element instanceof Ast.Arg) {
          final Ast.Arg arg = (Ast.Arg) element;
          consumer.accept(arg.name, arg.value);
        } else {
          consumer.accept(null, element);
        }
      }
    } else if (value instanceof Map) {
      ((Map<?, ?>) value).forEach((k, v) ->
          consumer.accept(String.valueOf(k), v));
    } else {
      throw new QuasiException(QuasiException.Kind.SPLICE_CONTEXT,
          "can't splice an object of type "
              + value.getClass().getSimpleName() + ": " + value);
    }
  }

  /**
   * Evaluates the left-hand side of a define marker to get the name of an
   * argument.
   *
   * <p>If the left-hand side is an unquote, as in {@code !!nm := v}, its
   * operand is evaluated; otherwise the left-hand side itself is evaluated.
   * The result must be a string or a symbol.
   *
   * @throws QuasiException of kind {@code DEFINE_NAME} if the value is
   *     neither a string nor a symbol
   */
  public static String defineName(Evaluator evaluator, Ast.Define define,
      Environment env) {
    final Ast.Exp lhs = define.lhs instanceof Ast.Unquote
        ? ((Ast.Unquote) define.lhs).operand
        : define.lhs;
    final Object value = evaluator.eval(lhs, env);
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof Ast.Sym && !((Ast.Sym) value).isMissingArg()) {
      return ((Ast.Sym) value).name;
    }
    throw new QuasiException(QuasiException.Kind.DEFINE_NAME,
        "the left-hand side of ':=' must be a string or a symbol, got "
            + value);
  }
}

// End Resolver.java
