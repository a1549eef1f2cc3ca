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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.quote.DataMask;
import net.hydromatic.quasi.quote.QuotedClosure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line for each event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action when a promise is forced,
   * then calls the underlying tracer.
   */
  public static Tracer withOnForce(Tracer tracer,
      Consumer<Promise> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onForce(Promise promise) {
        consumer.accept(promise);
        super.onForce(promise);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when an unquote marker is
   * substituted, then calls the underlying tracer.
   */
  public static Tracer withOnSubstitute(Tracer tracer,
      BiConsumer<Ast.Unquote, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSubstitute(Ast.Unquote unquote, Ast.Exp exp) {
        consumer.accept(unquote, exp);
        super.onSubstitute(unquote, exp);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a splice marker is
   * expanded, then calls the underlying tracer.
   */
  public static Tracer withOnSplice(Tracer tracer,
      BiConsumer<Ast.UnquoteSplice, List<Ast.Arg>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSplice(Ast.UnquoteSplice splice,
          List<Ast.Arg> args) {
        consumer.accept(splice, args);
        super.onSplice(splice, args);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a tree has been
   * resolved, then calls the underlying tracer.
   */
  public static Tracer withOnResolve(Tracer tracer,
      BiConsumer<Ast.Exp, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResolve(Ast.Exp exp, Ast.Exp resolved) {
        consumer.accept(exp, resolved);
        super.onResolve(exp, resolved);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a quoted closure is
   * evaluated, then calls the underlying tracer.
   */
  public static Tracer withOnEvalTidy(Tracer tracer,
      BiConsumer<QuotedClosure, @Nullable DataMask> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEvalTidy(QuotedClosure closure,
          @Nullable DataMask mask) {
        consumer.accept(closure, mask);
        super.onEvalTidy(closure, mask);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onForce(Promise promise) {
    }

    @Override public void onSubstitute(Ast.Unquote unquote, Ast.Exp exp) {
    }

    @Override public void onSplice(Ast.UnquoteSplice splice,
        List<Ast.Arg> args) {
    }

    @Override public void onResolve(Ast.Exp exp, Ast.Exp resolved) {
    }

    @Override public void onEvalTidy(QuotedClosure closure,
        @Nullable DataMask mask) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onForce(Promise promise) {
      tracer.onForce(promise);
    }

    @Override public void onSubstitute(Ast.Unquote unquote, Ast.Exp exp) {
      tracer.onSubstitute(unquote, exp);
    }

    @Override public void onSplice(Ast.UnquoteSplice splice,
        List<Ast.Arg> args) {
      tracer.onSplice(splice, args);
    }

    @Override public void onResolve(Ast.Exp exp, Ast.Exp resolved) {
      tracer.onResolve(exp, resolved);
    }

    @Override public void onEvalTidy(QuotedClosure closure,
        @Nullable DataMask mask) {
      tracer.onEvalTidy(closure, mask);
    }
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void println(String s) {
      w.println(s);
      w.flush();
    }

    @Override public void onForce(Promise promise) {
      println("force " + promise.expr);
    }

    @Override public void onSubstitute(Ast.Unquote unquote, Ast.Exp exp) {
      println("substitute " + unquote + " -> " + exp);
    }

    @Override public void onSplice(Ast.UnquoteSplice splice,
        List<Ast.Arg> args) {
      println("splice " + splice + " -> " + args);
    }

    @Override public void onResolve(Ast.Exp exp, Ast.Exp resolved) {
      println("resolve " + exp + " -> " + resolved);
    }

    @Override public void onEvalTidy(QuotedClosure closure,
        @Nullable DataMask mask) {
      println("evalTidy " + closure.expr
          + (mask == null ? "" : " with mask " + mask.names()));
    }
  }
}

// End Tracers.java
