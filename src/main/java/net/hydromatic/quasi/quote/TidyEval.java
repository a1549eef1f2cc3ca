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

import java.util.Map;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.Promise;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates quoted closures.
 *
 * <p>The expression of a quoted closure is evaluated in the closure's
 * environment, overlaid by a {@link DataMask} if one is given. The mask also
 * applies to quoted closures embedded in the expression, each of which is
 * evaluated in its own environment overlaid by the same mask.
 */
public class TidyEval {
  private TidyEval() {}

  /** Evaluates a quoted closure without a data mask. */
  public static @Nullable Object evalTidy(Evaluator evaluator,
      QuotedClosure closure) {
    return evalTidy(evaluator, closure, (DataMask) null);
  }

  /** Evaluates a quoted closure with an optional data mask. */
  public static @Nullable Object evalTidy(Evaluator evaluator,
      QuotedClosure closure, @Nullable DataMask mask) {
    evaluator.session.tracer.onEvalTidy(closure, mask);
    final Environment env =
        mask == null ? closure.env : mask.apply(closure.env);
    final Promise promise = new Promise(closure.expr, env);
    return promise.force(evaluator.withMask(mask));
  }

  /** Evaluates a quoted closure, using the bindings of an environment as the
   * data mask. */
  public static @Nullable Object evalTidy(Evaluator evaluator,
      QuotedClosure closure, @Nullable Environment mask) {
    return evalTidy(evaluator, closure,
        mask == null ? null : DataMask.of(mask));
  }

  /** Evaluates a quoted closure, using a map as the data mask. */
  public static @Nullable Object evalTidy(Evaluator evaluator,
      QuotedClosure closure, Map<String, ?> data) {
    return evalTidy(evaluator, closure, DataMask.of(data));
  }
}

// End TidyEval.java
