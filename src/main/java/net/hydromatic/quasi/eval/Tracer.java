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

import java.util.List;
import net.hydromatic.quasi.ast.Ast;
import net.hydromatic.quasi.quote.DataMask;
import net.hydromatic.quasi.quote.QuotedClosure;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during capture, resolution and evaluation. */
public interface Tracer {
  /** Called when a promise is about to be evaluated for the first time. */
  void onForce(Promise promise);

  /** Called when an unquote marker has been replaced by an expression. */
  void onSubstitute(Ast.Unquote unquote, Ast.Exp exp);

  /** Called when a splice marker has been replaced by arguments. */
  void onSplice(Ast.UnquoteSplice splice, List<Ast.Arg> args);

  /** Called when a tree has been resolved. */
  void onResolve(Ast.Exp exp, Ast.Exp resolved);

  /** Called when a quoted closure is about to be evaluated. */
  void onEvalTidy(QuotedClosure closure, @Nullable DataMask mask);
}

// End Tracer.java
