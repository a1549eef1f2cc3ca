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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Call frame of a {@link Closure}.
 *
 * <p>The frame's environment binds each parameter to a {@link Promise}, or to
 * {@link Missing#INSTANCE} if the parameter was not supplied and has no
 * default, and binds {@link #DOTS} to the excess arguments. Functions called
 * from the body of the closure find the frame via the hidden variable
 * {@link #FRAME}.
 */
public class Frame {
  /** The name of the variable that contains the {@link Frame}. */
  public static final String FRAME = "$frame";

  /** The name of the variable that contains the excess arguments. */
  public static final String DOTS = "...";

  public final Closure fn;
  public final Args args;
  public final Environment env;
  /** Excess arguments, in call-site order. */
  public final List<Args.Actual> dots;
  /** Names of parameters for which the caller supplied no argument. */
  private final ImmutableSet<String> unsupplied;

  Frame(Closure fn, Args args, Environment env, List<Args.Actual> dots,
      ImmutableSet<String> unsupplied) {
    this.fn = requireNonNull(fn);
    this.args = requireNonNull(args);
    this.env = requireNonNull(env);
    this.dots = requireNonNull(dots);
    this.unsupplied = requireNonNull(unsupplied);
  }

  @Override
  public String toString() {
    return "<frame: " + args.call + ">";
  }

  /**
   * Returns whether the caller supplied no argument for a parameter. True even
   * if the parameter has a default value.
   */
  public boolean isUnsupplied(String name) {
    return unsupplied.contains(name);
  }

  /**
   * Returns the frame of the innermost closure whose body contains the given
   * environment, or null if the environment is not inside a closure.
   */
  public static @Nullable Frame of(Environment env) {
    final Binding binding = env.getOpt(FRAME);
    return binding == null ? null : (Frame) binding.value;
  }
}

// End Frame.java
