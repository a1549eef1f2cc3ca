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

import static com.google.common.collect.Lists.reverse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Chain of scopes that map names to values.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change. Many promises and quoted closures may
 * therefore share one environment.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically, burning lots of CPU and memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    valueMap().forEach((k, v) -> b.append(k).append(" = ").append(v)
        .append("\n"));
    return b.toString();
  }

  /**
   * Returns the binding of {@code name} if bound, null if not.
   *
   * <p>Does not force a promise; a parameter is returned as its
   * {@link Promise}.
   */
  public abstract @Nullable Binding getOpt(String name);

  /**
   * Returns the binding of {@code name} in this scope only, not looking at
   * ancestors; null if not bound here.
   */
  public abstract @Nullable Binding getLocalOpt(String name);

  /**
   * Returns the value bound to {@code name}, searching the parent chain.
   *
   * @throws QuasiException of kind {@code UNBOUND_SYMBOL} if no scope defines
   *     the name
   */
  public @Nullable Object lookup(String name) {
    final Binding binding = getOpt(name);
    if (binding == null) {
      throw new QuasiException(QuasiException.Kind.UNBOUND_SYMBOL,
          "object '" + name + "' not found");
    }
    return binding.value;
  }

  /** Returns whether {@code name} is bound in this environment. */
  public boolean contains(String name) {
    return getOpt(name) != null;
  }

  /** Returns the enclosing environment, or null if this is the root. */
  public abstract @Nullable Environment parent();

  /**
   * Creates an environment that is the same as a given environment, plus one
   * more variable.
   */
  public Environment bind(String name, @Nullable Object value) {
    return bind(Binding.of(name, value));
  }

  protected Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /**
   * Creates an environment that is this environment plus the given bindings;
   * the {@code extend} operation.
   */
  public final Environment bindAll(Map<String, ?> bindings) {
    final List<Binding> list = new ArrayList<>();
    bindings.forEach((name, value) -> list.add(Binding.of(name, value)));
    return Environments.bind(this, list);
  }

  /** Returns a map of the visible bindings, most recent first. */
  public final Map<String, @Nullable Object> valueMap() {
    final Map<String, @Nullable Object> valueMap = new LinkedHashMap<>();
    visit(binding -> {
      if (!valueMap.containsKey(binding.name)) {
        valueMap.put(binding.name, binding.value);
      }
    });
    return valueMap;
  }

  /**
   * Returns this environment plus the visible bindings in the given
   * environment. Bindings in {@code env} obscure bindings of the same name in
   * this environment.
   */
  public Environment plus(Environment env) {
    final Set<String> names = new HashSet<>();
    final List<Binding> bindingList = new ArrayList<>();
    env.visit(binding -> {
      if (names.add(binding.name)) {
        bindingList.add(binding);
      }
    });
    return Environments.bind(this, reverse(bindingList));
  }
}

// End Environment.java
