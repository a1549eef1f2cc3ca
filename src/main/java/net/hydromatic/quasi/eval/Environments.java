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
import static net.hydromatic.quasi.util.Static.shorterThan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment containing the built-in functions. */
  public static Environment env() {
    final List<Binding> bindings = new ArrayList<>();
    Codes.BUILT_IN_VALUES.forEach((builtIn, value) ->
        bindings.add(Binding.of(builtIn.name, value)));
    return bind(EmptyEnvironment.INSTANCE, bindings);
  }

  /**
   * Creates an environment for a call frame.
   *
   * <p>The {@code bindings} map is used as is, not copied, so that promises
   * for default values can refer to the environment that they are part of.
   * The caller must finish populating the map before the environment is used
   * and must not modify it afterwards.
   */
  static Environment frame(Environment parent,
      LinkedHashMap<String, @Nullable Object> bindings) {
    return new MapEnvironment(parent, bindings);
  }

  /**
   * Creates an environment that binds one variable to a value that can see
   * the new environment; for example, a function that calls itself.
   */
  public static Environment recursive(Environment parent, String name,
      Function<Environment, @Nullable Object> valueFactory) {
    final LinkedHashMap<String, @Nullable Object> map = new LinkedHashMap<>();
    final Environment env = new MapEnvironment(parent, map);
    map.put(name, valueFactory.apply(env));
    return env;
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    if (shorterThan(bindings, 5)) {
      for (Binding binding : bindings) {
        env = env.bind(binding);
      }
      return env;
    } else {
      final LinkedHashMap<String, @Nullable Object> map = new LinkedHashMap<>();
      bindings.forEach(binding -> map.put(binding.name, binding.value));
      return new MapEnvironment(env, map);
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      for (Environment e = this;;) {
        if (!(e instanceof SubEnvironment)) {
          return e.getOpt(name);
        }
        final SubEnvironment sub = (SubEnvironment) e;
        if (name.equals(sub.binding.name)) {
          return sub.binding;
        }
        e = sub.parent;
      }
    }

    @Override
    public @Nullable Binding getLocalOpt(String name) {
      return name.equals(binding.name) ? binding : null;
    }

    @Override
    public Environment parent() {
      return parent;
    }

    @Override
    protected Environment bind(Binding binding) {
      Environment env;
      if (this.binding.name.equals(binding.name)) {
        // The new binding will obscure the current environment's binding,
        // because it binds a variable of the same name. Bind the parent
        // environment instead. This strategy tends to prevent long chains from
        // forming, and allows obscured values to be garbage-collected.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).binding.name.equals(binding.name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, binding);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    public String toString() {
      return "<empty>";
    }

    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }

    @Override
    public @Nullable Binding getLocalOpt(String name) {
      return null;
    }

    @Override
    public @Nullable Environment parent() {
      return null;
    }
  }

  /** Environment that keeps bindings in a map. */
  static class MapEnvironment extends Environment {
    private final Environment parent;
    private final Map<String, @Nullable Object> map;

    MapEnvironment(Environment parent, Map<String, @Nullable Object> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override
    public String toString() {
      return map.keySet() + ", ...";
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      map.forEach((name, value) -> consumer.accept(Binding.of(name, value)));
      parent.visit(consumer);
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      final Binding binding = getLocalOpt(name);
      return binding != null ? binding : parent.getOpt(name);
    }

    @Override
    public @Nullable Binding getLocalOpt(String name) {
      if (map.containsKey(name)) {
        return Binding.of(name, map.get(name));
      }
      return null;
    }

    @Override
    public Environment parent() {
      return parent;
    }
  }
}

// End Environments.java
