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

import com.google.common.collect.ImmutableSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.quasi.eval.Environment;
import net.hydromatic.quasi.eval.Evaluator;
import net.hydromatic.quasi.eval.NamedList;
import net.hydromatic.quasi.util.QuasiException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bindings that are overlaid on a quoted closure's environment while the
 * closure is evaluated.
 *
 * <p>Names in the mask obscure names of the same name in the closure's
 * environment. The mask also binds two pronouns: {@code .data}, through which
 * {@code .data$x} looks up {@code x} in the mask only, and {@code .env},
 * through which {@code .env$x} looks up {@code x} in the closure's
 * environment only.
 */
public class DataMask implements UnaryOperator<Environment> {
  /** Name of the pronoun that refers to the mask. */
  public static final String DATA = ".data";

  /** Name of the pronoun that refers to the closure's environment. */
  public static final String ENV = ".env";

  private final Map<String, @Nullable Object> data;

  private DataMask(Map<String, @Nullable Object> data) {
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /** Creates a mask from a map. */
  public static DataMask of(Map<String, ?> data) {
    return new DataMask(new LinkedHashMap<>(data));
  }

  /** Creates a mask from the visible bindings of an environment. */
  public static DataMask of(Environment env) {
    return new DataMask(env.valueMap());
  }

  /** Creates a mask from the named elements of a list. Unnamed elements are
   * ignored. */
  public static DataMask of(NamedList list) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>();
    for (int i = 0; i < list.size(); i++) {
      final String name = list.name(i);
      if (name != null && !map.containsKey(name)) {
        map.put(name, list.get(i));
      }
    }
    return new DataMask(map);
  }

  @Override
  public String toString() {
    return "<data mask: " + data.keySet() + ">";
  }

  /** Returns the names bound by this mask, not including pronouns. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(data.keySet());
  }

  /** Returns an environment that is a closure's environment overlaid by this
   * mask. */
  @Override
  public Environment apply(Environment env) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>(data);
    map.put(DATA, new DataPronoun(data));
    map.put(ENV, new EnvPronoun(env));
    return env.bindAll(map);
  }

  /** Value that looks up names on behalf of the "$" operator. */
  public interface Pronoun {
    @Nullable Object get(String name, Evaluator evaluator);
  }

  /** The {@code .data} pronoun. */
  private static class DataPronoun implements Pronoun {
    private final Map<String, @Nullable Object> data;

    DataPronoun(Map<String, @Nullable Object> data) {
      this.data = requireNonNull(data);
    }

    @Override
    public String toString() {
      return "<pronoun " + DATA + ">";
    }

    @Override
    public @Nullable Object get(String name, Evaluator evaluator) {
      if (!data.containsKey(name)) {
        throw new QuasiException(QuasiException.Kind.UNBOUND_SYMBOL,
            "Column `" + name + "` not found in `" + DATA + "`");
      }
      return evaluator.force(name, data.get(name));
    }
  }

  /** The {@code .env} pronoun. */
  private static class EnvPronoun implements Pronoun {
    private final Environment env;

    EnvPronoun(Environment env) {
      this.env = requireNonNull(env);
    }

    @Override
    public String toString() {
      return "<pronoun " + ENV + ">";
    }

    @Override
    public @Nullable Object get(String name, Evaluator evaluator) {
      return evaluator.force(name, env.lookup(name));
    }
  }
}

// End DataMask.java
