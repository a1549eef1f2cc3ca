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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /**
   * Enum property "homonyms" controls what capturing several arguments does
   * when two arguments have the same name. Default is "keep".
   */
  HOMONYMS("homonyms", Homonyms.class, Homonyms.KEEP),

  /**
   * Enum property "ignoreEmpty" controls whether capturing several arguments
   * drops empty arguments, such as the second argument in "f(x, )". Default is
   * "trailing", which drops an empty argument only if it is the last.
   */
  IGNORE_EMPTY("ignoreEmpty", IgnoreEmpty.class, IgnoreEmpty.TRAILING),

  /**
   * Integer property "maxDepth" is the depth of nesting at which evaluation
   * and resolution give up with an error rather than exhausting the stack.
   * Default is 512.
   */
  MAX_DEPTH("maxDepth", Integer.class, 512),

  /**
   * Boolean property "named" controls whether capturing several arguments
   * gives each unnamed argument a name derived from its expression. Default is
   * false.
   */
  NAMED("named", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /**
   * Returns the property with a given name, which may be either its camel-case
   * name ("maxDepth") or its enum name ("MAX_DEPTH").
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    checkArgument(prop != null, "unknown property '%s'; expected one of %s",
        propName, BY_CAMEL_NAME.stream().map(p -> p.camelName)
            .collect(Collectors.toList()));
    return prop;
  }

  /** Returns the value of this property in a session's property map, or its
   * default value if it is not set. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "property '%s' has type %s, not %s", camelName,
        type.getSimpleName(), requestedType.getSimpleName());
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /**
   * Sets the value of a property, converting a string to the property's type.
   *
   * <p>For an enum property the string is an enum constant in any case
   * ("last" or "LAST"); for an integer or boolean property it is parsed.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (!(value instanceof String) || type == String.class) {
      set(map, value);
      return;
    }
    final String s = (String) value;
    if (type.isEnum()) {
      final Optional<Enum> optional =
          Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        final String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(e -> e.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("invalid value '" + s
            + "' for property '" + camelName + "'; expected one of "
            + values);
      }
      set(map, optional.get());
    } else if (type == Integer.class) {
      final Integer i = Ints.tryParse(s.trim());
      checkArgument(i != null,
          "invalid value '%s' for integer property '%s'", s, camelName);
      set(map, i);
    } else if (type == Boolean.class) {
      final String b = s.trim().toLowerCase(Locale.ROOT);
      checkArgument(b.equals("true") || b.equals("false"),
          "invalid value '%s' for boolean property '%s'", s, camelName);
      set(map, Boolean.valueOf(b));
    } else {
      set(map, value);
    }
  }

  /**
   * Sets the value of a property. A null value restores the default.
   *
   * @throws IllegalArgumentException if the value does not have the
   *     property's type
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(type.isInstance(value),
        "value for property '%s' must have type %s, got %s", camelName,
        type.getSimpleName(), value.getClass().getSimpleName());
    if (this == MAX_DEPTH) {
      checkArgument((Integer) value > 0,
          "property '%s' must be positive, got %s", camelName, value);
    }
    map.put(this, value);
  }

  /** Allowed values for {@link #HOMONYMS} property. */
  public enum Homonyms {
    /** Keep all arguments. The default. */
    KEEP,
    /** Keep only the first argument of each name. */
    FIRST,
    /** Keep only the last argument of each name. */
    LAST,
    /** Throw if two arguments have the same name. */
    ERROR
  }

  /** Allowed values for {@link #IGNORE_EMPTY} property. */
  public enum IgnoreEmpty {
    /** Keep empty arguments. */
    NONE,
    /** Drop an empty argument if it is the last. The default. */
    TRAILING,
    /** Drop all empty arguments. */
    ALL
  }
}

// End Prop.java
