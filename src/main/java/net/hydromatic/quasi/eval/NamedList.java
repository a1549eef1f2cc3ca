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

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.RandomAccess;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable list of values, each of which may have a name.
 *
 * <p>It is the value of the "list" built-in and of functions that capture
 * several arguments. When spliced into a call, each element becomes an
 * argument, named if the element has a name.
 *
 * <p>Elements and names may be null.
 *
 * <p>Equality and hash code are those of {@link List}; names are not
 * compared. Use {@link #names()} to compare names.
 */
public class NamedList extends AbstractList<@Nullable Object>
    implements RandomAccess {
  private static final NamedList EMPTY =
      new NamedList(Collections.emptyList(), Collections.emptyList());

  private final List<@Nullable String> names;
  private final List<@Nullable Object> values;

  private NamedList(List<@Nullable String> names,
      List<@Nullable Object> values) {
    checkArgument(names.size() == values.size());
    this.names = names;
    this.values = values;
  }

  /** Returns an empty list. */
  public static NamedList of() {
    return EMPTY;
  }

  /** Creates a list from names and values, which must be the same size. */
  public static NamedList of(List<@Nullable String> names,
      List<@Nullable Object> values) {
    return new NamedList(
        Collections.unmodifiableList(new ArrayList<>(names)),
        Collections.unmodifiableList(new ArrayList<>(values)));
  }

  /** Creates a list of unnamed values. */
  public static NamedList copyOf(List<?> values) {
    return of(Collections.nCopies(values.size(), null),
        new ArrayList<>(values));
  }

  /** Creates a list whose names and values are the entries of a map. */
  public static NamedList copyOf(Map<String, ?> map) {
    return of(new ArrayList<>(map.keySet()), new ArrayList<>(map.values()));
  }

  @Override
  public @Nullable Object get(int index) {
    return values.get(index);
  }

  @Override
  public int size() {
    return values.size();
  }

  /** Returns the name of the {@code index}th element, or null. */
  public @Nullable String name(int index) {
    return names.get(index);
  }

  /** Returns the names; the list contains null for unnamed elements. */
  public List<@Nullable String> names() {
    return names;
  }

  /** Returns whether any element has a name. */
  public boolean hasNames() {
    return names.stream().anyMatch(Objects::nonNull);
  }

  /** Returns the index of the first element with a given name, or -1. */
  public int indexOf(String name) {
    return names.indexOf(name);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("list(");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      if (names.get(i) != null) {
        b.append(names.get(i)).append(" = ");
      }
      b.append(values.get(i));
    }
    return b.append(")").toString();
  }
}

// End NamedList.java
