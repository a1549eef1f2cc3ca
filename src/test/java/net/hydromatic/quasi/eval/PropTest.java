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

import static net.hydromatic.quasi.Ql.assertError;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.MAX_DEPTH.intValue(map), is(512));
    assertThat(Prop.NAMED.booleanValue(map), is(false));
    assertThat(Prop.HOMONYMS.enumValue(map, Prop.Homonyms.class),
        is(Prop.Homonyms.KEEP));
    assertThat(Prop.IGNORE_EMPTY.enumValue(map, Prop.IgnoreEmpty.class),
        is(Prop.IgnoreEmpty.TRAILING));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.HOMONYMS.setLenient(map, "last");
    assertThat(Prop.HOMONYMS.enumValue(map, Prop.Homonyms.class),
        is(Prop.Homonyms.LAST));
    Prop.IGNORE_EMPTY.setLenient(map, Prop.IgnoreEmpty.ALL);
    assertThat(Prop.IGNORE_EMPTY.enumValue(map, Prop.IgnoreEmpty.class),
        is(Prop.IgnoreEmpty.ALL));

    // Setting null restores the default
    Prop.HOMONYMS.setLenient(map, null);
    assertThat(Prop.HOMONYMS.enumValue(map, Prop.Homonyms.class),
        is(Prop.Homonyms.KEEP));
    assertThat(map.size(), is(1));
  }

  /** Tests that strings are converted to integer and boolean values. */
  @Test
  void testSetLenientParses() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.MAX_DEPTH.setLenient(map, " 100 ");
    assertThat(Prop.MAX_DEPTH.intValue(map), is(100));
    Prop.NAMED.setLenient(map, "TRUE");
    assertThat(Prop.NAMED.booleanValue(map), is(true));
    Prop.MAX_DEPTH.setLenient(map, 20);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(20));
  }

  @Test
  void testInvalidValue() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertError(() -> Prop.HOMONYMS.setLenient(map, "middle"),
        hasMessage("invalid value 'middle' for property 'homonyms'; "
            + "expected one of 'keep', 'first', 'last', 'error'"));
    assertError(() -> Prop.MAX_DEPTH.setLenient(map, "deep"),
        hasMessage("invalid value 'deep' for integer property 'maxDepth'"));
    assertError(() -> Prop.NAMED.setLenient(map, "yes"),
        hasMessage("invalid value 'yes' for boolean property 'named'"));
    assertError(() -> Prop.MAX_DEPTH.set(map, "deep"),
        hasMessage("value for property 'maxDepth' must have type Integer, "
            + "got String"));
    assertError(() -> Prop.MAX_DEPTH.set(map, 0),
        hasMessage("property 'maxDepth' must be positive, got 0"));
    assertError(() -> Prop.NAMED.intValue(map),
        hasMessage("property 'named' has type Boolean, not Integer"));
    assertThat(map.isEmpty(), is(true));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("maxDepth"), sameInstance(Prop.MAX_DEPTH));
    assertThat(Prop.lookup("MAX_DEPTH"), sameInstance(Prop.MAX_DEPTH));
    assertError(() -> Prop.lookup("maxdepth"),
        hasMessage("unknown property 'maxdepth'; expected one of "
            + "[homonyms, ignoreEmpty, maxDepth, named]"));
  }

  @Test
  void testSortedByCamelName() {
    assertThat(Prop.BY_CAMEL_NAME,
        is(
            ImmutableList.of(Prop.HOMONYMS, Prop.IGNORE_EMPTY, Prop.MAX_DEPTH,
                Prop.NAMED)));
    assertThat(Prop.BY_NAME.size(), is(2 * Prop.values().length));
  }

  private static Matcher<Throwable> hasMessage(String message) {
    return new CustomTypeSafeMatcher<Throwable>("message " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return message.equals(item.getMessage());
      }
    };
  }
}

// End PropTest.java
