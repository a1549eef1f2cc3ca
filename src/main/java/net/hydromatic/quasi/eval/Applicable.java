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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value that can be called.
 *
 * <p>A function receives its arguments as unforced promises. A strict function
 * forces them; a function that captures its arguments reads their expressions
 * instead.
 *
 * @see Closure
 * @see BuiltIn
 */
public interface Applicable {
  @Nullable Object apply(Evaluator evaluator, Args args);
}

// End Applicable.java
