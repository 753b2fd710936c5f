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
package net.hydromatic.symbolic.ast;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Key of a piece of node metadata, carrying the type of its value.
 *
 * <p>Keys are compared by identity.
 *
 * @param <T> Value type
 */
public final class TypedKey<T> {
  public final String name;
  public final Class<T> type;

  private TypedKey(String name, Class<T> type) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
  }

  /** Creates a key. */
  public static <T> TypedKey<T> of(String name, Class<T> type) {
    return new TypedKey<>(name, type);
  }

  /** Converts a value to this key's type. */
  public @Nullable T cast(@Nullable Object o) {
    return type.cast(o);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End TypedKey.java
