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
package net.hydromatic.symbolic.compile;

import com.google.common.collect.MapMaker;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.TypedKey;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Metadata about nodes, such as whether a node is already fully reduced.
 *
 * <p>Nodes are immutable and may be shared between calculators, so metadata
 * is held here rather than in the node. Nodes are compared by identity, and
 * an entry disappears when its node is garbage-collected.
 */
public final class MetaTable {
  private final Map<Expr.Node, Map<TypedKey<?>, Object>> map =
      new MapMaker().weakKeys().makeMap();

  /** Returns the value of a key for a node, or null. */
  public <T> @Nullable T get(Expr.Node node, TypedKey<T> key) {
    final Map<TypedKey<?>, Object> values = map.get(node);
    return values == null ? null : key.cast(values.get(key));
  }

  /** Returns whether a key has a value for a node. */
  public boolean containsKey(Expr.Node node, TypedKey<?> key) {
    final Map<TypedKey<?>, Object> values = map.get(node);
    return values != null && values.containsKey(key);
  }

  /** Sets the value of a key for a node. */
  public <T> void put(Expr.Node node, TypedKey<T> key, T value) {
    map.computeIfAbsent(node, n -> new ConcurrentHashMap<>()).put(key, value);
  }

  /** Removes the value of a key for a node. */
  public void remove(Expr.Node node, TypedKey<?> key) {
    final Map<TypedKey<?>, Object> values = map.get(node);
    if (values != null) {
      values.remove(key);
    }
  }

  /** Returns the number of nodes that have metadata. */
  public int size() {
    return map.size();
  }
}

// End MetaTable.java
