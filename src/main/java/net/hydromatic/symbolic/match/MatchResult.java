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
package net.hydromatic.symbolic.match;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of a successful match: the nodes bound to reference names.
 *
 * <p>Immutable. {@link #bind} returns a new result.
 */
public final class MatchResult {
  public final Calculator calculator;
  public final ImmutableMap<String, Expr.Node> bindings;

  private MatchResult(
      Calculator calculator, ImmutableMap<String, Expr.Node> bindings) {
    this.calculator = requireNonNull(calculator);
    this.bindings = requireNonNull(bindings);
  }

  /** Creates a result with no bindings. */
  public static MatchResult empty(Calculator calculator) {
    return new MatchResult(calculator, ImmutableMap.of());
  }

  /** Returns the node bound to a name, or null. */
  public Expr.@Nullable Node get(String name) {
    return bindings.get(name);
  }

  /** Returns whether a name is bound. */
  public boolean isBound(String name) {
    return bindings.containsKey(name);
  }

  /**
   * Returns a result that also binds {@code name} to {@code node}; or this
   * result if it is already bound to an equal node; or null if it is already
   * bound to a different node.
   */
  public @Nullable MatchResult bind(String name, Expr.Node node) {
    final Expr.Node existing = bindings.get(name);
    if (existing != null) {
      return existing.deepEquals(node) ? this : null;
    }
    return new MatchResult(calculator, Static.plus(bindings, name, node));
  }

  /**
   * Replaces each symbol in a template whose name is bound by the node it is
   * bound to. Other symbols are left as they are.
   */
  public Expr.Node substitute(Expr.Node template) {
    return template.recurMap(
        Integer.MAX_VALUE,
        node -> {
          if (node instanceof Expr.Symbol) {
            final Expr.Node bound = bindings.get(((Expr.Symbol) node).name);
            if (bound != null) {
              return bound;
            }
          }
          return node;
        });
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof MatchResult
            && calculator == ((MatchResult) obj).calculator
            && bindings.equals(((MatchResult) obj).bindings);
  }

  @Override
  public String toString() {
    return Objects.toString(bindings);
  }
}

// End MatchResult.java
