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

import static java.util.Objects.requireNonNull;

import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.match.MatchResult;

/** A node that a rule's matcher has matched, with the bindings it made. */
public final class Matched {
  public final Expr.Node node;
  public final Context context;
  public final MatchResult result;

  public Matched(Expr.Node node, Context context, MatchResult result) {
    this.node = requireNonNull(node);
    this.context = requireNonNull(context);
    this.result = requireNonNull(result);
  }

  @Override
  public String toString() {
    return node + " " + result;
  }

  /** Returns the calculator that is doing the matching. */
  public Calculator calculator() {
    return result.calculator;
  }

  /**
   * Returns the node bound to a name.
   *
   * @throws IllegalArgumentException if the name is not bound
   */
  public Expr.Node get(String name) {
    final Expr.Node node = result.get(name);
    if (node == null) {
      throw new IllegalArgumentException("no binding for " + name);
    }
    return node;
  }

  /** Returns the node bound to a name, cast to a type. */
  public <N extends Expr.Node> N get(String name, Class<N> type) {
    return type.cast(get(name));
  }

  /** Substitutes the bindings into a template. */
  public Expr.Node substitute(Expr.Node template) {
    return result.substitute(template);
  }
}

// End Matched.java
