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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.symbolic.ast.Expr;

/** Finds free variables in an expression. */
class FreeFinder {
  private final Calculator calculator;
  private final Consumer<Expr.Symbol> consumer;

  private FreeFinder(Calculator calculator, Consumer<Expr.Symbol> consumer) {
    this.calculator = calculator;
    this.consumer = consumer;
  }

  /**
   * Finds the free variables in an expression: symbol leaves that are not
   * bound by an enclosing qualifier, and are not constants such as π.
   */
  static Set<Expr.Symbol> freeSymbols(
      Calculator calculator, Expr.Node node, Context context) {
    final ImmutableSet.Builder<Expr.Symbol> set = ImmutableSet.builder();
    final FreeFinder finder = new FreeFinder(calculator, set::add);
    calculator.traverseWithContext(node, context, Integer.MAX_VALUE,
        finder::visit);
    return set.build();
  }

  private void visit(Expr.Node node, Context context) {
    if (node instanceof Expr.Symbol) {
      final String name = ((Expr.Symbol) node).name;
      if (!context.isBound(name) && !calculator.isConstant(name)) {
        consumer.accept((Expr.Symbol) node);
      }
    }
  }
}

// End FreeFinder.java
