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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.TypedKey;
import net.hydromatic.symbolic.match.MatchResult;
import net.hydromatic.symbolic.match.TreeDispatcher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Drives an expression to a normal form by applying rules until none
 * applies.
 *
 * <p>Each pass visits the tree in post-order, so that a node is rewritten
 * after its children. At each node, rules are tried in dispatch order, and
 * the first whose replacement differs from the node wins. Each node is
 * rewritten at most once per pass.
 */
class Rewriter {
  /**
   * Marks a node as fully reduced. The value is the generation of the
   * calculator at the time; the mark is stale if the calculator has since
   * registered rules or changed properties.
   */
  static final TypedKey<Integer> REDUCED =
      TypedKey.of("reduced", Integer.class);

  private final Calculator calculator;
  private final TreeDispatcher<Rule> dispatcher;
  private final Tracer tracer;
  private final int generation;

  Rewriter(Calculator calculator, TreeDispatcher<Rule> dispatcher,
      Tracer tracer, int generation) {
    this.calculator = requireNonNull(calculator);
    this.dispatcher = requireNonNull(dispatcher);
    this.tracer = requireNonNull(tracer);
    this.generation = generation;
  }

  /** Reduces an expression, applying rules up to a given depth. */
  Expr.Node reduce(Expr.Node node, Context context, int depth) {
    final boolean complete =
        depth == Integer.MAX_VALUE && context.boundNames().isEmpty();
    if (complete && isReduced(node)) {
      return node;
    }
    final int maxPasses = calculator.intProp(Prop.MAX_PASSES);
    Expr.Node current = node;
    for (int pass = 0; pass < maxPasses; pass++) {
      tracer.onPass(pass, current);
      final Expr.Node next = rewrite(current, context, 0, depth);
      if (next == current) {
        if (complete) {
          calculator.metaTable().put(current, REDUCED, generation);
        }
        return current;
      }
      current = next;
    }
    tracer.onPassLimit(maxPasses, current);
    if (calculator.enumProp(Prop.ON_PASS_LIMIT, Prop.PassLimit.class)
        == Prop.PassLimit.FAIL) {
      throw new IllegalStateException("no fixed point after " + maxPasses
          + " passes; last expression " + current);
    }
    return current;
  }

  private boolean isReduced(Expr.Node node) {
    final Integer g = calculator.metaTable().get(node, REDUCED);
    return g != null && g == generation;
  }

  /** Makes one pass over a subtree, whose root is at a given level. */
  private Expr.Node rewrite(
      Expr.Node node, Context context, int level, int depth) {
    Expr.Node node2 = node;
    if (node instanceof Expr.Branch && level < depth) {
      final Expr.Branch branch = (Expr.Branch) node;
      final List<Context> contexts = calculator.enterContext(node, context);
      final List<Expr.Node> children = new ArrayList<>(branch.children.size());
      for (int i = 0; i < branch.children.size(); i++) {
        children.add(
            rewrite(branch.children.get(i), contexts.get(i), level + 1, depth));
      }
      node2 = branch.withChildren(children);
    }
    final Expr.Node node3 = applyFirst(node2, context, level);
    return node3 != null ? node3 : node2;
  }

  /**
   * Applies the first applicable rule to a node; returns the replacement, or
   * null if no rule applies.
   */
  private Expr.@Nullable Node applyFirst(
      Expr.Node node, Context context, int level) {
    final Expr.Node[] holder = {null};
    dispatcher.dispatchUntil(node, context, MatchResult.empty(calculator),
        (rule, result) -> {
          if (level > rule.maxDepth) {
            return false;
          }
          final Expr.Node replacement =
              rule.replacement.replace(new Matched(node, context, result));
          if (replacement == null || replacement.deepEquals(node)) {
            return false;
          }
          tracer.onRewrite(rule, node, replacement);
          holder[0] = replacement;
          return true;
        });
    return holder[0];
  }
}

// End Rewriter.java
