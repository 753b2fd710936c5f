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
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;
import static net.hydromatic.symbolic.util.Static.transformEager;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.ExprBuilder;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.compile.QualifierDef;

/**
 * Converts a template expression into a {@link Matcher}.
 *
 * <p>In a template:
 *
 * <ul>
 *   <li>a symbol whose name starts with "$" is a reference;
 *   <li>a symbol that a qualifier node in the template declares, such as
 *       {@code i} in {@code sum(i, ...)}, is also a reference;
 *   <li>any other leaf matches only an equal leaf;
 *   <li>{@code Named(t, $r)} matches what {@code t} matches and binds the
 *       node to {@code $r};
 *   <li>{@code Where(t, c)} matches what {@code t} matches, provided that
 *       {@code c}, after substitution, is satisfied;
 *   <li>an n-ary node whose head is commutative in the calculator matches
 *       its children in any order;
 *   <li>any other branch matches a branch of the same kind and head whose
 *       children match in order.
 * </ul>
 */
public class MatcherCompiler {
  private final Calculator calculator;
  private final Set<String> declaredRefs = new HashSet<>();

  private MatcherCompiler(Calculator calculator) {
    this.calculator = requireNonNull(calculator);
  }

  /** Compiles a template into a matcher. */
  public static Matcher compile(Calculator calculator, Expr.Node template) {
    return new MatcherCompiler(calculator).toMatcher(template);
  }

  private Matcher toMatcher(Expr.Node node) {
    if (node instanceof Expr.Branch) {
      final Expr.Branch branch = (Expr.Branch) node;
      if (branch instanceof Expr.Node2) {
        final Expr.Node2 node2 = (Expr.Node2) branch;
        switch (branch.head) {
          case ExprBuilder.NAMED:
            if (!expr.isRef(node2.second)) {
              throw new IllegalArgumentException("second argument of "
                  + ExprBuilder.NAMED + " must be a reference: " + node);
            }
            return Matchers.named(toMatcher(node2.first),
                ((Expr.Symbol) node2.second).name);
          case ExprBuilder.WHERE:
            return Matchers.withCondition(toMatcher(node2.first), node2.second);
          default:
            break;
        }
      }
      final QualifierDef def = calculator.qualifier(branch.head);
      if (def != null) {
        declaredRefs.addAll(def.qualifiedVariables(branch));
      }
    }

    switch (node.kind) {
      case SYMBOL:
        final String name = ((Expr.Symbol) node).name;
        if (expr.isRef(node) || declaredRefs.contains(name)) {
          return Matchers.ref(name);
        }
        return Matchers.fixed(node);

      case RATIONAL:
      case OTHER:
        return Matchers.fixed(node);

      case NODE1:
        final Expr.Node1 node1 = (Expr.Node1) node;
        return Matchers.node1(node1.head, toMatcher(node1.child));

      case NODE2:
        final Expr.Node2 node2 = (Expr.Node2) node;
        return Matchers.node2(node2.head,
            toMatcher(node2.first), toMatcher(node2.second));

      case NODE3:
        final Expr.Node3 node3 = (Expr.Node3) node;
        return Matchers.node3(node3.head, toMatcher(node3.first),
            toMatcher(node3.second), toMatcher(node3.third));

      case NODEN:
        final Expr.NodeN nodeN = (Expr.NodeN) node;
        final List<Matcher> children =
            transformEager(nodeN.children, this::toMatcher);
        if (calculator.isCommutative(nodeN.head)) {
          return Matchers.commutative(nodeN.head, children, Matchers.nothing());
        }
        return Matchers.nodeN(nodeN.head, children);

      default:
        throw new AssertionError("unknown kind " + node.kind);
    }
  }
}

// End MatcherCompiler.java
