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
package net.hydromatic.symbolic.alg;

import static net.hydromatic.symbolic.alg.Alg.ADD;
import static net.hydromatic.symbolic.alg.Alg.isCall;
import static net.hydromatic.symbolic.alg.Alg.rational;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Matched;
import net.hydromatic.symbolic.compile.RuleSet;
import net.hydromatic.symbolic.match.Matchers;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules that simplify sums. */
public abstract class SumRules {
  private SumRules() {}

  /** Rule set for sums. */
  public static final RuleSet RULES =
      RuleSet.builder("sum")
          .add("flattenSum", Matchers.head(ADD), SumRules::flatten)
          .add("foldSumConstants", Matchers.head(ADD), SumRules::foldConstants)
          .add("collectTerms", Matchers.head(ADD), SumRules::collectTerms)
          .add("sortTerms", Matchers.head(ADD), SumRules::sort)
          .build();

  /** {@code add(a, add(b, c)) → add(a, b, c)}. */
  static Expr.@Nullable Node flatten(Matched m) {
    final List<Expr.Node> operands = Alg.flatten(m.node);
    return operands == null ? null : Alg.nary(ADD, operands, Alg.ZERO);
  }

  /** Adds the rational terms; drops the sum if it is 0. */
  static Expr.@Nullable Node foldConstants(Matched m) {
    final List<Expr.Node> children = m.node.children();
    BigFraction sum = BigFraction.ZERO;
    int count = 0;
    final List<Expr.Node> others = new ArrayList<>();
    for (Expr.Node child : children) {
      final BigFraction r = rational(child);
      if (r == null) {
        others.add(child);
      } else {
        sum = sum.add(r);
        ++count;
      }
    }
    final boolean isZero = sum.getNumerator().signum() == 0;
    if (children.size() > 1 && (count > 1 || count == 1 && isZero)) {
      final List<Expr.Node> operands = new ArrayList<>();
      if (!isZero) {
        operands.add(expr.rational(sum));
      }
      operands.addAll(others);
      return Alg.nary(ADD, operands, Alg.ZERO);
    }
    if (children.size() == 1) {
      return children.get(0);
    }
    return null;
  }

  /**
   * Collects like terms: {@code x + x → 2 * x},
   * {@code 2 * x + 3 * x → 5 * x}.
   */
  static Expr.@Nullable Node collectTerms(Matched m) {
    final Map<Expr.Node, BigFraction> coefficients = new LinkedHashMap<>();
    final List<Expr.Node> constants = new ArrayList<>();
    boolean merged = false;
    for (Expr.Node child : m.node.children()) {
      if (child instanceof Expr.Rational) {
        constants.add(child);
        continue;
      }
      BigFraction coefficient = BigFraction.ONE;
      Expr.Node term = child;
      if (isCall(child, Alg.MUL)) {
        final List<Expr.Node> factors = child.children();
        final BigFraction r = rational(factors.get(0));
        if (r != null && factors.size() > 1) {
          coefficient = r;
          term = Alg.nary(Alg.MUL, factors.subList(1, factors.size()), Alg.ONE);
        }
      }
      final BigFraction previous = coefficients.get(term);
      if (previous != null) {
        coefficient = coefficient.add(previous);
        merged = true;
      }
      coefficients.put(term, coefficient);
    }
    if (!merged) {
      return null;
    }
    final List<Expr.Node> operands = new ArrayList<>(constants);
    coefficients.forEach((term, coefficient) -> {
      if (coefficient.getNumerator().signum() == 0) {
        return;
      }
      operands.add(
          coefficient.equals(BigFraction.ONE)
              ? term
              : Alg.mul(expr.rational(coefficient), term));
    });
    return Alg.nary(ADD, operands, Alg.ZERO);
  }

  /** Puts terms into canonical order. */
  static Expr.@Nullable Node sort(Matched m) {
    final List<Expr.Node> sorted = Alg.sort(m.node);
    return sorted == null ? null : Alg.add(sorted);
  }
}

// End SumRules.java
