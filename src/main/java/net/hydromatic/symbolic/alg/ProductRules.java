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

import static net.hydromatic.symbolic.alg.Alg.MUL;
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

/** Rules that simplify products. */
public abstract class ProductRules {
  private ProductRules() {}

  /** Rule set for products. */
  public static final RuleSet RULES =
      RuleSet.builder("product")
          .add("flattenProduct", Matchers.head(MUL), ProductRules::flatten)
          .add("foldProductConstants", Matchers.head(MUL),
              ProductRules::foldConstants)
          .add("mergeFactors", Matchers.head(MUL), ProductRules::mergeFactors)
          .add("sortFactors", Matchers.head(MUL), ProductRules::sort)
          .build();

  /** {@code mul(a, mul(b, c)) → mul(a, b, c)}. */
  static Expr.@Nullable Node flatten(Matched m) {
    final List<Expr.Node> operands = Alg.flatten(m.node);
    return operands == null ? null : Alg.nary(MUL, operands, Alg.ONE);
  }

  /**
   * Multiplies the rational factors; drops the product if it is 1; returns 0
   * if it is 0.
   */
  static Expr.@Nullable Node foldConstants(Matched m) {
    final List<Expr.Node> children = m.node.children();
    BigFraction product = BigFraction.ONE;
    int count = 0;
    final List<Expr.Node> others = new ArrayList<>();
    for (Expr.Node child : children) {
      final BigFraction r = rational(child);
      if (r == null) {
        others.add(child);
      } else {
        product = product.multiply(r);
        ++count;
      }
    }
    final boolean isOne = product.equals(BigFraction.ONE);
    if (product.getNumerator().signum() == 0) {
      return Alg.ZERO;
    }
    if (children.size() > 1 && (count > 1 || count == 1 && isOne)) {
      final List<Expr.Node> operands = new ArrayList<>();
      if (!isOne) {
        operands.add(expr.rational(product));
      }
      operands.addAll(others);
      return Alg.nary(MUL, operands, Alg.ONE);
    }
    if (children.size() == 1) {
      return children.get(0);
    }
    return null;
  }

  /**
   * Merges factors with the same base: {@code x * x → pow(x, 2)},
   * {@code pow(x, a) * pow(x, b) → pow(x, a + b)}.
   */
  static Expr.@Nullable Node mergeFactors(Matched m) {
    final Map<Expr.Node, List<Expr.Node>> exponents = new LinkedHashMap<>();
    final List<Expr.Node> constants = new ArrayList<>();
    boolean merged = false;
    for (Expr.Node child : m.node.children()) {
      if (child instanceof Expr.Rational) {
        constants.add(child);
        continue;
      }
      final Expr.Node base;
      final Expr.Node exponent;
      if (isCall(child, Alg.POW) && child instanceof Expr.Node2) {
        base = ((Expr.Node2) child).first;
        exponent = ((Expr.Node2) child).second;
      } else {
        base = child;
        exponent = Alg.ONE;
      }
      final List<Expr.Node> list = exponents.get(base);
      if (list == null) {
        final List<Expr.Node> list2 = new ArrayList<>();
        list2.add(exponent);
        exponents.put(base, list2);
      } else {
        list.add(exponent);
        merged = true;
      }
    }
    if (!merged) {
      return null;
    }
    final List<Expr.Node> operands = new ArrayList<>(constants);
    exponents.forEach((base, list) -> {
      if (list.size() == 1) {
        operands.add(
            list.get(0).equals(Alg.ONE) ? base : Alg.pow(base, list.get(0)));
      } else {
        operands.add(Alg.pow(base, Alg.add(list)));
      }
    });
    return Alg.nary(MUL, operands, Alg.ONE);
  }

  /** Puts factors into canonical order. */
  static Expr.@Nullable Node sort(Matched m) {
    final List<Expr.Node> sorted = Alg.sort(m.node);
    return sorted == null ? null : Alg.mul(sorted);
  }
}

// End ProductRules.java
