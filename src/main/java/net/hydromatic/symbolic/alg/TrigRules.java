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

import static net.hydromatic.symbolic.alg.Alg.COS;
import static net.hydromatic.symbolic.alg.Alg.SIN;
import static net.hydromatic.symbolic.alg.Alg.TAN;
import static net.hydromatic.symbolic.alg.Alg.cos;
import static net.hydromatic.symbolic.alg.Alg.pow;
import static net.hydromatic.symbolic.alg.Alg.sin;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import java.util.List;
import java.util.function.Function;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Matched;
import net.hydromatic.symbolic.compile.RuleSet;
import net.hydromatic.symbolic.match.Matchers;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for trigonometric functions. */
public abstract class TrigRules {
  private TrigRules() {}

  /** Rule set for trigonometric functions. */
  public static final RuleSet RULES =
      RuleSet.builder("trig")
          .add("sinPi", Matchers.node1(SIN, Matchers.ref("x")),
              m -> evaluate(m, Trig::sin))
          .add("cosPi", Matchers.node1(COS, Matchers.ref("x")),
              m -> evaluate(m, Trig::cos))
          .add("tanPi", Matchers.node1(TAN, Matchers.ref("x")),
              m -> evaluate(m, Trig::tan))
          .template("pythagoras",
              Alg.add(pow(sin(expr.ref("x")), expr.integer(2)),
                  pow(cos(expr.ref("x")), expr.integer(2))),
              Alg.ONE)
          .build();

  private static Expr.@Nullable Node evaluate(
      Matched m, Function<BigFraction, Expr.@Nullable Node> fn) {
    final BigFraction r = piMultiple(m.get("x"));
    return r == null ? null : fn.apply(r);
  }

  /**
   * If an expression is a rational multiple of π, returns the multiple;
   * otherwise null. Recognizes {@code 0}, {@code π} and {@code mul(r, π)}.
   */
  static @Nullable BigFraction piMultiple(Expr.Node x) {
    if (x.equals(Alg.ZERO)) {
      return BigFraction.ZERO;
    }
    if (x.equals(Alg.pi())) {
      return BigFraction.ONE;
    }
    if (Alg.isCall(x, Alg.MUL)) {
      final List<Expr.Node> factors = x.children();
      if (factors.size() == 2
          && factors.get(0) instanceof Expr.Rational
          && factors.get(1).equals(Alg.pi())) {
        return ((Expr.Rational) factors.get(0)).value;
      }
    }
    return null;
  }
}

// End TrigRules.java
