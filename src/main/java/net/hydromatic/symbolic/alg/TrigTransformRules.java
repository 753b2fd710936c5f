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

import static net.hydromatic.symbolic.alg.Alg.add;
import static net.hydromatic.symbolic.alg.Alg.cos;
import static net.hydromatic.symbolic.alg.Alg.mul;
import static net.hydromatic.symbolic.alg.Alg.neg;
import static net.hydromatic.symbolic.alg.Alg.sin;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.RuleSet;

/**
 * Rules that transform trigonometric expressions using the parity of sine
 * and cosine and the angle-addition formulas.
 *
 * <p>These rules are not registered by {@link AlgCalculators}. Register
 * {@link #RULES} to combine products of sines and cosines into a single
 * function, or {@link #EXPAND} to split a function of a sum. Registering both
 * makes reduction oscillate until it reaches
 * {@link net.hydromatic.symbolic.compile.Prop#MAX_PASSES}.
 */
public abstract class TrigTransformRules {
  private TrigTransformRules() {}

  private static final Expr.Symbol X = expr.ref("x");
  private static final Expr.Symbol Y = expr.ref("y");

  /** {@code sin(-x) → -sin(x)} and {@code cos(-x) → cos(x)}. */
  public static final RuleSet PARITY =
      RuleSet.builder("trigParity")
          .template("sinNegate", sin(neg(X)), neg(sin(X)))
          .template("cosNegate", cos(neg(X)), cos(X))
          .build();

  /**
   * Parity rules, plus rules that combine
   * {@code sin(x)cos(y) + cos(x)sin(y)} into {@code sin(x + y)} and
   * {@code cos(x)cos(y) - sin(x)sin(y)} into {@code cos(x + y)}.
   */
  public static final RuleSet RULES =
      RuleSet.builder("trigTransform")
          .addAll(PARITY)
          .template("sinAddContract",
              add(mul(sin(X), cos(Y)), mul(cos(X), sin(Y))),
              sin(add(X, Y)))
          .template("cosAddContract",
              add(mul(cos(X), cos(Y)), mul(Alg.MINUS_ONE, sin(X), sin(Y))),
              cos(add(X, Y)))
          .build();

  /**
   * Parity rules, plus rules that expand {@code sin(x + y)} and
   * {@code cos(x + y)}.
   */
  public static final RuleSet EXPAND =
      RuleSet.builder("trigExpand")
          .addAll(PARITY)
          .template("sinAddExpand",
              sin(add(X, Y)),
              add(mul(sin(X), cos(Y)), mul(cos(X), sin(Y))))
          .template("cosAddExpand",
              cos(add(X, Y)),
              add(mul(cos(X), cos(Y)), mul(Alg.MINUS_ONE, sin(X), sin(Y))))
          .build();
}

// End TrigTransformRules.java
