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

import static net.hydromatic.symbolic.alg.Alg.POW;
import static net.hydromatic.symbolic.alg.Alg.isCall;
import static net.hydromatic.symbolic.alg.Alg.rational;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import java.math.BigInteger;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Matched;
import net.hydromatic.symbolic.compile.RuleSet;
import net.hydromatic.symbolic.match.Matcher;
import net.hydromatic.symbolic.match.Matchers;
import net.hydromatic.symbolic.util.BigFractions;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules that simplify powers. */
public abstract class PowerRules {
  private PowerRules() {}

  /** Largest root that we try to compute exactly. */
  private static final int MAX_ROOT = 64;

  private static final Matcher POW_MATCHER =
      Matchers.node2(POW, Matchers.ref("base"), Matchers.ref("exponent"));

  /** Rule set for powers. */
  public static final RuleSet RULES =
      RuleSet.builder("power")
          .add("computePow",
              Matchers.node2(POW,
                  Matchers.named(Matchers.anyRational(), "base"),
                  Matchers.named(Matchers.anyRational(), "exponent")),
              PowerRules::computePow)
          .add("powOne", POW_MATCHER, PowerRules::powOne)
          .add("powZero", POW_MATCHER, PowerRules::powZero)
          .add("powPow", POW_MATCHER, PowerRules::powPow)
          .add("powI",
              Matchers.node2(POW, Matchers.fixed(Alg.i()),
                  Matchers.named(Matchers.anyRational(), "exponent")),
              PowerRules::powI)
          .build();

  /**
   * Computes a rational raised to a rational power, if the result is
   * rational (or, in a complex calculator, a rational multiple of a power
   * of i).
   *
   * @throws ArithmeticException if the base is zero and the exponent is
   *     negative, or if the result is not real and the calculator is real
   */
  static Expr.@Nullable Node computePow(Matched m) {
    final BigFraction base = ((Expr.Rational) m.get("base")).value;
    final BigFraction exponent = ((Expr.Rational) m.get("exponent")).value;
    final BigInteger p = exponent.getNumerator();
    final BigInteger q = exponent.getDenominator();
    if (base.getNumerator().signum() == 0) {
      switch (p.signum()) {
        case 1:
          return Alg.ZERO;
        case -1:
          throw new ArithmeticException("zero raised to negative power "
              + exponent);
        default:
          // 0^0 is not defined; leave it.
          return null;
      }
    }
    if (q.equals(BigInteger.ONE)) {
      return expr.rational(BigFractions.pow(base, p));
    }
    if (q.compareTo(BigInteger.valueOf(MAX_ROOT)) > 0) {
      return null;
    }
    final int n = q.intValueExact();
    if (base.getNumerator().signum() > 0) {
      final BigFraction root = BigFractions.root(base, n);
      return root == null ? null : expr.rational(BigFractions.pow(root, p));
    }
    final BigFraction abs = base.negate();
    if (n % 2 == 1) {
      // Odd root of a negative number is negative.
      final BigFraction root = BigFractions.root(abs, n);
      return root == null
          ? null
          : expr.rational(BigFractions.pow(root.negate(), p));
    }
    if (m.calculator().isForceReal()) {
      throw new ArithmeticException("even root of negative number " + base
          + " is not real");
    }
    if (n != 2) {
      return null;
    }
    // (-b)^(p/2) = i^p * b^(p/2)
    return Alg.mul(Alg.pow(Alg.i(), expr.integer(p)),
        Alg.pow(expr.rational(abs), expr.rational(exponent)));
  }

  /** {@code pow(x, 1) → x}. */
  static Expr.@Nullable Node powOne(Matched m) {
    return m.get("exponent").equals(Alg.ONE) ? m.get("base") : null;
  }

  /** {@code pow(x, 0) → 1} if {@code x} is not a number. */
  static Expr.@Nullable Node powZero(Matched m) {
    return m.get("exponent").equals(Alg.ZERO)
            && !(m.get("base") instanceof Expr.Rational)
        ? Alg.ONE
        : null;
  }

  /** {@code pow(pow(x, a), n) → pow(x, a * n)} if {@code n} is an integer. */
  static Expr.@Nullable Node powPow(Matched m) {
    final Expr.Node base = m.get("base");
    final BigFraction n = rational(m.get("exponent"));
    if (n == null || !BigFractions.isInteger(n) || !isCall(base, POW)
        || !(base instanceof Expr.Node2)) {
      return null;
    }
    final Expr.Node2 inner = (Expr.Node2) base;
    return Alg.pow(inner.first, Alg.mul(inner.second, m.get("exponent")));
  }

  /** In a complex calculator, {@code pow(i, n)} for integer {@code n}. */
  static Expr.@Nullable Node powI(Matched m) {
    if (m.calculator().isForceReal()) {
      return null;
    }
    final BigFraction n = ((Expr.Rational) m.get("exponent")).value;
    if (!BigFractions.isInteger(n)) {
      return null;
    }
    switch (n.getNumerator().mod(BigInteger.valueOf(4)).intValue()) {
      case 0:
        return Alg.ONE;
      case 1:
        return Alg.i();
      case 2:
        return Alg.MINUS_ONE;
      default:
        return Alg.neg(Alg.i());
    }
  }
}

// End PowerRules.java
