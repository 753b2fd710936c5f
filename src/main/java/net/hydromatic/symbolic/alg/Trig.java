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
import static net.hydromatic.symbolic.alg.Alg.mul;
import static net.hydromatic.symbolic.alg.Alg.neg;
import static net.hydromatic.symbolic.alg.Alg.sqrt;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.ExprBuilder;
import net.hydromatic.symbolic.util.BigFractions;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exact values of trigonometric functions at rational multiples of π.
 *
 * <p>Each function takes {@code r} and returns the value at {@code r·π}, or
 * null if the value is not in the table.
 */
public abstract class Trig {
  private Trig() {}

  /** Returns sin(rπ), or null if unknown. */
  public static Expr.@Nullable Node sin(BigFraction r) {
    // sin((k + f)π) = (-1)^k sin(fπ), with 0 <= f < 1
    final BigInteger k = BigFractions.floor(r);
    BigFraction f = r.subtract(new BigFraction(k));
    // sin((1 - f)π) = sin(fπ)
    if (f.compareTo(BigFractions.HALF) > 0) {
      f = BigFraction.ONE.subtract(f);
    }
    final Expr.Node value = Tables.SIN.get(f);
    if (value == null) {
      return null;
    }
    return k.testBit(0) ? negate(value) : value;
  }

  /** Returns cos(rπ), or null if unknown. */
  public static Expr.@Nullable Node cos(BigFraction r) {
    // cos(rπ) = sin((1/2 - r)π)
    return sin(BigFractions.HALF.subtract(r));
  }

  /**
   * Returns tan(rπ), or null if unknown. If r is an odd multiple of 1/2,
   * returns {@link ExprBuilder#UNDEFINED}.
   */
  public static Expr.@Nullable Node tan(BigFraction r) {
    // tan has period π
    BigFraction f = BigFractions.fractionalPart(r);
    boolean negative = false;
    // tan((1 - f)π) = -tan(fπ)
    if (f.compareTo(BigFractions.HALF) > 0) {
      f = BigFraction.ONE.subtract(f);
      negative = true;
    }
    final Expr.Node value = Tables.TAN.get(f);
    if (value == null || value == ExprBuilder.UNDEFINED) {
      return value;
    }
    return negative ? negate(value) : value;
  }

  private static Expr.Node negate(Expr.Node value) {
    if (value instanceof Expr.Rational) {
      return expr.rational(((Expr.Rational) value).value.negate());
    }
    return neg(value);
  }

  /** Tables of values for r in [0, 1/2], created on first use. */
  private static class Tables {
    static final ImmutableMap<BigFraction, Expr.Node> SIN =
        ImmutableMap.<BigFraction, Expr.Node>builder()
            .put(BigFraction.ZERO, Alg.ZERO)
            .put(new BigFraction(1, 12),
                mul(expr.rational(1, 4), sqrt(expr.integer(2)),
                    add(Alg.MINUS_ONE, sqrt(expr.integer(3)))))
            .put(new BigFraction(1, 6), Alg.HALF)
            .put(new BigFraction(1, 4), mul(Alg.HALF, sqrt(expr.integer(2))))
            .put(new BigFraction(1, 3), mul(Alg.HALF, sqrt(expr.integer(3))))
            .put(new BigFraction(5, 12),
                mul(expr.rational(1, 4), sqrt(expr.integer(2)),
                    add(Alg.ONE, sqrt(expr.integer(3)))))
            .put(BigFractions.HALF, Alg.ONE)
            .build();

    static final ImmutableMap<BigFraction, Expr.Node> TAN =
        ImmutableMap.<BigFraction, Expr.Node>builder()
            .put(BigFraction.ZERO, Alg.ZERO)
            .put(new BigFraction(1, 12),
                add(expr.integer(2), neg(sqrt(expr.integer(3)))))
            .put(new BigFraction(1, 6),
                Alg.pow(expr.integer(3), expr.rational(-1, 2)))
            .put(new BigFraction(1, 4), Alg.ONE)
            .put(new BigFraction(1, 3), sqrt(expr.integer(3)))
            .put(new BigFraction(5, 12),
                add(expr.integer(2), sqrt(expr.integer(3))))
            .put(BigFractions.HALF, ExprBuilder.UNDEFINED)
            .build();
  }
}

// End Trig.java
