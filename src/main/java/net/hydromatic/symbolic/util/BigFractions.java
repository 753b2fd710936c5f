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
package net.hydromatic.symbolic.util;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Exact arithmetic on {@link BigFraction} values. */
public abstract class BigFractions {
  private BigFractions() {}

  public static final BigFraction HALF = new BigFraction(1, 2);

  /** Returns whether a fraction is an integer. */
  public static boolean isInteger(BigFraction f) {
    return f.getDenominator().equals(BigInteger.ONE);
  }

  /**
   * Raises a fraction to an integer power by repeated squaring.
   *
   * @throws ArithmeticException if {@code base} is zero and {@code exponent}
   *     is negative
   */
  public static BigFraction pow(BigFraction base, BigInteger exponent) {
    if (exponent.signum() < 0) {
      if (base.getNumerator().signum() == 0) {
        throw new ArithmeticException("zero to a negative power");
      }
      return pow(base.reciprocal(), exponent.negate());
    }
    BigFraction result = BigFraction.ONE;
    BigFraction square = base;
    for (int i = 0; i < exponent.bitLength(); i++) {
      if (exponent.testBit(i)) {
        result = result.multiply(square);
      }
      if (i + 1 < exponent.bitLength()) {
        square = square.multiply(square);
      }
    }
    return result;
  }

  /**
   * Returns the exact non-negative {@code n}th root of a non-negative integer,
   * or null if it is not a perfect power.
   */
  public static @Nullable BigInteger root(BigInteger x, int n) {
    checkArgument(n > 0, "invalid root %s", n);
    checkArgument(x.signum() >= 0, "negative radicand %s", x);
    if (n == 1 || x.signum() == 0 || x.equals(BigInteger.ONE)) {
      return x;
    }
    // Binary search in [lo, hi], where lo^n <= x < hi^n.
    BigInteger lo = BigInteger.ONE;
    BigInteger hi = BigInteger.ONE.shiftLeft(x.bitLength() / n + 1);
    while (hi.subtract(lo).compareTo(BigInteger.ONE) > 0) {
      final BigInteger mid = lo.add(hi).shiftRight(1);
      if (mid.pow(n).compareTo(x) <= 0) {
        lo = mid;
      } else {
        hi = mid;
      }
    }
    return lo.pow(n).equals(x) ? lo : null;
  }

  /**
   * Returns the exact non-negative {@code n}th root of a non-negative
   * fraction, or null if the numerator or denominator is not a perfect power.
   */
  public static @Nullable BigFraction root(BigFraction f, int n) {
    final BigInteger num = root(f.getNumerator(), n);
    if (num == null) {
      return null;
    }
    final BigInteger den = root(f.getDenominator(), n);
    if (den == null) {
      return null;
    }
    return new BigFraction(num, den);
  }

  /** Returns the greatest integer less than or equal to a fraction. */
  public static BigInteger floor(BigFraction f) {
    final BigInteger[] qr =
        f.getNumerator().divideAndRemainder(f.getDenominator());
    // The denominator is positive, so the remainder has the numerator's sign.
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }

  /** Returns {@code f - floor(f)}, which is in the range [0, 1). */
  public static BigFraction fractionalPart(BigFraction f) {
    return f.subtract(new BigFraction(floor(f)));
  }
}

// End BigFractions.java
