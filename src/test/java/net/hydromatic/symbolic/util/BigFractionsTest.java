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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

/** Tests for {@link BigFractions}. */
public class BigFractionsTest {
  private static BigInteger big(long v) {
    return BigInteger.valueOf(v);
  }

  @Test
  void testPow() {
    assertThat(BigFractions.pow(new BigFraction(2), big(10)),
        is(new BigFraction(1024)));
    assertThat(BigFractions.pow(new BigFraction(2, 3), big(3)),
        is(new BigFraction(8, 27)));
    assertThat(BigFractions.pow(new BigFraction(-2), big(-3)),
        is(new BigFraction(-1, 8)));
    assertThat(BigFractions.pow(new BigFraction(7), big(0)),
        is(BigFraction.ONE));
    assertThrows(ArithmeticException.class,
        () -> BigFractions.pow(BigFraction.ZERO, big(-1)));
  }

  @Test
  void testRoot() {
    assertThat(BigFractions.root(big(1024), 10), is(big(2)));
    assertThat(BigFractions.root(big(27), 3), is(big(3)));
    assertThat(BigFractions.root(big(26), 3), nullValue());
    assertThat(BigFractions.root(big(0), 5), is(big(0)));
    assertThat(BigFractions.root(new BigFraction(4, 9), 2),
        is(new BigFraction(2, 3)));
    assertThat(BigFractions.root(new BigFraction(2, 9), 2), nullValue());
    final BigInteger large = big(123_456_789L).pow(7);
    assertThat(BigFractions.root(large, 7), is(big(123_456_789L)));
  }

  @Test
  void testFloor() {
    assertThat(BigFractions.floor(new BigFraction(7, 2)), is(big(3)));
    assertThat(BigFractions.floor(new BigFraction(-7, 2)), is(big(-4)));
    assertThat(BigFractions.floor(new BigFraction(-4)), is(big(-4)));
    assertThat(BigFractions.fractionalPart(new BigFraction(-1, 3)),
        is(new BigFraction(2, 3)));
    assertThat(BigFractions.isInteger(new BigFraction(6, 3)), is(true));
  }
}

// End BigFractionsTest.java
