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

import static net.hydromatic.symbolic.TestMatchers.isNode;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Calculator;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

/** Tests the arithmetic methods of {@link AlgCalculators}. */
public class AlgCalculatorsTest {
  private final Calculator real = AlgCalculators.real().freeze();
  private final Calculator complex = AlgCalculators.complex().freeze();

  private final Expr.Symbol x = expr.symbol("x");

  private static Expr.Rational q(long numerator, long denominator) {
    return expr.rational(numerator, denominator);
  }

  private static Expr.Rational n(long value) {
    return expr.integer(value);
  }

  @Test
  void testConstants() {
    assertThat(real.constantValue(Alg.PI), is(Alg.pi()));
    assertThat(real.constantValue("pi"), is(Alg.pi()));
    assertThat(real.constantValue("e"), isNode("e"));
    assertThat(complex.constantValue("i"), is(Alg.i()));
    assertThrows(IllegalArgumentException.class,
        () -> real.constantValue("i"));
  }

  @Test
  void testAddSubtract() {
    assertThat(AlgCalculators.add(real, n(1), n(2)), is(n(3)));
    assertThat(AlgCalculators.add(real, x, x), isNode("mul(2, x)"));
    assertThat(AlgCalculators.add(real, x, n(0)), is(x));
    assertThat(AlgCalculators.subtract(real, x, x), is(n(0)));
    assertThat(AlgCalculators.subtract(real, n(1), q(1, 3)), is(q(2, 3)));
    assertThat(AlgCalculators.negate(real, n(2)), is(n(-2)));
    assertThat(AlgCalculators.negate(real, x), isNode("mul(-1, x)"));
    assertThat(
        AlgCalculators.sum(real, ImmutableList.of(n(1), n(2), n(3))),
        is(n(6)));
    assertThat(AlgCalculators.sum(real, ImmutableList.of()), is(n(0)));
  }

  @Test
  void testMultiplyDivide() {
    assertThat(AlgCalculators.multiply(real, n(2), n(3)), is(n(6)));
    assertThat(AlgCalculators.multiply(real, x, n(2)), isNode("mul(2, x)"));
    assertThat(AlgCalculators.multiply(real, x, n(0)), is(n(0)));
    assertThat(
        AlgCalculators.product(real, ImmutableList.of(n(2), x, n(3))),
        isNode("mul(6, x)"));
    assertThat(AlgCalculators.product(real, ImmutableList.of()), is(n(1)));
    assertThat(AlgCalculators.reciprocal(real, n(4)), is(q(1, 4)));
    assertThat(AlgCalculators.divide(real, n(6), n(4)), is(q(3, 2)));
    assertThat(AlgCalculators.divide(real, x, x), is(n(1)));
    final ArithmeticException e =
        assertThrows(ArithmeticException.class,
            () -> AlgCalculators.divide(real, x, n(0)));
    assertThat(e.getMessage(), is("zero raised to negative power -1"));
  }

  /** Operands are assumed to be reduced; only the new root is reduced. */
  @Test
  void testRootOnly() {
    final Expr.Node eight = Alg.pow(n(2), n(3));
    assertThat(AlgCalculators.multiply(real, n(2), eight),
        isNode("mul(2, pow(2, 3))"));
    assertThat(real.reduce(Alg.mul(n(2), eight)), is(n(16)));
  }

  @Test
  void testPowAndRoots() {
    assertThat(AlgCalculators.pow(real, n(2), n(10)), is(n(1024)));
    assertThat(AlgCalculators.sqrt(real, n(9)), is(n(3)));
    assertThat(AlgCalculators.sqrt(real, q(1, 4)), is(q(1, 2)));
    assertThat(AlgCalculators.nroot(real, n(27), 3), is(n(3)));
    assertThat(AlgCalculators.sqrt(complex, n(-1)), is(Alg.i()));
    assertThrows(ArithmeticException.class,
        () -> AlgCalculators.sqrt(real, n(-1)));
  }

  @Test
  void testTrig() {
    final Expr.Node sixth = Alg.piTimes(new BigFraction(1, 6));
    final Expr.Node quarter = Alg.piTimes(new BigFraction(1, 4));
    assertThat(AlgCalculators.sin(real, Alg.pi()), is(n(0)));
    assertThat(AlgCalculators.sin(real, sixth), is(q(1, 2)));
    assertThat(AlgCalculators.cos(real, Alg.pi()), is(n(-1)));
    assertThat(AlgCalculators.tan(real, quarter), is(n(1)));
    assertThat(AlgCalculators.sin(real, x), isNode("sin(x)"));
  }
}

// End AlgCalculatorsTest.java
