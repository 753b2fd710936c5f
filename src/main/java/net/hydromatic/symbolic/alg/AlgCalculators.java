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

import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.compile.Prop;
import net.hydromatic.symbolic.compile.QualifierDef;

/**
 * Creates calculators for elementary algebra.
 *
 * <p>The calculators are returned unfrozen, so that callers can register
 * further rules before calling {@link Calculator#freeze()}.
 *
 * <p>The arithmetic methods, such as {@link #add(Calculator, Expr.Node,
 * Expr.Node)}, build a node from operands that are assumed to be reduced
 * already, and reduce only the new root.
 */
public abstract class AlgCalculators {
  private AlgCalculators() {}

  /** Creates a calculator that works over the real numbers. */
  public static Calculator real() {
    return create(true);
  }

  /** Creates a calculator that works over the complex numbers. */
  public static Calculator complex() {
    return create(false);
  }

  /** Creates a calculator. */
  public static Calculator create(boolean forceReal) {
    final Calculator calculator = new Calculator();
    calculator.set(Prop.FORCE_REAL, forceReal);
    calculator.registerCommutative(Alg.ADD);
    calculator.registerCommutative(Alg.MUL);
    calculator.registerConstant(Alg.PI, Alg.pi());
    calculator.registerConstant("pi", Alg.pi());
    calculator.registerConstant(Alg.E, expr.symbol(Alg.E));
    if (!forceReal) {
      calculator.registerConstant(Alg.I, Alg.i());
    }
    calculator.registerQualifier(QualifierDef.of(Alg.SUM));
    calculator.registerRuleSet(SumRules.RULES);
    calculator.registerRuleSet(ProductRules.RULES);
    calculator.registerRuleSet(PowerRules.RULES);
    calculator.registerRuleSet(TrigRules.RULES);
    return calculator;
  }

  // Arithmetic

  /** Returns {@code x + y}. */
  public static Expr.Node add(Calculator calculator, Expr.Node x,
      Expr.Node y) {
    return calculator.reduce(Alg.add(x, y), 0);
  }

  /** Returns the sum of a list of operands; 0 if the list is empty. */
  public static Expr.Node sum(Calculator calculator,
      List<? extends Expr.Node> operands) {
    return operands.isEmpty()
        ? Alg.ZERO
        : calculator.reduce(Alg.add(operands), 0);
  }

  /** Returns {@code -x}. */
  public static Expr.Node negate(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.neg(x), 0);
  }

  /** Returns {@code x - y}. */
  public static Expr.Node subtract(Calculator calculator, Expr.Node x,
      Expr.Node y) {
    return add(calculator, x, negate(calculator, y));
  }

  /** Returns {@code x * y}. */
  public static Expr.Node multiply(Calculator calculator, Expr.Node x,
      Expr.Node y) {
    return calculator.reduce(Alg.mul(x, y), 0);
  }

  /** Returns the product of a list of operands; 1 if the list is empty. */
  public static Expr.Node product(Calculator calculator,
      List<? extends Expr.Node> operands) {
    return operands.isEmpty()
        ? Alg.ONE
        : calculator.reduce(Alg.mul(operands), 0);
  }

  /** Returns {@code 1 / x}. */
  public static Expr.Node reciprocal(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.pow(x, Alg.MINUS_ONE), 0);
  }

  /**
   * Returns {@code x / y}. Reduces the reciprocal of {@code y} as well as the
   * product.
   *
   * @throws ArithmeticException if {@code y} is zero
   */
  public static Expr.Node divide(Calculator calculator, Expr.Node x,
      Expr.Node y) {
    return calculator.reduce(Alg.div(x, y), 1);
  }

  /** Returns {@code base} raised to the power {@code exponent}. */
  public static Expr.Node pow(Calculator calculator, Expr.Node base,
      Expr.Node exponent) {
    return calculator.reduce(Alg.pow(base, exponent), 0);
  }

  /** Returns the square root of {@code x}. */
  public static Expr.Node sqrt(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.sqrt(x), 0);
  }

  /** Returns the {@code n}th root of {@code x}. */
  public static Expr.Node nroot(Calculator calculator, Expr.Node x, int n) {
    return pow(calculator, x, expr.rational(1, n));
  }

  /** Returns {@code sin(x)}. */
  public static Expr.Node sin(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.sin(x), 0);
  }

  /** Returns {@code cos(x)}. */
  public static Expr.Node cos(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.cos(x), 0);
  }

  /** Returns {@code tan(x)}. */
  public static Expr.Node tan(Calculator calculator, Expr.Node x) {
    return calculator.reduce(Alg.tan(x), 0);
  }
}

// End AlgCalculators.java
