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
import static net.hydromatic.symbolic.util.Static.anyMatch;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import org.apache.commons.math3.fraction.BigFraction;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Symbols and expression builders for elementary algebra. */
public abstract class Alg {
  private Alg() {}

  public static final String ADD = "add";
  public static final String MUL = "mul";
  public static final String POW = "pow";
  public static final String SIN = "sin";
  public static final String COS = "cos";
  public static final String TAN = "tan";
  public static final String SUM = "sum";
  public static final String BELONGS = "belongs";
  public static final String INT_RANGE = "intRange";

  /** Name of the constant π. */
  public static final String PI = "π";
  /** Name of the constant e, the base of natural logarithms. */
  public static final String E = "e";
  /** Name of the imaginary unit. */
  public static final String I = "i";

  public static final Expr.Rational ZERO = expr.integer(0);
  public static final Expr.Rational ONE = expr.integer(1);
  public static final Expr.Rational MINUS_ONE = expr.integer(-1);
  public static final Expr.Rational HALF = expr.rational(1, 2);

  public static Expr.Symbol pi() {
    return expr.symbol(PI);
  }

  public static Expr.Symbol i() {
    return expr.symbol(I);
  }

  public static Expr.NodeN add(Expr.Node... operands) {
    return expr.nodeN(ADD, operands);
  }

  public static Expr.NodeN add(List<? extends Expr.Node> operands) {
    return expr.nodeN(ADD, operands);
  }

  public static Expr.NodeN mul(Expr.Node... operands) {
    return expr.nodeN(MUL, operands);
  }

  public static Expr.NodeN mul(List<? extends Expr.Node> operands) {
    return expr.nodeN(MUL, operands);
  }

  public static Expr.Node2 pow(Expr.Node base, Expr.Node exponent) {
    return expr.node2(POW, base, exponent);
  }

  public static Expr.Node1 sin(Expr.Node x) {
    return expr.node1(SIN, x);
  }

  public static Expr.Node1 cos(Expr.Node x) {
    return expr.node1(COS, x);
  }

  public static Expr.Node1 tan(Expr.Node x) {
    return expr.node1(TAN, x);
  }

  /** Returns {@code -x}, as {@code mul(-1, x)}. */
  public static Expr.NodeN neg(Expr.Node x) {
    return mul(MINUS_ONE, x);
  }

  /** Returns {@code x - y}. */
  public static Expr.NodeN sub(Expr.Node x, Expr.Node y) {
    return add(x, neg(y));
  }

  /** Returns {@code x / y}, as {@code mul(x, pow(y, -1))}. */
  public static Expr.NodeN div(Expr.Node x, Expr.Node y) {
    return mul(x, pow(y, MINUS_ONE));
  }

  /** Returns the square root of {@code x}. */
  public static Expr.Node2 sqrt(Expr.Node x) {
    return pow(x, HALF);
  }

  /** Returns the multiple {@code r·π}. */
  public static Expr.Node piTimes(BigFraction r) {
    return mul(expr.rational(r), pi());
  }

  /** Returns {@code sum(var, condition, clause)}. */
  public static Expr.Node3 sum(
      Expr.Node variables, Expr.Node condition, Expr.Node clause) {
    return expr.node3(SUM, variables, condition, clause);
  }

  /** Returns {@code belongs(x, set)}. */
  public static Expr.Node2 belongs(Expr.Node x, Expr.Node set) {
    return expr.node2(BELONGS, x, set);
  }

  /** Returns the set of integers from {@code lo} to {@code hi}. */
  public static Expr.Node2 intRange(Expr.Node lo, Expr.Node hi) {
    return expr.node2(INT_RANGE, lo, hi);
  }

  /** Returns the value of a rational leaf, or null. */
  static @Nullable BigFraction rational(Expr.Node node) {
    return node instanceof Expr.Rational ? ((Expr.Rational) node).value : null;
  }

  /** Returns whether a node is a branch with a given head. */
  static boolean isCall(Expr.Node node, String head) {
    return !node.isLeaf() && node.head().equals(head);
  }

  /**
   * Builds an n-ary node from operands; if there is one operand, returns it,
   * and if there are none, returns {@code empty}.
   */
  static Expr.Node nary(
      String head, List<Expr.Node> operands, Expr.Node empty) {
    switch (operands.size()) {
      case 0:
        return empty;
      case 1:
        return operands.get(0);
      default:
        return expr.nodeN(head, ImmutableList.copyOf(operands));
    }
  }

  /**
   * If some operands of an n-ary node are nodes with the same head, returns
   * the operands with those nodes' operands spliced in; otherwise null.
   */
  static @Nullable List<Expr.Node> flatten(Expr.Node node) {
    final String head = node.head();
    if (!anyMatch(node.children(), child -> isCall(child, head))) {
      return null;
    }
    final List<Expr.Node> operands = new ArrayList<>();
    for (Expr.Node child : node.children()) {
      if (isCall(child, head)) {
        operands.addAll(child.children());
      } else {
        operands.add(child);
      }
    }
    return operands;
  }

  /** If the operands are not in canonical order, returns them sorted. */
  static @Nullable List<Expr.Node> sort(Expr.Node node) {
    final List<Expr.Node> children = node.children();
    if (Expr.ORDERING.isOrdered(children)) {
      return null;
    }
    return Expr.ORDERING.sortedCopy(children);
  }
}

// End Alg.java
