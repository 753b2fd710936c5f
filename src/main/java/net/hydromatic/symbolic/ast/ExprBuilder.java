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
package net.hydromatic.symbolic.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;

/** Builds expression trees. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Prefix of the name of a symbol that is a reference in a template. */
  public static final String REF_PREFIX = "$";

  /** Head of a template node that names the node matched by its child. */
  public static final String NAMED = "Named";

  /** Head of a template node that attaches a condition to its child. */
  public static final String WHERE = "Where";

  /** Head of a node that groups qualified variables. */
  public static final String TUPLE = "tuple";

  /** Result of an operation that has no defined value, such as tan(π/2). */
  public static final Expr.Other UNDEFINED = new Expr.Other("undefined");

  /** Truth value of a satisfied condition. */
  public static final Expr.Symbol TRUE = new Expr.Symbol("true");

  /** Truth value of an unsatisfied condition. */
  public static final Expr.Symbol FALSE = new Expr.Symbol("false");

  /** Creates a rational leaf. */
  public Expr.Rational rational(BigFraction value) {
    return new Expr.Rational(value);
  }

  /** Creates a rational leaf from a numerator and denominator. */
  public Expr.Rational rational(long numerator, long denominator) {
    return new Expr.Rational(new BigFraction(numerator, denominator));
  }

  /** Creates an integer leaf. */
  public Expr.Rational integer(long value) {
    return new Expr.Rational(new BigFraction(value));
  }

  /** Creates an integer leaf. */
  public Expr.Rational integer(BigInteger value) {
    return new Expr.Rational(new BigFraction(value));
  }

  /** Creates a symbol leaf. */
  public Expr.Symbol symbol(String name) {
    return new Expr.Symbol(name);
  }

  /**
   * Creates a reference symbol. If {@code name} does not already start with
   * "$", adds the prefix.
   */
  public Expr.Symbol ref(String name) {
    return new Expr.Symbol(
        name.startsWith(REF_PREFIX) ? name : REF_PREFIX + name);
  }

  /** Returns whether a node is a reference symbol. */
  public boolean isRef(Expr.Node node) {
    return node instanceof Expr.Symbol
        && ((Expr.Symbol) node).name.startsWith(REF_PREFIX);
  }

  /** Creates an opaque leaf. */
  public Expr.Other other(String tag) {
    return tag.equals(UNDEFINED.tag) ? UNDEFINED : new Expr.Other(tag);
  }

  /** Creates a branch with one child. */
  public Expr.Node1 node1(String head, Expr.Node child) {
    return new Expr.Node1(head, child);
  }

  /** Creates a branch with two children. */
  public Expr.Node2 node2(String head, Expr.Node first, Expr.Node second) {
    return new Expr.Node2(head, first, second);
  }

  /** Creates a branch with three children. */
  public Expr.Node3 node3(
      String head, Expr.Node first, Expr.Node second, Expr.Node third) {
    return new Expr.Node3(head, first, second, third);
  }

  /**
   * Creates a branch with a variable number of children.
   *
   * @throws IllegalArgumentException if {@code children} is empty
   */
  public Expr.NodeN nodeN(String head, List<? extends Expr.Node> children) {
    if (children.isEmpty()) {
      throw new IllegalArgumentException(
          "node '" + head + "' must have at least one child");
    }
    return new Expr.NodeN(head, ImmutableList.copyOf(children));
  }

  /** Creates a branch with a variable number of children. */
  public Expr.NodeN nodeN(String head, Expr.Node... children) {
    return nodeN(head, ImmutableList.copyOf(children));
  }

  /**
   * Creates a branch whose kind is determined by the number of children:
   * {@link Kind#NODE1}, {@link Kind#NODE2} or {@link Kind#NODE3} for one to
   * three children, {@link Kind#NODEN} for more.
   */
  public Expr.Branch call(String head, List<? extends Expr.Node> children) {
    switch (children.size()) {
      case 1:
        return node1(head, children.get(0));
      case 2:
        return node2(head, children.get(0), children.get(1));
      case 3:
        return node3(head, children.get(0), children.get(1), children.get(2));
      default:
        return nodeN(head, children);
    }
  }

  /** Creates a branch of a given kind. */
  public Expr.Branch branch(
      Kind kind, String head, List<? extends Expr.Node> children) {
    if (kind == Kind.NODEN) {
      return nodeN(head, children);
    }
    if (kind.arity != children.size()) {
      throw new IllegalArgumentException("kind " + kind + " requires "
          + kind.arity + " children, got " + children.size());
    }
    return call(head, children);
  }

  /** Creates a tuple, used to declare the variables of a qualifier. */
  public Expr.NodeN tuple(Expr.Node... children) {
    return nodeN(TUPLE, children);
  }

  /**
   * Creates a template node that matches what {@code child} matches, and
   * binds the matched node to {@code name}.
   */
  public Expr.Node2 named(Expr.Node child, String name) {
    return node2(NAMED, child, ref(name));
  }

  /**
   * Creates a template node that matches what {@code child} matches, provided
   * that {@code condition}, with references substituted, reduces to
   * {@link #TRUE}.
   */
  public Expr.Node2 where(Expr.Node child, Expr.Node condition) {
    return node2(WHERE, child, condition);
  }
}

// End ExprBuilder.java
