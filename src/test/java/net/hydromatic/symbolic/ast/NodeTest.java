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

import static net.hydromatic.symbolic.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

/** Tests for {@link Expr} and {@link ExprBuilder}. */
public class NodeTest {
  private final Expr.Symbol x = expr.symbol("x");
  private final Expr.Symbol y = expr.symbol("y");

  @Test
  void testKinds() {
    assertThat(expr.integer(3).kind, is(Kind.RATIONAL));
    assertThat(x.kind, is(Kind.SYMBOL));
    assertThat(ExprBuilder.UNDEFINED.kind, is(Kind.OTHER));
    assertThat(expr.node1("f", x).kind, is(Kind.NODE1));
    assertThat(expr.node2("f", x, y).kind, is(Kind.NODE2));
    assertThat(expr.node3("f", x, y, x).kind, is(Kind.NODE3));
    assertThat(expr.nodeN("f", x).kind, is(Kind.NODEN));
    assertThat(expr.call("f", ImmutableList.of(x, y)).kind, is(Kind.NODE2));
    assertThat(expr.call("f", ImmutableList.of(x, y, x, y)).kind,
        is(Kind.NODEN));
  }

  @Test
  void testOther() {
    assertThat(expr.other("undefined"), sameInstance(ExprBuilder.UNDEFINED));
    final Expr.Other tag = expr.other("tag");
    assertThat(tag.kind, is(Kind.OTHER));
    assertThat(tag, hasToString("tag"));
    assertThat(tag, is(expr.other("tag")));
    assertThat(tag.signature(), is(Signature.OTHER));
  }

  @Test
  void testNodeNRequiresChildren() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> expr.nodeN("f", ImmutableList.of()));
    assertThat(e.getMessage(), is("node 'f' must have at least one child"));
  }

  @Test
  void testRational() {
    assertThat(expr.rational(2, 4), is(expr.rational(1, 2)));
    assertThat(expr.rational(2, 4), hasToString("1/2"));
    assertThat(expr.rational(-6, 3), hasToString("-2"));
    assertThat(expr.rational(-6, 3).isInteger(), is(true));
    assertThat(expr.rational(1, 3).isInteger(), is(false));
  }

  @Test
  void testUnparse() {
    final Expr.Node e =
        expr.nodeN("add", x, expr.node2("pow", y, expr.rational(1, 2)));
    assertThat(e, hasToString("add(x, pow(y, 1/2))"));
    assertThat(e.treeString(),
        is("add\n"
            + "|  x\n"
            + "|  pow\n"
            + "|  |  y\n"
            + "|  |  1/2\n"));
  }

  @Test
  void testEquality() {
    final Expr.Node e1 = expr.node2("f", x, expr.integer(1));
    final Expr.Node e2 = expr.node2("f", expr.symbol("x"), expr.integer(1));
    assertThat(e1.deepEquals(e2), is(true));
    assertThat(e1.hashCode(), is(e2.hashCode()));
    // Same head and children, different kind
    assertThat(e1.deepEquals(expr.nodeN("f", x, expr.integer(1))), is(false));
    assertThat(e1.deepEquals(expr.node2("g", x, expr.integer(1))), is(false));
  }

  @Test
  void testOrdering() {
    final List<Expr.Node> list =
        new ArrayList<>(
            ImmutableList.of(expr.node1("sin", x), y, expr.integer(2),
                ExprBuilder.UNDEFINED, x, expr.rational(-1, 2)));
    list.sort(Expr.ORDERING);
    assertThat(list, hasToString("[undefined, -1/2, 2, x, y, sin(x)]"));
    assertThat(
        Expr.ORDERING.compare(expr.nodeN("f", x), expr.nodeN("f", x, y)),
        lessThan(0));
  }

  @Test
  void testWithChildrenSharesUnchanged() {
    final Expr.Branch e = expr.node2("f", x, y);
    assertThat(e.withChildren(ImmutableList.of(x, y)), sameInstance(e));
    assertThat(e.withChildren(ImmutableList.of(y, x)), hasToString("f(y, x)"));
  }

  @Test
  void testTraverse() {
    // f(g(x), y)
    final Expr.Node e = expr.node2("f", expr.node1("g", x), y);
    final StringBuilder b = new StringBuilder();
    e.traverse(n -> b.append(n.isLeaf() ? n.toString() : n.head()).append(' '));
    assertThat(b, hasToString("f g x y "));

    b.setLength(0);
    e.traversePostOrder(
        n -> b.append(n.isLeaf() ? n.toString() : n.head()).append(' '));
    assertThat(b, hasToString("x g y f "));

    b.setLength(0);
    e.traverseLeveled(1, 0,
        (n, level) ->
            b.append(n.isLeaf() ? n.toString() : n.head())
                .append(level).append(' '));
    assertThat(b, hasToString("f0 g1 y1 "));

    b.setLength(0);
    e.traversePostOrderLeveled(Integer.MAX_VALUE, 0,
        (n, level) ->
            b.append(n.isLeaf() ? n.toString() : n.head())
                .append(level).append(' '));
    assertThat(b, hasToString("x2 g1 y1 f0 "));

    final int[] count = {0};
    e.traverse(0, n -> ++count[0]);
    assertThat(count[0], is(1));
  }

  @Test
  void testRecurMap() {
    final Expr.Node e = expr.node2("f", expr.node1("g", x), y);
    final Expr.Node e2 =
        e.recurMap(Integer.MAX_VALUE, n -> n.equals(x) ? expr.integer(1) : n);
    assertThat(e2, hasToString("f(g(1), y)"));

    // Unchanged subtrees are shared.
    final Expr.Node e3 = e.recurMap(Integer.MAX_VALUE, n -> n);
    assertThat(e3, sameInstance(e));

    // At depth 1, only the root and its children are mapped.
    final Expr.Node e4 =
        e.recurMap(1, n -> n.equals(x) || n.equals(y) ? expr.integer(1) : n);
    assertThat(e4, hasToString("f(g(x), 1)"));
  }

  @Test
  void testMapSymbol() {
    final Expr.Node e = expr.node2("f", expr.node1("g", x), expr.integer(3));
    assertThat(e.mapSymbol(s -> s.toUpperCase(Locale.ROOT)),
        hasToString("F(G(X), 3)"));
  }

  @Test
  void testRef() {
    assertThat(expr.ref("x"), hasToString("$x"));
    assertThat(expr.ref("$x"), hasToString("$x"));
    assertThat(expr.isRef(expr.ref("x")), is(true));
    assertThat(expr.isRef(x), is(false));
    assertThat(expr.isRef(expr.integer(1)), is(false));
  }

  @Test
  void testSignature() {
    assertThat(x.signature(), is(Signature.SYMBOL));
    assertThat(expr.integer(1).signature(), is(Signature.RATIONAL));
    assertThat(expr.node2("f", x, y).signature(),
        is(Signature.of(Kind.NODE2, "f")));
    assertThat(expr.node2("f", x, y).signature()
            .equals(expr.nodeN("f", x, y).signature()),
        is(false));
  }
}

// End NodeTest.java
