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
package net.hydromatic.symbolic.match;

import static net.hydromatic.symbolic.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.compile.Context;
import net.hydromatic.symbolic.compile.Contexts;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Matcher} and {@link Matchers}. */
public class MatcherTest {
  private final Calculator calculator = new Calculator();
  private final MatchResult empty = MatchResult.empty(calculator);
  private final Context context = Contexts.empty();

  private final Expr.Symbol x = expr.symbol("x");
  private final Expr.Symbol y = expr.symbol("y");
  private final Expr.Rational one = expr.integer(1);

  private @Nullable MatchResult match(Matcher matcher, Expr.Node node) {
    return matcher.match(node, context, empty);
  }

  @Test
  void testAnyAndNothing() {
    assertThat(match(Matchers.any(), x), sameInstance(empty));
    assertThat(match(Matchers.any(), expr.node1("f", x)), sameInstance(empty));
    assertThat(match(Matchers.nothing(), x), nullValue());
  }

  @Test
  void testLeafKinds() {
    assertThat(match(Matchers.anyRational(), one), notNullValue());
    assertThat(match(Matchers.anyRational(), x), nullValue());
    assertThat(match(Matchers.anySymbol(), x), notNullValue());
    assertThat(match(Matchers.anySymbol(), expr.node1("f", x)), nullValue());
  }

  @Test
  void testFixed() {
    final Matcher m = Matchers.fixed(expr.node2("f", x, one));
    assertThat(match(m, expr.node2("f", x, one)), notNullValue());
    assertThat(match(m, expr.node2("f", x, y)), nullValue());
    assertThat(m.isDetermined(context, empty), is(true));
    assertThat(m.determinedNode(context, empty), hasToString("f(x, 1)"));
  }

  @Test
  void testRef() {
    final Matcher m = Matchers.ref("$a");
    final MatchResult r = match(m, x);
    assertThat(r, notNullValue());
    assertThat(r.get("$a"), is(x));
    assertThat(m.refNames(), is(ImmutableSet.of("$a")));
    assertThat(m.isDetermined(context, empty), is(false));
    assertThat(m.isDetermined(context, r), is(true));
    assertThat(m.determinedNode(context, r), is(x));
  }

  /** A reference that occurs twice must match equal nodes. */
  @Test
  void testRefConsistency() {
    final Matcher m =
        Matchers.node2("f", Matchers.ref("$a"), Matchers.ref("$a"));
    assertThat(match(m, expr.node2("f", x, x)), notNullValue());
    assertThat(match(m, expr.node2("f", x, y)), nullValue());
    assertThat(
        match(m, expr.node2("f", expr.node1("g", x), expr.node1("g", x))),
        notNullValue());
  }

  @Test
  void testBind() {
    final MatchResult r = empty.bind("a", x);
    assertThat(r, notNullValue());
    assertThat(r.bind("a", expr.symbol("x")), sameInstance(r));
    assertThat(r.bind("a", y), nullValue());
    assertThat(empty.bindings, aMapWithSize(0));
    assertThat(r.substitute(expr.node2("f", expr.symbol("a"), y)),
        hasToString("f(x, y)"));
  }

  @Test
  void testNamed() {
    final Matcher m = Matchers.named(Matchers.anyRational(), "n");
    final MatchResult r = match(m, expr.integer(7));
    assertThat(r, notNullValue());
    assertThat(r.get("n"), hasToString("7"));
    assertThat(match(m, x), nullValue());
    assertThat(Matchers.unwrap(m), sameInstance(Matchers.anyRational()));
  }

  @Test
  void testPreconditionAndPostcondition() {
    final int[] calls = {0};
    final Matcher pre =
        Matchers.withPrecondition(Matchers.ref("$a"),
            (node, ctx, result) -> {
              ++calls[0];
              return node.isLeaf();
            });
    assertThat(match(pre, x), notNullValue());
    assertThat(match(pre, expr.node1("f", x)), nullValue());
    assertThat(calls[0], is(2));

    // The postcondition sees the bindings made by the inner matcher.
    final Matcher post =
        Matchers.withPostcondition(Matchers.ref("$a"),
            (node, ctx, result) -> x.equals(result.get("$a")));
    assertThat(match(post, x), notNullValue());
    assertThat(match(post, y), nullValue());
  }

  @Test
  void testHead() {
    final Matcher m = Matchers.head("f");
    assertThat(match(m, expr.node1("f", x)), notNullValue());
    assertThat(match(m, expr.nodeN("f", x, y, x, y)), notNullValue());
    assertThat(match(m, expr.node1("g", x)), nullValue());
    assertThat(match(m, x), nullValue());
  }

  @Test
  void testOrdered() {
    final Matcher m =
        Matchers.node3("f", Matchers.ref("$a"), Matchers.anyRational(),
            Matchers.fixed(y));
    final MatchResult r = match(m, expr.node3("f", x, one, y));
    assertThat(r, notNullValue());
    assertThat(r.get("$a"), is(x));
    assertThat(match(m, expr.node3("f", x, y, y)), nullValue());
    assertThat(match(m, expr.node3("g", x, one, y)), nullValue());
    // Same head and children, but n-ary
    assertThat(match(m, expr.nodeN("f", x, one, y)), nullValue());

    final Matcher n =
        Matchers.nodeN("f", ImmutableList.of(Matchers.any(), Matchers.any()));
    assertThat(match(n, expr.nodeN("f", x, y)), notNullValue());
    assertThat(match(n, expr.nodeN("f", x, y, x)), nullValue());
    // Children of an ordered matcher must be in order.
    final Matcher n2 =
        Matchers.nodeN("f",
            ImmutableList.of(Matchers.fixed(y), Matchers.fixed(x)));
    assertThat(match(n2, expr.nodeN("f", x, y)), nullValue());
  }

  @Test
  void testDetermined() {
    final Matcher m =
        Matchers.node2("f", Matchers.ref("$a"), Matchers.fixed(one));
    assertThat(m.isDetermined(context, empty), is(false));
    assertThat(m.determinedNode(context, empty), nullValue());
    final MatchResult r = empty.bind("$a", x);
    assertThat(r, notNullValue());
    assertThat(m.isDetermined(context, r), is(true));
    assertThat(m.determinedNode(context, r), hasToString("f(x, 1)"));
  }
}

// End MatcherTest.java
