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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.ast.Signature;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.compile.Contexts;
import net.hydromatic.symbolic.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link TreeDispatcher}. */
public class TreeDispatcherTest {
  private final Calculator calculator = new Calculator();

  private final Expr.Symbol x = expr.symbol("x");
  private final Expr.Symbol y = expr.symbol("y");

  /** Wraps a matcher so that we can count how often it is invoked. */
  private static Matcher counting(Matcher matcher, AtomicInteger counter) {
    return Matchers.withPrecondition(matcher,
        (node, context, result) -> {
          counter.incrementAndGet();
          return true;
        });
  }

  private List<String> dispatch(TreeDispatcher<String> dispatcher,
      Expr.Node node) {
    final List<String> list = new ArrayList<>();
    dispatcher.dispatch(node, Contexts.empty(), calculator,
        (value, result) -> list.add(value));
    return list;
  }

  @Test
  void testSignatures() {
    assertThat(TreeDispatcher.signatures(Matchers.fixed(x)),
        is(ImmutableList.of(Signature.SYMBOL)));
    assertThat(TreeDispatcher.signatures(Matchers.anyRational()),
        is(ImmutableList.of(Signature.RATIONAL)));
    assertThat(
        TreeDispatcher.signatures(Matchers.node1("f", Matchers.any())),
        is(ImmutableList.of(Signature.of(Kind.NODE1, "f"))));
    assertThat(TreeDispatcher.signatures(Matchers.head("f")),
        hasSize(Kind.BRANCHES.size()));
    assertThat(TreeDispatcher.signatures(Matchers.any()), nullValue());
    assertThat(TreeDispatcher.signatures(Matchers.ref("$a")), nullValue());
  }

  /** A matcher filed under a different signature is never invoked. */
  @Test
  void testMatchersOutsideBucketAreNotInvoked() {
    final AtomicInteger fCount = new AtomicInteger();
    final AtomicInteger gCount = new AtomicInteger();
    final AtomicInteger anyCount = new AtomicInteger();
    final TreeDispatcher<String> dispatcher = new TreeDispatcher<>();
    dispatcher.register(
        counting(Matchers.node1("f", Matchers.any()), fCount), "f");
    dispatcher.register(
        counting(Matchers.node1("g", Matchers.any()), gCount), "g");
    dispatcher.register(counting(Matchers.any(), anyCount), "any");
    assertThat(dispatcher.size(), is(3));

    assertThat(dispatch(dispatcher, expr.node1("f", x)),
        is(ImmutableList.of("f", "any")));
    assertThat(fCount.get(), is(1));
    assertThat(gCount.get(), is(0));
    assertThat(anyCount.get(), is(1));

    // Same head, different kind
    assertThat(dispatch(dispatcher, expr.node2("f", x, y)),
        is(ImmutableList.of("any")));
    assertThat(fCount.get(), is(1));
    assertThat(anyCount.get(), is(2));
  }

  @Test
  void testOrder() {
    final TreeDispatcher<String> dispatcher = new TreeDispatcher<>();
    dispatcher.register(Matchers.any(), "any");
    dispatcher.register(Matchers.head("f"), "head");
    dispatcher.register(Matchers.node2("f", Matchers.any(), Matchers.any()),
        "node2");
    dispatcher.register(Matchers.nothing(), "nothing");
    assertThat(dispatcher.size(), is(3));

    // Signature bucket first, in order of registration, then wildcards.
    assertThat(dispatch(dispatcher, expr.node2("f", x, y)),
        is(ImmutableList.of("head", "node2", "any")));
    assertThat(dispatch(dispatcher, expr.nodeN("f", x, y, x, y)),
        is(ImmutableList.of("head", "any")));
    assertThat(dispatch(dispatcher, x), is(ImmutableList.of("any")));
  }

  @Test
  void testDispatchUntil() {
    final TreeDispatcher<String> dispatcher = new TreeDispatcher<>();
    dispatcher.register(Matchers.anySymbol(), "a");
    dispatcher.register(Matchers.fixed(x), "b");
    dispatcher.register(Matchers.any(), "c");
    final List<String> seen = new ArrayList<>();
    final boolean found =
        dispatcher.dispatchUntil(x, Contexts.empty(), calculator,
            (value, result) -> {
              seen.add(value);
              return value.equals("b");
            });
    assertThat(found, is(true));
    assertThat(seen, is(ImmutableList.of("a", "b")));
  }

  @Test
  void testDispatchToList() {
    final TreeDispatcher<String> dispatcher = new TreeDispatcher<>();
    dispatcher.register(
        Matchers.node2("pow", Matchers.ref("$b"), Matchers.ref("$e")), "pow");
    final List<Pair<String, MatchResult>> list =
        dispatcher.dispatchToList(
            expr.node2("pow", x, expr.integer(2)), Contexts.empty(),
            calculator);
    assertThat(list, hasSize(1));
    assertThat(list.get(0).left, is("pow"));
    assertThat(list.get(0).right.get("$e"), hasToString("2"));
  }

  @Test
  void testFreeze() {
    final TreeDispatcher<String> dispatcher = new TreeDispatcher<>();
    assertThat(dispatcher.isEmpty(), is(true));
    dispatcher.freeze();
    assertThrows(IllegalStateException.class,
        () -> dispatcher.register(Matchers.any(), "any"));
  }
}

// End TreeDispatcherTest.java
