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
package net.hydromatic.symbolic.compile;

import static net.hydromatic.symbolic.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.ExprBuilder;
import net.hydromatic.symbolic.match.Matchers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Calculator}. */
public class CalculatorTest {
  private final Expr.Symbol x = expr.symbol("x");
  private final Expr.Symbol y = expr.symbol("y");

  /** Rule {@code f(a) → a}. */
  private static final RuleSet DROP_F =
      RuleSet.builder("dropF")
          .template("dropF", expr.node1("f", expr.ref("a")), expr.ref("a"))
          .build();

  private static Expr.Node f(Expr.Node node) {
    return expr.node1("f", node);
  }

  private static Expr.Node g(Expr.Node node) {
    return expr.node1("g", node);
  }

  @Test
  void testReduce() {
    final Calculator calculator = new Calculator().registerRuleSet(DROP_F);
    assertThat(calculator.rules(), hasSize(1));
    assertThat(calculator.reduce(f(f(f(y)))), is(y));
    assertThat(calculator.reduce(g(f(y))), hasToString("g(y)"));
    assertThat(calculator.reduce(x), is(x));
  }

  /** Rules apply only down to the requested depth. */
  @Test
  void testReduceDepth() {
    final Calculator calculator = new Calculator().registerRuleSet(DROP_F);
    final Expr.Node e = g(g(f(y)));
    assertThat(calculator.reduce(e, 0), is(e));
    assertThat(calculator.reduce(e, 1), is(e));
    assertThat(calculator.reduce(e, 2), hasToString("g(g(y))"));

    calculator.set(Prop.DEFAULT_DEPTH, 1);
    assertThat(calculator.reduce(e), is(e));
  }

  /** A rule with a maximum depth applies only near the root. */
  @Test
  void testRuleMaxDepth() {
    final Rule rule =
        Rules.of("dropF", Matchers.node1("f", Matchers.ref("$a")),
            m -> m.get("$a"), 0);
    final Calculator calculator = new Calculator().registerRule(rule);
    assertThat(calculator.reduce(f(f(y))), is(y));
    assertThat(calculator.reduce(g(f(y))), hasToString("g(f(y))"));
    assertThat(calculator.reduce(g(f(y)), 5), hasToString("g(f(y))"));
    assertThrows(IllegalArgumentException.class, () -> rule.withMaxDepth(-1));
  }

  /** Each pass rewrites children before their parent. */
  @Test
  void testPostOrder() {
    final List<String> events = new ArrayList<>();
    final Calculator calculator =
        new Calculator()
            .registerRuleSet(DROP_F)
            .withTracer(
                Tracers.nullTracer()
                    .withPassHandler((pass, node) ->
                        events.add("pass " + pass + " " + node))
                    .withRewriteHandler((rule, before, after) ->
                        events.add(before + " -> " + after)));
    assertThat(calculator.reduce(g(f(f(y)))), hasToString("g(y)"));
    assertThat(events,
        is(
            ImmutableList.of("pass 0 g(f(f(y)))",
                "f(y) -> y",
                "f(y) -> y",
                "pass 1 g(y)")));
  }

  @Test
  void testPassLimit() {
    // g(a) → h(a) and h(a) → g(a) never reach a fixed point.
    final RuleSet flip =
        RuleSet.builder("flip")
            .template("gh", g(expr.ref("a")), expr.node1("h", expr.ref("a")))
            .template("hg", expr.node1("h", expr.ref("a")), g(expr.ref("a")))
            .build();
    final List<String> events = new ArrayList<>();
    final Calculator calculator =
        new Calculator()
            .registerRuleSet(flip)
            .set(Prop.MAX_PASSES, 5)
            .withTracer(
                Tracers.nullTracer()
                    .withPassLimitHandler((limit, node) ->
                        events.add(limit + " " + node)));
    assertThat(calculator.reduce(g(y)), hasToString("h(y)"));
    assertThat(events, is(ImmutableList.of("5 h(y)")));

    calculator.setLenient("onPassLimit", "fail");
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> calculator.reduce(g(y)));
    assertThat(e.getMessage(),
        is("no fixed point after 5 passes; last expression h(y)"));
  }

  @Test
  void testFreeze() {
    final Calculator calculator = new Calculator().freeze();
    assertThat(calculator.isFrozen(), is(true));
    assertThrows(IllegalStateException.class,
        () -> calculator.registerRuleSet(DROP_F));
    assertThrows(IllegalStateException.class,
        () -> calculator.registerCommutative("add"));
    assertThrows(IllegalStateException.class,
        () -> calculator.set(Prop.MAX_PASSES, 10));
    assertThrows(IllegalStateException.class,
        () -> calculator.registerConstant("π", expr.symbol("π")));
    // Reduction is still allowed.
    assertThat(calculator.reduce(f(y)), hasToString("f(y)"));
  }

  /**
   * A node that was reduced before a rule was registered is reduced again
   * afterwards.
   */
  @Test
  void testReducedMarkIsStale() {
    final Calculator calculator = new Calculator();
    final Expr.Node e = f(y);
    assertThat(calculator.reduce(e), is(e));
    assertThat(calculator.metaTable().get(e, Rewriter.REDUCED),
        notNullValue());
    calculator.registerRuleSet(DROP_F);
    assertThat(calculator.reduce(e), is(y));
  }

  @Test
  void testConstants() {
    final Calculator calculator =
        new Calculator().registerConstant("π", expr.symbol("π"));
    assertThat(calculator.isConstant("π"), is(true));
    assertThat(calculator.isConstant("x"), is(false));
    assertThat(calculator.constantValue("π"), hasToString("π"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> calculator.constantValue("x"));
    assertThat(e.getMessage(), is("unknown constant 'x'"));
  }

  /** Variables bound by a qualifier, and constants, are not free. */
  @Test
  void testFreeVariables() {
    final Calculator calculator =
        new Calculator()
            .registerQualifier(QualifierDef.of("sum"))
            .registerConstant("π", expr.symbol("π"));
    final Expr.Symbol i = expr.symbol("i");
    final Expr.Node e =
        expr.node3("sum", expr.tuple(i),
            expr.node2("belongs", i,
                expr.node2("intRange", expr.integer(1), x)),
            expr.nodeN("add", i, y, expr.symbol("π")));
    assertThat(calculator.freeVariablesOf(e), is(ImmutableSet.of(x, y)));

    // Outside the sum, "i" is free.
    assertThat(calculator.freeVariablesOf(expr.nodeN("add", e, i)),
        is(ImmutableSet.of(x, y, i)));
  }

  @Test
  void testTraverseWithContext() {
    final Calculator calculator =
        new Calculator()
            .registerQualifier(QualifierDef.of("forall", 0,
                ImmutableList.of(2)));
    final Expr.Symbol i = expr.symbol("i");
    final Expr.Node e = expr.node3("forall", i, g(i), f(i));
    final List<String> list = new ArrayList<>();
    calculator.traverseWithContext(e, Contexts.empty(), Integer.MAX_VALUE,
        (node, context) -> list.add(node + " " + context.asString()));
    assertThat(list,
        is(
            ImmutableList.of("forall(i, g(i), f(i)) []",
                "i []",
                "g(i) []",
                "i []",
                "f(i) [i]",
                "i [i]")));

    final int[] count = {0};
    calculator.traverseWithContext(e, Contexts.empty(), 0,
        (node, context) -> ++count[0]);
    assertThat(count[0], is(1));
  }

  /** A rule whose pattern has a condition. */
  @Test
  void testCondition() {
    // pos(r) → true if r > 0, false otherwise
    final Rule pos =
        Rules.of("pos",
            Matchers.node1("pos", Matchers.named(Matchers.anyRational(), "r")),
            m -> m.get("r", Expr.Rational.class).signum() > 0
                ? ExprBuilder.TRUE
                : ExprBuilder.FALSE);
    final Calculator calculator = new Calculator().registerRule(pos);
    // abs(a) → a where pos(a)
    final Rule abs =
        Rules.fromTemplate(calculator, "abs",
            expr.where(expr.node1("abs", expr.ref("a")),
                expr.node1("pos", expr.ref("a"))),
            expr.ref("a"));
    assertThat(abs, notNullValue());
    calculator.registerRule(abs);
    assertThat(calculator.reduce(expr.node1("abs", expr.integer(3))),
        is(expr.integer(3)));
    assertThat(calculator.reduce(expr.node1("abs", expr.integer(-3))),
        hasToString("abs(-3)"));
    assertThat(calculator.reduce(expr.node1("abs", x)), hasToString("abs(x)"));
    assertThat(calculator.isSatisfied(Contexts.empty(),
        expr.node1("pos", expr.integer(2))), is(true));
  }

  @Test
  void testEqualAndCompare() {
    final Calculator calculator = new Calculator().registerRuleSet(DROP_F);
    assertThat(calculator.isEqual(f(f(x)), x), is(true));
    assertThat(calculator.isEqual(f(x), y), is(false));
    assertThat(calculator.compare(f(x), f(f(x))), is(0));
    assertThat(calculator.compare(y, f(x)), greaterThan(0));
  }

  @Test
  void testProperties() {
    final Calculator calculator = new Calculator();
    assertThat(calculator.intProp(Prop.MAX_PASSES), is(1000));
    assertThat(calculator.isForceReal(), is(false));
    calculator.setLenient("maxPasses", "10");
    calculator.setLenient("FORCE_REAL", "true");
    assertThat(calculator.intProp(Prop.MAX_PASSES), is(10));
    assertThat(calculator.isForceReal(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> calculator.set(Prop.MAX_PASSES, 0));
    assertThrows(IllegalArgumentException.class,
        () -> calculator.setLenient("noSuchProp", "1"));
  }
}

// End CalculatorTest.java
