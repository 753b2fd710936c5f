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

import com.google.common.collect.ImmutableList;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.match.CommutativeMatcher;
import net.hydromatic.symbolic.match.Matcher;
import net.hydromatic.symbolic.match.Matchers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Creates {@link Rule} objects. */
public abstract class Rules {
  private Rules() {}

  /**
   * Name of the hidden reference that binds the operands left over when a
   * rule whose pattern is commutative matches some of the operands of a
   * larger node.
   */
  public static final String REMAINDER = "$$remainder";

  /** Creates a rule from a matcher and a replacement function. */
  public static Rule of(String name, Matcher matcher, Replacement replacement) {
    return of(name, matcher, replacement, Integer.MAX_VALUE);
  }

  /**
   * Creates a rule from a matcher and a replacement function, applicable to
   * nodes at most {@code maxDepth} levels below the root.
   */
  public static Rule of(String name, Matcher matcher, Replacement replacement,
      int maxDepth) {
    return new Rule(name, matcher, replacement, maxDepth);
  }

  /**
   * Creates a rule from a pattern template and a replacement template.
   *
   * <p>Returns null if the replacement is the same as the pattern, because
   * such a rule would do nothing.
   *
   * @throws RuleBuildException if the replacement uses a reference that the
   *     pattern does not bind, or the pattern is invalid
   */
  public static @Nullable Rule fromTemplate(Calculator calculator, String name,
      Expr.Node pattern, Expr.Node replacement) {
    return fromTemplate(
        calculator, name, pattern, replacement, Integer.MAX_VALUE);
  }

  /**
   * Creates a rule from a pattern template and a replacement template,
   * applicable to nodes at most {@code maxDepth} levels below the root.
   */
  public static @Nullable Rule fromTemplate(Calculator calculator, String name,
      Expr.Node pattern, Expr.Node replacement, int maxDepth) {
    if (replacement.deepEquals(pattern)) {
      calculator.tracer().onRuleSkipped(name, "replacement equals pattern");
      return null;
    }
    final Matcher matcher = compile(calculator, name, pattern);
    final Set<String> unbound = new TreeSet<>();
    replacement.traverse(
        node -> {
          if (expr.isRef(node)
              && !matcher.refNames().contains(((Expr.Symbol) node).name)) {
            unbound.add(((Expr.Symbol) node).name);
          }
        });
    if (!unbound.isEmpty()) {
      throw new RuleBuildException(name,
          "replacement refers to " + unbound + ", not bound by pattern "
              + pattern);
    }
    return build(name, matcher, m -> m.substitute(replacement), maxDepth);
  }

  /**
   * Creates a rule from a pattern template and a replacement function,
   * applicable to nodes at most {@code maxDepth} levels below the root.
   */
  public static Rule fromTemplate(Calculator calculator, String name,
      Expr.Node pattern, Replacement replacement, int maxDepth) {
    final Matcher matcher = compile(calculator, name, pattern);
    return build(name, matcher, replacement, maxDepth);
  }

  private static Matcher compile(
      Calculator calculator, String name, Expr.Node pattern) {
    try {
      return calculator.compileMatcher(pattern);
    } catch (RuleBuildException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      final RuleBuildException e2 =
          new RuleBuildException(name, "invalid pattern: " + e.getMessage());
      e2.initCause(e);
      throw e2;
    }
  }

  /**
   * Creates a rule. If the matcher is commutative and takes all operands,
   * allows it to take a subset of the operands, and appends the remaining
   * operands to the replacement.
   */
  private static Rule build(String name, Matcher matcher,
      Replacement replacement, int maxDepth) {
    if (!(matcher instanceof CommutativeMatcher)
        || ((CommutativeMatcher) matcher).hasRemainder()) {
      return new Rule(name, matcher, replacement, maxDepth);
    }
    final CommutativeMatcher cm = (CommutativeMatcher) matcher;
    final Replacement replacement2 =
        m -> {
          final Expr.Node remainder = m.result.get(REMAINDER);
          final Expr.Node node = replacement.replace(m);
          if (remainder == null || node == null) {
            return node;
          }
          return expr.nodeN(cm.head,
              ImmutableList.<Expr.Node>builder()
                  .add(node)
                  .addAll(remainder.children())
                  .build());
        };
    return new Rule(name, cm.withRemainder(Matchers.ref(REMAINDER)),
        replacement2, maxDepth);
  }
}

// End Rules.java
