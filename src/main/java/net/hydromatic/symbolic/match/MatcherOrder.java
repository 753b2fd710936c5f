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

import static net.hydromatic.symbolic.match.Matchers.unwrap;

import java.util.Comparator;
import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.util.PartialOrder;
import net.hydromatic.symbolic.util.PartialOrder.Result;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Orderings on matchers, used to plan commutative matching. */
public abstract class MatcherOrder {
  private MatcherOrder() {}

  /**
   * Partial order on matchers such that if {@code a < b} then every node
   * matched by {@code a} is less, in {@link Expr#ORDERING}, than every node
   * matched by {@code b}.
   */
  public static final PartialOrder.Comparison<Matcher> PARTIAL =
      MatcherOrder::comparePartial;

  /**
   * Order in which chains are tried: longer chains first, then chains whose
   * matchers are more specific.
   */
  public static final Comparator<List<Matcher>> CHAIN_PREFERENCE =
      MatcherOrder::compareChains;

  static Result comparePartial(Matcher m0, Matcher m1) {
    final Matcher a = unwrap(m0);
    final Matcher b = unwrap(m1);
    if (a instanceof Matchers.FixedMatcher
        && b instanceof Matchers.FixedMatcher) {
      return Result.of(
          Expr.ORDERING.compare(
              ((Matchers.FixedMatcher) a).node,
              ((Matchers.FixedMatcher) b).node));
    }
    final Kind kindA = kind(a);
    final Kind kindB = kind(b);
    if (kindA == null || kindB == null) {
      return Result.INCOMPARABLE;
    }
    int c = kindA.compareTo(kindB);
    if (c != 0) {
      return Result.of(c);
    }
    final String headA = head(a);
    final String headB = head(b);
    if (headA == null || headB == null) {
      return Result.INCOMPARABLE;
    }
    c = headA.compareTo(headB);
    if (c != 0) {
      return Result.of(c);
    }
    if (a instanceof Matchers.OrderedMatcher
        && b instanceof Matchers.OrderedMatcher) {
      final List<Matcher> childrenA = ((Matchers.OrderedMatcher) a).children;
      final List<Matcher> childrenB = ((Matchers.OrderedMatcher) b).children;
      c = Integer.compare(childrenA.size(), childrenB.size());
      if (c != 0) {
        return Result.of(c);
      }
      for (int i = 0; i < childrenA.size(); i++) {
        final Result r = comparePartial(childrenA.get(i), childrenB.get(i));
        if (r != Result.EQUAL) {
          return r;
        }
      }
      return Result.EQUAL;
    }
    return Result.INCOMPARABLE;
  }

  /** Returns the kind of node a matcher can match, if there is only one. */
  private static @Nullable Kind kind(Matcher m) {
    if (m instanceof Matchers.FixedMatcher) {
      return ((Matchers.FixedMatcher) m).node.kind;
    }
    if (m instanceof Matcher.Branch) {
      return ((Matcher.Branch) m).kind();
    }
    return null;
  }

  /**
   * Returns the head of the branches a matcher can match, or null if it is
   * not a branch matcher.
   */
  private static @Nullable String head(Matcher m) {
    if (m instanceof Matchers.FixedMatcher) {
      final Expr.Node node = ((Matchers.FixedMatcher) m).node;
      return node.isLeaf() ? null : node.head();
    }
    if (m instanceof Matcher.Branch) {
      return ((Matcher.Branch) m).head();
    }
    return null;
  }

  static int compareChains(List<Matcher> chain0, List<Matcher> chain1) {
    if (chain0.size() != chain1.size()) {
      return Integer.compare(chain1.size(), chain0.size());
    }
    for (int i = 0; i < chain0.size(); i++) {
      final int c = compareSpecificity(chain0.get(i), chain1.get(i));
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  /** Branch matchers come before other matchers, then by head. */
  private static int compareSpecificity(Matcher m0, Matcher m1) {
    final Matcher a = unwrap(m0);
    final Matcher b = unwrap(m1);
    final boolean branchA = a instanceof Matcher.Branch;
    final boolean branchB = b instanceof Matcher.Branch;
    if (branchA && branchB) {
      return ((Matcher.Branch) a).head().compareTo(((Matcher.Branch) b).head());
    }
    return Boolean.compare(branchB, branchA);
  }
}

// End MatcherOrder.java
