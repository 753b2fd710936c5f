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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.compile.Context;
import net.hydromatic.symbolic.util.PartialOrder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matcher for an n-ary branch whose head is associative and commutative,
 * such as "add" or "mul".
 *
 * <p>Each child matcher must claim a distinct child of the node; the order
 * of the node's children does not matter. Children that no matcher claims
 * are wrapped in a node with the same head and passed to the remainder
 * matcher. If the remainder matcher is {@link Matchers#nothing()}, every
 * child must be claimed.
 *
 * <p>The child matchers are decomposed into chains under
 * {@link MatcherOrder#PARTIAL}. If there is one chain and no remainder, and
 * the node's children are in canonical order, the children are matched
 * positionally. Otherwise we search with backtracking, whose cost is
 * exponential in the number of children in the worst case.
 */
public class CommutativeMatcher implements Matcher.Branch {
  public final String head;
  public final ImmutableList<Matcher> children;
  public final Matcher remainder;

  /** Chains of child matchers, in the order in which we try them. */
  final ImmutableList<List<Matcher>> chains;

  /** Child matchers, flattened from {@link #chains}. */
  private final ImmutableList<Matcher> plan;

  CommutativeMatcher(
      String head, ImmutableList<Matcher> children, Matcher remainder) {
    this.head = requireNonNull(head);
    this.children = requireNonNull(children);
    this.remainder = requireNonNull(remainder);
    final List<List<Matcher>> chainList =
        new ArrayList<>(PartialOrder.chains(children, MatcherOrder.PARTIAL));
    chainList.sort(MatcherOrder.CHAIN_PREFERENCE);
    this.chains = ImmutableList.copyOf(chainList);
    final ImmutableList.Builder<Matcher> b = ImmutableList.builder();
    chains.forEach(b::addAll);
    this.plan = b.build();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(head).append(plan);
    if (hasRemainder()) {
      b.append(" + ").append(remainder);
    }
    return b.toString();
  }

  @Override
  public String head() {
    return head;
  }

  @Override
  public Kind kind() {
    return Kind.NODEN;
  }

  /** Returns a copy of this matcher with a different remainder matcher. */
  public CommutativeMatcher withRemainder(Matcher remainder) {
    return remainder == this.remainder
        ? this
        : new CommutativeMatcher(head, children, remainder);
  }

  /** Whether children may be left over for the remainder matcher. */
  public boolean hasRemainder() {
    return remainder != Matchers.nothing();
  }

  @Override
  public Set<String> refNames() {
    return ImmutableSet.<String>builder()
        .addAll(Matchers.refNames(children))
        .addAll(remainder.refNames())
        .build();
  }

  @Override
  public @Nullable MatchResult match(
      Expr.Node node, Context context, MatchResult result) {
    if (node.kind != Kind.NODEN || !node.head().equals(head)) {
      return null;
    }
    final List<Expr.Node> nodeChildren = node.children();
    final int nodeCount = nodeChildren.size();
    if (nodeCount < plan.size()) {
      return null;
    }
    if (nodeCount > plan.size() && !hasRemainder()) {
      return null;
    }
    final List<Context> contexts =
        result.calculator.enterContext(node, context);
    if (chains.size() == 1
        && !hasRemainder()
        && Expr.ORDERING.isOrdered(nodeChildren)) {
      return matchPositionally(nodeChildren, contexts, result);
    }
    final boolean[] claimed = new boolean[nodeCount];
    final MatchResult result2 =
        search(0, nodeChildren, contexts, claimed, result);
    if (result2 == null) {
      return null;
    }
    if (nodeCount == plan.size()) {
      return result2;
    }
    final List<Expr.Node> leftovers = new ArrayList<>();
    for (int i = 0; i < nodeCount; i++) {
      if (!claimed[i]) {
        leftovers.add(nodeChildren.get(i));
      }
    }
    return remainder.match(expr.nodeN(head, leftovers), context, result2);
  }

  private @Nullable MatchResult matchPositionally(List<Expr.Node> nodeChildren,
      List<Context> contexts, MatchResult result) {
    MatchResult r = result;
    for (int i = 0; i < plan.size(); i++) {
      r = plan.get(i).match(nodeChildren.get(i), contexts.get(i), r);
      if (r == null) {
        return null;
      }
    }
    return r;
  }

  /**
   * Assigns the {@code k}th matcher of the plan, and recursively the
   * following matchers, to unclaimed children. On success, {@code claimed}
   * marks the children that were used.
   */
  private @Nullable MatchResult search(int k, List<Expr.Node> nodeChildren,
      List<Context> contexts, boolean[] claimed, MatchResult result) {
    if (k == plan.size()) {
      return result;
    }
    final Matcher matcher = plan.get(k);
    for (int i = 0; i < nodeChildren.size(); i++) {
      if (claimed[i]) {
        continue;
      }
      final MatchResult r =
          matcher.match(nodeChildren.get(i), contexts.get(i), result);
      if (r == null) {
        continue;
      }
      claimed[i] = true;
      final MatchResult r2 =
          search(k + 1, nodeChildren, contexts, claimed, r);
      if (r2 != null) {
        return r2;
      }
      claimed[i] = false;
    }
    return null;
  }
}

// End CommutativeMatcher.java
