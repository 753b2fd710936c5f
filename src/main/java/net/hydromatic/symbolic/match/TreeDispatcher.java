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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.ast.Signature;
import net.hydromatic.symbolic.compile.Calculator;
import net.hydromatic.symbolic.compile.Context;
import net.hydromatic.symbolic.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Index that, given a node, finds the registered matchers that could match
 * it, and matches them.
 *
 * <p>Each matcher is filed under the {@link Signature signatures} of the
 * nodes it can match. A matcher whose signatures cannot be determined goes
 * into a wildcard bucket that is tried for every node. When a node is
 * dispatched, we try the matchers in its signature's bucket, then those in
 * the wildcard bucket, each in order of registration. A matcher filed under
 * a different signature is never invoked.
 *
 * @param <T> Type of value associated with each matcher, such as a rule
 */
public class TreeDispatcher<T> {
  private final Map<Signature, List<Pair<Matcher, T>>> buckets =
      new HashMap<>();
  private final List<Pair<Matcher, T>> wildcards = new ArrayList<>();
  private int size;
  private volatile boolean frozen;

  @Override
  public String toString() {
    return "TreeDispatcher{buckets=" + buckets.keySet()
        + ", wildcards=" + wildcards.size() + "}";
  }

  /** Returns the number of registered matchers. */
  public int size() {
    return size;
  }

  /** Returns whether no matchers are registered. */
  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Makes this dispatcher read-only. After this call, {@link #register}
   * throws, and concurrent dispatch is safe.
   */
  public TreeDispatcher<T> freeze() {
    frozen = true;
    return this;
  }

  /** Registers a matcher and its associated value. */
  public void register(Matcher matcher, T value) {
    checkState(!frozen, "dispatcher is frozen");
    final Pair<Matcher, T> entry =
        Pair.of(requireNonNull(matcher), requireNonNull(value));
    final Matcher m = Matchers.unwrap(matcher);
    if (m == Matchers.nothing()) {
      // Can never match.
      return;
    }
    final List<Signature> signatures = signatures(m);
    if (signatures == null) {
      wildcards.add(entry);
    } else {
      for (Signature signature : signatures) {
        buckets.computeIfAbsent(signature, k -> new ArrayList<>()).add(entry);
      }
    }
    ++size;
  }

  /**
   * Returns the signatures of all nodes a matcher could match, or null if
   * that cannot be determined.
   */
  static @Nullable List<Signature> signatures(Matcher matcher) {
    if (matcher instanceof Matchers.FixedMatcher) {
      final Expr.Node node = ((Matchers.FixedMatcher) matcher).node;
      return ImmutableList.of(node.signature());
    }
    if (matcher instanceof Matcher.Branch) {
      final Matcher.Branch branch = (Matcher.Branch) matcher;
      final Kind kind = branch.kind();
      if (kind != null) {
        return ImmutableList.of(Signature.of(kind, branch.head()));
      }
      final ImmutableList.Builder<Signature> list = ImmutableList.builder();
      for (Kind k : Kind.BRANCHES) {
        list.add(Signature.of(k, branch.head()));
      }
      return list.build();
    }
    if (matcher instanceof Matcher.Leaf) {
      final Kind kind = ((Matcher.Leaf) matcher).kind();
      if (kind != null) {
        return ImmutableList.of(Signature.of(kind, ""));
      }
    }
    return null;
  }

  /**
   * Matches a node against the candidate matchers, calling {@code consumer}
   * for each that matches, with the associated value and the match result.
   */
  public void dispatch(Expr.Node node, Context context, MatchResult result,
      BiConsumer<T, MatchResult> consumer) {
    dispatchUntil(
        node,
        context,
        result,
        (value, r) -> {
          consumer.accept(value, r);
          return false;
        });
  }

  /** As {@link #dispatch}, using an empty result of a calculator. */
  public void dispatch(Expr.Node node, Context context, Calculator calculator,
      BiConsumer<T, MatchResult> consumer) {
    dispatch(node, context, MatchResult.empty(calculator), consumer);
  }

  /**
   * Matches a node against the candidate matchers, calling {@code predicate}
   * for each that matches, until the predicate returns true.
   *
   * @return Whether the predicate returned true
   */
  public boolean dispatchUntil(Expr.Node node, Context context,
      MatchResult result, BiPredicate<T, MatchResult> predicate) {
    final List<Pair<Matcher, T>> bucket = buckets.get(node.signature());
    if (bucket != null && tryAll(bucket, node, context, result, predicate)) {
      return true;
    }
    return tryAll(wildcards, node, context, result, predicate);
  }

  /** As {@link #dispatchUntil}, using an empty result of a calculator. */
  public boolean dispatchUntil(Expr.Node node, Context context,
      Calculator calculator, BiPredicate<T, MatchResult> predicate) {
    return dispatchUntil(
        node, context, MatchResult.empty(calculator), predicate);
  }

  /**
   * Returns the values and match results of all matchers that match a node,
   * in dispatch order.
   */
  public List<Pair<T, MatchResult>> dispatchToList(
      Expr.Node node, Context context, MatchResult result) {
    final List<Pair<T, MatchResult>> list = new ArrayList<>();
    dispatch(node, context, result, (value, r) -> list.add(Pair.of(value, r)));
    return list;
  }

  /** As {@link #dispatchToList}, using an empty result of a calculator. */
  public List<Pair<T, MatchResult>> dispatchToList(
      Expr.Node node, Context context, Calculator calculator) {
    return dispatchToList(node, context, MatchResult.empty(calculator));
  }

  private boolean tryAll(List<Pair<Matcher, T>> entries, Expr.Node node,
      Context context, MatchResult result,
      BiPredicate<T, MatchResult> predicate) {
    for (Pair<Matcher, T> entry : entries) {
      final MatchResult r = entry.left.match(node, context, result);
      if (r != null && predicate.test(entry.right, r)) {
        return true;
      }
    }
    return false;
  }
}

// End TreeDispatcher.java
