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

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.compile.Context;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Pattern that matches expression nodes.
 *
 * <p>Matching is pure: a matcher never modifies the node or the incoming
 * result, and returns either an extended result or null.
 *
 * @see Matchers
 */
public interface Matcher {
  /**
   * Matches a node.
   *
   * @param node Node to match
   * @param context Variables bound at the node's position
   * @param result Bindings made so far
   * @return Bindings extended with those made by this matcher, or null if the
   *     node does not match
   */
  @Nullable MatchResult match(
      Expr.Node node, Context context, MatchResult result);

  /** Returns the names of the references that this matcher may bind. */
  default Set<String> refNames() {
    return ImmutableSet.of();
  }

  /**
   * Returns whether, given the bindings so far, at most one node can match.
   */
  default boolean isDetermined(Context context, MatchResult result) {
    return false;
  }

  /**
   * If this matcher is determined, returns the only node it can match;
   * otherwise null.
   */
  default Expr.@Nullable Node determinedNode(
      Context context, MatchResult result) {
    return null;
  }

  /** Matcher that matches only leaves. */
  interface Leaf extends Matcher {
    /** Kind of leaf matched, or null if any leaf. */
    @Nullable Kind kind();
  }

  /** Matcher that matches only branches with a particular head. */
  interface Branch extends Matcher {
    String head();

    /** Kind of branch matched, or null if any branch with the head. */
    @Nullable Kind kind();
  }

  /**
   * Matcher that matches a subset of what another matcher matches, typically
   * adding a condition or a binding.
   */
  interface Transparent extends Matcher {
    Matcher inner();
  }
}

// End Matcher.java
