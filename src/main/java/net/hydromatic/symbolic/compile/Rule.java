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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.match.MatchResult;
import net.hydromatic.symbolic.match.Matcher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrite rule: a matcher and a replacement.
 *
 * <p>A rule applies only to nodes whose level (distance from the root of the
 * expression being reduced) is at most {@link #maxDepth}.
 *
 * @see Rules
 */
public final class Rule {
  public final String name;
  public final Matcher matcher;
  public final Replacement replacement;
  public final int maxDepth;

  Rule(String name, Matcher matcher, Replacement replacement, int maxDepth) {
    this.name = requireNonNull(name);
    this.matcher = requireNonNull(matcher);
    this.replacement = requireNonNull(replacement);
    this.maxDepth = maxDepth;
    checkArgument(maxDepth >= 0, "invalid maxDepth %s", maxDepth);
  }

  @Override
  public String toString() {
    return name;
  }

  /** Returns a copy of this rule with a given maximum depth. */
  public Rule withMaxDepth(int maxDepth) {
    return maxDepth == this.maxDepth
        ? this
        : new Rule(name, matcher, replacement, maxDepth);
  }

  /**
   * Applies this rule to a node. Returns the replacement, or null if the
   * matcher does not match or the replacement declines.
   */
  public Expr.@Nullable Node apply(
      Expr.Node node, Context context, Calculator calculator) {
    final MatchResult result =
        matcher.match(node, context, MatchResult.empty(calculator));
    if (result == null) {
      return null;
    }
    return replacement.replace(new Matched(node, context, result));
  }
}

// End Rule.java
