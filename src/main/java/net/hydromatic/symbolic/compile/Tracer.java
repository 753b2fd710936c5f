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

import net.hydromatic.symbolic.ast.Expr;

/**
 * Called on various events during rule registration and reduction.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called at the start of each rewrite pass. */
  void onPass(int pass, Expr.Node node);

  /** Called when a rule rewrites a node. */
  void onRewrite(Rule rule, Expr.Node before, Expr.Node after);

  /** Called when a rule is not registered because it would do nothing. */
  void onRuleSkipped(String name, String reason);

  /** Called when a rule in a rule set cannot be built. */
  void onRuleRejected(String name, RuleBuildException e);

  /**
   * Called when reduction stops because it has made the maximum number of
   * passes without reaching a fixed point.
   */
  void onPassLimit(int limit, Expr.Node node);
}

// End Tracer.java
