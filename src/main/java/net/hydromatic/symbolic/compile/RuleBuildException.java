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

/**
 * Thrown when a rule cannot be built, for example because its replacement
 * refers to a name that its pattern does not bind.
 *
 * <p>When several rules of a {@link RuleSet} fail, the exception thrown by
 * {@link Calculator#registerRuleSet} has one failure per rule in
 * {@link #getSuppressed()}.
 */
public class RuleBuildException extends IllegalArgumentException {
  public final String ruleName;

  public RuleBuildException(String ruleName, String message) {
    super("rule '" + ruleName + "': " + message);
    this.ruleName = ruleName;
  }
}

// End RuleBuildException.java
