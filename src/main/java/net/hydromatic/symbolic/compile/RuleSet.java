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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.match.Matcher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named, ordered collection of rule definitions.
 *
 * <p>Each definition is built against a calculator when the rule set is
 * registered, so that templates can use the calculator's commutative heads
 * and qualifiers.
 *
 * @see Calculator#registerRuleSet(RuleSet)
 */
public final class RuleSet {
  public final String name;
  public final ImmutableList<RuleDef> defs;

  private RuleSet(String name, ImmutableList<RuleDef> defs) {
    this.name = requireNonNull(name);
    this.defs = requireNonNull(defs);
  }

  @Override
  public String toString() {
    return name + defs;
  }

  /** Creates a builder. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Definition of a rule. */
  public interface RuleDef {
    /** Name of the rule. */
    String name();

    /**
     * Builds the rule; returns null if the rule would do nothing.
     *
     * @throws RuleBuildException if the rule is invalid
     */
    @Nullable Rule build(Calculator calculator);
  }

  /** Rule definition whose body is a lambda. */
  private static class RuleDefImpl implements RuleDef {
    private final String name;
    private final RuleFactory factory;

    RuleDefImpl(String name, RuleFactory factory) {
      this.name = requireNonNull(name);
      this.factory = requireNonNull(factory);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public @Nullable Rule build(Calculator calculator) {
      return factory.build(calculator);
    }
  }

  /** Function that builds a rule. */
  @FunctionalInterface
  private interface RuleFactory {
    @Nullable Rule build(Calculator calculator);
  }

  /** Builder for {@link RuleSet}. */
  public static class Builder {
    private final String name;
    private final ImmutableList.Builder<RuleDef> defs =
        ImmutableList.builder();

    Builder(String name) {
      this.name = requireNonNull(name);
    }

    /** Adds a rule that has already been built. */
    public Builder add(Rule rule) {
      defs.add(new RuleDefImpl(rule.name, calculator -> rule));
      return this;
    }

    /** Adds a rule defined by a matcher and a replacement function. */
    public Builder add(
        String ruleName, Matcher matcher, Replacement replacement) {
      return add(Rules.of(ruleName, matcher, replacement));
    }

    /** Adds a rule defined by a pattern and a replacement template. */
    public Builder template(
        String ruleName, Expr.Node pattern, Expr.Node replacement) {
      return template(ruleName, pattern, replacement, Integer.MAX_VALUE);
    }

    /**
     * Adds a rule defined by a pattern and a replacement template, that
     * applies at most {@code maxDepth} levels below the root.
     */
    public Builder template(String ruleName, Expr.Node pattern,
        Expr.Node replacement, int maxDepth) {
      defs.add(
          new RuleDefImpl(ruleName,
              calculator ->
                  Rules.fromTemplate(
                      calculator, ruleName, pattern, replacement, maxDepth)));
      return this;
    }

    /** Adds a rule defined by a pattern and a replacement function. */
    public Builder template(
        String ruleName, Expr.Node pattern, Replacement replacement) {
      defs.add(
          new RuleDefImpl(ruleName,
              calculator ->
                  Rules.fromTemplate(calculator, ruleName, pattern,
                      replacement, Integer.MAX_VALUE)));
      return this;
    }

    /** Adds all rules of another rule set. */
    public Builder addAll(RuleSet ruleSet) {
      defs.addAll(ruleSet.defs);
      return this;
    }

    public RuleSet build() {
      return new RuleSet(name, defs.build());
    }
  }

  /** Returns the names of the rules, in order. */
  public List<String> ruleNames() {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    defs.forEach(def -> names.add(def.name()));
    return names.build();
  }
}

// End RuleSet.java
