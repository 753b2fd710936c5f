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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.ExprBuilder;
import net.hydromatic.symbolic.match.Matcher;
import net.hydromatic.symbolic.match.MatcherCompiler;
import net.hydromatic.symbolic.match.TreeDispatcher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of rules, commutative heads, qualifiers and constants, and the
 * entry point for reducing expressions.
 *
 * <p>A calculator is mutable while it is being set up. After {@link #freeze()}
 * it is read-only, and {@link #reduce} may be called from several threads.
 * Registration state is held in plain fields, so the frozen calculator must
 * reach those threads through a safe publication, for example a final field
 * or an {@link java.util.concurrent.ExecutorService} submission.
 */
public class Calculator {
  private final Map<Prop, Object> propMap = new LinkedHashMap<>();
  private final TreeDispatcher<Rule> dispatcher = new TreeDispatcher<>();
  private final List<Rule> rules = new ArrayList<>();
  private final Map<String, QualifierDef> qualifiers = new HashMap<>();
  private final Set<String> commutativeHeads = new HashSet<>();
  private final Map<String, Expr.Node> constants = new LinkedHashMap<>();
  private final MetaTable metaTable = new MetaTable();
  private Tracer tracer = Tracers.nullTracer();
  private volatile boolean frozen;

  /**
   * Incremented whenever a change to this calculator may change the result
   * of a reduction.
   */
  private int generation;

  @Override
  public String toString() {
    return "Calculator{rules=" + rules.size() + "}";
  }

  private void checkMutable() {
    checkState(!frozen, "calculator is frozen");
    ++generation;
  }

  /**
   * Makes this calculator read-only. Subsequent attempts to register rules,
   * heads, qualifiers or constants, or to set properties, throw
   * {@link IllegalStateException}.
   */
  public Calculator freeze() {
    frozen = true;
    dispatcher.freeze();
    return this;
  }

  /** Returns whether this calculator is frozen. */
  public boolean isFrozen() {
    return frozen;
  }

  /** Sets the tracer. */
  public Calculator withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Returns the tracer. */
  public Tracer tracer() {
    return tracer;
  }

  /** Returns the metadata table. */
  public MetaTable metaTable() {
    return metaTable;
  }

  // Properties

  /** Sets the value of a property. */
  public Calculator set(Prop prop, @Nullable Object value) {
    checkMutable();
    prop.set(propMap, value);
    return this;
  }

  /**
   * Sets the value of a property, given its name, converting strings to the
   * property's type.
   */
  public Calculator setLenient(String propName, @Nullable Object value) {
    checkMutable();
    Prop.lookup(propName).setLenient(propMap, value);
    return this;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanProp(Prop prop) {
    return prop.booleanValue(propMap);
  }

  /** Returns the value of an integer property. */
  public int intProp(Prop prop) {
    return prop.intValue(propMap);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumProp(Prop prop, Class<E> type) {
    return prop.enumValue(propMap, type);
  }

  /** Returns whether this calculator works over the real numbers only. */
  public boolean isForceReal() {
    return booleanProp(Prop.FORCE_REAL);
  }

  // Registration

  /** Registers a rule. */
  public Calculator registerRule(Rule rule) {
    checkMutable();
    rules.add(requireNonNull(rule));
    dispatcher.register(rule.matcher, rule);
    return this;
  }

  /**
   * Registers every rule of a rule set.
   *
   * <p>Each rule is built independently. Rules that would do nothing are
   * skipped. If any rule fails to build, the other rules are still
   * registered, and then this method throws a {@link RuleBuildException}
   * that carries each failure as a suppressed exception.
   */
  public Calculator registerRuleSet(RuleSet ruleSet) {
    checkMutable();
    final List<RuleBuildException> failures = new ArrayList<>();
    for (RuleSet.RuleDef def : ruleSet.defs) {
      final Rule rule;
      try {
        rule = def.build(this);
      } catch (RuleBuildException e) {
        tracer.onRuleRejected(def.name(), e);
        failures.add(e);
        continue;
      }
      if (rule != null) {
        registerRule(rule);
      }
    }
    if (!failures.isEmpty()) {
      final RuleBuildException e =
          new RuleBuildException(ruleSet.name,
              failures.size() + " of " + ruleSet.defs.size()
                  + " rules could not be built");
      failures.forEach(e::addSuppressed);
      throw e;
    }
    return this;
  }

  /** Returns the registered rules, in order of registration. */
  public List<Rule> rules() {
    return Collections.unmodifiableList(rules);
  }

  /** Declares that a head is associative and commutative. */
  public Calculator registerCommutative(String head) {
    checkMutable();
    commutativeHeads.add(requireNonNull(head));
    return this;
  }

  /** Returns whether a head is associative and commutative. */
  public boolean isCommutative(String head) {
    return commutativeHeads.contains(head);
  }

  /** Registers a qualifier. */
  public Calculator registerQualifier(QualifierDef def) {
    checkMutable();
    qualifiers.put(def.head, def);
    return this;
  }

  /** Returns the qualifier with a given head, or null. */
  public @Nullable QualifierDef qualifier(String head) {
    return qualifiers.get(head);
  }

  /** Registers a named constant, such as π. */
  public Calculator registerConstant(String name, Expr.Node value) {
    checkMutable();
    constants.put(requireNonNull(name), requireNonNull(value));
    return this;
  }

  /** Returns whether a name is a registered constant. */
  public boolean isConstant(String name) {
    return constants.containsKey(name);
  }

  /**
   * Returns the value of a constant.
   *
   * @throws IllegalArgumentException if there is no constant with that name
   */
  public Expr.Node constantValue(String name) {
    final Expr.Node value = constants.get(name);
    if (value == null) {
      throw new IllegalArgumentException("unknown constant '" + name + "'");
    }
    return value;
  }

  // Matching

  /** Compiles a template into a matcher. */
  public Matcher compileMatcher(Expr.Node template) {
    return MatcherCompiler.compile(this, template);
  }

  /**
   * Returns the context of each child of a node. If the node is a qualifier,
   * the children within its scope see its variables as bound.
   */
  public List<Context> enterContext(Expr.Node node, Context context) {
    final List<Expr.Node> children = node.children();
    final QualifierDef def =
        node.isLeaf() ? null : qualifiers.get(node.head());
    if (def == null) {
      return Collections.nCopies(children.size(), context);
    }
    final Context inner = context.bindAll(def.qualifiedVariables(node), node);
    final ImmutableList.Builder<Context> contexts =
        ImmutableList.builderWithExpectedSize(children.size());
    for (int i = 0; i < children.size(); i++) {
      contexts.add(def.inScope(i) ? inner : context);
    }
    return contexts.build();
  }

  /**
   * Visits a node and its descendants in pre-order, passing each node's
   * context. Descends at most {@code depth} levels.
   */
  public void traverseWithContext(Expr.Node node, Context context, int depth,
      BiConsumer<Expr.Node, Context> visitor) {
    visitor.accept(node, context);
    if (depth <= 0 || node.isLeaf()) {
      return;
    }
    final List<Expr.Node> children = node.children();
    final List<Context> contexts = enterContext(node, context);
    for (int i = 0; i < children.size(); i++) {
      traverseWithContext(children.get(i), contexts.get(i), depth - 1, visitor);
    }
  }

  /**
   * Returns the free variables of an expression: symbols that are neither
   * bound by a qualifier nor constants.
   */
  public Set<Expr.Symbol> freeVariablesOf(Expr.Node node) {
    return FreeFinder.freeSymbols(this, node, Contexts.empty());
  }

  /**
   * Returns whether a condition holds: whether it reduces, in the given
   * context, to {@link ExprBuilder#TRUE}.
   */
  public boolean isSatisfied(Context context, Expr.Node condition) {
    final Expr.Node reduced =
        rewriter().reduce(condition, context, Integer.MAX_VALUE);
    return reduced.deepEquals(ExprBuilder.TRUE);
  }

  // Reduction

  private Rewriter rewriter() {
    return new Rewriter(this, dispatcher, tracer, generation);
  }

  /**
   * Reduces an expression to normal form, applying rules at the default
   * depth ({@link Prop#DEFAULT_DEPTH}).
   *
   * @throws ArithmeticException if the expression has no defined value, for
   *     example division by zero
   */
  public Expr.Node reduce(Expr.Node node) {
    return reduce(node, intProp(Prop.DEFAULT_DEPTH));
  }

  /**
   * Reduces an expression, applying rules only to nodes at most
   * {@code depth} levels below the root.
   */
  public Expr.Node reduce(Expr.Node node, int depth) {
    return rewriter().reduce(node, Contexts.empty(), depth);
  }

  /** Returns whether two expressions have the same normal form. */
  public boolean isEqual(Expr.Node node0, Expr.Node node1) {
    return reduce(node0).deepEquals(reduce(node1));
  }

  /** Compares the normal forms of two expressions. */
  public int compare(Expr.Node node0, Expr.Node node1) {
    return Expr.ORDERING.compare(reduce(node0), reduce(node1));
  }
}

// End Calculator.java
