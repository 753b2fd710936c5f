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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.Kind;
import net.hydromatic.symbolic.compile.Context;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Matcher}. */
public abstract class Matchers {
  private Matchers() {}

  /** Returns a matcher that matches any node. */
  public static Matcher any() {
    return AnyMatcher.INSTANCE;
  }

  /** Returns a matcher that matches no node. */
  public static Matcher nothing() {
    return NothingMatcher.INSTANCE;
  }

  /** Returns a matcher that matches any rational leaf. */
  public static Matcher anyRational() {
    return LeafKindMatcher.RATIONAL;
  }

  /** Returns a matcher that matches any symbol leaf. */
  public static Matcher anySymbol() {
    return LeafKindMatcher.SYMBOL;
  }

  /** Returns a matcher that matches nodes structurally equal to a node. */
  public static FixedMatcher fixed(Expr.Node node) {
    return new FixedMatcher(node);
  }

  /**
   * Returns a matcher that binds a reference. If the reference is already
   * bound, it matches only a node equal to the bound node.
   */
  public static Matcher ref(String name) {
    return new RefMatcher(name);
  }

  /**
   * Returns a matcher that matches what {@code matcher} matches, and binds
   * the matched node to a reference.
   */
  public static Matcher named(Matcher matcher, String name) {
    return new NamedMatcher(matcher, name);
  }

  /**
   * Returns a matcher that tests a condition before calling {@code matcher}.
   * Useful to reject a node cheaply.
   */
  public static Matcher withPrecondition(
      Matcher matcher, Condition condition) {
    return new PreconditionMatcher(matcher, condition);
  }

  /**
   * Returns a matcher that tests a condition on the result of
   * {@code matcher}.
   */
  public static Matcher withPostcondition(
      Matcher matcher, Condition condition) {
    return new PostconditionMatcher(matcher, condition);
  }

  /**
   * Returns a matcher that matches what {@code matcher} matches, provided
   * that a condition template, with references substituted by their
   * bindings, is satisfied in the calculator.
   */
  public static Matcher withCondition(Matcher matcher, Expr.Node condition) {
    return new WhereMatcher(matcher, condition);
  }

  /** Returns a matcher that matches any branch with a given head. */
  public static Matcher head(String head) {
    return new HeadMatcher(head);
  }

  /** Returns a matcher that matches a one-child branch. */
  public static Matcher node1(String head, Matcher child) {
    return new OrderedMatcher(Kind.NODE1, head, ImmutableList.of(child));
  }

  /** Returns a matcher that matches a two-child branch. */
  public static Matcher node2(String head, Matcher first, Matcher second) {
    return new OrderedMatcher(
        Kind.NODE2, head, ImmutableList.of(first, second));
  }

  /** Returns a matcher that matches a three-child branch. */
  public static Matcher node3(
      String head, Matcher first, Matcher second, Matcher third) {
    return new OrderedMatcher(
        Kind.NODE3, head, ImmutableList.of(first, second, third));
  }

  /**
   * Returns a matcher that matches an n-ary branch with the same number of
   * children, in order.
   */
  public static Matcher nodeN(String head, List<? extends Matcher> children) {
    return new OrderedMatcher(Kind.NODEN, head, ImmutableList.copyOf(children));
  }

  /**
   * Returns a matcher that matches an n-ary branch whose children may be in
   * any order. Children not claimed by {@code children} are passed to
   * {@code remainder}, wrapped in a node with the same head.
   */
  public static CommutativeMatcher commutative(String head,
      List<? extends Matcher> children, Matcher remainder) {
    return new CommutativeMatcher(
        head, ImmutableList.copyOf(children), remainder);
  }

  /** Returns the union of the reference names of some matchers. */
  static Set<String> refNames(Iterable<? extends Matcher> matchers) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    matchers.forEach(m -> names.addAll(m.refNames()));
    return names.build();
  }

  /** Removes wrappers such as {@link NamedMatcher} from a matcher. */
  public static Matcher unwrap(Matcher matcher) {
    while (matcher instanceof Matcher.Transparent) {
      matcher = ((Matcher.Transparent) matcher).inner();
    }
    return matcher;
  }

  /** Condition on a node and the bindings of a match. */
  @FunctionalInterface
  public interface Condition {
    boolean test(Expr.Node node, Context context, MatchResult result);
  }

  /** Matcher that matches any node. */
  static class AnyMatcher implements Matcher {
    static final AnyMatcher INSTANCE = new AnyMatcher();

    @Override
    public String toString() {
      return "any";
    }

    @Override
    public MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return result;
    }
  }

  /** Matcher that matches nothing. */
  static class NothingMatcher implements Matcher {
    static final NothingMatcher INSTANCE = new NothingMatcher();

    @Override
    public String toString() {
      return "nothing";
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return null;
    }
  }

  /** Matcher that matches any leaf of a given kind. */
  static class LeafKindMatcher implements Matcher.Leaf {
    static final LeafKindMatcher RATIONAL = new LeafKindMatcher(Kind.RATIONAL);
    static final LeafKindMatcher SYMBOL = new LeafKindMatcher(Kind.SYMBOL);

    private final Kind kind;

    private LeafKindMatcher(Kind kind) {
      this.kind = kind;
    }

    @Override
    public String toString() {
      return "any" + kind;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return node.kind == kind ? result : null;
    }
  }

  /** Matcher that matches nodes equal to a given node. */
  public static class FixedMatcher implements Matcher {
    public final Expr.Node node;

    FixedMatcher(Expr.Node node) {
      this.node = requireNonNull(node);
    }

    @Override
    public String toString() {
      return "fixed(" + node + ")";
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return this.node.deepEquals(node) ? result : null;
    }

    @Override
    public boolean isDetermined(Context context, MatchResult result) {
      return true;
    }

    @Override
    public Expr.Node determinedNode(Context context, MatchResult result) {
      return node;
    }
  }

  /** Matcher that binds a reference. */
  static class RefMatcher implements Matcher {
    final String name;

    RefMatcher(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return result.bind(name, node);
    }

    @Override
    public Set<String> refNames() {
      return ImmutableSet.of(name);
    }

    @Override
    public boolean isDetermined(Context context, MatchResult result) {
      return result.isBound(name);
    }

    @Override
    public Expr.@Nullable Node determinedNode(
        Context context, MatchResult result) {
      return result.get(name);
    }
  }

  /** Matcher that binds the node matched by another matcher. */
  static class NamedMatcher implements Matcher.Transparent {
    final Matcher inner;
    final String name;

    NamedMatcher(Matcher inner, String name) {
      this.inner = requireNonNull(inner);
      this.name = requireNonNull(name);
    }

    @Override
    public String toString() {
      return inner + " as " + name;
    }

    @Override
    public Matcher inner() {
      return inner;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      final MatchResult result2 = inner.match(node, context, result);
      return result2 == null ? null : result2.bind(name, node);
    }

    @Override
    public Set<String> refNames() {
      return ImmutableSet.<String>builder()
          .addAll(inner.refNames())
          .add(name)
          .build();
    }

    @Override
    public boolean isDetermined(Context context, MatchResult result) {
      return result.isBound(name) || inner.isDetermined(context, result);
    }

    @Override
    public Expr.@Nullable Node determinedNode(
        Context context, MatchResult result) {
      final Expr.Node node = result.get(name);
      return node != null ? node : inner.determinedNode(context, result);
    }
  }

  /** Base class for a matcher that wraps another and adds a condition. */
  abstract static class WrappingMatcher implements Matcher.Transparent {
    final Matcher inner;

    WrappingMatcher(Matcher inner) {
      this.inner = requireNonNull(inner);
    }

    @Override
    public Matcher inner() {
      return inner;
    }

    @Override
    public Set<String> refNames() {
      return inner.refNames();
    }

    @Override
    public boolean isDetermined(Context context, MatchResult result) {
      return inner.isDetermined(context, result);
    }

    @Override
    public Expr.@Nullable Node determinedNode(
        Context context, MatchResult result) {
      return inner.determinedNode(context, result);
    }
  }

  /** Matcher that tests a condition before matching. */
  static class PreconditionMatcher extends WrappingMatcher {
    final Condition condition;

    PreconditionMatcher(Matcher inner, Condition condition) {
      super(inner);
      this.condition = requireNonNull(condition);
    }

    @Override
    public String toString() {
      return "pre(" + inner + ")";
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      if (!condition.test(node, context, result)) {
        return null;
      }
      return inner.match(node, context, result);
    }
  }

  /** Matcher that tests a condition after matching. */
  static class PostconditionMatcher extends WrappingMatcher {
    final Condition condition;

    PostconditionMatcher(Matcher inner, Condition condition) {
      super(inner);
      this.condition = requireNonNull(condition);
    }

    @Override
    public String toString() {
      return "post(" + inner + ")";
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      final MatchResult result2 = inner.match(node, context, result);
      if (result2 == null || !condition.test(node, context, result2)) {
        return null;
      }
      return result2;
    }
  }

  /**
   * Matcher whose condition is an expression template, evaluated by the
   * calculator after references are substituted.
   */
  static class WhereMatcher extends WrappingMatcher {
    final Expr.Node condition;

    WhereMatcher(Matcher inner, Expr.Node condition) {
      super(inner);
      this.condition = requireNonNull(condition);
    }

    @Override
    public String toString() {
      return inner + " where " + condition;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      final MatchResult result2 = inner.match(node, context, result);
      if (result2 == null) {
        return null;
      }
      final Expr.Node condition2 = result2.substitute(condition);
      return result2.calculator.isSatisfied(context, condition2)
          ? result2
          : null;
    }
  }

  /** Matcher that matches any branch with a given head. */
  static class HeadMatcher implements Matcher.Branch {
    final String head;

    HeadMatcher(String head) {
      this.head = requireNonNull(head);
    }

    @Override
    public String toString() {
      return head + "(...)";
    }

    @Override
    public String head() {
      return head;
    }

    @Override
    public @Nullable Kind kind() {
      return null;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      return !node.isLeaf() && node.head().equals(head) ? result : null;
    }
  }

  /** Matcher that matches a branch whose children match in order. */
  static class OrderedMatcher implements Matcher.Branch {
    final Kind kind;
    final String head;
    final ImmutableList<Matcher> children;

    OrderedMatcher(Kind kind, String head, ImmutableList<Matcher> children) {
      this.kind = requireNonNull(kind);
      this.head = requireNonNull(head);
      this.children = requireNonNull(children);
      checkArgument(!kind.isLeaf());
      checkArgument(!children.isEmpty());
      checkArgument(kind.arity < 0 || kind.arity == children.size());
    }

    @Override
    public String toString() {
      return head + children;
    }

    @Override
    public String head() {
      return head;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public @Nullable MatchResult match(
        Expr.Node node, Context context, MatchResult result) {
      if (node.kind != kind || !node.head().equals(head)) {
        return null;
      }
      final List<Expr.Node> nodeChildren = node.children();
      if (nodeChildren.size() != children.size()) {
        return null;
      }
      final List<Context> contexts =
          result.calculator.enterContext(node, context);
      MatchResult r = result;
      for (int i = 0; i < children.size(); i++) {
        r = children.get(i).match(nodeChildren.get(i), contexts.get(i), r);
        if (r == null) {
          return null;
        }
      }
      return r;
    }

    @Override
    public Set<String> refNames() {
      return Matchers.refNames(children);
    }

    @Override
    public boolean isDetermined(Context context, MatchResult result) {
      for (Matcher child : children) {
        if (!child.isDetermined(context, result)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public Expr.@Nullable Node determinedNode(
        Context context, MatchResult result) {
      final ImmutableList.Builder<Expr.Node> nodes = ImmutableList.builder();
      for (Matcher child : children) {
        final Expr.Node node = child.determinedNode(context, result);
        if (node == null) {
          return null;
        }
        nodes.add(node);
      }
      return expr.branch(kind, head, nodes.build());
    }
  }
}

// End Matchers.java
