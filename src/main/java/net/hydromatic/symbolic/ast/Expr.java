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
package net.hydromatic.symbolic.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.math.BigInteger;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import java.util.function.UnaryOperator;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Expression trees.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Create nodes using {@link ExprBuilder#expr}.
 *
 * <p>Every node is immutable. Equality ({@link Node#equals(Object)} and {@link
 * Node#deepEquals(Node)}) is structural.
 */
public class Expr {
  private Expr() {}

  /**
   * Total order on nodes.
   *
   * <p>Ranks first by {@link Kind}, then by head (or name, for a leaf), then
   * by value (rationals by numerator, then denominator), then by children.
   * Used to put the operands of commutative heads into canonical order.
   */
  public static final Ordering<Node> ORDERING = Ordering.from(Expr::compare);

  /** Helper for {@link #ORDERING}. */
  static int compare(Node o1, Node o2) {
    if (o1 == o2) {
      return 0;
    }
    int c = o1.kind.compareTo(o2.kind);
    if (c != 0) {
      return c;
    }
    c = o1.head().compareTo(o2.head());
    if (c != 0) {
      return c;
    }
    switch (o1.kind) {
      case RATIONAL:
        final BigFraction f1 = ((Rational) o1).value;
        final BigFraction f2 = ((Rational) o2).value;
        c = f1.getNumerator().compareTo(f2.getNumerator());
        if (c != 0) {
          return c;
        }
        return f1.getDenominator().compareTo(f2.getDenominator());
      case SYMBOL:
        return ((Symbol) o1).name.compareTo(((Symbol) o2).name);
      case OTHER:
        return ((Other) o1).tag.compareTo(((Other) o2).tag);
      default:
        final List<Node> children1 = ((Branch) o1).children;
        final List<Node> children2 = ((Branch) o2).children;
        c = Integer.compare(children1.size(), children2.size());
        if (c != 0) {
          return c;
        }
        for (int i = 0; i < children1.size(); i++) {
          c = compare(children1.get(i), children2.get(i));
          if (c != 0) {
            return c;
          }
        }
        return 0;
    }
  }

  /** Abstract base class of all nodes. */
  public abstract static class Node {
    public final Kind kind;

    Node(Kind kind) {
      this.kind = requireNonNull(kind);
    }

    /** Returns the head symbol of a branch, or the empty string for a leaf. */
    public String head() {
      return "";
    }

    /** Returns the children; empty for a leaf. */
    public abstract List<Node> children();

    /** Returns the structural signature of this node. */
    public Signature signature() {
      return Signature.of(this);
    }

    /** Whether this node has no children. */
    public boolean isLeaf() {
      return kind.isLeaf();
    }

    /**
     * Visits this node and its descendants in pre-order, left to right.
     * Descends at most {@code depth} levels; depth 0 visits only this node.
     */
    public abstract void traverse(int depth, Consumer<Node> action);

    /** Visits this node and all of its descendants in pre-order. */
    public final void traverse(Consumer<Node> action) {
      traverse(Integer.MAX_VALUE, action);
    }

    /**
     * Visits this node and its descendants in post-order, left to right.
     * Descends at most {@code depth} levels.
     */
    public abstract void traversePostOrder(int depth, Consumer<Node> action);

    /** Visits this node and all of its descendants in post-order. */
    public final void traversePostOrder(Consumer<Node> action) {
      traversePostOrder(Integer.MAX_VALUE, action);
    }

    /**
     * As {@link #traverse(int, Consumer)}, but also passes each node's level,
     * counting this node as {@code level}.
     */
    public abstract void traverseLeveled(
        int depth, int level, ObjIntConsumer<Node> action);

    /**
     * As {@link #traversePostOrder(int, Consumer)}, but also passes each
     * node's level, counting this node as {@code level}.
     */
    public abstract void traversePostOrderLeveled(
        int depth, int level, ObjIntConsumer<Node> action);

    /**
     * Rebuilds this tree bottom-up.
     *
     * <p>Each child is first mapped recursively (with {@code depth - 1}); then
     * {@code f} is applied to this node if no child changed, or to the
     * rebuilt node if some child did. If {@code depth <= 0}, {@code f} is
     * applied to this node alone. Unchanged subtrees are shared, not copied.
     */
    public abstract Node recurMap(int depth, UnaryOperator<Node> f);

    /** Returns whether this node is structurally equal to another. */
    public boolean deepEquals(Node other) {
      return equals(other);
    }

    /**
     * Returns a tree in which every symbol name, both of symbol leaves and of
     * branch heads, has been passed through {@code f}.
     */
    public abstract Node mapSymbol(UnaryOperator<String> f);

    /** Writes this node in plain form, such as "pow(x, 2)". */
    public abstract StringBuilder unparse(StringBuilder buf);

    @Override
    public final String toString() {
      return unparse(new StringBuilder()).toString();
    }

    /** Returns a multi-line, indented rendering of this tree. */
    public final String treeString() {
      return treeTo(new StringBuilder(), "").toString();
    }

    abstract StringBuilder treeTo(StringBuilder buf, String indent);
  }

  /** Node with no children. */
  public abstract static class Leaf extends Node {
    Leaf(Kind kind) {
      super(kind);
      checkArgument(kind.isLeaf());
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public void traverse(int depth, Consumer<Node> action) {
      action.accept(this);
    }

    @Override
    public void traversePostOrder(int depth, Consumer<Node> action) {
      action.accept(this);
    }

    @Override
    public void traverseLeveled(
        int depth, int level, ObjIntConsumer<Node> action) {
      action.accept(this, level);
    }

    @Override
    public void traversePostOrderLeveled(
        int depth, int level, ObjIntConsumer<Node> action) {
      action.accept(this, level);
    }

    @Override
    public Node recurMap(int depth, UnaryOperator<Node> f) {
      return f.apply(this);
    }

    @Override
    public Node mapSymbol(UnaryOperator<String> f) {
      return this;
    }

    @Override
    StringBuilder treeTo(StringBuilder buf, String indent) {
      return unparse(buf.append(indent)).append('\n');
    }
  }

  /** Leaf holding an exact rational number. */
  public static final class Rational extends Leaf {
    public final BigFraction value;

    Rational(BigFraction value) {
      super(Kind.RATIONAL);
      this.value = requireNonNull(value);
    }

    /** Whether the value is an integer. */
    public boolean isInteger() {
      return value.getDenominator().equals(BigInteger.ONE);
    }

    /** Returns -1, 0 or 1 according to the sign of the value. */
    public int signum() {
      return value.getNumerator().signum();
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Rational && value.equals(((Rational) obj).value);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append(value.getNumerator());
      if (!isInteger()) {
        buf.append('/').append(value.getDenominator());
      }
      return buf;
    }
  }

  /** Leaf holding a named symbol. */
  public static final class Symbol extends Leaf {
    public final String name;

    Symbol(String name) {
      super(Kind.SYMBOL);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Symbol && name.equals(((Symbol) obj).name);
    }

    @Override
    public Node mapSymbol(UnaryOperator<String> f) {
      final String name2 = f.apply(name);
      return name2.equals(name) ? this : new Symbol(name2);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Opaque leaf, such as {@link ExprBuilder#UNDEFINED}. */
  public static final class Other extends Leaf {
    public final String tag;

    Other(String tag) {
      super(Kind.OTHER);
      this.tag = requireNonNull(tag);
    }

    @Override
    public int hashCode() {
      return tag.hashCode() * 31 + 7;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Other && tag.equals(((Other) obj).tag);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(tag);
    }
  }

  /** Node with a head symbol and one or more children. */
  public abstract static class Branch extends Node {
    public final String head;
    public final ImmutableList<Node> children;

    Branch(Kind kind, String head, ImmutableList<Node> children) {
      super(kind);
      this.head = requireNonNull(head);
      this.children = requireNonNull(children);
      checkArgument(!kind.isLeaf());
      checkArgument(!children.isEmpty(), "branch must have children");
      checkArgument(kind.arity < 0 || kind.arity == children.size());
    }

    @Override
    public String head() {
      return head;
    }

    @Override
    public List<Node> children() {
      return children;
    }

    /** Returns the {@code i}th child. */
    public Node child(int i) {
      return children.get(i);
    }

    /**
     * Creates a copy of this node with given head and children, or returns
     * {@code this} if they are the same.
     */
    public abstract Branch copy(String head, List<Node> children);

    /**
     * Creates a copy of this node with given children, or returns {@code this}
     * if every child is identical to the current one.
     */
    public Branch withChildren(List<Node> children) {
      return copy(head, children);
    }

    /** Whether two lists contain identical (not merely equal) elements. */
    static boolean same(List<Node> list0, List<Node> list1) {
      if (list0.size() != list1.size()) {
        return false;
      }
      for (int i = 0; i < list0.size(); i++) {
        if (list0.get(i) != list1.get(i)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public void traverse(int depth, Consumer<Node> action) {
      action.accept(this);
      if (depth > 0) {
        for (Node child : children) {
          child.traverse(depth - 1, action);
        }
      }
    }

    @Override
    public void traversePostOrder(int depth, Consumer<Node> action) {
      if (depth > 0) {
        for (Node child : children) {
          child.traversePostOrder(depth - 1, action);
        }
      }
      action.accept(this);
    }

    @Override
    public void traverseLeveled(
        int depth, int level, ObjIntConsumer<Node> action) {
      action.accept(this, level);
      if (depth > 0) {
        for (Node child : children) {
          child.traverseLeveled(depth - 1, level + 1, action);
        }
      }
    }

    @Override
    public void traversePostOrderLeveled(
        int depth, int level, ObjIntConsumer<Node> action) {
      if (depth > 0) {
        for (Node child : children) {
          child.traversePostOrderLeveled(depth - 1, level + 1, action);
        }
      }
      action.accept(this, level);
    }

    @Override
    public Node recurMap(int depth, UnaryOperator<Node> f) {
      if (depth <= 0) {
        return f.apply(this);
      }
      final List<Node> newChildren =
          transformEager(children, child -> child.recurMap(depth - 1, f));
      return f.apply(withChildren(newChildren));
    }

    @Override
    public Node mapSymbol(UnaryOperator<String> f) {
      return copy(
          f.apply(head), transformEager(children, c -> c.mapSymbol(f)));
    }

    @Override
    public int hashCode() {
      return (kind.hashCode() * 31 + head.hashCode()) * 31
          + children.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Branch
              && kind == ((Branch) obj).kind
              && head.equals(((Branch) obj).head)
              && children.equals(((Branch) obj).children);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append(head).append('(');
      for (int i = 0; i < children.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        children.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    StringBuilder treeTo(StringBuilder buf, String indent) {
      buf.append(indent).append(head).append('\n');
      final String indent2 = indent + "|  ";
      for (Node child : children) {
        child.treeTo(buf, indent2);
      }
      return buf;
    }
  }

  /** Branch with exactly one child. */
  public static final class Node1 extends Branch {
    public final Node child;

    Node1(String head, Node child) {
      super(Kind.NODE1, head, ImmutableList.of(child));
      this.child = child;
    }

    @Override
    public Node1 copy(String head, List<Node> children) {
      checkArgument(children.size() == 1);
      return head.equals(this.head) && same(children, this.children)
          ? this
          : new Node1(head, children.get(0));
    }
  }

  /** Branch with exactly two children. */
  public static final class Node2 extends Branch {
    public final Node first;
    public final Node second;

    Node2(String head, Node first, Node second) {
      super(Kind.NODE2, head, ImmutableList.of(first, second));
      this.first = first;
      this.second = second;
    }

    @Override
    public Node2 copy(String head, List<Node> children) {
      checkArgument(children.size() == 2);
      return head.equals(this.head) && same(children, this.children)
          ? this
          : new Node2(head, children.get(0), children.get(1));
    }
  }

  /** Branch with exactly three children. */
  public static final class Node3 extends Branch {
    public final Node first;
    public final Node second;
    public final Node third;

    Node3(String head, Node first, Node second, Node third) {
      super(Kind.NODE3, head, ImmutableList.of(first, second, third));
      this.first = first;
      this.second = second;
      this.third = third;
    }

    @Override
    public Node3 copy(String head, List<Node> children) {
      checkArgument(children.size() == 3);
      return head.equals(this.head) && same(children, this.children)
          ? this
          : new Node3(head, children.get(0), children.get(1), children.get(2));
    }
  }

  /**
   * Branch with a variable number of children.
   *
   * <p>Used for associative heads such as "add" and "mul".
   */
  public static final class NodeN extends Branch {
    NodeN(String head, ImmutableList<Node> children) {
      super(Kind.NODEN, head, children);
    }

    @Override
    public NodeN copy(String head, List<Node> children) {
      return head.equals(this.head) && same(children, this.children)
          ? this
          : new NodeN(head, ImmutableList.copyOf(children));
    }
  }
}

// End Expr.java
