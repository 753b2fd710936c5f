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

import com.google.common.collect.ImmutableList;

/**
 * Structural kinds of {@link Expr.Node}.
 *
 * <p>The set is closed; every node is exactly one of these kinds. The
 * declaration order is the rank used by {@link Expr#ORDERING}.
 */
public enum Kind {
  /** Opaque leaf, such as "undefined". */
  OTHER(0),
  /** Exact rational number. */
  RATIONAL(0),
  /** Named symbol. */
  SYMBOL(0),
  /** Branch with one child. */
  NODE1(1),
  /** Branch with two children. */
  NODE2(2),
  /** Branch with three children. */
  NODE3(3),
  /** Branch with any positive number of children. */
  NODEN(-1);

  /**
   * Number of children; 0 for leaves, -1 for {@link #NODEN}, whose arity is
   * not fixed.
   */
  public final int arity;

  /** The branch kinds. */
  public static final ImmutableList<Kind> BRANCHES =
      ImmutableList.of(NODE1, NODE2, NODE3, NODEN);

  Kind(int arity) {
    this.arity = arity;
  }

  /** Whether nodes of this kind have no children. */
  public boolean isLeaf() {
    return arity == 0;
  }
}

// End Kind.java
