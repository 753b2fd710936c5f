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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.symbolic.ast.Expr;
import net.hydromatic.symbolic.ast.ExprBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Definition of a qualifier head, such as "sum" or "forall", whose nodes bind
 * variables.
 *
 * <p>The child at {@link #declPosition} declares the variables: either a
 * single symbol or a {@code tuple} of symbols. The variables are bound within
 * the children listed in {@link #scope}, or within every child if the scope
 * is null.
 */
public final class QualifierDef {
  public final String head;
  public final int declPosition;
  public final @Nullable ImmutableSet<Integer> scope;

  private QualifierDef(
      String head, int declPosition, @Nullable ImmutableSet<Integer> scope) {
    this.head = requireNonNull(head);
    this.declPosition = declPosition;
    this.scope = scope;
    checkArgument(declPosition >= 0, "invalid position %s", declPosition);
  }

  /**
   * Creates a definition whose first child declares the variables, which are
   * in scope in every child.
   */
  public static QualifierDef of(String head) {
    return new QualifierDef(head, 0, null);
  }

  /** Creates a definition with a given declaration position and scope. */
  public static QualifierDef of(
      String head, int declPosition, Iterable<Integer> scope) {
    return new QualifierDef(head, declPosition, ImmutableSet.copyOf(scope));
  }

  @Override
  public String toString() {
    return "qualifier " + head;
  }

  /** Returns whether the variables are in scope in a given child. */
  public boolean inScope(int childOrdinal) {
    return scope == null || scope.contains(childOrdinal);
  }

  /**
   * Returns the names of the variables that a node declares, or an empty list
   * if the node is not an application of this qualifier.
   */
  public ImmutableList<String> qualifiedVariables(Expr.Node node) {
    if (!node.head().equals(head) || node.children().size() <= declPosition) {
      return ImmutableList.of();
    }
    final Expr.Node decl = node.children().get(declPosition);
    if (decl instanceof Expr.Symbol) {
      return ImmutableList.of(((Expr.Symbol) decl).name);
    }
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    if (decl.head().equals(ExprBuilder.TUPLE)) {
      for (Expr.Node child : decl.children()) {
        if (child instanceof Expr.Symbol) {
          names.add(((Expr.Symbol) child).name);
        }
      }
    }
    return names.build();
  }
}

// End QualifierDef.java
