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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import net.hydromatic.symbolic.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of variables that are bound at a position in an expression tree.
 *
 * <p>A variable is bound by a qualifier node (such as a sum or an integral)
 * and is in scope within some of that node's children.
 *
 * <p>Every context is immutable; when you call {@link #bind}, a new context is
 * created that inherits from the previous context. The new context may
 * obscure bindings in the old context, but neither the new nor the old will
 * ever change.
 *
 * <p>To create an empty context, call {@link Contexts#empty()}.
 */
public abstract class Context {
  /**
   * Visits every binding in this context, passing the variable name and the
   * qualifier node that bound it.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(BiConsumer<String, Expr.Node> consumer);

  /**
   * Converts this context to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically.
   */
  public String asString() {
    return getBinderMap().keySet().toString();
  }

  /** Returns the qualifier that binds {@code name}, or null if not bound. */
  public abstract Expr.@Nullable Node getOpt(String name);

  /** Returns whether a variable is bound. */
  public boolean isBound(String name) {
    return getOpt(name) != null;
  }

  /**
   * Creates a context that is the same as this context, plus one more
   * variable.
   */
  public Context bind(String name, Expr.Node binder) {
    return new Contexts.SubContext(this, name, binder);
  }

  /**
   * Creates a context that is the same as this context, plus the given
   * variables, all bound by the same qualifier.
   */
  public final Context bindAll(Iterable<String> names, Expr.Node binder) {
    Context context = this;
    for (String name : names) {
      context = context.bind(name, binder);
    }
    return context;
  }

  /** Returns the names of the bound variables, most recent first. */
  public final Set<String> boundNames() {
    final Set<String> names = new LinkedHashSet<>();
    visit((name, binder) -> names.add(name));
    return names;
  }

  /** Returns a map from each visible variable to its binder. */
  public final Map<String, Expr.Node> getBinderMap() {
    final Map<String, Expr.Node> map = new LinkedHashMap<>();
    visit(map::putIfAbsent);
    return map;
  }
}

// End Context.java
