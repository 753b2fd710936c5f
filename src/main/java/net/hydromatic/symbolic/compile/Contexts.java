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

import java.util.function.BiConsumer;
import net.hydromatic.symbolic.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Context}. */
public abstract class Contexts {
  private Contexts() {}

  /** Returns the empty context, in which no variables are bound. */
  public static Context empty() {
    return EmptyContext.INSTANCE;
  }

  /** Context that inherits from a parent context and binds one variable. */
  static class SubContext extends Context {
    private final Context parent;
    private final String name;
    private final Expr.Node binder;

    SubContext(Context parent, String name, Expr.Node binder) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.binder = requireNonNull(binder);
    }

    @Override
    public String toString() {
      return name + ", ...";
    }

    @Override
    public Expr.@Nullable Node getOpt(String name) {
      if (name.equals(this.name)) {
        return binder;
      }
      return parent.getOpt(name);
    }

    @Override
    public Context bind(String name, Expr.Node binder) {
      Context context;
      if (this.name.equals(name)) {
        // The new binding obscures this one. Bind the parent instead, so that
        // long chains do not form.
        context = parent;
        while (context instanceof SubContext
            && ((SubContext) context).name.equals(name)) {
          context = ((SubContext) context).parent;
        }
      } else {
        context = this;
      }
      return new SubContext(context, name, binder);
    }

    @Override
    void visit(BiConsumer<String, Expr.Node> consumer) {
      consumer.accept(name, binder);
      parent.visit(consumer);
    }
  }

  /** Context that binds no variables. */
  private static class EmptyContext extends Context {
    static final EmptyContext INSTANCE = new EmptyContext();

    @Override
    public String toString() {
      return "[]";
    }

    @Override
    void visit(BiConsumer<String, Expr.Node> consumer) {}

    @Override
    public Expr.@Nullable Node getOpt(String name) {
      return null;
    }
  }
}

// End Contexts.java
