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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Structural signature of a node: its kind and, for a branch, its head
 * symbol.
 *
 * <p>Leaves have an empty head, so all symbols share one signature, as do all
 * rationals.
 */
public final class Signature implements Comparable<Signature> {
  public final Kind kind;
  public final String head;

  public static final Signature RATIONAL = new Signature(Kind.RATIONAL, "");
  public static final Signature SYMBOL = new Signature(Kind.SYMBOL, "");
  public static final Signature OTHER = new Signature(Kind.OTHER, "");

  private Signature(Kind kind, String head) {
    this.kind = requireNonNull(kind);
    this.head = requireNonNull(head);
  }

  /** Creates a signature. */
  public static Signature of(Kind kind, String head) {
    switch (kind) {
      case RATIONAL:
        return RATIONAL;
      case SYMBOL:
        return SYMBOL;
      case OTHER:
        return OTHER;
      default:
        return new Signature(kind, head);
    }
  }

  /** Returns the signature of a node. */
  public static Signature of(Expr.Node node) {
    return of(node.kind, node.head());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, head);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Signature
            && kind == ((Signature) obj).kind
            && head.equals(((Signature) obj).head);
  }

  @Override
  public int compareTo(Signature o) {
    int c = kind.compareTo(o.kind);
    if (c != 0) {
      return c;
    }
    return head.compareTo(o.head);
  }

  @Override
  public String toString() {
    return head + ":" + kind;
  }
}

// End Signature.java
