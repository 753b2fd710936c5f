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
package net.hydromatic.symbolic.util;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Partial orders, and decomposition of a set into chains. */
public abstract class PartialOrder {
  private PartialOrder() {}

  /** Result of comparing two elements in a partial order. */
  public enum Result {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE;

    /** Returns the result of the comparison with its arguments swapped. */
    public Result reverse() {
      switch (this) {
        case LESS:
          return GREATER;
        case GREATER:
          return LESS;
        default:
          return this;
      }
    }

    /** Converts the result of {@link Comparable#compareTo}. */
    public static Result of(int c) {
      return c < 0 ? LESS : c > 0 ? GREATER : EQUAL;
    }
  }

  /**
   * Compares two elements of a partially ordered set.
   *
   * @param <E> Element type
   */
  @FunctionalInterface
  public interface Comparison<E> {
    Result compare(E e0, E e1);
  }

  /**
   * Decomposes a list into the minimum number of chains.
   *
   * <p>Each chain is in ascending order: each element is {@link Result#LESS}
   * than or {@link Result#EQUAL} to the next. Elements that are equal keep
   * their relative order. Chains are ordered by the position of their first
   * element in {@code elements}.
   *
   * <p>By Dilworth's theorem, the minimum number of chains is the size of a
   * maximum matching in the bipartite graph whose edges are the pairs
   * {@code (i, j)} with element {@code i} below element {@code j}; we find the
   * matching by augmenting paths.
   */
  public static <E> List<List<E>> chains(
      List<E> elements, Comparison<? super E> comparison) {
    final int n = elements.size();
    final List<List<Integer>> successors = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      final List<Integer> list = new ArrayList<>();
      for (int j = 0; j < n; j++) {
        if (i != j && below(comparison, elements, i, j)) {
          list.add(j);
        }
      }
      successors.add(list);
    }

    // next[i] is the element after i in its chain; prev[j] the one before j.
    final int[] next = new int[n];
    final int[] prev = new int[n];
    Arrays.fill(next, -1);
    Arrays.fill(prev, -1);
    for (int i = 0; i < n; i++) {
      augment(i, successors, next, prev, new boolean[n]);
    }

    final ImmutableList.Builder<List<E>> chains = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      if (prev[i] >= 0) {
        continue;
      }
      final ImmutableList.Builder<E> chain = ImmutableList.builder();
      for (int j = i; j >= 0; j = next[j]) {
        chain.add(elements.get(j));
      }
      chains.add(chain.build());
    }
    return chains.build();
  }

  private static <E> boolean below(
      Comparison<? super E> comparison, List<E> elements, int i, int j) {
    switch (comparison.compare(elements.get(i), elements.get(j))) {
      case LESS:
        return true;
      case EQUAL:
        return i < j;
      default:
        return false;
    }
  }

  /** Tries to find an augmenting path from left vertex {@code i}. */
  private static boolean augment(int i, List<List<Integer>> successors,
      int[] next, int[] prev, boolean[] visited) {
    for (int j : successors.get(i)) {
      if (visited[j]) {
        continue;
      }
      visited[j] = true;
      if (prev[j] < 0
          || augment(prev[j], successors, next, prev, visited)) {
        next[i] = j;
        prev[j] = i;
        return true;
      }
    }
    return false;
  }
}

// End PartialOrder.java
