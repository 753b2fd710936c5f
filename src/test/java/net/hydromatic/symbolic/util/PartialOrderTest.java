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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link PartialOrder}. */
public class PartialOrderTest {
  /** Divisibility: a is below b if a divides b. */
  private static final PartialOrder.Comparison<Integer> DIVIDES =
      (a, b) -> {
        if (a.equals(b)) {
          return PartialOrder.Result.EQUAL;
        }
        if (b % a == 0) {
          return PartialOrder.Result.LESS;
        }
        if (a % b == 0) {
          return PartialOrder.Result.GREATER;
        }
        return PartialOrder.Result.INCOMPARABLE;
      };

  @Test
  void testResult() {
    assertThat(PartialOrder.Result.of(-3), is(PartialOrder.Result.LESS));
    assertThat(PartialOrder.Result.of(0), is(PartialOrder.Result.EQUAL));
    assertThat(PartialOrder.Result.of(2), is(PartialOrder.Result.GREATER));
    assertThat(PartialOrder.Result.LESS.reverse(),
        is(PartialOrder.Result.GREATER));
    assertThat(PartialOrder.Result.INCOMPARABLE.reverse(),
        is(PartialOrder.Result.INCOMPARABLE));
  }

  @Test
  void testTotalOrderIsOneChain() {
    final List<List<Integer>> chains =
        PartialOrder.chains(ImmutableList.of(3, 1, 2),
            (a, b) -> PartialOrder.Result.of(Integer.compare(a, b)));
    assertThat(chains, hasToString("[[1, 2, 3]]"));
  }

  @Test
  void testAntichain() {
    final List<List<Integer>> chains =
        PartialOrder.chains(ImmutableList.of(2, 3, 5),
            (a, b) -> PartialOrder.Result.INCOMPARABLE);
    assertThat(chains, hasToString("[[2], [3], [5]]"));
  }

  @Test
  void testDivisibility() {
    // The largest antichain is {4, 6} (or {4, 3}, etc.), so two chains
    // suffice.
    final List<List<Integer>> chains =
        PartialOrder.chains(ImmutableList.of(1, 2, 3, 4, 6, 12), DIVIDES);
    assertThat(chains, hasSize(2));
    int count = 0;
    for (List<Integer> chain : chains) {
      for (int i = 1; i < chain.size(); i++) {
        assertThat(chain.get(i) % chain.get(i - 1), is(0));
      }
      count += chain.size();
    }
    assertThat(count, is(6));
  }

  @Test
  void testEqualElementsKeepOrder() {
    final List<List<String>> chains =
        PartialOrder.chains(ImmutableList.of("b", "a1", "a2"),
            (s, t) ->
                PartialOrder.Result.of(
                    Character.compare(s.charAt(0), t.charAt(0))));
    assertThat(chains, hasToString("[[a1, a2, b]]"));
  }

  @Test
  void testEmpty() {
    assertThat(PartialOrder.chains(ImmutableList.<Integer>of(), DIVIDES),
        hasSize(0));
  }
}

// End PartialOrderTest.java
