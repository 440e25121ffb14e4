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
package net.hydromatic.sygus.unif;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conjunction of literals, accumulated while a decision tree is built, that
 * justifies the state of the construction.
 *
 * <p>If the construction fails, the negation of the explanation is a lemma
 * that rules out the current model.
 *
 * <p>When a condition is first taken from the pool, the explanation records
 * its length. Pool conditions are not implied by the model, so on failure
 * the literals added after that point are discarded.
 */
class Explanation {
  private final List<Term> literals = new ArrayList<>();
  private int backtrackSize = -1;
  private boolean backtrackNeedsGuard;

  void add(Term literal) {
    literals.add(literal);
  }

  /** Returns whether a pool condition has been used. */
  boolean usedPool() {
    return backtrackSize >= 0;
  }

  /**
   * Records that a pool condition is about to be used. Only the first call
   * has an effect.
   *
   * @param enumeratedConditionExplained Whether the explanation already
   *     mentions the condition enumerator's value for the current level
   */
  void markPoolStart(boolean enumeratedConditionExplained) {
    if (backtrackSize < 0) {
      backtrackSize = literals.size();
      backtrackNeedsGuard = !enumeratedConditionExplained;
    }
  }

  /**
   * Converts the explanation into a lemma, {@code (not (and l1 ... ln))}.
   *
   * <p>If a pool condition was used, first truncates to the recorded length
   * and, where no enumerated condition was explained at that level, appends
   * the guard.
   */
  Term toLemma(@Nullable Term guard) {
    final List<Term> list = new ArrayList<>(literals);
    if (usedPool()) {
      checkState(
          backtrackSize < list.size(),
          "explanation did not grow after pool was used");
      list.subList(backtrackSize, list.size()).clear();
      if (backtrackNeedsGuard && guard != null) {
        list.add(guard);
      }
    }
    checkState(!list.isEmpty(), "empty explanation");
    return Terms.negate(Terms.and(list));
  }

  @Override
  public String toString() {
    return literals.toString();
  }
}

// End Explanation.java
