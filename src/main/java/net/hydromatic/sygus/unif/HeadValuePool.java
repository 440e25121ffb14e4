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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;

/**
 * Output values seen so far for the heads of a decision tree, used to find
 * a value that is compatible with several points.
 *
 * <p>Value {@code v} is compatible with head {@code h} if {@code v}, applied
 * to the arguments of {@code h}'s point, gives the same result as the model
 * value of {@code h} does. Compatibility is computed lazily, when a head's
 * compatible values are requested.
 */
class HeadValuePool {
  private final UnifSession session;
  private final SygusType type;

  /** All values, in order of first appearance. */
  private final List<Term> values = new ArrayList<>();
  private final Set<Term> valueSet = new LinkedHashSet<>();

  /** Result of applying each head's own value to its point. */
  private final Map<Term.Var, Term> currentEvals = new HashMap<>();

  /** For each head, values grouped by their result on the head's point. */
  private final Map<Term.Var, Map<Term, Set<Term>>> equivalentValues =
      new HashMap<>();

  /** For each head, how many of {@link #values} have been grouped. */
  private final Map<Term.Var, Integer> processed = new HashMap<>();

  HeadValuePool(UnifSession session, SygusType type) {
    this.session = session;
    this.type = type;
  }

  /** Adds a head's model value to the pool. */
  void add(Term.Var head, Term value) {
    if (valueSet.add(value)) {
      values.add(value);
    }
    currentEvals.put(head, evaluate(value, head));
  }

  /** Returns the result of applying a head's model value to its point. */
  Term currentEval(Term.Var head) {
    final Term result = currentEvals.get(head);
    if (result == null) {
      throw new UnifException("no value in pool for head " + head);
    }
    return result;
  }

  /** Returns the values that are compatible with a head, in pool order. */
  Set<Term> compatibleValues(Term.Var head) {
    final Map<Term, Set<Term>> groups =
        equivalentValues.computeIfAbsent(head, h -> new LinkedHashMap<>());
    int start = processed.getOrDefault(head, 0);
    for (int i = start; i < values.size(); i++) {
      final Term value = values.get(i);
      groups
          .computeIfAbsent(evaluate(value, head), r -> new LinkedHashSet<>())
          .add(value);
    }
    processed.put(head, values.size());
    final Set<Term> compatible = groups.get(currentEval(head));
    return compatible == null ? new LinkedHashSet<>() : compatible;
  }

  private Term evaluate(Term value, Term.Var head) {
    return session.evaluator.evaluate(type, value, session.point(head).args);
  }
}

// End HeadValuePool.java
