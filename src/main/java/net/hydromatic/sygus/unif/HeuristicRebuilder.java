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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a decision tree top-down, at each node choosing the condition
 * with the greatest information gain.
 *
 * <p>Entropy is computed over the output values of the points in a node,
 * using base-2 logarithms. Ties go to the condition that comes first.
 * Conditions that send every point of a node the same way are not
 * considered at that node.
 *
 * <p>If some impure node has no condition that splits it, the rebuild fails
 * and the caller uses the tree it built incrementally.
 */
class HeuristicRebuilder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(HeuristicRebuilder.class);

  private final PointSeparator separator;
  private final Set<Term.Var> entailed;

  HeuristicRebuilder(PointSeparator separator, Set<Term.Var> entailed) {
    this.separator = separator;
    this.entailed = entailed;
  }

  /**
   * Returns a solution that classifies the given heads, or null.
   *
   * <p>If all heads have the same value and there is at least one
   * condition, the tree is a single split on the last condition, whose
   * branches then collapse.
   */
  @Nullable Term rebuild(
      List<Term.Var> heads, List<Term> conditions, Map<Term.Var, Term> values) {
    if (heads.isEmpty()) {
      return null;
    }
    final @Nullable Node root;
    if (isPure(heads, values) && !conditions.isEmpty()) {
      final Term last = conditions.get(conditions.size() - 1);
      final Term value = values.get(heads.get(0));
      checkState(value != null);
      root = new Node(last, new Node(value), new Node(value));
    } else {
      root = build(heads, new ArrayList<>(conditions), values);
    }
    if (root == null) {
      LOGGER.debug("heuristic rebuild failed; using incremental tree");
      return null;
    }
    return root.toTerm(separator);
  }

  private @Nullable Node build(
      List<Term.Var> heads, List<Term> conditions, Map<Term.Var, Term> values) {
    if (isPure(heads, values)) {
      final Term value = values.get(heads.get(0));
      checkState(value != null);
      return new Node(value);
    }
    if (conditions.isEmpty()) {
      return null;
    }
    final double entropy = entropy(heads, values);
    int best = -1;
    double bestGain = Double.NEGATIVE_INFINITY;
    List<Term.Var> bestTrue = null;
    List<Term.Var> bestFalse = null;
    for (int i = 0; i < conditions.size(); i++) {
      final List<Term.Var> ifTrue = new ArrayList<>();
      final List<Term.Var> ifFalse = new ArrayList<>();
      split(conditions.get(i), heads, ifTrue, ifFalse);
      if (ifTrue.isEmpty() || ifFalse.isEmpty()) {
        continue;
      }
      final double gain =
          entropy
              - weightedEntropy(ifTrue, heads.size(), values)
              - weightedEntropy(ifFalse, heads.size(), values);
      if (gain > bestGain) {
        best = i;
        bestGain = gain;
        bestTrue = ifTrue;
        bestFalse = ifFalse;
      }
    }
    if (bestTrue == null || bestFalse == null) {
      LOGGER.debug("no condition splits {} points", heads.size());
      return null;
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "split {} points ({} entailed) on {}, gain {}",
          heads.size(),
          heads.stream().filter(entailed::contains).count(),
          conditions.get(best),
          bestGain);
    }
    final List<Term> remaining = new ArrayList<>(conditions);
    final Term condition = remaining.remove(best);
    final Node ifTrue = build(bestTrue, remaining, values);
    final Node ifFalse = build(bestFalse, remaining, values);
    if (ifTrue == null || ifFalse == null) {
      return null;
    }
    return new Node(condition, ifTrue, ifFalse);
  }

  private void split(
      Term condition,
      List<Term.Var> heads,
      List<Term.Var> ifTrue,
      List<Term.Var> ifFalse) {
    for (Term.Var head : heads) {
      if (separator.computeCondition(condition, head).equals(Terms.TRUE)) {
        ifTrue.add(head);
      } else {
        ifFalse.add(head);
      }
    }
  }

  private static boolean isPure(
      List<Term.Var> heads, Map<Term.Var, Term> values) {
    final Term first = values.get(heads.get(0));
    for (Term.Var head : heads) {
      if (!values.get(head).equals(first)) {
        return false;
      }
    }
    return true;
  }

  /** Entropy, in bits, of the values of a list of heads. */
  static double entropy(List<Term.Var> heads, Map<Term.Var, Term> values) {
    if (heads.isEmpty()) {
      return 0d;
    }
    final Map<Term, Integer> counts = new HashMap<>();
    for (Term.Var head : heads) {
      counts.merge(values.get(head), 1, Integer::sum);
    }
    double entropy = 0d;
    for (int count : counts.values()) {
      final double p = (double) count / heads.size();
      entropy -= p * Math.log(p) / Math.log(2);
    }
    return entropy;
  }

  private static double weightedEntropy(
      List<Term.Var> heads, int total, Map<Term.Var, Term> values) {
    return (double) heads.size() / total * entropy(heads, values);
  }

  /** Node of a rebuilt tree; a leaf if {@link #value} is not null. */
  private static class Node {
    final @Nullable Term value;
    final @Nullable Term condition;
    final @Nullable Node ifTrue;
    final @Nullable Node ifFalse;

    Node(Term value) {
      this.value = value;
      this.condition = null;
      this.ifTrue = null;
      this.ifFalse = null;
    }

    Node(Term condition, Node ifTrue, Node ifFalse) {
      this.value = null;
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    Term toTerm(PointSeparator separator) {
      if (value != null) {
        return value;
      }
      checkState(condition != null && ifTrue != null && ifFalse != null);
      final Term t = ifTrue.toTerm(separator);
      final Term f = ifFalse.toTerm(separator);
      return t.equals(f) ? t : Terms.ite(separator.guard(condition), t, f);
    }
  }
}

// End HeuristicRebuilder.java
