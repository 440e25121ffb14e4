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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Table;
import java.util.Map;
import net.hydromatic.sygus.eval.Prop;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Classifies the evaluation points of a decision tree by the outcomes of its
 * conditions, and extracts a solution from the resulting classes.
 *
 * <p>The outcome of a condition on a point is cached until
 * {@link #clearCache()}.
 */
class PointSeparator implements ClassificationTrie.Classifier {
  final ClassificationTrie trie = new ClassificationTrie();

  private final DecisionTree tree;
  private final Strategy.EnumeratorInfo conditionInfo;
  private final Table<Term, Term.Var, Term> cache = HashBasedTable.create();

  PointSeparator(DecisionTree tree, Strategy.EnumeratorInfo conditionInfo) {
    this.tree = tree;
    this.conditionInfo = conditionInfo;
  }

  @Override
  public Term evaluate(Term.Var head, int index) {
    return computeCondition(tree.condition(index), head);
  }

  /** Returns the outcome of a condition on the point of a head. */
  Term computeCondition(Term condition, Term.Var head) {
    final Term cached = cache.get(condition, head);
    if (cached != null) {
      return cached;
    }
    final UnifSession session = tree.session;
    final EvaluationPoint point = session.point(head);
    final Term result =
        session.evaluator.evaluate(
            conditionInfo.type, guard(condition), point.args);
    checkState(
        result.isLiteral(),
        "condition %s on %s did not evaluate to a constant: %s",
        condition,
        point,
        result);
    cache.put(condition, head, result);
    return result;
  }

  /**
   * Returns the guard of a split on a condition; the condition itself, or
   * the template instantiated with the condition.
   */
  Term guard(Term condition) {
    return conditionInfo.template == null
        ? condition
        : applyTemplate(condition);
  }

  private Term applyTemplate(Term value) {
    final Term template = conditionInfo.template;
    final Term.Var arg = conditionInfo.templateArg;
    checkState(template != null && arg != null);
    return template.substitute(ImmutableMap.of(arg, value));
  }

  void clearCache() {
    cache.clear();
  }

  /**
   * Extracts a solution from the trie.
   *
   * <p>If {@link Prop#BOOLEAN_HEURISTIC_DT} is set, first tries to rebuild
   * the tree by information gain.
   */
  Term extractSolution(Map<Term.Var, Term> headValues) {
    if (Prop.BOOLEAN_HEURISTIC_DT.booleanValue(tree.session.map)) {
      final Term solution =
          new HeuristicRebuilder(this, tree.entailedHeads())
              .rebuild(tree.heads(), tree.conditionsForRebuild(), headValues);
      if (solution != null) {
        return solution;
      }
    }
    return trie.fold(
        new ClassificationTrie.Folder<Term>() {
          @Override
          public Term leaf(Term.Var representative) {
            final Term value = headValues.get(representative);
            checkState(value != null, "no value for %s", representative);
            return value;
          }

          @Override
          public Term node(int level, Map<Term, Term> children) {
            final @Nullable Term ifTrue = children.get(Terms.TRUE);
            final @Nullable Term ifFalse = children.get(Terms.FALSE);
            final int booleanCount =
                (ifTrue == null ? 0 : 1) + (ifFalse == null ? 0 : 1);
            checkState(
                children.size() == booleanCount,
                "non-boolean outcome at level %s: %s",
                level,
                children.keySet());
            if (ifTrue == null) {
              return requireValue(ifFalse);
            }
            if (ifFalse == null || ifTrue.equals(ifFalse)) {
              return ifTrue;
            }
            return Terms.ite(guard(tree.condition(level)), ifTrue, ifFalse);
          }
        });
  }

  private static Term requireValue(@Nullable Term term) {
    checkState(term != null);
    return term;
  }
}

// End PointSeparator.java
