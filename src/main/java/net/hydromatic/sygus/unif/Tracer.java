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

import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during unification. */
public interface Tracer {
  /** Called when a refinement lemma has been purified. */
  void onPurify(Term lemma, Term purifiedLemma);

  /** Called when purification creates an evaluation point. */
  void onNewPoint(EvaluationPoint point);

  /**
   * Called when the decision tree of a strategy point moves from one state
   * to another.
   */
  void onTransition(
      Term.Var strategyPoint, DecisionTree.State from, DecisionTree.State to);

  /** Called when a condition is taken from the pool to separate two points. */
  void onPoolCondition(Term.Var strategyPoint, Term condition);

  /**
   * Called when construction of a decision tree fails. The lemma is null if
   * the failure yields no lemma.
   */
  void onConflict(Term.Var strategyPoint, @Nullable Term lemma);

  /** Called when a solution has been constructed for a candidate. */
  void onSolution(Term.Var candidate, Term solution);
}

// End Tracer.java
