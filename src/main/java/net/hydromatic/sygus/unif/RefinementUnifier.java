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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.strategy.StrategyRegistrar;
import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes functions by unifying decision trees over evaluation points.
 *
 * <p>Each refinement lemma from the outer loop is purified: applications of
 * candidates are replaced by fresh heads, each standing for the function's
 * value at one constant argument tuple. On each round, the caller supplies
 * the current values of the condition enumerators, and
 * {@link #constructSolutions()} builds, for each candidate, a decision tree
 * that gives each head its model value. If that is not possible, it returns
 * lemmas that rule out the current model.
 *
 * <p>Usage:
 *
 * <ol>
 *   <li>{@link #registerCandidate} once per candidate;
 *   <li>for each refinement round, {@link #addRefinementLemma}, then
 *       {@link #setConditions} for each strategy point, then
 *       {@link #constructSolutions()}.
 * </ol>
 */
public class RefinementUnifier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RefinementUnifier.class);

  private final UnifSession session;
  private final StrategyRegistrar registrar = new StrategyRegistrar();
  private final Purifier purifier;

  /** Decision trees, keyed by strategy point. */
  private final Map<Term.Var, DecisionTree> decisionTrees =
      new LinkedHashMap<>();

  public RefinementUnifier(UnifSession session) {
    this.session = session;
    this.purifier = new Purifier(session);
  }

  public UnifSession session() {
    return session;
  }

  /**
   * Registers a candidate and its strategy, and creates a decision tree for
   * each eligible strategy point.
   *
   * <p>Registering a candidate again discards its evaluation points and
   * decision trees.
   */
  public StrategyRegistrar.Registration registerCandidate(
      Term.Var candidate, Strategy strategy) {
    if (!strategy.candidate.equals(candidate)) {
      throw new IllegalArgumentException(
          "strategy is for " + strategy.candidate + ", not " + candidate);
    }
    session.registerCandidate(candidate, strategy);
    decisionTrees.values().removeIf(dt -> dt.candidate.equals(candidate));
    final StrategyRegistrar.Registration registration =
        registrar.register(strategy);
    for (StrategyRegistrar.StrategyPoint point : registration.points) {
      if (decisionTrees.containsKey(point.enumerator)) {
        continue;
      }
      session.state(candidate).usingUnif = true;
      decisionTrees.put(
          point.enumerator,
          new DecisionTree(
              session,
              candidate,
              point.enumerator,
              strategy.getEnumeratorInfo(point.conditionEnumerator)));
    }
    return registration;
  }

  /**
   * Purifies a refinement lemma, creating evaluation points for new
   * applications, and adds them to the decision trees of their candidate.
   */
  public RefinementResult addRefinementLemma(Term lemma) {
    final Map<Term.Var, Integer> previousCounts = new LinkedHashMap<>();
    for (Term.Var candidate : session.candidates()) {
      previousCounts.put(candidate, session.state(candidate).heads.size());
    }
    final Term purified = purifier.purifyLemma(lemma);
    final ImmutableListMultimap.Builder<Term.Var, Term.Var> newHeads =
        ImmutableListMultimap.builder();
    previousCounts.forEach(
        (candidate, previousCount) -> {
          final List<Term.Var> heads = session.state(candidate).heads;
          for (Term.Var head : heads.subList(previousCount, heads.size())) {
            newHeads.put(candidate, head);
            for (DecisionTree dt : decisionTrees.values()) {
              if (dt.candidate.equals(candidate)) {
                dt.addHead(head);
              }
            }
          }
        });
    session.tracer.onPurify(lemma, purified);
    LOGGER.debug("purified {} to {}", lemma, purified);
    return new RefinementResult(purified, newHeads.build());
  }

  /** Sets the current values of the condition enumerators of a point. */
  public void setConditions(
      Term.Var strategyPoint,
      Term guard,
      List<Term.Var> enumerators,
      List<Term> conditions) {
    decisionTree(strategyPoint).setConditions(guard, enumerators, conditions);
  }

  /** Records that the output of a head is entailed at a strategy point. */
  public void setEntailed(Term.Var strategyPoint, Term.Var head) {
    decisionTree(strategyPoint).setEntailed(head);
  }

  /**
   * Constructs a solution for every candidate.
   *
   * <p>Candidates that do not use unification get their model value. The
   * result is successful only if every candidate has a solution; candidates
   * that fail contribute lemmas instead.
   */
  public SolutionResult constructSolutions() {
    final ImmutableMap.Builder<Term.Var, Term> solutions =
        ImmutableMap.builder();
    final List<Term> lemmas = new ArrayList<>();
    boolean successful = true;
    for (Term.Var candidate : session.candidates()) {
      final UnifSession.CandidateState state = session.state(candidate);
      if (!state.usingUnif) {
        solutions.put(candidate, session.modelValue(candidate));
        continue;
      }
      final Term solution = constructSolution(candidate, state, lemmas);
      if (solution == null) {
        successful = false;
        continue;
      }
      state.solution = solution;
      solutions.put(candidate, solution);
      session.tracer.onSolution(candidate, solution);
    }
    return new SolutionResult(
        solutions.build(), ImmutableList.copyOf(lemmas), successful);
  }

  private @Nullable Term constructSolution(
      Term.Var candidate, UnifSession.CandidateState state, List<Term> lemmas) {
    final Term.Var root = state.strategy.rootEnumerator;
    final DecisionTree dt = decisionTrees.get(root);
    if (dt == null) {
      LOGGER.debug("{} has no decision tree at its root", candidate);
      return session.modelValue(candidate);
    }
    if (dt.heads().isEmpty()) {
      return session.modelValue(root);
    }
    return dt.buildSolution(lemmas);
  }

  /** Returns whether a candidate has a decision tree. */
  public boolean usingUnif(Term.Var candidate) {
    return session.isCandidate(candidate) && session.state(candidate).usingUnif;
  }

  /** Returns the condition enumerator of a strategy point. */
  public Term.Var getConditionEnumerator(Term.Var strategyPoint) {
    return decisionTree(strategyPoint).conditionEnumerator;
  }

  /** Returns the condition enumerators of a candidate's strategy points. */
  public List<Term.Var> getConditionEnumerators(Term.Var candidate) {
    final List<Term.Var> list = new ArrayList<>();
    for (DecisionTree dt : decisionTrees.values()) {
      if (dt.candidate.equals(candidate)
          && !list.contains(dt.conditionEnumerator)) {
        list.add(dt.conditionEnumerator);
      }
    }
    return list;
  }

  /** Returns the heads of a candidate's evaluation points. */
  public List<Term.Var> getEvalPointHeads(Term.Var candidate) {
    return ImmutableList.copyOf(session.state(candidate).heads);
  }

  /** Returns the evaluation point of a head. */
  public EvaluationPoint getEvaluationPoint(Term.Var head) {
    return session.point(head);
  }

  /** Returns the construction state of a strategy point. */
  public DecisionTree.State getState(Term.Var strategyPoint) {
    return decisionTree(strategyPoint).state();
  }

  private DecisionTree decisionTree(Term.Var strategyPoint) {
    final DecisionTree dt = decisionTrees.get(strategyPoint);
    if (dt == null) {
      throw new UnifException(strategyPoint + " is not a strategy point");
    }
    return dt;
  }

  /** Result of {@link #addRefinementLemma(Term)}. */
  public static class RefinementResult {
    /** Purified lemma, including guards. */
    public final Term lemma;

    /** Heads created by this lemma, by candidate. */
    public final ImmutableListMultimap<Term.Var, Term.Var> newHeads;

    RefinementResult(
        Term lemma, ImmutableListMultimap<Term.Var, Term.Var> newHeads) {
      this.lemma = lemma;
      this.newHeads = newHeads;
    }
  }

  /** Result of {@link #constructSolutions()}. */
  public static class SolutionResult {
    /** Solutions of the candidates that have one. */
    public final ImmutableMap<Term.Var, Term> solutions;

    /** Lemmas for the outer solver; may be non-empty even on success. */
    public final ImmutableList<Term> lemmas;

    public final boolean successful;

    SolutionResult(
        ImmutableMap<Term.Var, Term> solutions,
        ImmutableList<Term> lemmas,
        boolean successful) {
      this.solutions = solutions;
      this.lemmas = lemmas;
      this.successful = successful;
    }
  }
}

// End RefinementUnifier.java
