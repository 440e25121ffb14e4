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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.sygus.eval.ConditionRepairer;
import net.hydromatic.sygus.eval.ConstantRepairer;
import net.hydromatic.sygus.eval.Evaluator;
import net.hydromatic.sygus.eval.Explainer;
import net.hydromatic.sygus.eval.Interpreter;
import net.hydromatic.sygus.eval.ModelOracle;
import net.hydromatic.sygus.eval.Prop;
import net.hydromatic.sygus.eval.Rewriter;
import net.hydromatic.sygus.eval.Simplifier;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Unification session.
 *
 * <p>Holds property values, the collaborators that unification calls, and
 * the state of each candidate: its evaluation points, the applications that
 * have been purified, its condition pool and its most recent solution.
 */
public class UnifSession {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Current model of the outer solver. */
  public final ModelOracle modelOracle;

  public Evaluator evaluator = Interpreter.INSTANCE;
  public Rewriter rewriter = Simplifier.INSTANCE;
  public Explainer explainer = Explainer.EQUALITY;

  /**
   * Condition repairer; if null, a {@link ConstantRepairer} whose bound is
   * the value of {@link Prop#REPAIR_CONSTANT_BOUND}.
   */
  public @Nullable ConditionRepairer repairer;

  public Tracer tracer = Tracers.empty();

  private final Map<Term.Var, CandidateState> candidates =
      new LinkedHashMap<>();
  private final Map<Term.Var, EvaluationPoint> points = new HashMap<>();

  /**
   * Creates a UnifSession.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied.
   *
   * @param map Map that contains property values
   * @param modelOracle Current model of the outer solver
   */
  public UnifSession(Map<Prop, Object> map, ModelOracle modelOracle) {
    this.map = requireNonNull(map, "map");
    this.modelOracle = requireNonNull(modelOracle, "modelOracle");
  }

  /** Calls some code with a different tracer. */
  public void withTracer(Tracer tracer, Consumer<UnifSession> consumer) {
    final Tracer prevTracer = this.tracer;
    try {
      this.tracer = requireNonNull(tracer, "tracer");
      consumer.accept(this);
    } finally {
      this.tracer = prevTracer;
    }
  }

  /** Returns the condition repairer. */
  public ConditionRepairer repairer() {
    if (repairer != null) {
      return repairer;
    }
    return new ConstantRepairer(
        evaluator, Prop.REPAIR_CONSTANT_BOUND.intValue(map));
  }

  /** Returns the value of a term in the current model. */
  Term modelValue(Term term) {
    return modelOracle.getModelValue(term);
  }

  /**
   * Starts tracking a candidate. If it was already tracked, discards its
   * evaluation points, purified applications, condition pool and solution.
   */
  void registerCandidate(Term.Var candidate, Strategy strategy) {
    final CandidateState previous = candidates.get(candidate);
    if (previous != null) {
      previous.heads.forEach(points::remove);
    }
    candidates.put(candidate, new CandidateState(strategy));
  }

  /** Returns whether a variable is a registered candidate. */
  boolean isCandidate(Term term) {
    return term instanceof Term.Var && candidates.containsKey(term);
  }

  /** Returns the registered candidates, in order of registration. */
  List<Term.Var> candidates() {
    return ImmutableList.copyOf(candidates.keySet());
  }

  CandidateState state(Term.Var candidate) {
    final CandidateState state = candidates.get(candidate);
    if (state == null) {
      throw new UnifException("unknown candidate " + candidate);
    }
    return state;
  }

  /** Returns the type of a candidate. */
  SygusType type(Term.Var candidate) {
    return state(candidate).strategy.type();
  }

  /** Returns the evaluation point of a head, throwing if there is none. */
  EvaluationPoint point(Term.Var head) {
    final EvaluationPoint point = points.get(head);
    if (point == null) {
      throw new UnifException("no evaluation point for head " + head);
    }
    return point;
  }

  /** Creates an evaluation point with a fresh head. */
  EvaluationPoint newPoint(Term.Var candidate, List<? extends Term> args) {
    final CandidateState state = state(candidate);
    final Term.Var head =
        Terms.var(candidate.name + "_" + state.heads.size());
    final EvaluationPoint point = new EvaluationPoint(head, candidate, args);
    state.heads.add(head);
    points.put(head, point);
    tracer.onNewPoint(point);
    return point;
  }

  /** State of a candidate. */
  static class CandidateState {
    final Strategy strategy;

    /** Heads of evaluation points, in order of creation. */
    final List<Term.Var> heads = new ArrayList<>();

    /** Applications that have been purified, and their purified form. */
    final Map<Term, Term> purified = new HashMap<>();

    /** Conditions accepted so far, in order of first appearance. */
    final Set<Term> conditionPool = new LinkedHashSet<>();

    /** Whether some strategy point of this candidate has a decision tree. */
    boolean usingUnif;

    /** Most recent solution, or null. */
    @Nullable Term solution;

    CandidateState(Strategy strategy) {
      this.strategy = strategy;
    }
  }
}

// End UnifSession.java
