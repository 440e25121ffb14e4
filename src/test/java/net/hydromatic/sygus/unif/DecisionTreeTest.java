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

import static net.hydromatic.sygus.unif.Fixture.C;
import static net.hydromatic.sygus.unif.Fixture.E;
import static net.hydromatic.sygus.unif.Fixture.F;
import static net.hydromatic.sygus.unif.Fixture.X;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sygus.eval.Prop;
import net.hydromatic.sygus.strategy.NodeRole;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.strategy.StrategyType;
import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.junit.jupiter.api.Test;

/** Tests {@link DecisionTree}. */
public class DecisionTreeTest {
  /** Two points separated by the enumerated condition. */
  @Test
  void testSeparatedByEnumeratedCondition() {
    final Fixture f = Fixture.bool().register();
    f.point(0, Terms.TRUE);
    f.point(1, Terms.FALSE);
    f.conditions(Terms.gt(X, Terms.literal(0)));

    final List<DecisionTree.State> states = new ArrayList<>();
    f.session.tracer =
        Tracers.withOnTransition(
            Tracers.empty(), (point, to) -> states.add(to));
    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    assertThat(result.lemmas.isEmpty(), is(true));
    final Term solution = result.solutions.get(F);
    // branches follow each point's outcome, not the order points were added
    assertThat(solution, hasToString("(ite (> x 0) false true)"));
    f.checkSolution(solution);
    assertThat(
        states,
        hasToString("[RESOLVING_CONFLICT, COLLECTING, SOLVED]"));
    assertThat(f.unifier.getState(E), is(DecisionTree.State.SOLVED));
  }

  /** Two points with different outputs and no conditions at all. */
  @Test
  void testConflictWithoutConditions() {
    final Fixture f = Fixture.bool().register();
    f.point(0, Terms.TRUE);
    f.point(1, Terms.FALSE);
    f.conditions();

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.solutions.containsKey(F), is(false));
    assertThat(result.lemmas, hasSize(1));
    assertThat(
        result.lemmas.get(0), hasToString("(not (and (not (= f_1 f_0)) G))"));
    f.checkExcludesModel(result.lemmas.get(0));
    assertThat(f.unifier.getState(E), is(DecisionTree.State.CONFLICT));
  }

  /** Points with equal outputs share a class and need no condition. */
  @Test
  void testMergeWithEqualOutputs() {
    final Fixture f = Fixture.integer().register();
    f.point(0, Terms.literal(5));
    f.point(1, Terms.literal(5));
    f.point(2, Terms.literal(5));
    f.conditions();

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    assertThat(result.solutions.get(F), hasToString("5"));
  }

  /** Three points need two levels; the first split leaves a residual
   * conflict between the second and third points. */
  @Test
  void testResidualConflict() {
    final Fixture f = Fixture.integer().register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.point(2, Terms.literal(2));
    f.conditions(
        Terms.gt(X, Terms.literal(0)), Terms.gt(X, Terms.literal(1)));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    final Term solution = result.solutions.get(F);
    assertThat(solution, hasToString("(ite (> x 0) (ite (> x 1) 2 1) 0)"));
    f.checkSolution(solution);
  }

  /** The second condition does not separate the pair it is asked to. */
  @Test
  void testConditionDoesNotSeparate() {
    final Fixture f = Fixture.integer().with(Prop.COND_POOL, false).register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.point(2, Terms.literal(2));
    f.conditions(
        Terms.gt(X, Terms.literal(0)), Terms.gt(X, Terms.literal(5)));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.lemmas, hasSize(1));
    // no guard: the failure is due to the values of the enumerators
    assertThat(
        result.lemmas.get(0),
        hasToString(
            "(not (and (not (= f_1 f_0)) (= c0 (> x 0))"
                + " (not (= f_2 f_1)) (= c1 (> x 5))))"));
    f.checkExcludesModel(result.lemmas.get(0));
  }

  /** Two points that were merged keep their equality in the lemma after a
   * later condition splits their class. */
  @Test
  void testMergeThenSplit() {
    final Fixture f = Fixture.integer().with(Prop.COND_POOL, false).register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(0));
    f.point(2, Terms.literal(1));
    f.conditions(Terms.gt(X, Terms.literal(0)));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.lemmas, hasSize(1));
    assertThat(
        result.lemmas.get(0),
        hasToString(
            "(not (and (= f_0 f_1) (not (= f_2 f_0)) (= c0 (> x 0))"
                + " (not (= f_2 f_1)) G))"));
    f.checkExcludesModel(result.lemmas.get(0));
  }

  /** When the enumerated condition fails, a pool condition is used. */
  @Test
  void testPoolFallback() {
    final Fixture f = Fixture.integer().register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.conditions(Terms.gt(X, Terms.literal(0)));
    assertThat(f.unifier.constructSolutions().successful, is(true));

    f.point(2, Terms.literal(2));
    f.conditions(Terms.gt(X, Terms.literal(1)));
    final List<Term> pooled = new ArrayList<>();
    f.session.tracer =
        Tracers.withOnPoolCondition(
            Tracers.empty(), (point, condition) -> pooled.add(condition));
    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    assertThat(pooled, hasToString("[(> x 0), (> x 1)]"));
    final Term solution = result.solutions.get(F);
    assertThat(solution, hasToString("(ite (> x 0) (ite (> x 1) 2 1) 0)"));
    f.checkSolution(solution);
  }

  /** A conflict after the pool was used keeps only the explanation that
   * precedes the pool, plus the guard. */
  @Test
  void testPoolBacktrack() {
    final Fixture f = Fixture.integer().register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.conditions(Terms.gt(X, Terms.literal(0)));
    assertThat(f.unifier.constructSolutions().successful, is(true));

    f.point(2, Terms.literal(2));
    f.conditions();
    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.lemmas, hasSize(1));
    assertThat(
        result.lemmas.get(0), hasToString("(not (and (not (= f_1 f_0)) G))"));
    f.checkExcludesModel(result.lemmas.get(0));
  }

  /** A condition with a constant hole is repaired to separate a pair. */
  @Test
  void testRepair() {
    final Fixture f = Fixture.bool().with(Prop.COND_POOL, false).register();
    f.point(3, Terms.FALSE);
    f.point(5, Terms.TRUE);
    f.conditions(Terms.gt(X, Terms.anyConst()));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    final Term solution = result.solutions.get(F);
    assertThat(solution, hasToString("(ite (> x 3) true false)"));
    f.checkSolution(solution);
  }

  /** Condition values are plugged into the template of their enumerator. */
  @Test
  void testTemplate() {
    final Fixture f = Fixture.integer();
    final Term.Var t = Terms.var("t");
    final Strategy strategy =
        Strategy.builder(F, E, f.type)
            .enumerator(
                C,
                f.type.withSort("bound", SygusType.Sort.INT),
                Terms.gt(X, t),
                t)
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                Strategy.point(C, NodeRole.ITE_CONDITION),
                Strategy.point(E, NodeRole.EQUAL),
                Strategy.point(E, NodeRole.EQUAL))
            .build();
    f.unifier.registerCandidate(F, strategy);
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.conditions(Terms.literal(0));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    final Term solution = result.solutions.get(F);
    assertThat(solution, hasToString("(ite (> x 0) 1 0)"));
    f.checkSolution(solution);
  }

  /** A condition with a hole is repaired even if it already separates the
   * pair when the hole is read as zero. */
  @Test
  void testRepairHoleThatSeparates() {
    final Fixture f = Fixture.bool().with(Prop.COND_POOL, false).register();
    f.point(-1, Terms.FALSE);
    f.point(1, Terms.TRUE);
    f.conditions(Terms.gt(X, Terms.anyConst()));

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    final Term solution = result.solutions.get(F);
    assertThat(solution.containsOp(Op.ANY_CONST), is(false));
    assertThat(solution, hasToString("(ite (> x -1) true false)"));
    f.checkSolution(solution);
  }

  /** Without holes, and without "repairCond", a condition is not repaired. */
  @Test
  void testNoRepairWithoutHoles() {
    final Fixture f = Fixture.bool().with(Prop.COND_POOL, false).register();
    f.point(3, Terms.FALSE);
    f.point(5, Terms.TRUE);
    f.conditions(Terms.gt(X, Terms.literal(0)));
    assertThat(f.unifier.constructSolutions().successful, is(false));

    f.with(Prop.REPAIR_COND, true);
    f.conditions(Terms.gt(X, Terms.literal(0)));
    // "repairCond" cannot change a condition that has no holes either
    assertThat(f.unifier.constructSolutions().successful, is(false));
  }

  /** Retained-value repair finds an output compatible with both points. */
  @Test
  void testRetainedValue() {
    final Fixture f = Fixture.integer().with(Prop.RET_POOL, true).register();
    final Term.Var h0 = f.point(0, Terms.literal(0));
    final Term.Var h1 = f.point(1, Terms.literal(0));
    // h0 is "x" and h1 is "0"; both give 0 at x = 0 and h1 gives 0 at x = 1
    f.model.put(h0, X);
    f.model.put(h1, Terms.literal(0));
    f.conditions();

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    assertThat(result.solutions.get(F), hasToString("0"));
    assertThat(result.lemmas, hasSize(1));
    assertThat(
        result.lemmas.get(0),
        hasToString("(or (not (= f_1 0)) (= (eval f_1 0) 0))"));

    // the unfolding lemma is sent once
    f.conditions();
    assertThat(f.unifier.constructSolutions().lemmas.isEmpty(), is(true));
  }

  /** Retained-value repair fails if no value suits every point. */
  @Test
  void testRetainedValueConflict() {
    final Fixture f = Fixture.integer().with(Prop.RET_POOL, true).register();
    final Term.Var h0 = f.point(0, Terms.literal(0));
    final Term.Var h1 = f.point(1, Terms.literal(1));
    f.model.put(h0, Terms.literal(0));
    f.model.put(h1, Terms.literal(1));
    f.conditions();

    final RefinementUnifier.SolutionResult result =
        f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.lemmas, hasSize(1));
    assertThat(
        result.lemmas.get(0),
        hasToString("(not (and (not (= (eval f_0 0) (eval f_1 0))) G))"));
  }

  /** With "condIndependent", the pool decides and failure has no lemma. */
  @Test
  void testConditionIndependent() {
    final Fixture f =
        Fixture.bool().with(Prop.COND_INDEPENDENT, true).register();
    f.point(0, Terms.TRUE);
    f.point(1, Terms.FALSE);
    f.conditions(Terms.gt(X, Terms.literal(0)));
    RefinementUnifier.SolutionResult result = f.unifier.constructSolutions();
    assertThat(result.successful, is(true));
    assertThat(
        result.solutions.get(F), hasToString("(ite (> x 0) false true)"));

    f.point(2, Terms.TRUE);
    f.conditions();
    final List<String> conflicts = new ArrayList<>();
    f.session.tracer =
        Tracers.withOnConflict(
            Tracers.empty(), (p, lemma) -> conflicts.add(p + ":" + lemma));
    result = f.unifier.constructSolutions();
    assertThat(result.successful, is(false));
    assertThat(result.lemmas.isEmpty(), is(true));
    assertThat(conflicts, hasToString("[e:null]"));
  }

  /** Each round reads the model afresh. */
  @Test
  void testModelChangesBetweenRounds() {
    final Fixture f = Fixture.integer().register();
    final Term.Var h0 = f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(1));
    f.conditions(Terms.gt(X, Terms.literal(0)));
    assertThat(
        f.unifier.constructSolutions().solutions.get(F),
        hasToString("(ite (> x 0) 1 0)"));

    f.model.put(h0, Terms.literal(1));
    f.conditions(Terms.lt(X, Terms.literal(1)));
    final Term solution = f.unifier.constructSolutions().solutions.get(F);
    assertThat(solution, notNullValue());
    assertThat(solution, hasToString("1"));
    f.checkSolution(solution);
  }

  /** Heuristic rebuilding prefers the condition with greater gain. */
  @Test
  void testHeuristicRebuild() {
    final Fixture f = Fixture.integer().register();
    f.point(0, Terms.literal(0));
    f.point(1, Terms.literal(0));
    f.point(2, Terms.literal(1));
    f.conditions(
        Terms.gt(X, Terms.literal(0)), Terms.gt(X, Terms.literal(1)));
    assertThat(
        f.unifier.constructSolutions().solutions.get(F),
        hasToString("(ite (> x 0) (ite (> x 1) 1 0) 0)"));

    f.with(Prop.BOOLEAN_HEURISTIC_DT, true);
    f.conditions(
        Terms.gt(X, Terms.literal(0)), Terms.gt(X, Terms.literal(1)));
    final Term solution = f.unifier.constructSolutions().solutions.get(F);
    assertThat(solution, hasToString("(ite (> x 1) 1 0)"));
    f.checkSolution(solution);
  }
}

// End DecisionTreeTest.java
