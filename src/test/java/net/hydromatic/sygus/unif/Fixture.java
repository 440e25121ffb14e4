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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sygus.eval.Interpreter;
import net.hydromatic.sygus.eval.ModelOracle;
import net.hydromatic.sygus.eval.Prop;
import net.hydromatic.sygus.strategy.NodeRole;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.strategy.StrategyType;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;

/**
 * Test fixture: a candidate {@code f} with one formal {@code x}, whose
 * strategy is a single if-then-else at root enumerator {@code e} with
 * condition enumerator {@code c}, and a model backed by a map.
 */
class Fixture {
  static final Term.Var X = Terms.var("x");
  static final Term.Var F = Terms.var("f");
  static final Term.Var E = Terms.var("e");
  static final Term.Var C = Terms.var("c");
  static final Term.Var G = Terms.var("G");

  final Map<Prop, Object> props = new LinkedHashMap<>();
  final MapModel model = new MapModel();
  final UnifSession session = new UnifSession(props, model);
  final RefinementUnifier unifier = new RefinementUnifier(session);
  final SygusType type;

  Fixture(SygusType.Sort sort) {
    this.type = new SygusType("f", ImmutableList.of(X), sort);
    model.put(G, Terms.TRUE);
  }

  /** Creates a fixture whose function returns booleans. */
  static Fixture bool() {
    return new Fixture(SygusType.Sort.BOOL);
  }

  /** Creates a fixture whose function returns integers. */
  static Fixture integer() {
    return new Fixture(SygusType.Sort.INT);
  }

  Fixture with(Prop prop, Object value) {
    prop.set(props, value);
    return this;
  }

  /** Returns the if-then-else strategy for {@code f}. */
  Strategy strategy() {
    return Strategy.builder(F, E, type)
        .enumerator(C, type.withSort("cond", SygusType.Sort.BOOL))
        .alternative(
            E,
            NodeRole.EQUAL,
            StrategyType.ITE,
            "ite",
            Strategy.point(C, NodeRole.ITE_CONDITION),
            Strategy.point(E, NodeRole.EQUAL),
            Strategy.point(E, NodeRole.EQUAL))
        .build();
  }

  /** Registers {@code f}. */
  Fixture register() {
    unifier.registerCandidate(F, strategy());
    return this;
  }

  /**
   * Adds a refinement lemma that mentions {@code f} applied to {@code arg},
   * and returns the new head, whose model value becomes {@code output}.
   */
  Term.Var point(long arg, Term output) {
    final RefinementUnifier.RefinementResult result =
        unifier.addRefinementLemma(
            Terms.eq(Terms.eval(F, Terms.literal(arg)), output));
    final List<Term.Var> heads = result.newHeads.get(F);
    assertThat(heads.size(), is(1));
    model.put(heads.get(0), output);
    return heads.get(0);
  }

  /** Sets the conditions of the root point; each condition is a value of a
   * fresh condition enumerator {@code c0}, {@code c1}, .... */
  void conditions(Term... conditions) {
    final ImmutableList<Term.Var> enums = Terms.vars("c", conditions.length);
    for (int i = 0; i < conditions.length; i++) {
      model.put(enums.get(i), conditions[i]);
    }
    unifier.setConditions(E, G, enums, ImmutableList.copyOf(conditions));
  }

  /** Checks that a solution gives every point its model value. */
  void checkSolution(Term solution) {
    for (Term.Var head : unifier.getEvalPointHeads(F)) {
      final EvaluationPoint point = unifier.getEvaluationPoint(head);
      assertThat(
          "value of " + solution + " at " + point,
          Interpreter.INSTANCE.evaluate(type, solution, point.args),
          is(model.getModelValue(head)));
    }
  }

  /** Checks that a lemma is false in the current model. */
  void checkExcludesModel(Term lemma) {
    assertThat(
        "lemma " + lemma + " under model",
        Interpreter.INSTANCE.evaluate(lemma.substitute(model.vars())),
        is(Terms.FALSE));
  }

  /** Model backed by a map. */
  static class MapModel implements ModelOracle {
    private final Map<Term, Term> values = new HashMap<>();

    void put(Term term, Term value) {
      values.put(term, value);
    }

    /** Returns the values of variables. */
    Map<Term.Var, Term> vars() {
      final Map<Term.Var, Term> map = new HashMap<>();
      values.forEach(
          (term, value) -> {
            if (term instanceof Term.Var) {
              map.put((Term.Var) term, value);
            }
          });
      return map;
    }

    @Override
    public Term getModelValue(Term term) {
      if (term.isLiteral()) {
        return term;
      }
      final Term value = values.get(term);
      if (value == null) {
        throw new IllegalStateException("no model value for " + term);
      }
      return value;
    }
  }
}

// End Fixture.java
