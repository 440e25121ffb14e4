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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each purified lemma,
   * then calls the underlying tracer.
   */
  public static Tracer withOnPurify(
      Tracer tracer, BiConsumer<Term, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPurify(Term lemma, Term purifiedLemma) {
        consumer.accept(lemma, purifiedLemma);
        super.onPurify(lemma, purifiedLemma);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each new evaluation
   * point, then calls the underlying tracer.
   */
  public static Tracer withOnNewPoint(
      Tracer tracer, Consumer<EvaluationPoint> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onNewPoint(EvaluationPoint point) {
        consumer.accept(point);
        super.onNewPoint(point);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each state transition
   * of a decision tree, then calls the underlying tracer. The action receives
   * the new state.
   */
  public static Tracer withOnTransition(
      Tracer tracer, BiConsumer<Term.Var, DecisionTree.State> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTransition(
          Term.Var strategyPoint,
          DecisionTree.State from,
          DecisionTree.State to) {
        consumer.accept(strategyPoint, to);
        super.onTransition(strategyPoint, from, to);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each condition taken
   * from the pool, then calls the underlying tracer.
   */
  public static Tracer withOnPoolCondition(
      Tracer tracer, BiConsumer<Term.Var, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPoolCondition(Term.Var strategyPoint, Term condition) {
        consumer.accept(strategyPoint, condition);
        super.onPoolCondition(strategyPoint, condition);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each conflict, then
   * calls the underlying tracer. The lemma is null if there is none.
   */
  public static Tracer withOnConflict(
      Tracer tracer, BiConsumer<Term.Var, @Nullable Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConflict(Term.Var strategyPoint, @Nullable Term lemma) {
        consumer.accept(strategyPoint, lemma);
        super.onConflict(strategyPoint, lemma);
      }
    };
  }

  public static Tracer withOnSolution(
      Tracer tracer, BiConsumer<Term.Var, Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSolution(Term.Var candidate, Term solution) {
        consumer.accept(candidate, solution);
        super.onSolution(candidate, solution);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onPurify(Term lemma, Term purifiedLemma) {}

    @Override
    public void onNewPoint(EvaluationPoint point) {}

    @Override
    public void onTransition(
        Term.Var strategyPoint,
        DecisionTree.State from,
        DecisionTree.State to) {}

    @Override
    public void onPoolCondition(Term.Var strategyPoint, Term condition) {}

    @Override
    public void onConflict(Term.Var strategyPoint, @Nullable Term lemma) {}

    @Override
    public void onSolution(Term.Var candidate, Term solution) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onPurify(Term lemma, Term purifiedLemma) {
      tracer.onPurify(lemma, purifiedLemma);
    }

    @Override
    public void onNewPoint(EvaluationPoint point) {
      tracer.onNewPoint(point);
    }

    @Override
    public void onTransition(
        Term.Var strategyPoint,
        DecisionTree.State from,
        DecisionTree.State to) {
      tracer.onTransition(strategyPoint, from, to);
    }

    @Override
    public void onPoolCondition(Term.Var strategyPoint, Term condition) {
      tracer.onPoolCondition(strategyPoint, condition);
    }

    @Override
    public void onConflict(Term.Var strategyPoint, @Nullable Term lemma) {
      tracer.onConflict(strategyPoint, lemma);
    }

    @Override
    public void onSolution(Term.Var candidate, Term solution) {
      tracer.onSolution(candidate, solution);
    }
  }
}

// End Tracers.java
