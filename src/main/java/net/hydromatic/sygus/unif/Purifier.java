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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;

/**
 * Replaces applications of unification candidates in a lemma with
 * applications of fresh heads.
 *
 * <p>Arguments of such applications must be constants. A nested application
 * is replaced by its value (from the candidate's current solution, or else
 * from the model) and a guard {@code (not (= value application))} is
 * added to the lemma, so that the lemma only constrains models in which the
 * nested application has that value.
 *
 * <p>The same application, purified twice, yields the same head.
 */
class Purifier {
  private final UnifSession session;

  Purifier(UnifSession session) {
    this.session = session;
  }

  /**
   * Purifies a lemma. The result is {@code (or g1 ... gn lemma')} where
   * {@code gi} are the guards and {@code lemma'} is the purified lemma.
   */
  Term purifyLemma(Term lemma) {
    final List<Term> guards = new ArrayList<>();
    final Table<Boolean, Term, Term> cache = HashBasedTable.create();
    Term purified = purify(lemma, false, guards, cache);
    if (!guards.isEmpty()) {
      guards.add(purified);
      purified = Terms.or(guards);
    }
    return session.rewriter.rewrite(purified);
  }

  /**
   * Purifies a term.
   *
   * @param term Term
   * @param ensureConst Whether the result must be a constant
   * @param guards List to which guards are added
   * @param cache Purified terms, by {@code ensureConst} and term
   */
  private Term purify(
      Term term,
      boolean ensureConst,
      List<Term> guards,
      Table<Boolean, Term, Term> cache) {
    final Term cached = cache.get(ensureConst, term);
    if (cached != null) {
      return cached;
    }
    if (!(term instanceof Term.Call)) {
      checkConstant(term, ensureConst);
      cache.put(ensureConst, term, term);
      return term;
    }
    final Term.Call call = (Term.Call) term;
    final boolean isApp =
        call.op == Op.EVAL && session.isCandidate(Terms.evalFunction(call));
    final Term.Var fn = isApp ? (Term.Var) Terms.evalFunction(call) : null;
    final boolean unifApp = fn != null && session.state(fn).usingUnif;

    Term value = null;
    if (fn != null && ensureConst) {
      value = valueOf(call, fn, unifApp);
    }

    final List<Term> args = new ArrayList<>();
    for (int i = 0; i < call.args.size(); i++) {
      final Term arg = call.args.get(i);
      if (i == 0 && isApp) {
        args.add(arg);
        continue;
      }
      // Arguments of an application of a unification candidate, and of any
      // application inside one, must be constants.
      final boolean argConst =
          (fn == null || unifApp) && (ensureConst || unifApp);
      args.add(purify(arg, argConst, guards, cache));
    }
    Term result = args.equals(call.args) ? call : call.copy(args);
    if (unifApp) {
      result = purifiedApplication(fn, (Term.Call) result);
    }
    if (value != null) {
      guards.add(Terms.not(Terms.eq(value, result)));
      result = value;
    }
    result = session.rewriter.rewrite(result);
    checkConstant(result, ensureConst);
    cache.put(ensureConst, term, result);
    return result;
  }

  /**
   * Returns the head application that replaces an application of a
   * unification candidate, creating an evaluation point the first time.
   */
  private Term purifiedApplication(Term.Var fn, Term.Call application) {
    final UnifSession.CandidateState state = session.state(fn);
    final Term existing = state.purified.get(application);
    if (existing != null) {
      return existing;
    }
    final List<Term> args = Terms.evalArgs(application);
    final EvaluationPoint point = session.newPoint(fn, args);
    final Term purified = Terms.eval(point.head, args);
    state.purified.put(application, purified);
    return purified;
  }

  /** Returns the value of an application in the current solution or model. */
  private Term valueOf(Term.Call application, Term.Var fn, boolean unifApp) {
    final Term solution = session.state(fn).solution;
    if (solution == null) {
      if (unifApp) {
        throw new UnifException(
            "nested application " + application + " of " + fn
                + " has no solution to evaluate");
      }
      return session.modelValue(application);
    }
    return session.evaluator.evaluate(
        session.type(fn), solution, unfold(Terms.evalArgs(application)));
  }

  /** Replaces applications that have solutions by their values. */
  private List<Term> unfold(List<Term> args) {
    final List<Term> list = new ArrayList<>();
    for (Term arg : args) {
      list.add(session.rewriter.rewrite(unfold(arg)));
    }
    return list;
  }

  private Term unfold(Term term) {
    if (!(term instanceof Term.Call)) {
      return term;
    }
    final Term.Call call = (Term.Call) term;
    if (call.op == Op.EVAL && session.isCandidate(Terms.evalFunction(call))) {
      final Term.Var fn = (Term.Var) Terms.evalFunction(call);
      return valueOf(call, fn, session.state(fn).usingUnif);
    }
    final List<Term> args = new ArrayList<>();
    for (Term arg : call.args) {
      args.add(unfold(arg));
    }
    return call.copy(args);
  }

  private static void checkConstant(Term term, boolean ensureConst) {
    if (ensureConst && !term.isLiteral()) {
      throw new UnifException(
          "argument " + term + " of an application of a unification"
              + " candidate does not reduce to a constant");
    }
  }
}

// End Purifier.java
