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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.sygus.eval.ConditionRepairer;
import net.hydromatic.sygus.eval.Prop;
import net.hydromatic.sygus.strategy.Strategy;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a decision tree for one strategy point of a candidate.
 *
 * <p>Heads are added one at a time to a {@link ClassificationTrie}. Two heads
 * in the same class must have the same value; if they do not, the tree needs
 * a new condition that separates them. Conditions come from the condition
 * enumerator, possibly repaired, or from the candidate's condition pool. If
 * no condition separates the pair, construction fails and yields a lemma.
 */
public class DecisionTree {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DecisionTree.class);

  /** State of construction. */
  public enum State {
    /** Adding heads to the trie. */
    COLLECTING,
    /** Two heads in one class have different values. */
    RESOLVING_CONFLICT,
    /** No condition separates two heads; a lemma has been produced. */
    CONFLICT,
    /** Every class is consistent; a solution has been extracted. */
    SOLVED
  }

  final UnifSession session;
  final Term.Var candidate;
  final Term.Var strategyPoint;
  final Term.Var conditionEnumerator;

  private final SygusType conditionType;
  private final PointSeparator separator;
  private final HeadValuePool valuePool;

  private final List<Term.Var> heads = new ArrayList<>();
  private final Set<Term.Var> entailed = new LinkedHashSet<>();
  private @Nullable Term guard;
  private ImmutableList<Term.Var> enumerators = ImmutableList.of();
  private ImmutableList<Term> enumeratedConditions = ImmutableList.of();

  /**
   * Conditions of the trie's levels during a build; starts as a copy of the
   * enumerated conditions, which repair and pool lookup may replace.
   */
  private final List<Term> conditions = new ArrayList<>();

  /** Unfolding lemmas already sent, so that each is sent once. */
  private final Set<Term> unfoldingLemmas = new HashSet<>();

  private State state = State.COLLECTING;

  DecisionTree(
      UnifSession session,
      Term.Var candidate,
      Term.Var strategyPoint,
      Strategy.EnumeratorInfo conditionInfo) {
    this.session = requireNonNull(session, "session");
    this.candidate = requireNonNull(candidate, "candidate");
    this.strategyPoint = requireNonNull(strategyPoint, "strategyPoint");
    this.conditionEnumerator = conditionInfo.enumerator;
    this.conditionType = conditionInfo.type;
    this.separator = new PointSeparator(this, conditionInfo);
    this.valuePool = new HeadValuePool(session, session.type(candidate));
  }

  public State state() {
    return state;
  }

  ImmutableList<Term.Var> heads() {
    return ImmutableList.copyOf(heads);
  }

  Set<Term.Var> entailedHeads() {
    return entailed;
  }

  /** Returns the condition that splits level {@code index} of the trie. */
  Term condition(int index) {
    return conditions.get(index);
  }

  /** Returns the conditions used in the last build, then the pool. */
  List<Term> conditionsForRebuild() {
    final Set<Term> set = new LinkedHashSet<>(conditions);
    set.addAll(session.state(candidate).conditionPool);
    return new ArrayList<>(set);
  }

  void addHead(Term.Var head) {
    heads.add(head);
  }

  void setEntailed(Term.Var head) {
    checkArgument(heads.contains(head), "unknown head %s", head);
    checkArgument(entailed.add(head), "head %s is already entailed", head);
  }

  /**
   * Sets the enumerated conditions for the next round. The guard is the
   * literal that holds while the current set of condition enumerators is in
   * use.
   */
  void setConditions(Term guard, List<Term.Var> enums, List<Term> conds) {
    checkArgument(
        enums.size() == conds.size(),
        "%s enumerators but %s conditions",
        enums.size(),
        conds.size());
    this.guard = requireNonNull(guard, "guard");
    this.enumerators = ImmutableList.copyOf(enums);
    this.enumeratedConditions = ImmutableList.copyOf(conds);
    separator.clearCache();
    if (Prop.COND_POOL.booleanValue(session.map)
        || Prop.COND_INDEPENDENT.booleanValue(session.map)) {
      session.state(candidate).conditionPool.addAll(conds);
    }
  }

  private void transition(State to) {
    if (state != to) {
      final State from = state;
      state = to;
      session.tracer.onTransition(strategyPoint, from, to);
    }
  }

  /**
   * Tries to build a solution for the current heads.
   *
   * <p>Returns the solution, or null if construction failed. On failure, a
   * lemma that rules out the current model may be added to {@code lemmas}.
   * Unfolding lemmas may be added even on success.
   */
  @Nullable Term buildSolution(List<Term> lemmas) {
    LOGGER.debug(
        "build solution for {} at {}: {} heads, {} conditions",
        candidate,
        strategyPoint,
        heads.size(),
        enumeratedConditions.size());
    conditions.clear();
    conditions.addAll(enumeratedConditions);
    separator.trie.clear();
    state = State.COLLECTING;
    final Map<Term.Var, Term> headValues = new HashMap<>();
    if (Prop.COND_INDEPENDENT.booleanValue(session.map)) {
      return buildIndependently(headValues);
    }
    final boolean retPool = Prop.RET_POOL.booleanValue(session.map);
    final Explanation exp = new Explanation();
    int headCount = 0;
    int conditionCount = 0;
    boolean needsResolve = false;
    boolean conflict = false;
    Term.Var e = null;
    Term.Var er = null;
    while (headCount < heads.size() || needsResolve) {
      if (!needsResolve) {
        e = heads.get(headCount++);
        final Term value = session.modelValue(e);
        if (retPool) {
          valuePool.add(e, value);
        }
        headValues.put(e, value);
        er = separator.trie.add(e, separator, conditionCount);
        if (er.equals(e)) {
          continue;
        }
        if (value.equals(headValues.get(er))) {
          exp.add(
              retPool
                  ? evalExplanation(er, e, lemmas, true)
                  : Terms.eq(er, e));
          continue;
        }
      }
      requireNonNull(e);
      requireNonNull(er);
      transition(State.RESOLVING_CONFLICT);
      if (!retPool) {
        exp.add(Terms.not(Terms.eq(e, er)));
      } else {
        final List<Term.Var> members = classOf(er);
        final Term common = mergeValuePools(e, members, exp, lemmas);
        if (common != null) {
          LOGGER.debug("value {} is compatible with class of {}", common, er);
          for (Term.Var member : members) {
            headValues.put(member, common);
          }
          headValues.put(e, common);
          needsResolve = false;
          transition(State.COLLECTING);
          continue;
        }
      }
      if (!pickCondition(conditionCount, er, e, exp)) {
        exp.add(requireGuard());
        conflict = true;
        break;
      }
      final List<Term.Var> previousClass = classOf(er);
      separator.trie.addClassifier(separator, conditionCount);
      conditionCount++;
      if (separator.trie.isRepresentative(e)) {
        needsResolve = false;
        transition(State.COLLECTING);
        continue;
      }
      final List<Term.Var> erClass = separator.trie.classOf(er);
      if (erClass != null && erClass.contains(e)) {
        // the new condition does not tell e from er
        conflict = true;
        break;
      }
      Term.Var newRep = null;
      for (Term.Var check : previousClass) {
        if (check.equals(er) || check.equals(e)) {
          continue;
        }
        final List<Term.Var> checkClass = separator.trie.classOf(check);
        if (checkClass != null && checkClass.contains(e)) {
          newRep = check;
          break;
        }
      }
      checkState(newRep != null, "%s has no class after split", e);
      er = newRep;
      needsResolve = true;
    }
    if (conflict) {
      final Term lemma = exp.toLemma(guard);
      LOGGER.debug("conflict at {}: lemma {}", strategyPoint, lemma);
      lemmas.add(lemma);
      transition(State.CONFLICT);
      session.tracer.onConflict(strategyPoint, lemma);
      return null;
    }
    transition(State.SOLVED);
    return separator.extractSolution(headValues);
  }

  /**
   * Builds a solution using every condition in the pool, in pool order,
   * ignoring the order in which they were enumerated. Failure yields no
   * lemma.
   */
  private @Nullable Term buildIndependently(Map<Term.Var, Term> headValues) {
    conditions.clear();
    conditions.addAll(session.state(candidate).conditionPool);
    for (Term.Var e : heads) {
      final Term value = session.modelValue(e);
      headValues.put(e, value);
      final Term.Var er = separator.trie.add(e, separator, conditions.size());
      if (!er.equals(e) && !value.equals(headValues.get(er))) {
        LOGGER.debug(
            "pool of {} cannot separate {} from {}", candidate, e, er);
        transition(State.CONFLICT);
        session.tracer.onConflict(strategyPoint, null);
        return null;
      }
    }
    transition(State.SOLVED);
    return separator.extractSolution(headValues);
  }

  private List<Term.Var> classOf(Term.Var rep) {
    final List<Term.Var> cls = separator.trie.classOf(rep);
    checkState(cls != null, "%s is not a representative", rep);
    return cls;
  }

  private Term requireGuard() {
    if (guard == null) {
      throw new UnifException(
          "conditions of " + strategyPoint + " were never set");
    }
    return guard;
  }

  /**
   * Chooses the condition for level {@code index} of the trie, one that
   * should separate {@code e1} from {@code e2}. Returns false if there is
   * none.
   */
  private boolean pickCondition(
      int index, Term.Var e1, Term.Var e2, Explanation exp) {
    final boolean hasEnumerated = index < enumerators.size();
    if (hasEnumerated) {
      final Term value = enumeratedConditions.get(index);
      conditions.set(index, repair(value, e1, e2));
      // The repair is a function of the value, so the value explains it.
      exp.add(session.explainer.explainEquality(enumerators.get(index), value));
    }
    if (Prop.COND_POOL.booleanValue(session.map)
        && (!hasEnumerated || !separates(conditions.get(index), e1, e2))
        && pickFromPool(index, e1, e2)) {
      exp.markPoolStart(hasEnumerated);
      session.tracer.onPoolCondition(strategyPoint, conditions.get(index));
      return true;
    }
    return hasEnumerated;
  }

  private Term repair(Term condition, Term.Var e1, Term.Var e2) {
    // A condition with holes is always repaired, even if it separates the
    // pair with its holes read as zero.
    if (!ConditionRepairer.mustRepair(condition)
        && (!Prop.REPAIR_COND.booleanValue(session.map)
            || separates(condition, e1, e2))) {
      return condition;
    }
    final Term repaired =
        session
            .repairer()
            .repair(
                conditionType,
                condition,
                session.point(e1).args,
                session.point(e2).args);
    return repaired != null ? repaired : condition;
  }

  private boolean separates(Term condition, Term.Var e1, Term.Var e2) {
    return !separator
        .computeCondition(condition, e1)
        .equals(separator.computeCondition(condition, e2));
  }

  /**
   * Looks in the pool for a condition that separates {@code e1} from
   * {@code e2}, and if found, installs it at level {@code index}.
   */
  private boolean pickFromPool(int index, Term.Var e1, Term.Var e2) {
    for (Term condition : session.state(candidate).conditionPool) {
      if (separates(condition, e1, e2)) {
        LOGGER.trace(
            "pool condition {} separates {} from {}", condition, e1, e2);
        if (index < conditions.size()) {
          conditions.set(index, condition);
        } else {
          conditions.add(condition);
        }
        return true;
      }
    }
    return false;
  }

  /**
   * Finds a value compatible with {@code head} and every member of a class.
   * On success, explains it and returns the value; otherwise explains the
   * first member that has no common value and returns null.
   */
  private @Nullable Term mergeValuePools(
      Term.Var head,
      List<Term.Var> members,
      Explanation exp,
      List<Term> lemmas) {
    final Set<Term> common =
        new LinkedHashSet<>(valuePool.compatibleValues(head));
    for (Term.Var member : members) {
      common.retainAll(valuePool.compatibleValues(member));
      if (common.isEmpty()) {
        exp.add(evalExplanation(member, head, lemmas, false));
        return null;
      }
    }
    exp.add(evalExplanation(members.get(0), head, lemmas, true));
    return common.iterator().next();
  }

  /**
   * Returns the literal that {@code e1} and {@code e2}, applied to the point
   * of {@code e1}, are equal (or, if {@code equal} is false, distinct).
   *
   * <p>If equal, also sends unfolding lemmas stating that whenever
   * {@code e2} takes a value compatible with its own point, its application
   * to {@code e1}'s point has the value of {@code e1}'s.
   */
  private Term evalExplanation(
      Term.Var e1, Term.Var e2, List<Term> lemmas, boolean equal) {
    final List<Term> args = session.point(e1).args;
    final Term ev1 = Terms.eval(e1, args);
    final Term ev2 = Terms.eval(e2, args);
    if (equal) {
      final Term unfolded = Terms.eq(ev2, valuePool.currentEval(e1));
      for (Term value : valuePool.compatibleValues(e2)) {
        final Term lemma =
            Terms.or(
                Terms.negate(session.explainer.explainEquality(e2, value)),
                unfolded);
        if (unfoldingLemmas.add(lemma)) {
          lemmas.add(lemma);
        }
      }
    }
    final Term eq = Terms.eq(ev1, ev2);
    return equal ? eq : Terms.not(eq);
  }

  @Override
  public String toString() {
    return "DecisionTree{" + strategyPoint + ", " + heads.size() + " heads}";
  }
}

// End DecisionTree.java
