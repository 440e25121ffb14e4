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
package net.hydromatic.sygus.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs a condition by filling its constant holes with integers.
 *
 * <p>Candidate constants are the integer arguments of the two points, each
 * widened by up to {@code bound} in either direction, and zero. Assignments
 * to the holes are tried in the order of the cartesian product of the
 * candidates, and the first assignment under which the condition has
 * different outcomes on the two points wins.
 */
public class ConstantRepairer implements ConditionRepairer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ConstantRepairer.class);

  /** Maximum number of assignments tried in one repair. */
  static final int MAX_ATTEMPTS = 100_000;

  private final Evaluator evaluator;
  private final int bound;

  public ConstantRepairer(Evaluator evaluator, int bound) {
    this.evaluator = requireNonNull(evaluator, "evaluator");
    checkArgument(bound >= 0, "bound must be non-negative: %s", bound);
    this.bound = bound;
  }

  @Override
  public @Nullable Term repair(
      SygusType type,
      Term condition,
      List<? extends Term> args1,
      List<? extends Term> args2) {
    final int holeCount = countHoles(condition);
    if (holeCount == 0) {
      return separates(type, condition, args1, args2) ? condition : null;
    }
    final List<Term> candidates = candidateConstants(args1, args2);
    final List<List<Term>> axes = new ArrayList<>();
    for (int i = 0; i < holeCount; i++) {
      axes.add(candidates);
    }
    int attempts = 0;
    for (List<Term> assignment : Lists.cartesianProduct(axes)) {
      if (++attempts > MAX_ATTEMPTS) {
        LOGGER.debug(
            "giving up repair of {} after {} attempts",
            condition,
            MAX_ATTEMPTS);
        break;
      }
      final Term repaired = fill(condition, assignment.iterator());
      if (separates(type, repaired, args1, args2)) {
        LOGGER.debug("repaired {} to {}", condition, repaired);
        return repaired;
      }
    }
    return null;
  }

  private boolean separates(
      SygusType type,
      Term condition,
      List<? extends Term> args1,
      List<? extends Term> args2) {
    return !evaluator
        .evaluate(type, condition, args1)
        .equals(evaluator.evaluate(type, condition, args2));
  }

  private List<Term> candidateConstants(
      List<? extends Term> args1, List<? extends Term> args2) {
    final TreeSet<BigInteger> set = new TreeSet<>();
    set.add(BigInteger.ZERO);
    for (List<? extends Term> args : ImmutableList.of(args1, args2)) {
      for (Term arg : args) {
        if (arg instanceof Term.Literal
            && ((Term.Literal) arg).value instanceof BigInteger) {
          final BigInteger i = ((Term.Literal) arg).integerValue();
          for (int d = -bound; d <= bound; d++) {
            set.add(i.add(BigInteger.valueOf(d)));
          }
        }
      }
    }
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    set.forEach(i -> b.add(Terms.literal(i)));
    return b.build();
  }

  static int countHoles(Term term) {
    if (!(term instanceof Term.Call)) {
      return 0;
    }
    final Term.Call call = (Term.Call) term;
    if (call.op == Op.ANY_CONST) {
      return 1;
    }
    int n = 0;
    for (Term arg : call.args) {
      n += countHoles(arg);
    }
    return n;
  }

  /** Replaces holes, left to right, with successive constants. */
  static Term fill(Term term, Iterator<Term> constants) {
    if (!(term instanceof Term.Call)) {
      return term;
    }
    final Term.Call call = (Term.Call) term;
    if (call.op == Op.ANY_CONST) {
      return constants.next();
    }
    final List<Term> args = new ArrayList<>(call.args.size());
    for (Term arg : call.args) {
      args.add(fill(arg, constants));
    }
    return call.copy(args);
  }
}

// End ConstantRepairer.java
