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
package net.hydromatic.sygus.strategy;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.sygus.term.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a strategy graph and finds the points at which a decision tree can
 * be built.
 *
 * <p>A point is eligible if its enumerator, in the {@link NodeRole#EQUAL}
 * role, has an {@link StrategyType#ITE} alternative whose two branch children
 * are the enumerator itself in the same role, and whose first child is in
 * the {@link NodeRole#ITE_CONDITION} role. That child becomes the point's
 * condition enumerator. Each point is bound
 * to at most one alternative.
 *
 * <p>Each (enumerator, role) pair is visited at most once, so cyclic graphs
 * terminate.
 */
public class StrategyRegistrar {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(StrategyRegistrar.class);

  /** Walks the strategy graph of a candidate from its root. */
  public Registration register(Strategy strategy) {
    final Walker walker = new Walker(strategy);
    walker.visit(Strategy.point(strategy.rootEnumerator, NodeRole.EQUAL));
    final Registration registration =
        new Registration(
            ImmutableList.copyOf(walker.enumerators),
            walker.unused.build(),
            ImmutableList.copyOf(walker.points.values()),
            ImmutableList.copyOf(strategy.lemmas.values()));
    LOGGER.debug(
        "registered {}: {} strategy points, enumerators {}",
        strategy.candidate,
        registration.points.size(),
        registration.enumerators);
    return registration;
  }

  /** State of one walk. */
  private static class Walker {
    final Strategy strategy;
    final Set<Strategy.Point> visited = new HashSet<>();
    final Set<Term.Var> enumerators = new LinkedHashSet<>();
    final ImmutableSetMultimap.Builder<Term.Var, Integer> unused =
        ImmutableSetMultimap.builder();
    final Map<Term.Var, StrategyPoint> points = new LinkedHashMap<>();

    Walker(Strategy strategy) {
      this.strategy = strategy;
    }

    void visit(Strategy.Point point) {
      if (!visited.add(point)) {
        return;
      }
      final Term.Var e = point.enumerator;
      final List<Strategy.Point> children = new ArrayList<>();
      final ImmutableList<Strategy.Alternative> alternatives =
          strategy.getStrategyNode(e, point.role).alternatives;
      for (int i = 0; i < alternatives.size(); i++) {
        final Strategy.Alternative alternative = alternatives.get(i);
        if (isEligible(point, alternative)) {
          final Term.Var condition = alternative.children.get(0).enumerator;
          enumerators.add(e);
          if (!points.containsKey(e)) {
            points.put(e, new StrategyPoint(e, condition, i));
          }
        } else {
          unused.put(e, i);
        }
        children.addAll(alternative.children);
      }
      for (Strategy.Point child : children) {
        visit(child);
      }
    }

    private static boolean isEligible(
        Strategy.Point point, Strategy.Alternative alternative) {
      return point.role == NodeRole.EQUAL
          && alternative.type == StrategyType.ITE
          && alternative.children.get(0).role == NodeRole.ITE_CONDITION
          && alternative.children.get(1).equals(point)
          && alternative.children.get(2).equals(point);
    }
  }

  /** Point at which a decision tree is built. */
  public static final class StrategyPoint {
    public final Term.Var enumerator;
    public final Term.Var conditionEnumerator;

    /** Index of the alternative within the enumerator's node. */
    public final int strategyIndex;

    StrategyPoint(
        Term.Var enumerator, Term.Var conditionEnumerator, int strategyIndex) {
      this.enumerator = requireNonNull(enumerator, "enumerator");
      this.conditionEnumerator =
          requireNonNull(conditionEnumerator, "conditionEnumerator");
      this.strategyIndex = strategyIndex;
    }

    @Override
    public String toString() {
      return enumerator + "/" + conditionEnumerator + "#" + strategyIndex;
    }
  }

  /** Result of {@link #register}. */
  public static final class Registration {
    /** Enumerators that are strategy points. */
    public final ImmutableList<Term.Var> enumerators;

    /** Alternatives, by enumerator, that unification does not use. */
    public final ImmutableSetMultimap<Term.Var, Integer> unusedStrategies;

    public final ImmutableList<StrategyPoint> points;

    /** Lemmas that the grammar layer attached to the strategy. */
    public final ImmutableList<Term> lemmas;

    Registration(
        ImmutableList<Term.Var> enumerators,
        ImmutableSetMultimap<Term.Var, Integer> unusedStrategies,
        ImmutableList<StrategyPoint> points,
        ImmutableList<Term> lemmas) {
      this.enumerators = enumerators;
      this.unusedStrategies = unusedStrategies;
      this.points = points;
      this.lemmas = lemmas;
    }
  }
}

// End StrategyRegistrar.java
