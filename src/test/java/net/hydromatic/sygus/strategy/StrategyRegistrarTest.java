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

import static net.hydromatic.sygus.strategy.Strategy.point;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.junit.jupiter.api.Test;

/** Tests {@link Strategy} and {@link StrategyRegistrar}. */
public class StrategyRegistrarTest {
  private static final Term.Var X = Terms.var("x");
  private static final Term.Var F = Terms.var("f");
  private static final Term.Var E = Terms.var("e");
  private static final Term.Var E1 = Terms.var("e1");
  private static final Term.Var E2 = Terms.var("e2");
  private static final Term.Var C = Terms.var("c");
  private static final Term.Var C1 = Terms.var("c1");

  private static final SygusType TYPE =
      new SygusType("f", ImmutableList.of(X), SygusType.Sort.STRING);
  private static final SygusType COND_TYPE =
      TYPE.withSort("cond", SygusType.Sort.BOOL);

  private final StrategyRegistrar registrar = new StrategyRegistrar();

  private static Strategy.Builder builder() {
    return Strategy.builder(F, E, TYPE)
        .enumerator(E1, TYPE)
        .enumerator(E2, TYPE)
        .enumerator(C, COND_TYPE)
        .enumerator(C1, COND_TYPE);
  }

  /** A graph with a cycle through the root; each point is visited once. */
  @Test
  void testCycle() {
    final Strategy strategy =
        builder()
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                point(C, NodeRole.ITE_CONDITION),
                point(E, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL))
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.CONCAT_PREFIX,
                "concat",
                point(E1, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL))
            .alternative(
                E1, NodeRole.EQUAL, StrategyType.ID, "id",
                point(E2, NodeRole.EQUAL))
            .alternative(
                E1,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                point(C1, NodeRole.ITE_CONDITION),
                point(E1, NodeRole.EQUAL),
                point(E1, NodeRole.EQUAL))
            .build();
    final StrategyRegistrar.Registration registration =
        registrar.register(strategy);
    assertThat(registration.points, hasToString("[e/c#0, e1/c1#1]"));
    assertThat(registration.enumerators, hasToString("[e, e1]"));
    assertThat(registration.unusedStrategies, hasToString("{e=[1], e1=[0]}"));
    assertThat(registration.lemmas.isEmpty(), is(true));
  }

  /** Of two eligible alternatives, only the first is bound. */
  @Test
  void testOneBindingPerPoint() {
    final Strategy strategy =
        builder()
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                point(C, NodeRole.ITE_CONDITION),
                point(E, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL))
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite2",
                point(C1, NodeRole.ITE_CONDITION),
                point(E, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL))
            .build();
    final StrategyRegistrar.Registration registration =
        registrar.register(strategy);
    assertThat(registration.points, hasToString("[e/c#0]"));
    assertThat(registration.enumerators, hasToString("[e]"));
    assertThat(registration.unusedStrategies.isEmpty(), is(true));
  }

  /** An if-then-else whose branches are other enumerators, or whose node
   * is not in the equality role, is not a point. */
  @Test
  void testIneligible() {
    final Strategy strategy =
        builder()
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                point(C, NodeRole.ITE_CONDITION),
                point(E1, NodeRole.STRING_PREFIX),
                point(E2, NodeRole.EQUAL))
            .alternative(
                E1,
                NodeRole.STRING_PREFIX,
                StrategyType.ITE,
                "ite",
                point(C1, NodeRole.ITE_CONDITION),
                point(E1, NodeRole.STRING_PREFIX),
                point(E1, NodeRole.STRING_PREFIX))
            .lemma(E, Terms.not(Terms.eq(E, Terms.literal(""))))
            .build();
    final StrategyRegistrar.Registration registration =
        registrar.register(strategy);
    assertThat(registration.points, hasSize(0));
    assertThat(registration.enumerators, hasSize(0));
    assertThat(registration.unusedStrategies, hasToString("{e=[0], e1=[0]}"));
    assertThat(registration.lemmas, hasToString("[(not (= e \"\"))]"));
  }

  /** An if-then-else whose first child is not a condition is not a
   * point. */
  @Test
  void testConditionChildRole() {
    final Strategy strategy =
        builder()
            .alternative(
                E,
                NodeRole.EQUAL,
                StrategyType.ITE,
                "ite",
                point(C, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL),
                point(E, NodeRole.EQUAL))
            .build();
    final StrategyRegistrar.Registration registration =
        registrar.register(strategy);
    assertThat(registration.points, hasSize(0));
    assertThat(registration.unusedStrategies, hasToString("{e=[0]}"));
  }

  @Test
  void testBuilderChecks() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            Strategy.builder(F, E, TYPE)
                .alternative(
                    E,
                    NodeRole.EQUAL,
                    StrategyType.ITE,
                    "ite",
                    point(E, NodeRole.EQUAL),
                    point(E, NodeRole.EQUAL)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            Strategy.builder(F, E, TYPE)
                .alternative(
                    E, NodeRole.EQUAL, StrategyType.ID, "id",
                    point(C, NodeRole.EQUAL)));
    final Strategy strategy = builder().build();
    assertThat(strategy.getEnumeratorInfo(C).type, is(COND_TYPE));
    assertThat(strategy.type(), is(TYPE));
    assertThat(
        strategy.getStrategyNode(E, NodeRole.EQUAL).alternatives.isEmpty(),
        is(true));
    assertThrows(
        IllegalArgumentException.class,
        () -> strategy.getEnumeratorInfo(Terms.var("zz")));
  }
}

// End StrategyRegistrarTest.java
