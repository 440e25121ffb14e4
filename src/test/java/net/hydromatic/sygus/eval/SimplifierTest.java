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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;
import org.junit.jupiter.api.Test;

/** Tests {@link Simplifier}. */
public class SimplifierTest {
  private static final Term A = Terms.var("a");
  private static final Term B = Terms.var("b");
  private static final Term C = Terms.var("c");
  private static final Term X = Terms.var("x");

  private static void check(Term term, String expected) {
    assertThat(Simplifier.INSTANCE.rewrite(term), hasToString(expected));
  }

  @Test
  void testEquals() {
    check(Terms.eq(X, X), "true");
    check(Terms.eq(Terms.literal(1), Terms.literal(2)), "false");
    check(Terms.eq(B, A), "(= a b)");
    check(Terms.eq(Terms.literal(2), Terms.eval(A, X)), "(= (eval a x) 2)");
    check(
        Terms.eq(
            Terms.plus(Terms.literal(1), Terms.literal(1)), Terms.literal(2)),
        "true");
  }

  @Test
  void testNot() {
    check(Terms.not(Terms.not(A)), "a");
    check(Terms.not(Terms.TRUE), "false");
    check(Terms.not(Terms.eq(Terms.literal(1), Terms.literal(2))), "true");
  }

  @Test
  void testJunction() {
    check(Terms.and(A, Terms.and(B, C), Terms.TRUE), "(and a b c)");
    check(Terms.and(A, Terms.FALSE, B), "false");
    check(Terms.or(A, Terms.FALSE), "a");
    check(Terms.or(A, Terms.TRUE), "true");
    check(Terms.or(A, A, B), "(or a b)");
    check(Terms.call(Op.AND), "true");
    check(Terms.call(Op.OR), "false");
  }

  @Test
  void testIte() {
    check(Terms.ite(Terms.TRUE, A, B), "a");
    check(Terms.ite(Terms.lt(Terms.literal(3), Terms.literal(2)), A, B), "b");
    check(Terms.ite(C, A, A), "a");
    check(Terms.ite(C, A, B), "(ite c a b)");
  }

  @Test
  void testArithmetic() {
    check(Terms.plus(Terms.literal(3), Terms.literal(1)), "4");
    check(Terms.lt(Terms.literal(1), Terms.literal(2)), "true");
    check(Terms.plus(Terms.literal("a"), Terms.literal("b")), "\"ab\"");
    check(Terms.plus(X, Terms.literal(1)), "(+ x 1)");
    check(Terms.gt(X, Terms.anyConst()), "(> x any-const)");
  }

  /** Arguments of an application are simplified; the application is not. */
  @Test
  void testApplication() {
    check(
        Terms.eval(A, Terms.plus(Terms.literal(1), Terms.literal(2))),
        "(eval a 3)");
    final Term app = Terms.eval(A, Terms.literal(3));
    assertThat(Simplifier.INSTANCE.rewrite(app), is(app));
  }
}

// End SimplifierTest.java
