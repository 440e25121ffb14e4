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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;

/**
 * Rewriter that puts terms into a simple normal form.
 *
 * <ul>
 *   <li>{@code (= t t)} &rarr; {@code true}
 *   <li>{@code (= 1 2)} &rarr; {@code false} (for distinct literals)
 *   <li>{@code (= b a)} &rarr; {@code (= a b)} (operands in printed order)
 *   <li>{@code (not (not t))} &rarr; {@code t}
 *   <li>{@code (and a (and b c) true)} &rarr; {@code (and a b c)}
 *   <li>{@code (or a false)} &rarr; {@code a}
 *   <li>{@code (ite true a b)} &rarr; {@code a}; {@code (ite c a a)} &rarr;
 *       {@code a}
 *   <li>{@code (+ 3 1)} &rarr; {@code 4}; {@code (< 1 2)} &rarr; {@code
 *       true}
 * </ul>
 *
 * <p>Applications ({@link Op#EVAL}) and constant holes are never reduced.
 */
public class Simplifier implements Rewriter {
  public static final Simplifier INSTANCE = new Simplifier();

  @Override
  public Term rewrite(Term term) {
    if (!(term instanceof Term.Call)) {
      return term;
    }
    final Term.Call call = (Term.Call) term;
    final List<Term> args = new ArrayList<>(call.args.size());
    for (Term arg : call.args) {
      args.add(rewrite(arg));
    }
    return simplify(call.copy(args));
  }

  /** Simplifies a call whose arguments are already simplified. */
  private Term simplify(Term.Call call) {
    switch (call.op) {
      case EQ:
        final Term left = call.arg(0);
        final Term right = call.arg(1);
        if (left.equals(right)) {
          return Terms.TRUE;
        }
        if (left.isLiteral() && right.isLiteral()) {
          return Terms.FALSE;
        }
        if (left.toString().compareTo(right.toString()) > 0) {
          return Terms.eq(right, left);
        }
        return call;

      case NOT:
        final Term arg = call.arg(0);
        if (arg.isA(Op.NOT)) {
          return ((Term.Call) arg).arg(0);
        }
        if (isBoolean(arg)) {
          return Terms.literal(!((Term.Literal) arg).booleanValue());
        }
        return call;

      case AND:
      case OR:
        return simplifyJunction(call);

      case ITE:
        final Term condition = call.arg(0);
        if (isBoolean(condition)) {
          return ((Term.Literal) condition).booleanValue()
              ? call.arg(1)
              : call.arg(2);
        }
        if (call.arg(1).equals(call.arg(2))) {
          return call.arg(1);
        }
        return call;

      case PLUS:
        if (isString(call.arg(0)) && isString(call.arg(1))) {
          return Terms.literal(
              (String) ((Term.Literal) call.arg(0)).value
                  + ((Term.Literal) call.arg(1)).value);
        }
        // fall through
      case MINUS:
      case TIMES:
      case LT:
      case LE:
      case GT:
      case GE:
        if (isInteger(call.arg(0)) && isInteger(call.arg(1))) {
          return Interpreter.INSTANCE.evaluate(call);
        }
        return call;

      default:
        return call;
    }
  }

  /** Flattens a conjunction or disjunction and removes redundant terms. */
  private static Term simplifyJunction(Term.Call call) {
    final boolean and = call.op == Op.AND;
    final Term unit = Terms.literal(and);
    final Term zero = Terms.literal(!and);
    final Set<Term> terms = new LinkedHashSet<>();
    for (Term arg : call.args) {
      if (arg.isA(call.op)) {
        terms.addAll(((Term.Call) arg).args);
      } else {
        terms.add(arg);
      }
    }
    if (terms.contains(zero)) {
      return zero;
    }
    terms.remove(unit);
    switch (terms.size()) {
      case 0:
        return unit;
      case 1:
        return terms.iterator().next();
      default:
        final List<Term> list = new ArrayList<>(terms);
        if (list.equals(call.args)) {
          return call;
        }
        return Terms.call(call.op, list);
    }
  }

  private static boolean isBoolean(Term term) {
    return term instanceof Term.Literal
        && ((Term.Literal) term).value instanceof Boolean;
  }

  private static boolean isInteger(Term term) {
    return term instanceof Term.Literal
        && ((Term.Literal) term).value instanceof BigInteger;
  }

  private static boolean isString(Term term) {
    return term instanceof Term.Literal
        && ((Term.Literal) term).value instanceof String;
  }
}

// End Simplifier.java
