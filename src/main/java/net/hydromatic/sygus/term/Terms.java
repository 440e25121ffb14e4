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
package net.hydromatic.sygus.term;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Factory and utilities for {@link Term}. */
public class Terms {
  private Terms() {}

  public static final Term.Literal TRUE = new Term.Literal(true);
  public static final Term.Literal FALSE = new Term.Literal(false);

  /** Creates a boolean literal. */
  public static Term.Literal literal(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Creates an integer literal. */
  public static Term.Literal literal(long i) {
    return new Term.Literal(BigInteger.valueOf(i));
  }

  /** Creates an integer literal. */
  public static Term.Literal literal(BigInteger i) {
    return new Term.Literal(i);
  }

  /** Creates a string literal. */
  public static Term.Literal literal(String s) {
    return new Term.Literal(s);
  }

  /** Creates a variable. */
  public static Term.Var var(String name) {
    return new Term.Var(name);
  }

  /** Creates variables {@code prefix0}, ..., {@code prefix(n-1)}. */
  public static ImmutableList<Term.Var> vars(String prefix, int n) {
    final ImmutableList.Builder<Term.Var> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(var(prefix + i));
    }
    return b.build();
  }

  /** Creates a call. */
  public static Term.Call call(Op op, Term... args) {
    return new Term.Call(op, ImmutableList.copyOf(args));
  }

  /** Creates a call. */
  public static Term.Call call(Op op, Iterable<? extends Term> args) {
    return new Term.Call(op, ImmutableList.copyOf(args));
  }

  public static Term.Call eq(Term left, Term right) {
    return call(Op.EQ, left, right);
  }

  public static Term.Call not(Term term) {
    return call(Op.NOT, term);
  }

  /**
   * Returns the negation of a term; if the term is already a negation,
   * returns its argument.
   */
  public static Term negate(Term term) {
    if (term.isA(Op.NOT)) {
      return ((Term.Call) term).arg(0);
    }
    return not(term);
  }

  /** Creates a conjunction; a singleton list yields its sole element. */
  public static Term and(List<? extends Term> terms) {
    return terms.size() == 1 ? terms.get(0) : call(Op.AND, terms);
  }

  public static Term and(Term... terms) {
    return and(ImmutableList.copyOf(terms));
  }

  /** Creates a disjunction; a singleton list yields its sole element. */
  public static Term or(List<? extends Term> terms) {
    return terms.size() == 1 ? terms.get(0) : call(Op.OR, terms);
  }

  public static Term or(Term... terms) {
    return or(ImmutableList.copyOf(terms));
  }

  public static Term.Call ite(Term condition, Term ifTrue, Term ifFalse) {
    return call(Op.ITE, condition, ifTrue, ifFalse);
  }

  public static Term.Call plus(Term left, Term right) {
    return call(Op.PLUS, left, right);
  }

  public static Term.Call minus(Term left, Term right) {
    return call(Op.MINUS, left, right);
  }

  public static Term.Call lt(Term left, Term right) {
    return call(Op.LT, left, right);
  }

  public static Term.Call le(Term left, Term right) {
    return call(Op.LE, left, right);
  }

  public static Term.Call gt(Term left, Term right) {
    return call(Op.GT, left, right);
  }

  public static Term.Call ge(Term left, Term right) {
    return call(Op.GE, left, right);
  }

  /** Creates a constant hole. */
  public static Term.Call anyConst() {
    return call(Op.ANY_CONST);
  }

  /** Creates an application of a function to an argument tuple. */
  public static Term.Call eval(Term fn, List<? extends Term> args) {
    return call(
        Op.EVAL, ImmutableList.<Term>builder().add(fn).addAll(args).build());
  }

  public static Term.Call eval(Term fn, Term... args) {
    return eval(fn, ImmutableList.copyOf(args));
  }

  /** Returns the function of an {@link Op#EVAL} call. */
  public static Term evalFunction(Term.Call call) {
    checkArgument(call.op == Op.EVAL, "not an eval: %s", call);
    return call.arg(0);
  }

  /** Returns the actual arguments of an {@link Op#EVAL} call. */
  public static ImmutableList<Term> evalArgs(Term.Call call) {
    checkArgument(call.op == Op.EVAL, "not an eval: %s", call);
    return call.args.subList(1, call.args.size());
  }
}

// End Terms.java
