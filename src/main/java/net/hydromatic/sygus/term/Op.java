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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Operator of a {@link Term.Call}. */
public enum Op {
  EQ("=", 2),
  NOT("not", 1),
  /** Conjunction; zero or more arguments. */
  AND("and", -1),
  /** Disjunction; zero or more arguments. */
  OR("or", -1),
  ITE("ite", 3),
  PLUS("+", 2),
  MINUS("-", 2),
  TIMES("*", 2),
  LT("<", 2),
  LE("<=", 2),
  GT(">", 2),
  GE(">=", 2),

  /**
   * Application of a function to synthesize, or of an evaluation-point head,
   * to a tuple of arguments. The first argument is the function; the rest are
   * the actual arguments.
   */
  EVAL("eval", -1),

  /**
   * Constant hole in an enumerated term. It evaluates as integer zero until a
   * repair replaces it with a literal.
   */
  ANY_CONST("any-const", 0);

  /** Name of the operator when a term is printed. */
  public final String opName;

  /** Number of arguments, or -1 if variable. */
  public final int arity;

  private static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> builder = ImmutableMap.builder();
    for (Op op : values()) {
      builder.put(op.opName, op);
    }
    BY_OP_NAME = builder.build();
  }

  Op(String opName, int arity) {
    this.opName = opName;
    this.arity = arity;
  }

  /** Looks up an operator by its printed name; returns null if not found. */
  public static @Nullable Op lookup(String opName) {
    return BY_OP_NAME.get(opName);
  }

  /** Whether this operator returns a boolean. */
  public boolean isPredicate() {
    switch (this) {
      case EQ:
      case NOT:
      case AND:
      case OR:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
