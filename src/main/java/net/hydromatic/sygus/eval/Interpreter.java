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
import java.util.List;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.TermVisitor;
import net.hydromatic.sygus.term.Terms;

/**
 * Evaluator of closed boolean, integer and string terms.
 *
 * <p>An equality between two terms that are not literals after evaluation is
 * decided structurally, as for datatype values.
 */
public class Interpreter implements Evaluator {
  public static final Interpreter INSTANCE = new Interpreter();

  @Override
  public Term evaluate(SygusType type, Term term, List<? extends Term> args) {
    return evaluate(term.substitute(type.bind(args)));
  }

  /** Evaluates a closed term. */
  public Term evaluate(Term term) {
    return term.accept(new Visitor());
  }

  /** Evaluates a closed term that must yield a boolean. */
  public boolean evaluateBoolean(Term term) {
    final Term result = evaluate(term);
    if (!(result instanceof Term.Literal)
        || !(((Term.Literal) result).value instanceof Boolean)) {
      throw new EvalException("not a boolean: " + term + " = " + result);
    }
    return ((Term.Literal) result).booleanValue();
  }

  /** Evaluates a closed term that must yield an integer. */
  public BigInteger evaluateInteger(Term term) {
    final Term result = evaluate(term);
    if (!(result instanceof Term.Literal)
        || !(((Term.Literal) result).value instanceof BigInteger)) {
      throw new EvalException("not an integer: " + term + " = " + result);
    }
    return ((Term.Literal) result).integerValue();
  }

  /** Visitor that does the work. */
  private class Visitor implements TermVisitor<Term> {
    @Override
    public Term visit(Term.Literal literal) {
      return literal;
    }

    @Override
    public Term visit(Term.Var var) {
      throw new EvalException("free variable " + var);
    }

    @Override
    public Term visit(Term.Call call) {
      switch (call.op) {
        case ANY_CONST:
          return Terms.literal(0);

        case NOT:
          return Terms.literal(!evaluateBoolean(call.arg(0)));

        case AND:
          for (Term arg : call.args) {
            if (!evaluateBoolean(arg)) {
              return Terms.FALSE;
            }
          }
          return Terms.TRUE;

        case OR:
          for (Term arg : call.args) {
            if (evaluateBoolean(arg)) {
              return Terms.TRUE;
            }
          }
          return Terms.FALSE;

        case ITE:
          return evaluate(
              evaluateBoolean(call.arg(0)) ? call.arg(1) : call.arg(2));

        case EQ:
          if (call.arg(0).equals(call.arg(1))) {
            return Terms.TRUE;
          }
          return Terms.literal(
              evaluate(call.arg(0)).equals(evaluate(call.arg(1))));

        case PLUS:
          final Term left = evaluate(call.arg(0));
          final Term right = evaluate(call.arg(1));
          if (left instanceof Term.Literal
              && ((Term.Literal) left).value instanceof String
              && right instanceof Term.Literal
              && ((Term.Literal) right).value instanceof String) {
            return Terms.literal(
                (String) ((Term.Literal) left).value
                    + ((Term.Literal) right).value);
          }
          return Terms.literal(
              evaluateInteger(left).add(evaluateInteger(right)));

        case MINUS:
          return Terms.literal(
              evaluateInteger(call.arg(0))
                  .subtract(evaluateInteger(call.arg(1))));

        case TIMES:
          return Terms.literal(
              evaluateInteger(call.arg(0))
                  .multiply(evaluateInteger(call.arg(1))));

        case LT:
          return Terms.literal(compare(call) < 0);
        case LE:
          return Terms.literal(compare(call) <= 0);
        case GT:
          return Terms.literal(compare(call) > 0);
        case GE:
          return Terms.literal(compare(call) >= 0);

        case EVAL:
          throw new EvalException(
              "cannot evaluate application of "
                  + Terms.evalFunction(call)
                  + " without its definition");

        default:
          throw new AssertionError("unknown op " + call.op);
      }
    }

    private int compare(Term.Call call) {
      return evaluateInteger(call.arg(0))
          .compareTo(evaluateInteger(call.arg(1)));
    }
  }
}

// End Interpreter.java
