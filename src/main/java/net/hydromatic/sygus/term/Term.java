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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable term: a literal, a variable, or a call to an {@link Op}.
 *
 * <p>Terms compare structurally. They print as s-expressions, for example
 * {@code (ite (> x0 0) x0 0)}.
 */
public abstract class Term {
  // Only the nested classes may extend.
  private Term() {}

  /** Accepts a visitor. */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /** Applies a substitution to this term. */
  public abstract Term substitute(Map<Var, ? extends Term> substitutions);

  /** Returns whether this term references a given variable. */
  public abstract boolean contains(Var var);

  /** Returns whether this term contains a call to a given operator. */
  public abstract boolean containsOp(Op op);

  /** Returns whether this term is a literal. */
  public boolean isLiteral() {
    return false;
  }

  /** Returns whether this term is a call to a given operator. */
  public boolean isA(Op op) {
    return false;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Literal: boolean, integer or string constant. */
  public static final class Literal extends Term {
    public final Object value;

    Literal(Object value) {
      this.value = requireNonNull(value, "value");
      checkArgument(
          value instanceof Boolean
              || value instanceof BigInteger
              || value instanceof String,
          "invalid literal value %s",
          value);
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    /** Returns the value of a boolean literal. */
    public boolean booleanValue() {
      checkArgument(value instanceof Boolean, "not a boolean: %s", value);
      return (Boolean) value;
    }

    /** Returns the value of an integer literal. */
    public BigInteger integerValue() {
      checkArgument(value instanceof BigInteger, "not an integer: %s", value);
      return (BigInteger) value;
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Literal && value.equals(((Literal) obj).value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (value instanceof String) {
        return buf.append('"').append(value).append('"');
      }
      return buf.append(value);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term substitute(Map<Var, ? extends Term> substitutions) {
      return this;
    }

    @Override
    public boolean contains(Var var) {
      return false;
    }

    @Override
    public boolean containsOp(Op op) {
      return false;
    }
  }

  /**
   * Variable. Stands for a function to synthesize, an enumerator, a formal
   * argument, an evaluation-point head, or a guard.
   */
  public static final class Var extends Term implements Comparable<Var> {
    public final String name;

    Var(String name) {
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Var && name.equals(((Var) obj).name);
    }

    @Override
    public int compareTo(Var o) {
      return name.compareTo(o.name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term substitute(Map<Var, ? extends Term> substitutions) {
      final Term term = substitutions.get(this);
      return term != null ? term : this;
    }

    @Override
    public boolean contains(Var var) {
      return equals(var);
    }

    @Override
    public boolean containsOp(Op op) {
      return false;
    }
  }

  /** Call to an operator. */
  public static final class Call extends Term {
    public final Op op;
    public final ImmutableList<Term> args;
    private final int hashCode;

    Call(Op op, ImmutableList<Term> args) {
      this.op = requireNonNull(op, "op");
      this.args = requireNonNull(args, "args");
      checkArgument(
          op.arity < 0 || op.arity == args.size(),
          "operator %s expects %s arguments, got %s",
          op,
          op.arity,
          args.size());
      checkArgument(op != Op.EVAL || !args.isEmpty(), "eval needs a function");
      this.hashCode = Objects.hash(op, args);
    }

    /** Returns the {@code i}th argument. */
    public Term arg(int i) {
      return args.get(i);
    }

    @Override
    public boolean isA(Op op) {
      return this.op == op;
    }

    @Override
    public int hashCode() {
      return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Call
              && hashCode == ((Call) obj).hashCode
              && op == ((Call) obj).op
              && args.equals(((Call) obj).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (args.isEmpty() && op != Op.AND && op != Op.OR) {
        return buf.append(op.opName);
      }
      buf.append('(').append(op.opName);
      for (Term arg : args) {
        arg.unparse(buf.append(' '));
      }
      return buf.append(')');
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term substitute(Map<Var, ? extends Term> substitutions) {
      if (args.isEmpty()) {
        return this;
      }
      final List<Term> newArgs = new ArrayList<>(args.size());
      boolean changed = false;
      for (Term arg : args) {
        final Term newArg = arg.substitute(substitutions);
        changed |= newArg != arg;
        newArgs.add(newArg);
      }
      return changed ? new Call(op, ImmutableList.copyOf(newArgs)) : this;
    }

    /** Returns a call with the same operator and different arguments. */
    public Call copy(List<? extends Term> newArgs) {
      if (newArgs.equals(args)) {
        return this;
      }
      return new Call(op, ImmutableList.copyOf(newArgs));
    }

    @Override
    public boolean contains(Var var) {
      for (Term arg : args) {
        if (arg.contains(var)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public boolean containsOp(Op op) {
      if (this.op == op) {
        return true;
      }
      for (Term arg : args) {
        if (arg.containsOp(op)) {
          return true;
        }
      }
      return false;
    }
  }
}

// End Term.java
