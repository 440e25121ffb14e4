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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sygus.term.Term;

/**
 * Application of a function to synthesize to a tuple of constant arguments,
 * named by a fresh head symbol.
 */
public final class EvaluationPoint {
  public final Term.Var head;
  public final Term.Var candidate;
  public final ImmutableList<Term> args;

  EvaluationPoint(
      Term.Var head, Term.Var candidate, List<? extends Term> args) {
    this.head = requireNonNull(head, "head");
    this.candidate = requireNonNull(candidate, "candidate");
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public String toString() {
    return head + " = " + candidate + args;
  }
}

// End EvaluationPoint.java
