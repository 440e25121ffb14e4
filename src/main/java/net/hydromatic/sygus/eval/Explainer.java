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

import net.hydromatic.sygus.term.Term;
import net.hydromatic.sygus.term.Terms;

/** Produces the justification that an enumerator has a given value. */
public interface Explainer {
  /** Explainer whose justification is the equality itself. */
  Explainer EQUALITY = Terms::eq;

  /**
   * Returns a term that holds in every model where {@code enumerator} equals
   * {@code value}, and that is as weak as possible.
   */
  Term explainEquality(Term.Var enumerator, Term value);
}

// End Explainer.java
