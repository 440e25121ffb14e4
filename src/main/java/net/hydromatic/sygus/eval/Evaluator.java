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

import java.util.List;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;

/** Executes terms on concrete inputs. */
public interface Evaluator {
  /**
   * Evaluates a term of a given type on an argument tuple.
   *
   * <p>Must be pure, and total on well-typed inputs. Returns a literal.
   */
  Term evaluate(SygusType type, Term term, List<? extends Term> args);
}

// End Evaluator.java
