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
import net.hydromatic.sygus.term.Op;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Adjusts the constants of a condition so that it separates two points.
 *
 * <p>A repair keeps the syntactic shape of the condition; only the constant
 * holes ({@link Op#ANY_CONST}) are filled.
 */
public interface ConditionRepairer {
  /** Repairer that never succeeds. */
  ConditionRepairer NONE = (type, condition, args1, args2) -> null;

  /**
   * Returns a variant of {@code condition} whose outcome on {@code args1}
   * differs from its outcome on {@code args2}, or null if there is none.
   */
  @Nullable Term repair(
      SygusType type,
      Term condition,
      List<? extends Term> args1,
      List<? extends Term> args2);

  /** Returns whether a condition has holes that must be filled. */
  static boolean mustRepair(Term condition) {
    return condition.containsOp(Op.ANY_CONST);
  }
}

// End ConditionRepairer.java
