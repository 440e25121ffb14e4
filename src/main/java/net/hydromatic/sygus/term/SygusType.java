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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Objects;

/**
 * Type of a synthesis target or of an enumerator.
 *
 * <p>A term of this type is a body over the formal arguments; applying it to
 * an argument tuple substitutes the formals with the actual arguments.
 */
public final class SygusType {
  public final String name;
  public final ImmutableList<Term.Var> formals;
  public final Sort sort;

  public SygusType(String name, List<Term.Var> formals, Sort sort) {
    this.name = requireNonNull(name, "name");
    this.formals = ImmutableList.copyOf(formals);
    this.sort = requireNonNull(sort, "sort");
  }

  /** Returns a type with the same formals and a different result sort. */
  public SygusType withSort(String name, Sort sort) {
    return new SygusType(name, formals, sort);
  }

  /** Returns the substitution that binds the formals to an argument tuple. */
  public ImmutableMap<Term.Var, Term> bind(List<? extends Term> args) {
    if (args.size() != formals.size()) {
      throw new IllegalArgumentException(
          "type "
              + name
              + " has "
              + formals.size()
              + " formals, got "
              + args.size()
              + " arguments");
    }
    final ImmutableMap.Builder<Term.Var, Term> b = ImmutableMap.builder();
    for (int i = 0; i < args.size(); i++) {
      b.put(formals.get(i), args.get(i));
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, formals, sort);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof SygusType
            && name.equals(((SygusType) obj).name)
            && formals.equals(((SygusType) obj).formals)
            && sort == ((SygusType) obj).sort;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Result sort of a type. */
  public enum Sort {
    BOOL,
    INT,
    STRING
  }
}

// End SygusType.java
