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
package net.hydromatic.sygus.strategy;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.sygus.term.SygusType;
import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Synthesis-strategy graph of a function to synthesize.
 *
 * <p>Each node is identified by an enumerator and the role it plays, and
 * holds a list of alternative ways of constructing the enumerator's value
 * from child nodes. Graphs may be cyclic; an if-then-else whose branches are
 * the node itself is the common case.
 */
public class Strategy {
  public final Term.Var candidate;
  public final Term.Var rootEnumerator;
  private final ImmutableMap<Term.Var, EnumeratorInfo> enumerators;
  private final ImmutableMap<Point, StrategyNode> nodes;

  /** Lemmas produced by the grammar layer, keyed by enumerator. */
  public final ImmutableListMultimap<Term.Var, Term> lemmas;

  private Strategy(
      Term.Var candidate,
      Term.Var rootEnumerator,
      ImmutableMap<Term.Var, EnumeratorInfo> enumerators,
      ImmutableMap<Point, StrategyNode> nodes,
      ImmutableListMultimap<Term.Var, Term> lemmas) {
    this.candidate = requireNonNull(candidate, "candidate");
    this.rootEnumerator = requireNonNull(rootEnumerator, "rootEnumerator");
    this.enumerators = enumerators;
    this.nodes = nodes;
    this.lemmas = lemmas;
    checkArgument(
        enumerators.containsKey(rootEnumerator),
        "root enumerator %s has no type",
        rootEnumerator);
  }

  /** Creates a builder. */
  public static Builder builder(
      Term.Var candidate, Term.Var rootEnumerator, SygusType type) {
    return new Builder(candidate, rootEnumerator, type);
  }

  /** Creates a point, the key of a strategy node. */
  public static Point point(Term.Var enumerator, NodeRole role) {
    return new Point(enumerator, role);
  }

  /** Returns the type of the function to synthesize. */
  public SygusType type() {
    return getEnumeratorInfo(rootEnumerator).type;
  }

  /** Returns information about an enumerator; throws if unknown. */
  public EnumeratorInfo getEnumeratorInfo(Term.Var enumerator) {
    final EnumeratorInfo info = enumerators.get(enumerator);
    if (info == null) {
      throw new IllegalArgumentException("unknown enumerator " + enumerator);
    }
    return info;
  }

  /**
   * Returns the strategy node for an enumerator in a role; a node with no
   * alternatives if there is none.
   */
  public StrategyNode getStrategyNode(Term.Var enumerator, NodeRole role) {
    final StrategyNode node = nodes.get(point(enumerator, role));
    return node != null ? node : StrategyNode.EMPTY;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append("strategy for ").append(candidate).append(':');
    nodes.forEach(
        (point, node) -> {
          for (int i = 0; i < node.alternatives.size(); i++) {
            b.append("\n  ")
                .append(point)
                .append(" #")
                .append(i)
                .append(' ')
                .append(node.alternatives.get(i));
          }
        });
    return b.toString();
  }

  /** An enumerator in a role. Identifies a strategy node. */
  public static final class Point {
    public final Term.Var enumerator;
    public final NodeRole role;

    Point(Term.Var enumerator, NodeRole role) {
      this.enumerator = requireNonNull(enumerator, "enumerator");
      this.role = requireNonNull(role, "role");
    }

    @Override
    public int hashCode() {
      return Objects.hash(enumerator, role);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Point
              && enumerator.equals(((Point) obj).enumerator)
              && role == ((Point) obj).role;
    }

    @Override
    public String toString() {
      return enumerator + ":" + role;
    }
  }

  /** Information about an enumerator. */
  public static final class EnumeratorInfo {
    public final Term.Var enumerator;
    public final SygusType type;

    /**
     * Template that the enumerated values are plugged into, or null. The
     * value takes the place of {@link #templateArg}.
     */
    public final @Nullable Term template;

    public final Term.@Nullable Var templateArg;

    EnumeratorInfo(
        Term.Var enumerator,
        SygusType type,
        @Nullable Term template,
        Term.@Nullable Var templateArg) {
      this.enumerator = requireNonNull(enumerator, "enumerator");
      this.type = requireNonNull(type, "type");
      this.template = template;
      this.templateArg = templateArg;
      checkArgument(
          (template == null) == (templateArg == null),
          "template and template argument must both be set or both be null");
    }
  }

  /** Node of the strategy graph; a list of alternatives. */
  public static final class StrategyNode {
    static final StrategyNode EMPTY = new StrategyNode(ImmutableList.of());

    public final ImmutableList<Alternative> alternatives;

    StrategyNode(ImmutableList<Alternative> alternatives) {
      this.alternatives = alternatives;
    }
  }

  /**
   * One way to construct a value: a constructor applied to values built for
   * each child point.
   *
   * <p>For {@link StrategyType#ITE}, child 0 is the condition and children 1
   * and 2 are the branches.
   */
  public static final class Alternative {
    public final StrategyType type;
    public final String constructor;
    public final ImmutableList<Point> children;

    Alternative(StrategyType type, String constructor, List<Point> children) {
      this.type = requireNonNull(type, "type");
      this.constructor = requireNonNull(constructor, "constructor");
      this.children = ImmutableList.copyOf(children);
    }

    @Override
    public String toString() {
      return type + " " + constructor + children;
    }
  }

  /** Builder for {@link Strategy}. */
  public static class Builder {
    private final Term.Var candidate;
    private final Term.Var rootEnumerator;
    private final Map<Term.Var, EnumeratorInfo> enumerators =
        new LinkedHashMap<>();
    private final Map<Point, List<Alternative>> nodes = new LinkedHashMap<>();
    private final ImmutableListMultimap.Builder<Term.Var, Term> lemmas =
        ImmutableListMultimap.builder();

    Builder(Term.Var candidate, Term.Var rootEnumerator, SygusType type) {
      this.candidate = candidate;
      this.rootEnumerator = rootEnumerator;
      enumerator(rootEnumerator, type);
    }

    /** Declares an enumerator. */
    public Builder enumerator(Term.Var enumerator, SygusType type) {
      enumerators.put(
          enumerator, new EnumeratorInfo(enumerator, type, null, null));
      return this;
    }

    /** Declares an enumerator whose values are plugged into a template. */
    public Builder enumerator(
        Term.Var enumerator, SygusType type, Term template, Term.Var arg) {
      enumerators.put(
          enumerator, new EnumeratorInfo(enumerator, type, template, arg));
      return this;
    }

    /** Adds an alternative to the node of an enumerator in a role. */
    public Builder alternative(
        Term.Var enumerator,
        NodeRole role,
        StrategyType type,
        String constructor,
        Point... children) {
      checkArgument(
          enumerators.containsKey(enumerator),
          "unknown enumerator %s",
          enumerator);
      for (Point child : children) {
        checkArgument(
            enumerators.containsKey(child.enumerator),
            "unknown enumerator %s",
            child.enumerator);
      }
      if (type == StrategyType.ITE) {
        checkArgument(children.length == 3, "ite needs 3 children");
      }
      nodes
          .computeIfAbsent(point(enumerator, role), p -> new ArrayList<>())
          .add(
              new Alternative(
                  type, constructor, ImmutableList.copyOf(children)));
      return this;
    }

    /** Adds a lemma produced by the grammar layer. */
    public Builder lemma(Term.Var enumerator, Term lemma) {
      lemmas.put(enumerator, lemma);
      return this;
    }

    public Strategy build() {
      final ImmutableMap.Builder<Point, StrategyNode> b =
          ImmutableMap.builder();
      nodes.forEach(
          (point, alternatives) ->
              b.put(
                  point,
                  new StrategyNode(ImmutableList.copyOf(alternatives))));
      return new Strategy(
          candidate,
          rootEnumerator,
          ImmutableMap.copyOf(enumerators),
          b.build(),
          lemmas.build());
    }
  }
}

// End Strategy.java
