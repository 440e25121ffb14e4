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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.sygus.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Trie that partitions heads by the outcomes of a sequence of classifiers.
 *
 * <p>Level {@code i} of the trie branches on the outcome of classifier
 * {@code i}. Branching is lazy: a node that has seen only one head stores it
 * as its "lazy child" and does not evaluate any further classifiers until a
 * second head arrives.
 *
 * <p>Each leaf holds a separation class, a list of heads that no classifier
 * tells apart, whose first element is the class's representative.
 *
 * <p>Nodes are held in a list and refer to each other by index.
 */
public class ClassificationTrie {
  /** Computes the outcome of a classifier on a head. */
  public interface Classifier {
    Term evaluate(Term.Var head, int index);
  }

  /** Folds the trie bottom-up. */
  public interface Folder<R> {
    /** Value of a leaf, given its representative. */
    R leaf(Term.Var representative);

    /** Value of an internal node at a given level, given its children. */
    R node(int level, Map<Term, R> children);
  }

  private final List<Node> nodes = new ArrayList<>();
  private final Map<Term.Var, List<Term.Var>> repToClass =
      new LinkedHashMap<>();

  public ClassificationTrie() {
    clear();
  }

  /** Removes all heads. */
  public void clear() {
    nodes.clear();
    nodes.add(new Node());
    repToClass.clear();
  }

  /** Returns whether the trie is empty. */
  public boolean isEmpty() {
    return repToClass.isEmpty();
  }

  /**
   * Adds a head, evaluating up to {@code levels} classifiers, and returns the
   * representative of its separation class.
   */
  public Term.Var add(Term.Var head, Classifier classifier, int levels) {
    final Term.Var rep = addToTrie(head, classifier, levels);
    if (rep.equals(head)) {
      final List<Term.Var> cls = new ArrayList<>();
      cls.add(head);
      repToClass.put(head, cls);
    } else {
      final List<Term.Var> cls = repToClass.get(rep);
      checkState(cls != null, "representative %s has no class", rep);
      cls.add(head);
    }
    return rep;
  }

  private Term.Var addToTrie(Term.Var head, Classifier classifier, int levels) {
    int index = 0;
    for (int level = 0; level < levels; level++) {
      final Node node = nodes.get(index);
      if (node.children.isEmpty()) {
        if (node.lazyChild == null) {
          node.lazyChild = head;
          return head;
        }
        // Push the lazy child down one level.
        final Term.Var lazy = node.lazyChild;
        node.lazyChild = null;
        final int c = childIndex(node, classifier.evaluate(lazy, level));
        nodes.get(c).lazyChild = lazy;
      }
      index = childIndex(node, classifier.evaluate(head, level));
    }
    final Node leaf = nodes.get(index);
    if (leaf.lazyChild == null) {
      leaf.lazyChild = head;
    }
    return leaf.lazyChild;
  }

  /**
   * Splits every class that lies at depth {@code level} using classifier
   * {@code level}. Within each class, the first head routed to a new child
   * becomes that child's representative.
   */
  public void addClassifier(Classifier classifier, int level) {
    final Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {0, 0});
    while (!stack.isEmpty()) {
      final int[] entry = stack.pop();
      final int depth = entry[0];
      final Node node = nodes.get(entry[1]);
      if (depth == level) {
        final Term.Var rep = node.lazyChild;
        if (rep == null) {
          continue;
        }
        checkState(node.children.isEmpty(), "leaf has children");
        final List<Term.Var> previous = repToClass.remove(rep);
        checkState(previous != null, "representative %s has no class", rep);
        node.lazyChild = null;
        for (Term.Var head : previous) {
          final Node child =
              nodes.get(childIndex(node, classifier.evaluate(head, level)));
          if (child.lazyChild == null) {
            child.lazyChild = head;
            repToClass.put(head, new ArrayList<>());
          }
          final List<Term.Var> cls = repToClass.get(child.lazyChild);
          checkState(cls != null);
          cls.add(head);
        }
      } else {
        for (int c : node.children.values()) {
          stack.push(new int[] {depth + 1, c});
        }
      }
    }
  }

  private int childIndex(Node node, Term outcome) {
    final Integer c = node.children.get(outcome);
    if (c != null) {
      return c;
    }
    final int index = nodes.size();
    nodes.add(new Node());
    node.children.put(outcome, index);
    return index;
  }

  /** Returns the separation classes, keyed by representative. */
  public Map<Term.Var, List<Term.Var>> classes() {
    return Collections.unmodifiableMap(repToClass);
  }

  /** Returns whether a head is the representative of a class. */
  public boolean isRepresentative(Term.Var head) {
    return repToClass.containsKey(head);
  }

  /** Returns the class whose representative is {@code rep}, or null. */
  public @Nullable List<Term.Var> classOf(Term.Var rep) {
    final List<Term.Var> cls = repToClass.get(rep);
    return cls == null ? null : ImmutableList.copyOf(cls);
  }

  /** Folds the trie bottom-up, starting from the root at level 0. */
  public <R> R fold(Folder<R> folder) {
    checkArgument(!isEmpty(), "empty trie");
    return fold(folder, 0, 0);
  }

  private <R> R fold(Folder<R> folder, int index, int level) {
    final Node node = nodes.get(index);
    if (node.children.isEmpty()) {
      checkState(node.lazyChild != null, "leaf at level %s is empty", level);
      return folder.leaf(node.lazyChild);
    }
    final Map<Term, R> values = new LinkedHashMap<>();
    node.children.forEach(
        (outcome, child) ->
            values.put(outcome, fold(folder, child, level + 1)));
    return folder.node(level, values);
  }

  /** Node of the trie. */
  private static class Node {
    Term.@Nullable Var lazyChild;
    final Map<Term, Integer> children = new LinkedHashMap<>();
  }
}

// End ClassificationTrie.java
