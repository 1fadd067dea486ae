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
package net.hydromatic.peephole.optimize;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Exprs;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrite template: an expression to match ({@link #from}) and an expression
 * to build ({@link #to}).
 *
 * <p>Placeholders in {@code from} match any node. If a placeholder occurs
 * more than once, every occurrence must match the same node (by
 * fingerprint). A placeholder may have a matcher, a predicate that the
 * matched node must satisfy.
 *
 * <p>A literal in {@code from} matches only a literal with the same value and
 * type. A call in {@code from} matches only a call to the same operator with
 * the same number of arguments, whose arguments match.
 *
 * <p>Matching is a single deterministic attempt; there is no backtracking.
 */
public final class Pattern {
  public final ExprNode from;
  public final ExprNode to;
  public final ImmutableMap<String, Predicate<ExprNode>> matchers;

  private Pattern(ExprNode from, ExprNode to,
      ImmutableMap<String, Predicate<ExprNode>> matchers) {
    this.from = requireNonNull(from);
    this.to = requireNonNull(to);
    this.matchers = requireNonNull(matchers);
  }

  /** Creates a pattern with no matchers. */
  public static Pattern compile(ExprNode from, ExprNode to) {
    return compile(from, to, ImmutableMap.of());
  }

  /**
   * Creates a pattern.
   *
   * @throws InvalidPatternException if either template contains a leaf;
   *   if {@code from} is a placeholder with no matcher; if {@code to} contains
   *   a placeholder that is not in {@code from}; or if there is a matcher for
   *   a placeholder that is not in {@code from}
   */
  public static Pattern compile(ExprNode from, ExprNode to,
      Map<String, ? extends Predicate<ExprNode>> matchers) {
    if (!Exprs.leafKeys(from).isEmpty() || !Exprs.leafKeys(to).isEmpty()) {
      throw new InvalidPatternException(
          InvalidPatternException.Reason.LEAF_IN_TEMPLATE,
          "leaves are not allowed in optimizations: "
              + describe(from, to));
    }
    if (from.isPlaceholder()
        && !matchers.containsKey(((Expr.Placeholder) from).name)) {
      throw new InvalidPatternException(
          InvalidPatternException.Reason.TRIVIAL_MATCH,
          "from expression is placeholder, which would match everything: "
              + describe(from, to));
    }
    final ImmutableSortedSet<String> fromKeys = Exprs.placeholderKeys(from);
    final Set<String> unknownToKeys =
        new TreeSet<>(Exprs.placeholderKeys(to));
    unknownToKeys.removeAll(fromKeys);
    if (!unknownToKeys.isEmpty()) {
      throw new InvalidPatternException(
          InvalidPatternException.Reason.UNKNOWN_PLACEHOLDER,
          "unknown placeholder keys in to expression: "
              + String.join(",", unknownToKeys) + ", "
              + describe(from, to));
    }
    final Set<String> unknownMatcherKeys = new TreeSet<>(matchers.keySet());
    unknownMatcherKeys.removeAll(fromKeys);
    if (!unknownMatcherKeys.isEmpty()) {
      throw new InvalidPatternException(
          InvalidPatternException.Reason.UNKNOWN_MATCHER_KEY,
          "unknown placeholder matcher keys: "
              + String.join(",", unknownMatcherKeys) + ", "
              + describe(from, to));
    }
    return new Pattern(from, to, ImmutableMap.copyOf(matchers));
  }

  private static String describe(ExprNode from, ExprNode to) {
    return from + " -> " + to;
  }

  /** Returns the key of nodes that this pattern might match, or null if it
   * might match any node. */
  public @Nullable PatternKey key() {
    final PatternKey key = PatternKey.of(from);
    return key.kind == PatternKey.Kind.OTHER ? null : key;
  }

  /** Matches {@code from} against a node; returns the placeholder bindings if
   * it matches, null if it does not. */
  public @Nullable Map<String, ExprNode> match(ExprNode node) {
    final Map<String, ExprNode> bindings = new HashMap<>();
    return matches(from, node, bindings) ? bindings : null;
  }

  private boolean matches(ExprNode pattern, ExprNode node,
      Map<String, ExprNode> bindings) {
    switch (pattern.kind) {
    case PLACEHOLDER:
      final String name = ((Expr.Placeholder) pattern).name;
      final ExprNode bound = bindings.get(name);
      if (bound != null) {
        return bound.fingerprint().equals(node.fingerprint());
      }
      final Predicate<ExprNode> matcher = matchers.get(name);
      if (matcher != null && !matcher.test(node)) {
        return false;
      }
      bindings.put(name, node);
      return true;

    case LITERAL:
      // Fingerprint of a literal includes its type.
      return node.isLiteral()
          && pattern.fingerprint().equals(node.fingerprint());

    case OPERATOR:
      if (!node.isCall()) {
        return false;
      }
      final Expr.Call patternCall = (Expr.Call) pattern;
      final Expr.Call call = (Expr.Call) node;
      if (!patternCall.op.equals(call.op)
          || patternCall.args.size() != call.args.size()) {
        return false;
      }
      final List<ExprNode> patternArgs = patternCall.args;
      for (int i = 0; i < patternArgs.size(); i++) {
        if (!matches(patternArgs.get(i), call.args.get(i), bindings)) {
          return false;
        }
      }
      return true;

    default:
      throw new AssertionError("unexpected node in pattern: " + pattern);
    }
  }

  /** Builds {@code to}, replacing each placeholder with its binding. */
  public ExprNode substitute(Map<String, ExprNode> bindings) {
    return Exprs.substitutePlaceholders(to, bindings);
  }

  /** Rewrites a node if it matches; otherwise returns it unchanged. */
  public ExprNode apply(ExprNode node) {
    final Map<String, ExprNode> bindings = match(node);
    return bindings == null ? node : substitute(bindings);
  }

  @Override public String toString() {
    return describe(from, to);
  }
}

// End Pattern.java
