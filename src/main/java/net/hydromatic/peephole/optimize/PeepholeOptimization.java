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
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import net.hydromatic.peephole.expr.ExprNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rule that rewrites the root of an expression.
 *
 * <p>There are two kinds: a pattern optimization, created by
 * {@link #pattern}, rewrites nodes that match a {@link Pattern}; a transform
 * optimization, created by {@link #transform}, applies an arbitrary
 * function.
 *
 * <p>An optimization that does not apply returns its argument unchanged.
 * Optimizations are immutable and may be shared between threads.
 */
public abstract class PeepholeOptimization {
  private PeepholeOptimization() {}

  /** Creates an optimization that rewrites nodes that match {@code from}
   * into {@code to}. */
  public static PeepholeOptimization pattern(ExprNode from, ExprNode to) {
    return pattern(from, to, ImmutableMap.of());
  }

  /** Creates an optimization that rewrites nodes that match {@code from}
   * into {@code to}, if the nodes bound to placeholders satisfy the
   * matchers.
   *
   * @throws InvalidPatternException if the pattern is not valid */
  public static PeepholeOptimization pattern(ExprNode from, ExprNode to,
      Map<String, ? extends Predicate<ExprNode>> matchers) {
    return new PatternOptimization(Pattern.compile(from, to, matchers));
  }

  /** Creates an optimization that applies a function. The function must
   * return its argument if it does not apply. */
  public static PeepholeOptimization transform(String name,
      UnaryOperator<ExprNode> function) {
    return new TransformOptimization(name, function);
  }

  /** Tries to rewrite a node; returns the node unchanged if this
   * optimization does not apply. */
  public abstract ExprNode applyToRoot(ExprNode root);

  /** Returns the key of nodes that this optimization might apply to, or
   * null if it should be tried on every node. */
  public abstract @Nullable PatternKey patternKey();

  /** Optimization based on a {@link Pattern}. */
  static class PatternOptimization extends PeepholeOptimization {
    final Pattern pattern;
    private final @Nullable PatternKey key;

    PatternOptimization(Pattern pattern) {
      this.pattern = requireNonNull(pattern);
      this.key = pattern.key();
    }

    @Override public ExprNode applyToRoot(ExprNode root) {
      return pattern.apply(root);
    }

    @Override public @Nullable PatternKey patternKey() {
      return key;
    }

    @Override public String toString() {
      return pattern.toString();
    }
  }

  /** Optimization that applies a function. */
  static class TransformOptimization extends PeepholeOptimization {
    private final String name;
    private final UnaryOperator<ExprNode> function;

    TransformOptimization(String name, UnaryOperator<ExprNode> function) {
      this.name = requireNonNull(name);
      this.function = requireNonNull(function);
    }

    @Override public ExprNode applyToRoot(ExprNode root) {
      return requireNonNull(function.apply(root), name);
    }

    @Override public @Nullable PatternKey patternKey() {
      return null;
    }

    @Override public String toString() {
      return name;
    }
  }
}

// End PeepholeOptimization.java
