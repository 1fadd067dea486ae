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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Shuttle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of {@link PeepholeOptimization}s, indexed by {@link PatternKey}.
 *
 * <p>{@link #applyToNode} rewrites a single node using the first
 * optimization that changes it; {@link #apply} walks a whole expression.
 * Optimizations are tried in the order they were registered, so the order of
 * the list (and of packs) matters.
 *
 * <p>A rule set is immutable and may be shared between threads.
 */
public final class PeepholeOptimizer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PeepholeOptimizer.class);

  private final ImmutableList<PeepholeOptimization> optimizations;

  /** For each key, the optimizations with that key and the optimizations
   * with no key, in registration order. */
  private final ImmutableMap<PatternKey, ImmutableList<PeepholeOptimization>>
      byKey;

  /** Optimizations that have no key, in registration order. */
  private final ImmutableList<PeepholeOptimization> catchAll;

  private PeepholeOptimizer(ImmutableList<PeepholeOptimization> optimizations) {
    this.optimizations = optimizations;

    final Set<PatternKey> keys = new LinkedHashSet<>();
    final ImmutableList.Builder<PeepholeOptimization> catchAllBuilder =
        ImmutableList.builder();
    for (PeepholeOptimization optimization : optimizations) {
      final PatternKey key = optimization.patternKey();
      if (key == null) {
        catchAllBuilder.add(optimization);
      } else {
        keys.add(key);
      }
    }
    this.catchAll = catchAllBuilder.build();

    final Map<PatternKey, ImmutableList<PeepholeOptimization>> map =
        new LinkedHashMap<>();
    for (PatternKey key : keys) {
      final ImmutableList.Builder<PeepholeOptimization> bucket =
          ImmutableList.builder();
      for (PeepholeOptimization optimization : optimizations) {
        final PatternKey key2 = optimization.patternKey();
        if (key2 == null || key2.equals(key)) {
          bucket.add(optimization);
        }
      }
      map.put(key, bucket.build());
    }
    this.byKey = ImmutableMap.copyOf(map);
  }

  /** Creates a rule set from a list of optimizations. */
  public static PeepholeOptimizer create(
      List<? extends PeepholeOptimization> optimizations) {
    final PeepholeOptimizer optimizer =
        new PeepholeOptimizer(ImmutableList.copyOf(optimizations));
    LOGGER.debug("Created rule set with {} optimizations in {} buckets",
        optimizer.optimizations.size(), optimizer.byKey.size());
    return optimizer;
  }

  /** Creates a rule set from the optimizations of several packs, in
   * order. */
  public static PeepholeOptimizer create(OptimizationEnv env,
      PeepholeOptimizationPack... packs) {
    return create(env, Arrays.asList(packs));
  }

  /** Creates a rule set from the optimizations of several packs, in
   * order. */
  public static PeepholeOptimizer create(OptimizationEnv env,
      List<? extends PeepholeOptimizationPack> packs) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    for (PeepholeOptimizationPack pack : packs) {
      list.addAll(pack.create(env));
    }
    return create(list.build());
  }

  /** Returns the optimizations, in registration order. */
  public List<PeepholeOptimization> optimizations() {
    return optimizations;
  }

  /** Rewrites a node using the first optimization that changes its
   * fingerprint. Returns the node unchanged if no optimization applies. */
  public ExprNode applyToNode(ExprNode node) {
    return applyToNode(node, Tracers.empty());
  }

  /** Rewrites a node using the first optimization that changes its
   * fingerprint, informing a tracer. */
  public ExprNode applyToNode(ExprNode node, Tracer tracer) {
    final List<PeepholeOptimization> candidates =
        byKey.getOrDefault(PatternKey.of(node), catchAll);
    for (PeepholeOptimization optimization : candidates) {
      final ExprNode result = optimization.applyToRoot(node);
      if (!result.fingerprint().equals(node.fingerprint())) {
        tracer.onRewrite(optimization, node, result);
        return result;
      }
    }
    return node;
  }

  /** Rewrites an expression in one post-order pass. */
  public ExprNode apply(ExprNode root) {
    return apply(root, Tracers.empty());
  }

  /**
   * Rewrites an expression in one post-order pass, informing a tracer.
   *
   * <p>Each node's arguments are rewritten first, then the node is rebuilt
   * with the new arguments, and then {@link #applyToNode} is called on the
   * rebuilt node. The result of {@code applyToNode} is not rewritten again
   * in this pass. A sub-expression that occurs several times is rewritten
   * once.
   */
  public ExprNode apply(ExprNode root, Tracer tracer) {
    return new Shuttle() {
      @Override protected ExprNode visit(Expr.Literal literal) {
        return applyToNode(literal, tracer);
      }

      @Override protected ExprNode visit(Expr.Leaf leaf) {
        return applyToNode(leaf, tracer);
      }

      @Override protected ExprNode visit(Expr.Placeholder placeholder) {
        return applyToNode(placeholder, tracer);
      }

      @Override protected ExprNode visit(Expr.Call call) {
        return applyToNode(super.visit(call), tracer);
      }
    }.apply(root);
  }
}

// End PeepholeOptimizer.java
