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
package net.hydromatic.peephole.type;

import static java.util.Objects.requireNonNull;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Fingerprint;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type inference based on the types of leaves and the {@link TypeRule} of
 * each operator.
 *
 * <p>Placeholders, leaves that are not in the map, and calls whose type rule
 * returns null have unknown type.
 *
 * <p>Inferred types are remembered by fingerprint, up to a maximum number
 * of entries. The cache is thread-safe, so an instance may be shared.
 */
public class StandardTypeInference implements TypeInference {
  /** Default maximum number of remembered types. */
  public static final int DEFAULT_CACHE_SIZE = 10_000;

  private final ImmutableMap<String, QType> leafTypes;
  private final Cache<Fingerprint, Optional<QType>> cache;

  private StandardTypeInference(ImmutableMap<String, QType> leafTypes,
      int cacheSize) {
    this.leafTypes = leafTypes;
    this.cache = CacheBuilder.newBuilder().maximumSize(cacheSize).build();
  }

  /** Creates a type inference with a given type for each leaf. */
  public static StandardTypeInference create(
      Map<String, ? extends QType> leafTypes) {
    return create(leafTypes, DEFAULT_CACHE_SIZE);
  }

  /** Creates a type inference with a given type for each leaf, remembering
   * at most {@code cacheSize} inferred types. */
  public static StandardTypeInference create(
      Map<String, ? extends QType> leafTypes, int cacheSize) {
    return new StandardTypeInference(ImmutableMap.copyOf(leafTypes),
        cacheSize);
  }

  /** {@inheritDoc}
   *
   * <p>Arguments are typed before the calls that use them, using an explicit
   * stack rather than recursion, so the depth of an expression is not
   * limited by the thread's stack. Types computed during one call are held
   * in a local map as well as the shared cache, so that evictions from the
   * cache do not lose an argument's type before its parent needs it. */
  @Override public @Nullable QType inferType(ExprNode node) {
    final Optional<QType> cached = cache.getIfPresent(node.fingerprint());
    if (cached != null) {
      return cached.orElse(null);
    }
    final Map<Fingerprint, Optional<QType>> types = new HashMap<>();
    final Deque<ExprNode> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      final ExprNode top = stack.peek();
      if (types.containsKey(top.fingerprint())) {
        stack.pop();
        continue;
      }
      final Optional<QType> known = cache.getIfPresent(top.fingerprint());
      if (known != null) {
        types.put(top.fingerprint(), known);
        stack.pop();
        continue;
      }
      boolean pushed = false;
      final List<ExprNode> children = top.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        final ExprNode child = children.get(i);
        if (!types.containsKey(child.fingerprint())) {
          stack.push(child);
          pushed = true;
        }
      }
      if (pushed) {
        continue;
      }
      stack.pop();
      final Optional<QType> type = Optional.ofNullable(compute(top, types));
      types.put(top.fingerprint(), type);
      cache.put(top.fingerprint(), type);
    }
    return requireNonNull(types.get(node.fingerprint())).orElse(null);
  }

  /** Computes the type of a node, given the types of its arguments. */
  private @Nullable QType compute(ExprNode node,
      Map<Fingerprint, Optional<QType>> types) {
    switch (node.kind) {
    case LITERAL:
      return ((Expr.Literal) node).type;
    case LEAF:
      return leafTypes.get(((Expr.Leaf) node).name);
    case PLACEHOLDER:
      return null;
    case OPERATOR:
      final Expr.Call call = (Expr.Call) node;
      final List<@Nullable QType> argTypes = new ArrayList<>();
      for (ExprNode arg : call.args) {
        argTypes.add(
            requireNonNull(types.get(arg.fingerprint())).orElse(null));
      }
      return call.op.typeRule.apply(call.op, argTypes);
    default:
      throw new AssertionError("unknown kind " + node.kind);
    }
  }
}

// End StandardTypeInference.java
