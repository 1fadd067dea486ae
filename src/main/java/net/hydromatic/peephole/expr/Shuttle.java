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
package net.hydromatic.peephole.expr;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Visits and transforms expressions.
 *
 * <p>The transformation is post-order: a call's arguments are transformed
 * before the call. Results are remembered by fingerprint, so a sub-expression
 * that occurs several times is transformed once, and the result is shared.
 * A shuttle is therefore stateful; use a new instance for each expression.
 */
public class Shuttle {
  private final Map<Fingerprint, ExprNode> cache = new HashMap<>();

  /** Transforms a node, or returns the remembered result if the node (or a
   * node with the same fingerprint) has been transformed before.
   *
   * <p>Descendants are transformed first, using an explicit stack rather
   * than recursion, so the depth of an expression is not limited by the
   * thread's stack. By the time a node's {@code visit} method is called,
   * its arguments' results are remembered, and {@link #visitList} finds
   * them without walking further. */
  public ExprNode apply(ExprNode node) {
    final ExprNode cached = cache.get(node.fingerprint());
    if (cached != null) {
      return cached;
    }
    final Deque<ExprNode> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      final ExprNode top = stack.peek();
      if (cache.containsKey(top.fingerprint())) {
        stack.pop();
        continue;
      }
      if (pushPending(stack, top.children())) {
        continue;
      }
      stack.pop();
      cache.put(top.fingerprint(), top.accept(this));
    }
    return requireNonNull(cache.get(node.fingerprint()));
  }

  /** Pushes the nodes that have not been transformed yet, so that the first
   * of them will be transformed first. Returns whether it pushed any. */
  private boolean pushPending(Deque<ExprNode> stack,
      List<ExprNode> nodes) {
    boolean pushed = false;
    for (int i = nodes.size() - 1; i >= 0; i--) {
      final ExprNode node = nodes.get(i);
      if (!cache.containsKey(node.fingerprint())) {
        stack.push(node);
        pushed = true;
      }
    }
    return pushed;
  }

  protected List<ExprNode> visitList(List<ExprNode> nodes) {
    final List<ExprNode> list = new ArrayList<>(nodes.size());
    for (ExprNode node : nodes) {
      list.add(apply(node));
    }
    return list;
  }

  protected ExprNode visit(Expr.Literal literal) {
    return literal; // leaf
  }

  protected ExprNode visit(Expr.Leaf leaf) {
    return leaf; // leaf
  }

  protected ExprNode visit(Expr.Placeholder placeholder) {
    return placeholder; // leaf
  }

  protected ExprNode visit(Expr.Call call) {
    return call.withNewChildren(visitList(call.args));
  }
}

// End Shuttle.java
