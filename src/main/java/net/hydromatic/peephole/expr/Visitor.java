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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Visits expressions.
 *
 * <p>Nodes are visited in post-order: a call is visited after its
 * arguments. Each distinct node (by fingerprint) is visited once, even if
 * it occurs several times in the graph.
 */
public class Visitor {
  private final Set<Fingerprint> visited = new HashSet<>();

  /** Visits a node and its descendants, skipping those that have been
   * visited already.
   *
   * <p>Uses an explicit stack rather than recursion, so the depth of an
   * expression is not limited by the thread's stack. */
  public void accept(ExprNode node) {
    final Deque<ExprNode> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      final ExprNode top = stack.peek();
      if (visited.contains(top.fingerprint())) {
        stack.pop();
        continue;
      }
      if (pushPending(stack, top.children())) {
        continue;
      }
      stack.pop();
      visited.add(top.fingerprint());
      top.accept(this);
    }
  }

  /** Pushes the nodes that have not been visited yet, so that the first of
   * them will be visited first. Returns whether it pushed any. */
  private boolean pushPending(Deque<ExprNode> stack, List<ExprNode> nodes) {
    boolean pushed = false;
    for (int i = nodes.size() - 1; i >= 0; i--) {
      final ExprNode node = nodes.get(i);
      if (!visited.contains(node.fingerprint())) {
        stack.push(node);
        pushed = true;
      }
    }
    return pushed;
  }

  protected void visit(Expr.Literal literal) {}

  protected void visit(Expr.Leaf leaf) {}

  protected void visit(Expr.Placeholder placeholder) {}

  /** Called after the call's arguments have been visited. */
  protected void visit(Expr.Call call) {}
}

// End Visitor.java
