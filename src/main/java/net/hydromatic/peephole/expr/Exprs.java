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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;

/** Utilities for {@link ExprNode}. */
public abstract class Exprs {
  private Exprs() {}

  /** Returns the names of the leaves in an expression. */
  public static ImmutableSortedSet<String> leafKeys(ExprNode node) {
    final ImmutableSortedSet.Builder<String> names =
        ImmutableSortedSet.naturalOrder();
    new Visitor() {
      @Override protected void visit(Expr.Leaf leaf) {
        names.add(leaf.name);
      }
    }.accept(node);
    return names.build();
  }

  /** Returns the names of the placeholders in an expression. */
  public static ImmutableSortedSet<String> placeholderKeys(ExprNode node) {
    final ImmutableSortedSet.Builder<String> names =
        ImmutableSortedSet.naturalOrder();
    new Visitor() {
      @Override protected void visit(Expr.Placeholder placeholder) {
        names.add(placeholder.name);
      }
    }.accept(node);
    return names.build();
  }

  /** Returns the number of distinct nodes in an expression. */
  public static int nodeCount(ExprNode node) {
    return postOrder(node).size();
  }

  /** Returns the distinct nodes of an expression, each after its
   * arguments. */
  public static ImmutableList<ExprNode> postOrder(ExprNode node) {
    final ImmutableList.Builder<ExprNode> nodes = ImmutableList.builder();
    new Visitor() {
      @Override protected void visit(Expr.Literal literal) {
        nodes.add(literal);
      }

      @Override protected void visit(Expr.Leaf leaf) {
        nodes.add(leaf);
      }

      @Override protected void visit(Expr.Placeholder placeholder) {
        nodes.add(placeholder);
      }

      @Override protected void visit(Expr.Call call) {
        nodes.add(call);
      }
    }.accept(node);
    return nodes.build();
  }

  /**
   * Replaces each placeholder in an expression with the corresponding
   * expression from a map.
   *
   * <p>Throws if a placeholder has no entry in the map.
   */
  public static ExprNode substitutePlaceholders(ExprNode node,
      Map<String, ? extends ExprNode> substitutions) {
    return new Shuttle() {
      @Override protected ExprNode visit(Expr.Placeholder placeholder) {
        final ExprNode substitute = substitutions.get(placeholder.name);
        if (substitute == null) {
          throw new IllegalArgumentException("no substitution for placeholder "
              + placeholder.name);
        }
        return substitute;
      }
    }.apply(node);
  }

  /** Returns the debug rendering of an expression, truncated to at most
   * {@code maxLength} characters. */
  public static String debugSnippet(ExprNode node, int maxLength) {
    final String s = requireNonNull(node.toString());
    if (s.length() <= maxLength) {
      return s;
    }
    final String ellipsis = "...";
    return s.substring(0, Math.max(0, maxLength - ellipsis.length()))
        + ellipsis;
  }
}

// End Exprs.java
