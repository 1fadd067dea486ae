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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node in an expression graph.
 *
 * <p>Nodes are immutable. A node may be shared by several parents, so an
 * expression is a directed acyclic graph rather than a tree.
 *
 * <p>Each node has a {@link Fingerprint}, computed when the node is created
 * from its kind, its payload and the fingerprints of its children. Equality
 * is defined by fingerprint: two structurally equal nodes are equal, even if
 * they are different objects.
 */
public abstract class ExprNode {
  public final NodeKind kind;
  private final Fingerprint fingerprint;

  ExprNode(NodeKind kind, Fingerprint fingerprint) {
    this.kind = requireNonNull(kind);
    this.fingerprint = requireNonNull(fingerprint);
  }

  /** Returns the fingerprint of this node. */
  public final Fingerprint fingerprint() {
    return fingerprint;
  }

  /** Returns the children of this node; empty unless this is a call. */
  public List<ExprNode> children() {
    return ImmutableList.of();
  }

  /**
   * Returns a node like this but with different children.
   *
   * <p>If the new children are the same as the current ones, returns this
   * node.
   */
  public ExprNode withNewChildren(List<? extends ExprNode> children) {
    checkArgument(children.isEmpty(), "%s node cannot have children", kind);
    return this;
  }

  public boolean isLiteral() {
    return kind == NodeKind.LITERAL;
  }

  public boolean isLeaf() {
    return kind == NodeKind.LEAF;
  }

  public boolean isPlaceholder() {
    return kind == NodeKind.PLACEHOLDER;
  }

  public boolean isCall() {
    return kind == NodeKind.OPERATOR;
  }

  @Override public final int hashCode() {
    return fingerprint.hashCode();
  }

  @Override public final boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof ExprNode
        && fingerprint.equals(((ExprNode) o).fingerprint);
  }

  /**
   * Converts this node into a string, for debugging.
   *
   * <p>For example, "{@code math.add(L.x, P.a)}".
   */
  @Override public final String toString() {
    // Marked final because you should override unparse, not toString
    return new ExprWriter().append(this).toString();
  }

  /** Writes this node to a writer. */
  abstract ExprWriter unparse(ExprWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the kind of this node, and returning the result.
   */
  public abstract ExprNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the kind of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End ExprNode.java
