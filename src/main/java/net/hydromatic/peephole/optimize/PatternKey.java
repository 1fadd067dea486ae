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

import java.util.Objects;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Fingerprint;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Key derived from the root of an expression, used to find the rules that
 * might apply to a node.
 *
 * <p>A literal is keyed by its value and type, and a call by its operator.
 * Other nodes share a single key. If a rule matches a node, the rule's
 * pattern and the node have the same key; the converse is not true.
 */
public final class PatternKey {
  /** Key of all nodes that are neither literals nor calls. */
  static final PatternKey OTHER = new PatternKey(Kind.OTHER, null);

  public final Kind kind;
  private final @Nullable Fingerprint fingerprint;

  private PatternKey(Kind kind, @Nullable Fingerprint fingerprint) {
    this.kind = requireNonNull(kind);
    this.fingerprint = fingerprint;
  }

  /** Returns the key of a node. */
  public static PatternKey of(ExprNode node) {
    switch (node.kind) {
    case LITERAL:
      return new PatternKey(Kind.LITERAL, node.fingerprint());
    case OPERATOR:
      return new PatternKey(Kind.OPERATOR,
          ((Expr.Call) node).op.fingerprint());
    default:
      return OTHER;
    }
  }

  @Override public int hashCode() {
    return Objects.hash(kind, fingerprint);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof PatternKey
        && kind == ((PatternKey) o).kind
        && Objects.equals(fingerprint, ((PatternKey) o).fingerprint);
  }

  @Override public String toString() {
    return fingerprint == null ? kind.toString() : kind + ":" + fingerprint;
  }

  /** Kind of key. */
  public enum Kind {
    LITERAL,
    OPERATOR,
    OTHER
  }
}

// End PatternKey.java
