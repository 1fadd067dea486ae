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

import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Exprs;
import net.hydromatic.peephole.type.QType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when an optimizer violates an invariant.
 *
 * <p>This indicates a bug in one of the optimizations: either they do not
 * converge, or one of them changes the type of the expression.
 */
public class OptimizerException extends RuntimeException {
  OptimizerException(String message) {
    super(message);
  }

  /** Thrown when an expression has not reached a fixed point after the
   * maximum number of iterations. */
  public static class NonTermination extends OptimizerException {
    private final int iterationCount;
    private final ExprNode before;
    private final ExprNode after;

    NonTermination(int iterationCount, ExprNode before, ExprNode after,
        int snippetLength) {
      super(String.format("too many iterations of peephole optimizer; "
              + "iteration count %d; expression before last iteration: %s; "
              + "expression after last iteration: %s",
          iterationCount,
          Exprs.debugSnippet(before, snippetLength),
          Exprs.debugSnippet(after, snippetLength)));
      this.iterationCount = iterationCount;
      this.before = requireNonNull(before);
      this.after = requireNonNull(after);
    }

    /** Returns the number of iterations completed. */
    public int iterationCount() {
      return iterationCount;
    }

    /** Returns the expression before the last iteration. */
    public ExprNode before() {
      return before;
    }

    /** Returns the expression after the last iteration. */
    public ExprNode after() {
      return after;
    }
  }

  /** Thrown when an iteration changes the type of an expression. */
  public static class TypeChanged extends OptimizerException {
    private final ExprNode before;
    private final ExprNode after;
    private final @Nullable QType fromType;
    private final @Nullable QType toType;

    TypeChanged(ExprNode before, ExprNode after, @Nullable QType fromType,
        @Nullable QType toType, int snippetLength) {
      super(String.format("expression type changed from %s to %s "
              + "during optimization; before: %s; after: %s",
          moniker(fromType), moniker(toType),
          Exprs.debugSnippet(before, snippetLength),
          Exprs.debugSnippet(after, snippetLength)));
      this.before = requireNonNull(before);
      this.after = requireNonNull(after);
      this.fromType = fromType;
      this.toType = toType;
    }

    private static String moniker(@Nullable QType type) {
      return type == null ? "unknown" : type.moniker();
    }

    public ExprNode before() {
      return before;
    }

    public ExprNode after() {
      return after;
    }

    public @Nullable QType fromType() {
      return fromType;
    }

    public @Nullable QType toType() {
      return toType;
    }
  }
}

// End OptimizerException.java
