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

import net.hydromatic.peephole.expr.ExprNode;

/**
 * Rewrites an expression into an equivalent, simpler expression.
 *
 * <p>An optimizer is immutable and may be shared between threads.
 *
 * @see Optimizers
 */
@FunctionalInterface
public interface Optimizer {
  /** Optimizes an expression.
   *
   * @throws OptimizerException if optimization fails; this indicates a bug
   *   in an optimization, not a problem with the expression */
  ExprNode apply(ExprNode expr);
}

// End Optimizer.java
