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

/** Called on various events during optimization.
 *
 * @see Tracers */
public interface Tracer {
  /** Called when an optimization rewrites a node. */
  void onRewrite(PeepholeOptimization optimization, ExprNode before,
      ExprNode after);

  /** Called after each iteration of a fixed-point optimizer, with the
   * expression before and after the iteration. Iterations are numbered
   * from 1. */
  void onIteration(int iteration, ExprNode before, ExprNode after);

  /** Called when a fixed-point optimizer reaches a fixed point. */
  void onFixedPoint(int iterationCount, ExprNode result);
}

// End Tracer.java
