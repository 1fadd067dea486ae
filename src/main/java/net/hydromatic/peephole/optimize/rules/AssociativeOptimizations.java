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
package net.hydromatic.peephole.optimize.rules;

import static net.hydromatic.peephole.expr.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;

/**
 * Optimizations that fold a sum of four terms into one call to
 * {@code math._add4}, reducing the depth of the expression.
 *
 * <p>Three shapes of sum are recognized: balanced,
 * {@code (a + b) + (c + d)}; left-linear, {@code ((a + b) + c) + d}; and
 * right-linear, {@code a + (b + (c + d))}.
 */
public abstract class AssociativeOptimizations {
  private AssociativeOptimizations() {}

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    final ExprNode c = expr.placeholder("c");
    final ExprNode d = expr.placeholder("d");
    final ExprNode to = env.call("math._add4", a, b, c, d);
    final ExprNode balanced =
        env.call("math.add", env.call("math.add", a, b),
            env.call("math.add", c, d));
    final ExprNode leftLinear =
        env.call("math.add",
            env.call("math.add", env.call("math.add", a, b), c), d);
    final ExprNode rightLinear =
        env.call("math.add", a,
            env.call("math.add", b, env.call("math.add", c, d)));
    return ImmutableList.of(
        PeepholeOptimization.pattern(balanced, to),
        PeepholeOptimization.pattern(leftLinear, to),
        PeepholeOptimization.pattern(rightLinear, to));
  }
}

// End AssociativeOptimizations.java
