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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;

/**
 * Optimizations that move pointwise operators inside
 * {@code core.const_with_shape}, so that the operator is applied once to a
 * scalar rather than to every element of an array.
 *
 * <p>For example, {@code math.neg(core.const_with_shape(s, x))} becomes
 * {@code core.const_with_shape(s, math.neg(x))}.
 */
public abstract class ConstWithShapeOptimizations {
  private ConstWithShapeOptimizations() {}

  private static final ImmutableList<String> UNARY_POINTWISE_OPS =
      ImmutableList.of(
          "bool.logical_not",
          "core.has",
          "core.presence_not",
          "core.to_optional",
          "math.abs",
          "math.neg");

  private static final ImmutableList<String> BINARY_POINTWISE_OPS =
      ImmutableList.of(
          "bool.equal",
          "bool.less",
          "bool.less_equal",
          "bool.logical_and",
          "bool.logical_or",
          "bool.not_equal",
          "core.equal",
          "core.less",
          "core.less_equal",
          "core.not_equal",
          "core.presence_and",
          "core.presence_or",
          "math.add",
          "math.divide",
          "math.max",
          "math.min",
          "math.mod",
          "math.multiply",
          "math.subtract");

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    final ExprNode shape = expr.placeholder("shape");
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");

    // shape_of(has(const_with_shape(shape, a))) -> shape
    // shape_of(const_with_shape(shape, a)) -> shape
    // The second handles the case where "has" has already been moved
    // inside const_with_shape.
    list.add(
        PeepholeOptimization.pattern(
            env.call("core.shape_of",
                env.call("core.has",
                    env.call("core.const_with_shape", shape, a))),
            shape),
        PeepholeOptimization.pattern(
            env.call("core.shape_of",
                env.call("core.const_with_shape", shape, a)),
            shape));

    for (String op : UNARY_POINTWISE_OPS) {
      list.add(
          PeepholeOptimization.pattern(
              env.call(op, env.call("core.const_with_shape", shape, a)),
              env.call("core.const_with_shape", shape, env.call(op, a))));
    }

    final Predicate<ExprNode> isBaseType = NodeMatchers.isBaseType(env);
    final ExprNode expandedA = env.call("core.const_with_shape", shape, a);
    final ExprNode expandedB = env.call("core.const_with_shape", shape, b);
    for (String op : BINARY_POINTWISE_OPS) {
      final ExprNode to =
          env.call("core.const_with_shape", shape, env.call(op, a, b));
      // Both operands expanded to the same shape
      list.add(
          PeepholeOptimization.pattern(env.call(op, expandedA, expandedB),
              to));
      // One operand expanded, the other scalar or optional
      list.add(
          PeepholeOptimization.pattern(env.call(op, expandedA, b), to,
              ImmutableMap.of("b", isBaseType)),
          PeepholeOptimization.pattern(env.call(op, a, expandedB), to,
              ImmutableMap.of("a", isBaseType)));
    }
    return list.build();
  }
}

// End ConstWithShapeOptimizations.java
