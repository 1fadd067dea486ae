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
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.ScalarType;

/**
 * Optimizations that remove identity elements: {@code x + 0}, {@code 0 + x},
 * {@code x - 0}, {@code x * 1}, {@code 1 * x} and {@code x / 1} become
 * {@code x}.
 *
 * <p>The literal must have the same value type as {@code x}. If the literal
 * is optional, {@code x} must be optional or an array; otherwise the result
 * would have a different type.
 */
public abstract class ArithmeticOptimizations {
  private ArithmeticOptimizations() {}

  /** The numeric types, and their zero and one values. */
  private static final ImmutableMap<ScalarType, List<Object>> IDENTITIES =
      ImmutableMap.of(
          ScalarType.INT32, ImmutableList.<Object>of(0, 1),
          ScalarType.INT64, ImmutableList.<Object>of(0L, 1L),
          ScalarType.FLOAT32, ImmutableList.<Object>of(0F, 1F),
          ScalarType.FLOAT64, ImmutableList.<Object>of(0D, 1D));

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    IDENTITIES.forEach((scalarType, values) -> {
      final Predicate<ExprNode> isType =
          NodeMatchers.hasValueType(env, scalarType);
      addIdentities(env, list, expr.literal(values.get(0)),
          expr.literal(values.get(1)), isType);
      addIdentities(env, list,
          expr.literal(OptionalValue.of(values.get(0))),
          expr.literal(OptionalValue.of(values.get(1))),
          isType.and(NodeMatchers.isOptionalLike(env)));
    });
    return list.build();
  }

  private static void addIdentities(OptimizationEnv env,
      ImmutableList.Builder<PeepholeOptimization> list, ExprNode zero,
      ExprNode one, Predicate<ExprNode> matcher) {
    final ExprNode x = expr.placeholder("x");
    final ImmutableMap<String, Predicate<ExprNode>> matchers =
        ImmutableMap.of("x", matcher);
    list.add(
        PeepholeOptimization.pattern(env.call("math.add", x, zero), x,
            matchers),
        PeepholeOptimization.pattern(env.call("math.add", zero, x), x,
            matchers),
        PeepholeOptimization.pattern(env.call("math.subtract", x, zero), x,
            matchers),
        PeepholeOptimization.pattern(env.call("math.multiply", x, one), x,
            matchers),
        PeepholeOptimization.pattern(env.call("math.multiply", one, x), x,
            matchers),
        PeepholeOptimization.pattern(env.call("math.divide", x, one), x,
            matchers));
  }
}

// End ArithmeticOptimizations.java
