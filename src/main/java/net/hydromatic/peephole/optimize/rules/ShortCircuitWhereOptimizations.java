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
import java.util.Objects;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Operator;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.QTypes;
import net.hydromatic.peephole.type.ScalarType;
import net.hydromatic.peephole.type.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Optimizations that lower {@code core.where} to
 * {@code core._short_circuit_where}, which evaluates only the chosen
 * branch.
 *
 * <p>This is only possible if the condition is not an array: an array
 * condition chooses a different branch for each element.
 */
public abstract class ShortCircuitWhereOptimizations {
  private ShortCircuitWhereOptimizations() {}

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    final ExprNode c = expr.placeholder("c");
    final ExprNode shape = expr.placeholder("shape");
    final ExprNode to = env.call("core._short_circuit_where", c, a, b);
    final Operator shortCircuitWhere = env.op("core._short_circuit_where");
    return ImmutableList.of(
        // where(c, a, b) -> _short_circuit_where(c, a, b), if c is scalar
        // or optional
        PeepholeOptimization.pattern(env.call("core.where", c, a, b), to,
            ImmutableMap.of("c", NodeMatchers.isBaseType(env))),
        // where(const_with_shape(shape, c), a, b)
        //   -> _short_circuit_where(c, a, b), if a and b are arrays
        PeepholeOptimization.pattern(
            env.call("core.where",
                env.call("core.const_with_shape", shape, c), a, b),
            to,
            ImmutableMap.of("c", NodeMatchers.isBaseType(env),
                "a", NodeMatchers.isArray(env),
                "b", NodeMatchers.isArray(env))),
        PeepholeOptimization.transform("_short_circuit_where(literal)",
            node -> foldLiteralCondition(env, shortCircuitWhere, node)));
  }

  /** Replaces {@code _short_circuit_where(c, a, b)}, where {@code c} is a
   * literal, with the chosen branch. */
  private static ExprNode foldLiteralCondition(OptimizationEnv env,
      Operator shortCircuitWhere, ExprNode node) {
    if (!node.isCall()) {
      return node;
    }
    final Expr.Call call = (Expr.Call) node;
    if (!call.op.equals(shortCircuitWhere)
        || call.args.size() != 3
        || !call.arg(0).isLiteral()) {
      return node;
    }
    final Boolean present = presence(((Expr.Literal) call.arg(0)).value);
    if (present == null) {
      return node;
    }
    final ExprNode branch = present ? call.arg(1) : call.arg(2);
    final QType type = env.typeOf(node);
    final QType branchType = env.typeOf(branch);
    if (Objects.equals(type, branchType)) {
      return branch;
    }
    if (QTypes.isOptional(type)
        && QTypes.isScalar(branchType)
        && type.valueType() == branchType.valueType()) {
      // The other branch was optional
      return env.call("core.to_optional", branch);
    }
    return node;
  }

  /** Returns whether a literal condition is present, or null if the value
   * is not a presence. */
  private static @Nullable Boolean presence(Object value) {
    if (value instanceof Unit) {
      return true;
    }
    if (value instanceof OptionalValue
        && ((OptionalValue) value).type().valueType()
            == ScalarType.UNIT) {
      return ((OptionalValue) value).isPresent();
    }
    return null;
  }
}

// End ShortCircuitWhereOptimizations.java
