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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.ScalarType;

/**
 * Optimizations of boolean expressions.
 *
 * <p>Three-valued operators ({@code bool.*}) are lowered to two-valued
 * presence operators ({@code core.*}) where a literal {@code true} or
 * {@code false} makes that possible. Such patterns often arise when
 * three-valued logic is converted to two-valued logic.
 */
public abstract class BoolOptimizations {
  private BoolOptimizations() {}

  /** Pairs of comparisons, each the negation of the other. There are no
   * rules from {@code bool.greater} and {@code bool.greater_equal}. */
  private static final ImmutableMap<String, String> OPPOSITE_COMPARISONS =
      ImmutableMap.of(
          "equal", "not_equal",
          "not_equal", "equal",
          "less", "greater_equal",
          "less_equal", "greater");

  private static final ImmutableList<String> COMPARISONS =
      ImmutableList.of("equal", "not_equal", "less", "less_equal");

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    addLogicalNotOptimizations(env, list);
    addCoreComparisonOptimizations(env, list);
    addLogicalIfOptimizations(env, list);
    return list.build();
  }

  /** Matches literals {@code true} and {@code optional_boolean{true}}. */
  private static Predicate<ExprNode> isTrue() {
    return NodeMatchers.isAnyOf(expr.literal(true),
        expr.literal(OptionalValue.of(true)));
  }

  /** Matches literals {@code false} and {@code optional_boolean{false}}. */
  private static Predicate<ExprNode> isFalse() {
    return NodeMatchers.isAnyOf(expr.literal(false),
        expr.literal(OptionalValue.of(false)));
  }

  /** Removes {@code bool.logical_not} from double negations and from
   * around comparisons. */
  private static void addLogicalNotOptimizations(OptimizationEnv env,
      ImmutableList.Builder<PeepholeOptimization> list) {
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    list.add(
        PeepholeOptimization.pattern(
            env.call("bool.logical_not", env.call("bool.logical_not", a)), a,
            ImmutableMap.of("a",
                NodeMatchers.hasValueType(env, ScalarType.BOOLEAN))));
    OPPOSITE_COMPARISONS.forEach((cmp1, cmp2) ->
        list.add(
            PeepholeOptimization.pattern(
                env.call("bool.logical_not", env.call("bool." + cmp1, a, b)),
                env.call("bool." + cmp2, a, b))));
  }

  /**
   * Lowers comparisons with {@code true}.
   *
   * <ul>
   * <li>{@code core.equal(true, a)} becomes {@code core.equal(a, true)},
   *   to reduce the number of other rules;
   * <li>{@code core.equal(bool.cmp(a, b), true)} becomes
   *   {@code core.cmp(a, b)}, also if the comparison is wrapped in
   *   {@code core.to_optional};
   * <li>{@code core.equal(bool.logical_and(a, b), true)} becomes
   *   {@code core.presence_and(core.equal(a, true), core.equal(b, true))},
   *   and similarly for {@code logical_or}, if {@code a} or {@code b} is a
   *   literal or a comparison, and will be lowered further.
   * </ul>
   */
  private static void addCoreComparisonOptimizations(OptimizationEnv env,
      ImmutableList.Builder<PeepholeOptimization> list) {
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    final ExprNode true_ = expr.placeholder("true");
    final Predicate<ExprNode> isTrue = isTrue();

    list.add(
        PeepholeOptimization.pattern(env.call("core.equal", true_, a),
            env.call("core.equal", a, true_),
            ImmutableMap.of("true", isTrue, "a", isTrue.negate())));
    for (String cmp : COMPARISONS) {
      final ExprNode boolCmp = env.call("bool." + cmp, a, b);
      final ExprNode coreCmp = env.call("core." + cmp, a, b);
      list.add(
          PeepholeOptimization.pattern(
              env.call("core.equal", boolCmp, true_), coreCmp,
              ImmutableMap.of("true", isTrue)),
          PeepholeOptimization.pattern(
              env.call("core.equal", env.call("core.to_optional", boolCmp),
                  true_),
              coreCmp,
              ImmutableMap.of("true", isTrue)));
    }

    final ImmutableSet<String> boolComparisons =
        COMPARISONS.stream()
            .map(cmp -> "bool." + cmp)
            .collect(ImmutableSet.toImmutableSet());
    final Predicate<ExprNode> willBeLowered = node ->
        node.isLiteral()
            || node.isCall()
            && boolComparisons.contains(((Expr.Call) node).op.name);
    for (String op : ImmutableList.of("and", "or")) {
      final ExprNode from =
          env.call("core.equal", env.call("bool.logical_" + op, a, b), true_);
      final ExprNode to =
          env.call("core.presence_" + op,
              env.call("core.equal", a, true_),
              env.call("core.equal", b, true_));
      list.add(
          PeepholeOptimization.pattern(from, to,
              ImmutableMap.of("true", isTrue, "a", willBeLowered)),
          PeepholeOptimization.pattern(from, to,
              ImmutableMap.of("true", isTrue, "b", willBeLowered)));
    }
  }

  /**
   * Removes unused branches of {@code bool.logical_if(cond, ifTrue, ifFalse,
   * ifMissing)}.
   *
   * <p>If {@code cond} is never missing, or if missing means the same as
   * false or true, the call becomes a {@code core.where}. The
   * {@code ifMissing} branch that is dropped must be scalar, or the type of
   * the result would change.
   */
  private static void addLogicalIfOptimizations(OptimizationEnv env,
      ImmutableList.Builder<PeepholeOptimization> list) {
    final ExprNode condition = expr.placeholder("condition");
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    final ExprNode c = expr.placeholder("c");
    final ExprNode true_ = expr.placeholder("true");
    final ExprNode false_ = expr.placeholder("false");
    final Predicate<ExprNode> isScalar = NodeMatchers.isAlwaysPresentType(env);
    final Predicate<ExprNode> isScalarBool =
        NodeMatchers.hasType(env, type -> type == ScalarType.BOOLEAN);

    // logical_if(to_optional(cond), a, b, c)
    //   -> where(cond == true, a, b)
    // logical_if(cond | false, a, b, c)
    //   -> where(cond == true, a, b)
    final ExprNode whereTrue =
        env.call("core.where",
            env.call("core.equal", condition, expr.literal(true)), a, b);
    list.add(
        PeepholeOptimization.pattern(
            env.call("bool.logical_if",
                env.call("core.to_optional", condition), a, b, c),
            whereTrue,
            ImmutableMap.of("condition", isScalarBool, "c", isScalar)),
        PeepholeOptimization.pattern(
            env.call("bool.logical_if",
                env.call("core.presence_or", condition, false_), a, b, c),
            whereTrue,
            ImmutableMap.of("false", isFalse(), "c", isScalar)));

    // logical_if(cond, a, b, b) -> where(cond == true, a, b)
    list.add(
        PeepholeOptimization.pattern(
            env.call("bool.logical_if", condition, a, b, b), whereTrue));

    // logical_if(cond | true, a, b, c) -> where(cond == false, b, a)
    list.add(
        PeepholeOptimization.pattern(
            env.call("bool.logical_if",
                env.call("core.presence_or", condition, true_), a, b, c),
            env.call("core.where",
                env.call("core.equal", condition, expr.literal(false)), b, a),
            ImmutableMap.of("true", isTrue(), "c", isScalar)));

    // logical_if(cond, true, false, a) -> cond | a
    // If a branch is an optional literal, the result is optional, and so
    // "a" must be too.
    final Predicate<ExprNode> isOptionalLike =
        NodeMatchers.isOptionalLike(env);
    final ExprNode presenceOr = env.call("core.presence_or", condition, a);
    list.add(
        PeepholeOptimization.pattern(
            env.call("bool.logical_if", condition, expr.literal(true),
                expr.literal(false), a),
            presenceOr,
            ImmutableMap.of("condition", isOptionalLike)),
        PeepholeOptimization.pattern(
            env.call("bool.logical_if", condition, true_, false_, a),
            presenceOr,
            ImmutableMap.of("condition", isOptionalLike, "true", isTrue(),
                "false", isFalse(), "a", isOptionalLike)));
  }
}

// End BoolOptimizations.java
