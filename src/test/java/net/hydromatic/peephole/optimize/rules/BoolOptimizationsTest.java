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

import static net.hydromatic.peephole.Matchers.isExpr;
import static net.hydromatic.peephole.expr.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.peephole.expr.BuiltIn;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.Optimizer;
import net.hydromatic.peephole.optimize.Optimizers;
import net.hydromatic.peephole.optimize.PeepholeOptimizer;
import net.hydromatic.peephole.type.OptionalType;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link BoolOptimizations}. */
public class BoolOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>builder()
              .put("b", ScalarType.BOOLEAN)
              .put("c", ScalarType.BOOLEAN)
              .put("ob", OptionalType.of(ScalarType.BOOLEAN))
              .put("oc", OptionalType.of(ScalarType.BOOLEAN))
              .put("x", ScalarType.INT32)
              .put("y", ScalarType.INT32)
              .put("z", ScalarType.INT32)
              .put("oz", OptionalType.of(ScalarType.INT32))
              .build());
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, BoolOptimizations::create),
          env.typeInference);

  private final ExprNode b = expr.leaf("b");
  private final ExprNode c = expr.leaf("c");
  private final ExprNode ob = expr.leaf("ob");
  private final ExprNode x = expr.leaf("x");
  private final ExprNode y = expr.leaf("y");
  private final ExprNode z = expr.leaf("z");
  private final ExprNode true_ = expr.literal(true);

  private ExprNode call(BuiltIn builtIn, ExprNode... args) {
    return expr.call(builtIn, args);
  }

  @Test void testDoubleNegation() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_NOT,
                call(BuiltIn.BOOL_LOGICAL_NOT, b))),
        isExpr("L.b"));

    // Not boolean, so left alone
    final ExprNode e =
        call(BuiltIn.BOOL_LOGICAL_NOT, call(BuiltIn.BOOL_LOGICAL_NOT, x));
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testNegatedComparison() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_NOT, call(BuiltIn.BOOL_LESS, x, y))),
        isExpr("bool.greater_equal(L.x, L.y)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_NOT,
                call(BuiltIn.BOOL_LESS_EQUAL, x, y))),
        isExpr("bool.greater(L.x, L.y)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_NOT, call(BuiltIn.BOOL_EQUAL, x, y))),
        isExpr("bool.not_equal(L.x, L.y)"));

    // There is no rule for "greater"
    final ExprNode e =
        call(BuiltIn.BOOL_LOGICAL_NOT, call(BuiltIn.BOOL_GREATER, x, y));
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testTrueIsMovedRight() {
    assertThat(optimizer.apply(call(BuiltIn.CORE_EQUAL, true_, b)),
        isExpr("core.equal(L.b, true)"));
    final ExprNode e = call(BuiltIn.CORE_EQUAL, true_, true_);
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testComparisonIsLowered() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_EQUAL, call(BuiltIn.BOOL_LESS, x, y), true_)),
        isExpr("core.less(L.x, L.y)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_EQUAL,
                call(BuiltIn.CORE_TO_OPTIONAL,
                    call(BuiltIn.BOOL_NOT_EQUAL, x, y)),
                expr.optional(true))),
        isExpr("core.not_equal(L.x, L.y)"));
  }

  @Test void testLogicalAndIsLowered() {
    final ExprNode e =
        call(BuiltIn.CORE_EQUAL,
            call(BuiltIn.BOOL_LOGICAL_AND, call(BuiltIn.BOOL_LESS, x, y), b),
            true_);
    assertThat(optimizer.apply(e),
        isExpr("core.presence_and(core.less(L.x, L.y), "
            + "core.equal(L.b, true))"));

    final ExprNode e2 =
        call(BuiltIn.CORE_EQUAL,
            call(BuiltIn.BOOL_LOGICAL_OR, b, call(BuiltIn.BOOL_EQUAL, x, y)),
            true_);
    assertThat(optimizer.apply(e2),
        isExpr("core.presence_or(core.equal(L.b, true), "
            + "core.equal(L.x, L.y))"));

    // Neither operand would be lowered further, so it is left alone
    final ExprNode e3 =
        call(BuiltIn.CORE_EQUAL, call(BuiltIn.BOOL_LOGICAL_AND, b, c),
            true_);
    assertThat(optimizer.apply(e3), is(e3));
  }

  @Test void testLogicalIfSameBranches() {
    assertThat(
        optimizer.apply(call(BuiltIn.BOOL_LOGICAL_IF, ob, x, y, y)),
        isExpr("core.where(core.equal(L.ob, true), L.x, L.y)"));
  }

  @Test void testLogicalIfNeverMissing() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF, call(BuiltIn.CORE_TO_OPTIONAL, b),
                x, y, z)),
        isExpr("core.where(core.equal(L.b, true), L.x, L.y)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF,
                call(BuiltIn.CORE_PRESENCE_OR, ob, expr.literal(false)),
                x, y, z)),
        isExpr("core.where(core.equal(L.ob, true), L.x, L.y)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF,
                call(BuiltIn.CORE_PRESENCE_OR, ob, true_), x, y, z)),
        isExpr("core.where(core.equal(L.ob, false), L.y, L.x)"));

    // The dropped branch is optional, so the type would change
    final ExprNode e =
        call(BuiltIn.BOOL_LOGICAL_IF, call(BuiltIn.CORE_TO_OPTIONAL, b),
            x, y, expr.leaf("oz"));
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testLogicalIfToPresenceOr() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF, ob, true_, expr.literal(false), c)),
        isExpr("core.presence_or(L.ob, L.c)"));
  }

  @Test void testLogicalIfToPresenceOrOptionalLiterals() {
    final ExprNode optionalTrue = expr.literal(OptionalValue.of(true));
    final ExprNode optionalFalse = expr.literal(OptionalValue.of(false));
    final ExprNode oc = expr.leaf("oc");
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF, ob, optionalTrue,
                expr.literal(false), oc)),
        isExpr("core.presence_or(L.ob, L.oc)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.BOOL_LOGICAL_IF, ob, true_, optionalFalse, oc)),
        isExpr("core.presence_or(L.ob, L.oc)"));

    // The result is optional, but "cond | c" would not be
    final ExprNode e =
        call(BuiltIn.BOOL_LOGICAL_IF, ob, optionalTrue, optionalFalse, c);
    assertThat(optimizer.apply(e), is(e));
  }
}

// End BoolOptimizationsTest.java
