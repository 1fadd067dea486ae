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
import net.hydromatic.peephole.type.ArrayType;
import net.hydromatic.peephole.type.OptionalType;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ArithmeticOptimizations}. */
public class ArithmeticOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>builder()
              .put("i", ScalarType.INT32)
              .put("l", ScalarType.INT64)
              .put("f", ScalarType.FLOAT32)
              .put("d", ScalarType.FLOAT64)
              .put("oi", OptionalType.of(ScalarType.INT32))
              .put("ai", ArrayType.of(ScalarType.INT32))
              .build());
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, ArithmeticOptimizations::create),
          env.typeInference);

  private final ExprNode i = expr.leaf("i");

  private ExprNode call(BuiltIn builtIn, ExprNode... args) {
    return expr.call(builtIn, args);
  }

  @Test void testFloatZero() {
    assertThat(
        optimizer.apply(call(BuiltIn.MATH_ADD, expr.leaf("f"),
            expr.literal(0F))),
        isExpr("L.f"));
    assertThat(
        optimizer.apply(call(BuiltIn.MATH_ADD, expr.leaf("d"),
            expr.literal(0D))),
        isExpr("L.d"));
  }

  @Test void testIdentities() {
    final ExprNode zero = expr.literal(0);
    final ExprNode one = expr.literal(1);
    assertThat(optimizer.apply(call(BuiltIn.MATH_ADD, i, zero)),
        isExpr("L.i"));
    assertThat(optimizer.apply(call(BuiltIn.MATH_ADD, zero, i)),
        isExpr("L.i"));
    assertThat(optimizer.apply(call(BuiltIn.MATH_SUBTRACT, i, zero)),
        isExpr("L.i"));
    assertThat(optimizer.apply(call(BuiltIn.MATH_MULTIPLY, i, one)),
        isExpr("L.i"));
    assertThat(optimizer.apply(call(BuiltIn.MATH_MULTIPLY, one, i)),
        isExpr("L.i"));
    assertThat(optimizer.apply(call(BuiltIn.MATH_DIVIDE, i, one)),
        isExpr("L.i"));
    assertThat(
        optimizer.apply(call(BuiltIn.MATH_ADD, expr.leaf("l"),
            expr.literal(0L))),
        isExpr("L.l"));
  }

  /** Operations that look like identities but are not. */
  @Test void testNonIdentities() {
    final ExprNode zero = expr.literal(0);
    final ExprNode one = expr.literal(1);
    final ExprNode subtract = call(BuiltIn.MATH_SUBTRACT, zero, i);
    assertThat(optimizer.apply(subtract), is(subtract));
    final ExprNode divide = call(BuiltIn.MATH_DIVIDE, one, i);
    assertThat(optimizer.apply(divide), is(divide));
    final ExprNode multiply = call(BuiltIn.MATH_MULTIPLY, i, zero);
    assertThat(optimizer.apply(multiply), is(multiply));

    // The literal has a different type than the leaf
    final ExprNode add =
        call(BuiltIn.MATH_ADD, expr.leaf("f"), expr.literal(0D));
    assertThat(optimizer.apply(add), is(add));
  }

  /** An optional zero may only be removed if the other operand is optional
   * or an array; otherwise the result would not be optional. */
  @Test void testOptionalLiteral() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.MATH_ADD, expr.leaf("oi"), expr.optional(0))),
        isExpr("L.oi"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.MATH_MULTIPLY, expr.optional(1), expr.leaf("ai"))),
        isExpr("L.ai"));
    final ExprNode add = call(BuiltIn.MATH_ADD, i, expr.optional(0));
    assertThat(optimizer.apply(add), is(add));
  }

  @Test void testNested() {
    final ExprNode e =
        call(BuiltIn.MATH_MULTIPLY,
            call(BuiltIn.MATH_ADD, expr.literal(0),
                call(BuiltIn.MATH_NEG, i)),
            expr.literal(1));
    assertThat(optimizer.apply(e), isExpr("math.neg(L.i)"));
  }
}

// End ArithmeticOptimizationsTest.java
