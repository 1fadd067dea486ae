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
import net.hydromatic.peephole.type.ShapeType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstWithShapeOptimizations}. */
public class ConstWithShapeOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>builder()
              .put("shape", ShapeType.DENSE_ARRAY_SHAPE)
              .put("shape2", ShapeType.DENSE_ARRAY_SHAPE)
              .put("x", ScalarType.INT32)
              .put("ox", OptionalType.of(ScalarType.INT32))
              .put("ax", ArrayType.of(ScalarType.INT32))
              .build());
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, ConstWithShapeOptimizations::create),
          env.typeInference);

  private final ExprNode shape = expr.leaf("shape");
  private final ExprNode x = expr.leaf("x");
  private final ExprNode ox = expr.leaf("ox");

  private ExprNode call(BuiltIn builtIn, ExprNode... args) {
    return expr.call(builtIn, args);
  }

  private ExprNode broadcast(ExprNode value) {
    return call(BuiltIn.CORE_CONST_WITH_SHAPE, shape, value);
  }

  @Test void testShapeOf() {
    assertThat(optimizer.apply(call(BuiltIn.CORE_SHAPE_OF, broadcast(x))),
        isExpr("L.shape"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_SHAPE_OF,
                call(BuiltIn.CORE_HAS, broadcast(ox)))),
        isExpr("L.shape"));
  }

  @Test void testUnary() {
    assertThat(optimizer.apply(call(BuiltIn.MATH_NEG, broadcast(x))),
        isExpr("core.const_with_shape(L.shape, math.neg(L.x))"));
    assertThat(optimizer.apply(call(BuiltIn.CORE_HAS, broadcast(ox))),
        isExpr("core.const_with_shape(L.shape, core.has(L.ox))"));
  }

  @Test void testBinary() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.MATH_ADD, broadcast(x), broadcast(ox))),
        isExpr("core.const_with_shape(L.shape, math.add(L.x, L.ox))"));
    assertThat(
        optimizer.apply(call(BuiltIn.MATH_SUBTRACT, broadcast(x), ox)),
        isExpr("core.const_with_shape(L.shape, math.subtract(L.x, L.ox))"));
    assertThat(
        optimizer.apply(call(BuiltIn.CORE_LESS, x, broadcast(ox))),
        isExpr("core.const_with_shape(L.shape, core.less(L.x, L.ox))"));
  }

  /** Operators are moved inside repeatedly. */
  @Test void testNested() {
    final ExprNode e =
        call(BuiltIn.MATH_ABS,
            call(BuiltIn.MATH_MULTIPLY, broadcast(x), x));
    assertThat(optimizer.apply(e),
        isExpr("core.const_with_shape(L.shape, "
            + "math.abs(math.multiply(L.x, L.x)))"));
  }

  @Test void testNotApplicable() {
    // The other operand is a real array
    final ExprNode e =
        call(BuiltIn.MATH_ADD, broadcast(x), expr.leaf("ax"));
    assertThat(optimizer.apply(e), is(e));

    // Shapes differ
    final ExprNode e2 =
        call(BuiltIn.MATH_ADD, broadcast(x),
            call(BuiltIn.CORE_CONST_WITH_SHAPE, expr.leaf("shape2"), x));
    assertThat(optimizer.apply(e2), is(e2));

    // There is no rule for "greater"
    final ExprNode e3 = call(BuiltIn.CORE_GREATER, broadcast(x), x);
    assertThat(optimizer.apply(e3), is(e3));
  }
}

// End ConstWithShapeOptimizationsTest.java
