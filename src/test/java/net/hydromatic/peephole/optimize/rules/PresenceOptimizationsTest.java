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
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link PresenceOptimizations}. */
public class PresenceOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>builder()
              .put("x", ScalarType.INT32)
              .put("y", ScalarType.INT32)
              .put("ox", OptionalType.of(ScalarType.INT32))
              .put("oy", OptionalType.of(ScalarType.INT32))
              .put("ax", ArrayType.of(ScalarType.INT32))
              .put("u", OptionalType.of(ScalarType.UNIT))
              .put("u2", OptionalType.of(ScalarType.UNIT))
              .put("su", ScalarType.UNIT)
              .build());
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, PresenceOptimizations::create),
          env.typeInference);
  private final Optimizer codegenOptimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, PresenceOptimizations::create,
              PresenceOptimizations::createForCodegen),
          env.typeInference);

  private final ExprNode x = expr.leaf("x");
  private final ExprNode y = expr.leaf("y");
  private final ExprNode ox = expr.leaf("ox");
  private final ExprNode oy = expr.leaf("oy");
  private final ExprNode u = expr.leaf("u");

  private ExprNode call(BuiltIn builtIn, ExprNode... args) {
    return expr.call(builtIn, args);
  }

  @Test void testHasRemoval() {
    assertThat(optimizer.apply(call(BuiltIn.CORE_HAS, expr.optional(1))),
        isExpr("present"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_HAS, call(BuiltIn.CORE_TO_OPTIONAL, x))),
        isExpr("present"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_PRESENCE_NOT, call(BuiltIn.CORE_HAS, ox))),
        isExpr("core.presence_not(L.ox)"));

    final ExprNode e = call(BuiltIn.CORE_HAS, ox);
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testPresenceAndRemoval() {
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_PRESENCE_AND, ox, expr.leaf("su"))),
        isExpr("L.ox"));
    assertThat(
        optimizer.apply(call(BuiltIn.CORE_PRESENCE_AND, x, expr.present())),
        isExpr("core.to_optional(L.x)"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_PRESENCE_AND, expr.present(), u)),
        isExpr("L.u"));
    assertThat(
        optimizer.apply(
            call(BuiltIn.CORE_PRESENCE_NOT,
                call(BuiltIn.CORE_PRESENCE_AND, x, u))),
        isExpr("core.presence_not(L.u)"));
  }

  @Test void testPresenceOrRemoval() {
    assertThat(optimizer.apply(call(BuiltIn.CORE_PRESENCE_OR, x, ox)),
        isExpr("L.x"));
    // The result would not be an array
    final ExprNode e =
        call(BuiltIn.CORE_PRESENCE_OR, x, expr.leaf("ax"));
    assertThat(optimizer.apply(e), is(e));
  }

  @Test void testWhere() {
    // (a & c) | (b & ~c) -> to_optional(where(c, a, b))
    final ExprNode e =
        call(BuiltIn.CORE_PRESENCE_OR,
            call(BuiltIn.CORE_PRESENCE_AND, ox, u),
            call(BuiltIn.CORE_PRESENCE_AND, oy,
                call(BuiltIn.CORE_PRESENCE_NOT, u)));
    assertThat(optimizer.apply(e),
        isExpr("core.to_optional(core.where(L.u, L.ox, L.oy))"));

    // (a & c) | b -> _presence_and_or(a, c, b)
    final ExprNode e2 =
        call(BuiltIn.CORE_PRESENCE_OR,
            call(BuiltIn.CORE_PRESENCE_AND, ox, u), oy);
    assertThat(optimizer.apply(e2),
        isExpr("core._presence_and_or(L.ox, L.u, L.oy)"));

    // where(c, a, b) -> a, if c is always present
    assertThat(
        optimizer.apply(call(BuiltIn.CORE_WHERE, expr.present(), x, y)),
        isExpr("L.x"));
  }

  @Test void testCommonCondition() {
    // (c & a) | (c & b) -> c & (a | b)
    final ExprNode e =
        call(BuiltIn.CORE_PRESENCE_OR,
            call(BuiltIn.CORE_PRESENCE_AND, ox, u),
            call(BuiltIn.CORE_PRESENCE_AND, ox, expr.leaf("u2")));
    assertThat(optimizer.apply(e),
        isExpr("core.presence_and(L.ox, core.presence_or(L.u, L.u2))"));
  }

  @Test void testInsideWhere() {
    final ExprNode e =
        call(BuiltIn.CORE_HAS,
            call(BuiltIn.CORE_WHERE, u, ox, expr.optional(1)));
    assertThat(optimizer.apply(e),
        isExpr("core.where(L.u, core.has(L.ox), present)"));
  }

  @Test void testCodegen() {
    final ExprNode e =
        call(BuiltIn.CORE_WHERE, u, ox,
            expr.literal(OptionalValue.missing(ScalarType.INT32)));
    assertThat(optimizer.apply(e), is(e));
    assertThat(codegenOptimizer.apply(e),
        isExpr("core.presence_and(L.ox, L.u)"));
  }
}

// End PresenceOptimizationsTest.java
