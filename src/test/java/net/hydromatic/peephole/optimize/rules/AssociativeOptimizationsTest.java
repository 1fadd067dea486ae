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
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link AssociativeOptimizations}. */
public class AssociativeOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>of("a", ScalarType.INT64,
              "b", ScalarType.INT64,
              "c", ScalarType.INT64,
              "d", ScalarType.INT64));
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, AssociativeOptimizations::create),
          env.typeInference);

  private final ExprNode a = expr.leaf("a");
  private final ExprNode b = expr.leaf("b");
  private final ExprNode c = expr.leaf("c");
  private final ExprNode d = expr.leaf("d");

  private static ExprNode add(ExprNode e0, ExprNode e1) {
    return expr.call(BuiltIn.MATH_ADD, e0, e1);
  }

  @Test void testBalanced() {
    assertThat(optimizer.apply(add(add(a, b), add(c, d))),
        isExpr("math._add4(L.a, L.b, L.c, L.d)"));
  }

  @Test void testLeftLinear() {
    assertThat(optimizer.apply(add(add(add(a, b), c), d)),
        isExpr("math._add4(L.a, L.b, L.c, L.d)"));
  }

  @Test void testRightLinear() {
    assertThat(optimizer.apply(add(a, add(b, add(c, d)))),
        isExpr("math._add4(L.a, L.b, L.c, L.d)"));
  }

  /** A sum of three terms is not folded. */
  @Test void testThreeTerms() {
    final ExprNode e = add(add(a, b), c);
    assertThat(optimizer.apply(e), is(e));
  }

  /** Terms may be repeated, and may themselves be sums. */
  @Test void testNestedSums() {
    final ExprNode e = add(add(add(add(a, b), add(c, d)), a), b);
    assertThat(optimizer.apply(e),
        isExpr("math.add(math.add(math._add4(L.a, L.b, L.c, L.d), L.a), "
            + "L.b)"));
  }
}

// End AssociativeOptimizationsTest.java
