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
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.peephole.expr.BuiltIn;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Operator;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.Optimizer;
import net.hydromatic.peephole.optimize.Optimizers;
import net.hydromatic.peephole.optimize.PeepholeOptimizer;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link TupleOptimizations}. */
public class TupleOptimizationsTest {
  private final OptimizationEnv env =
      OptimizationEnv.standard(
          ImmutableMap.<String, QType>of("a", ScalarType.INT32,
              "b", ScalarType.TEXT,
              "c", ScalarType.FLOAT64,
              "d", ScalarType.BOOLEAN));
  private final Optimizer optimizer =
      Optimizers.fixedPoint(
          PeepholeOptimizer.create(env, TupleOptimizations::create),
          env.typeInference);

  private final ExprNode tuple =
      expr.makeTuple(expr.leaf("a"), expr.leaf("b"), expr.leaf("c"),
          expr.leaf("d"));

  @Test void testGetNth() {
    assertThat(optimizer.apply(expr.getNth(2, tuple)), isExpr("L.c"));
    assertThat(optimizer.apply(expr.getNth(0, tuple)), isExpr("L.a"));
  }

  @Test void testNestedTuple() {
    final ExprNode e =
        expr.call(BuiltIn.MATH_NEG,
            expr.getNth(0,
                expr.getNth(1,
                    expr.makeTuple(expr.leaf("d"), tuple))));
    assertThat(optimizer.apply(e), isExpr("math.neg(L.a)"));
  }

  @Test void testNotApplicable() {
    final ExprNode outOfRange = expr.getNth(4, tuple);
    assertThat(optimizer.apply(outOfRange), is(outOfRange));
    final ExprNode notTuple = expr.getNth(0, expr.leaf("a"));
    assertThat(optimizer.apply(notTuple), is(notTuple));
  }

  /** Only an {@code Integer} index selects a field. An index of another
   * type is not confused with it, even after the other node's type has
   * been inferred. */
  @Test void testGetNthIndexType() {
    final Operator getNth = BuiltIn.CORE_GET_NTH.operator;
    final ExprNode longIndex =
        expr.call(getNth.withParams(ImmutableList.of(2L)), tuple);
    final ExprNode stringIndex =
        expr.call(getNth.withParams(ImmutableList.of("2")), tuple);
    final ExprNode intIndex =
        expr.call(getNth.withParams(ImmutableList.of(2)), tuple);
    assertThat(env.typeOf(longIndex), nullValue());
    assertThat(env.typeOf(stringIndex), nullValue());
    assertThat(env.typeOf(intIndex), is(ScalarType.FLOAT64));
    assertThat(optimizer.apply(longIndex), is(longIndex));
    assertThat(optimizer.apply(stringIndex), is(stringIndex));
    assertThat(optimizer.apply(intIndex), isExpr("L.c"));
  }
}

// End TupleOptimizationsTest.java
