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
package net.hydromatic.peephole.expr;

import static net.hydromatic.peephole.Matchers.isExpr;
import static net.hydromatic.peephole.Matchers.throwsA;
import static net.hydromatic.peephole.expr.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.ScalarType;
import net.hydromatic.peephole.type.Unit;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExprNode} and {@link Exprs}. */
public class ExprTest {
  private final Expr.Leaf x = expr.leaf("x");
  private final Expr.Leaf y = expr.leaf("y");

  @Test void testFingerprintIsStructural() {
    final ExprNode e1 = expr.call(BuiltIn.MATH_ADD, x, expr.literal(1));
    final ExprNode e2 =
        expr.call(BuiltIn.MATH_ADD, expr.leaf("x"), expr.literal(1));
    assertThat(e1.fingerprint(), is(e2.fingerprint()));
    assertThat(e1, is(e2));
    assertThat(e1.hashCode(), is(e2.hashCode()));

    // Argument order matters
    final ExprNode e3 = expr.call(BuiltIn.MATH_ADD, expr.literal(1), x);
    assertThat(e3.fingerprint(), not(e1.fingerprint()));

    // Different operator, same arguments
    final ExprNode e4 = expr.call(BuiltIn.MATH_SUBTRACT, x, expr.literal(1));
    assertThat(e4.fingerprint(), not(e1.fingerprint()));
  }

  @Test void testLiteralFingerprintIncludesType() {
    assertThat(expr.literal(0).fingerprint(),
        not(expr.literal(0L).fingerprint()));
    assertThat(expr.literal(0F).fingerprint(),
        not(expr.literal(0D).fingerprint()));
    assertThat(expr.literal(1).fingerprint(),
        not(expr.optional(1).fingerprint()));
    assertThat(expr.present().fingerprint(),
        not(expr.missing().fingerprint()));
    assertThat(expr.literal(1).fingerprint(),
        is(expr.literal(1).fingerprint()));
  }

  @Test void testLeafAndPlaceholderDiffer() {
    assertThat(expr.leaf("a").fingerprint(),
        not(expr.placeholder("a").fingerprint()));
  }

  @Test void testToString() {
    assertThat(expr.call(BuiltIn.MATH_ADD, x, expr.literal(0F)),
        isExpr("math.add(L.x, float32{0.0})"));
    assertThat(expr.call(BuiltIn.MATH_MULTIPLY, expr.literal(1), x),
        isExpr("math.multiply(1, L.x)"));
    assertThat(expr.literal(2L), isExpr("int64{2}"));
    assertThat(expr.literal(true), isExpr("true"));
    assertThat(expr.literal("abc"), isExpr("'abc'"));
    assertThat(expr.literal(Unit.INSTANCE), isExpr("unit"));
    assertThat(expr.present(), isExpr("present"));
    assertThat(expr.missing(), isExpr("missing"));
    assertThat(expr.optional(3), isExpr("optional_int32{3}"));
    assertThat(expr.literal(OptionalValue.missing(ScalarType.INT64)),
        isExpr("optional_int64{NA}"));
    assertThat(expr.placeholder("a"), isExpr("P.a"));
    assertThat(expr.getNth(2, expr.makeTuple(x, y)),
        isExpr("core.get_nth[2](core.make_tuple(L.x, L.y))"));
  }

  @Test void testWithNewChildren() {
    final Expr.Call call = expr.call(BuiltIn.MATH_ADD, x, y);
    assertThat(call.withNewChildren(ImmutableList.of(x, y)),
        sameInstance(call));
    assertThat(
        call.withNewChildren(ImmutableList.of(expr.leaf("x"), y)),
        sameInstance(call));

    final ExprNode call2 =
        expr.withNewChildren(call, ImmutableList.of(y, x));
    assertThat(call2, isExpr("math.add(L.y, L.x)"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            call.withNewChildren(ImmutableList.of(x)));
    assertThat(e, throwsA("expected 2 children, got 1"));

    assertThat(x.withNewChildren(ImmutableList.of()), sameInstance(x));
    assertThrows(IllegalArgumentException.class, () ->
        x.withNewChildren(ImmutableList.of(y)));
  }

  @Test void testKeys() {
    final ExprNode e =
        expr.call(BuiltIn.MATH_ADD, y,
            expr.call(BuiltIn.MATH_MULTIPLY, x, expr.placeholder("b")),
            expr.placeholder("a"));
    assertThat(Exprs.leafKeys(e), hasToString("[x, y]"));
    assertThat(Exprs.placeholderKeys(e), hasToString("[a, b]"));
  }

  /** Shared sub-expressions are counted and visited once. */
  @Test void testPostOrder() {
    final ExprNode product = expr.call(BuiltIn.MATH_MULTIPLY, x, y);
    final ExprNode e = expr.call(BuiltIn.MATH_ADD, product, product);
    final List<ExprNode> nodes = Exprs.postOrder(e);
    assertThat(nodes, hasSize(4));
    assertThat(nodes.get(0), isExpr("L.x"));
    assertThat(nodes.get(1), isExpr("L.y"));
    assertThat(nodes.get(2), is(product));
    assertThat(nodes.get(3), is(e));
    assertThat(Exprs.nodeCount(e), is(4));
  }

  @Test void testSubstitutePlaceholders() {
    final ExprNode template =
        expr.call(BuiltIn.MATH_ADD, expr.placeholder("a"),
            expr.placeholder("a"));
    assertThat(
        Exprs.substitutePlaceholders(template, ImmutableMap.of("a", x)),
        isExpr("math.add(L.x, L.x)"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            Exprs.substitutePlaceholders(template, ImmutableMap.of("b", x)));
    assertThat(e, throwsA("no substitution for placeholder a"));
  }

  @Test void testDebugSnippet() {
    final ExprNode e = expr.call(BuiltIn.MATH_ADD, x, y);
    assertThat(Exprs.debugSnippet(e, 100), is("math.add(L.x, L.y)"));
    assertThat(Exprs.debugSnippet(e, 10), is("math.ad..."));
  }

  @Test void testOperatorRegistry() {
    final OperatorRegistry registry = OperatorRegistry.standard();
    assertThat(registry.lookup("math.add"), is(BuiltIn.MATH_ADD.operator));
    assertThat(registry.getOptional("math.pow") == null, is(true));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            registry.lookup("math.pow"));
    assertThat(e, throwsA("unknown operator: math.pow"));

    final Operator pow = Operator.of("math.pow");
    assertThat(registry.plus(pow).lookup("math.pow"), is(pow));
  }

  @Test void testOperatorParams() {
    final Operator getNth0 =
        BuiltIn.CORE_GET_NTH.operator.withParams(ImmutableList.of(0));
    final Operator getNth1 =
        BuiltIn.CORE_GET_NTH.operator.withParams(ImmutableList.of(1));
    assertThat(getNth0, hasToString("core.get_nth[0]"));
    assertThat(getNth0, not(getNth1));
    assertThat(getNth0,
        is(BuiltIn.CORE_GET_NTH.operator.withParams(ImmutableList.of(0))));
  }

  /** Parameters that render the same but have different types give
   * different operators, and different nodes. */
  @Test void testOperatorParamTypes() {
    final Operator op = BuiltIn.CORE_GET_NTH.operator;
    final Operator intOp = op.withParams(ImmutableList.of(2));
    final Operator longOp = op.withParams(ImmutableList.of(2L));
    final Operator stringOp = op.withParams(ImmutableList.of("2"));
    assertThat(intOp, hasToString("core.get_nth[2]"));
    assertThat(longOp, hasToString("core.get_nth[2]"));
    assertThat(stringOp, hasToString("core.get_nth[2]"));
    assertThat(intOp, not(longOp));
    assertThat(intOp, not(stringOp));
    assertThat(longOp, not(stringOp));
    assertThat(expr.call(intOp, x), not(expr.call(longOp, x)));
    assertThat(expr.call(intOp, x).fingerprint(),
        not(expr.call(stringOp, x).fingerprint()));
  }
}

// End ExprTest.java
