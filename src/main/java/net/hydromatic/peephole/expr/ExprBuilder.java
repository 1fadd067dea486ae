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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.QTypes;

/** Builds expression nodes. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  /** Creates a literal whose type is derived from its value. */
  public Expr.Literal literal(Object value) {
    return new Expr.Literal(value, QTypes.ofValue(value));
  }

  /** Creates a literal with a given type. */
  public Expr.Literal literal(Object value, QType type) {
    return new Expr.Literal(value, type);
  }

  /** Creates a literal of type {@code OPTIONAL_UNIT} that is present. */
  public Expr.Literal present() {
    return literal(OptionalValue.PRESENT);
  }

  /** Creates a literal of type {@code OPTIONAL_UNIT} that is missing. */
  public Expr.Literal missing() {
    return literal(OptionalValue.MISSING);
  }

  /** Creates a present optional literal, such as
   * {@code optional_int32{1}}. */
  public Expr.Literal optional(Object value) {
    return literal(OptionalValue.of(value));
  }

  /** Creates a leaf (free variable). */
  public Expr.Leaf leaf(String name) {
    return new Expr.Leaf(name);
  }

  /** Creates a placeholder (a hole in a rewrite template). */
  public Expr.Placeholder placeholder(String name) {
    return new Expr.Placeholder(name);
  }

  /** Creates a call to an operator. */
  public Expr.Call call(Operator op, List<? extends ExprNode> args) {
    return new Expr.Call(op, ImmutableList.copyOf(args));
  }

  /** Creates a call to an operator. */
  public Expr.Call call(Operator op, ExprNode... args) {
    return new Expr.Call(op, ImmutableList.copyOf(args));
  }

  /** Creates a call to a built-in operator. */
  public Expr.Call call(BuiltIn builtIn, ExprNode... args) {
    return call(builtIn.operator, args);
  }

  /** Creates a call to {@code core.make_tuple}. */
  public Expr.Call makeTuple(ExprNode... args) {
    return call(BuiltIn.CORE_MAKE_TUPLE, args);
  }

  /** Creates a call to {@code core.get_nth[i]}. */
  public Expr.Call getNth(int i, ExprNode tuple) {
    checkArgument(i >= 0, "negative index %s", i);
    return call(BuiltIn.CORE_GET_NTH.operator.withParams(ImmutableList.of(i)),
        tuple);
  }

  /** Returns a node like the given node but with different children. */
  public ExprNode withNewChildren(ExprNode node,
      List<? extends ExprNode> children) {
    return node.withNewChildren(children);
  }
}

// End ExprBuilder.java
