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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.peephole.type.TypeRule;
import net.hydromatic.peephole.type.TypeRules;

/** Built-in operators. */
public enum BuiltIn {
  /** Operator "bool.equal", three-valued equality. */
  BOOL_EQUAL("bool", "equal", TypeRules.BOOL_COMPARISON),

  /** Operator "bool.greater". */
  BOOL_GREATER("bool", "greater", TypeRules.BOOL_COMPARISON),

  /** Operator "bool.greater_equal". */
  BOOL_GREATER_EQUAL("bool", "greater_equal", TypeRules.BOOL_COMPARISON),

  /** Operator "bool.less". */
  BOOL_LESS("bool", "less", TypeRules.BOOL_COMPARISON),

  /** Operator "bool.less_equal". */
  BOOL_LESS_EQUAL("bool", "less_equal", TypeRules.BOOL_COMPARISON),

  /**
   * Operator "bool.logical_and".
   *
   * <p>Three-valued: {@code false} and missing is {@code false}.
   */
  BOOL_LOGICAL_AND("bool", "logical_and", TypeRules.BOOL_LOGICAL),

  /**
   * Operator "bool.logical_if", of type "(cond, ifTrue, ifFalse, ifMissing)",
   * chooses a value based on a three-valued condition.
   */
  BOOL_LOGICAL_IF("bool", "logical_if", TypeRules.LOGICAL_IF),

  /** Operator "bool.logical_not". */
  BOOL_LOGICAL_NOT("bool", "logical_not", TypeRules.LOGICAL_NOT),

  /** Operator "bool.logical_or". */
  BOOL_LOGICAL_OR("bool", "logical_or", TypeRules.BOOL_LOGICAL),

  /** Operator "bool.not_equal". */
  BOOL_NOT_EQUAL("bool", "not_equal", TypeRules.BOOL_COMPARISON),

  /**
   * Operator "core._presence_and_or", of type "(a, c, b)", equivalent to
   * {@code (a & c) | b}.
   */
  CORE_PRESENCE_AND_OR("core", "_presence_and_or",
      TypeRules.PRESENCE_AND_OR),

  /**
   * Operator "core._short_circuit_where", like {@link #CORE_WHERE} but only
   * evaluates the branch that is chosen.
   */
  CORE_SHORT_CIRCUIT_WHERE("core", "_short_circuit_where", TypeRules.WHERE),

  /**
   * Operator "core.const_with_shape", of type "(shape, value)", creates an
   * array of the given shape, every element of which is {@code value}.
   */
  CORE_CONST_WITH_SHAPE("core", "const_with_shape",
      TypeRules.CONST_WITH_SHAPE),

  /** Operator "core.equal", two-valued equality; present if equal. */
  CORE_EQUAL("core", "equal", TypeRules.CORE_COMPARISON),

  /**
   * Operator "core.get_nth", of type "[i](tuple)", returns the {@code i}th
   * field of a tuple. The index is a parameter of the operator.
   */
  CORE_GET_NTH("core", "get_nth", TypeRules.GET_NTH),

  /** Operator "core.greater". */
  CORE_GREATER("core", "greater", TypeRules.CORE_COMPARISON),

  /** Operator "core.greater_equal". */
  CORE_GREATER_EQUAL("core", "greater_equal", TypeRules.CORE_COMPARISON),

  /** Operator "core.has", present if its argument is present. */
  CORE_HAS("core", "has", TypeRules.PRESENCE),

  /** Operator "core.less". */
  CORE_LESS("core", "less", TypeRules.CORE_COMPARISON),

  /** Operator "core.less_equal". */
  CORE_LESS_EQUAL("core", "less_equal", TypeRules.CORE_COMPARISON),

  /** Operator "core.make_tuple". */
  CORE_MAKE_TUPLE("core", "make_tuple", TypeRules.MAKE_TUPLE),

  /** Operator "core.not_equal". */
  CORE_NOT_EQUAL("core", "not_equal", TypeRules.CORE_COMPARISON),

  /**
   * Operator "core.presence_and", of type "(a, c)", returns {@code a} if
   * {@code c} is present, otherwise missing.
   */
  CORE_PRESENCE_AND("core", "presence_and", TypeRules.PRESENCE_AND),

  /** Operator "core.presence_not", present if its argument is missing. */
  CORE_PRESENCE_NOT("core", "presence_not", TypeRules.PRESENCE),

  /**
   * Operator "core.presence_or", of type "(a, b)", returns {@code a} if
   * present, otherwise {@code b}.
   */
  CORE_PRESENCE_OR("core", "presence_or", TypeRules.PRESENCE_OR),

  /** Operator "core.shape_of", the shape of an array. */
  CORE_SHAPE_OF("core", "shape_of", TypeRules.SHAPE_OF),

  /** Operator "core.to_optional", converts a scalar to an optional. */
  CORE_TO_OPTIONAL("core", "to_optional", TypeRules.TO_OPTIONAL),

  /**
   * Operator "core.where", of type "(c, a, b)", returns {@code a} if
   * {@code c} is present, otherwise {@code b}.
   */
  CORE_WHERE("core", "where", TypeRules.WHERE),

  /** Operator "math._add4", the sum of four values. */
  MATH_ADD4("math", "_add4", TypeRules.ARITHMETIC),

  /** Operator "math.abs". */
  MATH_ABS("math", "abs", TypeRules.UNARY_NUMERIC),

  /** Operator "math.add". */
  MATH_ADD("math", "add", TypeRules.ARITHMETIC),

  /** Operator "math.divide". */
  MATH_DIVIDE("math", "divide", TypeRules.ARITHMETIC),

  /** Operator "math.max". */
  MATH_MAX("math", "max", TypeRules.ARITHMETIC),

  /** Operator "math.min". */
  MATH_MIN("math", "min", TypeRules.ARITHMETIC),

  /** Operator "math.mod". */
  MATH_MOD("math", "mod", TypeRules.ARITHMETIC),

  /** Operator "math.multiply". */
  MATH_MULTIPLY("math", "multiply", TypeRules.ARITHMETIC),

  /** Operator "math.neg". */
  MATH_NEG("math", "neg", TypeRules.UNARY_NUMERIC),

  /** Operator "math.subtract". */
  MATH_SUBTRACT("math", "subtract", TypeRules.ARITHMETIC);

  /** Namespace, for example "math". */
  public final String structure;

  /** Name within the namespace, for example "add". */
  public final String shortName;

  /** Qualified name, for example "math.add". */
  public final String opName;

  /** The operator, with no parameters. */
  public final Operator operator;

  public static final ImmutableMap<String, BuiltIn> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> byOpName =
        ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      byOpName.put(builtIn.opName, builtIn);
    }
    BY_OP_NAME = byOpName.build();
  }

  BuiltIn(String structure, String shortName, TypeRule typeRule) {
    this.structure = structure;
    this.shortName = shortName;
    this.opName = structure + "." + shortName;
    this.operator = Operator.of(opName, typeRule);
  }
}

// End BuiltIn.java
