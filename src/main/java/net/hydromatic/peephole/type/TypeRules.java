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
package net.hydromatic.peephole.type;

import static net.hydromatic.peephole.type.QTypes.commonValueType;
import static net.hydromatic.peephole.type.QTypes.isArray;
import static net.hydromatic.peephole.type.QTypes.isScalar;
import static net.hydromatic.peephole.type.QTypes.isValueType;
import static net.hydromatic.peephole.type.QTypes.maxShape;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.peephole.type.QType.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Standard {@link TypeRule} instances.
 *
 * <p>Pointwise operators lift over shapes: if any argument is an array, the
 * result is an array; otherwise if any argument is optional, the result is
 * optional.
 */
public abstract class TypeRules {
  private TypeRules() {}

  /** Rule for an operator whose result type is never known. */
  public static final TypeRule UNKNOWN = (op, types) -> null;

  /** Rule for numeric operators such as {@code math.add}; all arguments
   * must have the same numeric value type. */
  public static final TypeRule ARITHMETIC = (op, types) ->
      pointwise(types, ScalarType::isNumeric, null, Shape.SCALAR);

  /** Rule for unary numeric operators such as {@code math.neg}. */
  public static final TypeRule UNARY_NUMERIC = (op, types) ->
      types.size() == 1
          ? pointwise(types, ScalarType::isNumeric, null, Shape.SCALAR)
          : null;

  /** Rule for {@code bool.logical_not}. */
  public static final TypeRule LOGICAL_NOT = (op, types) ->
      types.size() == 1
          ? pointwise(types, t -> t == ScalarType.BOOLEAN, null, Shape.SCALAR)
          : null;

  /** Rule for three-valued comparisons such as {@code bool.less}; the
   * result is boolean. */
  public static final TypeRule BOOL_COMPARISON = (op, types) ->
      types.size() == 2
          ? pointwise(types, t -> true, ScalarType.BOOLEAN, Shape.SCALAR)
          : null;

  /** Rule for {@code bool.logical_and} and {@code bool.logical_or}. */
  public static final TypeRule BOOL_LOGICAL = (op, types) ->
      types.size() == 2
          ? pointwise(types, t -> t == ScalarType.BOOLEAN, null, Shape.SCALAR)
          : null;

  /** Rule for two-valued comparisons such as {@code core.less}; the result
   * is a presence, at least {@code OPTIONAL_UNIT}. */
  public static final TypeRule CORE_COMPARISON = (op, types) ->
      types.size() == 2
          ? pointwise(types, t -> true, ScalarType.UNIT, Shape.OPTIONAL)
          : null;

  /** Rule for {@code core.has} and {@code core.presence_not}. */
  public static final TypeRule PRESENCE = (op, types) ->
      types.size() == 1
          ? pointwise(types, t -> true, ScalarType.UNIT, Shape.OPTIONAL)
          : null;

  /** Rule for {@code core.to_optional}. */
  public static final TypeRule TO_OPTIONAL = (op, types) ->
      types.size() == 1
          ? pointwise(types, t -> true, null, Shape.OPTIONAL)
          : null;

  /** Rule for {@code core.presence_and(a, c)}: the value of {@code a}, masked
   * by the presence {@code c}. */
  public static final TypeRule PRESENCE_AND = (op, types) ->
      types.size() == 2 ? presenceAnd(types.get(0), types.get(1)) : null;

  /** Rule for {@code core.presence_or(a, b)}: {@code a} if present, else
   * {@code b}. */
  public static final TypeRule PRESENCE_OR = (op, types) ->
      types.size() == 2 ? presenceOr(types.get(0), types.get(1)) : null;

  /** Rule for {@code core._presence_and_or(a, c, b)}, which is equivalent to
   * {@code (a & c) | b}. */
  public static final TypeRule PRESENCE_AND_OR = (op, types) ->
      types.size() == 3
          ? presenceOr(presenceAnd(types.get(0), types.get(1)), types.get(2))
          : null;

  /** Rule for {@code core.where(c, a, b)} and
   * {@code core._short_circuit_where(c, a, b)}. */
  public static final TypeRule WHERE = (op, types) -> {
    if (types.size() != 3) {
      return null;
    }
    final QType c = types.get(0);
    if (!isValueType(c) || c.valueType() != ScalarType.UNIT) {
      return null;
    }
    final List<@Nullable QType> branches = types.subList(1, 3);
    return select(c, branches);
  };

  /** Rule for {@code bool.logical_if(cond, ifTrue, ifFalse, ifMissing)}. */
  public static final TypeRule LOGICAL_IF = (op, types) -> {
    if (types.size() != 4) {
      return null;
    }
    final QType cond = types.get(0);
    if (!isValueType(cond) || cond.valueType() != ScalarType.BOOLEAN) {
      return null;
    }
    return select(cond, types.subList(1, 4));
  };

  /** Rule for {@code core.const_with_shape(shape, value)}, which broadcasts
   * a scalar or optional value to an array. */
  public static final TypeRule CONST_WITH_SHAPE = (op, types) -> {
    if (types.size() != 2 || types.get(0) != ShapeType.DENSE_ARRAY_SHAPE) {
      return null;
    }
    final QType value = types.get(1);
    if (!isValueType(value) || isArray(value)) {
      return null;
    }
    return ArrayType.of(value.valueType());
  };

  /** Rule for {@code core.shape_of(array)}. */
  public static final TypeRule SHAPE_OF = (op, types) ->
      types.size() == 1 && isArray(types.get(0))
          ? ShapeType.DENSE_ARRAY_SHAPE
          : null;

  /** Rule for {@code core.make_tuple}. */
  public static final TypeRule MAKE_TUPLE = (op, types) -> {
    final ImmutableList.Builder<QType> fieldTypes = ImmutableList.builder();
    for (QType type : types) {
      if (type == null) {
        return null;
      }
      fieldTypes.add(type);
    }
    return TupleType.of(fieldTypes.build());
  };

  /** Rule for {@code core.get_nth[i]}; the index is the operator's first
   * parameter. */
  public static final TypeRule GET_NTH = (op, types) -> {
    if (types.size() != 1
        || !(types.get(0) instanceof TupleType)
        || op.params.isEmpty()
        || !(op.params.get(0) instanceof Integer)) {
      return null;
    }
    final TupleType tupleType = (TupleType) types.get(0);
    final int i = (Integer) op.params.get(0);
    return i >= 0 && i < tupleType.fieldTypes.size()
        ? tupleType.fieldTypes.get(i)
        : null;
  };

  /** Rule for an operator whose result has the same type as its first
   * argument. */
  public static final TypeRule SAME_AS_FIRST = (op, types) ->
      types.isEmpty() ? null : types.get(0);

  private static @Nullable QType pointwise(List<@Nullable QType> types,
      Predicate<ScalarType> predicate, @Nullable ScalarType resultType,
      Shape minShape) {
    if (types.isEmpty()) {
      return null;
    }
    final ScalarType common = commonValueType(types);
    if (common == null || !predicate.test(common)) {
      return null;
    }
    return QTypes.of(resultType != null ? resultType : common,
        maxShape(types).max(minShape));
  }

  private static @Nullable QType presenceAnd(@Nullable QType a,
      @Nullable QType c) {
    if (!isValueType(a)
        || !isValueType(c)
        || c.valueType() != ScalarType.UNIT) {
      return null;
    }
    return QTypes.of(a.valueType(), a.shape().max(c.shape()));
  }

  private static @Nullable QType presenceOr(@Nullable QType a,
      @Nullable QType b) {
    final ScalarType common = commonValueType(Arrays.asList(a, b));
    if (common == null) {
      return null;
    }
    final Shape shape;
    if (isArray(a) || isArray(b)) {
      shape = Shape.ARRAY;
    } else if (isScalar(a) || isScalar(b)) {
      shape = Shape.SCALAR;
    } else {
      shape = Shape.OPTIONAL;
    }
    return QTypes.of(common, shape);
  }

  /** Type of a selection between branches, controlled by a condition. The
   * result is an array if the condition or any branch is an array. */
  private static @Nullable QType select(QType condition,
      List<@Nullable QType> branches) {
    final ScalarType common = commonValueType(branches);
    if (common == null) {
      return null;
    }
    final Shape shape;
    if (isArray(condition) || branches.stream().anyMatch(QTypes::isArray)) {
      shape = Shape.ARRAY;
    } else if (branches.stream().anyMatch(QTypes::isOptional)) {
      shape = Shape.OPTIONAL;
    } else {
      shape = Shape.SCALAR;
    }
    return QTypes.of(common, shape);
  }
}

// End TypeRules.java
