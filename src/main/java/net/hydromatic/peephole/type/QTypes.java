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

import java.util.List;
import net.hydromatic.peephole.type.QType.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link QType}. */
public abstract class QTypes {
  private QTypes() {}

  /** Returns the type that holds values of a given scalar type in a given
   * shape. */
  public static QType of(ScalarType scalarType, Shape shape) {
    switch (shape) {
    case SCALAR:
      return scalarType;
    case OPTIONAL:
      return OptionalType.of(scalarType);
    case ARRAY:
      return ArrayType.of(scalarType);
    default:
      throw new IllegalArgumentException("not a value shape: " + shape);
    }
  }

  /** Returns the type of a literal value, or throws if the value is of an
   * unknown class. */
  public static QType ofValue(Object value) {
    if (value instanceof OptionalValue) {
      return ((OptionalValue) value).type();
    }
    final ScalarType scalarType = ScalarType.of(value);
    if (scalarType == null) {
      throw new IllegalArgumentException("no type for value " + value
          + " of class " + value.getClass().getName());
    }
    return scalarType;
  }

  /** Returns whether a type is a scalar, optional or array type. */
  public static boolean isValueType(@Nullable QType type) {
    return type != null && type.valueType() != null;
  }

  /** Returns whether a type is a scalar type. */
  public static boolean isScalar(@Nullable QType type) {
    return isValueType(type) && type.shape() == Shape.SCALAR;
  }

  /** Returns whether a type is an optional type. */
  public static boolean isOptional(@Nullable QType type) {
    return isValueType(type) && type.shape() == Shape.OPTIONAL;
  }

  /** Returns whether a type is an array type. */
  public static boolean isArray(@Nullable QType type) {
    return isValueType(type) && type.shape() == Shape.ARRAY;
  }

  /** Returns whether values of a type may be missing; that is, whether it
   * is an optional or array type. */
  public static boolean isOptionalLike(@Nullable QType type) {
    return isOptional(type) || isArray(type);
  }

  /** Returns whether a type is a scalar or optional type. */
  public static boolean isBaseType(@Nullable QType type) {
    return isScalar(type) || isOptional(type);
  }

  /** Returns whether a type is {@code OPTIONAL_UNIT} or
   * {@code DENSE_ARRAY_UNIT}, the types that represent presence. */
  public static boolean isPresenceType(@Nullable QType type) {
    return isOptionalLike(type) && type.valueType() == ScalarType.UNIT;
  }

  /**
   * Returns the value type shared by all of a list of types, or null if any
   * of them is unknown, is not a value type, or has a different value type.
   */
  public static @Nullable ScalarType commonValueType(
      List<? extends @Nullable QType> types) {
    ScalarType common = null;
    for (QType type : types) {
      if (type == null || type.valueType() == null) {
        return null;
      }
      if (common == null) {
        common = type.valueType();
      } else if (common != type.valueType()) {
        return null;
      }
    }
    return common;
  }

  /** Returns the widest shape of a list of value types. */
  public static Shape maxShape(List<? extends @Nullable QType> types) {
    Shape shape = Shape.SCALAR;
    for (QType type : types) {
      if (type != null && type.shape() != Shape.OTHER) {
        shape = shape.max(type.shape());
      }
    }
    return shape;
  }
}

// End QTypes.java
