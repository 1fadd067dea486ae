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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Static type of an expression.
 *
 * <p>Scalar, optional and array types each carry a {@link ScalarType} that
 * describes the values they hold; other types (array shapes, tuples) do not.
 */
public interface QType {
  /** Returns the name of this type, for example "OPTIONAL_INT32". */
  String moniker();

  /**
   * Returns the type of the values held by this type, or null if this is not
   * a scalar, optional or array type.
   */
  @Nullable ScalarType valueType();

  /** Returns the shape of this type. */
  Shape shape();

  /**
   * Shape of a type.
   *
   * <p>The first three values are ordered by how far a value is lifted: an
   * operation on a scalar and an array yields an array.
   */
  enum Shape {
    SCALAR,
    OPTIONAL,
    ARRAY,
    OTHER;

    /** Returns the wider of two value shapes. */
    public Shape max(Shape shape) {
      return compareTo(shape) >= 0 ? this : shape;
    }
  }
}

// End QType.java
