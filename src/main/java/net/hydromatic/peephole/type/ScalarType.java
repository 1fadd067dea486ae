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

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Scalar types. */
public enum ScalarType implements QType {
  UNIT(Unit.class),
  BOOLEAN(Boolean.class),
  INT32(Integer.class),
  INT64(Long.class),
  FLOAT32(Float.class),
  FLOAT64(Double.class),
  TEXT(String.class);

  /** Java class of values of this type. */
  public final Class<?> valueClass;

  ScalarType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  /**
   * Returns the scalar type of a Java value, or null if the value is not of a
   * scalar type.
   */
  public static @Nullable ScalarType of(Object value) {
    for (ScalarType type : values()) {
      if (type.valueClass.isInstance(value)) {
        return type;
      }
    }
    return null;
  }

  /** Returns whether this is a numeric type. */
  public boolean isNumeric() {
    switch (this) {
    case INT32:
    case INT64:
    case FLOAT32:
    case FLOAT64:
      return true;
    default:
      return false;
    }
  }

  /** Returns the lower-case name, used when printing literals. */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override public String moniker() {
    return name();
  }

  @Override public ScalarType valueType() {
    return this;
  }

  @Override public Shape shape() {
    return Shape.SCALAR;
  }
}

// End ScalarType.java
