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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of an {@link OptionalType}: either a present value of a scalar type,
 * or missing.
 */
public final class OptionalValue {
  /** The present value of type {@code OPTIONAL_UNIT}. */
  public static final OptionalValue PRESENT =
      new OptionalValue(ScalarType.UNIT, Unit.INSTANCE);

  /** The missing value of type {@code OPTIONAL_UNIT}. */
  public static final OptionalValue MISSING =
      new OptionalValue(ScalarType.UNIT, null);

  public final ScalarType scalarType;
  private final @Nullable Object value;

  private OptionalValue(ScalarType scalarType, @Nullable Object value) {
    this.scalarType = requireNonNull(scalarType);
    this.value = value;
  }

  /** Creates a present value. */
  public static OptionalValue of(Object value) {
    final ScalarType scalarType = ScalarType.of(value);
    checkArgument(scalarType != null, "not a scalar value: %s", value);
    return scalarType == ScalarType.UNIT
        ? PRESENT
        : new OptionalValue(scalarType, value);
  }

  /** Creates a missing value of a given type. */
  public static OptionalValue missing(ScalarType scalarType) {
    return scalarType == ScalarType.UNIT
        ? MISSING
        : new OptionalValue(scalarType, null);
  }

  public boolean isPresent() {
    return value != null;
  }

  /** Returns the value; throws if missing. */
  public Object get() {
    if (value == null) {
      throw new IllegalStateException("value is missing");
    }
    return value;
  }

  /** Returns the type of this value. */
  public OptionalType type() {
    return OptionalType.of(scalarType);
  }

  @Override public int hashCode() {
    return Objects.hash(scalarType, value);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof OptionalValue
        && scalarType == ((OptionalValue) o).scalarType
        && Objects.equals(value, ((OptionalValue) o).value);
  }

  @Override public String toString() {
    return value == null ? "NA" : value.toString();
  }
}

// End OptionalValue.java
