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

import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Type of a value that may be missing.
 *
 * <p>There is one instance per {@link ScalarType}, so instances may be
 * compared using {@code ==}.
 */
public final class OptionalType implements QType {
  private static final Map<ScalarType, OptionalType> INSTANCES =
      new EnumMap<>(ScalarType.class);

  static {
    for (ScalarType scalarType : ScalarType.values()) {
      INSTANCES.put(scalarType, new OptionalType(scalarType));
    }
  }

  public final ScalarType scalarType;

  private OptionalType(ScalarType scalarType) {
    this.scalarType = requireNonNull(scalarType);
  }

  /** Returns the optional type of a given scalar type. */
  public static OptionalType of(ScalarType scalarType) {
    return requireNonNull(INSTANCES.get(scalarType));
  }

  @Override public String toString() {
    return moniker();
  }

  @Override public String moniker() {
    return "OPTIONAL_" + scalarType.moniker();
  }

  @Override public ScalarType valueType() {
    return scalarType;
  }

  @Override public Shape shape() {
    return Shape.OPTIONAL;
  }
}

// End OptionalType.java
