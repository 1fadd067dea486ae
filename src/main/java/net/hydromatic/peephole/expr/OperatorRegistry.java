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
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves operator names to operators.
 *
 * <p>A registry is immutable; {@link #plus} returns a new registry.
 */
public class OperatorRegistry {
  private static final OperatorRegistry STANDARD = create(standardMap());

  private final ImmutableMap<String, Operator> operators;

  private OperatorRegistry(ImmutableMap<String, Operator> operators) {
    this.operators = operators;
  }

  private static OperatorRegistry create(Map<String, Operator> map) {
    return new OperatorRegistry(ImmutableMap.copyOf(map));
  }

  private static Map<String, Operator> standardMap() {
    final Map<String, Operator> map = new LinkedHashMap<>();
    for (BuiltIn builtIn : BuiltIn.values()) {
      map.put(builtIn.opName, builtIn.operator);
    }
    return map;
  }

  /** Returns the registry of {@link BuiltIn} operators. */
  public static OperatorRegistry standard() {
    return STANDARD;
  }

  /** Returns a registry containing the operators in this registry plus the
   * given operators. A given operator replaces an existing operator of the
   * same name. */
  public OperatorRegistry plus(Operator... extraOperators) {
    final Map<String, Operator> map = new LinkedHashMap<>(operators);
    for (Operator operator : extraOperators) {
      map.put(operator.name, operator);
    }
    return create(map);
  }

  /** Looks up an operator by name, returning null if not found. */
  public @Nullable Operator getOptional(String name) {
    return operators.get(name);
  }

  /** Looks up an operator by name. Throws if not found; never returns
   * null. */
  public Operator lookup(String name) {
    final Operator operator = operators.get(name);
    if (operator == null) {
      throw new IllegalArgumentException("unknown operator: " + name);
    }
    return operator;
  }
}

// End OperatorRegistry.java
