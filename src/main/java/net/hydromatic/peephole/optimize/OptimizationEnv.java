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
package net.hydromatic.peephole.optimize;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprBuilder;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Operator;
import net.hydromatic.peephole.expr.OperatorRegistry;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.StandardTypeInference;
import net.hydromatic.peephole.type.TypeInference;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Services available while building optimizations: resolving operator
 * names and inferring types.
 */
public class OptimizationEnv {
  public final OperatorRegistry registry;
  public final TypeInference typeInference;

  private OptimizationEnv(OperatorRegistry registry,
      TypeInference typeInference) {
    this.registry = requireNonNull(registry);
    this.typeInference = requireNonNull(typeInference);
  }

  /** Creates an environment. */
  public static OptimizationEnv of(OperatorRegistry registry,
      TypeInference typeInference) {
    return new OptimizationEnv(registry, typeInference);
  }

  /** Creates an environment with the standard operators, and the given leaf
   * types. */
  public static OptimizationEnv standard(
      Map<String, ? extends QType> leafTypes) {
    return of(OperatorRegistry.standard(),
        StandardTypeInference.create(leafTypes));
  }

  /** Creates an environment with the standard operators, the given leaf
   * types, and a type cache whose size is given by
   * {@link Prop#TYPE_CACHE_SIZE}. */
  public static OptimizationEnv standard(
      Map<String, ? extends QType> leafTypes, Map<Prop, Object> props) {
    return of(OperatorRegistry.standard(),
        StandardTypeInference.create(leafTypes,
            Prop.TYPE_CACHE_SIZE.intValue(props)));
  }

  /** Resolves an operator name. Throws if the operator is unknown. */
  public Operator op(String name) {
    return registry.lookup(name);
  }

  /** Creates a call to a named operator. */
  public Expr.Call call(String name, ExprNode... args) {
    return ExprBuilder.expr.call(op(name), args);
  }

  /** Returns the inferred type of a node, or null if unknown. */
  public @Nullable QType typeOf(ExprNode node) {
    return typeInference.inferType(node);
  }
}

// End OptimizationEnv.java
