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
package net.hydromatic.peephole.optimize.rules;

import com.google.common.collect.ImmutableSet;
import java.util.function.Predicate;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Fingerprint;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.QTypes;
import net.hydromatic.peephole.type.ScalarType;

/**
 * Predicates on nodes, for use as placeholder matchers.
 *
 * <p>Matchers that look at types use the environment's type inference. A
 * node whose type is unknown does not satisfy them.
 */
public abstract class NodeMatchers {
  private NodeMatchers() {}

  /** Matches literals. */
  public static Predicate<ExprNode> isLiteral() {
    return ExprNode::isLiteral;
  }

  /** Matches nodes whose fingerprint is one of the given nodes'. */
  public static Predicate<ExprNode> isAnyOf(ExprNode... nodes) {
    final ImmutableSet.Builder<Fingerprint> fingerprints =
        ImmutableSet.builder();
    for (ExprNode node : nodes) {
      fingerprints.add(node.fingerprint());
    }
    final ImmutableSet<Fingerprint> set = fingerprints.build();
    return node -> set.contains(node.fingerprint());
  }

  /** Matches nodes whose type satisfies a predicate. */
  public static Predicate<ExprNode> hasType(OptimizationEnv env,
      Predicate<QType> predicate) {
    return node -> {
      final QType type = env.typeOf(node);
      return type != null && predicate.test(type);
    };
  }

  /** Matches nodes whose values are of a given scalar type, in any
   * shape. */
  public static Predicate<ExprNode> hasValueType(OptimizationEnv env,
      ScalarType scalarType) {
    return hasType(env, type -> type.valueType() == scalarType);
  }

  /** Matches nodes of scalar type; such a node always has a value. */
  public static Predicate<ExprNode> isAlwaysPresentType(OptimizationEnv env) {
    return hasType(env, QTypes::isScalar);
  }

  /** Matches optional or array nodes. */
  public static Predicate<ExprNode> isOptionalLike(OptimizationEnv env) {
    return hasType(env, QTypes::isOptionalLike);
  }

  /** Matches optional nodes. */
  public static Predicate<ExprNode> isOptional(OptimizationEnv env) {
    return hasType(env, QTypes::isOptional);
  }

  /** Matches array nodes. */
  public static Predicate<ExprNode> isArray(OptimizationEnv env) {
    return hasType(env, QTypes::isArray);
  }

  /** Matches scalar or optional nodes. */
  public static Predicate<ExprNode> isBaseType(OptimizationEnv env) {
    return hasType(env, QTypes::isBaseType);
  }

  /** Matches nodes of type {@code OPTIONAL_UNIT} or
   * {@code DENSE_ARRAY_UNIT}. */
  public static Predicate<ExprNode> isPresenceType(OptimizationEnv env) {
    return hasType(env, QTypes::isPresenceType);
  }

  /** Matches optional literals that are present. */
  public static Predicate<ExprNode> isAlwaysPresentOptionalValue() {
    return node -> optionalValue(node, true);
  }

  /** Matches optional literals that are missing. */
  public static Predicate<ExprNode> isAlwaysAbsentOptionalValue() {
    return node -> optionalValue(node, false);
  }

  /** Matches nodes that always have a value: scalars and present optional
   * literals. */
  public static Predicate<ExprNode> isAlwaysPresent(OptimizationEnv env) {
    return isAlwaysPresentType(env).or(isAlwaysPresentOptionalValue());
  }

  private static boolean optionalValue(ExprNode node, boolean present) {
    if (!node.isLiteral()) {
      return false;
    }
    final Object value = ((Expr.Literal) node).value;
    return value instanceof OptionalValue
        && ((OptionalValue) value).isPresent() == present;
  }
}

// End NodeMatchers.java
