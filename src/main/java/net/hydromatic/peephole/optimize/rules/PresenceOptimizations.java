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

import static net.hydromatic.peephole.expr.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;
import net.hydromatic.peephole.type.QTypes;
import net.hydromatic.peephole.type.ScalarType;

/**
 * Optimizations of presence operators: {@code core.has},
 * {@code core.presence_not}, {@code core.presence_and} ({@code a & c}),
 * {@code core.presence_or} ({@code a | b}) and {@code core.where}.
 *
 * <p>Scalar values are always present, as are present optional literals.
 */
public abstract class PresenceOptimizations {
  private PresenceOptimizations() {}

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    final Rules rules = new Rules(env, list);
    rules.hasRemoval();
    rules.presenceAndRemoval();
    rules.presenceOrRemoval();
    rules.hasPropagation();
    rules.toOptionalPropagation();
    rules.presenceAndOptional();
    rules.presenceAndOrCombination();
    rules.where();
    rules.insideWherePropagation();
    rules.presenceAndOr();
    return list.build();
  }

  /** Creates optimizations that are only useful before generating code,
   * because they replace {@code core.where} with a cheaper operator that the
   * evaluator cannot short-circuit. */
  public static List<PeepholeOptimization> createForCodegen(
      OptimizationEnv env) {
    final ImmutableList.Builder<PeepholeOptimization> list =
        ImmutableList.builder();
    new Rules(env, list).whereToPresenceAnd();
    return list.build();
  }

  /** Builds rules into a list. */
  private static class Rules {
    final OptimizationEnv env;
    final ImmutableList.Builder<PeepholeOptimization> list;
    final ExprNode a = expr.placeholder("a");
    final ExprNode b = expr.placeholder("b");
    final ExprNode c = expr.placeholder("c");
    final ExprNode d = expr.placeholder("d");

    final Predicate<ExprNode> isAlwaysPresentType;
    final Predicate<ExprNode> isAlwaysPresent;
    final Predicate<ExprNode> isPresenceType;
    final Predicate<ExprNode> isOptionalLike;
    final Predicate<ExprNode> isBaseType;
    final Predicate<ExprNode> isLiteral = NodeMatchers.isLiteral();

    Rules(OptimizationEnv env,
        ImmutableList.Builder<PeepholeOptimization> list) {
      this.env = env;
      this.list = list;
      this.isAlwaysPresentType = NodeMatchers.isAlwaysPresentType(env);
      this.isAlwaysPresent = NodeMatchers.isAlwaysPresent(env);
      this.isPresenceType = NodeMatchers.isPresenceType(env);
      this.isOptionalLike = NodeMatchers.isOptionalLike(env);
      this.isBaseType = NodeMatchers.isBaseType(env);
    }

    ExprNode call(String name, ExprNode... args) {
      return env.call(name, args);
    }

    void add(ExprNode from, ExprNode to) {
      list.add(PeepholeOptimization.pattern(from, to));
    }

    void add(ExprNode from, ExprNode to,
        ImmutableMap<String, Predicate<ExprNode>> matchers) {
      list.add(PeepholeOptimization.pattern(from, to, matchers));
    }

    /** Matches a scalar {@code UNIT}; a presence that is always present. */
    Predicate<ExprNode> isPresentUnit() {
      return isAlwaysPresentType.and(
          NodeMatchers.hasValueType(env, ScalarType.UNIT));
    }

    /** Removes {@code core.has}. */
    void hasRemoval() {
      // has(a) -> present, if a is a present optional literal
      add(call("core.has", a), expr.present(),
          ImmutableMap.of("a", NodeMatchers.isAlwaysPresentOptionalValue()));
      // ~has(a) -> ~a
      add(call("core.presence_not", call("core.has", a)),
          call("core.presence_not", a));
      // has(to_optional(a)) -> present, if a is scalar
      add(call("core.has", call("core.to_optional", a)), expr.present(),
          ImmutableMap.of("a", isAlwaysPresentType));
    }

    /** Removes {@code core.presence_and}. */
    void presenceAndRemoval() {
      // a & b -> a, if b is a scalar unit
      add(call("core.presence_and", a, b), a,
          ImmutableMap.of("b", isPresentUnit()));
      // ~(a & b) -> ~b, if a is always present
      add(call("core.presence_not", call("core.presence_and", a, b)),
          call("core.presence_not", b),
          ImmutableMap.of("a", isAlwaysPresent));
      // a & b -> to_optional(a), if b is present
      add(call("core.presence_and", a, b), call("core.to_optional", a),
          ImmutableMap.of("b",
              NodeMatchers.isAlwaysPresentOptionalValue()
                  .and(NodeMatchers.hasValueType(env, ScalarType.UNIT))));
      // a & b -> b, if a is present and a presence
      add(call("core.presence_and", a, b), b,
          ImmutableMap.of("a", isAlwaysPresent.and(isPresenceType),
              "b", isPresenceType));
    }

    /** Removes {@code core.presence_or}. */
    void presenceOrRemoval() {
      // a | b -> a, if a is scalar
      add(call("core.presence_or", a, b), a,
          ImmutableMap.of("a", isAlwaysPresentType,
              "b", NodeMatchers.hasType(env, type -> !QTypes.isArray(type))));
    }

    /** Moves {@code core.has} inside other presence operators, if that will
     * allow further simplification. */
    void hasPropagation() {
      final Predicate<ExprNode> isLiteralOrPresence =
          isLiteral.or(isPresenceType);
      for (String op
          : ImmutableList.of("core.presence_or", "core.presence_and")) {
        final ExprNode from = call("core.has", call(op, a, b));
        final ExprNode to =
            call(op, call("core.has", a), call("core.has", b));
        add(from, to, ImmutableMap.of("a", isLiteralOrPresence));
        add(from, to, ImmutableMap.of("b", isLiteralOrPresence));
      }
      final ExprNode from =
          call("core.has", call("core._presence_and_or", a, c, b));
      final ExprNode to =
          call("core._presence_and_or", call("core.has", a), c,
              call("core.has", b));
      add(from, to, ImmutableMap.of("a", isLiteralOrPresence));
      add(from, to, ImmutableMap.of("b", isLiteralOrPresence));
    }

    /** Moves {@code core.to_optional} inside {@code core.presence_or} and
     * {@code core._presence_and_or}; useful when {@code x | default} is
     * immediately used as optional. */
    void toOptionalPropagation() {
      add(call("core.to_optional", call("core.presence_or", a, b)),
          call("core.presence_or", a, call("core.to_optional", b)),
          ImmutableMap.of("a", isOptionalLike, "b", isLiteral));
      final ExprNode from =
          call("core.to_optional", call("core._presence_and_or", a, c, b));
      final ExprNode to =
          call("core._presence_and_or", call("core.to_optional", a), c,
              call("core.to_optional", b));
      add(from, to, ImmutableMap.of("a", isLiteral));
      add(from, to, ImmutableMap.of("b", isLiteral));
    }

    /** to_optional(a) &amp; c -> a &amp; c. */
    void presenceAndOptional() {
      add(call("core.presence_and", call("core.to_optional", a), c),
          call("core.presence_and", a, c),
          ImmutableMap.of("c", isOptionalLike));
    }

    /** Factors out a common condition. */
    void presenceAndOrCombination() {
      // (c & a) | (c & b) -> c & (a | b)
      final ExprNode to =
          call("core.presence_and", c, call("core.presence_or", a, b));
      add(call("core.presence_or", call("core.presence_and", c, a),
              call("core.presence_and", c, b)),
          to);
      add(call("core._presence_and_or", c, a,
              call("core.presence_and", c, b)),
          to);
      // (d | (c & a)) | (c & b) -> d | (c & (a | b))
      add(call("core.presence_or",
              call("core.presence_or", d, call("core.presence_and", c, a)),
              call("core.presence_and", c, b)),
          call("core.presence_or", d, to));
    }

    /** Creates {@code core.where} and {@code core._presence_and_or}. */
    void where() {
      // (a & c) | (b & ~c) -> to_optional(where(c, a, b))
      add(call("core.presence_or", call("core.presence_and", a, c),
              call("core.presence_and", b, call("core.presence_not", c))),
          call("core.to_optional", call("core.where", c, a, b)),
          ImmutableMap.of("c", isOptionalLike));
      // _presence_and_or(a, c, b & ~c) -> where(c, a, b)
      final Predicate<ExprNode> isOptional = NodeMatchers.isOptional(env);
      add(call("core._presence_and_or", a, c,
              call("core.presence_and", b, call("core.presence_not", c))),
          call("core.where", c, a, b),
          ImmutableMap.of("a", isOptional, "b", isOptional, "c", isBaseType));
      // (a & c) | b -> _presence_and_or(a, c, b)
      add(call("core.presence_or", call("core.presence_and", a, c), b),
          call("core._presence_and_or", a, c, b),
          ImmutableMap.of("a", isBaseType, "b", isBaseType, "c", isBaseType));
      // where(c, a, b) -> a, if c is always present and a, b are scalar
      add(call("core.where", c, a, b), a,
          ImmutableMap.of("c", isAlwaysPresent, "a", isAlwaysPresentType,
              "b", isAlwaysPresentType));
    }

    /** Moves operators inside {@code core.where} if one of the branches is a
     * literal. */
    void insideWherePropagation() {
      for (String op : ImmutableList.of("core.to_optional", "core.has")) {
        final ExprNode from = call(op, call("core.where", c, a, b));
        final ExprNode to = call("core.where", c, call(op, a), call(op, b));
        add(from, to, ImmutableMap.of("a", isLiteral));
        add(from, to, ImmutableMap.of("b", isLiteral));
      }
    }

    /** Simplifies {@code core._presence_and_or}. */
    void presenceAndOr() {
      // _presence_and_or(a, b, c) -> a | c, if b is a scalar unit
      add(call("core._presence_and_or", a, b, c),
          call("core.presence_or", a, c),
          ImmutableMap.of("b", isPresentUnit()));
      // _presence_and_or(a, b, c) -> b | c, if a is present and a presence
      add(call("core._presence_and_or", a, b, c),
          call("core.presence_or", b, c),
          ImmutableMap.of("a", isAlwaysPresent.and(isPresenceType),
              "b", isPresenceType));
    }

    /** where(c, a, missing) -> a &amp; c. */
    void whereToPresenceAnd() {
      add(call("core.where", c, a, b), call("core.presence_and", a, c),
          ImmutableMap.of("b", NodeMatchers.isAlwaysAbsentOptionalValue(),
              "c", isOptionalLike));
    }
  }
}

// End PresenceOptimizations.java
