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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.optimize.rules.ArithmeticOptimizations;
import net.hydromatic.peephole.optimize.rules.AssociativeOptimizations;
import net.hydromatic.peephole.optimize.rules.BoolOptimizations;
import net.hydromatic.peephole.optimize.rules.ConstWithShapeOptimizations;
import net.hydromatic.peephole.optimize.rules.PresenceOptimizations;
import net.hydromatic.peephole.optimize.rules.ShortCircuitWhereOptimizations;
import net.hydromatic.peephole.optimize.rules.TupleOptimizations;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.TypeInference;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for {@link Optimizer}. */
public abstract class Optimizers {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Optimizers.class);

  private Optimizers() {}

  /** Creates an optimizer that applies a rule set repeatedly until the
   * expression stops changing, with default properties. */
  public static Optimizer fixedPoint(PeepholeOptimizer ruleSet,
      TypeInference typeInference) {
    return fixedPoint(ruleSet, typeInference, ImmutableMap.of(),
        Tracers.empty());
  }

  /**
   * Creates an optimizer that applies a rule set repeatedly until the
   * expression stops changing.
   *
   * <p>Each iteration is one {@link PeepholeOptimizer#apply} pass. The
   * optimizer stops when an iteration returns an expression with the same
   * fingerprint as its input. It throws
   * {@link OptimizerException.NonTermination} if that has not happened after
   * {@link Prop#ITERATION_LIMIT} iterations, and (if
   * {@link Prop#TYPE_CHECK} is set) throws
   * {@link OptimizerException.TypeChanged} if an iteration changes the
   * inferred type of the expression.
   *
   * @param ruleSet Rule set
   * @param typeInference Type inference, used to check that types are
   *                      preserved
   * @param props Properties; see {@link Prop}
   * @param tracer Tracer
   */
  public static Optimizer fixedPoint(PeepholeOptimizer ruleSet,
      TypeInference typeInference, Map<Prop, Object> props, Tracer tracer) {
    return new FixedPointOptimizer(ruleSet, typeInference,
        ImmutableMap.copyOf(props), tracer);
  }

  /** Returns the packs of the default optimizer, in order. */
  public static List<PeepholeOptimizationPack> defaultPacks() {
    return ImmutableList.of(
        ArithmeticOptimizations::create,
        AssociativeOptimizations::create,
        BoolOptimizations::create,
        ConstWithShapeOptimizations::create,
        PresenceOptimizations::create,
        TupleOptimizations::create);
  }

  /** Returns the packs of the optimizer that prepares an expression for
   * code generation, in order. */
  public static List<PeepholeOptimizationPack> codegenPacks() {
    return ImmutableList.<PeepholeOptimizationPack>builder()
        .addAll(defaultPacks())
        .add(PresenceOptimizations::createForCodegen)
        .add(ShortCircuitWhereOptimizations::create)
        .build();
  }

  /** Creates the default optimizer. */
  public static Optimizer defaultOptimizer(OptimizationEnv env) {
    return defaultOptimizer(env, ImmutableMap.of());
  }

  /** Creates the default optimizer with given properties. */
  public static Optimizer defaultOptimizer(OptimizationEnv env,
      Map<Prop, Object> props) {
    return fixedPoint(PeepholeOptimizer.create(env, defaultPacks()),
        env.typeInference, props, Tracers.empty());
  }

  /** Creates the optimizer that prepares an expression for code
   * generation. */
  public static Optimizer codegenOptimizer(OptimizationEnv env,
      Map<Prop, Object> props) {
    return fixedPoint(PeepholeOptimizer.create(env, codegenPacks()),
        env.typeInference, props, Tracers.empty());
  }

  /** Optimizer that applies a rule set until it reaches a fixed point. */
  private static class FixedPointOptimizer implements Optimizer {
    private final PeepholeOptimizer ruleSet;
    private final TypeInference typeInference;
    private final ImmutableMap<Prop, Object> props;
    private final Tracer tracer;

    FixedPointOptimizer(PeepholeOptimizer ruleSet,
        TypeInference typeInference, ImmutableMap<Prop, Object> props,
        Tracer tracer) {
      this.ruleSet = requireNonNull(ruleSet);
      this.typeInference = requireNonNull(typeInference);
      this.props = requireNonNull(props);
      this.tracer = requireNonNull(tracer);
    }

    @Override public ExprNode apply(ExprNode expr) {
      final int limit = Prop.ITERATION_LIMIT.intValue(props);
      final boolean typeCheck = Prop.TYPE_CHECK.booleanValue(props);
      final int snippetLength = Prop.DEBUG_SNIPPET_LENGTH.intValue(props);
      final @Nullable QType type =
          typeCheck ? typeInference.inferType(expr) : null;

      ExprNode lastBefore = expr;
      ExprNode previous = expr;
      for (int iteration = 1;; iteration++) {
        if (iteration > limit) {
          LOGGER.warn("No fixed point after {} iterations", limit);
          throw new OptimizerException.NonTermination(limit, lastBefore,
              previous, snippetLength);
        }
        final ExprNode current = ruleSet.apply(previous, tracer);
        if (typeCheck) {
          final @Nullable QType currentType = typeInference.inferType(current);
          if (!Objects.equals(type, currentType)) {
            LOGGER.warn("Type changed from {} to {} in iteration {}",
                type, currentType, iteration);
            throw new OptimizerException.TypeChanged(previous, current, type,
                currentType, snippetLength);
          }
        }
        tracer.onIteration(iteration, previous, current);
        LOGGER.debug("Iteration {}: {}", iteration, current);
        if (current.fingerprint().equals(previous.fingerprint())) {
          tracer.onFixedPoint(iteration, current);
          LOGGER.debug("Reached fixed point after {} iterations", iteration);
          return current;
        }
        lastBefore = previous;
        previous = current;
      }
    }
  }
}

// End Optimizers.java
