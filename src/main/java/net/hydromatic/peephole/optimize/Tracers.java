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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.peephole.expr.ExprNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each rewrite,
   * then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<PeepholeOptimization> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(PeepholeOptimization optimization,
          ExprNode before, ExprNode after) {
        consumer.accept(optimization);
        super.onRewrite(optimization, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * iteration, then calls the underlying tracer. */
  public static Tracer withOnIteration(Tracer tracer,
      BiConsumer<Integer, ExprNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onIteration(int iteration, ExprNode before,
          ExprNode after) {
        consumer.accept(iteration, after);
        super.onIteration(iteration, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of a
   * fixed-point optimizer, then calls the underlying tracer. */
  public static Tracer withOnFixedPoint(Tracer tracer,
      Consumer<ExprNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onFixedPoint(int iterationCount,
          ExprNode result) {
        consumer.accept(result);
        super.onFixedPoint(iterationCount, result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRewrite(PeepholeOptimization optimization,
        ExprNode before, ExprNode after) {
    }

    @Override public void onIteration(int iteration, ExprNode before,
        ExprNode after) {
    }

    @Override public void onFixedPoint(int iterationCount, ExprNode result) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRewrite(PeepholeOptimization optimization,
        ExprNode before, ExprNode after) {
      tracer.onRewrite(optimization, before, after);
    }

    @Override public void onIteration(int iteration, ExprNode before,
        ExprNode after) {
      tracer.onIteration(iteration, before, after);
    }

    @Override public void onFixedPoint(int iterationCount, ExprNode result) {
      tracer.onFixedPoint(iterationCount, result);
    }
  }
}

// End Tracers.java
