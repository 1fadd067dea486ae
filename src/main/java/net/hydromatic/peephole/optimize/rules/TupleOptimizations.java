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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.peephole.expr.Expr;
import net.hydromatic.peephole.expr.ExprNode;
import net.hydromatic.peephole.expr.Operator;
import net.hydromatic.peephole.optimize.OptimizationEnv;
import net.hydromatic.peephole.optimize.PeepholeOptimization;

/**
 * Optimization that folds a projection of a tuple constructor:
 * {@code core.get_nth[i](core.make_tuple(e0, ..., en))} becomes {@code ei}.
 *
 * <p>It is a transform rather than a pattern because the index is a
 * parameter of the operator, and a pattern would need one rule per index.
 */
public abstract class TupleOptimizations {
  private TupleOptimizations() {}

  /** Creates the optimizations. */
  public static List<PeepholeOptimization> create(OptimizationEnv env) {
    final Operator getNth = env.op("core.get_nth");
    final Operator makeTuple = env.op("core.make_tuple");
    return ImmutableList.of(
        PeepholeOptimization.transform("get_nth(make_tuple)",
            node -> foldGetNth(node, getNth, makeTuple)));
  }

  private static ExprNode foldGetNth(ExprNode node, Operator getNth,
      Operator makeTuple) {
    if (!node.isCall()) {
      return node;
    }
    final Expr.Call call = (Expr.Call) node;
    if (!call.op.name.equals(getNth.name)
        || call.op.params.size() != 1
        || !(call.op.params.get(0) instanceof Integer)
        || call.args.size() != 1
        || !call.arg(0).isCall()) {
      return node;
    }
    final Expr.Call tuple = (Expr.Call) call.arg(0);
    if (!tuple.op.equals(makeTuple)) {
      return node;
    }
    final int i = (Integer) call.op.params.get(0);
    if (i < 0 || i >= tuple.args.size()) {
      return node;
    }
    return tuple.arg(i);
  }
}

// End TupleOptimizations.java
