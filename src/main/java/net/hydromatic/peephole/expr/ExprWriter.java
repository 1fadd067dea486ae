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

import java.util.ArrayDeque;
import java.util.Deque;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;
import net.hydromatic.peephole.type.ScalarType;
import net.hydromatic.peephole.type.Unit;

/**
 * Converts expressions to strings, for debugging and diagnostics.
 *
 * <p>Literals of types other than {@code INT32}, {@code BOOLEAN},
 * {@code TEXT} and {@code UNIT} are written with their type, for example
 * {@code float32{0.5}} or {@code optional_int64{NA}}, so that literals of
 * different types are distinguishable.
 */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression.
   *
   * <p>Uses an explicit stack of pending nodes and punctuation rather than
   * recursion, so that deep expressions can be written. */
  public ExprWriter append(ExprNode node) {
    final Deque<Object> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      final Object o = stack.pop();
      if (o instanceof Expr.Call) {
        final Expr.Call call = (Expr.Call) o;
        append(call.op.toString()).append("(");
        stack.push(")");
        for (int i = call.args.size() - 1; i >= 0; i--) {
          stack.push(call.args.get(i));
          if (i > 0) {
            stack.push(", ");
          }
        }
      } else if (o instanceof ExprNode) {
        ((ExprNode) o).unparse(this);
      } else {
        append((String) o);
      }
    }
    return this;
  }

  /** Appends a literal value. */
  public ExprWriter appendLiteral(Object value, QType type) {
    if (value instanceof OptionalValue) {
      final OptionalValue optionalValue = (OptionalValue) value;
      if (optionalValue.scalarType == ScalarType.UNIT) {
        return append(optionalValue.isPresent() ? "present" : "missing");
      }
      return append("optional_")
          .append(optionalValue.scalarType.lowerName())
          .append("{")
          .append(optionalValue.toString())
          .append("}");
    }
    if (value instanceof Boolean
        || value instanceof Integer
        || value instanceof Unit) {
      return append(value.toString());
    }
    if (value instanceof String) {
      return append("'").append((String) value).append("'");
    }
    final ScalarType scalarType = ScalarType.of(value);
    final String typeName =
        scalarType != null ? scalarType.lowerName() : type.moniker();
    return append(typeName).append("{").append(value.toString()).append("}");
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
