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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.peephole.type.OptionalValue;
import net.hydromatic.peephole.type.QType;

/**
 * Expression nodes.
 *
 * <p>Create nodes using {@link ExprBuilder#expr}.
 */
public class Expr {
  private Expr() {}

  /** Constant value of a known type. */
  public static class Literal extends ExprNode {
    public final Object value;
    public final QType type;

    Literal(Object value, QType type) {
      super(NodeKind.LITERAL, fingerprint(value, type));
      this.value = requireNonNull(value);
      this.type = requireNonNull(type);
    }

    private static Fingerprint fingerprint(Object value, QType type) {
      final Fingerprint.Builder b =
          Fingerprint.builder("literal").putString(type.moniker());
      if (value instanceof OptionalValue) {
        final OptionalValue optionalValue = (OptionalValue) value;
        b.putBoolean(optionalValue.isPresent());
        if (optionalValue.isPresent()) {
          b.putValue(optionalValue.get());
        }
      } else {
        b.putValue(value);
      }
      return b.build();
    }

    @Override ExprWriter unparse(ExprWriter w) {
      return w.appendLiteral(value, type);
    }

    @Override public ExprNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Free variable, whose value is supplied when the expression is
   * evaluated. */
  public static class Leaf extends ExprNode {
    public final String name;

    Leaf(String name) {
      super(NodeKind.LEAF, Fingerprint.builder("leaf").putString(name).build());
      this.name = name;
    }

    @Override ExprWriter unparse(ExprWriter w) {
      return w.append("L.").append(name);
    }

    @Override public ExprNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Named hole in a rewrite template. When a template matches an
   * expression, each placeholder is bound to a sub-expression. */
  public static class Placeholder extends ExprNode {
    public final String name;

    Placeholder(String name) {
      super(NodeKind.PLACEHOLDER,
          Fingerprint.builder("placeholder").putString(name).build());
      this.name = name;
    }

    @Override ExprWriter unparse(ExprWriter w) {
      return w.append("P.").append(name);
    }

    @Override public ExprNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to an operator. */
  public static class Call extends ExprNode {
    public final Operator op;
    public final ImmutableList<ExprNode> args;

    Call(Operator op, ImmutableList<ExprNode> args) {
      super(NodeKind.OPERATOR, fingerprint(op, args));
      this.op = op;
      this.args = args;
    }

    private static Fingerprint fingerprint(Operator op,
        List<ExprNode> args) {
      final Fingerprint.Builder b =
          Fingerprint.builder("call").put(op.fingerprint()).putInt(args.size());
      args.forEach(arg -> b.put(arg.fingerprint()));
      return b.build();
    }

    /** Returns the {@code i}th argument. */
    public ExprNode arg(int i) {
      return args.get(i);
    }

    @Override public List<ExprNode> children() {
      return args;
    }

    @Override public Call withNewChildren(List<? extends ExprNode> children) {
      checkArgument(children.size() == args.size(),
          "expected %s children, got %s", args.size(), children.size());
      if (sameNodes(children, args)) {
        return this;
      }
      return new Call(op, ImmutableList.copyOf(children));
    }

    private static boolean sameNodes(List<? extends ExprNode> list0,
        List<? extends ExprNode> list1) {
      for (int i = 0; i < list0.size(); i++) {
        if (!list0.get(i).equals(list1.get(i))) {
          return false;
        }
      }
      return true;
    }

    @Override ExprWriter unparse(ExprWriter w) {
      return w.append(this);
    }

    @Override public ExprNode accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Expr.java
