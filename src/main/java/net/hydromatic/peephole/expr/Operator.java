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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.peephole.type.TypeRule;
import net.hydromatic.peephole.type.TypeRules;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operator, such as {@code math.add} or {@code core.get_nth[2]}.
 *
 * <p>An operator's identity is its name and its parameters. Two operators
 * with the same name but different parameters, such as
 * {@code core.get_nth[0]} and {@code core.get_nth[1]}, are different.
 *
 * <p>The {@link #typeRule} is not part of the identity.
 */
public final class Operator {
  public final String name;
  public final ImmutableList<Object> params;
  public final TypeRule typeRule;
  private final Fingerprint fingerprint;

  private Operator(String name, ImmutableList<Object> params,
      TypeRule typeRule) {
    this.name = requireNonNull(name);
    this.params = requireNonNull(params);
    this.typeRule = requireNonNull(typeRule);
    final Fingerprint.Builder b =
        Fingerprint.builder("operator").putString(name).putInt(params.size());
    params.forEach(b::putValue);
    this.fingerprint = b.build();
  }

  /** Creates an operator with no parameters. */
  public static Operator of(String name, TypeRule typeRule) {
    return new Operator(name, ImmutableList.of(), typeRule);
  }

  /** Creates an operator whose result type is unknown. */
  public static Operator of(String name) {
    return of(name, TypeRules.UNKNOWN);
  }

  /** Returns an operator with the same name and type rule as this, but with
   * the given parameters. */
  public Operator withParams(List<?> params) {
    return new Operator(name, ImmutableList.<Object>copyOf(params), typeRule);
  }

  /** Returns the fingerprint, computed from name and parameters. */
  public Fingerprint fingerprint() {
    return fingerprint;
  }

  @Override public int hashCode() {
    return fingerprint.hashCode();
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Operator
        && fingerprint.equals(((Operator) o).fingerprint);
  }

  @Override public String toString() {
    if (params.isEmpty()) {
      return name;
    }
    final StringBuilder b = new StringBuilder(name).append('[');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        b.append(',');
      }
      b.append(params.get(i));
    }
    return b.append(']').toString();
  }
}

// End Operator.java
