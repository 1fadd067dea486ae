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
package net.hydromatic.peephole.type;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of a tuple, a fixed-length sequence of fields of given types. */
public final class TupleType implements QType {
  public final ImmutableList<QType> fieldTypes;

  private TupleType(ImmutableList<QType> fieldTypes) {
    this.fieldTypes = fieldTypes;
  }

  /** Creates a tuple type. */
  public static TupleType of(List<? extends QType> fieldTypes) {
    return new TupleType(ImmutableList.copyOf(fieldTypes));
  }

  /** Creates a tuple type. */
  public static TupleType of(QType... fieldTypes) {
    return new TupleType(ImmutableList.copyOf(fieldTypes));
  }

  @Override public int hashCode() {
    return fieldTypes.hashCode();
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof TupleType
        && fieldTypes.equals(((TupleType) o).fieldTypes);
  }

  @Override public String toString() {
    return moniker();
  }

  @Override public String moniker() {
    final StringBuilder b = new StringBuilder("tuple<");
    for (int i = 0; i < fieldTypes.size(); i++) {
      if (i > 0) {
        b.append(',');
      }
      b.append(fieldTypes.get(i).moniker());
    }
    return b.append('>').toString();
  }

  @Override public @Nullable ScalarType valueType() {
    return null;
  }

  @Override public Shape shape() {
    return Shape.OTHER;
  }
}

// End TupleType.java
