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

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.primitives.UnsignedBytes;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Content hash that identifies the structure of an expression.
 *
 * <p>Two nodes with equal fingerprints are treated as the same node. A
 * fingerprint is 128 bits, computed by a {@link Hashing#murmur3_128()}
 * hasher.
 */
public final class Fingerprint implements Comparable<Fingerprint> {
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  private static final Comparator<byte[]> BYTES_COMPARATOR =
      UnsignedBytes.lexicographicalComparator();

  private final HashCode hashCode;

  private Fingerprint(HashCode hashCode) {
    this.hashCode = requireNonNull(hashCode);
  }

  /** Starts building a fingerprint. The salt distinguishes kinds of
   * object that might otherwise have the same content. */
  public static Builder builder(String salt) {
    return new Builder(HASH_FUNCTION.newHasher()).putString(salt);
  }

  @Override public int hashCode() {
    return hashCode.asInt();
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Fingerprint
        && hashCode.equals(((Fingerprint) o).hashCode);
  }

  @Override public int compareTo(Fingerprint o) {
    return BYTES_COMPARATOR.compare(hashCode.asBytes(), o.hashCode.asBytes());
  }

  /** Returns the fingerprint as 32 hexadecimal digits. */
  @Override public String toString() {
    return hashCode.toString();
  }

  /** Accumulates the content of a fingerprint. */
  public static final class Builder {
    private final Hasher hasher;

    private Builder(Hasher hasher) {
      this.hasher = hasher;
    }

    public Builder putString(String s) {
      // Length prefix keeps ("ab", "c") distinct from ("a", "bc").
      hasher.putInt(s.length());
      hasher.putString(s, StandardCharsets.UTF_8);
      return this;
    }

    public Builder putInt(int i) {
      hasher.putInt(i);
      return this;
    }

    public Builder putLong(long l) {
      hasher.putLong(l);
      return this;
    }

    public Builder putBoolean(boolean b) {
      hasher.putBoolean(b);
      return this;
    }

    /** Adds a value, tagged with its class, so that values such as
     * {@code 2}, {@code 2L} and {@code "2"} are distinct. */
    public Builder putValue(Object value) {
      putString(value.getClass().getName());
      if (value instanceof Boolean) {
        return putBoolean((Boolean) value);
      } else if (value instanceof Integer) {
        return putInt((Integer) value);
      } else if (value instanceof Long) {
        return putLong((Long) value);
      } else if (value instanceof Float) {
        return putInt(Float.floatToIntBits((Float) value));
      } else if (value instanceof Double) {
        return putLong(Double.doubleToLongBits((Double) value));
      } else {
        return putString(value.toString());
      }
    }

    public Builder put(Fingerprint fingerprint) {
      hasher.putBytes(fingerprint.hashCode.asBytes());
      return this;
    }

    public Fingerprint build() {
      return new Fingerprint(hasher.hash());
    }
  }
}

// End Fingerprint.java
