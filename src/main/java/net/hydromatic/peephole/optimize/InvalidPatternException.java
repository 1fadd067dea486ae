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

/** Thrown when a pattern is not valid. Thrown while building rules, never
 * while rewriting an expression. */
public class InvalidPatternException extends RuntimeException {
  public final Reason reason;

  public InvalidPatternException(Reason reason, String message) {
    super(message);
    this.reason = requireNonNull(reason);
  }

  /** Reason that a pattern is not valid. */
  public enum Reason {
    /** The template contains a leaf. */
    LEAF_IN_TEMPLATE,
    /** The "to" template contains a placeholder that is not in "from". */
    UNKNOWN_PLACEHOLDER,
    /** The "from" template is a placeholder with no matcher, and would
     * therefore match every node. */
    TRIVIAL_MATCH,
    /** There is a matcher for a placeholder that is not in "from". */
    UNKNOWN_MATCHER_KEY
  }
}

// End InvalidPatternException.java
