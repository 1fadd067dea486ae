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

import java.util.List;
import net.hydromatic.peephole.expr.Operator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Computes the result type of a call to an operator, given the types of its
 * arguments.
 *
 * @see TypeRules */
@FunctionalInterface
public interface TypeRule {
  /** Returns the result type, or null if the argument types are unknown or
   * not valid for the operator. An element of {@code argTypes} is null if the
   * type of that argument is unknown. */
  @Nullable QType apply(Operator op, List<@Nullable QType> argTypes);
}

// End TypeRule.java
