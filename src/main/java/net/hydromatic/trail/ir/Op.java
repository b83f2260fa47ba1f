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
package net.hydromatic.trail.ir;

import com.google.common.base.CaseFormat;

/** Sub-types of {@link IrNode}. */
public enum Op {
  // blocks
  QUERY_ROOT(true),
  TRAVERSE(true),
  RECURSE(true),
  FOLD(true),
  UNFOLD(true),
  BACKTRACK(true),
  MARK_LOCATION(true),
  COERCE_TYPE(true),
  FILTER(true),
  END_OPTIONAL(true),
  OUTPUT_SOURCE(true),
  GLOBAL_OPERATIONS_START(true),
  CONSTRUCT_RESULT(true),

  // expressions
  LITERAL(false),
  VARIABLE(false),
  LOCAL_FIELD(false),
  CONTEXT_FIELD(false),
  OUTPUT_CONTEXT_FIELD(false),
  FOLDED_CONTEXT_FIELD(false),
  CONTEXT_FIELD_EXISTENCE(false),
  UNARY_TRANSFORMATION(false),
  BINARY_COMPOSITION(false),
  TERNARY_CONDITIONAL(false);

  /** Whether nodes of this kind are blocks (as opposed to expressions). */
  public final boolean block;

  /** Name used when printing, e.g. "MarkLocation" for {@link #MARK_LOCATION}. */
  public final String displayName;

  Op(boolean block) {
    this.block = block;
    this.displayName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
  }

  /**
   * Returns whether this is a block that moves to a new vertex: {@link
   * #TRAVERSE}, {@link #RECURSE} or {@link #FOLD}. Each such block is followed,
   * perhaps after some {@link #FILTER} and {@link #COERCE_TYPE} blocks, by a
   * {@link #MARK_LOCATION} for its destination.
   */
  public boolean isTraversal() {
    switch (this) {
      case TRAVERSE:
      case RECURSE:
      case FOLD:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
