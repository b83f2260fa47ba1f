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
package net.hydromatic.trail.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.IrWriter;

/**
 * A fault that occurred while lowering a query.
 *
 * <p>Faults indicate a defect in the lowering passes or in one of their
 * collaborators (the front end that produced the blocks, or the query metadata
 * table); they are never caused by a mistake in the user's query, which the
 * front end would have reported earlier. Lowering is all-or-nothing: a pass
 * either returns a complete list of blocks or throws.
 */
public class LoweringException extends RuntimeException {
  private final Kind kind;
  private final ImmutableList<Ir.Block> blocks;

  public LoweringException(Kind kind, String message,
      List<? extends Ir.Block> blocks) {
    super(message);
    this.kind = requireNonNull(kind);
    this.blocks = ImmutableList.copyOf(blocks);
  }

  /** Creates a fault for blocks that do not have the structure that a pass
   * requires. */
  public static LoweringException malformed(String message,
      List<? extends Ir.Block> blocks) {
    return new LoweringException(Kind.MALFORMED_IR, message, blocks);
  }

  /** Creates a fault for a malformed query metadata table. */
  public static LoweringException malformed(String message) {
    return malformed(message, ImmutableList.of());
  }

  /** Creates a fault for a pass whose output breaks its own invariant. */
  public static LoweringException invariantViolation(String message,
      List<? extends Ir.Block> blocks) {
    return new LoweringException(Kind.INVARIANT_VIOLATION, message, blocks);
  }

  /** Returns the kind of fault. */
  public Kind kind() {
    return kind;
  }

  /** Returns the blocks that were being lowered, to aid diagnosis; empty if
   * the fault was found outside of a pass. */
  public ImmutableList<Ir.Block> blocks() {
    return blocks;
  }

  /** Returns whether this fault is a defect in the compiler, as opposed to an
   * error in the query. Always true. */
  public boolean isInternal() {
    return true;
  }

  @Override
  public String toString() {
    return super.toString() + " (" + kind + ")";
  }

  /** Describes this fault, with at most {@code printLength} of its blocks. */
  public StringBuilder describeTo(StringBuilder buf, int printLength) {
    buf.append("Internal error (").append(kind).append("): ")
        .append(getMessage());
    if (!blocks.isEmpty()) {
      buf.append("\nIR blocks:\n")
          .append(new IrWriter().blocks(blocks, printLength));
    }
    return buf;
  }

  /** Kind of fault. */
  public enum Kind {
    /** The blocks, or the metadata table, do not have the structure that a
     * pass assumes. */
    MALFORMED_IR,
    /** The output of a pass breaks an invariant that the pass promises. */
    INVARIANT_VIOLATION
  }
}

// End LoweringException.java
