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

import static net.hydromatic.trail.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.Location;
import net.hydromatic.trail.ir.Op;

/**
 * Pass that replaces each {@link Ir.LocalField} with an expression that names
 * its location explicitly.
 *
 * <p>A local field means "the field at whichever location is currently
 * open", and that is determined by the position of its block. Once blocks
 * may move (see {@link OptionalFilterHoister}), local fields would become
 * ambiguous. The location that a block's local fields refer to is the
 * location of the next {@link Ir.MarkLocation}; each local field becomes a
 * {@link Ir.ContextField} at that location, or a {@link
 * Ir.FoldedContextField} if the location is in a fold scope.
 *
 * <p>The pass rewrites blocks one-for-one; it never adds, removes or reorders
 * blocks.
 */
public class LocalFieldResolver {
  private LocalFieldResolver() {}

  /** Replaces local fields with context fields. */
  public static ImmutableList<Ir.Block> resolveLocalFields(
      List<? extends Ir.Block> blocks) {
    final State state = new State();
    blocks.forEach(state::advance);
    final ImmutableList<Ir.Block> newBlocks = state.finish();
    if (newBlocks.size() != blocks.size()) {
      throw LoweringException.invariantViolation("the number of IR blocks "
          + "unexpectedly changed, " + blocks.size() + " vs "
          + newBlocks.size(), blocks);
    }
    return newBlocks;
  }

  /** Converts an expression, if it is a local field, into a field at the
   * given location. */
  static Ir.Exp toContextField(BaseLocation location, Ir.Exp exp) {
    if (exp.op != Op.LOCAL_FIELD) {
      return exp;
    }
    final String fieldName = ((Ir.LocalField) exp).fieldName;
    if (location instanceof FoldScopeLocation) {
      return ir.foldedContextField(
          ((FoldScopeLocation) location).navigateToField(fieldName));
    }
    return ir.contextField(((Location) location).navigateToField(fieldName));
  }

  /**
   * State of the pass as it scans the blocks.
   *
   * <p>Blocks are held in a pending list until the next {@link
   * Ir.MarkLocation} tells us which location their local fields refer to.
   */
  public static class State {
    private final ImmutableList.Builder<Ir.Block> output =
        ImmutableList.builder();
    private final List<Ir.Block> pending = new ArrayList<>();

    /** Consumes the next block. */
    public void advance(Ir.Block block) {
      if (block.op != Op.MARK_LOCATION) {
        pending.add(block);
        return;
      }
      // First, rewrite all the blocks that might refer to this location;
      // then emit the MarkLocation itself.
      final ExpressionRewriter rewriter =
          ExpressionRewriter.at(((Ir.MarkLocation) block).location,
              LocalFieldResolver::toContextField);
      for (Ir.Block pendingBlock : pending) {
        output.add(rewriter.rewrite(pendingBlock));
      }
      pending.clear();
      output.add(block);
    }

    /** Returns the blocks that are waiting for a location. */
    public List<Ir.Block> pending() {
      return ImmutableList.copyOf(pending);
    }

    /** Returns the output, including any blocks after the last
     * {@link Ir.MarkLocation}, which are not rewritten. */
    public ImmutableList<Ir.Block> finish() {
      output.addAll(pending);
      pending.clear();
      return output.build();
    }
  }
}

// End LocalFieldResolver.java
