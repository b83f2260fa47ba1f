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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.IrWriter;
import net.hydromatic.trail.ir.Op;
import net.hydromatic.trail.ir.Visitor;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Checks the structure of lists of blocks.
 *
 * <p>{@link #checkWellFormed} checks what the passes assume about their
 * input; {@link #checkLowered} checks what the pipeline promises about its
 * output. {@link Lowering} calls them if {@link Prop#VALIDATE} is set.
 */
public class IrChecker {
  private IrChecker() {}

  /**
   * Checks that blocks produced by the front end are well-formed: every
   * traversal is followed, skipping only filters and type coercions, by a
   * {@link Ir.MarkLocation}; and there is exactly one {@link
   * Ir.GlobalOperationsStart}.
   *
   * @throws LoweringException of kind {@code MALFORMED_IR} if not
   */
  public static void checkWellFormed(List<? extends Ir.Block> blocks,
      int printLength) {
    checkGlobalOperationsStart(blocks, printLength,
        LoweringException.Kind.MALFORMED_IR);
    for (int i = 0; i < blocks.size(); i++) {
      if (!blocks.get(i).op.isTraversal()) {
        continue;
      }
      final int j = skip(blocks, i + 1, Op.FILTER, Op.COERCE_TYPE);
      if (j >= blocks.size() || blocks.get(j).op != Op.MARK_LOCATION) {
        throw fault(LoweringException.Kind.MALFORMED_IR, "block "
            + blocks.get(i) + " at index " + i
            + " is not followed by a MarkLocation", blocks, printLength);
      }
    }
  }

  /**
   * Checks that blocks are fully lowered: every traversal is followed,
   * skipping only filters, by a {@link Ir.CoerceType}; no block marks or
   * refers to a revisit location, or to a fold scope entered at one; no
   * {@link Ir.LocalField} remains; there is exactly one {@link
   * Ir.GlobalOperationsStart}; and no filter inside an optional scope
   * precedes it.
   *
   * @throws LoweringException of kind {@code INVARIANT_VIOLATION} if not
   */
  public static void checkLowered(List<? extends Ir.Block> blocks,
      QueryMetadataTable table, int printLength) {
    final LoweringException.Kind kind =
        LoweringException.Kind.INVARIANT_VIOLATION;
    checkGlobalOperationsStart(blocks, printLength, kind);
    final Set<?> revisits = table.revisitTranslations().keySet();
    boolean withinOptionalScope = false;
    boolean globalOperationsStarted = false;
    for (int i = 0; i < blocks.size(); i++) {
      final Ir.Block block = blocks.get(i);
      switch (block.op) {
        case TRAVERSE:
          withinOptionalScope |= ((Ir.Traverse) block).optional;
          break;
        case BACKTRACK:
          withinOptionalScope =
              table.getLocationInfo(((Ir.Backtrack) block).location)
                  .optionalScopesDepth > 0;
          break;
        case FILTER:
          if (withinOptionalScope && !globalOperationsStarted) {
            throw fault(kind, "filter " + block + " at index " + i
                + " is inside an optional scope", blocks, printLength);
          }
          break;
        case GLOBAL_OPERATIONS_START:
          globalOperationsStarted = true;
          break;
        default:
          break;
      }
      if (block.op.isTraversal()) {
        final int j = skip(blocks, i + 1, Op.FILTER);
        if (j >= blocks.size() || blocks.get(j).op != Op.COERCE_TYPE) {
          throw fault(kind, "block " + block + " at index " + i
              + " is not followed by a CoerceType", blocks, printLength);
        }
      }
      for (BaseLocation location : referencedLocations(block)) {
        final BaseLocation vertex = location instanceof FoldScopeLocation
            ? ((FoldScopeLocation) location).baseLocation
            : location;
        if (revisits.contains(vertex)) {
          throw fault(kind, "block " + block + " at index " + i
              + " refers to revisit location " + location, blocks,
              printLength);
        }
      }
      if (containsLocalField(block)) {
        throw fault(kind, "block " + block + " at index " + i
            + " contains a LocalField", blocks, printLength);
      }
    }
  }

  /** Returns whether any of the given blocks contains a {@link
   * Ir.LocalField}. */
  public static boolean containsLocalField(
      Iterable<? extends Ir.Block> blocks) {
    for (Ir.Block block : blocks) {
      if (containsLocalField(block)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether a block contains a {@link Ir.LocalField}. */
  public static boolean containsLocalField(Ir.Block block) {
    final boolean[] found = {false};
    block.accept(new Visitor() {
      @Override
      protected void visit(Ir.LocalField localField) {
        found[0] = true;
      }
    });
    return found[0];
  }

  /**
   * Returns the vertex locations that a block refers to, either directly
   * (the location of a {@link Ir.MarkLocation}, {@link Ir.Backtrack} or
   * {@link Ir.Fold}) or in its expressions.
   */
  public static ImmutableSet<BaseLocation> referencedLocations(
      Ir.Block block) {
    final ImmutableSet.Builder<BaseLocation> b = ImmutableSet.builder();
    switch (block.op) {
      case MARK_LOCATION:
        b.add(((Ir.MarkLocation) block).location);
        break;
      case BACKTRACK:
        b.add(((Ir.Backtrack) block).location);
        break;
      case FOLD:
        b.add(((Ir.Fold) block).foldScopeLocation);
        break;
      default:
        break;
    }
    block.accept(new Visitor() {
      @Override
      protected void visit(Ir.ContextField contextField) {
        b.add(contextField.location.atVertex());
      }

      @Override
      protected void visit(Ir.OutputContextField outputContextField) {
        b.add(outputContextField.location.atVertex());
      }

      @Override
      protected void visit(Ir.FoldedContextField foldedContextField) {
        b.add(foldedContextField.location.atVertex());
      }

      @Override
      protected void visit(Ir.ContextFieldExistence contextFieldExistence) {
        b.add(contextFieldExistence.location);
      }
    });
    return b.build();
  }

  private static void checkGlobalOperationsStart(
      List<? extends Ir.Block> blocks, int printLength,
      LoweringException.Kind kind) {
    int count = 0;
    for (Ir.Block block : blocks) {
      if (block.op == Op.GLOBAL_OPERATIONS_START) {
        ++count;
      }
    }
    if (count != 1) {
      throw fault(kind, "expected exactly one GlobalOperationsStart block, "
          + "found " + count, blocks, printLength);
    }
  }

  /** Returns the index of the first block at or after {@code start} whose op
   * is not one of {@code ops}. */
  private static int skip(List<? extends Ir.Block> blocks, int start,
      Op... ops) {
    final Set<Op> opSet = ImmutableSet.copyOf(ops);
    int i = start;
    while (i < blocks.size() && opSet.contains(blocks.get(i).op)) {
      ++i;
    }
    return i;
  }

  private static LoweringException fault(LoweringException.Kind kind,
      String message, List<? extends Ir.Block> blocks, int printLength) {
    final String fullMessage = message + "; IR blocks:\n"
        + new IrWriter().blocks(blocks, printLength);
    return new LoweringException(kind, fullMessage, blocks);
  }
}

// End IrChecker.java
