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
import java.util.List;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.meta.LocationInfo;
import net.hydromatic.trail.meta.QueryMetadataTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Pass that makes the type of every traversed vertex explicit.
 *
 * <p>A backend may not know that the endpoints of every edge are strictly
 * typed. After each {@link Ir.Traverse}, {@link Ir.Fold} and {@link
 * Ir.Recurse} that is not already followed by an {@link Ir.CoerceType}, this
 * pass adds a {@code CoerceType} to the declared type of the destination.
 *
 * <p>The new block goes immediately after the traversal, before any filters
 * that follow it, so that those filters may assume the narrowed type. Running
 * the pass a second time has no effect.
 */
public class TypeBoundInserter {
  private TypeBoundInserter() {}

  /** Adds a {@link Ir.CoerceType} after every traversal that lacks one. */
  public static ImmutableList<Ir.Block> insertExplicitTypeBounds(
      List<? extends Ir.Block> blocks, QueryMetadataTable table) {
    final ImmutableList.Builder<Ir.Block> newBlocks = ImmutableList.builder();
    for (int i = 0; i < blocks.size(); i++) {
      final Ir.Block block = blocks.get(i);
      newBlocks.add(block);
      if (block.op.isTraversal()) {
        final Ir.@Nullable CoerceType coerceType =
            missingTypeBound(blocks, i, table);
        if (coerceType != null) {
          newBlocks.add(coerceType);
        }
      }
    }
    return newBlocks.build();
  }

  /**
   * Returns the type coercion to add after the traversal at position
   * {@code index}, or null if one is already present.
   *
   * <p>Filtering happens before location-marking, so we step over filters; if
   * we reach a {@link Ir.MarkLocation} without finding a {@link
   * Ir.CoerceType}, there is none.
   */
  private static Ir.@Nullable CoerceType missingTypeBound(
      List<? extends Ir.Block> blocks, int index, QueryMetadataTable table) {
    final Ir.Block block = blocks.get(index);
    for (int i = index + 1; i < blocks.size(); i++) {
      final Ir.Block next = blocks.get(i);
      switch (next.op) {
        case FILTER:
          continue;

        case COERCE_TYPE:
          return null;

        case MARK_LOCATION:
          final LocationInfo info =
              table.getLocationInfo(((Ir.MarkLocation) next).location);
          return ir.coerceType(info.type);

        default:
          throw LoweringException.malformed("expected only CoerceType and "
              + "Filter blocks between " + block + " at index " + index
              + " and the corresponding MarkLocation, but found " + next
              + " at index " + i, blocks);
      }
    }
    throw LoweringException.malformed("block " + block + " at index " + index
        + " does not have a MarkLocation or CoerceType block after it",
        blocks);
  }
}

// End TypeBoundInserter.java
