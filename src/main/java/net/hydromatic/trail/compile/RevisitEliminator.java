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
import static net.hydromatic.trail.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.Location;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Pass that removes location revisits.
 *
 * <p>When it returns to a vertex after an optional branch, the front end
 * mints a new location for the vertex and marks it again. A backend that
 * has no notion of a revisit does not need the second binding. This pass
 * drops each {@link Ir.MarkLocation} of a revisit location, and makes every
 * reference to a revisit location refer to the location being revisited.
 * That includes fold scopes entered at a revisit location, and the
 * destinations of {@link Ir.Backtrack} blocks.
 */
public class RevisitEliminator {
  private RevisitEliminator() {}

  /** Removes location revisits. */
  public static ImmutableList<Ir.Block> eliminateRevisits(
      List<? extends Ir.Block> blocks, QueryMetadataTable table) {
    final Map<Location, Location> translations = table.revisitTranslations();
    if (translations.isEmpty()) {
      return ImmutableList.copyOf(blocks);
    }
    final ExpressionRewriter rewriter =
        ExpressionRewriter.of(exp -> translate(translations, exp));

    final ImmutableList.Builder<Ir.Block> newBlocks = ImmutableList.builder();
    for (Ir.Block block : blocks) {
      switch (block.op) {
        case MARK_LOCATION:
          final BaseLocation location = ((Ir.MarkLocation) block).location;
          if (translations.containsKey(location)) {
            // Drop this block; references to its location are translated to
            // the origin.
            continue;
          }
          if (location instanceof FoldScopeLocation) {
            final FoldScopeLocation foldLocation =
                translateFoldScope(translations, (FoldScopeLocation) location);
            newBlocks.add(foldLocation == location ? block
                : ir.markLocation(foldLocation));
          } else {
            newBlocks.add(block);
          }
          break;

        case FOLD:
          final FoldScopeLocation foldScopeLocation =
              ((Ir.Fold) block).foldScopeLocation;
          final FoldScopeLocation newFoldScopeLocation =
              translateFoldScope(translations, foldScopeLocation);
          newBlocks.add(newFoldScopeLocation == foldScopeLocation ? block
              : ir.fold(newFoldScopeLocation));
          break;

        case BACKTRACK:
          final Ir.Backtrack backtrack = (Ir.Backtrack) block;
          newBlocks.add(
              backtrack.copy(
                  translations.getOrDefault(backtrack.location,
                      backtrack.location)));
          break;

        default:
          newBlocks.add(rewriter.rewrite(block));
          break;
      }
    }
    return newBlocks.build();
  }

  /** Translates an expression that refers to a revisit location so that it
   * refers to the origin. Other expressions are returned unchanged. */
  static Ir.Exp translate(Map<Location, Location> translations, Ir.Exp exp) {
    switch (exp.op) {
      case CONTEXT_FIELD:
        final Location location = ((Ir.ContextField) exp).location;
        final Location origin = translations.get(location.atVertex());
        return origin == null ? exp
            : ir.contextField(
                origin.navigateToField(requireNonNull(location.field)));

      case OUTPUT_CONTEXT_FIELD:
        final Location outputLocation =
            ((Ir.OutputContextField) exp).location;
        final Location outputOrigin =
            translations.get(outputLocation.atVertex());
        return outputOrigin == null ? exp
            : ir.outputContextField(
                outputOrigin.navigateToField(
                    requireNonNull(outputLocation.field)));

      case CONTEXT_FIELD_EXISTENCE:
        final Location vertex = ((Ir.ContextFieldExistence) exp).location;
        final Location vertexOrigin = translations.get(vertex);
        return vertexOrigin == null ? exp
            : ir.contextFieldExistence(vertexOrigin);

      case FOLDED_CONTEXT_FIELD:
        // A fold scope is never revisited, but it may be entered at a revisit.
        final FoldScopeLocation foldLocation =
            ((Ir.FoldedContextField) exp).location;
        final FoldScopeLocation foldOrigin =
            translateFoldScope(translations, foldLocation);
        return foldOrigin == foldLocation ? exp
            : ir.foldedContextField(foldOrigin);

      default:
        return exp;
    }
  }

  /** Translates a fold scope location that is entered at a revisit
   * location so that it is entered at the origin. */
  static FoldScopeLocation translateFoldScope(
      Map<Location, Location> translations, FoldScopeLocation location) {
    final Location origin = translations.get(location.baseLocation);
    return origin == null ? location : location.withBaseLocation(origin);
  }
}

// End RevisitEliminator.java
