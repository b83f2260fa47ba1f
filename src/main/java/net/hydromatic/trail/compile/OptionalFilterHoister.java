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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Pass that moves filters inside {@code @optional} scopes to the global
 * operations section.
 *
 * <p>If an optional edge exists but a filter on its destination fails, the
 * row must be dropped; if the edge does not exist, the row must be kept.
 * Many backends' native optional-match semantics instead drop the row on
 * filter failure whether or not the edge exists. So we apply the
 * optional-edge semantics first, materialize the result, and only then apply
 * the filters, by moving them to just after the {@link
 * Ir.GlobalOperationsStart} block. Filters outside optional scopes stay where
 * they are; moved filters keep their relative order.
 *
 * <p>This pass assumes that every {@link Ir.LocalField} has already been
 * replaced by an expression that names its location (see {@link
 * LocalFieldResolver}); a local field that moves would lose its meaning.
 */
public class OptionalFilterHoister {
  private OptionalFilterHoister() {}

  /** Moves filters within optional scopes to the global operations
   * section. */
  public static ImmutableList<Ir.Block> hoistOptionalFilters(
      List<? extends Ir.Block> blocks, QueryMetadataTable table) {
    final State state = new State(table, blocks);
    blocks.forEach(state::advance);
    return state.finish();
  }

  /**
   * State of the pass as it scans the blocks.
   *
   * <p>Whether we are inside an optional scope is set when we enter an
   * optional traversal, and is recomputed from the metadata table at each
   * {@link Ir.Backtrack}, so that after leaving a nested optional scope we
   * are still inside the enclosing one.
   */
  public static class State {
    private final QueryMetadataTable table;
    private final List<? extends Ir.Block> input;
    private final ImmutableList.Builder<Ir.Block> output =
        ImmutableList.builder();
    private final List<Ir.Filter> hoisted = new ArrayList<>();
    private boolean withinOptionalScope;
    private boolean globalOperationsStarted;

    /** Creates a State. {@code input} is used only to describe faults. */
    public State(QueryMetadataTable table, List<? extends Ir.Block> input) {
      this.table = table;
      this.input = input;
    }

    /** Consumes the next block. */
    public void advance(Ir.Block block) {
      switch (block.op) {
        case FILTER:
          if (withinOptionalScope && !globalOperationsStarted) {
            // Do not emit the block in its original position.
            hoisted.add((Ir.Filter) block);
            return;
          }
          break;

        case TRAVERSE:
          if (((Ir.Traverse) block).optional) {
            withinOptionalScope = true;
          }
          break;

        case BACKTRACK:
          withinOptionalScope =
              table.getLocationInfo(((Ir.Backtrack) block).location)
                  .optionalScopesDepth > 0;
          break;

        case GLOBAL_OPERATIONS_START:
          if (globalOperationsStarted) {
            throw LoweringException.malformed(
                "more than one GlobalOperationsStart block", input);
          }
          globalOperationsStarted = true;
          // The global operations section starts here, and this is where the
          // hoisted filters go.
          output.add(block);
          output.addAll(hoisted);
          hoisted.clear();
          return;

        default:
          break;
      }
      output.add(block);
    }

    /** Returns whether the blocks consumed so far leave us inside an optional
     * scope. */
    public boolean isWithinOptionalScope() {
      return withinOptionalScope;
    }

    /** Returns the filters waiting to be moved. */
    public List<Ir.Filter> hoisted() {
      return ImmutableList.copyOf(hoisted);
    }

    /** Returns the output.
     *
     * @throws LoweringException if filters were moved but there was no
     *   {@link Ir.GlobalOperationsStart} to move them to */
    public ImmutableList<Ir.Block> finish() {
      if (!hoisted.isEmpty()) {
        throw LoweringException.malformed("no GlobalOperationsStart block "
            + "to receive " + hoisted.size() + " filter(s) from optional "
            + "scopes", input);
      }
      return output.build();
    }
  }
}

// End OptionalFilterHoister.java
