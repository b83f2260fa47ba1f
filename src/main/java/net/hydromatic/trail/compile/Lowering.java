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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Lowers the blocks of a query into a form that a backend's code generator
 * can emit.
 *
 * <p>Applies {@link #PASSES} in order. The order matters for correctness,
 * not just efficiency: filters may move only after their local fields have
 * been resolved, and local fields are resolved only after type bounds have
 * been added and revisits removed.
 */
public abstract class Lowering {
  private Lowering() {}

  /** The lowering passes, in the order that they must be applied. */
  public static final ImmutableList<LoweringPass> PASSES =
      ImmutableList.of(
          TypeBoundInserter::insertExplicitTypeBounds,
          RevisitEliminator::eliminateRevisits,
          (blocks, table) -> LocalFieldResolver.resolveLocalFields(blocks),
          OptionalFilterHoister::hoistOptionalFilters);

  /** Lowers a query, with default properties and no tracing. */
  public static ImmutableList<Ir.Block> lower(List<? extends Ir.Block> blocks,
      QueryMetadataTable table) {
    return lower(blocks, table, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Lowers a query.
   *
   * <p>Faults thrown by a pass propagate to the caller unchanged.
   *
   * @param blocks Blocks produced by the front end
   * @param table Metadata about the query's locations
   * @param propMap Properties; see {@link Prop}
   * @param tracer Called with the blocks before and after each pass
   * @return Lowered blocks
   * @throws LoweringException if the blocks are malformed, or a pass breaks
   *   one of its invariants
   */
  public static ImmutableList<Ir.Block> lower(List<? extends Ir.Block> blocks,
      QueryMetadataTable table, Map<Prop, Object> propMap, Tracer tracer) {
    final boolean validate = Prop.VALIDATE.booleanValue(propMap);
    final int printLength = Prop.PRINT_LENGTH.intValue(propMap);

    ImmutableList<Ir.Block> currentBlocks = ImmutableList.copyOf(blocks);
    if (validate) {
      IrChecker.checkWellFormed(currentBlocks, printLength);
    }
    tracer.onBlocks(0, currentBlocks);
    for (int i = 0; i < PASSES.size(); i++) {
      currentBlocks = PASSES.get(i).apply(currentBlocks, table);
      tracer.onBlocks(i + 1, currentBlocks);
    }
    if (validate) {
      IrChecker.checkLowered(currentBlocks, table, printLength);
    }
    tracer.onBlocks(-1, currentBlocks);
    return currentBlocks;
  }
}

// End Lowering.java
