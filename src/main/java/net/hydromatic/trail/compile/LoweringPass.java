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
import java.util.List;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Rewrites the blocks of a query.
 *
 * <p>A pass is a pure function: it does not modify the blocks or the table,
 * and returns the same output for the same input.
 */
@FunctionalInterface
public interface LoweringPass {
  /** Applies this pass to a list of blocks.
   *
   * @throws LoweringException if the blocks are malformed, or if the output
   *   would break an invariant of the pass */
  ImmutableList<Ir.Block> apply(List<? extends Ir.Block> blocks,
      QueryMetadataTable table);
}

// End LoweringPass.java
