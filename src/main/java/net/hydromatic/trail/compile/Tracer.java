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

import java.util.List;
import net.hydromatic.trail.ir.Ir;

/** Called on various events during lowering. */
public interface Tracer {
  /**
   * Called with the list of blocks at each stage of lowering.
   *
   * <p>{@code pass} is 0 for the input, 1 to 4 for the output of each pass in
   * {@link Lowering#PASSES}, and -1 for the final result.
   */
  void onBlocks(int pass, List<Ir.Block> blocks);
}

// End Tracer.java
