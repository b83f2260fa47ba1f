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

import static net.hydromatic.trail.Fixture.describe;
import static net.hydromatic.trail.ir.IrBuilder.ir;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.trail.Fixture;
import net.hydromatic.trail.ir.Ir;
import org.junit.jupiter.api.Test;

/** Tests {@link LocalFieldResolver}. */
class LocalFieldResolverTest {
  private final Fixture f = new Fixture();

  @Test void testResolve() {
    final List<Ir.Block> blocks =
        RevisitEliminator.eliminateRevisits(
            TypeBoundInserter.insertExplicitTypeBounds(f.nestedOptionalQuery(),
                f.nestedOptionalTable()),
            f.nestedOptionalTable());
    final List<Ir.Block> blocks2 = LocalFieldResolver.resolveLocalFields(blocks);
    final String expected = ""
        + "  0: QueryRoot({Animal})\n"
        + "  1: MarkLocation(Animal)\n"
        + "  2: Traverse(out_Animal_ParentOf, optional)\n"
        + "  3: CoerceType({Animal})\n"
        + "  4: Filter((ContextField(Animal/out_Animal_ParentOf.name) "
        + "= $parentName))\n"
        + "  5: MarkLocation(Animal/out_Animal_ParentOf)\n"
        + "  6: Traverse(out_Animal_FedAt, optional, withinOptionalScope)\n"
        + "  7: CoerceType({FeedingEvent})\n"
        + "  8: Filter((ContextField("
        + "Animal/out_Animal_ParentOf/out_Animal_FedAt.event_date) "
        + ">= $since))\n"
        + "  9: MarkLocation(Animal/out_Animal_ParentOf/out_Animal_FedAt)\n"
        + "  10: Backtrack(Animal/out_Animal_ParentOf, optional)\n"
        + "  11: Traverse(out_Animal_OfSpecies, withinOptionalScope)\n"
        + "  12: CoerceType({Species})\n"
        + "  13: Filter((ContextField("
        + "Animal/out_Animal_ParentOf/out_Animal_OfSpecies.name) "
        + "= $species))\n"
        + "  14: MarkLocation(Animal/out_Animal_ParentOf/out_Animal_OfSpecies)\n"
        + "  15: Backtrack(Animal/out_Animal_ParentOf)\n"
        + "  16: Backtrack(Animal, optional)\n"
        + "  17: GlobalOperationsStart()\n"
        + "  18: ConstructResult(name=OutputContextField(Animal.name))\n";
    assertThat(describe(blocks2), is(expected));
    assertThat(blocks2, hasSize(blocks.size()));
    assertThat(IrChecker.containsLocalField(blocks), is(true));
    assertThat(IrChecker.containsLocalField(blocks2), is(false));
  }

  /** Inside a fold scope, a local field becomes a folded context field. */
  @Test void testFold() {
    final List<Ir.Block> blocks2 =
        LocalFieldResolver.resolveLocalFields(f.foldQuery());
    assertThat(blocks2.get(3),
        hasToString("Filter((FoldedContextField("
            + "Animal{in_Animal_ParentOf}.name) has_substring $fragment))"));
  }

  /** Blocks after the last MarkLocation have no location to refer to, and are
   * emitted as they are. */
  @Test void testTail() {
    final Ir.Filter filter =
        ir.filter(ir.equal(ir.localField("name"), ir.variable("$name")));
    final List<Ir.Block> blocks =
        ImmutableList.of(ir.queryRoot("Animal"),
            ir.markLocation(f.animal),
            filter,
            ir.globalOperationsStart());
    final List<Ir.Block> blocks2 = LocalFieldResolver.resolveLocalFields(blocks);
    assertThat(blocks2, is(blocks));
    assertThat(blocks2.get(2), sameInstance(filter));
  }

  /** Blocks before the first MarkLocation are rewritten using its
   * location. */
  @Test void testHead() {
    final List<Ir.Block> blocks =
        ImmutableList.of(ir.queryRoot("Animal"),
            ir.filter(ir.unary("size", ir.localField("alias"))),
            ir.markLocation(f.animal));
    assertThat(LocalFieldResolver.resolveLocalFields(blocks).get(1),
        hasToString("Filter(size(ContextField(Animal.alias)))"));
  }

  @Test void testState() {
    final LocalFieldResolver.State state = new LocalFieldResolver.State();
    state.advance(ir.queryRoot("Animal"));
    state.advance(ir.filter(ir.localField("is_alive")));
    assertThat(state.pending(), hasSize(2));
    state.advance(ir.markLocation(f.animal));
    assertThat(state.pending(), empty());
    state.advance(ir.globalOperationsStart());
    assertThat(state.pending(), hasSize(1));
    assertThat(describe(state.finish()),
        is("  0: QueryRoot({Animal})\n"
            + "  1: Filter(ContextField(Animal.is_alive))\n"
            + "  2: MarkLocation(Animal)\n"
            + "  3: GlobalOperationsStart()\n"));
  }
}

// End LocalFieldResolverTest.java
