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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.trail.Fixture;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.Op;
import net.hydromatic.trail.meta.QueryMetadataTable;
import org.junit.jupiter.api.Test;

/** Tests {@link RevisitEliminator}. */
class RevisitEliminatorTest {
  private final Fixture f = new Fixture();

  @Test void testEliminate() {
    final QueryMetadataTable table = f.nestedOptionalTable();
    final List<Ir.Block> blocks = f.nestedOptionalQuery();
    final List<Ir.Block> blocks2 =
        RevisitEliminator.eliminateRevisits(blocks, table);
    final String expected = ""
        + "  0: QueryRoot({Animal})\n"
        + "  1: MarkLocation(Animal)\n"
        + "  2: Traverse(out_Animal_ParentOf, optional)\n"
        + "  3: Filter((LocalField(name) = $parentName))\n"
        + "  4: MarkLocation(Animal/out_Animal_ParentOf)\n"
        + "  5: Traverse(out_Animal_FedAt, optional, withinOptionalScope)\n"
        + "  6: Filter((LocalField(event_date) >= $since))\n"
        + "  7: MarkLocation(Animal/out_Animal_ParentOf/out_Animal_FedAt)\n"
        + "  8: Backtrack(Animal/out_Animal_ParentOf, optional)\n"
        + "  9: Traverse(out_Animal_OfSpecies, withinOptionalScope)\n"
        + "  10: Filter((LocalField(name) = $species))\n"
        + "  11: MarkLocation(Animal/out_Animal_ParentOf/out_Animal_OfSpecies)\n"
        + "  12: Backtrack(Animal/out_Animal_ParentOf)\n"
        + "  13: Backtrack(Animal, optional)\n"
        + "  14: GlobalOperationsStart()\n"
        + "  15: ConstructResult(name=OutputContextField(Animal.name))\n";
    assertThat(describe(blocks2), is(expected));

    // One block fewer for each MarkLocation of a revisit
    final long revisitMarks = blocks.stream()
        .filter(b -> b.op == Op.MARK_LOCATION
            && table.revisitTranslations()
                .containsKey(((Ir.MarkLocation) b).location))
        .count();
    assertThat(revisitMarks, is(2L));
    assertThat(blocks2, hasSize(blocks.size() - 2));

    // No block refers to a revisit
    for (Ir.Block block : blocks2) {
      for (Object location : IrChecker.referencedLocations(block)) {
        assertThat(table.revisitTranslations().containsKey(location),
            is(false));
      }
    }
  }

  /** Tests that every kind of reference to a revisit is translated, including
   * those inside compound expressions. */
  @Test void testTranslateExpressions() {
    final QueryMetadataTable table = f.singleOptionalTable();
    final List<Ir.Block> blocks =
        ImmutableList.of(ir.queryRoot("Animal"),
            ir.markLocation(f.animal),
            ir.traverse(Ir.Direction.OUT, "Animal_FedAt", true),
            ir.markLocation(f.fedAt),
            ir.backtrack(f.animal, true),
            ir.markLocation(f.animal2),
            ir.filter(
                ir.ternary(ir.contextFieldExistence(f.animal2),
                    ir.equal(ir.contextField(f.animal2.navigateToField("name")),
                        ir.contextField(f.fedAt.navigateToField("name"))),
                    ir.trueLiteral())),
            ir.globalOperationsStart(),
            ir.constructResult(
                ImmutableMap.of("name",
                    ir.outputContextField(f.animal2.navigateToField("name")))));
    final List<Ir.Block> blocks2 =
        RevisitEliminator.eliminateRevisits(blocks, table);
    assertThat(blocks2, hasSize(8));
    assertThat(blocks2.get(5),
        hasToString("Filter((ContextFieldExistence(Animal) ? "
            + "(ContextField(Animal.name) = "
            + "ContextField(Animal/out_Animal_FedAt.name)) : true))"));
    assertThat(blocks2.get(7),
        hasToString("ConstructResult(name=OutputContextField(Animal.name))"));
  }

  /** A fold scope entered at a revisit is entered at the origin instead, in
   * the Fold block, in its MarkLocation and in folded fields. */
  @Test void testFoldEnteredAtRevisit() {
    final QueryMetadataTable table = f.foldAfterOptionalTable();
    final List<Ir.Block> blocks2 =
        RevisitEliminator.eliminateRevisits(f.foldAfterOptionalQuery(),
            table);
    final String expected = ""
        + "  0: QueryRoot({Animal})\n"
        + "  1: MarkLocation(Animal)\n"
        + "  2: Traverse(out_Animal_FedAt, optional)\n"
        + "  3: MarkLocation(Animal/out_Animal_FedAt)\n"
        + "  4: Backtrack(Animal, optional)\n"
        + "  5: Fold(Animal{in_Animal_ParentOf})\n"
        + "  6: Filter((LocalField(name) has_substring $fragment))\n"
        + "  7: MarkLocation(Animal{in_Animal_ParentOf})\n"
        + "  8: Unfold()\n"
        + "  9: GlobalOperationsStart()\n"
        + "  10: ConstructResult("
        + "event_name=OutputContextField(Animal/out_Animal_FedAt.name), "
        + "child_names=FoldedContextField(Animal{in_Animal_ParentOf}.name))\n";
    assertThat(describe(blocks2), is(expected));

    for (Ir.Block block : blocks2) {
      for (BaseLocation location : IrChecker.referencedLocations(block)) {
        final BaseLocation vertex = location instanceof FoldScopeLocation
            ? ((FoldScopeLocation) location).baseLocation
            : location;
        assertThat(table.revisitTranslations().containsKey(vertex),
            is(false));
      }
    }
  }

  /** A fold scope entered at a location that is not a revisit is left
   * alone. */
  @Test void testFoldNotEnteredAtRevisit() {
    final Ir.Fold fold = ir.fold(f.children);
    final Ir.MarkLocation markLocation = ir.markLocation(f.children);
    final List<Ir.Block> blocks =
        ImmutableList.of(ir.queryRoot("Animal"),
            ir.markLocation(f.animal),
            fold,
            markLocation,
            ir.unfold(),
            ir.globalOperationsStart());
    final List<Ir.Block> blocks2 =
        RevisitEliminator.eliminateRevisits(blocks, f.singleOptionalTable());
    assertThat(blocks2, is(blocks));
    assertThat(blocks2.get(2), sameInstance(fold));
    assertThat(blocks2.get(3), sameInstance(markLocation));
  }

  /** With no revisits, the blocks are unchanged. */
  @Test void testNoRevisits() {
    final List<Ir.Block> blocks = f.foldQuery();
    assertThat(RevisitEliminator.eliminateRevisits(blocks, f.foldTable()),
        is(blocks));
  }
}

// End RevisitEliminatorTest.java
