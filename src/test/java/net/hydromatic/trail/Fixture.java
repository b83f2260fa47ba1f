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
package net.hydromatic.trail;

import static net.hydromatic.trail.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.IrWriter;
import net.hydromatic.trail.ir.Location;
import net.hydromatic.trail.meta.LocationInfo;
import net.hydromatic.trail.meta.QueryMetadataTable;

/**
 * Locations, metadata tables and queries shared by tests.
 *
 * <p>The schema has vertex types "Animal", "FeedingEvent" and "Species";
 * edges "Animal_ParentOf" (Animal to Animal), "Animal_FedAt" (Animal to
 * FeedingEvent) and "Animal_OfSpecies" (Animal to Species).
 */
public class Fixture {
  /** Root of every query. */
  public final Location animal = Location.root("Animal");
  /** Revisit of {@link #animal} after an optional branch. */
  public final Location animal2 = animal.revisit();
  /** Parent of the root. */
  public final Location parent = animal.navigateToSubpath("out_Animal_ParentOf");
  /** Revisit of {@link #parent}. */
  public final Location parent2 = parent.revisit();
  /** Feeding event of the parent. */
  public final Location parentFedAt =
      parent.navigateToSubpath("out_Animal_FedAt");
  /** Species of the parent. */
  public final Location parentSpecies =
      parent.navigateToSubpath("out_Animal_OfSpecies");
  /** Feeding event of the root. */
  public final Location fedAt = animal.navigateToSubpath("out_Animal_FedAt");
  /** Children of the root, in a fold scope. */
  public final FoldScopeLocation children =
      animal.navigateToFold("in_Animal_ParentOf");
  /** Children of the root, in a fold scope entered at a revisit. */
  public final FoldScopeLocation children2 =
      animal2.navigateToFold("in_Animal_ParentOf");

  /** Creates a builder of a metadata table with just the root. */
  public QueryMetadataTable.Builder tableBuilder() {
    return QueryMetadataTable.builder(animal, "Animal");
  }

  /**
   * Returns the metadata table for {@link #singleOptionalQuery()}.
   */
  public QueryMetadataTable singleOptionalTable() {
    return tableBuilder()
        .registerLocation(fedAt, LocationInfo.of(animal, "FeedingEvent", 1))
        .registerLocation(animal2, LocationInfo.of(animal, "Animal", 0))
        .recordRevisit(animal2, animal)
        .build();
  }

  /**
   * Returns a query with a filter inside one optional scope:
   *
   * <blockquote><pre>{@code
   * {
   *   Animal {
   *     name @output(out_name: "name")
   *     out_Animal_FedAt @optional {
   *       name @filter(op_name: "=", value: ["$event"])
   *     }
   *   }
   * }
   * }</pre></blockquote>
   */
  public List<Ir.Block> singleOptionalQuery() {
    return ImmutableList.of(
        ir.queryRoot("Animal"),
        ir.markLocation(animal),
        ir.traverse(Ir.Direction.OUT, "Animal_FedAt", true),
        ir.filter(ir.equal(ir.localField("name"), ir.variable("$event"))),
        ir.markLocation(fedAt),
        ir.backtrack(animal, true),
        ir.markLocation(animal2),
        ir.globalOperationsStart(),
        ir.constructResult(
            ImmutableMap.of("name",
                ir.outputContextField(animal2.navigateToField("name")))));
  }

  /**
   * Returns the metadata table for {@link #nestedOptionalQuery()}.
   */
  public QueryMetadataTable nestedOptionalTable() {
    return tableBuilder()
        .registerLocation(parent, LocationInfo.of(animal, "Animal", 1))
        .registerLocation(parentFedAt,
            LocationInfo.of(parent, "FeedingEvent", 2))
        .registerLocation(parent2, LocationInfo.of(animal, "Animal", 1))
        .registerLocation(parentSpecies,
            LocationInfo.of(parent2, "Species", 1))
        .registerLocation(animal2, LocationInfo.of(animal, "Animal", 0))
        .recordRevisit(parent2, parent)
        .recordRevisit(animal2, animal)
        .build();
  }

  /**
   * Returns a query with two nested optional scopes. There is a filter in the
   * inner scope, and filters in the outer scope before and after it:
   *
   * <blockquote><pre>{@code
   * {
   *   Animal {
   *     name @output(out_name: "name")
   *     out_Animal_ParentOf @optional {
   *       name @filter(op_name: "=", value: ["$parentName"])
   *       out_Animal_FedAt @optional {
   *         event_date @filter(op_name: ">=", value: ["$since"])
   *       }
   *       out_Animal_OfSpecies {
   *         name @filter(op_name: "=", value: ["$species"])
   *       }
   *     }
   *   }
   * }
   * }</pre></blockquote>
   */
  public List<Ir.Block> nestedOptionalQuery() {
    return ImmutableList.of(
        ir.queryRoot("Animal"),
        ir.markLocation(animal),
        ir.traverse(Ir.Direction.OUT, "Animal_ParentOf", true),
        ir.filter(ir.equal(ir.localField("name"), ir.variable("$parentName"))),
        ir.markLocation(parent),
        ir.traverse(Ir.Direction.OUT, "Animal_FedAt", true, true),
        ir.filter(
            ir.binary(">=", ir.localField("event_date"),
                ir.variable("$since"))),
        ir.markLocation(parentFedAt),
        ir.backtrack(parent, true),
        ir.markLocation(parent2),
        ir.traverse(Ir.Direction.OUT, "Animal_OfSpecies", false, true),
        ir.filter(ir.equal(ir.localField("name"), ir.variable("$species"))),
        ir.markLocation(parentSpecies),
        ir.backtrack(parent2),
        ir.backtrack(animal, true),
        ir.markLocation(animal2),
        ir.globalOperationsStart(),
        ir.constructResult(
            ImmutableMap.of("name",
                ir.outputContextField(animal2.navigateToField("name")))));
  }

  /** Returns the metadata table for {@link #foldQuery()}. */
  public QueryMetadataTable foldTable() {
    return tableBuilder()
        .registerLocation(children,
            new LocationInfo(animal, "Animal", null, 0, 0, true))
        .build();
  }

  /** Returns a query with a filter inside a fold scope. */
  public List<Ir.Block> foldQuery() {
    return ImmutableList.of(
        ir.queryRoot("Animal"),
        ir.markLocation(animal),
        ir.fold(children),
        ir.filter(
            ir.binary("has_substring", ir.localField("name"),
                ir.variable("$fragment"))),
        ir.markLocation(children),
        ir.unfold(),
        ir.globalOperationsStart(),
        ir.constructResult(
            ImmutableMap.of("child_names",
                ir.foldedContextField(children.navigateToField("name")))));
  }

  /** Returns the metadata table for {@link #foldAfterOptionalQuery()}. */
  public QueryMetadataTable foldAfterOptionalTable() {
    return tableBuilder()
        .registerLocation(fedAt, LocationInfo.of(animal, "FeedingEvent", 1))
        .registerLocation(animal2, LocationInfo.of(animal, "Animal", 0))
        .registerLocation(children2,
            new LocationInfo(animal2, "Animal", null, 0, 0, true))
        .recordRevisit(animal2, animal)
        .build();
  }

  /**
   * Returns a query whose fold scope is entered at a revisit of the root,
   * because it follows an optional scope:
   *
   * <blockquote><pre>{@code
   * {
   *   Animal {
   *     out_Animal_FedAt @optional {
   *       name @output(out_name: "event_name")
   *     }
   *     in_Animal_ParentOf @fold {
   *       name @filter(op_name: "has_substring", value: ["$fragment"])
   *            @output(out_name: "child_names")
   *     }
   *   }
   * }
   * }</pre></blockquote>
   */
  public List<Ir.Block> foldAfterOptionalQuery() {
    return ImmutableList.of(
        ir.queryRoot("Animal"),
        ir.markLocation(animal),
        ir.traverse(Ir.Direction.OUT, "Animal_FedAt", true),
        ir.markLocation(fedAt),
        ir.backtrack(animal, true),
        ir.markLocation(animal2),
        ir.fold(children2),
        ir.filter(
            ir.binary("has_substring", ir.localField("name"),
                ir.variable("$fragment"))),
        ir.markLocation(children2),
        ir.unfold(),
        ir.globalOperationsStart(),
        ir.constructResult(
            ImmutableMap.of("event_name",
                ir.outputContextField(fedAt.navigateToField("name")),
                "child_names",
                ir.foldedContextField(children2.navigateToField("name")))));
  }

  /** Prints a list of blocks, one per line, each preceded by its index. */
  public static String describe(List<? extends Ir.Block> blocks) {
    return new IrWriter().blocks(blocks, Integer.MAX_VALUE).toString();
  }
}

// End Fixture.java
