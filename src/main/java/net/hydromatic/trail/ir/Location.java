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
package net.hydromatic.trail.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Location reached by a traversal outside of any fold scope.
 *
 * <p>The query path starts with the name of the root type, followed by the
 * names of the edges traversed from it, each prefixed by its direction (for
 * example "out_Animal_ParentOf"). The visit counter starts at 1 and is
 * incremented each time the front end revisits the same vertex after an
 * optional branch; see {@link #revisit()}.
 */
public class Location extends BaseLocation {
  public final ImmutableList<String> queryPath;
  public final int visitCounter;

  Location(List<String> queryPath, @Nullable String field, int visitCounter) {
    super(field);
    this.queryPath = ImmutableList.copyOf(queryPath);
    this.visitCounter = visitCounter;
    checkArgument(!this.queryPath.isEmpty(), "empty query path");
    checkArgument(visitCounter >= 1, "visit counter must be positive");
  }

  /** Creates the location of the root of a query. */
  public static Location root(String typeName) {
    return new Location(ImmutableList.of(typeName), null, 1);
  }

  /** Returns the location reached by traversing an edge from this vertex. */
  public Location navigateToSubpath(String edge) {
    checkArgument(field == null, "cannot navigate from field location %s",
        this);
    final ImmutableList<String> path =
        ImmutableList.<String>builder().addAll(queryPath).add(edge).build();
    return new Location(path, null, 1);
  }

  /** Returns the location of a fold scope entered by traversing an edge from
   * this vertex. */
  public FoldScopeLocation navigateToFold(String edge) {
    checkArgument(field == null, "cannot fold from field location %s", this);
    return new FoldScopeLocation(this, ImmutableList.of(edge), null);
  }

  /** Returns the location that the front end mints when it returns to this
   * vertex after an optional branch. */
  public Location revisit() {
    checkArgument(field == null, "cannot revisit field location %s", this);
    return new Location(queryPath, null, visitCounter + 1);
  }

  @Override
  public Location navigateToField(String field) {
    checkArgument(this.field == null,
        "location %s already has a field", this);
    return new Location(queryPath, field, visitCounter);
  }

  @Override
  public Location atVertex() {
    return field == null ? this : new Location(queryPath, null, visitCounter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(queryPath, field, visitCounter);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof Location
            && queryPath.equals(((Location) obj).queryPath)
            && Objects.equals(field, ((Location) obj).field)
            && visitCounter == ((Location) obj).visitCounter;
  }

  /** Prints the location; for example "Animal/out_Animal_ParentOf@2.name". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(String.join("/", queryPath));
    if (visitCounter > 1) {
      buf.append('@').append(visitCounter);
    }
    return describeField(buf).toString();
  }
}

// End Location.java
