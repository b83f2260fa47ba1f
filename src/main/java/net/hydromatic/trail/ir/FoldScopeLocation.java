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
 * Location inside a {@code @fold} scope.
 *
 * <p>A field read at a fold-scope location yields the list of values
 * aggregated over every path through the fold, rather than a scalar.
 */
public class FoldScopeLocation extends BaseLocation {
  /** The location at which the fold scope was entered. */
  public final Location baseLocation;
  /** Edges traversed since the fold scope was entered; never empty. */
  public final ImmutableList<String> foldPath;

  FoldScopeLocation(Location baseLocation, List<String> foldPath,
      @Nullable String field) {
    super(field);
    checkArgument(!baseLocation.isField(),
        "fold scope must start at a vertex: %s", baseLocation);
    this.baseLocation = baseLocation;
    this.foldPath = ImmutableList.copyOf(foldPath);
    checkArgument(!this.foldPath.isEmpty(), "empty fold path");
  }

  /** Returns the location reached by traversing a further edge inside this
   * fold scope. */
  public FoldScopeLocation navigateToSubpath(String edge) {
    checkArgument(field == null, "cannot navigate from field location %s",
        this);
    final ImmutableList<String> path =
        ImmutableList.<String>builder().addAll(foldPath).add(edge).build();
    return new FoldScopeLocation(baseLocation, path, null);
  }

  /** Returns a location with the same fold path and field whose fold scope
   * is entered at a different vertex. */
  public FoldScopeLocation withBaseLocation(Location baseLocation) {
    return baseLocation.equals(this.baseLocation) ? this
        : new FoldScopeLocation(baseLocation, foldPath, field);
  }

  @Override
  public FoldScopeLocation navigateToField(String field) {
    checkArgument(this.field == null,
        "location %s already has a field", this);
    return new FoldScopeLocation(baseLocation, foldPath, field);
  }

  @Override
  public FoldScopeLocation atVertex() {
    return field == null ? this
        : new FoldScopeLocation(baseLocation, foldPath, null);
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseLocation, foldPath, field);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof FoldScopeLocation
            && baseLocation.equals(((FoldScopeLocation) obj).baseLocation)
            && foldPath.equals(((FoldScopeLocation) obj).foldPath)
            && Objects.equals(field, ((FoldScopeLocation) obj).field);
  }

  /** Prints the location; for example
   * "Animal{out_Animal_ParentOf/in_Entity_Related}.name". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(baseLocation.toString())
        .append('{')
        .append(String.join("/", foldPath))
        .append('}');
    return describeField(buf).toString();
  }
}

// End FoldScopeLocation.java
