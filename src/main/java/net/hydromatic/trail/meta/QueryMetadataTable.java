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
package net.hydromatic.trail.meta;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.trail.compile.LoweringException;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.FoldScopeLocation;
import net.hydromatic.trail.ir.Location;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Facts about the locations of a query, computed by the front end.
 *
 * <p>The table is immutable; lowering passes consult it but never change it.
 * Create one using {@link #builder}.
 */
public class QueryMetadataTable {
  public final Location rootLocation;
  private final ImmutableMap<BaseLocation, LocationInfo> locationInfos;
  /** Maps each revisit location to the location it directly revisits. */
  private final ImmutableMap<Location, Location> revisitOrigins;
  /** Maps each revisit location to the first visit of its vertex. */
  private final ImmutableMap<Location, Location> revisitTranslations;

  private QueryMetadataTable(Location rootLocation,
      ImmutableMap<BaseLocation, LocationInfo> locationInfos,
      ImmutableMap<Location, Location> revisitOrigins) {
    this.rootLocation = rootLocation;
    this.locationInfos = locationInfos;
    this.revisitOrigins = revisitOrigins;

    final ImmutableMap.Builder<Location, Location> b = ImmutableMap.builder();
    revisitOrigins.keySet().forEach(revisit ->
        b.put(revisit, getRevisitOrigin(revisit)));
    this.revisitTranslations = b.build();
  }

  /** Creates a builder for a table whose root is the given location. */
  public static Builder builder(Location rootLocation, String rootType) {
    return new Builder(rootLocation, LocationInfo.of(null, rootType, 0));
  }

  /**
   * Returns the information about a location.
   *
   * <p>A location with a field is looked up at its vertex.
   *
   * @throws LoweringException if the location is not registered; the blocks
   *   refer to a location that the front end did not record
   */
  public LocationInfo getLocationInfo(BaseLocation location) {
    final LocationInfo info = locationInfos.get(location.atVertex());
    if (info == null) {
      throw LoweringException.malformed("location " + location
          + " is not registered in the query metadata table");
    }
    return info;
  }

  /** Returns whether a location is registered. */
  public boolean isRegistered(BaseLocation location) {
    return locationInfos.containsKey(location.atVertex());
  }

  /** Returns all registered locations, in the order they were registered. */
  public ImmutableSet<BaseLocation> registeredLocations() {
    return locationInfos.keySet();
  }

  /** Returns the location that a revisit location revisits, following chains
   * of revisits to the first visit; or the location itself if it is not a
   * revisit. */
  public Location getRevisitOrigin(Location location) {
    Location origin = location;
    for (;;) {
      final @Nullable Location next = revisitOrigins.get(origin);
      if (next == null) {
        return origin;
      }
      origin = next;
    }
  }

  /** Returns a map from each revisit location to the location it revisits.
   * Chains of revisits are resolved, so no value is itself a key. */
  public ImmutableMap<Location, Location> revisitTranslations() {
    return revisitTranslations;
  }

  /** Builder for {@link QueryMetadataTable}. */
  public static class Builder {
    private final Location rootLocation;
    private final Map<BaseLocation, LocationInfo> locationInfos =
        new LinkedHashMap<>();
    private final Map<Location, Location> revisitOrigins =
        new LinkedHashMap<>();

    private Builder(Location rootLocation, LocationInfo rootInfo) {
      this.rootLocation = requireNonNull(rootLocation);
      registerLocation(rootLocation, rootInfo);
    }

    /** Records the information about a location. Each location may be
     * registered only once. A location is within a fold if and only if it
     * is a {@link FoldScopeLocation}. */
    public Builder registerLocation(BaseLocation location,
        LocationInfo info) {
      checkArgument(!location.isField(),
          "cannot register field location %s", location);
      checkArgument(!locationInfos.containsKey(location),
          "location %s is already registered", location);
      checkArgument(
          info.withinFold == (location instanceof FoldScopeLocation),
          "location %s has withinFold=%s", location, info.withinFold);
      locationInfos.put(location, requireNonNull(info));
      return this;
    }

    /** Records that a location's vertex has been narrowed to a subtype. */
    public Builder recordCoercion(BaseLocation location, String type) {
      final LocationInfo info = locationInfos.get(location);
      checkArgument(info != null, "location %s is not registered", location);
      locationInfos.put(location, info.withCoercedType(type));
      return this;
    }

    /** Records that {@code revisit} is a revisit of {@code origin}. Both must
     * already be registered. */
    public Builder recordRevisit(Location revisit, Location origin) {
      checkArgument(locationInfos.containsKey(revisit),
          "revisit location %s is not registered", revisit);
      checkArgument(locationInfos.containsKey(origin),
          "origin location %s is not registered", origin);
      checkArgument(!revisitOrigins.containsKey(revisit),
          "location %s already has a revisit origin", revisit);
      for (@Nullable Location o = origin; o != null;
           o = revisitOrigins.get(o)) {
        checkArgument(!o.equals(revisit),
            "location %s cannot revisit itself", revisit);
      }
      revisitOrigins.put(revisit, origin);
      return this;
    }

    public QueryMetadataTable build() {
      return new QueryMetadataTable(rootLocation,
          ImmutableMap.copyOf(locationInfos),
          ImmutableMap.copyOf(revisitOrigins));
    }
  }
}

// End QueryMetadataTable.java
