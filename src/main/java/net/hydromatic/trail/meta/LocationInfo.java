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

import java.util.Objects;
import net.hydromatic.trail.ir.BaseLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Facts about a location, computed by the front end. */
public class LocationInfo {
  /** Location from which this location was reached; null for the root. */
  public final @Nullable BaseLocation parentLocation;
  /** Name of the declared type of the vertex at this location. */
  public final String type;
  /** Type before the vertex was narrowed by a type coercion, or null. */
  public final @Nullable String coercedFromType;
  /** Number of {@code @optional} scopes that enclose this location. */
  public final int optionalScopesDepth;
  /** Number of {@code @recurse} scopes that enclose this location. */
  public final int recursiveScopesDepth;
  /** Whether this location is inside a {@code @fold} scope. */
  public final boolean withinFold;

  public LocationInfo(@Nullable BaseLocation parentLocation, String type,
      @Nullable String coercedFromType, int optionalScopesDepth,
      int recursiveScopesDepth, boolean withinFold) {
    this.parentLocation = parentLocation;
    this.type = requireNonNull(type, "type");
    this.coercedFromType = coercedFromType;
    this.optionalScopesDepth = optionalScopesDepth;
    this.recursiveScopesDepth = recursiveScopesDepth;
    this.withinFold = withinFold;
    checkArgument(!type.isEmpty(), "empty type name");
    checkArgument(optionalScopesDepth >= 0,
        "negative optional scopes depth %s", optionalScopesDepth);
    checkArgument(recursiveScopesDepth >= 0,
        "negative recursive scopes depth %s", recursiveScopesDepth);
  }

  /** Creates a LocationInfo for a location that is not in a fold or
   * recursive scope and has not been coerced. */
  public static LocationInfo of(@Nullable BaseLocation parentLocation,
      String type, int optionalScopesDepth) {
    return new LocationInfo(parentLocation, type, null, optionalScopesDepth,
        0, false);
  }

  /** Returns a copy of this LocationInfo whose type has been narrowed. */
  public LocationInfo withCoercedType(String type) {
    return new LocationInfo(parentLocation, type, this.type,
        optionalScopesDepth, recursiveScopesDepth, withinFold);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parentLocation, type, coercedFromType,
        optionalScopesDepth, recursiveScopesDepth, withinFold);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof LocationInfo)) {
      return false;
    }
    final LocationInfo that = (LocationInfo) obj;
    return Objects.equals(parentLocation, that.parentLocation)
        && type.equals(that.type)
        && Objects.equals(coercedFromType, that.coercedFromType)
        && optionalScopesDepth == that.optionalScopesDepth
        && recursiveScopesDepth == that.recursiveScopesDepth
        && withinFold == that.withinFold;
  }

  @Override
  public String toString() {
    return "LocationInfo(type=" + type
        + (coercedFromType == null ? "" : ", coercedFrom=" + coercedFromType)
        + ", optionalScopesDepth=" + optionalScopesDepth
        + ", recursiveScopesDepth=" + recursiveScopesDepth
        + (withinFold ? ", withinFold" : "")
        + ")";
  }
}

// End LocationInfo.java
