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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Position reached by a traversal, optionally qualified by a field read at that
 * position.
 *
 * <p>Locations are created by the front end and are immutable. There are two
 * kinds: {@link Location} and {@link FoldScopeLocation}.
 */
public abstract class BaseLocation {
  /** Name of the field read at this location, or null if this location
   * denotes a vertex. */
  public final @Nullable String field;

  BaseLocation(@Nullable String field) {
    checkArgument(field == null || !field.isEmpty(), "empty field name");
    this.field = field;
  }

  /** Returns whether this location is qualified by a field. */
  public boolean isField() {
    return field != null;
  }

  /** Returns a location that reads the given field at this vertex.
   *
   * @throws IllegalArgumentException if this location already has a field */
  public abstract BaseLocation navigateToField(String field);

  /** Returns the vertex location, without a field. */
  public abstract BaseLocation atVertex();

  /** Appends the field suffix, if any. */
  StringBuilder describeField(StringBuilder buf) {
    return field == null ? buf : buf.append('.').append(field);
  }
}

// End BaseLocation.java
