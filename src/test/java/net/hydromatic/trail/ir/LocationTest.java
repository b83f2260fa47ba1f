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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Location} and {@link FoldScopeLocation}. */
class LocationTest {
  @Test void testNavigate() {
    final Location animal = Location.root("Animal");
    assertThat(animal, hasToString("Animal"));
    assertThat(animal.isField(), is(false));
    assertThat(animal.visitCounter, is(1));

    final Location parent = animal.navigateToSubpath("out_Animal_ParentOf");
    assertThat(parent, hasToString("Animal/out_Animal_ParentOf"));
    assertThat(parent.queryPath.size(), is(2));

    final Location name = parent.navigateToField("name");
    assertThat(name, hasToString("Animal/out_Animal_ParentOf.name"));
    assertThat(name.isField(), is(true));
    assertThat(name.atVertex(), is(parent));
    assertThat(parent.atVertex(), sameInstance(parent));
  }

  @Test void testRevisit() {
    final Location animal = Location.root("Animal");
    final Location animal2 = animal.revisit();
    final Location animal3 = animal2.revisit();
    assertThat(animal2, hasToString("Animal@2"));
    assertThat(animal3.navigateToField("uuid"), hasToString("Animal@3.uuid"));
    assertThat(animal2, not(is(animal)));
    assertThat(animal2, is(animal.revisit()));
    assertThat(animal2.hashCode(), is(animal.revisit().hashCode()));

    // Navigating from a revisit starts a new path with a fresh counter.
    assertThat(animal2.navigateToSubpath("out_Animal_FedAt"),
        is(animal.navigateToSubpath("out_Animal_FedAt")));
  }

  @Test void testFieldLocationsCannotMove() {
    final Location name = Location.root("Animal").navigateToField("name");
    assertThrows(IllegalArgumentException.class,
        () -> name.navigateToSubpath("out_Animal_ParentOf"));
    assertThrows(IllegalArgumentException.class,
        () -> name.navigateToField("uuid"));
    assertThrows(IllegalArgumentException.class, name::revisit);
    assertThrows(IllegalArgumentException.class,
        () -> name.navigateToFold("in_Animal_ParentOf"));
  }

  @Test void testFold() {
    final Location animal = Location.root("Animal");
    final FoldScopeLocation children =
        animal.navigateToFold("in_Animal_ParentOf");
    assertThat(children, hasToString("Animal{in_Animal_ParentOf}"));
    assertThat(children.baseLocation, is(animal));

    final FoldScopeLocation grandchildren =
        children.navigateToSubpath("in_Animal_ParentOf");
    final FoldScopeLocation name = grandchildren.navigateToField("name");
    assertThat(name,
        hasToString("Animal{in_Animal_ParentOf/in_Animal_ParentOf}.name"));
    assertThat(name.atVertex(), is(grandchildren));
    assertThat(name, not(is(children.navigateToField("name"))));
    assertThrows(IllegalArgumentException.class,
        () -> name.navigateToSubpath("out_Animal_FedAt"));

    // Re-basing keeps the fold path and the field
    final Location animal2 = animal.revisit();
    final FoldScopeLocation name2 = name.withBaseLocation(animal2);
    assertThat(name2,
        hasToString("Animal@2{in_Animal_ParentOf/in_Animal_ParentOf}.name"));
    assertThat(name2.withBaseLocation(animal), is(name));
    assertThat(name.withBaseLocation(animal), sameInstance(name));
  }
}

// End LocationTest.java
