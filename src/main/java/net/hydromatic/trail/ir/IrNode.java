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

import static java.util.Objects.requireNonNull;

/** Node in the intermediate representation of a query; a block or an
 * expression. */
public abstract class IrNode {
  public final Op op;

  IrNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging, and messages of faults during
   * lowering. Derived classes override {@link #unparse}, not this method.
   */
  @Override
  public final String toString() {
    return unparse(new IrWriter()).toString();
  }

  abstract IrWriter unparse(IrWriter w);

  /**
   * Accepts a visitor, calling the {@code visit} method appropriate to the type
   * of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End IrNode.java
