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

import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts IR nodes to strings. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string. */
  public IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node. */
  public IrWriter append(IrNode node) {
    return node.unparse(this);
  }

  /** Appends a location. */
  public IrWriter append(BaseLocation location) {
    b.append(location);
    return this;
  }

  /** Appends a set of type names; for example "{Cat, Dog}". */
  IrWriter typeNames(Set<String> names) {
    b.append('{').append(String.join(", ", names)).append('}');
    return this;
  }

  /** Appends an edge with its direction; for example
   * "out_Animal_ParentOf". */
  IrWriter edge(Ir.Direction direction, String edgeName) {
    b.append(direction.prefix()).append('_').append(edgeName);
    return this;
  }

  /** Appends a literal value. Strings are quoted. */
  IrWriter literal(@Nullable Object value) {
    if (value instanceof String) {
      b.append('"')
          .append(((String) value).replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    } else if (value instanceof List) {
      b.append('[');
      int i = 0;
      for (Object o : (List<?>) value) {
        if (i++ > 0) {
          b.append(", ");
        }
        literal(o);
      }
      b.append(']');
    } else {
      b.append(value);
    }
    return this;
  }

  /**
   * Appends a list of blocks, one per line, each preceded by its index.
   *
   * <p>If there are more than {@code printLength} blocks, prints the first
   * {@code printLength} followed by an ellipsis.
   */
  public IrWriter blocks(List<? extends Ir.Block> blocks, int printLength) {
    for (int i = 0; i < blocks.size(); i++) {
      if (i >= printLength) {
        b.append("  ... (")
            .append(blocks.size() - printLength)
            .append(" more)\n");
        break;
      }
      b.append("  ").append(i).append(": ");
      append(blocks.get(i)).append("\n");
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End IrWriter.java
