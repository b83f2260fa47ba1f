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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds IR nodes. */
public enum IrBuilder {
  /** The singleton instance of the IR builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ir;

  private final Ir.Unfold unfold = new Ir.Unfold();
  private final Ir.EndOptional endOptional = new Ir.EndOptional();
  private final Ir.OutputSource outputSource = new Ir.OutputSource();
  private final Ir.GlobalOperationsStart globalOperationsStart =
      new Ir.GlobalOperationsStart();

  private final Ir.Literal trueLiteral = new Ir.Literal(true);
  private final Ir.Literal falseLiteral = new Ir.Literal(false);
  private final Ir.Literal nullLiteral = new Ir.Literal(null);

  // blocks

  public Ir.QueryRoot queryRoot(String... startClasses) {
    return queryRoot(Arrays.asList(startClasses));
  }

  public Ir.QueryRoot queryRoot(Collection<String> startClasses) {
    return new Ir.QueryRoot(ImmutableSortedSet.copyOf(startClasses));
  }

  /** Creates a block that traverses an edge that is not optional. */
  public Ir.Traverse traverse(Ir.Direction direction, String edgeName) {
    return traverse(direction, edgeName, false, false);
  }

  public Ir.Traverse traverse(Ir.Direction direction, String edgeName,
      boolean optional) {
    return traverse(direction, edgeName, optional, false);
  }

  public Ir.Traverse traverse(Ir.Direction direction, String edgeName,
      boolean optional, boolean withinOptionalScope) {
    return new Ir.Traverse(direction, edgeName, optional,
        withinOptionalScope);
  }

  public Ir.Recurse recurse(Ir.Direction direction, String edgeName,
      int depth) {
    return recurse(direction, edgeName, depth, false);
  }

  public Ir.Recurse recurse(Ir.Direction direction, String edgeName,
      int depth, boolean withinOptionalScope) {
    return new Ir.Recurse(direction, edgeName, depth, withinOptionalScope);
  }

  public Ir.Fold fold(FoldScopeLocation foldScopeLocation) {
    return new Ir.Fold(foldScopeLocation);
  }

  public Ir.Unfold unfold() {
    return unfold;
  }

  public Ir.Backtrack backtrack(Location location) {
    return backtrack(location, false);
  }

  public Ir.Backtrack backtrack(Location location, boolean optional) {
    return new Ir.Backtrack(location, optional);
  }

  public Ir.MarkLocation markLocation(BaseLocation location) {
    return new Ir.MarkLocation(location);
  }

  public Ir.CoerceType coerceType(String... targetClasses) {
    return coerceType(Arrays.asList(targetClasses));
  }

  public Ir.CoerceType coerceType(Collection<String> targetClasses) {
    return new Ir.CoerceType(ImmutableSortedSet.copyOf(targetClasses));
  }

  public Ir.Filter filter(Ir.Exp predicate) {
    return new Ir.Filter(predicate);
  }

  public Ir.EndOptional endOptional() {
    return endOptional;
  }

  public Ir.OutputSource outputSource() {
    return outputSource;
  }

  public Ir.GlobalOperationsStart globalOperationsStart() {
    return globalOperationsStart;
  }

  /** Creates a block that constructs result rows. The order of the fields is
   * preserved. */
  public Ir.ConstructResult constructResult(
      Map<String, ? extends Ir.Exp> fields) {
    return new Ir.ConstructResult(ImmutableMap.copyOf(fields));
  }

  // expressions

  /** Creates a literal.
   *
   * <p>Numbers are converted to {@link BigDecimal}, and lists to immutable
   * lists. */
  public Ir.Literal literal(@Nullable Object value) {
    if (value == null) {
      return nullLiteral;
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? trueLiteral : falseLiteral;
    }
    return new Ir.Literal(normalize(value));
  }

  private static Object normalize(Object value) {
    if (value instanceof BigDecimal) {
      return value;
    }
    if (value instanceof Integer || value instanceof Long) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number) {
      return new BigDecimal(value.toString());
    }
    if (value instanceof List) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object o : (List<?>) value) {
        if (o == null) {
          throw new IllegalArgumentException("null element in list literal");
        }
        b.add(normalize(o));
      }
      return b.build();
    }
    return value;
  }

  public Ir.Literal trueLiteral() {
    return trueLiteral;
  }

  public Ir.Literal falseLiteral() {
    return falseLiteral;
  }

  public Ir.Literal nullLiteral() {
    return nullLiteral;
  }

  public Ir.Variable variable(String name) {
    return new Ir.Variable(name);
  }

  public Ir.LocalField localField(String fieldName) {
    return new Ir.LocalField(fieldName);
  }

  public Ir.ContextField contextField(Location location) {
    return new Ir.ContextField(location);
  }

  public Ir.OutputContextField outputContextField(Location location) {
    return new Ir.OutputContextField(location);
  }

  public Ir.FoldedContextField foldedContextField(
      FoldScopeLocation location) {
    return new Ir.FoldedContextField(location);
  }

  public Ir.ContextFieldExistence contextFieldExistence(Location location) {
    return new Ir.ContextFieldExistence(location);
  }

  public Ir.UnaryTransformation unary(String operator, Ir.Exp inner) {
    return new Ir.UnaryTransformation(operator, inner);
  }

  public Ir.BinaryComposition binary(String operator, Ir.Exp left,
      Ir.Exp right) {
    return new Ir.BinaryComposition(operator, left, right);
  }

  /** Creates an equality comparison. */
  public Ir.BinaryComposition equal(Ir.Exp left, Ir.Exp right) {
    return binary("=", left, right);
  }

  /** Creates a conjunction of two predicates. */
  public Ir.BinaryComposition and(Ir.Exp left, Ir.Exp right) {
    return binary("&&", left, right);
  }

  public Ir.TernaryConditional ternary(Ir.Exp predicate, Ir.Exp ifTrue,
      Ir.Exp ifFalse) {
    return new Ir.TernaryConditional(predicate, ifTrue, ifFalse);
  }
}

// End IrBuilder.java
