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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Visits and transforms the expressions inside blocks.
 *
 * <p>Each expression is rebuilt only if one of its arguments changed; if
 * nothing changes, the shuttle returns the original node.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  // blocks

  protected Ir.Filter visit(Ir.Filter filter) {
    return filter.copy(filter.predicate.accept(this));
  }

  protected Ir.ConstructResult visit(Ir.ConstructResult constructResult) {
    final Map<String, Ir.Exp> fields = new LinkedHashMap<>();
    constructResult.fields.forEach((name, exp) ->
        fields.put(name, exp.accept(this)));
    return constructResult.copy(fields);
  }

  // expressions

  protected Ir.Exp visit(Ir.Literal literal) {
    return literal; // leaf
  }

  protected Ir.Exp visit(Ir.Variable variable) {
    return variable; // leaf
  }

  protected Ir.Exp visit(Ir.LocalField localField) {
    return localField; // leaf
  }

  protected Ir.Exp visit(Ir.ContextField contextField) {
    return contextField; // leaf
  }

  protected Ir.Exp visit(Ir.OutputContextField outputContextField) {
    return outputContextField; // leaf
  }

  protected Ir.Exp visit(Ir.FoldedContextField foldedContextField) {
    return foldedContextField; // leaf
  }

  protected Ir.Exp visit(Ir.ContextFieldExistence contextFieldExistence) {
    return contextFieldExistence; // leaf
  }

  protected Ir.Exp visit(Ir.UnaryTransformation unary) {
    return unary.copy(unary.inner.accept(this));
  }

  protected Ir.Exp visit(Ir.BinaryComposition binary) {
    return binary.copy(binary.left.accept(this), binary.right.accept(this));
  }

  protected Ir.Exp visit(Ir.TernaryConditional ternary) {
    return ternary.copy(ternary.predicate.accept(this),
        ternary.ifTrue.accept(this), ternary.ifFalse.accept(this));
  }
}

// End Shuttle.java
