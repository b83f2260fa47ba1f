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

/** Visits the expressions inside blocks. */
public class Visitor {

  // blocks

  protected void visit(Ir.Filter filter) {
    filter.predicate.accept(this);
  }

  protected void visit(Ir.ConstructResult constructResult) {
    constructResult.fields.values().forEach(exp -> exp.accept(this));
  }

  // expressions

  protected void visit(Ir.Literal literal) {}

  protected void visit(Ir.Variable variable) {}

  protected void visit(Ir.LocalField localField) {}

  protected void visit(Ir.ContextField contextField) {}

  protected void visit(Ir.OutputContextField outputContextField) {}

  protected void visit(Ir.FoldedContextField foldedContextField) {}

  protected void visit(Ir.ContextFieldExistence contextFieldExistence) {}

  protected void visit(Ir.UnaryTransformation unary) {
    unary.inner.accept(this);
  }

  protected void visit(Ir.BinaryComposition binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Ir.TernaryConditional ternary) {
    ternary.predicate.accept(this);
    ternary.ifTrue.accept(this);
    ternary.ifFalse.accept(this);
  }
}

// End Visitor.java
