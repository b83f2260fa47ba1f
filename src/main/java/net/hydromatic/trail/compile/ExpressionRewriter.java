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
package net.hydromatic.trail.compile;

import static java.util.Objects.requireNonNull;

import java.util.function.BiFunction;
import java.util.function.Function;
import net.hydromatic.trail.ir.BaseLocation;
import net.hydromatic.trail.ir.Ir;
import net.hydromatic.trail.ir.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Shuttle that applies a function to every expression in a block.
 *
 * <p>The function is applied bottom-up: to the arguments of an expression
 * first, then to the expression rebuilt from the new arguments. It receives
 * the location that was known when the rewriter was created (for instance, the
 * location that a block's local fields refer to), and must accept every kind
 * of expression, returning those it does not rewrite unchanged.
 *
 * <p>Blocks that contain no expressions, and blocks none of whose
 * expressions change, are returned as is.
 */
public class ExpressionRewriter extends Shuttle {
  private final @Nullable BaseLocation location;
  private final BiFunction<@Nullable BaseLocation, Ir.Exp, Ir.Exp> fn;

  private ExpressionRewriter(@Nullable BaseLocation location,
      BiFunction<@Nullable BaseLocation, Ir.Exp, Ir.Exp> fn) {
    this.location = location;
    this.fn = requireNonNull(fn);
  }

  /** Creates a rewriter whose function does not need a location. */
  public static ExpressionRewriter of(Function<Ir.Exp, Ir.Exp> fn) {
    requireNonNull(fn);
    return new ExpressionRewriter(null, (location, exp) -> fn.apply(exp));
  }

  /** Creates a rewriter that calls a function with a given location. */
  public static ExpressionRewriter at(BaseLocation location,
      BiFunction<BaseLocation, Ir.Exp, Ir.Exp> fn) {
    requireNonNull(location);
    requireNonNull(fn);
    return new ExpressionRewriter(location,
        (location2, exp) -> fn.apply(requireNonNull(location2), exp));
  }

  /** Rewrites the expressions in a block. */
  public Ir.Block rewrite(Ir.Block block) {
    return block.accept(this);
  }

  private Ir.Exp apply(Ir.Exp exp) {
    return requireNonNull(fn.apply(location, exp),
        () -> "rewrite of " + exp + " returned null");
  }

  @Override
  protected Ir.Exp visit(Ir.Literal literal) {
    return apply(super.visit(literal));
  }

  @Override
  protected Ir.Exp visit(Ir.Variable variable) {
    return apply(super.visit(variable));
  }

  @Override
  protected Ir.Exp visit(Ir.LocalField localField) {
    return apply(super.visit(localField));
  }

  @Override
  protected Ir.Exp visit(Ir.ContextField contextField) {
    return apply(super.visit(contextField));
  }

  @Override
  protected Ir.Exp visit(Ir.OutputContextField outputContextField) {
    return apply(super.visit(outputContextField));
  }

  @Override
  protected Ir.Exp visit(Ir.FoldedContextField foldedContextField) {
    return apply(super.visit(foldedContextField));
  }

  @Override
  protected Ir.Exp visit(Ir.ContextFieldExistence contextFieldExistence) {
    return apply(super.visit(contextFieldExistence));
  }

  @Override
  protected Ir.Exp visit(Ir.UnaryTransformation unary) {
    return apply(super.visit(unary));
  }

  @Override
  protected Ir.Exp visit(Ir.BinaryComposition binary) {
    return apply(super.visit(binary));
  }

  @Override
  protected Ir.Exp visit(Ir.TernaryConditional ternary) {
    return apply(super.visit(ternary));
  }
}

// End ExpressionRewriter.java
