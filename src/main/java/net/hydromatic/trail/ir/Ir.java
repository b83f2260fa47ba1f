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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.trail.ir.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Blocks and expressions of the intermediate representation (IR).
 *
 * <p>A compiled query is a list of {@link Block}s, one per step of the
 * traversal, some of which contain {@link Exp expressions}. Every node has an
 * {@link Op}, so that passes can {@code switch} over the kinds of node. This
 * class functions as a namespace, so that we can keep the class names short.
 *
 * <p>Nodes are immutable. Create them using {@link IrBuilder#ir}.
 */
public class Ir {
  private Ir() {}

  /** Direction in which an edge is traversed. */
  public enum Direction {
    OUT,
    IN;

    /** Returns "out" or "in". */
    public String prefix() {
      return this == OUT ? "out" : "in";
    }
  }

  /** Abstract base class of blocks. */
  public abstract static class Block extends IrNode {
    Block(Op op) {
      super(op);
      checkArgument(op.block, "not a block: %s", op);
    }

    /**
     * Accepts a shuttle, returning a block whose expressions have been
     * rewritten by the shuttle.
     *
     * <p>Returns this block if it contains no expressions, or if the shuttle
     * changed none of them.
     */
    public Block accept(Shuttle shuttle) {
      return this;
    }

    @Override
    public void accept(Visitor visitor) {
      // no expressions
    }
  }

  /** Abstract base class of blocks that have no payload. There is one
   * instance of each, in {@link IrBuilder}. */
  abstract static class MarkerBlock extends Block {
    MarkerBlock(Op op) {
      super(op);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("()");
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof MarkerBlock && ((MarkerBlock) obj).op == op;
    }
  }

  /** Root of a traversal; the vertex at which the query starts. */
  public static class QueryRoot extends Block {
    public final ImmutableSortedSet<String> startClasses;

    QueryRoot(ImmutableSortedSet<String> startClasses) {
      super(Op.QUERY_ROOT);
      this.startClasses = startClasses;
      checkArgument(!startClasses.isEmpty(), "no start classes");
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(")
          .typeNames(startClasses).append(")");
    }

    @Override
    public int hashCode() {
      return startClasses.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof QueryRoot
              && startClasses.equals(((QueryRoot) obj).startClasses);
    }
  }

  /** Follows an edge from the current vertex. */
  public static class Traverse extends Block {
    public final Direction direction;
    public final String edgeName;
    /** Whether the edge is {@code @optional}; if the edge does not exist, the
     * row is kept. */
    public final boolean optional;
    /** Whether this traversal is inside an enclosing optional scope. */
    public final boolean withinOptionalScope;

    Traverse(Direction direction, String edgeName, boolean optional,
        boolean withinOptionalScope) {
      super(Op.TRAVERSE);
      this.direction = requireNonNull(direction);
      this.edgeName = requireNonNull(edgeName);
      this.optional = optional;
      this.withinOptionalScope = withinOptionalScope;
    }

    @Override
    IrWriter unparse(IrWriter w) {
      w.append(op.displayName).append("(").edge(direction, edgeName);
      if (optional) {
        w.append(", optional");
      }
      if (withinOptionalScope) {
        w.append(", withinOptionalScope");
      }
      return w.append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(direction, edgeName, optional, withinOptionalScope);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Traverse
              && direction == ((Traverse) obj).direction
              && edgeName.equals(((Traverse) obj).edgeName)
              && optional == ((Traverse) obj).optional
              && withinOptionalScope == ((Traverse) obj).withinOptionalScope;
    }
  }

  /** Follows an edge repeatedly, up to a given depth. */
  public static class Recurse extends Block {
    public final Direction direction;
    public final String edgeName;
    public final int depth;
    public final boolean withinOptionalScope;

    Recurse(Direction direction, String edgeName, int depth,
        boolean withinOptionalScope) {
      super(Op.RECURSE);
      this.direction = requireNonNull(direction);
      this.edgeName = requireNonNull(edgeName);
      this.depth = depth;
      this.withinOptionalScope = withinOptionalScope;
      checkArgument(depth >= 1, "depth must be at least 1, was %s", depth);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      w.append(op.displayName).append("(").edge(direction, edgeName)
          .append(", depth=").append(Integer.toString(depth));
      if (withinOptionalScope) {
        w.append(", withinOptionalScope");
      }
      return w.append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(direction, edgeName, depth, withinOptionalScope);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Recurse
              && direction == ((Recurse) obj).direction
              && edgeName.equals(((Recurse) obj).edgeName)
              && depth == ((Recurse) obj).depth
              && withinOptionalScope == ((Recurse) obj).withinOptionalScope;
    }
  }

  /** Enters a {@code @fold} scope. */
  public static class Fold extends Block {
    public final FoldScopeLocation foldScopeLocation;

    Fold(FoldScopeLocation foldScopeLocation) {
      super(Op.FOLD);
      this.foldScopeLocation = foldScopeLocation;
      checkArgument(!foldScopeLocation.isField(),
          "fold location must be a vertex: %s", foldScopeLocation);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(")
          .append(foldScopeLocation).append(")");
    }

    @Override
    public int hashCode() {
      return foldScopeLocation.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Fold
              && foldScopeLocation.equals(((Fold) obj).foldScopeLocation);
    }
  }

  /** Leaves a {@code @fold} scope. */
  public static class Unfold extends MarkerBlock {
    Unfold() {
      super(Op.UNFOLD);
    }
  }

  /** Returns to a previously visited location after a branch completes. */
  public static class Backtrack extends Block {
    public final Location location;
    /** Whether the branch being left was optional. */
    public final boolean optional;

    Backtrack(Location location, boolean optional) {
      super(Op.BACKTRACK);
      this.location = location;
      this.optional = optional;
      checkArgument(!location.isField(),
          "cannot backtrack to field location %s", location);
    }

    /** Returns a copy of this block that backtracks to a different location,
     * or this block if the location is the same. */
    public Backtrack copy(Location location) {
      return location.equals(this.location) ? this
          : ir.backtrack(location, optional);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      w.append(op.displayName).append("(").append(location);
      if (optional) {
        w.append(", optional");
      }
      return w.append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(location, optional);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Backtrack
              && location.equals(((Backtrack) obj).location)
              && optional == ((Backtrack) obj).optional;
    }
  }

  /** Binds the current point of the traversal to a location. */
  public static class MarkLocation extends Block {
    public final BaseLocation location;

    MarkLocation(BaseLocation location) {
      super(Op.MARK_LOCATION);
      this.location = location;
      checkArgument(!location.isField(),
          "cannot mark field location %s", location);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(").append(location)
          .append(")");
    }

    @Override
    public int hashCode() {
      return location.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof MarkLocation
              && location.equals(((MarkLocation) obj).location);
    }
  }

  /** Narrows the type at the current point to one of a set of types. */
  public static class CoerceType extends Block {
    public final ImmutableSortedSet<String> targetClasses;

    CoerceType(ImmutableSortedSet<String> targetClasses) {
      super(Op.COERCE_TYPE);
      this.targetClasses = targetClasses;
      checkArgument(!targetClasses.isEmpty(), "no target classes");
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(")
          .typeNames(targetClasses).append(")");
    }

    @Override
    public int hashCode() {
      return targetClasses.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof CoerceType
              && targetClasses.equals(((CoerceType) obj).targetClasses);
    }
  }

  /** Predicate that must hold for the current point to remain in the
   * result. */
  public static class Filter extends Block {
    public final Exp predicate;

    Filter(Exp predicate) {
      super(Op.FILTER);
      this.predicate = requireNonNull(predicate);
    }

    /** Returns a copy of this filter with a different predicate, or this
     * filter if the predicate is the same. */
    public Filter copy(Exp predicate) {
      return predicate == this.predicate ? this : ir.filter(predicate);
    }

    @Override
    public Filter accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(").append(predicate)
          .append(")");
    }

    @Override
    public int hashCode() {
      return predicate.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Filter
              && predicate.equals(((Filter) obj).predicate);
    }
  }

  /** Marks the end of an optional traversal. */
  public static class EndOptional extends MarkerBlock {
    EndOptional() {
      super(Op.END_OPTIONAL);
    }
  }

  /** Marks the vertex that is the source of output rows. */
  public static class OutputSource extends MarkerBlock {
    OutputSource() {
      super(Op.OUTPUT_SOURCE);
    }
  }

  /** Marks the end of per-path operations and the start of query-wide
   * operations. Exactly one occurs in each query. */
  public static class GlobalOperationsStart extends MarkerBlock {
    GlobalOperationsStart() {
      super(Op.GLOBAL_OPERATIONS_START);
    }
  }

  /** Builds each result row from named expressions. */
  public static class ConstructResult extends Block {
    public final ImmutableMap<String, Exp> fields;

    ConstructResult(ImmutableMap<String, Exp> fields) {
      super(Op.CONSTRUCT_RESULT);
      this.fields = fields;
      checkArgument(!fields.isEmpty(), "no output fields");
    }

    /** Returns a copy of this block with different expressions, or this block
     * if every expression is the same. */
    public ConstructResult copy(Map<String, Exp> fields) {
      if (fields.size() == this.fields.size()) {
        boolean same = true;
        for (Map.Entry<String, Exp> entry : this.fields.entrySet()) {
          if (fields.get(entry.getKey()) != entry.getValue()) {
            same = false;
            break;
          }
        }
        if (same) {
          return this;
        }
      }
      return ir.constructResult(fields);
    }

    @Override
    public ConstructResult accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      w.append(op.displayName).append("(");
      int i = 0;
      for (Map.Entry<String, Exp> entry : fields.entrySet()) {
        w.append(i++ == 0 ? "" : ", ")
            .append(entry.getKey()).append("=").append(entry.getValue());
      }
      return w.append(")");
    }

    @Override
    public int hashCode() {
      return fields.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof ConstructResult
              && fields.equals(((ConstructResult) obj).fields);
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Exp extends IrNode {
    Exp(Op op) {
      super(op);
      checkArgument(!op.block, "not an expression: %s", op);
    }

    /** Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
     * to the type of this expression, and returning the result. */
    public abstract Exp accept(Shuttle shuttle);
  }

  /** Constant value.
   *
   * <p>The value is null, a {@link Boolean}, a {@link BigDecimal}, a
   * {@link String}, or an immutable list of such values. */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(Op.LITERAL);
      this.value = value;
      checkArgument(validValue(value), "invalid literal value %s", value);
    }

    private static boolean validValue(@Nullable Object value) {
      if (value instanceof ImmutableList) {
        for (Object o : (List<?>) value) {
          if (!validValue(o)) {
            return false;
          }
        }
        return true;
      }
      return value == null
          || value instanceof Boolean
          || value instanceof BigDecimal
          || value instanceof String;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.literal(value);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Literal
              && Objects.equals(value, ((Literal) obj).value);
    }
  }

  /** Parameter whose value is supplied at run time; for example
   * "$minAge". */
  public static class Variable extends Exp {
    public final String name;

    Variable(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
      checkArgument(name.length() > 1 && name.startsWith("$"),
          "variable name must start with '$': %s", name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof Variable && name.equals(((Variable) obj).name);
    }
  }

  /** Field at whichever location is currently open.
   *
   * <p>Only meaningful while the position of a block in the list determines
   * the location it refers to; {@code LocalFieldResolver} replaces each with
   * a {@link ContextField} or {@link FoldedContextField}. */
  public static class LocalField extends Exp {
    public final String fieldName;

    LocalField(String fieldName) {
      super(Op.LOCAL_FIELD);
      this.fieldName = requireNonNull(fieldName);
      checkArgument(!fieldName.isEmpty(), "empty field name");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(").append(fieldName)
          .append(")");
    }

    @Override
    public int hashCode() {
      return fieldName.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof LocalField
              && fieldName.equals(((LocalField) obj).fieldName);
    }
  }

  /** Abstract base class of expressions that read a field at an explicit
   * location. */
  public abstract static class LocatedField<L extends BaseLocation>
      extends Exp {
    public final L location;

    LocatedField(Op op, L location) {
      super(op);
      this.location = requireNonNull(location);
      checkArgument(location.isField(),
          "location of %s must have a field: %s", op.displayName, location);
    }

    /** Returns the name of the field. */
    public String fieldName() {
      return requireNonNull(location.field);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(").append(location)
          .append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, location);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof LocatedField
              && op == ((LocatedField<?>) obj).op
              && location.equals(((LocatedField<?>) obj).location);
    }
  }

  /** Field read at an explicit location outside any fold scope. */
  public static class ContextField extends LocatedField<Location> {
    ContextField(Location location) {
      super(Op.CONTEXT_FIELD, location);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field that is part of the output of a query. */
  public static class OutputContextField extends LocatedField<Location> {
    OutputContextField(Location location) {
      super(Op.OUTPUT_CONTEXT_FIELD, location);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field read at a location inside a fold scope; its value is the list of
   * values over all paths in the fold. */
  public static class FoldedContextField
      extends LocatedField<FoldScopeLocation> {
    FoldedContextField(FoldScopeLocation location) {
      super(Op.FOLDED_CONTEXT_FIELD, location);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether the vertex at a location (usually reached by an optional edge)
   * exists. */
  public static class ContextFieldExistence extends Exp {
    public final Location location;

    ContextFieldExistence(Location location) {
      super(Op.CONTEXT_FIELD_EXISTENCE);
      this.location = requireNonNull(location);
      checkArgument(!location.isField(),
          "existence applies to vertices, not fields: %s", location);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(op.displayName).append("(").append(location)
          .append(")");
    }

    @Override
    public int hashCode() {
      return location.hashCode();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof ContextFieldExistence
              && location.equals(((ContextFieldExistence) obj).location);
    }
  }

  /** Applies a unary operator to an expression. */
  public static class UnaryTransformation extends Exp {
    /** Allowed operators. */
    public static final ImmutableSet<String> OPERATORS =
        ImmutableSet.of("size");

    public final String operator;
    public final Exp inner;

    UnaryTransformation(String operator, Exp inner) {
      super(Op.UNARY_TRANSFORMATION);
      this.operator = requireNonNull(operator);
      this.inner = requireNonNull(inner);
      checkArgument(OPERATORS.contains(operator),
          "unknown unary operator %s", operator);
    }

    public UnaryTransformation copy(Exp inner) {
      return inner == this.inner ? this : ir.unary(operator, inner);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append(operator).append("(").append(inner).append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, inner);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof UnaryTransformation
              && operator.equals(((UnaryTransformation) obj).operator)
              && inner.equals(((UnaryTransformation) obj).inner);
    }
  }

  /** Applies a binary operator to two expressions. */
  public static class BinaryComposition extends Exp {
    /** Allowed operators. */
    public static final ImmutableSet<String> OPERATORS =
        ImmutableSet.of("=", "!=", "<", "<=", ">", ">=", "&&", "||",
            "contains", "not_contains", "intersects", "has_substring",
            "starts_with", "ends_with", "LIKE", "INSIDE");

    public final String operator;
    public final Exp left;
    public final Exp right;

    BinaryComposition(String operator, Exp left, Exp right) {
      super(Op.BINARY_COMPOSITION);
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(OPERATORS.contains(operator),
          "unknown binary operator %s", operator);
    }

    public BinaryComposition copy(Exp left, Exp right) {
      return left == this.left && right == this.right ? this
          : ir.binary(operator, left, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append("(").append(left).append(" ").append(operator)
          .append(" ").append(right).append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, left, right);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof BinaryComposition
              && operator.equals(((BinaryComposition) obj).operator)
              && left.equals(((BinaryComposition) obj).left)
              && right.equals(((BinaryComposition) obj).right);
    }
  }

  /** Evaluates one of two expressions, depending on a predicate. */
  public static class TernaryConditional extends Exp {
    public final Exp predicate;
    public final Exp ifTrue;
    public final Exp ifFalse;

    TernaryConditional(Exp predicate, Exp ifTrue, Exp ifFalse) {
      super(Op.TERNARY_CONDITIONAL);
      this.predicate = requireNonNull(predicate);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    public TernaryConditional copy(Exp predicate, Exp ifTrue, Exp ifFalse) {
      return predicate == this.predicate
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : ir.ternary(predicate, ifTrue, ifFalse);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    IrWriter unparse(IrWriter w) {
      return w.append("(").append(predicate).append(" ? ").append(ifTrue)
          .append(" : ").append(ifFalse).append(")");
    }

    @Override
    public int hashCode() {
      return Objects.hash(predicate, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof TernaryConditional
              && predicate.equals(((TernaryConditional) obj).predicate)
              && ifTrue.equals(((TernaryConditional) obj).ifTrue)
              && ifFalse.equals(((TernaryConditional) obj).ifFalse);
    }
  }
}

// End Ir.java
