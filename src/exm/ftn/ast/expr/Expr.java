/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ftn.ast.expr;

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.ASTNode;
import exm.ftn.ast.SourceLocation;
import exm.ftn.ast.SourceRange;
import exm.ftn.common.Logging;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.lang.Types.Type;

/**
 * Top-level class for expressions.
 *
 * Every expression has a kind tag naming its concrete class, fixed at
 * construction, a type slot that is empty until semantic analysis resolves
 * it, and the location it was parsed at.  Composite expressions widen the
 * single location into a range covering their children.
 *
 * Nodes are only built through the static {@code create} factory of each
 * concrete class, always inside an {@link ASTContext}.  Consumers must check
 * the kind (or use {@link #as(Class)} / an {@link ExprVisitor}) before
 * using anything specific to a variant.
 */
public abstract sealed class Expr extends ASTNode
    permits ConstantExpr, RepeatedConstantExpr, DesignatorExpr, UnaryExpr,
            BinaryExpr, ImplicitCastExpr, IntrinsicCallExpr,
            ArrayConstructorExpr, RangeExpr, UnresolvedIdentifierExpr {

  private static final Logger logger = Logging.getFTNLogger();

  private final ExprKind kind;
  private Type type;
  private final SourceLocation location;

  protected Expr(ASTContext context, ExprKind kind, Type type,
                 SourceLocation location) {
    super(context);
    Preconditions.checkNotNull(location, "Expression needs a location");
    if (kind.nodeClass() != getClass()) {
      throw new FTNRuntimeError("Kind " + kind + " does not match class " +
                                getClass().getSimpleName());
    }
    this.kind = kind;
    this.type = type;
    this.location = location;
  }

  public ExprKind getKind() {
    return kind;
  }

  /**
   * @return the type, or null if semantic analysis has not resolved it
   */
  public Type getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  /**
   * Type for consumers that run after semantic analysis
   * @throws FTNRuntimeError if the type was never resolved
   */
  public Type requireType() {
    if (type == null) {
      throw new FTNRuntimeError("Type of " + kind + " expression " +
                                print() + " at " + location +
                                " was never resolved");
    }
    return type;
  }

  /**
   * Set the type determined by semantic analysis.  Re-analysis after an
   * error may resolve the same node again.
   */
  public void resolveType(Type newType) {
    Preconditions.checkNotNull(newType, "Cannot resolve type to null");
    if (type != null && !type.equals(newType) && logger.isTraceEnabled()) {
      logger.trace("Overwriting type of " + print() + " at " + location +
                   ": " + type.typeName() + " => " + newType.typeName());
    }
    type = newType;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public SourceLocation getMinLocation() {
    return location;
  }

  public SourceLocation getMaxLocation() {
    return location;
  }

  /**
   * @return closed range from min to max location
   */
  public SourceRange getSourceRange() {
    return new SourceRange(getMinLocation(), getMaxLocation());
  }

  /**
   * @return direct subexpressions in source order
   */
  public abstract List<Expr> getChildren();

  public abstract <T> T accept(ExprVisitor<T> visitor);

  /**
   * @return true if this is an instance of exprClass
   */
  public boolean is(Class<? extends Expr> exprClass) {
    return exprClass.isAssignableFrom(kind.nodeClass());
  }

  /**
   * Checked downcast.
   * @throws FTNRuntimeError if this expression is not an exprClass
   */
  public <T extends Expr> T as(Class<T> exprClass) {
    if (!is(exprClass)) {
      throw new FTNRuntimeError("Expected " + exprClass.getSimpleName() +
              " but " + print() + " at " + location + " is " + kind);
    }
    return exprClass.cast(this);
  }

  /**
   * @return this cast to exprClass, or null if not an instance
   */
  public <T extends Expr> T dynCast(Class<T> exprClass) {
    if (!is(exprClass)) {
      return null;
    }
    return exprClass.cast(this);
  }

  /**
   * Text of expression for diagnostics.  Not guaranteed to be valid source.
   */
  public String print() {
    StringBuilder sb = new StringBuilder();
    print(sb);
    return sb.toString();
  }

  public void print(StringBuilder sb) {
    accept(new ExprPrinter(sb));
  }

  public void dump() {
    logger.debug(kind + " " + getSourceRange() + ": " + print());
  }

  @Override
  public String toString() {
    return print();
  }
}
