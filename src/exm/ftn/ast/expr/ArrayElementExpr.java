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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.Type;

/**
 * Array element: a(i, j).  The element type is taken from the target's
 * array type, so the target's type must already be resolved.
 */
public final class ArrayElementExpr extends DesignatorExpr {
  private final List<Expr> subscripts;

  private ArrayElementExpr(ASTContext context, SourceLocation location,
                           Type elementType, Expr target,
                           List<Expr> subscripts) {
    super(context, ExprKind.ARRAY_ELEMENT, DesignatorKind.ARRAY_ELEMENT,
          elementType, location, target);
    this.subscripts = subscripts;
  }

  /**
   * @throws FTNRuntimeError if target type is unresolved or not an array,
   *          or if there are no subscripts
   */
  public static ArrayElementExpr create(ASTContext context,
          SourceLocation location, Expr target, List<? extends Expr> subscripts) {
    Preconditions.checkNotNull(target);
    context.checkOwned(target);
    if (subscripts == null || subscripts.isEmpty()) {
      throw new FTNRuntimeError("Array element " + target.print() + " at " +
                                location + " has no subscripts");
    }
    if (!target.hasType()) {
      throw new FTNRuntimeError("Type of array " + target.print() + " at " +
                location + " must be resolved before subscripting");
    }
    Type targetType = target.getType();
    if (!Types.isArray(targetType)) {
      throw new FTNRuntimeError("Subscripted " + target.print() + " at " +
            location + " is not an array: " + targetType.typeName());
    }
    context.checkAllOwned(subscripts);
    return new ArrayElementExpr(context, location,
            targetType.elementType(), target,
            ImmutableList.<Expr>copyOf(subscripts));
  }

  public List<Expr> getSubscripts() {
    return subscripts;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return subscripts.get(subscripts.size() - 1).getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.<Expr>builder().add(getTarget())
                        .addAll(subscripts).build();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitArrayElement(this);
  }
}
