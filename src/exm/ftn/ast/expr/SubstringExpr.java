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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types;

/**
 * Substring: s(start:end), where either bound may be omitted.
 *
 * The result length is not computed here, so the type is CHARACTER of
 * unknown length until semantic analysis resolves it.
 */
public final class SubstringExpr extends DesignatorExpr {
  private final Expr startingPoint;
  private final Expr endPoint;

  private SubstringExpr(ASTContext context, SourceLocation location,
                        Expr target, Expr startingPoint, Expr endPoint) {
    super(context, ExprKind.SUBSTRING, DesignatorKind.SUBSTRING,
          Types.CHARACTER, location, target);
    this.startingPoint = startingPoint;
    this.endPoint = endPoint;
  }

  /**
   * @param startingPoint first character, null if omitted
   * @param endPoint last character, null if omitted
   */
  public static SubstringExpr create(ASTContext context,
          SourceLocation location, Expr target, Expr startingPoint,
          Expr endPoint) {
    Preconditions.checkNotNull(target);
    context.checkOwned(target);
    context.checkOwned(startingPoint);
    context.checkOwned(endPoint);
    return new SubstringExpr(context, location, target, startingPoint,
                             endPoint);
  }

  public Expr getStartingPoint() {
    return startingPoint;
  }

  public Expr getEndPoint() {
    return endPoint;
  }

  /**
   * Ends at the last bound written, or at the target if s(:).
   */
  @Override
  public SourceLocation getMaxLocation() {
    if (endPoint != null) {
      return endPoint.getMaxLocation();
    } else if (startingPoint != null) {
      return startingPoint.getMaxLocation();
    } else {
      return getTarget().getMaxLocation();
    }
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> children = new ArrayList<Expr>(3);
    children.add(getTarget());
    if (startingPoint != null) {
      children.add(startingPoint);
    }
    if (endPoint != null) {
      children.add(endPoint);
    }
    return Collections.unmodifiableList(children);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitSubstring(this);
  }
}
