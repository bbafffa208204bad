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
import exm.ftn.common.lang.Types.Type;

/**
 * The base class for all literal constants.
 *
 * The literal text spans from the location to the max location given by
 * the parser.  A trailing kind selector (e.g. the {@code _8} in
 * {@code 42_8}) may be attached after construction; it extends the range
 * of the constant but not its kind.
 */
public abstract sealed class ConstantExpr extends Expr
    permits IntegerConstantExpr, RealConstantExpr,
            DoublePrecisionConstantExpr, ComplexConstantExpr,
            CharacterConstantExpr, BOZConstantExpr, LogicalConstantExpr {

  private final SourceLocation maxLocation;
  /** Optional kind selector */
  private Expr kindSelector = null;

  protected ConstantExpr(ASTContext context, ExprKind kind, Type type,
                         SourceLocation location,
                         SourceLocation maxLocation) {
    super(context, kind, type, location);
    Preconditions.checkNotNull(maxLocation);
    this.maxLocation = maxLocation;
  }

  /**
   * @return kind selector, or null if none
   */
  public Expr getKindSelector() {
    return kindSelector;
  }

  public void setKindSelector(Expr kindSelector) {
    Preconditions.checkNotNull(kindSelector);
    Preconditions.checkState(this.kindSelector == null,
          "Kind selector already set on %s", this);
    getContext().checkOwned(kindSelector);
    this.kindSelector = kindSelector;
  }

  @Override
  public SourceLocation getMaxLocation() {
    if (kindSelector != null) {
      return kindSelector.getMaxLocation();
    }
    return maxLocation;
  }

  @Override
  public List<Expr> getChildren() {
    if (kindSelector == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(kindSelector);
  }
}
