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
import exm.ftn.common.lang.Operators.UnaryOperator;
import exm.ftn.common.lang.Types.Type;

/**
 * Unary operator applied to an operand: .NOT. x, +x, -x.  The location
 * is that of the operator.
 */
public sealed class UnaryExpr extends Expr permits DefinedUnaryOperatorExpr {
  private final UnaryOperator op;
  private final Expr operand;

  protected UnaryExpr(ASTContext context, ExprKind kind,
                      SourceLocation location, UnaryOperator op, Type type,
                      Expr operand) {
    super(context, kind, type, location);
    this.op = op;
    this.operand = operand;
  }

  /**
   * @throws FTNRuntimeError for defined operators, which need a name
   */
  public static UnaryExpr create(ASTContext context, SourceLocation location,
                                 UnaryOperator op, Expr operand) {
    Preconditions.checkNotNull(op);
    Preconditions.checkNotNull(operand);
    context.checkOwned(operand);
    if (op == UnaryOperator.DEFINED) {
      throw new FTNRuntimeError("Defined unary operator at " + location +
          " must be built as " + DefinedUnaryOperatorExpr.class.getSimpleName());
    }
    Type type;
    if (op == UnaryOperator.NOT) {
      type = context.getLogicalType();
    } else {
      type = operand.getType();
    }
    return new UnaryExpr(context, ExprKind.UNARY, location, op, type, operand);
  }

  public UnaryOperator getOperator() {
    return op;
  }

  public Expr getOperand() {
    return operand;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return operand.getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of(operand);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitUnary(this);
  }
}
