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
import exm.ftn.common.lang.Operators.BinaryOperator;
import exm.ftn.common.lang.Operators.Category;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.CharacterType;
import exm.ftn.common.lang.Types.Type;

/**
 * Binary operator expression.  The location is that of the operator; the
 * range runs from the start of the left operand to the end of the right.
 *
 * The result type is known up front only where the operator alone decides
 * it: relational and logical operators give LOGICAL, and concatenation of
 * two character operands gives CHARACTER.  Arithmetic results depend on
 * type promotion, so are either passed in or resolved later.
 */
public sealed class BinaryExpr extends Expr
    permits DefinedBinaryOperatorExpr {
  private final BinaryOperator op;
  private final Expr lhs;
  private final Expr rhs;

  protected BinaryExpr(ASTContext context, ExprKind kind,
                       SourceLocation location, BinaryOperator op, Type type,
                       Expr lhs, Expr rhs) {
    super(context, kind, type, location);
    this.op = op;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public static BinaryExpr create(ASTContext context, SourceLocation location,
                                  BinaryOperator op, Expr lhs, Expr rhs) {
    checkArgs(context, location, op, lhs, rhs);
    Type type = null;
    if (op.hasLogicalResult()) {
      type = context.getLogicalType();
    } else if (op == BinaryOperator.CONCAT) {
      if (lhs.getType() instanceof CharacterType &&
          rhs.getType() instanceof CharacterType) {
        type = Types.concatType((CharacterType)lhs.getType(),
                                (CharacterType)rhs.getType());
      }
    }
    return new BinaryExpr(context, ExprKind.BINARY, location, op, type,
                          lhs, rhs);
  }

  /**
   * Arithmetic expression with a result type already worked out by the
   * caller.
   */
  public static BinaryExpr create(ASTContext context, SourceLocation location,
          BinaryOperator op, Type type, Expr lhs, Expr rhs) {
    checkArgs(context, location, op, lhs, rhs);
    Preconditions.checkNotNull(type);
    if (op.category() != Category.ARITHMETIC) {
      throw new FTNRuntimeError("Result type of " + op + " at " + location +
                                " is not given by the caller");
    }
    return new BinaryExpr(context, ExprKind.BINARY, location, op, type,
                          lhs, rhs);
  }

  private static void checkArgs(ASTContext context, SourceLocation location,
                                BinaryOperator op, Expr lhs, Expr rhs) {
    Preconditions.checkNotNull(op);
    Preconditions.checkNotNull(lhs);
    Preconditions.checkNotNull(rhs);
    context.checkOwned(lhs);
    context.checkOwned(rhs);
    if (op == BinaryOperator.DEFINED) {
      throw new FTNRuntimeError("Defined binary operator at " + location +
          " must be built as " +
          DefinedBinaryOperatorExpr.class.getSimpleName());
    }
  }

  public BinaryOperator getOperator() {
    return op;
  }

  public Expr getLHS() {
    return lhs;
  }

  public Expr getRHS() {
    return rhs;
  }

  @Override
  public SourceLocation getMinLocation() {
    return lhs.getMinLocation();
  }

  @Override
  public SourceLocation getMaxLocation() {
    return rhs.getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of(lhs, rhs);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitBinary(this);
  }
}
