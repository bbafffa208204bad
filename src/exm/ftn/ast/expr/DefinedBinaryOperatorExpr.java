package exm.ftn.ast.expr;

import com.google.common.base.Preconditions;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.Identifier;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Operators.BinaryOperator;

/**
 * User defined binary operator: a .NAME. b.  The result type comes from
 * the interface implementing the operator, so starts unresolved.
 */
public final class DefinedBinaryOperatorExpr extends BinaryExpr {
  private final Identifier name;

  private DefinedBinaryOperatorExpr(ASTContext context,
          SourceLocation location, Expr lhs, Expr rhs, Identifier name) {
    super(context, ExprKind.DEFINED_BINARY_OPERATOR, location,
          BinaryOperator.DEFINED, null, lhs, rhs);
    this.name = name;
  }

  public static DefinedBinaryOperatorExpr create(ASTContext context,
          SourceLocation location, Expr lhs, Expr rhs, Identifier name) {
    Preconditions.checkNotNull(lhs);
    Preconditions.checkNotNull(rhs);
    Preconditions.checkNotNull(name);
    context.checkOwned(lhs);
    context.checkOwned(rhs);
    return new DefinedBinaryOperatorExpr(context, location, lhs, rhs, name);
  }

  public Identifier getIdentifier() {
    return name;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitDefinedBinaryOperator(this);
  }
}
