package exm.ftn.ast.expr;

import com.google.common.base.Preconditions;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.Identifier;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Operators.UnaryOperator;

/**
 * User defined unary operator: .NAME. x
 */
public final class DefinedUnaryOperatorExpr extends UnaryExpr {
  private final Identifier name;

  private DefinedUnaryOperatorExpr(ASTContext context,
          SourceLocation location, Expr operand, Identifier name) {
    super(context, ExprKind.DEFINED_UNARY_OPERATOR, location,
          UnaryOperator.DEFINED, operand.getType(), operand);
    this.name = name;
  }

  public static DefinedUnaryOperatorExpr create(ASTContext context,
          SourceLocation location, Expr operand, Identifier name) {
    Preconditions.checkNotNull(operand);
    Preconditions.checkNotNull(name);
    context.checkOwned(operand);
    return new DefinedUnaryOperatorExpr(context, location, operand, name);
  }

  public Identifier getIdentifier() {
    return name;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitDefinedUnaryOperator(this);
  }
}
