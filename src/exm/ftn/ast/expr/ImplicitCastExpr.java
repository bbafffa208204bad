package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types.Type;

/**
 * Conversion inserted by semantic analysis, e.g. to promote the INTEGER
 * operand of a mixed INTEGER/REAL operation.  Has no source of its own, so
 * covers the range of the converted expression.
 */
public final class ImplicitCastExpr extends Expr {
  private final Expr expression;

  private ImplicitCastExpr(ASTContext context, SourceLocation location,
                           Type destType, Expr expression) {
    super(context, ExprKind.IMPLICIT_CAST, destType, location);
    this.expression = expression;
  }

  public static ImplicitCastExpr create(ASTContext context,
          SourceLocation location, Type destType, Expr expression) {
    Preconditions.checkNotNull(destType);
    Preconditions.checkNotNull(expression);
    context.checkOwned(expression);
    return new ImplicitCastExpr(context, location, destType, expression);
  }

  public Expr getExpression() {
    return expression;
  }

  @Override
  public SourceLocation getMinLocation() {
    return expression.getMinLocation();
  }

  @Override
  public SourceLocation getMaxLocation() {
    return expression.getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of(expression);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitImplicitCast(this);
  }
}
