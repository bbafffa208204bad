package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;

/**
 * r*c in a DATA statement value list: the constant c repeated r times.
 */
public final class RepeatedConstantExpr extends Expr {
  private final IntegerConstantExpr repeatCount;
  private final Expr expression;

  private RepeatedConstantExpr(ASTContext context, SourceLocation location,
                               IntegerConstantExpr repeatCount,
                               Expr expression) {
    super(context, ExprKind.REPEATED_CONSTANT, expression.getType(),
          location);
    this.repeatCount = repeatCount;
    this.expression = expression;
  }

  public static RepeatedConstantExpr create(ASTContext context,
          SourceLocation location, IntegerConstantExpr repeatCount,
          Expr expression) {
    Preconditions.checkNotNull(repeatCount);
    Preconditions.checkNotNull(expression);
    context.checkOwned(repeatCount);
    context.checkOwned(expression);
    return new RepeatedConstantExpr(context, location, repeatCount,
                                    expression);
  }

  public IntegerConstantExpr getRepeatCount() {
    return repeatCount;
  }

  public Expr getExpression() {
    return expression;
  }

  @Override
  public SourceLocation getMinLocation() {
    return repeatCount.getMinLocation();
  }

  @Override
  public SourceLocation getMaxLocation() {
    return expression.getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.<Expr>of(repeatCount, expression);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitRepeatedConstant(this);
  }
}
