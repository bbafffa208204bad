package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * Array section: a(1:n, j).  Each subscript is either a scalar expression
 * or a {@link RangeExpr}.  The section's shape, and so its type, is left
 * to semantic analysis.
 */
public final class ArraySectionExpr extends DesignatorExpr {
  private final List<Expr> subscripts;

  private ArraySectionExpr(ASTContext context, SourceLocation location,
                           Expr target, List<Expr> subscripts) {
    super(context, ExprKind.ARRAY_SECTION, DesignatorKind.ARRAY_SECTION,
          null, location, target);
    this.subscripts = subscripts;
  }

  public static ArraySectionExpr create(ASTContext context,
          SourceLocation location, Expr target, List<? extends Expr> subscripts) {
    Preconditions.checkNotNull(target);
    context.checkOwned(target);
    if (subscripts == null || subscripts.isEmpty()) {
      throw new FTNRuntimeError("Array section of " + target.print() +
                                " at " + location + " has no subscripts");
    }
    context.checkAllOwned(subscripts);
    return new ArraySectionExpr(context, location, target,
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
    return visitor.visitArraySection(this);
  }
}
