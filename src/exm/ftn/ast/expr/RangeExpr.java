package exm.ftn.ast.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;

/**
 * first:second, as used in array section subscripts.  Either bound may be
 * omitted.  The location is that of the colon if the first bound is
 * absent.
 */
public final class RangeExpr extends Expr {
  private Expr first;
  private Expr second;

  private RangeExpr(ASTContext context, SourceLocation location,
                    Expr first, Expr second) {
    super(context, ExprKind.RANGE, null, location);
    this.first = first;
    this.second = second;
  }

  public static RangeExpr create(ASTContext context, SourceLocation location,
                                 Expr first, Expr second) {
    context.checkOwned(first);
    context.checkOwned(second);
    return new RangeExpr(context, location, first, second);
  }

  public Expr getFirstExpr() {
    return first;
  }

  public Expr getSecondExpr() {
    return second;
  }

  public void setFirstExpr(Expr first) {
    getContext().checkOwned(first);
    this.first = first;
  }

  public void setSecondExpr(Expr second) {
    getContext().checkOwned(second);
    this.second = second;
  }

  @Override
  public SourceLocation getMinLocation() {
    if (first != null) {
      return first.getMinLocation();
    }
    return getLocation();
  }

  @Override
  public SourceLocation getMaxLocation() {
    if (second != null) {
      return second.getMaxLocation();
    } else if (first != null) {
      return first.getMaxLocation();
    }
    return getLocation();
  }

  @Override
  public List<Expr> getChildren() {
    List<Expr> children = new ArrayList<Expr>(2);
    if (first != null) {
      children.add(first);
    }
    if (second != null) {
      children.add(second);
    }
    return Collections.unmodifiableList(children);
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitRange(this);
  }
}
