package exm.ftn.ast.spec;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.expr.Expr;

/**
 * AssumedShapeSpec - An assumed-shape array is a nonallocatable nonpointer
 * dummy argument array that takes its shape from its effective arguments.
 *
 *   [R519]:
 *     assumed-shape-spec :=
 *         [ lower-bound ] :
 */
public final class AssumedShapeSpec extends ArraySpec {
  private final Expr lowerBound;

  private AssumedShapeSpec(ASTContext context, Expr lowerBound) {
    super(context, ArraySpecKind.ASSUMED_SHAPE);
    this.lowerBound = lowerBound;
  }

  public static AssumedShapeSpec create(ASTContext context) {
    return new AssumedShapeSpec(context, null);
  }

  public static AssumedShapeSpec create(ASTContext context, Expr lowerBound) {
    context.checkOwned(lowerBound);
    return new AssumedShapeSpec(context, lowerBound);
  }

  /** @return lower bound, null if not given */
  public Expr getLowerBound() {
    return lowerBound;
  }

  @Override
  public List<Expr> getBounds() {
    if (lowerBound == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(lowerBound);
  }

  @Override
  public String toString() {
    return (lowerBound == null ? "" : lowerBound.print()) + ":";
  }
}
