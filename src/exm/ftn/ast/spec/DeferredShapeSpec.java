package exm.ftn.ast.spec;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.expr.Expr;

/**
 * DeferredShapeSpec - A deferred-shape array is an allocatable array or an
 * array pointer.  It has no bounds until allocated.
 *
 *   [R520]:
 *     deferred-shape-spec :=
 *         :
 */
public final class DeferredShapeSpec extends ArraySpec {

  private DeferredShapeSpec(ASTContext context) {
    super(context, ArraySpecKind.DEFERRED_SHAPE);
  }

  public static DeferredShapeSpec create(ASTContext context) {
    return new DeferredShapeSpec(context);
  }

  @Override
  public List<Expr> getBounds() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return ":";
  }
}
