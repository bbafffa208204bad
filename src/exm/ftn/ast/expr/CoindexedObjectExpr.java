package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * Coindexed object: a[i].  Has the type of the object on the image.
 */
public final class CoindexedObjectExpr extends DesignatorExpr {
  private final List<Expr> cosubscripts;

  private CoindexedObjectExpr(ASTContext context, SourceLocation location,
                              Expr target, List<Expr> cosubscripts) {
    super(context, ExprKind.COINDEXED_OBJECT,
          DesignatorKind.COINDEXED_NAMED_OBJECT, target.getType(),
          location, target);
    this.cosubscripts = cosubscripts;
  }

  public static CoindexedObjectExpr create(ASTContext context,
          SourceLocation location, Expr target,
          List<? extends Expr> cosubscripts) {
    Preconditions.checkNotNull(target);
    context.checkOwned(target);
    if (cosubscripts == null || cosubscripts.isEmpty()) {
      throw new FTNRuntimeError("Coindexed " + target.print() + " at " +
                                location + " has no cosubscripts");
    }
    context.checkAllOwned(cosubscripts);
    return new CoindexedObjectExpr(context, location, target,
                                   ImmutableList.<Expr>copyOf(cosubscripts));
  }

  public List<Expr> getCosubscripts() {
    return cosubscripts;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return cosubscripts.get(cosubscripts.size() - 1).getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.<Expr>builder().add(getTarget())
                        .addAll(cosubscripts).build();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitCoindexedObject(this);
  }
}
