package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types.Type;

/**
 * Array constructor: (/ a, b, c /)
 */
public final class ArrayConstructorExpr extends Expr {
  private final List<Expr> items;

  private ArrayConstructorExpr(ASTContext context, SourceLocation location,
                               List<Expr> items, Type type) {
    super(context, ExprKind.ARRAY_CONSTRUCTOR, type, location);
    this.items = items;
  }

  /**
   * @param type array type, null if not yet known
   */
  public static ArrayConstructorExpr create(ASTContext context,
          SourceLocation location, List<? extends Expr> items, Type type) {
    Preconditions.checkNotNull(items);
    context.checkAllOwned(items);
    return new ArrayConstructorExpr(context, location,
                                    ImmutableList.<Expr>copyOf(items), type);
  }

  public List<Expr> getItems() {
    return items;
  }

  @Override
  public SourceLocation getMaxLocation() {
    if (items.isEmpty()) {
      return getLocation();
    }
    return items.get(items.size() - 1).getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return items;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitArrayConstructor(this);
  }
}
