package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.Identifier;
import exm.ftn.ast.SourceLocation;

/**
 * Name the parser could not yet bind to a declaration.  Semantic analysis
 * replaces it with a resolved expression.
 */
public final class UnresolvedIdentifierExpr extends Expr {
  private final Identifier name;

  private UnresolvedIdentifierExpr(ASTContext context,
          SourceLocation location, Identifier name) {
    super(context, ExprKind.UNRESOLVED_IDENTIFIER, null, location);
    this.name = name;
  }

  public static UnresolvedIdentifierExpr create(ASTContext context,
          SourceLocation location, Identifier name) {
    Preconditions.checkNotNull(name);
    return new UnresolvedIdentifierExpr(context, location, name);
  }

  public Identifier getIdentifier() {
    return name;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return getLocation().advance(name.getLength() - 1);
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitUnresolvedIdentifier(this);
  }
}
