package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.ast.VarDecl;

/**
 * Reference to a declared variable.  Constructing the reference records
 * the use on the declaration.
 */
public final class VarExpr extends DesignatorExpr {
  private final VarDecl variable;

  private VarExpr(ASTContext context, SourceLocation location,
                  VarDecl variable) {
    super(context, ExprKind.VAR, DesignatorKind.OBJECT_NAME,
          variable.getType(), location, null);
    this.variable = variable;
  }

  public static VarExpr create(ASTContext context, SourceLocation location,
                               VarDecl variable) {
    Preconditions.checkNotNull(variable);
    context.checkOwned(variable);
    variable.markUsedAsVariable(location);
    return new VarExpr(context, location, variable);
  }

  public VarDecl getVarDecl() {
    return variable;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return getLocation().advance(variable.getIdentifier().getLength() - 1);
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitVar(this);
  }
}
