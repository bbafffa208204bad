package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.Identifier;
import exm.ftn.ast.SourceLocation;

/**
 * Component of a derived-type object: a%b.  Derived types are resolved
 * elsewhere, so the component type starts unresolved.
 */
public final class StructureComponentExpr extends DesignatorExpr {
  private final Identifier component;
  private final SourceLocation componentLocation;

  private StructureComponentExpr(ASTContext context, SourceLocation location,
          Expr target, Identifier component,
          SourceLocation componentLocation) {
    super(context, ExprKind.STRUCTURE_COMPONENT,
          DesignatorKind.STRUCTURE_COMPONENT, null, location, target);
    this.component = component;
    this.componentLocation = componentLocation;
  }

  public static StructureComponentExpr create(ASTContext context,
          SourceLocation location, Expr target, Identifier component,
          SourceLocation componentLocation) {
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(component);
    Preconditions.checkNotNull(componentLocation);
    context.checkOwned(target);
    return new StructureComponentExpr(context, location, target, component,
                                      componentLocation);
  }

  public Identifier getComponent() {
    return component;
  }

  @Override
  public SourceLocation getMaxLocation() {
    return componentLocation.advance(component.getLength() - 1);
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of(getTarget());
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitStructureComponent(this);
  }
}
