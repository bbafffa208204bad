package exm.ftn.ast.expr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.Type;

/**
 * Real or imaginary part of a complex object: z%RE or z%IM
 */
public final class ComplexPartExpr extends DesignatorExpr {
  public static enum Part {
    RE, IM;
  }

  private final Part part;
  private final SourceLocation partLocation;

  private ComplexPartExpr(ASTContext context, SourceLocation location,
                          Type type, Expr target, Part part,
                          SourceLocation partLocation) {
    super(context, ExprKind.COMPLEX_PART, DesignatorKind.COMPLEX_PART,
          type, location, target);
    this.part = part;
    this.partLocation = partLocation;
  }

  /**
   * @param partLocation location of the RE or IM keyword
   */
  public static ComplexPartExpr create(ASTContext context,
          SourceLocation location, Expr target, Part part,
          SourceLocation partLocation) {
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(part);
    Preconditions.checkNotNull(partLocation);
    context.checkOwned(target);
    Type type = null;
    if (target.hasType() && Types.isComplex(target.getType())) {
      type = Types.complexComponentType(target.getType());
    }
    return new ComplexPartExpr(context, location, type, target, part,
                               partLocation);
  }

  public Part getPart() {
    return part;
  }

  public boolean isRealPart() {
    return part == Part.RE;
  }

  public boolean isImaginaryPart() {
    return part == Part.IM;
  }

  @Override
  public SourceLocation getMaxLocation() {
    // Both keywords are two characters
    return partLocation.advance(1);
  }

  @Override
  public List<Expr> getChildren() {
    return ImmutableList.of(getTarget());
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitComplexPart(this);
  }
}
