package exm.ftn.ast.expr;

import com.google.common.base.Preconditions;

import exm.ftn.ast.APFloatStorage;
import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.IntrinsicType;
import exm.ftn.common.lang.Types.Type;
import exm.ftn.common.lang.Types.TypeSpec;
import exm.ftn.common.numeric.APFloat;

/**
 * Complex literal (re, im), built from parts already parsed as reals.
 */
public final class ComplexConstantExpr extends ConstantExpr {
  private final APFloatStorage re = new APFloatStorage();
  private final APFloatStorage im = new APFloatStorage();

  private ComplexConstantExpr(ASTContext context, SourceLocation location,
                              SourceLocation maxLocation,
                              APFloat re, APFloat im, Type type) {
    super(context, ExprKind.COMPLEX_CONSTANT, type, location, maxLocation);
    this.re.setValue(context, re);
    this.im.setValue(context, im);
  }

  /**
   * Build constant with complex kind matching the parts' format
   */
  public static ComplexConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation,
          APFloat re, APFloat im) {
    Preconditions.checkNotNull(re);
    Preconditions.checkNotNull(im);
    int kind = re.getSemantics().bitWidth() / 8;
    return create(context, location, maxLocation, re, im,
                  new IntrinsicType(TypeSpec.COMPLEX, kind));
  }

  public static ComplexConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation,
          APFloat re, APFloat im, Type type) {
    Preconditions.checkNotNull(re);
    Preconditions.checkNotNull(im);
    Preconditions.checkArgument(re.getSemantics() == im.getSemantics(),
        "Complex parts in different formats: %s, %s",
        re.getSemantics(), im.getSemantics());
    Preconditions.checkArgument(Types.isComplex(type),
                                "Complex literal of type %s", type);
    Preconditions.checkArgument(
        context.getFPTypeSemantics(type) == re.getSemantics(),
        "Complex literal of type %s with %s parts", type, re.getSemantics());
    return new ComplexConstantExpr(context, location, maxLocation,
                                   re, im, type);
  }

  public APFloat getRealValue() {
    return re.getValue();
  }

  public APFloat getImaginaryValue() {
    return im.getValue();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitComplexConstant(this);
  }
}
