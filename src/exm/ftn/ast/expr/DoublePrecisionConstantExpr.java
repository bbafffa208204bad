package exm.ftn.ast.expr;

import exm.ftn.ast.APFloatStorage;
import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.numeric.APFloat;
import exm.ftn.common.numeric.FloatSemantics;

/**
 * DOUBLE PRECISION literal, e.g. 1.5D0
 */
public final class DoublePrecisionConstantExpr extends ConstantExpr {
  private final APFloatStorage num = new APFloatStorage();

  private DoublePrecisionConstantExpr(ASTContext context,
      SourceLocation location, SourceLocation maxLocation, APFloat value) {
    super(context, ExprKind.DOUBLE_PRECISION_CONSTANT,
          context.getDoublePrecisionType(), location, maxLocation);
    num.setValue(context, value);
  }

  public static DoublePrecisionConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data) {
    return new DoublePrecisionConstantExpr(context, location, maxLocation,
                 APFloat.fromString(FloatSemantics.IEEE_DOUBLE, data));
  }

  public APFloat getValue() {
    return num.getValue();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitDoublePrecisionConstant(this);
  }
}
