package exm.ftn.ast.expr;

import com.google.common.base.Preconditions;

import exm.ftn.ast.APFloatStorage;
import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.Type;
import exm.ftn.common.numeric.APFloat;
import exm.ftn.common.numeric.FloatSemantics;

/**
 * REAL literal.  The IEEE format is chosen by the kind of the requested
 * type.
 */
public final class RealConstantExpr extends ConstantExpr {
  private final APFloatStorage num = new APFloatStorage();

  private RealConstantExpr(ASTContext context, SourceLocation location,
                           SourceLocation maxLocation, APFloat value,
                           Type type) {
    super(context, ExprKind.REAL_CONSTANT, type, location, maxLocation);
    num.setValue(context, value);
  }

  /**
   * Build literal of default REAL kind
   */
  public static RealConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data) {
    return create(context, location, maxLocation, data,
                  context.getRealType());
  }

  /**
   * @param type a REAL type
   * @throws exm.ftn.common.exceptions.FTNRuntimeError if the kind of type
   *          has no IEEE format
   */
  public static RealConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data,
          Type type) {
    Preconditions.checkArgument(Types.isReal(type),
                                "Real literal of type %s", type);
    FloatSemantics semantics = context.getFPTypeSemantics(type);
    return new RealConstantExpr(context, location, maxLocation,
                       APFloat.fromString(semantics, data), type);
  }

  public APFloat getValue() {
    return num.getValue();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitRealConstant(this);
  }
}
