package exm.ftn.ast.expr;

import org.apache.commons.lang3.StringUtils;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;

/**
 * .TRUE. or .FALSE.
 *
 * Only the exact token .TRUE. (in any case) is true; any other text,
 * well formed or not, gives false.
 */
public final class LogicalConstantExpr extends ConstantExpr {
  private static final String TRUE_TOKEN = ".TRUE.";

  private final boolean val;

  private LogicalConstantExpr(ASTContext context, SourceLocation location,
                              SourceLocation maxLocation, boolean val) {
    super(context, ExprKind.LOGICAL_CONSTANT, context.getLogicalType(),
          location, maxLocation);
    this.val = val;
  }

  public static LogicalConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data) {
    return new LogicalConstantExpr(context, location, maxLocation,
                                   StringUtils.equalsIgnoreCase(data, TRUE_TOKEN));
  }

  public boolean isTrue() {
    return val;
  }

  public boolean isFalse() {
    return !val;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitLogicalConstant(this);
  }
}
