package exm.ftn.ast.expr;

import java.math.BigInteger;

import org.apache.log4j.Logger;

import exm.ftn.ast.APIntStorage;
import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.Logging;
import exm.ftn.common.numeric.APInt;

/**
 * Decimal integer literal, held at the context's integer literal width
 * (64 bits by default).
 */
public final class IntegerConstantExpr extends ConstantExpr {
  private static final Logger logger = Logging.getFTNLogger();

  private final APIntStorage num = new APIntStorage();

  private IntegerConstantExpr(ASTContext context, SourceLocation location,
                              SourceLocation maxLocation, APInt value) {
    super(context, ExprKind.INTEGER_CONSTANT, context.getIntegerType(),
          location, maxLocation);
    num.setValue(context, value);
  }

  /**
   * @param data decimal digits of the literal
   * @throws exm.ftn.common.exceptions.FTNRuntimeError if data is not a
   *          decimal number
   */
  public static IntegerConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data) {
    int width = context.getIntLiteralWidth();
    BigInteger parsed = APInt.parse(data, 10);
    if (!APInt.fitsUnsigned(parsed, width)) {
      Logging.uniqueWarn("Integer literal " + data + " at " + location +
                         " does not fit in " + width + " bits: truncated");
    }
    APInt value = APInt.get(width, parsed);
    if (logger.isTraceEnabled()) {
      logger.trace("Integer literal '" + data + "' => " + value);
    }
    return new IntegerConstantExpr(context, location, maxLocation, value);
  }

  public APInt getValue() {
    return num.getValue();
  }

  /**
   * Replace the value, e.g. after constant folding
   */
  public void setValue(APInt value) {
    num.setValue(getContext(), value);
  }

  /**
   * @return true if the value is held inline rather than in an
   *          arena buffer
   */
  public boolean isStoredInline() {
    return num.isInline();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitIntegerConstant(this);
  }
}
