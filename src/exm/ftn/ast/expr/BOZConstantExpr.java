package exm.ftn.ast.expr;

import java.math.BigInteger;

import org.apache.log4j.Logger;

import exm.ftn.ast.APIntStorage;
import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.Logging;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.numeric.APInt;

/**
 * Binary, octal or hexadecimal literal: B'1010', O'17', Z'FF' or X'FF'.
 *
 * The lexer only hands over well formed tokens, so malformed text here
 * is an internal error rather than a user diagnostic.
 */
public final class BOZConstantExpr extends ConstantExpr {
  private static final Logger logger = Logging.getFTNLogger();

  public static enum BOZKind {
    HEXADECIMAL(16, 4, 'Z'),
    OCTAL(8, 3, 'O'),
    BINARY(2, 1, 'B');

    public final int radix;
    public final int bitsPerDigit;
    public final char prefix;

    private BOZKind(int radix, int bitsPerDigit, char prefix) {
      this.radix = radix;
      this.bitsPerDigit = bitsPerDigit;
      this.prefix = prefix;
    }

    /**
     * @return kind selected by prefix character, any case
     */
    public static BOZKind fromPrefix(char prefix) {
      switch (Character.toUpperCase(prefix)) {
        case 'B':
          return BINARY;
        case 'O':
          return OCTAL;
        case 'Z':
        case 'X':
          return HEXADECIMAL;
        default:
          throw new FTNRuntimeError("Invalid BOZ constant prefix '" +
                                    prefix + "'");
      }
    }
  }

  private final APIntStorage num = new APIntStorage();
  private final BOZKind bozKind;

  private BOZConstantExpr(ASTContext context, SourceLocation location,
                          SourceLocation maxLocation, BOZKind bozKind,
                          APInt value) {
    super(context, ExprKind.BOZ_CONSTANT, context.getIntegerType(),
          location, maxLocation);
    this.bozKind = bozKind;
    num.setValue(context, value);
  }

  /**
   * @param data whole token: prefix letter, quote, digits, matching quote
   * @throws FTNRuntimeError if the token is malformed, e.g. has no
   *                          closing quote
   */
  public static BOZConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String data) {
    if (data == null || data.length() < 2) {
      throw new FTNRuntimeError("Invalid BOZ constant: '" + data + "'");
    }
    BOZKind bozKind = BOZKind.fromPrefix(data.charAt(0));

    char quote = data.charAt(1);
    if (quote != '\'' && quote != '"') {
      throw new FTNRuntimeError("Invalid BOZ constant, expected quote: '"
                                + data + "'");
    }
    int lastQuote = data.lastIndexOf(quote);
    if (lastQuote <= 1 || lastQuote != data.length() - 1) {
      throw new FTNRuntimeError("Invalid BOZ constant, unterminated: '"
                                + data + "'");
    }
    String digits = data.substring(2, lastQuote);
    BigInteger parsed = APInt.parse(digits, bozKind.radix);

    // Wide enough for any value with this many digits
    int width = Math.max(context.getBOZMinWidth(),
                         digits.length() * bozKind.bitsPerDigit);
    APInt value = APInt.get(width, parsed);
    if (logger.isTraceEnabled()) {
      logger.trace("BOZ literal '" + data + "' => " + value + " (" +
                   width + " bits)");
    }
    return new BOZConstantExpr(context, location, maxLocation, bozKind,
                               value);
  }

  public APInt getValue() {
    return num.getValue();
  }

  public BOZKind getBOZKind() {
    return bozKind;
  }

  public boolean isBinaryKind() {
    return bozKind == BOZKind.BINARY;
  }

  public boolean isOctalKind() {
    return bozKind == BOZKind.OCTAL;
  }

  public boolean isHexKind() {
    return bozKind == BOZKind.HEXADECIMAL;
  }

  public boolean isStoredInline() {
    return num.isInline();
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitBOZConstant(this);
  }
}
