package exm.ftn.ast.expr;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.Preconditions;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;

/**
 * Character literal.  The bytes are copied out of the token into a buffer
 * owned by the node and null terminated, so the constant does not depend
 * on the lexer's buffer staying alive.
 */
public final class CharacterConstantExpr extends ConstantExpr {
  /** Literal bytes followed by a terminating 0 */
  private final byte[] data;

  private CharacterConstantExpr(ASTContext context, SourceLocation location,
                                SourceLocation maxLocation, byte[] data) {
    super(context, ExprKind.CHARACTER_CONSTANT,
          context.getCharacterType(data.length - 1), location, maxLocation);
    this.data = data;
  }

  /**
   * @param buf buffer holding literal, not necessarily null terminated
   * @param offset start of literal in buf
   * @param length number of bytes in literal
   */
  public static CharacterConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation,
          byte[] buf, int offset, int length) {
    Preconditions.checkNotNull(buf);
    Preconditions.checkPositionIndexes(offset, offset + length, buf.length);
    byte[] data = new byte[length + 1];
    System.arraycopy(buf, offset, data, 0, length);
    data[length] = 0;
    return new CharacterConstantExpr(context, location, maxLocation, data);
  }

  /**
   * @param text literal text, one byte per character
   * @throws IllegalArgumentException if text has characters outside
   *          ISO-8859-1
   */
  public static CharacterConstantExpr create(ASTContext context,
          SourceLocation location, SourceLocation maxLocation, String text) {
    Preconditions.checkNotNull(text);
    Preconditions.checkArgument(
        StandardCharsets.ISO_8859_1.newEncoder().canEncode(text),
        "Character literal at %s not representable in ISO-8859-1: %s",
        location, text);
    byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
    return create(context, location, maxLocation, bytes, 0, bytes.length);
  }

  /**
   * @return literal text, without the terminator
   */
  public String getValue() {
    return new String(data, 0, getLength(), StandardCharsets.ISO_8859_1);
  }

  /**
   * @return copy of the literal bytes including the terminating 0
   */
  public byte[] getBytes() {
    return Arrays.copyOf(data, data.length);
  }

  public int getLength() {
    return data.length - 1;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitCharacterConstant(this);
  }
}
