package exm.ftn.ast;

import exm.ftn.common.numeric.APFloat;

/**
 * Floating point values are stored as the integer with the same bits;
 * the width selects the IEEE format when reading back.
 */
public final class APFloatStorage extends APNumericStorage {

  public APFloat getValue() {
    return APFloat.fromBits(getIntValue());
  }

  public void setValue(ASTContext context, APFloat value) {
    setIntValue(context, value.bitcastToAPInt());
  }
}
