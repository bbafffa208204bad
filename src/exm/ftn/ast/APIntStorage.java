package exm.ftn.ast;

import exm.ftn.common.numeric.APInt;

public final class APIntStorage extends APNumericStorage {

  public APInt getValue() {
    return getIntValue();
  }

  public void setValue(ASTContext context, APInt value) {
    setIntValue(context, value);
  }
}
