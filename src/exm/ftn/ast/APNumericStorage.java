/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ftn.ast;

import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.numeric.APInt;

/**
 * Holds the value of a numeric constant without keeping an {@link APInt}
 * alive in the node.  Values up to one word wide are stored inline; wider
 * values live in a word buffer allocated from the {@link ASTContext}.
 * Which of the two is in use depends only on the bit width.
 *
 * Not copyable: each constant node owns its storage.
 */
public abstract class APNumericStorage {
  private int bitWidth;
  /** Value when it fits in one word */
  private long val;
  /** Value when wider than one word, owned by the context */
  private long[] pVal;

  protected APNumericStorage() {
    this.bitWidth = 0;
    this.val = 0;
    this.pVal = null;
  }

  private boolean hasAllocation() {
    return bitWidth > 0 && APInt.getNumWords(bitWidth) > 1;
  }

  public int getBitWidth() {
    return bitWidth;
  }

  /**
   * @return true if the value is held inline rather than in a buffer
   */
  public boolean isInline() {
    return !hasAllocation();
  }

  protected APInt getIntValue() {
    if (bitWidth == 0) {
      throw new FTNRuntimeError("Numeric storage read before a value " +
                                "was set");
    }
    if (hasAllocation()) {
      return APInt.fromWords(bitWidth, pVal);
    } else {
      return APInt.get(bitWidth, val);
    }
  }

  /**
   * Replace the stored value, releasing any buffer held for the old one.
   */
  protected void setIntValue(ASTContext context, APInt value) {
    if (hasAllocation()) {
      context.deallocate(pVal);
      pVal = null;
    }

    bitWidth = value.getBitWidth();
    long[] words = value.getRawData();
    if (words.length > 1) {
      pVal = context.allocateWords(words.length);
      System.arraycopy(words, 0, pVal, 0, words.length);
      val = 0;
    } else {
      val = words[0];
    }
  }
}
