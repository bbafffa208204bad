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
package exm.ftn.common.numeric;

import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * IEEE 754 binary interchange formats that REAL and COMPLEX values
 * can be stored in.
 */
public enum FloatSemantics {
  IEEE_HALF(16, 5, 11),
  IEEE_SINGLE(32, 8, 24),
  IEEE_DOUBLE(64, 11, 53),
  IEEE_QUAD(128, 15, 113);

  private final int bitWidth;
  private final int exponentBits;
  /** Significand bits, including the implicit leading bit */
  private final int precision;

  private FloatSemantics(int bitWidth, int exponentBits, int precision) {
    this.bitWidth = bitWidth;
    this.exponentBits = exponentBits;
    this.precision = precision;
  }

  public int bitWidth() {
    return bitWidth;
  }

  public int exponentBits() {
    return exponentBits;
  }

  public int precision() {
    return precision;
  }

  public int bias() {
    return (1 << (exponentBits - 1)) - 1;
  }

  public int minExponent() {
    return 1 - bias();
  }

  public int maxExponent() {
    return bias();
  }

  /**
   * @param bitWidth
   * @return the format with the given storage width
   * @throws FTNRuntimeError if no IEEE format has that width
   */
  public static FloatSemantics forBitWidth(int bitWidth) {
    for (FloatSemantics s: values()) {
      if (s.bitWidth == bitWidth) {
        return s;
      }
    }
    throw new FTNRuntimeError("Unknown float semantic for bit width "
                              + bitWidth);
  }
}
