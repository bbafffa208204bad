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

import java.math.BigInteger;

import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * Immutable fixed width integer.  The value is held unsigned, in the range
 * [0, 2^bitWidth); arithmetic on construction wraps modulo 2^bitWidth the
 * way machine integers of that width do.
 */
public final class APInt {
  public static final int WORD_BITS = 64;

  private static final BigInteger WORD_MASK =
          BigInteger.ONE.shiftLeft(WORD_BITS).subtract(BigInteger.ONE);

  private final int bitWidth;
  private final BigInteger value;

  private APInt(int bitWidth, BigInteger value) {
    this.bitWidth = bitWidth;
    this.value = value;
  }

  /**
   * @param bitWidth
   * @param bits low order bits of value, treated as unsigned
   */
  public static APInt get(int bitWidth, long bits) {
    return get(bitWidth, BigInteger.valueOf(bits).and(WORD_MASK));
  }

  /**
   * @param bitWidth
   * @param val any value; negative values are stored in two's complement
   */
  public static APInt get(int bitWidth, BigInteger val) {
    checkWidth(bitWidth);
    return new APInt(bitWidth, wrap(bitWidth, val));
  }

  /**
   * Parse digits in the given radix.
   * @throws FTNRuntimeError if text is not a valid number.  Literal text
   *      is validated by the lexer so this indicates a caller bug.
   */
  public static APInt fromString(int bitWidth, String text, int radix) {
    return get(bitWidth, parse(text, radix));
  }

  /**
   * Parse digits without truncating to any width.
   */
  public static BigInteger parse(String text, int radix) {
    if (text == null || text.isEmpty()) {
      throw new FTNRuntimeError("Empty integer text");
    }
    try {
      return new BigInteger(text, radix);
    } catch (NumberFormatException e) {
      throw new FTNRuntimeError("Invalid base " + radix + " integer: '"
                                + text + "'", e);
    }
  }

  /**
   * Rebuild from little-endian 64 bit words
   */
  public static APInt fromWords(int bitWidth, long[] words) {
    checkWidth(bitWidth);
    BigInteger val = BigInteger.ZERO;
    for (int i = words.length - 1; i >= 0; i--) {
      val = val.shiftLeft(WORD_BITS).or(
                  BigInteger.valueOf(words[i]).and(WORD_MASK));
    }
    return new APInt(bitWidth, wrap(bitWidth, val));
  }

  /**
   * @return true if val can be represented unsigned in bitWidth bits
   */
  public static boolean fitsUnsigned(BigInteger val, int bitWidth) {
    return val.signum() >= 0 && val.bitLength() <= bitWidth;
  }

  public static int getNumWords(int bitWidth) {
    return (bitWidth + WORD_BITS - 1) / WORD_BITS;
  }

  private static BigInteger wrap(int bitWidth, BigInteger val) {
    if (fitsUnsigned(val, bitWidth)) {
      return val;
    }
    return val.mod(BigInteger.ONE.shiftLeft(bitWidth));
  }

  private static void checkWidth(int bitWidth) {
    if (bitWidth <= 0) {
      throw new FTNRuntimeError("Invalid integer bit width " + bitWidth);
    }
  }

  public int getBitWidth() {
    return bitWidth;
  }

  public int getNumWords() {
    return getNumWords(bitWidth);
  }

  /**
   * @return number of bits needed to hold the unsigned value
   */
  public int getActiveBits() {
    return value.bitLength();
  }

  /**
   * @return a fresh copy of the value as little-endian 64 bit words
   */
  public long[] getRawData() {
    long[] words = new long[getNumWords()];
    for (int i = 0; i < words.length; i++) {
      words[i] = value.shiftRight(i * WORD_BITS).longValue();
    }
    return words;
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isNegative() {
    return value.testBit(bitWidth - 1);
  }

  public boolean testBit(int bit) {
    return value.testBit(bit);
  }

  /** Value interpreted as unsigned */
  public BigInteger toBigInteger() {
    return value;
  }

  /** Value interpreted as two's complement */
  public BigInteger toSignedBigInteger() {
    if (isNegative()) {
      return value.subtract(BigInteger.ONE.shiftLeft(bitWidth));
    }
    return value;
  }

  /**
   * @return the value zero extended to a long
   * @throws FTNRuntimeError if more than 64 bits are active
   */
  public long getZExtValue() {
    if (getActiveBits() > WORD_BITS) {
      throw new FTNRuntimeError("Too many bits for uint64_t: " + this);
    }
    return value.longValue();
  }

  /**
   * @return the value sign extended to a long
   * @throws FTNRuntimeError if the signed value does not fit in a long
   */
  public long getSExtValue() {
    BigInteger signed = toSignedBigInteger();
    if (signed.bitLength() > WORD_BITS - 1) {
      throw new FTNRuntimeError("Too many bits for int64_t: " + this);
    }
    return signed.longValue();
  }

  public String toString(int radix, boolean signed) {
    return (signed ? toSignedBigInteger() : value).toString(radix);
  }

  @Override
  public String toString() {
    return value.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof APInt)) {
      return false;
    }
    APInt other = (APInt) obj;
    return bitWidth == other.bitWidth && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * bitWidth + value.hashCode();
  }
}
