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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * Immutable IEEE 754 binary floating point value of any of the
 * {@link FloatSemantics} formats, stored as its bit pattern so that
 * half and quad precision values are represented exactly.
 */
public final class APFloat {
  private static final BigInteger FIVE = BigInteger.valueOf(5);

  private final FloatSemantics semantics;
  private final APInt bits;

  private APFloat(FloatSemantics semantics, APInt bits) {
    this.semantics = semantics;
    this.bits = bits;
  }

  /**
   * Reinterpret an integer as a float of the same width.
   * @throws FTNRuntimeError if there is no IEEE format of that width
   */
  public static APFloat fromBits(APInt bits) {
    return new APFloat(FloatSemantics.forBitWidth(bits.getBitWidth()), bits);
  }

  public static APFloat fromDouble(double d) {
    return new APFloat(FloatSemantics.IEEE_DOUBLE,
              APInt.get(64, Double.doubleToRawLongBits(d)));
  }

  public static APFloat fromFloat(float f) {
    return new APFloat(FloatSemantics.IEEE_SINGLE,
              APInt.get(32, Float.floatToRawIntBits(f) & 0xffffffffL));
  }

  public static APFloat zero(FloatSemantics semantics, boolean negative) {
    BigInteger field = BigInteger.ZERO;
    if (negative) {
      field = field.setBit(semantics.bitWidth() - 1);
    }
    return new APFloat(semantics, APInt.get(semantics.bitWidth(), field));
  }

  /**
   * Convert decimal real literal text, rounding to nearest, ties to even.
   * Accepts Fortran exponent letters E, D and Q in any case.  Values too
   * large for the format become infinity, values too small become zero.
   * @throws FTNRuntimeError if text is not a decimal number
   */
  public static APFloat fromString(FloatSemantics semantics, String text) {
    BigDecimal dec = parseDecimal(text);
    boolean negative = dec.signum() < 0 ||
                (dec.signum() == 0 && text.trim().startsWith("-"));
    dec = dec.abs();
    if (dec.signum() == 0) {
      return zero(semantics, negative);
    }
    return new APFloat(semantics,
                   APInt.get(semantics.bitWidth(),
                             encode(semantics, dec, negative)));
  }

  private static BigDecimal parseDecimal(String text) {
    if (text == null) {
      throw new FTNRuntimeError("Null real literal text");
    }
    String normalized = text.trim().replace('D', 'E').replace('d', 'E')
                                   .replace('Q', 'E').replace('q', 'E');
    try {
      return new BigDecimal(normalized);
    } catch (NumberFormatException e) {
      throw new FTNRuntimeError("Invalid real literal: '" + text + "'", e);
    }
  }

  /**
   * Find the bit pattern nearest to a positive decimal value
   */
  private static BigInteger encode(FloatSemantics sem, BigDecimal dec,
                                   boolean negative) {
    BigInteger num, den;
    if (dec.scale() >= 0) {
      num = dec.unscaledValue();
      den = BigInteger.TEN.pow(dec.scale());
    } else {
      num = dec.unscaledValue().multiply(BigInteger.TEN.pow(-dec.scale()));
      den = BigInteger.ONE;
    }

    int p = sem.precision();

    // Binary exponent e such that 2^e <= num/den < 2^(e+1)
    int e = num.bitLength() - den.bitLength();
    if (compareScaled(num, den, e) < 0) {
      e--;
    }

    boolean subnormal = e < sem.minExponent();
    int shift = (subnormal ? sem.minExponent() : e) - (p - 1);

    BigInteger n2 = num, d2 = den;
    if (shift >= 0) {
      d2 = den.shiftLeft(shift);
    } else {
      n2 = num.shiftLeft(-shift);
    }
    BigInteger[] qr = n2.divideAndRemainder(d2);
    BigInteger q = qr[0];
    int halfCmp = qr[1].shiftLeft(1).compareTo(d2);
    if (halfCmp > 0 || (halfCmp == 0 && q.testBit(0))) {
      q = q.add(BigInteger.ONE);
    }

    BigInteger field;
    if (subnormal) {
      // Rounding up to 2^(p-1) gives the encoding of the smallest normal
      field = q;
    } else {
      if (q.bitLength() > p) {
        q = q.shiftRight(1);
        e++;
      }
      if (e > sem.maxExponent()) {
        field = infinityField(sem);
      } else {
        field = BigInteger.valueOf(e + sem.bias()).shiftLeft(p - 1)
                          .or(q.clearBit(p - 1));
      }
    }
    if (negative) {
      field = field.setBit(sem.bitWidth() - 1);
    }
    return field;
  }

  /** compare num/den with 2^e */
  private static int compareScaled(BigInteger num, BigInteger den, int e) {
    if (e >= 0) {
      return num.compareTo(den.shiftLeft(e));
    } else {
      return num.shiftLeft(-e).compareTo(den);
    }
  }

  private static BigInteger infinityField(FloatSemantics sem) {
    return BigInteger.ONE.shiftLeft(sem.exponentBits())
                .subtract(BigInteger.ONE).shiftLeft(sem.precision() - 1);
  }

  public FloatSemantics getSemantics() {
    return semantics;
  }

  public APInt bitcastToAPInt() {
    return bits;
  }

  public boolean isNegative() {
    return bits.testBit(semantics.bitWidth() - 1);
  }

  private int exponentField() {
    return bits.toBigInteger().shiftRight(semantics.precision() - 1)
               .clearBit(semantics.exponentBits()).intValue();
  }

  private BigInteger significandField() {
    BigInteger mask = BigInteger.ONE.shiftLeft(semantics.precision() - 1)
                                    .subtract(BigInteger.ONE);
    return bits.toBigInteger().and(mask);
  }

  private boolean maxExponentField() {
    return exponentField() == (1 << semantics.exponentBits()) - 1;
  }

  public boolean isZero() {
    return exponentField() == 0 && significandField().signum() == 0;
  }

  public boolean isDenormal() {
    return exponentField() == 0 && significandField().signum() != 0;
  }

  public boolean isInfinity() {
    return maxExponentField() && significandField().signum() == 0;
  }

  public boolean isNaN() {
    return maxExponentField() && significandField().signum() != 0;
  }

  /**
   * @return the exact decimal expansion of a finite value
   * @throws FTNRuntimeError for infinities and NaNs
   */
  public BigDecimal toBigDecimal() {
    if (isInfinity() || isNaN()) {
      throw new FTNRuntimeError("No decimal value for " + this);
    }
    int p = semantics.precision();
    BigInteger mant = significandField();
    int exp;
    if (exponentField() == 0) {
      exp = semantics.minExponent() - (p - 1);
    } else {
      mant = mant.setBit(p - 1);
      exp = exponentField() - semantics.bias() - (p - 1);
    }
    BigDecimal result;
    if (exp >= 0) {
      result = new BigDecimal(mant.shiftLeft(exp));
    } else {
      // m * 2^-k == m * 5^k / 10^k
      result = new BigDecimal(mant.multiply(FIVE.pow(-exp)), -exp);
    }
    return isNegative() ? result.negate() : result;
  }

  /**
   * @return nearest double to this value
   */
  public double convertToDouble() {
    switch (semantics) {
      case IEEE_DOUBLE:
        return Double.longBitsToDouble(bits.toBigInteger().longValue());
      case IEEE_SINGLE:
        return Float.intBitsToFloat(bits.toBigInteger().intValue());
      default:
        if (isNaN()) {
          return Double.NaN;
        } else if (isInfinity()) {
          return isNegative() ? Double.NEGATIVE_INFINITY
                              : Double.POSITIVE_INFINITY;
        } else if (isZero()) {
          return isNegative() ? -0.0 : 0.0;
        }
        return toBigDecimal().doubleValue();
    }
  }

  @Override
  public String toString() {
    switch (semantics) {
      case IEEE_DOUBLE:
        return Double.toString(convertToDouble());
      case IEEE_SINGLE:
      case IEEE_HALF:
        return Float.toString((float)convertToDouble());
      case IEEE_QUAD:
        if (isNaN() || isInfinity() || isZero()) {
          return Double.toString(convertToDouble());
        }
        return toBigDecimal().round(MathContext.DECIMAL128)
                             .stripTrailingZeros().toString();
      default:
        throw new FTNRuntimeError("Unknown semantics " + semantics);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof APFloat)) {
      return false;
    }
    APFloat other = (APFloat) obj;
    return semantics == other.semantics && bits.equals(other.bits);
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }
}
