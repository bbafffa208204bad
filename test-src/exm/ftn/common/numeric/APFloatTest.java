package exm.ftn.common.numeric;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.Test;

import exm.ftn.common.exceptions.FTNRuntimeError;

public class APFloatTest {

  private static long bits(FloatSemantics sem, String text) {
    return APFloat.fromString(sem, text).bitcastToAPInt().getZExtValue();
  }

  @Test
  public void testDouble() {
    assertEquals(0x3ff8000000000000L, bits(FloatSemantics.IEEE_DOUBLE, "1.5"));
    assertEquals(0x3fb999999999999aL, bits(FloatSemantics.IEEE_DOUBLE, "0.1"));
    assertEquals(0x419d6f34547e6b75L,
            bits(FloatSemantics.IEEE_DOUBLE, "123456789.123456789"));
    assertEquals(0x7fefffffffffffffL,
            bits(FloatSemantics.IEEE_DOUBLE, "1.7976931348623157E308"));
  }

  @Test
  public void testFortranExponents() {
    assertEquals(0xc004000000000000L,
            bits(FloatSemantics.IEEE_DOUBLE, "-2.5D0"));
    assertEquals(0x3ff8000000000000L,
            bits(FloatSemantics.IEEE_DOUBLE, "15d-1"));
    assertEquals(0x3ff8000000000000L,
            bits(FloatSemantics.IEEE_DOUBLE, "0.15Q1"));
  }

  @Test
  public void testDenormalAndUnderflow() {
    APFloat tiny = APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "4.9E-324");
    assertEquals(1L, tiny.bitcastToAPInt().getZExtValue());
    assertTrue(tiny.isDenormal());

    APFloat zero = APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "1E-400");
    assertEquals(0L, zero.bitcastToAPInt().getZExtValue());
    assertTrue(zero.isZero());
  }

  @Test
  public void testSingle() {
    assertEquals(0x3dcccccdL, bits(FloatSemantics.IEEE_SINGLE, "0.1"));
    assertEquals(Float.floatToRawIntBits(0.1f),
            (int)bits(FloatSemantics.IEEE_SINGLE, "0.1"));

    // Just past FLT_MAX rounds up to infinity
    APFloat inf = APFloat.fromString(FloatSemantics.IEEE_SINGLE,
                                     "3.4028236E38");
    assertEquals(0x7f800000L, inf.bitcastToAPInt().getZExtValue());
    assertTrue(inf.isInfinity());
  }

  @Test
  public void testHalf() {
    assertEquals(0x3c00L, bits(FloatSemantics.IEEE_HALF, "1.0"));
    assertEquals(0x7bffL, bits(FloatSemantics.IEEE_HALF, "65504"));
    assertEquals(0x7c00L, bits(FloatSemantics.IEEE_HALF, "65520"));
    assertEquals(0x2e66L, bits(FloatSemantics.IEEE_HALF, "0.1"));
  }

  @Test
  public void testQuad() {
    APFloat one = APFloat.fromString(FloatSemantics.IEEE_QUAD, "1.0");
    BigInteger expected = new BigInteger("3fff" + "0000000000000000" +
                                         "000000000000", 16);
    assertEquals(expected, one.bitcastToAPInt().toBigInteger());
    assertEquals(2, one.bitcastToAPInt().getNumWords());
    assertEquals(1.0, one.convertToDouble(), 0.0);
  }

  @Test
  public void testNegativeZero() {
    APFloat negZero = APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "-0.0");
    assertTrue(negZero.isZero());
    assertTrue(negZero.isNegative());
    assertFalse(negZero.equals(
            APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "0.0")));
  }

  @Test
  public void testExactDecimal() {
    APFloat f = APFloat.fromString(FloatSemantics.IEEE_SINGLE, "0.5");
    assertEquals(0, new BigDecimal("0.5").compareTo(f.toBigDecimal()));
    assertEquals("0.5", f.toString());
    assertEquals(APFloat.fromFloat(0.5f), f);
    assertEquals(APFloat.fromDouble(1.5),
            APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "1.5"));
  }

  @Test(expected=FTNRuntimeError.class)
  public void testNoDecimalForInfinity() {
    APFloat.fromString(FloatSemantics.IEEE_HALF, "1E10").toBigDecimal();
  }

  @Test(expected=FTNRuntimeError.class)
  public void testBadText() {
    APFloat.fromString(FloatSemantics.IEEE_DOUBLE, "1.2.3");
  }

  @Test
  public void testSemantics() {
    assertEquals(FloatSemantics.IEEE_SINGLE, FloatSemantics.forBitWidth(32));
    assertEquals(1023, FloatSemantics.IEEE_DOUBLE.bias());
    assertEquals(113, FloatSemantics.IEEE_QUAD.precision());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testNoSemanticsForWidth() {
    FloatSemantics.forBitWidth(80);
  }
}
