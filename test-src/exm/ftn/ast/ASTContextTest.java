package exm.ftn.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ftn.ast.expr.BinaryExpr;
import exm.ftn.ast.expr.Expr;
import exm.ftn.ast.expr.IntegerConstantExpr;
import exm.ftn.ast.expr.VarExpr;
import exm.ftn.ast.spec.ExplicitShapeSpec;
import exm.ftn.common.Logging;
import exm.ftn.common.Settings;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.exceptions.InvalidOptionException;
import exm.ftn.common.lang.Operators.BinaryOperator;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.CharacterType;
import exm.ftn.common.lang.Types.IntrinsicType;
import exm.ftn.common.lang.Types.TypeSpec;
import exm.ftn.common.numeric.APFloat;
import exm.ftn.common.numeric.APInt;
import exm.ftn.common.numeric.FloatSemantics;

public class ASTContextTest {

  private static final SourceLocation LOC = new SourceLocation(1, 1);

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  private static VarDecl decl(ASTContext ctx, String name) {
    return VarDecl.create(ctx, LOC, new Identifier(name), Types.INTEGER);
  }

  @Test
  public void testHandles() {
    ASTContext ctx = new ASTContext();
    VarDecl a = decl(ctx, "a");
    VarDecl b = decl(ctx, "b");

    assertEquals(0, a.getHandle());
    assertEquals(1, b.getHandle());
    assertEquals(2, ctx.getNodeCount());
    assertSame(b, ctx.getNode(1));
    assertSame(a, ctx.getNode(0, VarDecl.class));
    assertTrue(ctx.owns(a));
  }

  @Test(expected=FTNRuntimeError.class)
  public void testBadHandle() {
    new ASTContext().getNode(3);
  }

  @Test
  public void testIndependentContexts() {
    ASTContext ctx1 = new ASTContext();
    ASTContext ctx2 = new ASTContext();
    VarDecl a = decl(ctx1, "a");
    VarDecl b = decl(ctx2, "b");

    // Handles are per context
    assertEquals(a.getHandle(), b.getHandle());
    assertFalse(ctx2.owns(a));
    assertFalse(ctx1.owns(b));

    ctx1.dispose();
    assertTrue(ctx2.owns(b));
    assertFalse(ctx1.owns(a));
  }

  @Test
  public void testCrossContextVar() {
    ASTContext ctx1 = new ASTContext();
    ASTContext ctx2 = new ASTContext();
    VarDecl b = decl(ctx2, "b");
    try {
      VarExpr.create(ctx1, LOC, b);
      fail("Expected rejection of declaration from other context");
    } catch (IllegalArgumentException e) {
      // Expected
    }
    assertFalse(b.isUsedAsVariable());
    assertEquals(0, ctx1.getNodeCount());
  }

  @Test
  public void testCrossContextChildren() {
    ASTContext ctx1 = new ASTContext();
    ASTContext ctx2 = new ASTContext();
    VarExpr v = VarExpr.create(ctx1, LOC, decl(ctx1, "a"));
    Expr lit = IntegerConstantExpr.create(ctx2, LOC, LOC, "1");
    int count = ctx1.getNodeCount();
    try {
      BinaryExpr.create(ctx1, LOC, BinaryOperator.PLUS, Types.INTEGER,
                        v, lit);
      fail("Expected rejection of operand from other context");
    } catch (IllegalArgumentException e) {
      // Expected
    }
    assertEquals(count, ctx1.getNodeCount());

    try {
      ExplicitShapeSpec.create(ctx1, lit);
      fail("Expected rejection of bound from other context");
    } catch (IllegalArgumentException e) {
      // Expected
    }

    // Children of a disposed context are no longer usable either
    Expr other = IntegerConstantExpr.create(ctx2, LOC, LOC, "2");
    ctx2.dispose();
    try {
      ctx1.checkOwned(other);
      fail("Expected rejection of disposed node");
    } catch (IllegalArgumentException e) {
      // Expected
    }
    ctx1.checkOwned(v);
    ctx1.checkOwned(null);
  }

  @Test
  public void testDispose() {
    ASTContext ctx = new ASTContext();
    decl(ctx, "a");
    ctx.allocateWords(2);
    assertEquals(1, ctx.getLiveWordBuffers());

    ctx.dispose();
    assertTrue(ctx.isDisposed());
    assertEquals(0, ctx.getNodeCount());
    assertEquals(0, ctx.getLiveWordBuffers());

    // Second dispose is harmless
    ctx.dispose();
  }

  @Test(expected=FTNRuntimeError.class)
  public void testAllocateAfterDispose() {
    ASTContext ctx = new ASTContext();
    ctx.dispose();
    decl(ctx, "a");
  }

  @Test(expected=FTNRuntimeError.class)
  public void testDeallocateForeignBuffer() {
    new ASTContext().deallocate(new long[2]);
  }

  @Test
  public void testInlineStorage() {
    ASTContext ctx = new ASTContext();
    APIntStorage s = new APIntStorage();
    s.setValue(ctx, APInt.get(64, 12345));
    assertTrue(s.isInline());
    assertEquals(0, ctx.getLiveWordBuffers());
    assertEquals(12345, s.getValue().getZExtValue());
    assertEquals(64, s.getBitWidth());
  }

  @Test
  public void testWideStorage() {
    ASTContext ctx = new ASTContext();
    APIntStorage s = new APIntStorage();
    BigInteger big = BigInteger.ONE.shiftLeft(70);
    s.setValue(ctx, APInt.get(128, big));
    assertFalse(s.isInline());
    assertEquals(1, ctx.getLiveWordBuffers());
    assertEquals(big, s.getValue().toBigInteger());

    // Replacing frees the old buffer and allocates a new one
    s.setValue(ctx, APInt.get(128, BigInteger.TEN));
    assertEquals(1, ctx.getLiveWordBuffers());
    assertEquals(BigInteger.TEN, s.getValue().toBigInteger());

    // Narrow value needs no buffer
    s.setValue(ctx, APInt.get(32, 3));
    assertEquals(0, ctx.getLiveWordBuffers());
    assertTrue(s.isInline());
  }

  @Test
  public void testFloatStorage() {
    ASTContext ctx = new ASTContext();
    APFloatStorage s = new APFloatStorage();
    APFloat quad = APFloat.fromString(FloatSemantics.IEEE_QUAD, "2.5");
    s.setValue(ctx, quad);
    assertFalse(s.isInline());
    assertEquals(quad, s.getValue());
    assertEquals(FloatSemantics.IEEE_QUAD, s.getValue().getSemantics());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testStorageReadBeforeSet() {
    new APIntStorage().getValue();
  }

  @Test
  public void testFPSemantics() {
    ASTContext ctx = new ASTContext();
    assertEquals(FloatSemantics.IEEE_SINGLE,
                 ctx.getFPTypeSemantics(ctx.getRealType()));
    assertEquals(FloatSemantics.IEEE_DOUBLE,
                 ctx.getFPTypeSemantics(ctx.getDoublePrecisionType()));
    assertEquals(FloatSemantics.IEEE_HALF,
            ctx.getFPTypeSemantics(new IntrinsicType(TypeSpec.REAL, 2)));
    assertEquals(FloatSemantics.IEEE_QUAD,
            ctx.getFPTypeSemantics(new IntrinsicType(TypeSpec.COMPLEX, 16)));
  }

  @Test
  public void testFromSettings() throws InvalidOptionException {
    Settings.set(Settings.INT_LITERAL_WIDTH, "32");
    try {
      ASTContext ctx = ASTContext.fromSettings();
      assertEquals(32, ctx.getIntLiteralWidth());
      assertEquals(Settings.DEFAULT_BOZ_MIN_WIDTH, ctx.getBOZMinWidth());
    } finally {
      Settings.reset(Settings.INT_LITERAL_WIDTH);
    }
  }

  @Test
  public void testBuiltinTypes() {
    ASTContext ctx = new ASTContext();
    assertEquals(Types.COMPLEX, ctx.getComplexType());
    assertEquals(FloatSemantics.IEEE_SINGLE,
                 ctx.getFPTypeSemantics(ctx.getComplexType()));
    assertSame(Types.CHARACTER,
               ctx.getCharacterType(CharacterType.UNKNOWN_LENGTH));
    assertEquals(12, ctx.getCharacterType(12).length());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testFPSemanticsBadKind() {
    new ASTContext().getFPTypeSemantics(new IntrinsicType(TypeSpec.REAL, 10));
  }

  @Test(expected=FTNRuntimeError.class)
  public void testFPSemanticsNotFloat() {
    ASTContext ctx = new ASTContext();
    ctx.getFPTypeSemantics(ctx.getIntegerType());
  }

  @Test
  public void testVarDeclUse() {
    ASTContext ctx = new ASTContext();
    VarDecl x = decl(ctx, "x");
    assertFalse(x.isUsedAsVariable());
    x.markUsedAsVariable(new SourceLocation(3, 4));
    x.markUsedAsVariable(new SourceLocation(5, 1));
    assertTrue(x.isUsedAsVariable());
    assertEquals(2, x.getUseCount());
    assertEquals(new SourceLocation(3, 4), x.getFirstUse());
    assertEquals(new Identifier("X"), x.getIdentifier());

    // Implicit typing fills in the type later
    VarDecl y = VarDecl.create(ctx, LOC, new Identifier("y"), null);
    y.setType(Types.REAL);
    assertEquals(Types.REAL, y.getType());
    assertEquals("y :: REAL(KIND=4)", y.toString());
  }

  @Test
  public void testSourceRange() {
    SourceRange r = new SourceRange(new SourceLocation(1, 5),
                                    new SourceLocation(2, 3));
    assertTrue(r.contains(new SourceLocation(1, 80)));
    assertFalse(r.contains(new SourceLocation(2, 4)));
    assertEquals("[1:5-2:3]", r.toString());
  }
}
