package exm.ftn.ast.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.Identifier;
import exm.ftn.ast.SourceLocation;
import exm.ftn.ast.SourceRange;
import exm.ftn.ast.VarDecl;
import exm.ftn.common.Logging;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.lang.Operators.BinaryOperator;
import exm.ftn.common.lang.Operators.Category;
import exm.ftn.common.lang.Operators.Level;
import exm.ftn.common.lang.Operators.UnaryOperator;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.CharacterType;
import exm.ftn.common.lang.Types.Type;

public class OperatorExprTest {

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  private static SourceLocation loc(int col) {
    return new SourceLocation(1, col);
  }

  private static VarExpr var(ASTContext ctx, int col, String name,
                             Type type) {
    VarDecl decl = VarDecl.create(ctx, loc(100), new Identifier(name), type);
    return VarExpr.create(ctx, loc(col), decl);
  }

  @Test
  public void testUnary() {
    ASTContext ctx = new ASTContext();
    // -x
    VarExpr x = var(ctx, 2, "x", Types.REAL);
    UnaryExpr neg = UnaryExpr.create(ctx, loc(1), UnaryOperator.MINUS, x);
    assertEquals(Types.REAL, neg.getType());
    assertEquals(new SourceRange(loc(1), loc(2)), neg.getSourceRange());
    assertEquals("(-x)", neg.print());

    // .NOT. is always logical
    UnaryExpr not = UnaryExpr.create(ctx, loc(1), UnaryOperator.NOT, x);
    assertEquals(Types.LOGICAL, not.getType());
    assertEquals("(.NOT. x)", not.print());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testUnaryDefinedNeedsName() {
    ASTContext ctx = new ASTContext();
    UnaryExpr.create(ctx, loc(1), UnaryOperator.DEFINED,
                     var(ctx, 2, "x", Types.REAL));
  }

  @Test
  public void testDefinedUnary() {
    ASTContext ctx = new ASTContext();
    // .INV. m
    VarExpr m = var(ctx, 7, "m", Types.REAL);
    DefinedUnaryOperatorExpr inv = DefinedUnaryOperatorExpr.create(ctx,
            loc(1), m, new Identifier("INV"));
    assertEquals(UnaryOperator.DEFINED, inv.getOperator());
    assertEquals(Types.REAL, inv.getType());
    assertEquals(loc(7), inv.getMaxLocation());
    assertEquals("(.INV. m)", inv.print());
    assertTrue(inv.is(UnaryExpr.class));
  }

  @Test
  public void testBinaryArithmetic() {
    ASTContext ctx = new ASTContext();
    // a + b
    VarExpr a = var(ctx, 1, "a", Types.INTEGER);
    VarExpr b = var(ctx, 5, "b", Types.REAL);
    BinaryExpr sum = BinaryExpr.create(ctx, loc(3), BinaryOperator.PLUS, a, b);
    assertNull(sum.getType());
    assertEquals(new SourceRange(loc(1), loc(5)), sum.getSourceRange());
    assertEquals(loc(3), sum.getLocation());
    assertEquals("(a + b)", sum.print());

    BinaryExpr typed = BinaryExpr.create(ctx, loc(3), BinaryOperator.PLUS,
                                         Types.REAL, a, b);
    assertEquals(Types.REAL, typed.getType());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testBinaryTypedNotArithmetic() {
    ASTContext ctx = new ASTContext();
    BinaryExpr.create(ctx, loc(3), BinaryOperator.EQUAL, Types.REAL,
                      var(ctx, 1, "a", Types.REAL),
                      var(ctx, 6, "b", Types.REAL));
  }

  @Test
  public void testBinaryLogicalResult() {
    ASTContext ctx = new ASTContext();
    VarExpr a = var(ctx, 1, "a", Types.REAL);
    VarExpr b = var(ctx, 6, "b", Types.REAL);
    for (BinaryOperator op: BinaryOperator.values()) {
      if (op.hasLogicalResult()) {
        BinaryExpr e = BinaryExpr.create(ctx, loc(3), op, a, b);
        assertEquals(op.toString(), Types.LOGICAL, e.getType());
      }
    }
    assertEquals("(a <= b)", BinaryExpr.create(ctx, loc(3),
            BinaryOperator.LESS_THAN_EQUAL, a, b).print());
  }

  @Test
  public void testConcat() {
    ASTContext ctx = new ASTContext();
    VarExpr s = var(ctx, 1, "s", new CharacterType(3));
    VarExpr t = var(ctx, 6, "t", new CharacterType(4));
    BinaryExpr st = BinaryExpr.create(ctx, loc(3), BinaryOperator.CONCAT,
                                      s, t);
    assertEquals(new CharacterType(7), st.getType());
    assertEquals("(s // t)", st.print());

    VarExpr u = var(ctx, 6, "u", Types.CHARACTER);
    assertEquals(Types.CHARACTER, BinaryExpr.create(ctx, loc(3),
            BinaryOperator.CONCAT, s, u).getType());

    VarExpr unresolved = var(ctx, 6, "v", null);
    assertNull(BinaryExpr.create(ctx, loc(3), BinaryOperator.CONCAT,
                                 s, unresolved).getType());
  }

  @Test
  public void testDefinedBinary() {
    ASTContext ctx = new ASTContext();
    VarExpr a = var(ctx, 1, "a", Types.REAL);
    VarExpr b = var(ctx, 10, "b", Types.REAL);
    DefinedBinaryOperatorExpr cross = DefinedBinaryOperatorExpr.create(ctx,
            loc(3), a, b, new Identifier("CROSS"));
    assertNull(cross.getType());
    assertEquals(BinaryOperator.DEFINED, cross.getOperator());
    assertEquals("(a .CROSS. b)", cross.print());

    cross.resolveType(Types.REAL);
    assertEquals(Types.REAL, cross.requireType());
  }

  @Test(expected=FTNRuntimeError.class)
  public void testBinaryDefinedNeedsName() {
    ASTContext ctx = new ASTContext();
    BinaryExpr.create(ctx, loc(3), BinaryOperator.DEFINED,
                      var(ctx, 1, "a", Types.REAL),
                      var(ctx, 5, "b", Types.REAL));
  }

  @Test
  public void testOperatorTables() {
    assertEquals("**", BinaryOperator.POWER.spelling());
    assertEquals(Category.CONCATENATION, BinaryOperator.CONCAT.category());
    assertNull(UnaryOperator.DEFINED.spelling());
    assertTrue(Level.NUMERIC.bindsTighterThan(Level.RELATIONAL));
    assertTrue(Level.DEFINED_UNARY.bindsTighterThan(Level.NUMERIC));
    assertFalse(Level.DEFINED_BINARY.bindsTighterThan(Level.LOGICAL));
    assertEquals(5, BinaryOperator.AND.level().standardLevel);
  }
}
