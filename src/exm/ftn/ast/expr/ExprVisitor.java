package exm.ftn.ast.expr;

/**
 * Dispatch over every concrete kind of expression.  Code generation and
 * other passes implement this rather than testing kinds by hand, so that
 * a new kind of expression cannot be silently ignored.
 *
 * @param <T> result of visiting a node
 */
public interface ExprVisitor<T> {
  T visitIntegerConstant(IntegerConstantExpr e);
  T visitRealConstant(RealConstantExpr e);
  T visitDoublePrecisionConstant(DoublePrecisionConstantExpr e);
  T visitComplexConstant(ComplexConstantExpr e);
  T visitCharacterConstant(CharacterConstantExpr e);
  T visitBOZConstant(BOZConstantExpr e);
  T visitLogicalConstant(LogicalConstantExpr e);
  T visitRepeatedConstant(RepeatedConstantExpr e);

  T visitVar(VarExpr e);
  T visitArrayElement(ArrayElementExpr e);
  T visitArraySection(ArraySectionExpr e);
  T visitCoindexedObject(CoindexedObjectExpr e);
  T visitComplexPart(ComplexPartExpr e);
  T visitStructureComponent(StructureComponentExpr e);
  T visitSubstring(SubstringExpr e);

  T visitUnary(UnaryExpr e);
  T visitDefinedUnaryOperator(DefinedUnaryOperatorExpr e);
  T visitBinary(BinaryExpr e);
  T visitDefinedBinaryOperator(DefinedBinaryOperatorExpr e);

  T visitImplicitCast(ImplicitCastExpr e);
  T visitIntrinsicCall(IntrinsicCallExpr e);
  T visitArrayConstructor(ArrayConstructorExpr e);
  T visitRange(RangeExpr e);
  T visitUnresolvedIdentifier(UnresolvedIdentifierExpr e);
}
