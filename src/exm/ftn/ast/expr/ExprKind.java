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
package exm.ftn.ast.expr;

/**
 * Tag for each concrete kind of expression, and the class implementing it.
 */
public enum ExprKind {
  // Constants
  INTEGER_CONSTANT(IntegerConstantExpr.class),
  REAL_CONSTANT(RealConstantExpr.class),
  DOUBLE_PRECISION_CONSTANT(DoublePrecisionConstantExpr.class),
  COMPLEX_CONSTANT(ComplexConstantExpr.class),
  CHARACTER_CONSTANT(CharacterConstantExpr.class),
  BOZ_CONSTANT(BOZConstantExpr.class),
  LOGICAL_CONSTANT(LogicalConstantExpr.class),
  REPEATED_CONSTANT(RepeatedConstantExpr.class),

  // Designators
  VAR(VarExpr.class),
  ARRAY_ELEMENT(ArrayElementExpr.class),
  ARRAY_SECTION(ArraySectionExpr.class),
  COINDEXED_OBJECT(CoindexedObjectExpr.class),
  COMPLEX_PART(ComplexPartExpr.class),
  STRUCTURE_COMPONENT(StructureComponentExpr.class),
  SUBSTRING(SubstringExpr.class),

  // Operators
  UNARY(UnaryExpr.class),
  DEFINED_UNARY_OPERATOR(DefinedUnaryOperatorExpr.class),
  BINARY(BinaryExpr.class),
  DEFINED_BINARY_OPERATOR(DefinedBinaryOperatorExpr.class),

  IMPLICIT_CAST(ImplicitCastExpr.class),
  INTRINSIC_CALL(IntrinsicCallExpr.class),
  ARRAY_CONSTRUCTOR(ArrayConstructorExpr.class),
  RANGE(RangeExpr.class),
  UNRESOLVED_IDENTIFIER(UnresolvedIdentifierExpr.class);

  private final Class<? extends Expr> nodeClass;

  private ExprKind(Class<? extends Expr> nodeClass) {
    this.nodeClass = nodeClass;
  }

  public Class<? extends Expr> nodeClass() {
    return nodeClass;
  }

  public boolean isConstant() {
    return ConstantExpr.class.isAssignableFrom(nodeClass);
  }

  public boolean isDesignator() {
    return DesignatorExpr.class.isAssignableFrom(nodeClass);
  }
}
