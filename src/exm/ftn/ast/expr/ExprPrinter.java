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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.Type;

/**
 * Renders expressions as Fortran-like text for diagnostics and debug dumps.
 * Operator expressions are fully parenthesised, so the output shows how
 * the tree was grouped rather than reproducing the source.
 */
class ExprPrinter implements ExprVisitor<Void> {
  private final StringBuilder sb;

  ExprPrinter(StringBuilder sb) {
    this.sb = sb;
  }

  private void print(Expr e) {
    if (e == null) {
      sb.append("<null>");
    } else {
      e.accept(this);
    }
  }

  private void printList(List<Expr> exprs) {
    boolean first = true;
    for (Expr e: exprs) {
      if (first) {
        first = false;
      } else {
        sb.append(',');
      }
      print(e);
    }
  }

  private void printKindSelector(ConstantExpr e) {
    if (e.getKindSelector() != null) {
      sb.append('_');
      print(e.getKindSelector());
    }
  }

  @Override
  public Void visitIntegerConstant(IntegerConstantExpr e) {
    sb.append(e.getValue().toString(10, false));
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitRealConstant(RealConstantExpr e) {
    sb.append(e.getValue());
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitDoublePrecisionConstant(DoublePrecisionConstantExpr e) {
    sb.append(e.getValue());
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitComplexConstant(ComplexConstantExpr e) {
    sb.append('(').append(e.getRealValue()).append(',')
      .append(e.getImaginaryValue()).append(')');
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitCharacterConstant(CharacterConstantExpr e) {
    sb.append('\'')
      .append(StringUtils.replace(e.getValue(), "'", "''"))
      .append('\'');
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitBOZConstant(BOZConstantExpr e) {
    sb.append(e.getBOZKind().prefix).append('\'')
      .append(StringUtils.upperCase(
              e.getValue().toString(e.getBOZKind().radix, false)))
      .append('\'');
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitLogicalConstant(LogicalConstantExpr e) {
    sb.append(e.isTrue() ? ".TRUE." : ".FALSE.");
    printKindSelector(e);
    return null;
  }

  @Override
  public Void visitRepeatedConstant(RepeatedConstantExpr e) {
    print(e.getRepeatCount());
    sb.append('*');
    print(e.getExpression());
    return null;
  }

  @Override
  public Void visitVar(VarExpr e) {
    sb.append(e.getVarDecl().getName());
    return null;
  }

  @Override
  public Void visitArrayElement(ArrayElementExpr e) {
    print(e.getTarget());
    sb.append('(');
    printList(e.getSubscripts());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitArraySection(ArraySectionExpr e) {
    print(e.getTarget());
    sb.append('(');
    printList(e.getSubscripts());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitCoindexedObject(CoindexedObjectExpr e) {
    print(e.getTarget());
    sb.append('[');
    printList(e.getCosubscripts());
    sb.append(']');
    return null;
  }

  @Override
  public Void visitComplexPart(ComplexPartExpr e) {
    print(e.getTarget());
    sb.append('%').append(e.getPart());
    return null;
  }

  @Override
  public Void visitStructureComponent(StructureComponentExpr e) {
    print(e.getTarget());
    sb.append('%').append(e.getComponent().getName());
    return null;
  }

  @Override
  public Void visitSubstring(SubstringExpr e) {
    print(e.getTarget());
    sb.append('(');
    if (e.getStartingPoint() != null) {
      print(e.getStartingPoint());
    }
    sb.append(':');
    if (e.getEndPoint() != null) {
      print(e.getEndPoint());
    }
    sb.append(')');
    return null;
  }

  @Override
  public Void visitUnary(UnaryExpr e) {
    sb.append('(').append(e.getOperator().spelling());
    if (e.getOperator().spelling().startsWith(".")) {
      sb.append(' ');
    }
    print(e.getOperand());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitDefinedUnaryOperator(DefinedUnaryOperatorExpr e) {
    sb.append("(.").append(e.getIdentifier().getName()).append(". ");
    print(e.getOperand());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpr e) {
    sb.append('(');
    print(e.getLHS());
    sb.append(' ').append(e.getOperator().spelling()).append(' ');
    print(e.getRHS());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitDefinedBinaryOperator(DefinedBinaryOperatorExpr e) {
    sb.append('(');
    print(e.getLHS());
    sb.append(" .").append(e.getIdentifier().getName()).append(". ");
    print(e.getRHS());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitImplicitCast(ImplicitCastExpr e) {
    Type t = e.getType();
    if (Types.isArray(t)) {
      // Elemental conversion of a whole array
      t = t.elementType();
    }
    sb.append(conversionName(t)).append('(');
    print(e.getExpression());
    sb.append(", ").append(t.kind()).append(')');
    return null;
  }

  /**
   * @return name of the intrinsic that performs conversion to t
   */
  private static String conversionName(Type t) {
    switch (t.typeSpec()) {
      case INTEGER:
        return "INT";
      case REAL:
        return "REAL";
      case COMPLEX:
        return "CMPLX";
      case LOGICAL:
        return "LOGICAL";
      case CHARACTER:
        return "CHAR";
      default:
        return t.typeSpec().toString();
    }
  }

  @Override
  public Void visitIntrinsicCall(IntrinsicCallExpr e) {
    sb.append(e.getFunction()).append('(');
    printList(e.getArguments());
    sb.append(')');
    return null;
  }

  @Override
  public Void visitArrayConstructor(ArrayConstructorExpr e) {
    sb.append("(/ ");
    boolean first = true;
    for (Expr item: e.getItems()) {
      if (first) {
        first = false;
      } else {
        sb.append(", ");
      }
      print(item);
    }
    sb.append(" /)");
    return null;
  }

  @Override
  public Void visitRange(RangeExpr e) {
    if (e.getFirstExpr() != null) {
      print(e.getFirstExpr());
    }
    sb.append(':');
    if (e.getSecondExpr() != null) {
      print(e.getSecondExpr());
    }
    return null;
  }

  @Override
  public Void visitUnresolvedIdentifier(UnresolvedIdentifierExpr e) {
    sb.append(e.getIdentifier().getName());
    return null;
  }
}
