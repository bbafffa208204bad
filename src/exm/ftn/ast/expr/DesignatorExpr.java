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

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.lang.Types.Type;

/**
 * A designator names an object or a part of one: a variable, an array
 * element or section, a substring, a complex part, a structure component
 * or a coindexed object.
 *
 * All designators except a plain variable refer to a target designator (or
 * other expression); the range of a designator starts at its target.
 */
public abstract sealed class DesignatorExpr extends Expr
    permits VarExpr, ArrayElementExpr, SubstringExpr, ArraySectionExpr,
            ComplexPartExpr, StructureComponentExpr, CoindexedObjectExpr {

  public static enum DesignatorKind {
    OBJECT_NAME,
    ARRAY_ELEMENT,
    ARRAY_SECTION,
    COINDEXED_NAMED_OBJECT,
    COMPLEX_PART,
    STRUCTURE_COMPONENT,
    SUBSTRING;
  }

  private final DesignatorKind designatorKind;
  /** Designated object, null for an object name */
  private final Expr target;

  protected DesignatorExpr(ASTContext context, ExprKind kind,
          DesignatorKind designatorKind, Type type,
          SourceLocation location, Expr target) {
    super(context, kind, type, location);
    this.designatorKind = designatorKind;
    this.target = target;
  }

  public DesignatorKind getDesignatorKind() {
    return designatorKind;
  }

  /**
   * @return the object this designator selects from, or null for a name
   */
  public Expr getTarget() {
    return target;
  }

  @Override
  public SourceLocation getMinLocation() {
    if (target != null) {
      return target.getMinLocation();
    }
    return getLocation();
  }
}
