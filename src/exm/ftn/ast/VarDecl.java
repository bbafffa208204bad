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
package exm.ftn.ast;

import com.google.common.base.Preconditions;

import exm.ftn.common.lang.Types.Type;

/**
 * Declaration of a named variable.  Built by semantic analysis when it
 * processes type declaration statements; expressions refer to it through
 * {@link exm.ftn.ast.expr.VarExpr}.
 */
public final class VarDecl extends ASTNode {
  private final SourceLocation location;
  private final Identifier name;
  private Type type;

  /** Where first used as a variable, null if never */
  private SourceLocation firstUse = null;
  private int useCount = 0;

  private VarDecl(ASTContext context, SourceLocation location,
                  Identifier name, Type type) {
    super(context);
    this.location = location;
    this.name = name;
    this.type = type;
  }

  /**
   * @param type declared type, null if to be determined by implicit typing
   */
  public static VarDecl create(ASTContext context, SourceLocation location,
                               Identifier name, Type type) {
    Preconditions.checkNotNull(location);
    Preconditions.checkNotNull(name);
    return new VarDecl(context, location, name, type);
  }

  public SourceLocation getLocation() {
    return location;
  }

  public Identifier getIdentifier() {
    return name;
  }

  public String getName() {
    return name.getName();
  }

  public Type getType() {
    return type;
  }

  public void setType(Type type) {
    this.type = type;
  }

  /**
   * Record a use of the declaration as a variable.
   */
  public void markUsedAsVariable(SourceLocation loc) {
    if (firstUse == null) {
      firstUse = loc;
    }
    useCount++;
  }

  public boolean isUsedAsVariable() {
    return useCount > 0;
  }

  public SourceLocation getFirstUse() {
    return firstUse;
  }

  public int getUseCount() {
    return useCount;
  }

  @Override
  public String toString() {
    return name + (type == null ? "" : " :: " + type.typeName());
  }
}
