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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.ftn.ast.ASTContext;
import exm.ftn.ast.SourceLocation;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.lang.Intrinsics;
import exm.ftn.common.lang.Intrinsics.IntrinsicFunction;
import exm.ftn.common.lang.Types.Type;

/**
 * Call to an intrinsic function, e.g. SQRT(x).  The location is that of the
 * function name.
 */
public final class IntrinsicCallExpr extends Expr {
  private final IntrinsicFunction function;
  private final List<Expr> arguments;

  private IntrinsicCallExpr(ASTContext context, SourceLocation location,
                            IntrinsicFunction function,
                            List<Expr> arguments, Type returnType) {
    super(context, ExprKind.INTRINSIC_CALL, returnType, location);
    this.function = function;
    this.arguments = arguments;
  }

  /**
   * @param returnType result type, null if not yet known
   * @throws FTNRuntimeError if the number of arguments is wrong
   */
  public static IntrinsicCallExpr create(ASTContext context,
          SourceLocation location, IntrinsicFunction function,
          List<? extends Expr> arguments, Type returnType) {
    Preconditions.checkNotNull(function);
    Preconditions.checkNotNull(arguments);
    context.checkAllOwned(arguments);
    if (!Intrinsics.acceptsArgCount(function, arguments.size())) {
      throw new FTNRuntimeError("Intrinsic " + function + " at " + location +
            " called with " + arguments.size() + " argument(s)");
    }
    return new IntrinsicCallExpr(context, location, function,
            ImmutableList.<Expr>copyOf(arguments), returnType);
  }

  public IntrinsicFunction getFunction() {
    return function;
  }

  public List<Expr> getArguments() {
    return arguments;
  }

  @Override
  public SourceLocation getMaxLocation() {
    if (arguments.isEmpty()) {
      return getLocation();
    }
    return arguments.get(arguments.size() - 1).getMaxLocation();
  }

  @Override
  public List<Expr> getChildren() {
    return arguments;
  }

  @Override
  public <T> T accept(ExprVisitor<T> visitor) {
    return visitor.visitIntrinsicCall(this);
  }
}
