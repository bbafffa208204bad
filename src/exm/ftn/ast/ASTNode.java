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

/**
 * Base class of everything allocated in an {@link ASTContext}.
 *
 * A node registers itself with its context when constructed and is given a
 * handle that stays valid for the context's whole lifetime.  Nodes are
 * never copied, moved or freed individually.
 */
public abstract class ASTNode {
  private final ASTContext context;
  private final int handle;

  protected ASTNode(ASTContext context) {
    Preconditions.checkNotNull(context, "AST nodes must be allocated in " +
                                        "a context");
    this.context = context;
    this.handle = context.register(this);
  }

  public ASTContext getContext() {
    return context;
  }

  /**
   * @return stable index of this node in its context
   */
  public int getHandle() {
    return handle;
  }
}
