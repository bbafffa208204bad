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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.ftn.common.Logging;
import exm.ftn.common.Settings;
import exm.ftn.common.exceptions.FTNRuntimeError;
import exm.ftn.common.exceptions.InvalidOptionException;
import exm.ftn.common.lang.Types;
import exm.ftn.common.lang.Types.CharacterType;
import exm.ftn.common.lang.Types.IntrinsicType;
import exm.ftn.common.lang.Types.Type;
import exm.ftn.common.lang.Types.TypeSpec;
import exm.ftn.common.numeric.FloatSemantics;

/**
 * Arena that owns every AST node and numeric payload buffer built while
 * compiling one translation unit.
 *
 * Nodes are kept in a growable store and referred to by handle; they are
 * never freed one at a time.  The whole store is released at once by
 * {@link #dispose()}.  The only storage that can be given back early is the
 * word buffer behind a wide numeric constant, when the constant's value is
 * replaced.
 *
 * Not thread safe: a context belongs to a single compilation, and separate
 * compilations use separate contexts.
 */
public class ASTContext {

  private static final Logger logger = Logging.getFTNLogger();

  private final ArrayList<ASTNode> nodes = new ArrayList<ASTNode>();

  /** Word buffers currently handed out, compared by identity */
  private final Set<long[]> wordBuffers =
          Collections.newSetFromMap(new IdentityHashMap<long[], Boolean>());

  private long wordsAllocated = 0;

  private boolean disposed = false;

  private final int intLiteralWidth;
  private final int bozMinWidth;

  public ASTContext() {
    this(Settings.DEFAULT_INT_LITERAL_WIDTH, Settings.DEFAULT_BOZ_MIN_WIDTH);
  }

  /**
   * @param intLiteralWidth bit width of decimal integer literals
   * @param bozMinWidth minimum bit width of B/O/Z literals
   */
  public ASTContext(int intLiteralWidth, int bozMinWidth) {
    Preconditions.checkArgument(intLiteralWidth > 0,
                       "Bad integer literal width %s", intLiteralWidth);
    Preconditions.checkArgument(bozMinWidth > 0,
                       "Bad BOZ literal width %s", bozMinWidth);
    this.intLiteralWidth = intLiteralWidth;
    this.bozMinWidth = bozMinWidth;
  }

  /**
   * Create a context using the literal widths from {@link Settings}
   */
  public static ASTContext fromSettings() throws InvalidOptionException {
    return new ASTContext(Settings.getPositiveInt(Settings.INT_LITERAL_WIDTH),
                          Settings.getPositiveInt(Settings.BOZ_MIN_WIDTH));
  }

  public int getIntLiteralWidth() {
    return intLiteralWidth;
  }

  public int getBOZMinWidth() {
    return bozMinWidth;
  }

  int register(ASTNode node) {
    checkLive();
    int handle = nodes.size();
    nodes.add(node);
    if (logger.isTraceEnabled()) {
      logger.trace("Allocated " + node.getClass().getSimpleName() +
                   " #" + handle);
    }
    return handle;
  }

  /**
   * @param handle
   * @return node previously allocated in this context
   */
  public ASTNode getNode(int handle) {
    checkLive();
    if (handle < 0 || handle >= nodes.size()) {
      throw new FTNRuntimeError("No node with handle " + handle);
    }
    return nodes.get(handle);
  }

  public <T extends ASTNode> T getNode(int handle, Class<T> nodeClass) {
    ASTNode node = getNode(handle);
    if (!nodeClass.isInstance(node)) {
      throw new FTNRuntimeError("Node #" + handle + " is a " +
          node.getClass().getSimpleName() + " not a " +
          nodeClass.getSimpleName());
    }
    return nodeClass.cast(node);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  /**
   * @return true if node was allocated in this context and the context
   *          has not been torn down
   */
  public boolean owns(ASTNode node) {
    return !disposed && node.getContext() == this &&
           node.getHandle() < nodes.size() &&
           nodes.get(node.getHandle()) == node;
  }

  /**
   * Check that a node handed to a factory of this context was allocated
   * here.  Nodes never refer across contexts.
   * @param node may be null for an omitted optional child
   * @throws IllegalArgumentException if node belongs to another context
   */
  public void checkOwned(ASTNode node) {
    if (node != null) {
      Preconditions.checkArgument(owns(node),
          "%s #%s was not allocated in this context",
          node.getClass().getSimpleName(), node.getHandle());
    }
  }

  public void checkAllOwned(Iterable<? extends ASTNode> nodes) {
    for (ASTNode node: nodes) {
      checkOwned(node);
    }
  }

  /**
   * Allocate a zeroed buffer for a numeric value wider than one word
   */
  public long[] allocateWords(int numWords) {
    checkLive();
    Preconditions.checkArgument(numWords > 0);
    long[] words = new long[numWords];
    wordBuffers.add(words);
    wordsAllocated += numWords;
    return words;
  }

  /**
   * Give back a buffer from {@link #allocateWords(int)}
   */
  public void deallocate(long[] words) {
    if (!wordBuffers.remove(words)) {
      throw new FTNRuntimeError("Deallocating word buffer not owned by " +
                                "this context");
    }
  }

  /**
   * @return number of word buffers allocated and not yet deallocated
   */
  public int getLiveWordBuffers() {
    return wordBuffers.size();
  }

  /**
   * Release everything allocated in this context.  Nodes must not be used
   * afterwards.
   */
  public void dispose() {
    if (disposed) {
      return;
    }
    logger.debug("Disposing AST context: " + nodes.size() + " nodes, " +
                 wordBuffers.size() + " live word buffers, " +
                 wordsAllocated + " words allocated in total");
    nodes.clear();
    nodes.trimToSize();
    wordBuffers.clear();
    disposed = true;
  }

  public boolean isDisposed() {
    return disposed;
  }

  private void checkLive() {
    if (disposed) {
      throw new FTNRuntimeError("AST context used after dispose()");
    }
  }

  public IntrinsicType getIntegerType() {
    return Types.INTEGER;
  }

  public IntrinsicType getRealType() {
    return Types.REAL;
  }

  public IntrinsicType getDoublePrecisionType() {
    return Types.DOUBLE_PRECISION;
  }

  public IntrinsicType getComplexType() {
    return Types.COMPLEX;
  }

  public IntrinsicType getLogicalType() {
    return Types.LOGICAL;
  }

  /**
   * @param length length in characters, or
   *        {@link CharacterType#UNKNOWN_LENGTH}
   */
  public CharacterType getCharacterType(int length) {
    if (length == CharacterType.UNKNOWN_LENGTH) {
      return Types.CHARACTER;
    }
    return new CharacterType(length);
  }

  /**
   * Storage format for values of a REAL or COMPLEX type
   * @throws FTNRuntimeError for other types and unsupported kinds
   */
  public FloatSemantics getFPTypeSemantics(Type type) {
    TypeSpec spec = type.typeSpec();
    if (!(type instanceof IntrinsicType) ||
        (spec != TypeSpec.REAL && spec != TypeSpec.COMPLEX)) {
      throw new FTNRuntimeError("Not a floating point type: " + type);
    }
    switch (type.kind()) {
      case 2:
        return FloatSemantics.IEEE_HALF;
      case 4:
        return FloatSemantics.IEEE_SINGLE;
      case 8:
        return FloatSemantics.IEEE_DOUBLE;
      case 16:
        return FloatSemantics.IEEE_QUAD;
      default:
        throw new FTNRuntimeError("Unknown float semantic for " + type);
    }
  }
}
