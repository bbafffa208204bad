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
package exm.ftn.common.lang;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ftn.ast.spec.ArraySpec;
import exm.ftn.common.exceptions.FTNRuntimeError;

/**
 * Semantic types of Fortran expressions.
 *
 * The type slot of an expression holds one of these once semantic analysis
 * has run.  Intrinsic types are identified by their type specifier and kind
 * parameter, character types additionally carry a length, and array types
 * wrap an element type with one shape specification per dimension.
 */
public class Types {

  public static enum TypeSpec {
    INTEGER, REAL, COMPLEX, CHARACTER, LOGICAL;
  }

  public static final int DEFAULT_INTEGER_KIND = 4;
  public static final int DEFAULT_REAL_KIND = 4;
  public static final int DOUBLE_PRECISION_KIND = 8;
  public static final int DEFAULT_LOGICAL_KIND = 4;
  public static final int DEFAULT_CHARACTER_KIND = 1;

  public static final IntrinsicType INTEGER =
          new IntrinsicType(TypeSpec.INTEGER, DEFAULT_INTEGER_KIND);
  public static final IntrinsicType REAL =
          new IntrinsicType(TypeSpec.REAL, DEFAULT_REAL_KIND);
  public static final IntrinsicType DOUBLE_PRECISION =
          new IntrinsicType(TypeSpec.REAL, DOUBLE_PRECISION_KIND);
  public static final IntrinsicType COMPLEX =
          new IntrinsicType(TypeSpec.COMPLEX, DEFAULT_REAL_KIND);
  public static final IntrinsicType DOUBLE_COMPLEX =
          new IntrinsicType(TypeSpec.COMPLEX, DOUBLE_PRECISION_KIND);
  public static final IntrinsicType LOGICAL =
          new IntrinsicType(TypeSpec.LOGICAL, DEFAULT_LOGICAL_KIND);
  /** Character of length not known until semantic analysis */
  public static final CharacterType CHARACTER =
          new CharacterType(CharacterType.UNKNOWN_LENGTH);

  public abstract static class Type {

    public abstract TypeSpec typeSpec();

    public int kind() {
      throw new FTNRuntimeError("kind() not implemented " +
                                "for class " + getClass().getName());
    }

    public Type elementType() {
      throw new FTNRuntimeError("elementType() not implemented " +
                                "for class " + getClass().getName());
    }

    /** Print out a short unique name for type */
    public abstract String typeName();

    @Override
    public String toString() {
      return typeName();
    }

    /** equals is required */
    @Override
    public abstract boolean equals(Object o);

    /** hashcode is required */
    @Override
    public abstract int hashCode();
  }

  /**
   * INTEGER, REAL, COMPLEX and LOGICAL with a kind parameter
   */
  public static class IntrinsicType extends Type {
    private final TypeSpec spec;
    private final int kind;

    public IntrinsicType(TypeSpec spec, int kind) {
      if (spec == TypeSpec.CHARACTER) {
        throw new FTNRuntimeError("Character types must be built as " +
                                  "CharacterType");
      }
      this.spec = spec;
      this.kind = kind;
    }

    @Override
    public TypeSpec typeSpec() {
      return spec;
    }

    @Override
    public int kind() {
      return kind;
    }

    @Override
    public String typeName() {
      if (this.equals(DOUBLE_PRECISION)) {
        return "DOUBLE PRECISION";
      }
      return spec.name() + "(KIND=" + kind + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof IntrinsicType)) {
        return false;
      }
      IntrinsicType otherT = (IntrinsicType) other;
      return otherT.spec == spec && otherT.kind == kind;
    }

    @Override
    public int hashCode() {
      return spec.hashCode() * 13 + kind;
    }
  }

  public static class CharacterType extends Type {
    public static final int UNKNOWN_LENGTH = -1;

    private final int length;

    public CharacterType(int length) {
      if (length < 0 && length != UNKNOWN_LENGTH) {
        throw new FTNRuntimeError("Invalid character length " + length);
      }
      this.length = length;
    }

    @Override
    public TypeSpec typeSpec() {
      return TypeSpec.CHARACTER;
    }

    @Override
    public int kind() {
      return DEFAULT_CHARACTER_KIND;
    }

    public int length() {
      return length;
    }

    public boolean hasKnownLength() {
      return length != UNKNOWN_LENGTH;
    }

    @Override
    public String typeName() {
      return "CHARACTER(LEN=" + (hasKnownLength() ? length : "*") + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof CharacterType)) {
        return false;
      }
      return ((CharacterType)other).length == length;
    }

    @Override
    public int hashCode() {
      return CharacterType.class.hashCode() + 13 * length;
    }
  }

  public static class ArrayType extends Type {
    private final Type elementType;
    private final List<ArraySpec> dimensions;

    public ArrayType(Type elementType, List<? extends ArraySpec> dimensions) {
      if (dimensions.isEmpty()) {
        throw new FTNRuntimeError("Array type needs at least one dimension");
      }
      this.elementType = elementType;
      this.dimensions = ImmutableList.copyOf(dimensions);
    }

    @Override
    public TypeSpec typeSpec() {
      return elementType.typeSpec();
    }

    @Override
    public Type elementType() {
      return elementType;
    }

    public List<ArraySpec> dimensions() {
      return dimensions;
    }

    public int rank() {
      int rank = 0;
      for (ArraySpec dim: dimensions) {
        rank += dim.getRank();
      }
      return rank;
    }

    @Override
    public String typeName() {
      List<String> dims = new ArrayList<String>(dimensions.size());
      for (ArraySpec dim: dimensions) {
        dims.add(dim.toString());
      }
      return elementType.typeName() + ", DIMENSION(" +
             String.join(",", dims) + ")";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      ArrayType otherT = (ArrayType) other;
      return otherT.elementType.equals(elementType) &&
             otherT.dimensions.equals(dimensions);
    }

    @Override
    public int hashCode() {
      return elementType.hashCode() + 13 *
            (ArrayType.class.hashCode() + 13 * dimensions.size());
    }
  }

  public static boolean isInteger(Type t) {
    return t instanceof IntrinsicType && t.typeSpec() == TypeSpec.INTEGER;
  }

  public static boolean isReal(Type t) {
    return t instanceof IntrinsicType && t.typeSpec() == TypeSpec.REAL;
  }

  public static boolean isComplex(Type t) {
    return t instanceof IntrinsicType && t.typeSpec() == TypeSpec.COMPLEX;
  }

  public static boolean isLogical(Type t) {
    return t instanceof IntrinsicType && t.typeSpec() == TypeSpec.LOGICAL;
  }

  public static boolean isCharacter(Type t) {
    return t instanceof CharacterType;
  }

  public static boolean isArray(Type t) {
    return t instanceof ArrayType;
  }

  /**
   * @return real type with same kind as complex type
   */
  public static IntrinsicType complexComponentType(Type complexType) {
    if (!isComplex(complexType)) {
      throw new FTNRuntimeError("Not a complex type: " + complexType);
    }
    return new IntrinsicType(TypeSpec.REAL, complexType.kind());
  }

  /**
   * Character type of concatenated strings.
   * @return type with summed lengths, or unknown length if either is unknown
   *          or the sum does not fit in an int
   */
  public static CharacterType concatType(CharacterType a, CharacterType b) {
    if (a.hasKnownLength() && b.hasKnownLength()) {
      try {
        return new CharacterType(Math.addExact(a.length(), b.length()));
      } catch (ArithmeticException e) {
        return CHARACTER;
      }
    }
    return CHARACTER;
  }
}
