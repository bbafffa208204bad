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

/**
 * This class serves to define details of builtin and defined operators
 * in Fortran expressions.
 *
 * Precedence is resolved by the parser and is reflected in the shape of the
 * tree; the level is kept on each operator for diagnostics and printing.
 */
public class Operators {

  /**
   * Operator precedence levels, from the loosest binding to the tightest.
   * Numbering follows the standard's level-1 to level-5 expressions.
   */
  public static enum Level {
    DEFINED_BINARY(0),
    LOGICAL(5),
    RELATIONAL(4),
    CHARACTER(3),
    NUMERIC(2),
    DEFINED_UNARY(1);

    /** Level number in the standard, 0 for extended-intrinsic/defined */
    public final int standardLevel;

    private Level(int standardLevel) {
      this.standardLevel = standardLevel;
    }

    /**
     * @return true if this level binds more tightly than other
     */
    public boolean bindsTighterThan(Level other) {
      return ordinal() > other.ordinal();
    }
  }

  /**
   * Broad class of operator, which determines what the AST can say about
   * the result type without semantic analysis
   */
  public static enum Category {
    LOGICAL, RELATIONAL, CONCATENATION, ARITHMETIC, DEFINED;
  }

  public static enum UnaryOperator {
    NOT(".NOT.", Level.LOGICAL),
    PLUS("+", Level.NUMERIC),
    MINUS("-", Level.NUMERIC),
    /** User defined .NAME. operator */
    DEFINED(null, Level.DEFINED_UNARY);

    private final String spelling;
    private final Level level;

    private UnaryOperator(String spelling, Level level) {
      this.spelling = spelling;
      this.level = level;
    }

    /** @return source spelling, null for defined operators */
    public String spelling() {
      return spelling;
    }

    public Level level() {
      return level;
    }
  }

  public static enum BinaryOperator {
    // Level-5 operators
    EQV(".EQV.", Level.LOGICAL, Category.LOGICAL),
    NEQV(".NEQV.", Level.LOGICAL, Category.LOGICAL),
    OR(".OR.", Level.LOGICAL, Category.LOGICAL),
    AND(".AND.", Level.LOGICAL, Category.LOGICAL),
    DEFINED(null, Level.DEFINED_BINARY, Category.DEFINED),

    // Level-4 operators
    EQUAL("==", Level.RELATIONAL, Category.RELATIONAL),
    NOT_EQUAL("/=", Level.RELATIONAL, Category.RELATIONAL),
    LESS_THAN("<", Level.RELATIONAL, Category.RELATIONAL),
    LESS_THAN_EQUAL("<=", Level.RELATIONAL, Category.RELATIONAL),
    GREATER_THAN(">", Level.RELATIONAL, Category.RELATIONAL),
    GREATER_THAN_EQUAL(">=", Level.RELATIONAL, Category.RELATIONAL),

    // Level-3 operator
    CONCAT("//", Level.CHARACTER, Category.CONCATENATION),

    // Level-2 operators
    PLUS("+", Level.NUMERIC, Category.ARITHMETIC),
    MINUS("-", Level.NUMERIC, Category.ARITHMETIC),
    MULTIPLY("*", Level.NUMERIC, Category.ARITHMETIC),
    DIVIDE("/", Level.NUMERIC, Category.ARITHMETIC),
    POWER("**", Level.NUMERIC, Category.ARITHMETIC);

    private final String spelling;
    private final Level level;
    private final Category category;

    private BinaryOperator(String spelling, Level level, Category category) {
      this.spelling = spelling;
      this.level = level;
      this.category = category;
    }

    /** @return source spelling, null for defined operators */
    public String spelling() {
      return spelling;
    }

    public Level level() {
      return level;
    }

    public Category category() {
      return category;
    }

    /**
     * @return true if result is LOGICAL whatever the operand types
     */
    public boolean hasLogicalResult() {
      return category == Category.LOGICAL || category == Category.RELATIONAL;
    }
  }
}
